package org.conceptlens.om;

/*
 * This file is part of ConceptLens.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * ConceptLens is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * ConceptLens is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with ConceptLens.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A reference annotation used to score extraction output.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class GoldAnnotation {

	private final int start;
	private final int end;
	private final String conceptId;
	private final Set<String> types;

	public GoldAnnotation(int start, int end, String conceptId, Set<String> types) {
		if (start >= end) {
			throw new IllegalArgumentException("Annotation start must be less than end: [" + start + "," + end + ")");
		}
		this.start = start;
		this.end = end;
		this.conceptId = conceptId;
		this.types = (types == null) ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(types));
	}

	public GoldAnnotation(int start, int end, String conceptId) {
		this(start, end, conceptId, null);
	}
}
