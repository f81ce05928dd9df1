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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * An ordered list of component strings that, found in order with at most
 * {@code maxGap} tokens between consecutive components, signal one concept.
 * Components may be multi-word.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class CombinedPattern {

	private final String conceptId;
	private final String name;
	private final List<String> components;
	private final int maxGap;

	public CombinedPattern(String conceptId, String name, List<String> components, int maxGap) {
		this.conceptId = conceptId;
		this.name = name;
		this.components = (components == null) ? Collections.emptyList()
				: Collections.unmodifiableList(new ArrayList<>(components));
		this.maxGap = maxGap;
	}

	public static CombinedPattern of(String conceptId, int maxGap, String... components) {
		return new CombinedPattern(conceptId, String.join(" ", components), List.of(components), maxGap);
	}
}
