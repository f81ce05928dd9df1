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
 * A concept as held by the concept database: one identifier, a non-empty set
 * of surface names, one preferred name, flat type tags and an optional
 * frequency prior. Instances are immutable.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Concept {

	private final String id;
	private final String preferredName;

	/** Normalized key of {@link #preferredName}. */
	private final String preferredKey;
	private final Set<String> names;
	private final Set<String> types;
	private final long frequency;

	public Concept(String id, String preferredName, String preferredKey, Set<String> names, Set<String> types,
			long frequency) {
		this.id = id;
		this.preferredName = preferredName;
		this.preferredKey = preferredKey;
		this.names = Collections.unmodifiableSet(new LinkedHashSet<>(names));
		this.types = Collections.unmodifiableSet(new LinkedHashSet<>(types));
		this.frequency = Math.max(0L, frequency);
	}
}
