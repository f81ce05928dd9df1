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

/**
 * Which matcher produced a span. Lower {@link #getPriority()} wins ties in the
 * span merger.
 */
public enum SpanSource {
	DICTIONARY("dictionary", 0), COMBINED("combined", 1), SEMANTIC("semantic", 2);

	private final String label;
	private final int priority;

	SpanSource(String label, int priority) {
		this.label = label;
		this.priority = priority;
	}

	public String getLabel() {
		return label;
	}

	public int getPriority() {
		return priority;
	}

	@Override
	public String toString() {
		return label;
	}
}
