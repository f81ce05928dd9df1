package org.conceptlens.semantic;

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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Token range {@code [from, to)} to be embedded. */
@Getter
@ToString
@EqualsAndHashCode
public final class TokenWindow {

	private final int from;
	private final int to;

	public TokenWindow(int from, int to) {
		if (from < 0 || from >= to)
			throw new IllegalArgumentException("Empty window [" + from + "," + to + ")");
		this.from = from;
		this.to = to;
	}
}
