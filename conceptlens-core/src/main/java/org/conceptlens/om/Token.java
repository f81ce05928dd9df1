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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One token of a document with its character offsets ({@code end} exclusive).
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Token {

	private final String text;
	private final int start;
	private final int end;

	public Token(String text, int start, int end) {
		this.text = text;
		this.start = start;
		this.end = end;
	}
}
