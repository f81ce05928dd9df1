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

import java.util.List;

import org.conceptlens.om.TokenizedDocument;

/**
 * Chooses the token windows the semantic fallback embeds.
 */
@FunctionalInterface
public interface WindowStrategy {

	/**
	 * @param covered {@code covered[i]} is true when token {@code i} lies inside
	 *                an accepted annotation; windows must avoid those tokens
	 */
	List<TokenWindow> windows(TokenizedDocument doc, boolean[] covered);
}
