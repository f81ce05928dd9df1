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

/**
 * Embedding and nearest-neighbour lookup over the concept database. An instance
 * is immutable once created and safe to call from many threads.
 */
public interface SemanticBackend {

	/** Stable identifier used to tag metrics produced with this backend. */
	String id();

	float[] embed(String text);

	/**
	 * Concepts nearest to {@code vector}, best first (similarity descending, then
	 * concept id ascending), at most {@code k}, all with similarity
	 * {@code >= minSimilarity}.
	 */
	List<SemanticMatch> nearest(float[] vector, int k, double minSimilarity);
}
