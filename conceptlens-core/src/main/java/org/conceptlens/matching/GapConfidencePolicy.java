package org.conceptlens.matching;

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
 * Maps the total gap of a combined-pattern match to a confidence.
 */
@FunctionalInterface
public interface GapConfidencePolicy {

	/**
	 * @param totalGap   tokens skipped between consecutive components, summed
	 * @param maxGap     the pattern's per-boundary gap limit
	 * @param components number of components in the pattern
	 * @return confidence in [0, 1]
	 */
	double confidence(int totalGap, int maxGap, int components);
}
