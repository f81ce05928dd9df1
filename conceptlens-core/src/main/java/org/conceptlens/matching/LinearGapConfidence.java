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
 * {@code raw = 1 - totalGap / (maxGap * (components - 1) + 1)}, rescaled
 * linearly into {@code [floor, 1]}. A contiguous match scores 1.0.
 */
public class LinearGapConfidence implements GapConfidencePolicy {

	public static final double DEFAULT_FLOOR = 0.5;

	private final double floor;

	public LinearGapConfidence() {
		this(DEFAULT_FLOOR);
	}

	public LinearGapConfidence(double floor) {
		if (floor < 0.0 || floor > 1.0)
			throw new IllegalArgumentException("floor must be in [0,1]: " + floor);
		this.floor = floor;
	}

	@Override
	public double confidence(int totalGap, int maxGap, int components) {
		double denominator = (double) maxGap * Math.max(1, components - 1) + 1.0;
		double raw = 1.0 - (Math.max(0, totalGap) / denominator);
		raw = Math.max(0.0, Math.min(1.0, raw));
		return floor + (1.0 - floor) * raw;
	}
}
