package org.conceptlens.evolution;

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

import lombok.Getter;
import lombok.ToString;

/**
 * What an evaluation batch must reach for its backend to become stable.
 */
@Getter
@ToString
public final class EvolutionThresholds {

	private final double minRecall;
	private final double minPrecision;
	private final double maxMeanLatencyMillis;
	private final int batchSize;

	public EvolutionThresholds(double minRecall, double minPrecision, double maxMeanLatencyMillis, int batchSize) {
		if (batchSize < 1)
			throw new IllegalArgumentException("batchSize must be >= 1");
		this.minRecall = minRecall;
		this.minPrecision = minPrecision;
		this.maxMeanLatencyMillis = maxMeanLatencyMillis;
		this.batchSize = batchSize;
	}

	public boolean isMetBy(MetricsWindow w) {
		return w.recall() >= minRecall && w.precision() >= minPrecision
				&& w.meanLatencyMillis() <= maxMeanLatencyMillis;
	}
}
