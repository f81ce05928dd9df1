package org.conceptlens.eval;

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

import lombok.Value;

/**
 * Scores of predicted annotations against a reference set.
 */
@Value
public class DetectionMetrics {

	/** Same start, end and concept. */
	Score exactMatch;
	/** Overlapping span, same concept. */
	Score partialMatch;
	/** Among partial matches: share whose reference types are covered by the predicted concept's types. */
	double typeAccuracy;
	int typeMatched;
	int typeCorrect;
	int predictedCount;
	int goldCount;

	@Value
	public static class Score {
		int truePositives;
		int falsePositives;
		int falseNegatives;

		public double precision() {
			int d = truePositives + falsePositives;
			return (d == 0) ? 0.0 : (double) truePositives / d;
		}

		public double recall() {
			int d = truePositives + falseNegatives;
			return (d == 0) ? 0.0 : (double) truePositives / d;
		}

		public double f1() {
			double p = precision();
			double r = recall();
			return (p + r == 0.0) ? 0.0 : 2 * p * r / (p + r);
		}
	}
}
