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

import java.time.Instant;
import java.util.Map;

import org.conceptlens.om.SpanSource;

import lombok.Value;

/**
 * What the controller publishes at the end of each evaluation batch. Holds
 * counts and rates only.
 */
@Value
public class MetricsSnapshot {

	public enum Decision {
		/** Thresholds met; backend became stable. */
		PROMOTED,
		/** Thresholds missed; switched to another backend. */
		SWAPPED,
		/** Thresholds missed, no alternative could be activated; evaluation continues. */
		RETAINED,
		/** Batch completed while stable. */
		MONITORED
	}

	Instant timestamp;
	String backendId;
	String nextBackendId;
	EvolutionPhase phase;
	Decision decision;
	int samples;
	long truePositives;
	long falsePositives;
	long falseNegatives;
	double precision;
	double recall;
	double meanLatencyMillis;
	Map<SpanSource, Long> countsBySource;

	static MetricsSnapshot of(Instant at, MetricsWindow w, String nextBackendId, EvolutionPhase phase,
			Decision decision) {
		return new MetricsSnapshot(at, w.getBackendId(), nextBackendId, phase, decision, w.getSamples(),
				w.getTruePositives(), w.getFalsePositives(), w.getFalseNegatives(), w.precision(), w.recall(),
				w.meanLatencyMillis(), w.getCountsBySource());
	}
}
