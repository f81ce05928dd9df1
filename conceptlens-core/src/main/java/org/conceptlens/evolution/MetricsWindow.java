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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import org.conceptlens.om.SpanSource;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Aggregate of the samples reported for one backend since its evaluation
 * started. Immutable: {@link #plus(MetricsSample)} returns a new window.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class MetricsWindow {

	private final String backendId;
	private final int samples;
	private final long truePositives;
	private final long falsePositives;
	private final long falseNegatives;
	private final double totalLatencyMillis;
	private final Map<SpanSource, Long> countsBySource;

	private MetricsWindow(String backendId, int samples, long tp, long fp, long fn, double totalLatencyMillis,
			Map<SpanSource, Long> countsBySource) {
		this.backendId = backendId;
		this.samples = samples;
		this.truePositives = tp;
		this.falsePositives = fp;
		this.falseNegatives = fn;
		this.totalLatencyMillis = totalLatencyMillis;
		this.countsBySource = Collections.unmodifiableMap(countsBySource);
	}

	public static MetricsWindow empty(String backendId) {
		Map<SpanSource, Long> counts = new EnumMap<>(SpanSource.class);
		for (SpanSource s : SpanSource.values())
			counts.put(s, 0L);
		return new MetricsWindow(backendId, 0, 0, 0, 0, 0.0, counts);
	}

	/**
	 * @throws IllegalArgumentException if the sample belongs to another backend
	 */
	public MetricsWindow plus(MetricsSample s) {
		if (!backendId.equals(s.getBackendId())) {
			throw new IllegalArgumentException(
					"Sample for backend '" + s.getBackendId() + "' cannot join window of '" + backendId + "'");
		}
		Map<SpanSource, Long> counts = new EnumMap<>(countsBySource);
		s.countsBySourceOrZero().forEach((src, n) -> counts.merge(src, (long) n, Long::sum));
		return new MetricsWindow(backendId, samples + 1, truePositives + s.getTruePositives(),
				falsePositives + s.getFalsePositives(), falseNegatives + s.getFalseNegatives(),
				totalLatencyMillis + Math.max(0.0, s.getLatencyMillis()), counts);
	}

	/** tp / (tp + fp); 1.0 when nothing was expected and nothing was found. */
	public double precision() {
		long denom = truePositives + falsePositives;
		if (denom == 0)
			return (falseNegatives == 0) ? 1.0 : 0.0;
		return (double) truePositives / denom;
	}

	/** tp / (tp + fn); 1.0 when nothing was expected and nothing was found. */
	public double recall() {
		long denom = truePositives + falseNegatives;
		if (denom == 0)
			return (falsePositives == 0) ? 1.0 : 0.0;
		return (double) truePositives / denom;
	}

	public double f1() {
		double p = precision();
		double r = recall();
		return (p + r == 0.0) ? 0.0 : 2 * p * r / (p + r);
	}

	public double meanLatencyMillis() {
		return (samples == 0) ? 0.0 : totalLatencyMillis / samples;
	}
}
