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

import java.util.Locale;

import org.conceptlens.util.Logger;

public class LoggingMetricsSink implements MetricsSink {

	@Override
	public void publish(MetricsSnapshot s) {
		Logger.info("Evolution batch [{}] backend={} next={} phase={} samples={} precision={} recall={} latencyMs={} sources={}",
				s.getDecision(), s.getBackendId(), s.getNextBackendId(), s.getPhase(), s.getSamples(),
				String.format(Locale.ROOT, "%.3f", s.getPrecision()), String.format(Locale.ROOT, "%.3f", s.getRecall()),
				String.format(Locale.ROOT, "%.1f", s.getMeanLatencyMillis()), s.getCountsBySource());
	}
}
