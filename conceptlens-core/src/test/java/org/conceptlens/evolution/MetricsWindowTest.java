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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.conceptlens.om.SpanSource;
import org.junit.jupiter.api.Test;

class MetricsWindowTest {

	private static MetricsSample sample(String backend, int tp, int fp, int fn, double latency) {
		return MetricsSample.builder().backendId(backend).truePositives(tp).falsePositives(fp).falseNegatives(fn)
				.latencyMillis(latency).build();
	}

	@Test
	void empty_window_counts_as_perfect() {
		MetricsWindow w = MetricsWindow.empty("a");
		assertEquals(0, w.getSamples());
		assertEquals(1.0, w.precision());
		assertEquals(1.0, w.recall());
		assertEquals(0.0, w.meanLatencyMillis());
		assertEquals(0L, w.getCountsBySource().get(SpanSource.SEMANTIC));
	}

	@Test
	void samples_accumulate_into_a_new_window() {
		MetricsWindow empty = MetricsWindow.empty("a");
		MetricsWindow w = empty.plus(sample("a", 3, 1, 0, 10)).plus(sample("a", 1, 0, 4, 30));

		assertEquals(0, empty.getSamples());
		assertEquals(2, w.getSamples());
		assertEquals(4, w.getTruePositives());
		assertEquals(0.8, w.precision(), 1e-9);
		assertEquals(0.5, w.recall(), 1e-9);
		assertEquals(2 * 0.8 * 0.5 / 1.3, w.f1(), 1e-9);
		assertEquals(20.0, w.meanLatencyMillis(), 1e-9);
	}

	@Test
	void only_false_results_give_zero_rates() {
		MetricsWindow fpOnly = MetricsWindow.empty("a").plus(sample("a", 0, 2, 0, 0));
		assertEquals(0.0, fpOnly.precision());
		assertEquals(0.0, fpOnly.recall());
		assertEquals(0.0, fpOnly.f1());
	}

	@Test
	void source_counts_are_summed_and_latency_is_never_negative() {
		MetricsSample s = MetricsSample.builder().backendId("a").latencyMillis(-5)
				.countsBySource(Map.of(SpanSource.DICTIONARY, 2, SpanSource.SEMANTIC, 1)).build();
		MetricsWindow w = MetricsWindow.empty("a").plus(s).plus(s);
		assertEquals(4L, w.getCountsBySource().get(SpanSource.DICTIONARY));
		assertEquals(0L, w.getCountsBySource().get(SpanSource.COMBINED));
		assertEquals(2L, w.getCountsBySource().get(SpanSource.SEMANTIC));
		assertEquals(0.0, w.getTotalLatencyMillis());
	}

	@Test
	void samples_of_another_backend_are_rejected() {
		assertThrows(IllegalArgumentException.class, () -> MetricsWindow.empty("a").plus(sample("b", 1, 0, 0, 1)));
	}

	@Test
	void thresholds_check_all_three_limits() {
		EvolutionThresholds t = new EvolutionThresholds(0.5, 0.5, 20, 1);
		assertTrue(t.isMetBy(MetricsWindow.empty("a").plus(sample("a", 1, 1, 1, 20))));
		assertFalse(t.isMetBy(MetricsWindow.empty("a").plus(sample("a", 1, 1, 1, 21))));
		assertFalse(t.isMetBy(MetricsWindow.empty("a").plus(sample("a", 1, 0, 2, 1))));
		assertThrows(IllegalArgumentException.class, () -> new EvolutionThresholds(0.5, 0.5, 20, 0));
	}
}
