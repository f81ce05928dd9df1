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

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.conceptlens.evolution.MetricsSnapshot.Decision;
import org.conceptlens.om.SpanSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvMetricsSinkTest {

	@TempDir
	Path tmp;

	private static MetricsSnapshot snapshot() {
		MetricsWindow w = MetricsWindow.empty("a").plus(MetricsSample.builder().backendId("a").truePositives(9)
				.falsePositives(1).falseNegatives(1).latencyMillis(10).countsBySource(Map.of(SpanSource.DICTIONARY, 3))
				.build());
		return MetricsSnapshot.of(Instant.parse("2025-01-01T00:00:00Z"), w, "b", EvolutionPhase.EVALUATING,
				Decision.SWAPPED);
	}

	@Test
	void writes_header_once_and_appends_rows() throws Exception {
		Path file = tmp.resolve("metrics/evolution.csv");
		try (CsvMetricsSink sink = new CsvMetricsSink(file)) {
			sink.publish(snapshot());
			sink.publish(snapshot());
		}
		try (CsvMetricsSink sink = new CsvMetricsSink(file)) {
			sink.publish(snapshot());
		}

		List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
		assertEquals(4, lines.size());
		assertEquals(String.join(",", CsvMetricsSink.HEADER), lines.get(0));
		assertEquals("2025-01-01T00:00:00Z,a,b,EVALUATING,SWAPPED,1,9,1,1,0.9,0.9,10.0,3,0,0", lines.get(1));
		assertEquals(lines.get(1), lines.get(3));
	}

	@Test
	void logging_sink_accepts_snapshots() {
		new LoggingMetricsSink().publish(snapshot());
	}
}
