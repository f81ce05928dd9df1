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

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.conceptlens.om.SpanSource;
import org.conceptlens.util.Logger;

/**
 * Appends one CSV row per snapshot. The header is written when the file is new.
 */
public class CsvMetricsSink implements MetricsSink, Closeable {

	static final String[] HEADER = { "timestamp", "backend", "next_backend", "phase", "decision", "samples", "tp", "fp",
			"fn", "precision", "recall", "mean_latency_ms", "dictionary", "combined", "semantic" };

	private final Path file;
	private final CSVPrinter printer;

	public CsvMetricsSink(Path file) {
		this.file = file;
		try {
			boolean fresh = !Files.exists(file) || Files.size(file) == 0;
			if (file.getParent() != null)
				Files.createDirectories(file.getParent());
			Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
					StandardOpenOption.APPEND);
			CSVFormat format = fresh ? CSVFormat.DEFAULT.builder().setHeader(HEADER).build() : CSVFormat.DEFAULT;
			this.printer = new CSVPrinter(w, format);
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to open metrics file " + file, e);
		}
	}

	@Override
	public synchronized void publish(MetricsSnapshot s) {
		try {
			printer.printRecord(s.getTimestamp(), s.getBackendId(), s.getNextBackendId(), s.getPhase(),
					s.getDecision(), s.getSamples(), s.getTruePositives(), s.getFalsePositives(), s.getFalseNegatives(),
					s.getPrecision(), s.getRecall(), s.getMeanLatencyMillis(),
					s.getCountsBySource().getOrDefault(SpanSource.DICTIONARY, 0L),
					s.getCountsBySource().getOrDefault(SpanSource.COMBINED, 0L),
					s.getCountsBySource().getOrDefault(SpanSource.SEMANTIC, 0L));
			printer.flush();
		} catch (IOException e) {
			Logger.warn("Unable to write metrics row to {}", e, file);
		}
	}

	@Override
	public synchronized void close() throws IOException {
		printer.close();
	}
}
