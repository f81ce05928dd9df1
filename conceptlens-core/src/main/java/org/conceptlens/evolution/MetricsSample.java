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

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one annotated document (or a small group of documents) under one
 * semantic backend: match counts against a reference, latency and how many
 * annotations each matcher contributed.
 */
@Value
@Builder
public class MetricsSample {

	/** Backend that was active when the document was annotated. */
	String backendId;
	int truePositives;
	int falsePositives;
	int falseNegatives;
	double latencyMillis;
	@Builder.Default
	Map<SpanSource, Integer> countsBySource = Collections.emptyMap();

	/** Counts copied into an {@link EnumMap}; absent sources count as zero. */
	public Map<SpanSource, Integer> countsBySourceOrZero() {
		Map<SpanSource, Integer> out = new EnumMap<>(SpanSource.class);
		for (SpanSource s : SpanSource.values())
			out.put(s, 0);
		if (countsBySource != null)
			out.putAll(countsBySource);
		return out;
	}
}
