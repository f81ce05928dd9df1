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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.conceptlens.cdb.ConceptDatabase;
import org.conceptlens.evolution.MetricsSample;
import org.conceptlens.om.Annotation;
import org.conceptlens.om.GoldAnnotation;
import org.conceptlens.om.SpanSource;

/**
 * Compares extracted annotations with reference annotations.
 * <p>
 * Concept ids are compared case-insensitively. A predicted annotation is
 * matched to at most one reference annotation and vice versa; the first
 * eligible reference in list order wins.
 */
public class EntityDetectionValidator {

	private final ConceptDatabase db;

	/**
	 * @param db source of predicted concepts' type tags for type accuracy; may be
	 *           null, in which case predicted concepts have no types
	 */
	public EntityDetectionValidator(ConceptDatabase db) {
		this.db = db;
	}

	public DetectionMetrics calculateMetrics(List<Annotation> predicted, List<GoldAnnotation> gold) {
		DetectionMetrics.Score exact = exactMatches(predicted, gold);
		DetectionMetrics.Score partial = partialMatches(predicted, gold);

		Map<String, List<GoldAnnotation>> goldByCui = new LinkedHashMap<>();
		for (GoldAnnotation g : gold) {
			goldByCui.computeIfAbsent(key(g.getConceptId()), k -> new ArrayList<>()).add(g);
		}
		int matched = 0;
		int correct = 0;
		for (Annotation a : predicted) {
			for (GoldAnnotation g : goldByCui.getOrDefault(key(a.getConceptId()), Collections.emptyList())) {
				if (!a.overlaps(g.getStart(), g.getEnd()))
					continue;
				matched++;
				if (g.getTypes().isEmpty() || upper(predictedTypes(a)).containsAll(upper(g.getTypes())))
					correct++;
				break;
			}
		}
		double accuracy = (matched == 0) ? 0.0 : (double) correct / matched;
		return new DetectionMetrics(exact, partial, accuracy, matched, correct, predicted.size(), gold.size());
	}

	/**
	 * One evolution sample from a labelled document, using partial-match counts.
	 */
	public MetricsSample toSample(String backendId, List<Annotation> predicted, List<GoldAnnotation> gold,
			double latencyMillis) {
		DetectionMetrics.Score s = partialMatches(predicted, gold);
		Map<SpanSource, Integer> counts = new EnumMap<>(SpanSource.class);
		for (Annotation a : predicted) {
			counts.merge(a.getSource(), 1, Integer::sum);
		}
		return MetricsSample.builder().backendId(backendId).truePositives(s.getTruePositives())
				.falsePositives(s.getFalsePositives()).falseNegatives(s.getFalseNegatives()).latencyMillis(latencyMillis)
				.countsBySource(counts).build();
	}

	DetectionMetrics.Score exactMatches(List<Annotation> predicted, List<GoldAnnotation> gold) {
		Map<String, Integer> lookup = new HashMap<>();
		for (int i = 0; i < gold.size(); i++) {
			GoldAnnotation g = gold.get(i);
			lookup.putIfAbsent(g.getStart() + ":" + g.getEnd() + ":" + key(g.getConceptId()), i);
		}
		Set<Integer> used = new HashSet<>();
		int tp = 0;
		for (Annotation a : predicted) {
			Integer idx = lookup.get(a.getStartChar() + ":" + a.getEndChar() + ":" + key(a.getConceptId()));
			if (idx == null || !used.add(idx))
				continue;
			tp++;
		}
		return new DetectionMetrics.Score(tp, predicted.size() - tp, gold.size() - tp);
	}

	DetectionMetrics.Score partialMatches(List<Annotation> predicted, List<GoldAnnotation> gold) {
		Set<Integer> used = new HashSet<>();
		int tp = 0;
		for (Annotation a : predicted) {
			for (int i = 0; i < gold.size(); i++) {
				GoldAnnotation g = gold.get(i);
				if (used.contains(i) || !key(g.getConceptId()).equals(key(a.getConceptId())))
					continue;
				if (a.overlaps(g.getStart(), g.getEnd())) {
					used.add(i);
					tp++;
					break;
				}
			}
		}
		return new DetectionMetrics.Score(tp, predicted.size() - tp, gold.size() - tp);
	}

	private Set<String> predictedTypes(Annotation a) {
		return (db == null) ? Collections.emptySet() : db.types(a.getConceptId());
	}

	private static Set<String> upper(Set<String> in) {
		Set<String> out = new HashSet<>();
		for (String s : in)
			out.add(key(s));
		return out;
	}

	private static String key(String s) {
		return (s == null) ? "" : s.toUpperCase(Locale.ROOT);
	}
}
