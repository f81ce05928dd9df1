package org.conceptlens.matching;

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
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.conceptlens.om.Annotation;
import org.conceptlens.om.Span;

/**
 * Reconciles overlapping candidate spans into non-overlapping annotations.
 * <p>
 * Spans are taken in {@link #PRIORITY} order (longer first, then dictionary
 * over combined over semantic, then higher confidence, then leftmost) and each
 * is accepted only when its character range is free. Disambiguation happens
 * only for spans that are accepted.
 */
public class SpanMerger {

	/** Acceptance order. The trailing keys only make the order total. */
	public static final Comparator<Span> PRIORITY = Comparator.comparingInt(Span::tokenLength).reversed()
			.thenComparingInt(s -> s.getSource().getPriority())
			.thenComparing(Comparator.comparingDouble(Span::getConfidence).reversed())
			.thenComparingInt(Span::getStartChar)
			.thenComparing(Comparator.comparingInt(Span::getEndChar).reversed())
			.thenComparing(s -> s.getCandidates().get(0));

	private static final Comparator<Annotation> BY_POSITION = Comparator.comparingInt(Annotation::getStartChar)
			.thenComparingInt(Annotation::getEndChar);

	private final DisambiguationPolicy policy;

	public SpanMerger(DisambiguationPolicy policy) {
		this.policy = policy;
	}

	public List<Annotation> merge(Collection<Span> spans) {
		return merge(spans, List.of());
	}

	/**
	 * Merges {@code spans} into a document that already holds {@code accepted}
	 * annotations; accepted ranges are never displaced.
	 *
	 * @return accepted plus newly accepted annotations, ordered by start offset
	 */
	public List<Annotation> merge(Collection<Span> spans, Collection<Annotation> accepted) {
		TreeMap<Integer, Annotation> occupied = new TreeMap<>();
		for (Annotation a : accepted) {
			occupied.put(a.getStartChar(), a);
		}

		List<Span> ordered = new ArrayList<>(spans);
		ordered.sort(PRIORITY);

		for (Span s : ordered) {
			if (overlapsAccepted(occupied, s))
				continue;
			String conceptId = s.isAmbiguous() ? policy.resolve(s) : s.getCandidates().get(0);
			occupied.put(s.getStartChar(), Annotation.of(s, conceptId));
		}

		List<Annotation> out = new ArrayList<>(occupied.values());
		out.sort(BY_POSITION);
		return out;
	}

	// accepted ranges are disjoint, so only the closest one starting before s ends can overlap it
	private static boolean overlapsAccepted(TreeMap<Integer, Annotation> occupied, Span s) {
		Map.Entry<Integer, Annotation> floor = occupied.floorEntry(s.getEndChar() - 1);
		return floor != null && floor.getValue().getEndChar() > s.getStartChar();
	}
}
