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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.conceptlens.cdb.ConceptDatabase;
import org.conceptlens.om.Span;

/**
 * Picks one concept for a span with several candidates. Rules apply in order,
 * each only breaking ties left by the previous one:
 * <ol>
 * <li>the candidate whose preferred name equals the matched text (can be
 * switched off);</li>
 * <li>higher frequency prior;</li>
 * <li>better-ranked type in the configured type priority (unlisted types rank
 * last);</li>
 * <li>lexicographically lowest concept id.</li>
 * </ol>
 * The result depends only on the candidate set, the matched text and the
 * database, so repeated calls agree.
 */
public class DisambiguationPolicy {

	private final ConceptDatabase db;
	private final boolean preferPreferredName;
	private final Map<String, Integer> typeRank;

	public DisambiguationPolicy(ConceptDatabase db) {
		this(db, true, List.of());
	}

	/**
	 * @param typePriority type tags, highest priority first
	 */
	public DisambiguationPolicy(ConceptDatabase db, boolean preferPreferredName, List<String> typePriority) {
		this.db = db;
		this.preferPreferredName = preferPreferredName;
		Map<String, Integer> ranks = new HashMap<>();
		if (typePriority != null) {
			for (int i = 0; i < typePriority.size(); i++) {
				ranks.putIfAbsent(typePriority.get(i), i);
			}
		}
		this.typeRank = ranks;
	}

	public String resolve(Span span) {
		return resolve(span.getCandidates(), span.getMatchedText());
	}

	/**
	 * @param candidates  non-empty candidate concept ids
	 * @param matchedText normalized matched text of the span
	 */
	public String resolve(Collection<String> candidates, String matchedText) {
		if (candidates == null || candidates.isEmpty())
			throw new IllegalArgumentException("No candidates to resolve");
		if (candidates.size() == 1)
			return candidates.iterator().next();
		return rank(candidates, matchedText).get(0);
	}

	/** All candidates, best first. */
	public List<String> rank(Collection<String> candidates, String matchedText) {
		List<String> ranked = new ArrayList<>(candidates);
		ranked.sort(comparator(matchedText));
		return ranked;
	}

	private Comparator<String> comparator(String matchedText) {
		Comparator<String> byPreferred = Comparator
				.comparingInt(id -> (preferPreferredName && db.isPreferredKey(id, matchedText)) ? 0 : 1);
		Comparator<String> byFrequency = Comparator.comparingLong((String id) -> db.frequency(id)).reversed();
		Comparator<String> byType = Comparator.comparingInt(this::bestTypeRank);
		return byPreferred.thenComparing(byFrequency).thenComparing(byType).thenComparing(Comparator.naturalOrder());
	}

	private int bestTypeRank(String id) {
		int best = Integer.MAX_VALUE;
		for (String t : db.types(id)) {
			Integer r = typeRank.get(t);
			if (r != null && r < best)
				best = r;
		}
		return best;
	}
}
