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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.conceptlens.cdb.ConceptDatabase;
import org.conceptlens.om.CombinedPattern;
import org.conceptlens.om.Span;
import org.conceptlens.om.SpanSource;
import org.conceptlens.om.TokenizedDocument;

/**
 * Gap-tolerant matcher for {@link CombinedPattern}s.
 * <p>
 * Patterns are grouped by the first token of their first component, so each
 * document position only tries the patterns that can start there. Each next
 * component must begin within {@code maxGap} tokens of the previous
 * component's end; placements are tried earliest-first with backtracking. A
 * pattern's matches never overlap each other (the scan for that pattern resumes
 * after a match), but matches of different patterns may, and are reconciled by
 * the {@link SpanMerger}.
 */
public class CombinedPatternMatcher {

	private final Map<String, List<Compiled>> byFirstToken;
	private final int patternCount;
	private final GapConfidencePolicy confidencePolicy;

	public CombinedPatternMatcher(ConceptDatabase db) {
		this(db, new LinearGapConfidence());
	}

	public CombinedPatternMatcher(ConceptDatabase db, GapConfidencePolicy confidencePolicy) {
		this.confidencePolicy = confidencePolicy;
		Map<String, List<Compiled>> groups = new HashMap<>();
		int order = 0;
		for (CombinedPattern p : db.getPatterns()) {
			String[][] comps = new String[p.getComponents().size()][];
			for (int i = 0; i < comps.length; i++) {
				comps[i] = db.tokenize(p.getComponents().get(i));
			}
			Compiled c = new Compiled(p, comps, order++);
			groups.computeIfAbsent(comps[0][0], k -> new ArrayList<>()).add(c);
		}
		Map<String, List<Compiled>> frozen = new HashMap<>();
		groups.forEach((k, v) -> frozen.put(k, Collections.unmodifiableList(v)));
		this.byFirstToken = Collections.unmodifiableMap(frozen);
		this.patternCount = order;
	}

	public List<Span> match(TokenizedDocument doc) {
		List<Span> out = new ArrayList<>();
		final int n = doc.size();
		if (n == 0 || patternCount == 0)
			return out;

		final String[] toks = doc.normalizedTokens();
		final int[] nextAllowed = new int[patternCount];

		for (int i = 0; i < n; i++) {
			List<Compiled> group = byFirstToken.get(toks[i]);
			if (group == null)
				continue;
			for (Compiled c : group) {
				if (nextAllowed[c.order] > i || !componentAt(c.components[0], toks, i))
					continue;
				int[] starts = new int[c.components.length];
				starts[0] = i;
				if (!place(c, toks, 1, starts))
					continue;

				int last = c.components.length - 1;
				int end = starts[last] + c.components[last].length;
				int totalGap = 0;
				for (int k = 1; k <= last; k++) {
					totalGap += starts[k] - (starts[k - 1] + c.components[k - 1].length);
				}
				double confidence = confidencePolicy.confidence(totalGap, c.pattern.getMaxGap(), c.components.length);
				out.add(Span.over(doc, i, end, SpanSource.COMBINED, List.of(c.pattern.getConceptId()), confidence));
				nextAllowed[c.order] = end;
			}
		}
		return out;
	}

	/** Number of distinct first tokens patterns are grouped under. */
	public int groupCount() {
		return byFirstToken.size();
	}

	private static boolean place(Compiled c, String[] toks, int idx, int[] starts) {
		if (idx == c.components.length)
			return true;
		int prevEnd = starts[idx - 1] + c.components[idx - 1].length;
		int lastStart = Math.min(prevEnd + c.pattern.getMaxGap(), toks.length - c.components[idx].length);
		for (int p = prevEnd; p <= lastStart; p++) {
			if (componentAt(c.components[idx], toks, p)) {
				starts[idx] = p;
				if (place(c, toks, idx + 1, starts))
					return true;
			}
		}
		return false;
	}

	private static boolean componentAt(String[] component, String[] toks, int pos) {
		if (pos + component.length > toks.length)
			return false;
		for (int j = 0; j < component.length; j++) {
			if (!component[j].equals(toks[pos + j]))
				return false;
		}
		return true;
	}

	private static final class Compiled {
		final CombinedPattern pattern;
		final String[][] components;
		final int order;

		Compiled(CombinedPattern pattern, String[][] components, int order) {
			this.pattern = pattern;
			this.components = components;
			this.order = order;
		}
	}
}
