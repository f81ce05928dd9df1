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
import java.util.List;
import java.util.Set;

import org.conceptlens.cdb.ConceptDatabase;
import org.conceptlens.om.Span;
import org.conceptlens.om.SpanSource;
import org.conceptlens.om.TokenizedDocument;
import org.conceptlens.util.TermNormalizer;

/**
 * Greedy longest-match lookup of concept names over a token stream.
 * <p>
 * From each position the longest n-gram (bounded by the longest registered name
 * and the configured cap) that is a known name wins; the scan then resumes
 * after it. Spans from one call never overlap. Spans with more than one
 * candidate concept are left for the {@link DisambiguationPolicy}.
 */
public class DictionaryMatcher {

	/** Confidence of a span with a single candidate. */
	public static final double UNAMBIGUOUS_CONFIDENCE = 1.0;
	public static final double DEFAULT_AMBIGUOUS_CONFIDENCE = 0.8;

	private final ConceptDatabase db;
	private final int maxTokens;
	private final double ambiguousConfidence;

	public DictionaryMatcher(ConceptDatabase db) {
		this(db, 0, DEFAULT_AMBIGUOUS_CONFIDENCE);
	}

	/**
	 * @param maxNameTokens       cap on n-gram length; {@code <= 0} uses the
	 *                            database's longest name
	 * @param ambiguousConfidence confidence given to multi-candidate spans
	 */
	public DictionaryMatcher(ConceptDatabase db, int maxNameTokens, double ambiguousConfidence) {
		this.db = db;
		int longest = Math.max(1, db.getMaxNameTokens());
		this.maxTokens = (maxNameTokens <= 0) ? longest : Math.min(maxNameTokens, longest);
		this.ambiguousConfidence = ambiguousConfidence;
	}

	public List<Span> match(TokenizedDocument doc) {
		List<Span> out = new ArrayList<>();
		final int n = doc.size();
		if (n == 0 || db.keyCount() == 0)
			return out;

		final String[] toks = doc.normalizedTokens();
		final StringBuilder key = new StringBuilder(128);

		int i = 0;
		while (i < n) {
			int matchedLen = 0;
			for (int len = Math.min(maxTokens, n - i); len >= 1; len--) {
				Set<String> ids = db.lookupKey(TermNormalizer.ngramKey(toks, i, len, key));
				if (ids.isEmpty())
					continue;
				double confidence = (ids.size() == 1) ? UNAMBIGUOUS_CONFIDENCE : ambiguousConfidence;
				out.add(Span.over(doc, i, i + len, SpanSource.DICTIONARY, ids, confidence));
				matchedLen = len;
				break;
			}
			i += (matchedLen > 0) ? matchedLen : 1;
		}
		return out;
	}

	public int getMaxTokens() {
		return maxTokens;
	}
}
