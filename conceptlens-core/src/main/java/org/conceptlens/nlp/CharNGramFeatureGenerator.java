package org.conceptlens.nlp;

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
import java.util.List;
import java.util.Map;

import opennlp.tools.doccat.FeatureGenerator;

/**
 * Character n-gram features of each token, with {@code <} and {@code >}
 * marking the token boundaries so prefixes and suffixes get their own
 * features. Optionally emits the whole token as well.
 * <p>
 * Public and no-arg constructible so OpenNLP can reload it from serialized
 * models.
 */
public class CharNGramFeatureGenerator implements FeatureGenerator {

	public static final String NGRAM_PREFIX = "charng=";
	public static final String TOKEN_PREFIX = "tok=";

	private final int min;
	private final int max;
	private final boolean wholeTokens;

	/** Defaults 3..5 with whole-token features. */
	public CharNGramFeatureGenerator() {
		this(3, 5, true);
	}

	public CharNGramFeatureGenerator(int min, int max, boolean wholeTokens) {
		this.min = Math.max(1, min);
		this.max = Math.max(this.min, max);
		this.wholeTokens = wholeTokens;
	}

	@Override
	public Collection<String> extractFeatures(String[] tokens, Map<String, Object> extraInformation) {
		List<String> features = new ArrayList<>();
		if (tokens == null)
			return features;

		for (String tok : tokens) {
			if (tok == null || tok.isEmpty())
				continue;
			if (wholeTokens)
				features.add(TOKEN_PREFIX + tok);
			String bounded = "<" + tok + ">";
			int len = bounded.length();
			for (int n = min; n <= max; n++) {
				if (len < n)
					continue;
				for (int i = 0; i + n <= len; i++) {
					features.add(NGRAM_PREFIX + n + ":" + bounded.substring(i, i + n));
				}
			}
		}
		return features;
	}
}
