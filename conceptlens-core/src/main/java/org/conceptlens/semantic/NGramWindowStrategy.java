package org.conceptlens.semantic;

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

import org.conceptlens.om.TokenizedDocument;

/**
 * Every n-gram up to {@code maxTokens} inside each maximal run of uncovered
 * tokens, longest first. Windows with no letter or digit are skipped.
 */
public class NGramWindowStrategy implements WindowStrategy {

	private final int maxTokens;

	public NGramWindowStrategy(int maxTokens) {
		if (maxTokens < 1)
			throw new IllegalArgumentException("maxTokens must be >= 1");
		this.maxTokens = maxTokens;
	}

	@Override
	public List<TokenWindow> windows(TokenizedDocument doc, boolean[] covered) {
		List<TokenWindow> out = new ArrayList<>();
		int n = doc.size();
		int i = 0;
		while (i < n) {
			if (covered[i]) {
				i++;
				continue;
			}
			int runEnd = i;
			while (runEnd < n && !covered[runEnd])
				runEnd++;
			for (int len = Math.min(maxTokens, runEnd - i); len >= 1; len--) {
				for (int s = i; s + len <= runEnd; s++) {
					if (hasWordChar(doc, s, s + len))
						out.add(new TokenWindow(s, s + len));
				}
			}
			i = runEnd;
		}
		return out;
	}

	private static boolean hasWordChar(TokenizedDocument doc, int from, int to) {
		for (int t = from; t < to; t++) {
			String s = doc.normalizedToken(t);
			for (int c = 0; c < s.length(); c++) {
				if (Character.isLetterOrDigit(s.charAt(c)))
					return true;
			}
		}
		return false;
	}
}
