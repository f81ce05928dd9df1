package org.conceptlens.util;

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

import java.util.Locale;
import java.util.function.Function;

import org.apache.commons.lang3.StringUtils;

/**
 * Case and punctuation folding shared by the concept database and the matchers.
 * <p>
 * Concept names are stored under the same key the matchers build from the
 * token stream, so both sides must go through this class.
 */
public final class TermNormalizer {

	/** Default name tokenizer: whitespace split of an already normalized name. */
	public static final Function<String, String[]> WHITESPACE = s -> StringUtils.split(s);

	private TermNormalizer() {
	}

	/**
	 * Lower-case (root locale), fold typographic quotes and dashes, collapse
	 * whitespace. Returns "" for null input.
	 */
	public static String normalize(String s) {
		if (s == null)
			return "";
		String out = s.replace('\u2019', '\'').replace('\u2018', '\'').replace('\u201C', '"').replace('\u201D', '"')
				.replace('\u2013', '-').replace('\u2014', '-').replace('\u2212', '-').replace('\u00A0', ' ');
		out = StringUtils.normalizeSpace(out);
		return out.toLowerCase(Locale.ROOT);
	}

	/** Normalizes one token; whitespace inside a token is collapsed the same way. */
	public static String normalizeToken(String token) {
		return normalize(token);
	}

	/**
	 * Builds the lookup key for a multi-word name: normalize, tokenize with
	 * {@code tokenizer}, then join with single spaces.
	 */
	public static String nameKey(String name, Function<String, String[]> tokenizer) {
		String[] toks = tokens(name, tokenizer);
		return String.join(" ", toks);
	}

	/** Normalized tokens of {@code name}; empty array for blank input. */
	public static String[] tokens(String name, Function<String, String[]> tokenizer) {
		String n = normalize(name);
		if (n.isEmpty())
			return new String[0];
		String[] toks = (tokenizer == null ? WHITESPACE : tokenizer).apply(n);
		return toks == null ? new String[0] : toks;
	}

	/** Build a space-joined n-gram key without extra allocations. */
	public static String ngramKey(String[] toks, int start, int len, StringBuilder sb) {
		sb.setLength(0);
		int end = start + len;
		sb.append(toks[start]);
		for (int i = start + 1; i < end; i++)
			sb.append(' ').append(toks[i]);
		return sb.toString();
	}
}
