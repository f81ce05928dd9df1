package org.conceptlens.om;

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
import java.util.List;

import org.conceptlens.util.TermNormalizer;

import lombok.Getter;
import lombok.ToString;

/**
 * An identified document as a token sequence with character offsets. The
 * original text is optional; when present it bounds the offsets.
 */
@Getter
@ToString(exclude = { "text", "normalized" })
public final class TokenizedDocument {

	private final String id;
	private final String text;
	private final List<Token> tokens;

	/** Case/punctuation-folded token texts, aligned with {@link #tokens}. */
	private final String[] normalized;

	public TokenizedDocument(String id, String text, List<Token> tokens) {
		this.id = id;
		this.text = text;
		this.tokens = (tokens == null) ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(tokens));
		this.normalized = new String[this.tokens.size()];
		for (int i = 0; i < this.normalized.length; i++) {
			Token t = this.tokens.get(i);
			this.normalized[i] = (t == null) ? "" : TermNormalizer.normalizeToken(t.getText());
		}
	}

	public int size() {
		return tokens.size();
	}

	public Token token(int i) {
		return tokens.get(i);
	}

	/** Normalized text of token {@code i}. */
	public String normalizedToken(int i) {
		return normalized[i];
	}

	/** Defensive copy of the normalized tokens. */
	public String[] normalizedTokens() {
		return normalized.clone();
	}

	/**
	 * Checks offsets: non-null tokens, {@code 0 <= start < end}, end within the
	 * text when text is present, tokens ordered and non-overlapping.
	 *
	 * @throws InvalidDocumentException on the first violation
	 */
	public void validate() {
		int prevEnd = 0;
		for (int i = 0; i < tokens.size(); i++) {
			Token t = tokens.get(i);
			if (t == null || t.getText() == null) {
				throw new InvalidDocumentException(id, "token " + i + " is null");
			}
			if (t.getStart() < 0 || t.getStart() >= t.getEnd()) {
				throw new InvalidDocumentException(id,
						"token " + i + " has invalid offsets [" + t.getStart() + "," + t.getEnd() + ")");
			}
			if (text != null && t.getEnd() > text.length()) {
				throw new InvalidDocumentException(id,
						"token " + i + " ends at " + t.getEnd() + " beyond text length " + text.length());
			}
			if (t.getStart() < prevEnd) {
				throw new InvalidDocumentException(id, "token " + i + " overlaps or precedes the previous token");
			}
			prevEnd = t.getEnd();
		}
	}

	/**
	 * Surface text covered by tokens {@code [from, to)}: the original text slice
	 * when available, otherwise the token texts joined by single spaces.
	 */
	public String coveredText(int from, int to) {
		if (from >= to)
			return "";
		if (text != null) {
			return text.substring(tokens.get(from).getStart(), tokens.get(to - 1).getEnd());
		}
		StringBuilder sb = new StringBuilder();
		for (int i = from; i < to; i++) {
			if (i > from)
				sb.append(' ');
			sb.append(tokens.get(i).getText());
		}
		return sb.toString();
	}

	/** Space-joined normalized tokens {@code [from, to)}. */
	public String normalizedText(int from, int to) {
		if (from >= to)
			return "";
		return TermNormalizer.ngramKey(normalized, from, to - from, new StringBuilder(32));
	}
}
