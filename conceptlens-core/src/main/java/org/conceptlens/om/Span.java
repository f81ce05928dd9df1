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

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;
import java.util.ArrayList;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A candidate match produced by one matcher: a token range
 * {@code [startToken, endToken)}, its character range
 * {@code [startChar, endChar)}, the candidate concept ids (sorted, unique) and
 * a confidence in [0, 1].
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Span {

	private final int startToken;
	private final int endToken;
	private final int startChar;
	private final int endChar;
	private final SpanSource source;
	private final List<String> candidates;
	private final double confidence;

	/** Normalized surface text the span was matched on. */
	private final String matchedText;

	public Span(int startToken, int endToken, int startChar, int endChar, SpanSource source,
			Collection<String> candidates, double confidence, String matchedText) {
		if (startToken >= endToken || startChar >= endChar) {
			throw new IllegalArgumentException("Empty span [" + startToken + "," + endToken + ")");
		}
		if (candidates == null || candidates.isEmpty()) {
			throw new IllegalArgumentException("Span without candidates");
		}
		this.startToken = startToken;
		this.endToken = endToken;
		this.startChar = startChar;
		this.endChar = endChar;
		this.source = source;
		this.candidates = Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(candidates)));
		this.confidence = Math.max(0.0, Math.min(1.0, confidence));
		this.matchedText = matchedText;
	}

	/** Builds a span over tokens {@code [from, to)} of {@code doc}. */
	public static Span over(TokenizedDocument doc, int from, int to, SpanSource source, Collection<String> candidates,
			double confidence) {
		return new Span(from, to, doc.token(from).getStart(), doc.token(to - 1).getEnd(), source, candidates,
				confidence, doc.normalizedText(from, to));
	}

	public int tokenLength() {
		return endToken - startToken;
	}

	public int charLength() {
		return endChar - startChar;
	}

	public boolean isAmbiguous() {
		return candidates.size() > 1;
	}

	public boolean overlaps(int otherStartChar, int otherEndChar) {
		return startChar < otherEndChar && otherStartChar < endChar;
	}
}
