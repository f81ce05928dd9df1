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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * An accepted span bound to exactly one concept.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Annotation {

	private final int startToken;
	private final int endToken;
	private final int startChar;
	private final int endChar;
	private final String conceptId;
	private final double confidence;
	private final SpanSource source;
	private final String matchedText;

	public Annotation(int startToken, int endToken, int startChar, int endChar, String conceptId, double confidence,
			SpanSource source, String matchedText) {
		this.startToken = startToken;
		this.endToken = endToken;
		this.startChar = startChar;
		this.endChar = endChar;
		this.conceptId = conceptId;
		this.confidence = confidence;
		this.source = source;
		this.matchedText = matchedText;
	}

	public static Annotation of(Span span, String conceptId) {
		return new Annotation(span.getStartToken(), span.getEndToken(), span.getStartChar(), span.getEndChar(),
				conceptId, span.getConfidence(), span.getSource(), span.getMatchedText());
	}

	public boolean overlaps(int otherStartChar, int otherEndChar) {
		return startChar < otherEndChar && otherStartChar < endChar;
	}
}
