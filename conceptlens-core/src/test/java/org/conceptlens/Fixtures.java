package org.conceptlens;

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
import java.util.Arrays;
import java.util.List;

import org.conceptlens.om.ConceptRecord;
import org.conceptlens.om.Token;
import org.conceptlens.om.TokenizedDocument;

/**
 * Shared builders for tests.
 */
public final class Fixtures {

	private Fixtures() {
	}

	/** Splits {@code text} on single spaces, keeping character offsets. */
	public static TokenizedDocument doc(String id, String text) {
		List<Token> tokens = new ArrayList<>();
		int i = 0;
		while (i < text.length()) {
			if (text.charAt(i) == ' ') {
				i++;
				continue;
			}
			int start = i;
			while (i < text.length() && text.charAt(i) != ' ')
				i++;
			tokens.add(new Token(text.substring(start, i), start, i));
		}
		return new TokenizedDocument(id, text, tokens);
	}

	public static ConceptRecord record(String id, String name, boolean preferred, long frequency, String... types) {
		return new ConceptRecord(id, name, preferred, new ArrayList<>(Arrays.asList(types)), frequency);
	}
}
