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

import static org.conceptlens.Fixtures.doc;
import static org.conceptlens.Fixtures.record;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Random;

import org.conceptlens.cdb.ConceptDatabase;
import org.conceptlens.om.Span;
import org.conceptlens.om.SpanSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DictionaryMatcherTest {

	private ConceptDatabase db;

	@BeforeEach
	void setUp() {
		db = ConceptDatabase.build(List.of(record("C1", "heart attack", true, 0), record("C2", "heart", true, 0),
				record("C3", "cold", true, 0), record("C4", "common cold", true, 0), record("C4", "cold", false, 0),
				record("C5", "acute heart attack", true, 0)), null);
	}

	@Test
	void longest_name_wins_and_scan_resumes_after_it() {
		List<Span> spans = new DictionaryMatcher(db).match(doc("d", "heart attack now heart"));
		assertEquals(2, spans.size());
		assertEquals(0, spans.get(0).getStartToken());
		assertEquals(2, spans.get(0).getEndToken());
		assertEquals(List.of("C1"), spans.get(0).getCandidates());
		assertEquals(3, spans.get(1).getStartToken());
		assertEquals(List.of("C2"), spans.get(1).getCandidates());
		assertEquals(SpanSource.DICTIONARY, spans.get(0).getSource());
		assertEquals(1.0, spans.get(0).getConfidence(), 1e-9);
	}

	@Test
	void shared_names_produce_one_ambiguous_span() {
		List<Span> spans = new DictionaryMatcher(db).match(doc("d", "a cold day"));
		assertEquals(1, spans.size());
		assertEquals(List.of("C3", "C4"), spans.get(0).getCandidates());
		assertTrue(spans.get(0).isAmbiguous());
		assertEquals(DictionaryMatcher.DEFAULT_AMBIGUOUS_CONFIDENCE, spans.get(0).getConfidence(), 1e-9);
		assertEquals(0.6, new DictionaryMatcher(db, 0, 0.6).match(doc("d", "cold")).get(0).getConfidence(), 1e-9);
	}

	@Test
	void token_cap_limits_name_length() {
		assertEquals(3, new DictionaryMatcher(db).getMaxTokens());
		assertEquals(List.of("C5"), new DictionaryMatcher(db).match(doc("d", "acute heart attack")).get(0)
				.getCandidates());

		List<Span> capped = new DictionaryMatcher(db, 2, 0.8).match(doc("d", "acute heart attack"));
		assertEquals(1, capped.size());
		assertEquals(List.of("C1"), capped.get(0).getCandidates());
		assertEquals(1, capped.get(0).getStartToken());
	}

	@Test
	void matching_ignores_case() {
		List<Span> spans = new DictionaryMatcher(db).match(doc("d", "HEART Attack"));
		assertEquals(1, spans.size());
		assertEquals("heart attack", spans.get(0).getMatchedText());
		assertEquals(0, spans.get(0).getStartChar());
		assertEquals(12, spans.get(0).getEndChar());
	}

	@Test
	void empty_inputs_yield_nothing() {
		assertTrue(new DictionaryMatcher(db).match(doc("d", "")).isEmpty());
		assertTrue(new DictionaryMatcher(ConceptDatabase.build(List.of(), null)).match(doc("d", "heart")).isEmpty());
	}

	@Test
	void spans_never_overlap_on_random_text() {
		String[] vocab = { "heart", "attack", "acute", "cold", "common", "now", "and" };
		Random rnd = new Random(42);
		DictionaryMatcher m = new DictionaryMatcher(db);
		for (int round = 0; round < 200; round++) {
			StringBuilder sb = new StringBuilder();
			int len = 1 + rnd.nextInt(20);
			for (int i = 0; i < len; i++) {
				if (i > 0)
					sb.append(' ');
				sb.append(vocab[rnd.nextInt(vocab.length)]);
			}
			int prevEnd = 0;
			for (Span s : m.match(doc("r" + round, sb.toString()))) {
				assertTrue(s.getStartToken() >= prevEnd, () -> "overlap in '" + sb + "'");
				prevEnd = s.getEndToken();
			}
		}
	}
}
