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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;

import org.conceptlens.cdb.ConceptDatabase;
import org.conceptlens.om.Annotation;
import org.conceptlens.om.CombinedPattern;
import org.conceptlens.om.Span;
import org.conceptlens.om.SpanSource;
import org.conceptlens.om.TokenizedDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SpanMergerTest {

	@Mock
	DisambiguationPolicy policy;

	private static Span span(int from, int to, SpanSource source, double confidence, String... ids) {
		return new Span(from, to, from * 10, to * 10 - 1, source, List.of(ids), confidence, "t");
	}

	@Test
	@DisplayName("a four-token combined match displaces an overlapping ambiguous dictionary match")
	void longer_combined_span_wins_and_discarded_span_is_not_disambiguated() {
		ConceptDatabase db = ConceptDatabase.build(List.of(record("A", "blood sugar", true, 1),
				record("B", "glucose", true, 50), record("B", "blood sugar", false, 50), record("C", "glucose check", true, 0)),
				List.of(CombinedPattern.of("C", 3, "check", "sugar")));
		TokenizedDocument d = doc("d", "check her blood sugar");

		List<Span> spans = new ArrayList<>(new DictionaryMatcher(db).match(d));
		spans.addAll(new CombinedPatternMatcher(db).match(d));
		assertEquals(2, spans.size());

		List<Annotation> out = new SpanMerger(policy).merge(spans);

		assertEquals(1, out.size());
		assertEquals("C", out.get(0).getConceptId());
		assertEquals(SpanSource.COMBINED, out.get(0).getSource());
		assertEquals(0, out.get(0).getStartChar());
		assertEquals(21, out.get(0).getEndChar());
		verify(policy, never()).resolve(any(Span.class));
	}

	@Test
	void dictionary_beats_combined_at_equal_length() {
		List<Annotation> out = new SpanMerger(policy).merge(
				List.of(span(0, 2, SpanSource.COMBINED, 1.0, "C"), span(0, 2, SpanSource.DICTIONARY, 1.0, "D")));
		assertEquals(1, out.size());
		assertEquals("D", out.get(0).getConceptId());
	}

	@Test
	void higher_confidence_then_leftmost_wins_among_equals() {
		SpanMerger merger = new SpanMerger(policy);
		List<Annotation> out = merger.merge(
				List.of(span(1, 3, SpanSource.COMBINED, 0.7, "X"), span(2, 4, SpanSource.COMBINED, 0.9, "Y")));
		assertEquals(1, out.size());
		assertEquals("Y", out.get(0).getConceptId());

		out = merger.merge(List.of(span(2, 4, SpanSource.COMBINED, 0.9, "Y"), span(1, 3, SpanSource.COMBINED, 0.9, "X")));
		assertEquals("X", out.get(0).getConceptId());
	}

	@Test
	void accepted_ambiguous_spans_are_resolved_by_the_policy() {
		Span ambiguous = span(0, 1, SpanSource.DICTIONARY, 0.8, "A", "B");
		when(policy.resolve(ambiguous)).thenReturn("B");

		List<Annotation> out = new SpanMerger(policy).merge(List.of(ambiguous));
		assertEquals("B", out.get(0).getConceptId());
		assertEquals(0.8, out.get(0).getConfidence(), 1e-9);
		verify(policy).resolve(ambiguous);
	}

	@Test
	void already_accepted_annotations_are_never_displaced() {
		SpanMerger merger = new SpanMerger(policy);
		List<Annotation> accepted = merger.merge(List.of(span(2, 3, SpanSource.DICTIONARY, 1.0, "A")));

		List<Annotation> out = merger.merge(List.of(span(1, 5, SpanSource.SEMANTIC, 0.99, "S"),
				span(5, 6, SpanSource.SEMANTIC, 0.85, "T")), accepted);

		assertEquals(2, out.size());
		assertEquals("A", out.get(0).getConceptId());
		assertEquals("T", out.get(1).getConceptId());
	}

	@Test
	void output_is_ordered_and_disjoint() {
		SpanMerger merger = new SpanMerger(policy);
		List<Annotation> out = merger.merge(List.of(span(6, 7, SpanSource.DICTIONARY, 1.0, "Z"),
				span(0, 2, SpanSource.DICTIONARY, 1.0, "A"), span(1, 4, SpanSource.COMBINED, 0.6, "B"),
				span(3, 5, SpanSource.DICTIONARY, 1.0, "C"), span(4, 6, SpanSource.DICTIONARY, 1.0, "D")));

		for (int i = 1; i < out.size(); i++) {
			assertTrue(out.get(i - 1).getEndChar() <= out.get(i).getStartChar());
		}
		assertEquals("B", out.get(0).getConceptId());
		assertEquals("D", out.get(1).getConceptId());
		assertEquals("Z", out.get(2).getConceptId());
	}
}
