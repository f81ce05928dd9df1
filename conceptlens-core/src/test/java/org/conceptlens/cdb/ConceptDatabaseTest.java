package org.conceptlens.cdb;

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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.conceptlens.cdb.ConceptBuildException.Reason;
import org.conceptlens.om.CombinedPattern;
import org.conceptlens.om.ConceptRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConceptDatabaseTest {

	private static List<ConceptRecord> sampleRecords() {
		return List.of(ConceptRecord.preferred("C1", "Blood Sugar", "T1"), ConceptRecord.synonym("C1", "glucose"),
				ConceptRecord.preferred("C2", "Blood Glucose Test", "T2"), ConceptRecord.synonym("C2", "blood sugar"),
				new ConceptRecord("C3", "Myocardial   Infarction", true, List.of("T3", "T1"), 42L));
	}

	@Test
	@DisplayName("Lookup is case and whitespace insensitive and returns every owner of a shared name")
	void lookup_normalizes_and_returns_all_owners() {
		ConceptDatabase db = ConceptDatabase.build(sampleRecords(), List.of());

		assertEquals(Set.of("C1", "C2"), db.lookup("BLOOD   sugar"));
		assertEquals(Set.of("C3"), db.lookup("myocardial infarction"));
		assertTrue(db.lookup("unknown term").isEmpty());
	}

	@Test
	void concept_attributes_are_merged_across_rows() {
		ConceptDatabase db = ConceptDatabase.build(sampleRecords(), List.of());

		assertEquals(3, db.conceptCount());
		assertEquals("Blood Sugar", db.preferredName("C1"));
		assertTrue(db.isPreferredKey("C1", "blood sugar"));
		assertFalse(db.isPreferredKey("C2", "blood sugar"));
		assertEquals(Set.of("T3", "T1"), db.types("C3"));
		assertEquals(42L, db.frequency("C3"));
		assertEquals(0L, db.frequency("C1"));
		assertEquals(Set.of("Blood Sugar", "glucose"), db.getConcept("C1").getNames());
		assertNull(db.preferredName("nope"));
	}

	@Test
	void max_name_tokens_tracks_longest_name() {
		ConceptDatabase db = ConceptDatabase.build(sampleRecords(), List.of());
		assertEquals(3, db.getMaxNameTokens());
	}

	@Test
	void first_name_is_preferred_when_none_is_flagged() {
		ConceptDatabase db = ConceptDatabase.build(
				List.of(ConceptRecord.synonym("C9", "Alpha"), ConceptRecord.synonym("C9", "Beta")), List.of());
		assertEquals("Alpha", db.preferredName("C9"));
	}

	@Test
	void repeated_identical_preferred_name_is_accepted() {
		ConceptDatabase db = ConceptDatabase.build(
				List.of(ConceptRecord.preferred("C1", "Headache"), ConceptRecord.preferred("C1", "HEADACHE")),
				List.of());
		assertEquals("Headache", db.preferredName("C1"));
	}

	@Test
	void conflicting_preferred_names_fail_the_build() {
		ConceptBuildException ex = assertThrows(ConceptBuildException.class, () -> ConceptDatabase.build(
				List.of(ConceptRecord.preferred("C1", "Headache"), ConceptRecord.preferred("C1", "Migraine")),
				List.of()));
		assertEquals(Reason.DUPLICATE_IDENTIFIER, ex.getReason());
		assertEquals("C1", ex.getConceptId());
	}

	@Test
	void concept_with_only_blank_names_fails_the_build() {
		ConceptBuildException ex = assertThrows(ConceptBuildException.class,
				() -> ConceptDatabase.build(List.of(ConceptRecord.synonym("C1", "   ")), List.of()));
		assertEquals(Reason.EMPTY_NAME_SET, ex.getReason());
	}

	@Test
	void record_without_identifier_fails_the_build() {
		ConceptBuildException ex = assertThrows(ConceptBuildException.class,
				() -> ConceptDatabase.build(List.of(ConceptRecord.synonym(" ", "Headache")), List.of()));
		assertEquals(Reason.MISSING_IDENTIFIER, ex.getReason());
	}

	@Test
	void pattern_with_single_component_fails_the_build() {
		ConceptBuildException ex = assertThrows(ConceptBuildException.class, () -> ConceptDatabase
				.build(sampleRecords(), List.of(CombinedPattern.of("C1", 3, "sugar"))));
		assertEquals(Reason.INVALID_PATTERN, ex.getReason());
	}

	@Test
	void pattern_with_blank_component_or_negative_gap_fails_the_build() {
		assertEquals(Reason.INVALID_PATTERN, assertThrows(ConceptBuildException.class,
				() -> ConceptDatabase.build(sampleRecords(), List.of(CombinedPattern.of("C1", 3, "check", " "))))
				.getReason());
		assertEquals(Reason.INVALID_PATTERN, assertThrows(ConceptBuildException.class,
				() -> ConceptDatabase.build(sampleRecords(), List.of(CombinedPattern.of("C1", -1, "check", "sugar"))))
				.getReason());
	}

	@Test
	void pattern_for_unknown_concept_fails_the_build() {
		ConceptBuildException ex = assertThrows(ConceptBuildException.class, () -> ConceptDatabase
				.build(sampleRecords(), List.of(CombinedPattern.of("C404", 3, "check", "sugar"))));
		assertEquals(Reason.UNKNOWN_CONCEPT, ex.getReason());
	}

	@Test
	void pattern_components_are_normalized() {
		ConceptDatabase db = ConceptDatabase.build(sampleRecords(),
				List.of(CombinedPattern.of("C1", 2, "Check", "Blood  SUGAR")));
		CombinedPattern p = db.getPatterns().get(0);
		assertEquals(List.of("check", "blood sugar"), p.getComponents());
		assertEquals(2, p.getMaxGap());
	}

	@Test
	void views_are_unmodifiable() {
		ConceptDatabase db = ConceptDatabase.build(sampleRecords(),
				List.of(CombinedPattern.of("C1", 2, "check", "sugar")));
		assertThrows(UnsupportedOperationException.class, () -> db.lookup("blood sugar").add("C9"));
		assertThrows(UnsupportedOperationException.class, () -> db.getPatterns().clear());
		assertThrows(UnsupportedOperationException.class, () -> db.getConcept("C1").getNames().clear());
	}

	@Test
	void custom_name_tokenizer_is_used_for_keys() {
		ConceptDatabase db = ConceptDatabase.build(List.of(ConceptRecord.preferred("C1", "Kaposi-Sarcoma")),
				List.of(), s -> s.split("[\\s-]+"));
		assertEquals(Set.of("C1"), db.lookupKey("kaposi sarcoma"));
		assertEquals(2, db.getMaxNameTokens());
	}
}
