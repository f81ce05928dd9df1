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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

import org.apache.commons.lang3.StringUtils;
import org.conceptlens.cdb.ConceptBuildException.Reason;
import org.conceptlens.om.CombinedPattern;
import org.conceptlens.om.Concept;
import org.conceptlens.om.ConceptRecord;
import org.conceptlens.util.Logger;
import org.conceptlens.util.TermNormalizer;

/**
 * Immutable index of concepts, their normalized surface names and their
 * combined patterns.
 * <p>
 * Names are keyed by {@link TermNormalizer#nameKey(String, Function)} using the
 * database's name tokenizer, which must split names the same way documents are
 * tokenized. A new database is built whole and swapped in by the caller; an
 * instance never changes once returned from {@link #build}.
 */
public final class ConceptDatabase {

	private final Map<String, Concept> concepts;
	private final Map<String, Set<String>> nameIndex;
	private final List<CombinedPattern> patterns;
	private final Function<String, String[]> nameTokenizer;
	private final int maxNameTokens;

	private ConceptDatabase(Map<String, Concept> concepts, Map<String, Set<String>> nameIndex,
			List<CombinedPattern> patterns, Function<String, String[]> nameTokenizer, int maxNameTokens) {
		this.concepts = concepts;
		this.nameIndex = nameIndex;
		this.patterns = patterns;
		this.nameTokenizer = nameTokenizer;
		this.maxNameTokens = maxNameTokens;
	}

	public static ConceptDatabase build(Collection<ConceptRecord> records, Collection<CombinedPattern> patterns) {
		return build(records, patterns, TermNormalizer.WHITESPACE);
	}

	/**
	 * Builds a database.
	 *
	 * @param records       name rows; several rows per concept id are merged
	 * @param patterns      combined patterns; may be null or empty
	 * @param nameTokenizer splits a normalized name into tokens
	 * @throws ConceptBuildException if the sources are inconsistent
	 */
	public static ConceptDatabase build(Collection<ConceptRecord> records, Collection<CombinedPattern> patterns,
			Function<String, String[]> nameTokenizer) {
		Function<String, String[]> tokenizer = (nameTokenizer == null) ? TermNormalizer.WHITESPACE : nameTokenizer;

		Map<String, Draft> drafts = new LinkedHashMap<>();
		if (records != null) {
			for (ConceptRecord r : records) {
				String id = StringUtils.trimToEmpty(r.getConceptId());
				if (id.isEmpty()) {
					throw new ConceptBuildException(Reason.MISSING_IDENTIFIER, id, "record for name '" + r.getName()
							+ "' has no concept id");
				}
				drafts.computeIfAbsent(id, Draft::new).add(r, tokenizer);
			}
		}

		Map<String, Concept> concepts = new LinkedHashMap<>();
		Map<String, Set<String>> index = new HashMap<>();
		int maxTokens = 0;
		int nameCount = 0;
		for (Draft d : drafts.values()) {
			if (d.names.isEmpty()) {
				throw new ConceptBuildException(Reason.EMPTY_NAME_SET, d.id, "concept has no non-blank name");
			}
			if (d.preferredName == null) {
				// no row flagged preferred: the first listed name stands in
				Map.Entry<String, String> first = d.names.entrySet().iterator().next();
				d.preferredKey = first.getKey();
				d.preferredName = first.getValue();
			}
			concepts.put(d.id, new Concept(d.id, d.preferredName, d.preferredKey, new LinkedHashSet<>(d.names.values()),
					d.types, d.frequency));
			for (String key : d.names.keySet()) {
				index.computeIfAbsent(key, k -> new TreeSet<>()).add(d.id);
				maxTokens = Math.max(maxTokens, d.tokenCounts.get(key));
				nameCount++;
			}
		}

		Map<String, Set<String>> frozenIndex = new HashMap<>(index.size() * 2);
		for (Map.Entry<String, Set<String>> e : index.entrySet()) {
			frozenIndex.put(e.getKey(), Collections.unmodifiableSet(e.getValue()));
		}

		List<CombinedPattern> normalizedPatterns = new ArrayList<>();
		if (patterns != null) {
			for (CombinedPattern p : patterns) {
				normalizedPatterns.add(normalizePattern(p, concepts, tokenizer));
			}
		}

		ConceptDatabase db = new ConceptDatabase(Collections.unmodifiableMap(concepts),
				Collections.unmodifiableMap(frozenIndex), Collections.unmodifiableList(normalizedPatterns), tokenizer,
				maxTokens);
		Logger.info("Concept database built: {} concepts, {} names ({} distinct keys), {} patterns, longest name {} tokens",
				concepts.size(), nameCount, frozenIndex.size(), normalizedPatterns.size(), maxTokens);
		return db;
	}

	private static CombinedPattern normalizePattern(CombinedPattern p, Map<String, Concept> concepts,
			Function<String, String[]> tokenizer) {
		String id = StringUtils.trimToEmpty(p.getConceptId());
		if (id.isEmpty()) {
			throw new ConceptBuildException(Reason.MISSING_IDENTIFIER, id, "pattern '" + p.getName() + "' has no concept id");
		}
		if (!concepts.containsKey(id)) {
			throw new ConceptBuildException(Reason.UNKNOWN_CONCEPT, id, "pattern '" + p.getName()
					+ "' refers to a concept that is not in the database");
		}
		if (p.getComponents().size() < 2) {
			throw new ConceptBuildException(Reason.INVALID_PATTERN, id,
					"pattern needs at least two components, got " + p.getComponents().size());
		}
		if (p.getMaxGap() < 0) {
			throw new ConceptBuildException(Reason.INVALID_PATTERN, id, "negative max gap " + p.getMaxGap());
		}
		List<String> comps = new ArrayList<>(p.getComponents().size());
		for (String c : p.getComponents()) {
			String key = TermNormalizer.nameKey(c, tokenizer);
			if (key.isEmpty()) {
				throw new ConceptBuildException(Reason.INVALID_PATTERN, id, "blank component in pattern '" + p.getName() + "'");
			}
			comps.add(key);
		}
		String name = StringUtils.isBlank(p.getName()) ? String.join(" ", comps) : p.getName();
		return new CombinedPattern(id, name, comps, p.getMaxGap());
	}

	// -------------------------- Lookups -----------------------------------------

	/** Concept ids whose names normalize to the same key as {@code name}; empty if none. */
	public Set<String> lookup(String name) {
		return lookupKey(TermNormalizer.nameKey(name, nameTokenizer));
	}

	/** Concept ids registered under an already normalized, space-joined key. */
	public Set<String> lookupKey(String key) {
		Set<String> ids = nameIndex.get(key);
		return (ids == null) ? Collections.emptySet() : ids;
	}

	/** The concept, or null when the id is unknown. */
	public Concept getConcept(String id) {
		return concepts.get(id);
	}

	public boolean contains(String id) {
		return concepts.containsKey(id);
	}

	/** Preferred name of {@code id}, or null when unknown. */
	public String preferredName(String id) {
		Concept c = concepts.get(id);
		return (c == null) ? null : c.getPreferredName();
	}

	/** True when {@code key} is the normalized preferred name of {@code id}. */
	public boolean isPreferredKey(String id, String key) {
		Concept c = concepts.get(id);
		return c != null && c.getPreferredKey().equals(key);
	}

	public Set<String> types(String id) {
		Concept c = concepts.get(id);
		return (c == null) ? Collections.emptySet() : c.getTypes();
	}

	public long frequency(String id) {
		Concept c = concepts.get(id);
		return (c == null) ? 0L : c.getFrequency();
	}

	/** All concepts in build order. */
	public Collection<Concept> concepts() {
		return concepts.values();
	}

	public List<CombinedPattern> getPatterns() {
		return patterns;
	}

	/** Splits an already normalized name the way stored keys were split. */
	public String[] tokenize(String normalizedName) {
		return TermNormalizer.tokens(normalizedName, nameTokenizer);
	}

	/** Longest registered name, in tokens. */
	public int getMaxNameTokens() {
		return maxNameTokens;
	}

	public int conceptCount() {
		return concepts.size();
	}

	public int keyCount() {
		return nameIndex.size();
	}

	// -------------------------- Build scratch ------------------------------------

	private static final class Draft {
		final String id;
		// normalized key -> first surface form seen
		final Map<String, String> names = new LinkedHashMap<>();
		final Map<String, Integer> tokenCounts = new HashMap<>();
		final Set<String> types = new LinkedHashSet<>();
		String preferredName;
		String preferredKey;
		long frequency;

		Draft(String id) {
			this.id = id;
		}

		void add(ConceptRecord r, Function<String, String[]> tokenizer) {
			if (r.getTypes() != null) {
				for (String t : r.getTypes()) {
					if (StringUtils.isNotBlank(t)) {
						types.add(t.trim());
					}
				}
			}
			frequency = Math.max(frequency, r.getFrequency());

			String[] toks = TermNormalizer.tokens(r.getName(), tokenizer);
			if (toks.length == 0) {
				return;
			}
			String key = String.join(" ", toks);
			String surface = r.getName().trim();
			names.putIfAbsent(key, surface);
			tokenCounts.put(key, toks.length);

			if (r.isPreferred()) {
				if (preferredKey != null && !preferredKey.equals(key)) {
					throw new ConceptBuildException(Reason.DUPLICATE_IDENTIFIER, id,
							"conflicting preferred names '" + preferredName + "' and '" + surface + "'");
				}
				if (preferredKey == null) {
					preferredKey = key;
					preferredName = surface;
				}
			}
		}
	}
}
