package org.conceptlens.processing;

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
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import org.conceptlens.cdb.ConceptDatabase;
import org.conceptlens.matching.CombinedPatternMatcher;
import org.conceptlens.matching.DictionaryMatcher;
import org.conceptlens.matching.DisambiguationPolicy;
import org.conceptlens.matching.GapConfidencePolicy;
import org.conceptlens.matching.LinearGapConfidence;
import org.conceptlens.matching.SpanMerger;
import org.conceptlens.om.Annotation;
import org.conceptlens.om.Span;
import org.conceptlens.om.SpanSource;
import org.conceptlens.om.TokenizedDocument;
import org.conceptlens.semantic.DisabledSemanticBackend;
import org.conceptlens.semantic.SemanticBackend;
import org.conceptlens.semantic.SemanticFallback;

/**
 * Annotates one document at a time: dictionary and combined-pattern matching,
 * span merging with disambiguation, then the optional semantic fallback on
 * whatever is left uncovered.
 * <p>
 * The matchers for one concept database form an immutable set held in an
 * {@link AtomicReference}. {@link #reload(ConceptDatabase)} swaps in a new set;
 * a document already being annotated finishes on the set it started with, and
 * likewise keeps the semantic backend it read at the start.
 */
public class ConceptAnnotator {

	private final AtomicReference<MatcherSet> matchers = new AtomicReference<>();

	private final int maxNameTokens;
	private final double ambiguousConfidence;
	private final boolean preferPreferredName;
	private final List<String> typePriority;
	private final GapConfidencePolicy gapConfidence;

	private final SemanticFallback fallback;
	private final Supplier<SemanticBackend> backend;

	private ConceptAnnotator(Builder b) {
		this.maxNameTokens = b.maxNameTokens;
		this.ambiguousConfidence = b.ambiguousConfidence;
		this.preferPreferredName = b.preferPreferredName;
		this.typePriority = Collections.unmodifiableList(new ArrayList<>(b.typePriority));
		this.gapConfidence = b.gapConfidence;
		this.fallback = b.fallback;
		this.backend = b.backend;
		this.matchers.set(newMatcherSet(b.database));
	}

	public static Builder builder(ConceptDatabase database) {
		return new Builder(database);
	}

	/**
	 * @throws org.conceptlens.om.InvalidDocumentException if the token offsets are
	 *                                                     inconsistent
	 */
	public AnnotationResult annotate(TokenizedDocument doc) {
		final MatcherSet m = matchers.get();
		doc.validate();

		long t0 = System.nanoTime();
		List<Span> spans = new ArrayList<>(m.dictionary.match(doc));
		spans.addAll(m.combined.match(doc));
		List<Annotation> accepted = m.merger.merge(spans);

		String backendId = null;
		if (fallback != null && backend != null) {
			SemanticBackend b = backend.get();
			if (b != null) {
				backendId = b.id();
				// the disabled backend never matches; do not spend executor tasks on it
				if (!DisabledSemanticBackend.ID.equals(backendId))
					accepted = fallback.apply(doc, accepted, b, m.merger);
			}
		}
		double elapsedMillis = (System.nanoTime() - t0) / 1_000_000.0;

		Map<SpanSource, Integer> counts = new EnumMap<>(SpanSource.class);
		for (Annotation a : accepted) {
			counts.merge(a.getSource(), 1, Integer::sum);
		}
		return new AnnotationResult(doc.getId(), Collections.unmodifiableList(accepted), elapsedMillis, backendId,
				Collections.unmodifiableMap(counts));
	}

	/** Replaces the concept database used by documents that start after this call. */
	public void reload(ConceptDatabase database) {
		matchers.set(newMatcherSet(database));
	}

	public ConceptDatabase currentDatabase() {
		return matchers.get().database;
	}

	private MatcherSet newMatcherSet(ConceptDatabase db) {
		if (db == null)
			throw new IllegalArgumentException("Concept database is required");
		DisambiguationPolicy policy = new DisambiguationPolicy(db, preferPreferredName, typePriority);
		return new MatcherSet(db, new DictionaryMatcher(db, maxNameTokens, ambiguousConfidence),
				new CombinedPatternMatcher(db, gapConfidence), new SpanMerger(policy));
	}

	private static final class MatcherSet {
		final ConceptDatabase database;
		final DictionaryMatcher dictionary;
		final CombinedPatternMatcher combined;
		final SpanMerger merger;

		MatcherSet(ConceptDatabase database, DictionaryMatcher dictionary, CombinedPatternMatcher combined,
				SpanMerger merger) {
			this.database = database;
			this.dictionary = dictionary;
			this.combined = combined;
			this.merger = merger;
		}
	}

	public static final class Builder {
		private final ConceptDatabase database;
		private int maxNameTokens = 0;
		private double ambiguousConfidence = DictionaryMatcher.DEFAULT_AMBIGUOUS_CONFIDENCE;
		private boolean preferPreferredName = true;
		private List<String> typePriority = List.of();
		private GapConfidencePolicy gapConfidence = new LinearGapConfidence();
		private SemanticFallback fallback;
		private Supplier<SemanticBackend> backend;

		private Builder(ConceptDatabase database) {
			this.database = database;
		}

		public Builder maxNameTokens(int v) {
			this.maxNameTokens = v;
			return this;
		}

		public Builder ambiguousConfidence(double v) {
			this.ambiguousConfidence = v;
			return this;
		}

		public Builder preferPreferredName(boolean v) {
			this.preferPreferredName = v;
			return this;
		}

		public Builder typePriority(List<String> v) {
			this.typePriority = (v == null) ? List.of() : v;
			return this;
		}

		public Builder gapConfidence(GapConfidencePolicy v) {
			this.gapConfidence = v;
			return this;
		}

		/**
		 * Enables the semantic fallback. {@code backend} is read once per document,
		 * e.g. {@code controller::activeBackend}.
		 */
		public Builder semantic(SemanticFallback fallback, Supplier<SemanticBackend> backend) {
			this.fallback = fallback;
			this.backend = backend;
			return this;
		}

		public ConceptAnnotator build() {
			return new ConceptAnnotator(this);
		}
	}
}
