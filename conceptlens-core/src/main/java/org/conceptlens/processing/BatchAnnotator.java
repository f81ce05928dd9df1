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
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import org.conceptlens.om.InvalidDocumentException;
import org.conceptlens.om.TokenizedDocument;
import org.conceptlens.util.Logger;

/**
 * Annotates many documents on a bounded pool. Documents share nothing but the
 * read-only matcher set; a rejected document is reported in its outcome and
 * the others carry on.
 */
public class BatchAnnotator {

	private final ConceptAnnotator annotator;
	private final int parallelism;
	private final Consumer<AnnotationResult> listener;

	public BatchAnnotator(ConceptAnnotator annotator, int parallelism) {
		this(annotator, parallelism, r -> {
		});
	}

	/**
	 * @param listener called for each successfully annotated document, from the
	 *                 worker thread (e.g. to report outcomes to the evolution
	 *                 controller)
	 */
	public BatchAnnotator(ConceptAnnotator annotator, int parallelism, Consumer<AnnotationResult> listener) {
		this.annotator = annotator;
		this.parallelism = Math.max(1, parallelism);
		this.listener = listener;
	}

	/** One outcome per input document, in input order. */
	public List<DocumentOutcome> annotateAll(List<TokenizedDocument> documents) {
		if (documents == null || documents.isEmpty())
			return new ArrayList<>();

		final AtomicInteger failed = new AtomicInteger();
		final long t0 = System.currentTimeMillis();
		final ForkJoinPool pool = new ForkJoinPool(parallelism);
		List<DocumentOutcome> out;
		try {
			out = pool.submit(() -> documents.parallelStream().map(doc -> {
				DocumentOutcome o = annotateOne(doc);
				if (!o.isSuccess())
					failed.incrementAndGet();
				return o;
			}).collect(Collectors.toList())).get();
		} catch (InterruptedException ie) {
			Thread.currentThread().interrupt();
			throw new RuntimeException("Batch annotation interrupted", ie);
		} catch (ExecutionException ee) {
			throw new RuntimeException("Batch annotation failed", ee.getCause());
		} finally {
			pool.shutdown();
		}

		Logger.info("Annotated {} documents ({} rejected) in {} ms with parallelism {}", documents.size(),
				failed.get(), System.currentTimeMillis() - t0, parallelism);
		return out;
	}

	private DocumentOutcome annotateOne(TokenizedDocument doc) {
		try {
			AnnotationResult r = annotator.annotate(doc);
			listener.accept(r);
			return DocumentOutcome.success(r);
		} catch (InvalidDocumentException e) {
			Logger.warn("Rejected document {}: {}", doc.getId(), e.getMessage());
			return DocumentOutcome.failure(doc.getId(), e.getMessage());
		} catch (RuntimeException e) {
			Logger.error("Failed to annotate document {}", e, doc.getId());
			return DocumentOutcome.failure(doc.getId(), e.getClass().getSimpleName() + ": " + e.getMessage());
		}
	}
}
