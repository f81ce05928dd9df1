package org.conceptlens.semantic;

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
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.conceptlens.matching.SpanMerger;
import org.conceptlens.om.Annotation;
import org.conceptlens.om.Span;
import org.conceptlens.om.SpanSource;
import org.conceptlens.om.TokenizedDocument;
import org.conceptlens.util.Logger;

/**
 * Embedding-based matching over the parts of a document that dictionary and
 * combined matching left uncovered.
 * <p>
 * Backend calls run on a separate executor under a per-document time budget.
 * When the budget runs out, or the backend fails, the remaining windows of that
 * document get no semantic match; the document itself still completes.
 * Results go through a second {@link SpanMerger} pass against the annotations
 * already accepted, so a semantic span never displaces them.
 */
public class SemanticFallback implements AutoCloseable {

	private final WindowStrategy windowStrategy;
	private final int topK;
	private final double minSimilarity;
	private final long timeoutMillis;
	private final ExecutorService executor;
	private final boolean ownsExecutor;

	public SemanticFallback(WindowStrategy windowStrategy, int topK, double minSimilarity, long timeoutMillis) {
		this(windowStrategy, topK, minSimilarity, timeoutMillis, Executors.newCachedThreadPool(daemonThreads()), true);
	}

	public SemanticFallback(WindowStrategy windowStrategy, int topK, double minSimilarity, long timeoutMillis,
			ExecutorService executor) {
		this(windowStrategy, topK, minSimilarity, timeoutMillis, executor, false);
	}

	private SemanticFallback(WindowStrategy windowStrategy, int topK, double minSimilarity, long timeoutMillis,
			ExecutorService executor, boolean ownsExecutor) {
		if (topK < 1)
			throw new IllegalArgumentException("topK must be >= 1");
		if (timeoutMillis <= 0)
			throw new IllegalArgumentException("timeoutMillis must be > 0");
		this.windowStrategy = windowStrategy;
		this.topK = topK;
		this.minSimilarity = minSimilarity;
		this.timeoutMillis = timeoutMillis;
		this.executor = executor;
		this.ownsExecutor = ownsExecutor;
	}

	/**
	 * Runs the fallback with {@code backend} and merges its spans into
	 * {@code accepted} with {@code merger}.
	 *
	 * @return accepted plus semantic annotations, ordered by start offset
	 */
	public List<Annotation> apply(TokenizedDocument doc, Collection<Annotation> accepted, SemanticBackend backend,
			SpanMerger merger) {
		return merger.merge(findCandidates(doc, accepted, backend), accepted);
	}

	/** Semantic candidate spans for the residual regions of {@code doc}. */
	public List<Span> findCandidates(TokenizedDocument doc, Collection<Annotation> accepted, SemanticBackend backend) {
		List<Span> out = new ArrayList<>();
		if (backend == null || doc.size() == 0)
			return out;

		List<TokenWindow> windows = windowStrategy.windows(doc, coverage(doc, accepted));
		if (windows.isEmpty())
			return out;

		final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
		for (TokenWindow w : windows) {
			long remaining = deadline - System.nanoTime();
			if (remaining <= 0) {
				Logger.warn("Semantic budget of {} ms exhausted for document {} with backend '{}'", timeoutMillis,
						doc.getId(), backend.id());
				break;
			}
			final String text = doc.normalizedText(w.getFrom(), w.getTo());
			Future<List<SemanticMatch>> f = executor
					.submit(() -> backend.nearest(backend.embed(text), topK, minSimilarity));
			List<SemanticMatch> matches;
			try {
				matches = f.get(remaining, TimeUnit.NANOSECONDS);
			} catch (TimeoutException e) {
				f.cancel(true);
				Logger.warn("Semantic lookup timed out after {} ms for document {} with backend '{}'", timeoutMillis,
						doc.getId(), backend.id());
				break;
			} catch (ExecutionException e) {
				Logger.warn("Semantic lookup failed for document {} with backend '{}'", e.getCause(), doc.getId(),
						backend.id());
				break;
			} catch (InterruptedException e) {
				f.cancel(true);
				Thread.currentThread().interrupt();
				break;
			}
			SemanticMatch best = firstAboveFloor(matches);
			if (best != null) {
				out.add(Span.over(doc, w.getFrom(), w.getTo(), SpanSource.SEMANTIC, List.of(best.getConceptId()),
						best.getSimilarity()));
			}
		}
		return out;
	}

	private SemanticMatch firstAboveFloor(List<SemanticMatch> matches) {
		if (matches == null)
			return null;
		for (SemanticMatch m : matches) {
			if (m.getSimilarity() >= minSimilarity)
				return m;
		}
		return null;
	}

	static boolean[] coverage(TokenizedDocument doc, Collection<Annotation> accepted) {
		boolean[] covered = new boolean[doc.size()];
		for (Annotation a : accepted) {
			for (int i = 0; i < covered.length; i++) {
				if (!covered[i] && a.overlaps(doc.token(i).getStart(), doc.token(i).getEnd()))
					covered[i] = true;
			}
		}
		return covered;
	}

	@Override
	public void close() {
		if (ownsExecutor)
			executor.shutdownNow();
	}

	private static ThreadFactory daemonThreads() {
		AtomicInteger seq = new AtomicInteger();
		return r -> {
			Thread t = new Thread(r, "semantic-" + seq.incrementAndGet());
			t.setDaemon(true);
			return t;
		};
	}
}
