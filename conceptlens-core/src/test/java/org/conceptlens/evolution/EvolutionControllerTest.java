package org.conceptlens.evolution;

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
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.conceptlens.cdb.ConceptDatabase;
import org.conceptlens.evolution.MetricsSnapshot.Decision;
import org.conceptlens.om.ConceptRecord;
import org.conceptlens.semantic.BackendUnavailableException;
import org.conceptlens.semantic.SemanticBackend;
import org.conceptlens.semantic.SemanticBackendProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EvolutionControllerTest {

	/** Clock the test moves by hand. */
	static final class MutableClock extends Clock {
		private Instant now;

		MutableClock(Instant start) {
			this.now = start;
		}

		void advance(Duration d) {
			now = now.plus(d);
		}

		@Override
		public ZoneId getZone() {
			return ZoneOffset.UTC;
		}

		@Override
		public Clock withZone(ZoneId zone) {
			return this;
		}

		@Override
		public Instant instant() {
			return now;
		}
	}

	private final ConceptDatabase db = ConceptDatabase.build(List.of(ConceptRecord.preferred("C1", "headache")), null);
	private MutableClock clock;
	private EvolutionController controller;
	private final List<MetricsSnapshot> published = new CopyOnWriteArrayList<>();

	@BeforeEach
	void setUp() {
		clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
		controller = new EvolutionController(() -> db, new EvolutionThresholds(0.8, 0.8, 100, 2),
				Duration.ofSeconds(1), Duration.ofSeconds(5), clock);
		controller.addSink(published::add);
	}

	private static SemanticBackend backend(String id) {
		SemanticBackend b = mock(SemanticBackend.class);
		when(b.id()).thenReturn(id);
		return b;
	}

	private static SemanticBackendProvider provider(String id) throws Exception {
		SemanticBackendProvider p = mock(SemanticBackendProvider.class);
		when(p.id()).thenReturn(id);
		when(p.create(any())).thenAnswer(inv -> backend(id));
		return p;
	}

	private static SemanticBackendProvider failingProvider(String id) throws Exception {
		SemanticBackendProvider p = mock(SemanticBackendProvider.class);
		when(p.id()).thenReturn(id);
		when(p.create(any())).thenThrow(new BackendUnavailableException("no model for " + id));
		return p;
	}

	private static MetricsSample good(String backend) {
		return MetricsSample.builder().backendId(backend).truePositives(9).falsePositives(1).falseNegatives(1)
				.latencyMillis(10).build();
	}

	private static MetricsSample bad(String backend) {
		return MetricsSample.builder().backendId(backend).truePositives(1).falsePositives(5).falseNegatives(5)
				.latencyMillis(10).build();
	}

	private void batch(MetricsSample s) {
		controller.reportOutcome(s);
		controller.reportOutcome(s);
	}

	@Test
	void starts_with_the_initial_provider_while_evaluating() throws Exception {
		assertEquals("none", controller.currentBackend());
		controller.start(provider("a"));
		assertEquals("a", controller.currentBackend());
		assertEquals(EvolutionPhase.EVALUATING, controller.phase());
		assertEquals("a", controller.window().getBackendId());
	}

	@Test
	void backend_meeting_thresholds_becomes_stable() throws Exception {
		controller.start(provider("a"));
		controller.reportOutcome(good("a"));
		assertEquals(1, controller.window().getSamples());
		assertTrue(published.isEmpty());

		controller.reportOutcome(good("a"));

		assertEquals(EvolutionPhase.STABLE, controller.phase());
		assertEquals(0, controller.window().getSamples());
		assertEquals(1, published.size());
		MetricsSnapshot s = published.get(0);
		assertEquals(Decision.PROMOTED, s.getDecision());
		assertEquals("a", s.getBackendId());
		assertEquals(2, s.getSamples());
		assertEquals(0.9, s.getPrecision(), 1e-9);
		assertEquals(clock.instant(), s.getTimestamp());
	}

	@Test
	void missed_thresholds_swap_to_the_next_provider_with_a_fresh_window() throws Exception {
		controller.start(provider("a"));
		controller.registerProvider(provider("b"));

		batch(bad("a"));

		assertEquals("b", controller.currentBackend());
		assertEquals(EvolutionPhase.EVALUATING, controller.phase());
		assertEquals("b", controller.window().getBackendId());
		assertEquals(0, controller.window().getSamples());
		MetricsSnapshot s = published.get(0);
		assertEquals(Decision.SWAPPED, s.getDecision());
		assertEquals("a", s.getBackendId());
		assertEquals("b", s.getNextBackendId());

		batch(bad("b"));
		assertEquals("a", controller.currentBackend());
	}

	@Test
	void samples_for_other_backends_are_dropped() throws Exception {
		controller.start(provider("a"));
		controller.registerProvider(provider("b"));
		controller.reportOutcome(bad("a"));
		controller.reportOutcome(good("b"));
		assertEquals(1, controller.window().getSamples());
		assertEquals("a", controller.currentBackend());
	}

	@Test
	void stable_batches_are_monitored_without_swapping() throws Exception {
		controller.start(provider("a"));
		controller.registerProvider(provider("b"));
		batch(good("a"));

		batch(bad("a"));

		assertEquals("a", controller.currentBackend());
		assertEquals(EvolutionPhase.STABLE, controller.phase());
		assertEquals(Decision.MONITORED, published.get(1).getDecision());
	}

	@Test
	void reevaluation_and_registration_reopen_evaluation() throws Exception {
		controller.start(provider("a"));
		batch(good("a"));
		controller.triggerReevaluation("drift");
		assertEquals(EvolutionPhase.EVALUATING, controller.phase());

		batch(good("a"));
		assertEquals(EvolutionPhase.STABLE, controller.phase());
		controller.registerProvider(provider("b"));
		assertEquals(EvolutionPhase.EVALUATING, controller.phase());
		assertEquals("a", controller.currentBackend());

		assertThrows(IllegalArgumentException.class, () -> controller.registerProvider(provider("b")));
	}

	@Test
	void failing_provider_backs_off_before_being_retried() throws Exception {
		controller.start(provider("a"));
		SemanticBackendProvider b = failingProvider("b");
		controller.registerProvider(b);

		batch(bad("a"));
		assertEquals("a", controller.currentBackend());
		assertEquals(Decision.RETAINED, published.get(0).getDecision());
		assertEquals(1, controller.failedAttempts("b"));
		assertEquals(clock.instant().plusSeconds(1), controller.nextRetryAt("b"));

		batch(bad("a"));
		verify(b, times(1)).create(any());

		clock.advance(Duration.ofMillis(1001));
		batch(bad("a"));
		verify(b, times(2)).create(any());
		assertEquals(2, controller.failedAttempts("b"));
		assertEquals(clock.instant().plusSeconds(2), controller.nextRetryAt("b"));
	}

	@Test
	void failed_start_runs_disabled_until_the_provider_recovers() throws Exception {
		SemanticBackendProvider a = mock(SemanticBackendProvider.class);
		when(a.id()).thenReturn("a");
		when(a.create(any())).thenThrow(new BackendUnavailableException("not yet")).thenAnswer(inv -> backend("a"));

		controller.start(a);
		assertEquals("none", controller.currentBackend());
		assertEquals(1, controller.failedAttempts("a"));

		batch(bad("none"));
		assertEquals("none", controller.currentBackend());

		clock.advance(Duration.ofSeconds(2));
		batch(bad("none"));
		assertEquals("a", controller.currentBackend());
		assertEquals(0, controller.failedAttempts("a"));
		assertNull(controller.nextRetryAt("a"));
	}

	@Test
	void refresh_rebuilds_the_active_backend() throws Exception {
		SemanticBackendProvider a = provider("a");
		controller.start(a);
		SemanticBackend before = controller.activeBackend();
		batch(good("a"));

		controller.refreshBackend("database reloaded");

		verify(a, times(2)).create(any());
		assertNotSame(before, controller.activeBackend());
		assertEquals(EvolutionPhase.EVALUATING, controller.phase());
	}

	@Test
	void failed_refresh_keeps_the_current_backend() throws Exception {
		SemanticBackendProvider a = mock(SemanticBackendProvider.class);
		when(a.id()).thenReturn("a");
		SemanticBackend first = backend("a");
		when(a.create(any())).thenReturn(first).thenThrow(new IllegalStateException("index corrupt"));

		controller.start(a);
		controller.refreshBackend("database reloaded");

		assertSame(first, controller.activeBackend());
		assertEquals(1, controller.failedAttempts("a"));
	}

	@Test
	void a_failing_sink_does_not_stop_the_others() throws Exception {
		controller.addSink(s -> {
			throw new IllegalStateException("disk full");
		});
		List<MetricsSnapshot> second = new CopyOnWriteArrayList<>();
		controller.addSink(second::add);
		controller.start(provider("a"));

		batch(good("a"));

		assertEquals(1, published.size());
		assertEquals(1, second.size());
	}

	@Test
	void backoff_doubles_up_to_the_cap() {
		assertEquals(Duration.ofMillis(1000), controller.backoffDelay(1));
		assertEquals(Duration.ofMillis(2000), controller.backoffDelay(2));
		assertEquals(Duration.ofMillis(4000), controller.backoffDelay(3));
		assertEquals(Duration.ofMillis(5000), controller.backoffDelay(4));
		assertEquals(Duration.ofMillis(5000), controller.backoffDelay(60));
	}

	@Test
	void backoff_overflow_returns_the_cap() {
		// (2^34 + 1) * 2^30 wraps to 2^30, a positive value under the cap
		Duration max = Duration.ofMillis(Long.MAX_VALUE);
		EvolutionController c = new EvolutionController(() -> db, new EvolutionThresholds(0.8, 0.8, 100, 2),
				Duration.ofMillis((1L << 34) + 1), max, clock);
		assertEquals(Duration.ofMillis((1L << 34) + 1), c.backoffDelay(1));
		assertEquals(max, c.backoffDelay(31));
		assertEquals(max, c.backoffDelay(500));
	}

	@Test
	void concurrent_reports_are_all_counted() throws Exception {
		EvolutionController c = new EvolutionController(() -> db, new EvolutionThresholds(0.8, 0.8, 100, 10_000),
				Duration.ofSeconds(1), Duration.ofSeconds(5), clock);
		c.start(provider("a"));

		int threads = 8;
		int perThread = 200;
		ExecutorService pool = Executors.newFixedThreadPool(threads);
		CountDownLatch go = new CountDownLatch(1);
		try {
			for (int t = 0; t < threads; t++) {
				pool.submit(() -> {
					go.await();
					for (int i = 0; i < perThread; i++) {
						c.reportOutcome(good("a"));
					}
					return null;
				});
			}
			go.countDown();
			pool.shutdown();
			assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
		} finally {
			pool.shutdownNow();
		}
		assertEquals(threads * perThread, c.window().getSamples());
		assertEquals(9L * threads * perThread, c.window().getTruePositives());
	}
}
