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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import org.conceptlens.cdb.ConceptDatabase;
import org.conceptlens.evolution.MetricsSnapshot.Decision;
import org.conceptlens.semantic.BackendUnavailableException;
import org.conceptlens.semantic.DisabledSemanticBackend;
import org.conceptlens.semantic.SemanticBackend;
import org.conceptlens.semantic.SemanticBackendProvider;
import org.conceptlens.util.Logger;

/**
 * Chooses which semantic backend is active, based on the outcomes callers
 * report.
 * <p>
 * While {@link EvolutionPhase#EVALUATING}, samples for the active backend
 * accumulate in a {@link MetricsWindow}. When a batch is complete the window is
 * checked against the {@link EvolutionThresholds}: a pass makes the backend
 * {@link EvolutionPhase#STABLE}; a miss activates the next registered provider
 * (registration order, round robin) that is not backing off. Every swap starts
 * a fresh window, and samples tagged with any other backend are dropped, so a
 * window never mixes backends.
 * <p>
 * A provider that fails to create its backend is retried only after
 * {@code base * 2^(attempts-1)} (capped) has elapsed; meanwhile the previous
 * backend stays active.
 * <p>
 * All state lives in one immutable {@link ControllerState} behind an
 * {@link AtomicReference}. Readers take a single snapshot; writers serialize on
 * one lock. Backend creation happens under that lock, which blocks other
 * writers but never readers.
 */
public class EvolutionController {

	private final Object writeLock = new Object();
	private final AtomicReference<ControllerState> state;

	private final Map<String, SemanticBackendProvider> providers = new LinkedHashMap<>();
	private final Supplier<ConceptDatabase> database;
	private final EvolutionThresholds thresholds;
	private final Duration backoffBase;
	private final Duration backoffMax;
	private final Clock clock;
	private final List<MetricsSink> sinks = new CopyOnWriteArrayList<>();

	public EvolutionController(Supplier<ConceptDatabase> database, EvolutionThresholds thresholds,
			Duration backoffBase, Duration backoffMax, Clock clock) {
		this.database = database;
		this.thresholds = thresholds;
		this.backoffBase = backoffBase;
		this.backoffMax = backoffMax;
		this.clock = clock;
		this.state = new AtomicReference<>(ControllerState.initial(DisabledSemanticBackend.INSTANCE));
	}

	public EvolutionController(Supplier<ConceptDatabase> database, EvolutionThresholds thresholds,
			Duration backoffBase, Duration backoffMax) {
		this(database, thresholds, backoffBase, backoffMax, Clock.systemUTC());
	}

	public void addSink(MetricsSink sink) {
		sinks.add(sink);
	}

	// -------------------------- Readers -----------------------------------------

	/** Id of the active backend. */
	public String currentBackend() {
		return state.get().backend.id();
	}

	/** The active backend; callers keep this reference for the whole document. */
	public SemanticBackend activeBackend() {
		return state.get().backend;
	}

	public EvolutionPhase phase() {
		return state.get().phase;
	}

	public MetricsWindow window() {
		return state.get().window;
	}

	/** When {@code providerId} may next be tried, or null if it is not backing off. */
	public Instant nextRetryAt(String providerId) {
		FailureRecord f = state.get().failures.get(providerId);
		return (f == null) ? null : f.nextRetryAt;
	}

	public int failedAttempts(String providerId) {
		FailureRecord f = state.get().failures.get(providerId);
		return (f == null) ? 0 : f.attempts;
	}

	// -------------------------- Writers -----------------------------------------

	/**
	 * Registers {@code initial} and tries to activate it. On failure the
	 * controller runs with the disabled backend and the provider backs off.
	 */
	public void start(SemanticBackendProvider initial) {
		synchronized (writeLock) {
			register(initial);
			ControllerState st = state.get();
			Map<String, FailureRecord> failures = new HashMap<>(st.failures);
			SemanticBackend backend = tryCreate(initial, failures);
			if (backend == null) {
				backend = DisabledSemanticBackend.INSTANCE;
			}
			state.set(new ControllerState(EvolutionPhase.EVALUATING, backend, MetricsWindow.empty(backend.id()),
					failures));
			Logger.info("Evolution controller started with backend '{}'", backend.id());
		}
	}

	/**
	 * Adds a provider to the rotation. A stable controller returns to
	 * evaluating so the new provider can be reached.
	 */
	public void registerProvider(SemanticBackendProvider provider) {
		synchronized (writeLock) {
			register(provider);
			if (state.get().phase == EvolutionPhase.STABLE) {
				reevaluate("provider '" + provider.id() + "' registered");
			}
		}
	}

	/** Moves a stable controller back to evaluating. No-op while evaluating. */
	public void triggerReevaluation(String reason) {
		synchronized (writeLock) {
			if (state.get().phase == EvolutionPhase.STABLE) {
				reevaluate(reason);
			}
		}
	}

	/**
	 * Rebuilds the active backend from its provider, typically after the concept
	 * database was replaced, and starts a fresh evaluation. If the rebuild fails
	 * the current backend stays active and the provider backs off.
	 */
	public void refreshBackend(String reason) {
		synchronized (writeLock) {
			ControllerState st = state.get();
			SemanticBackendProvider provider = providers.get(st.backend.id());
			Map<String, FailureRecord> failures = new HashMap<>(st.failures);
			SemanticBackend rebuilt = (provider == null) ? null : tryCreate(provider, failures);
			SemanticBackend backend = (rebuilt == null) ? st.backend : rebuilt;
			state.set(new ControllerState(EvolutionPhase.EVALUATING, backend, MetricsWindow.empty(backend.id()),
					failures));
			Logger.info("Re-evaluating backend '{}' ({}): {}", backend.id(), (rebuilt == null) ? "kept" : "rebuilt",
					reason);
		}
	}

	/**
	 * Adds one outcome to the active backend's window and, once a batch is
	 * complete, decides whether to promote, swap or keep evaluating.
	 */
	public void reportOutcome(MetricsSample sample) {
		synchronized (writeLock) {
			ControllerState st = state.get();
			if (!st.backend.id().equals(sample.getBackendId())) {
				Logger.debug("Dropping sample for backend '{}'; active backend is '{}'", sample.getBackendId(),
						st.backend.id());
				return;
			}
			MetricsWindow w = st.window.plus(sample);
			if (Logger.isEnabled(Logger.Level.DEBUG)) {
				Logger.debug("Backend '{}' window {}/{}: precision {}, recall {}, mean latency {} ms", st.backend.id(),
						w.getSamples(), thresholds.getBatchSize(), w.precision(), w.recall(), w.meanLatencyMillis());
			}
			if (w.getSamples() < thresholds.getBatchSize()) {
				state.set(st.withWindow(w));
				return;
			}

			Instant now = clock.instant();
			if (st.phase == EvolutionPhase.STABLE) {
				state.set(st.withWindow(MetricsWindow.empty(st.backend.id())));
				publish(MetricsSnapshot.of(now, w, st.backend.id(), EvolutionPhase.STABLE, Decision.MONITORED));
				return;
			}

			if (thresholds.isMetBy(w)) {
				state.set(new ControllerState(EvolutionPhase.STABLE, st.backend, MetricsWindow.empty(st.backend.id()),
						st.failures));
				Logger.info("Backend '{}' met thresholds (precision {}, recall {}); now stable", st.backend.id(),
						w.precision(), w.recall());
				publish(MetricsSnapshot.of(now, w, st.backend.id(), EvolutionPhase.STABLE, Decision.PROMOTED));
				return;
			}

			Map<String, FailureRecord> failures = new HashMap<>(st.failures);
			SemanticBackend next = nextAvailable(st.backend.id(), failures, now);
			if (next != null) {
				state.set(new ControllerState(EvolutionPhase.EVALUATING, next, MetricsWindow.empty(next.id()),
						failures));
				Logger.info("Backend '{}' missed thresholds (precision {}, recall {}, latency {} ms); switched to '{}'",
						st.backend.id(), w.precision(), w.recall(), w.meanLatencyMillis(), next.id());
				publish(MetricsSnapshot.of(now, w, next.id(), EvolutionPhase.EVALUATING, Decision.SWAPPED));
			} else {
				state.set(new ControllerState(EvolutionPhase.EVALUATING, st.backend,
						MetricsWindow.empty(st.backend.id()), failures));
				Logger.info("Backend '{}' missed thresholds and no alternative is available; evaluating again",
						st.backend.id());
				publish(MetricsSnapshot.of(now, w, st.backend.id(), EvolutionPhase.EVALUATING, Decision.RETAINED));
			}
		}
	}

	// -------------------------- Internals ---------------------------------------

	private void register(SemanticBackendProvider provider) {
		if (providers.containsKey(provider.id())) {
			throw new IllegalArgumentException("Provider already registered: " + provider.id());
		}
		providers.put(provider.id(), provider);
	}

	private void reevaluate(String reason) {
		ControllerState st = state.get();
		state.set(new ControllerState(EvolutionPhase.EVALUATING, st.backend, MetricsWindow.empty(st.backend.id()),
				st.failures));
		Logger.info("Re-evaluating backend '{}': {}", st.backend.id(), reason);
	}

	/** Tries providers after {@code currentId} in registration order, wrapping around. */
	private SemanticBackend nextAvailable(String currentId, Map<String, FailureRecord> failures, Instant now) {
		List<String> ids = new ArrayList<>(providers.keySet());
		int at = ids.indexOf(currentId);
		for (int step = 1; step <= ids.size(); step++) {
			int idx = (at < 0) ? step - 1 : (at + step) % ids.size();
			String id = ids.get(idx);
			if (id.equals(currentId))
				continue;
			FailureRecord f = failures.get(id);
			if (f != null && now.isBefore(f.nextRetryAt)) {
				Logger.debug("Provider '{}' backing off until {}", id, f.nextRetryAt);
				continue;
			}
			SemanticBackend b = tryCreate(providers.get(id), failures);
			if (b != null)
				return b;
		}
		return null;
	}

	private SemanticBackend tryCreate(SemanticBackendProvider provider, Map<String, FailureRecord> failures) {
		try {
			SemanticBackend b = provider.create(database.get());
			failures.remove(provider.id());
			return b;
		} catch (BackendUnavailableException | RuntimeException e) {
			FailureRecord prev = failures.get(provider.id());
			int attempts = (prev == null) ? 1 : prev.attempts + 1;
			Instant retryAt = clock.instant().plus(backoffDelay(attempts));
			failures.put(provider.id(), new FailureRecord(attempts, retryAt));
			Logger.warn("Semantic backend '{}' unavailable (attempt {}), next retry at {}", e, provider.id(), attempts,
					retryAt);
			return null;
		}
	}

	/** {@code base * 2^(attempts-1)}, capped at the configured maximum. */
	Duration backoffDelay(int attempts) {
		int shift = Math.min(Math.max(0, attempts - 1), 62);
		long millis;
		try {
			millis = Math.multiplyExact(backoffBase.toMillis(), 1L << shift);
		} catch (ArithmeticException overflow) {
			return backoffMax;
		}
		if (millis > backoffMax.toMillis())
			return backoffMax;
		return Duration.ofMillis(millis);
	}

	private void publish(MetricsSnapshot snapshot) {
		for (MetricsSink sink : sinks) {
			try {
				sink.publish(snapshot);
			} catch (RuntimeException e) {
				Logger.warn("Metrics sink {} failed", e, sink.getClass().getSimpleName());
			}
		}
	}

	// -------------------------- State -------------------------------------------

	static final class FailureRecord {
		final int attempts;
		final Instant nextRetryAt;

		FailureRecord(int attempts, Instant nextRetryAt) {
			this.attempts = attempts;
			this.nextRetryAt = nextRetryAt;
		}
	}

	static final class ControllerState {
		final EvolutionPhase phase;
		final SemanticBackend backend;
		final MetricsWindow window;
		final Map<String, FailureRecord> failures;

		ControllerState(EvolutionPhase phase, SemanticBackend backend, MetricsWindow window,
				Map<String, FailureRecord> failures) {
			this.phase = phase;
			this.backend = backend;
			this.window = window;
			this.failures = Collections.unmodifiableMap(new HashMap<>(failures));
		}

		static ControllerState initial(SemanticBackend backend) {
			return new ControllerState(EvolutionPhase.EVALUATING, backend, MetricsWindow.empty(backend.id()),
					Collections.emptyMap());
		}

		ControllerState withWindow(MetricsWindow w) {
			return new ControllerState(phase, backend, w, failures);
		}
	}
}
