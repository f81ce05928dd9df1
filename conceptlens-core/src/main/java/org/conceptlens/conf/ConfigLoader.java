package org.conceptlens.conf;

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

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.conceptlens.evolution.EvolutionThresholds;
import org.conceptlens.util.Logger;

/**
 * Loads ConceptLens configuration from a {@code .properties} file.
 * <p>
 * By default, this loader reads <code>config/conceptlens.properties</code> from
 * the classpath. You can override this by setting the system property
 * <code>conceptlens.config</code> to a path, or by using the
 * {@link #ConfigLoader(Path)} constructor.
 *
 * <h3>Notes</h3>
 * <ul>
 * <li>Directory-like values are normalized to end with a trailing slash.</li>
 * <li>Numeric values that do not parse log a warning and fall back to their
 * default.</li>
 * <li>Use {@link #validate()} during startup to check for missing required
 * keys.</li>
 * </ul>
 */
public final class ConfigLoader {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/conceptlens.properties";

	/** System property to point to an external config file. */
	public static final String SYS_PROP_CONFIG_PATH = "conceptlens.config";

	// ---- Property keys --------------------------------------------------------
	static final String K_CONCEPT_CSV = "CONCEPT_CSV";
	static final String K_PATTERN_CSV = "PATTERN_CSV";
	static final String K_KEYWORD_CSV = "KEYWORD_CSV";
	static final String K_INPUT_PATH = "INPUT_PATH";
	static final String K_OUTPUT_PATH = "OUTPUT_PATH";

	// Matching
	static final String K_MAX_NAME_TOKENS = "MAX_NAME_TOKENS";
	static final String K_DEFAULT_MAX_GAP = "DEFAULT_MAX_GAP";
	static final String K_AMBIGUOUS_CONFIDENCE = "AMBIGUOUS_CONFIDENCE";
	static final String K_PREFER_PREFERRED_NAME = "PREFER_PREFERRED_NAME";
	static final String K_TYPE_PRIORITY = "TYPE_PRIORITY";

	// Semantic fallback
	static final String K_SEMANTIC_ENABLED = "SEMANTIC_ENABLED";
	static final String K_SEMANTIC_TOP_K = "SEMANTIC_TOP_K";
	static final String K_SEMANTIC_MIN_SIMILARITY = "SEMANTIC_MIN_SIMILARITY";
	static final String K_SEMANTIC_MAX_WINDOW_TOKENS = "SEMANTIC_MAX_WINDOW_TOKENS";
	static final String K_SEMANTIC_TIMEOUT_MS = "SEMANTIC_TIMEOUT_MS";

	// Evolution
	static final String K_EVOLUTION_BATCH_SIZE = "EVOLUTION_BATCH_SIZE";
	static final String K_EVOLUTION_MIN_RECALL = "EVOLUTION_MIN_RECALL";
	static final String K_EVOLUTION_MIN_PRECISION = "EVOLUTION_MIN_PRECISION";
	static final String K_EVOLUTION_MAX_LATENCY_MS = "EVOLUTION_MAX_LATENCY_MS";
	static final String K_EVOLUTION_BACKOFF_BASE_MS = "EVOLUTION_BACKOFF_BASE_MS";
	static final String K_EVOLUTION_BACKOFF_MAX_MS = "EVOLUTION_BACKOFF_MAX_MS";
	static final String K_METRICS_CSV = "METRICS_CSV";
	static final String K_GOLD_CSV = "GOLD_CSV";

	static final String K_PARALLEL_DOCUMENT_LIMIT = "PARALLEL_DOCUMENT_LIMIT";

	// --------------------------------------------------------------------------

	private final Properties properties = new Properties();

	/**
	 * Create a loader that reads the default classpath resource:
	 * {@value #DEFAULT_CLASSPATH_RESOURCE}. If a system property
	 * {@value #SYS_PROP_CONFIG_PATH} is set, it takes precedence and the file at
	 * that path is used instead.
	 */
	public ConfigLoader() {
		String external = System.getProperty(SYS_PROP_CONFIG_PATH);
		if (StringUtils.isNotBlank(external)) {
			Path p = Path.of(external.trim());
			if (Files.isReadable(p)) {
				loadFromFile(p);
				return;
			}
			Logger.warn("System property {} points to an unreadable path: {}", SYS_PROP_CONFIG_PATH, p);
		}
		loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
	}

	/**
	 * Create a loader that reads a specific file on disk.
	 *
	 * @throws IllegalArgumentException if the file is not readable
	 */
	public ConfigLoader(Path filePath) {
		if (filePath == null || !Files.isReadable(filePath)) {
			throw new IllegalArgumentException("Config file is null or not readable: " + filePath);
		}
		loadFromFile(filePath);
	}

	/** Wraps already loaded properties. */
	public ConfigLoader(Properties props) {
		properties.putAll(props);
	}

	// -------------------------- Public API -------------------------------------

	/**
	 * Checks keys the command line run needs and ranges of numeric keys. Does not
	 * throw.
	 *
	 * @return human-readable issues; empty when the configuration looks usable
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();
		if (StringUtils.isBlank(properties.getProperty(K_CONCEPT_CSV))
				&& StringUtils.isBlank(properties.getProperty(K_KEYWORD_CSV))) {
			issues.add("Missing required property: " + K_CONCEPT_CSV + " (or " + K_KEYWORD_CSV + ")");
		}
		requireNonBlank(K_INPUT_PATH, issues);
		requireNonBlank(K_OUTPUT_PATH, issues);

		String in = properties.getProperty(K_INPUT_PATH);
		String out = properties.getProperty(K_OUTPUT_PATH);
		if (StringUtils.isNotBlank(in) && normalizedDir(in).equals(normalizedDir(out))) {
			issues.add("OUTPUT_PATH must differ from INPUT_PATH.");
		}

		double minSim = getSemanticMinSimilarity();
		if (minSim < 0.0 || minSim > 1.0) {
			issues.add(K_SEMANTIC_MIN_SIMILARITY + " must be within [0,1]: " + minSim);
		}
		if (getDefaultMaxGap() < 0) {
			issues.add(K_DEFAULT_MAX_GAP + " must be >= 0");
		}
		if (getBackoffMax().compareTo(getBackoffBase()) < 0) {
			issues.add(K_EVOLUTION_BACKOFF_MAX_MS + " must be >= " + K_EVOLUTION_BACKOFF_BASE_MS);
		}
		return issues;
	}

	/** Concept name CSV (cui,name,name_status,type_ids,frequency); "" when unset. */
	public String getConceptCsv() {
		return getOptional(K_CONCEPT_CSV, "");
	}

	/** Combined pattern CSV; "" when unset. */
	public String getPatternCsv() {
		return getOptional(K_PATTERN_CSV, "");
	}

	/** Compact keyword ontology CSV; "" when unset. */
	public String getKeywordCsv() {
		return getOptional(K_KEYWORD_CSV, "");
	}

	/** Directory of {@code .txt} documents to annotate. */
	public String getInputPath() {
		return normalizedDir(getRequired(K_INPUT_PATH));
	}

	/** Directory that receives annotation output. */
	public String getOutputPath() {
		return normalizedDir(getRequired(K_OUTPUT_PATH));
	}

	/** Cap on dictionary n-gram length; 0 means the longest registered name. */
	public int getMaxNameTokens() {
		return getInt(K_MAX_NAME_TOKENS, 0);
	}

	public int getDefaultMaxGap() {
		return getInt(K_DEFAULT_MAX_GAP, 3);
	}

	public double getAmbiguousConfidence() {
		return getDouble(K_AMBIGUOUS_CONFIDENCE, 0.8);
	}

	public boolean isPreferPreferredName() {
		return Boolean.parseBoolean(getOptional(K_PREFER_PREFERRED_NAME, "true"));
	}

	/** Type tags, highest priority first. */
	public List<String> getTypePriority() {
		String raw = getOptional(K_TYPE_PRIORITY, "");
		return Arrays.stream(StringUtils.split(raw, ", ")).filter(StringUtils::isNotBlank)
				.collect(Collectors.toList());
	}

	public boolean isSemanticEnabled() {
		return Boolean.parseBoolean(getOptional(K_SEMANTIC_ENABLED, "false"));
	}

	public int getSemanticTopK() {
		return Math.max(1, getInt(K_SEMANTIC_TOP_K, 5));
	}

	public double getSemanticMinSimilarity() {
		return getDouble(K_SEMANTIC_MIN_SIMILARITY, 0.8);
	}

	public int getSemanticMaxWindowTokens() {
		return Math.max(1, getInt(K_SEMANTIC_MAX_WINDOW_TOKENS, 4));
	}

	public long getSemanticTimeoutMillis() {
		return Math.max(1L, getInt(K_SEMANTIC_TIMEOUT_MS, 250));
	}

	public EvolutionThresholds getEvolutionThresholds() {
		return new EvolutionThresholds(getDouble(K_EVOLUTION_MIN_RECALL, 0.9), getDouble(K_EVOLUTION_MIN_PRECISION, 0.9),
				getDouble(K_EVOLUTION_MAX_LATENCY_MS, 50.0), Math.max(1, getInt(K_EVOLUTION_BATCH_SIZE, 50)));
	}

	public Duration getBackoffBase() {
		return Duration.ofMillis(Math.max(1, getInt(K_EVOLUTION_BACKOFF_BASE_MS, 1000)));
	}

	public Duration getBackoffMax() {
		return Duration.ofMillis(Math.max(1, getInt(K_EVOLUTION_BACKOFF_MAX_MS, 300_000)));
	}

	/** Optional metrics CSV path; "" when unset. */
	public String getMetricsCsv() {
		return getOptional(K_METRICS_CSV, "");
	}

	/**
	 * Optional reference annotations ({@code doc_id,start,end,cui,types}) used to
	 * score documents for backend evolution; "" when unset.
	 */
	public String getGoldCsv() {
		return getOptional(K_GOLD_CSV, "");
	}

	/**
	 * Documents annotated in parallel. Defaults to ~25% of available cores;
	 * never exceeds the core count.
	 */
	public int getParallelDocumentLimit() {
		int cores = Math.max(1, Runtime.getRuntime().availableProcessors());
		int defaultLimit = Math.max(1, (int) Math.floor(cores / 4.0));

		String raw = getOptional(K_PARALLEL_DOCUMENT_LIMIT, null);
		if (raw != null) {
			try {
				int val = Integer.parseInt(raw);
				if (val <= 0)
					return defaultLimit;
				return Math.min(val, cores);
			} catch (NumberFormatException nfe) {
				Logger.warn("Invalid integer for parallel limit: '{}'. Using default {}", raw, defaultLimit);
			}
		}
		return defaultLimit;
	}

	// -------------------------- Internals --------------------------------------

	private void loadFromClasspath(String resource) {
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				Logger.error("Unable to find resource on classpath: {}", resource);
				return;
			}
			properties.load(in);
		} catch (IOException ex) {
			Logger.error("Failed to load properties from classpath: {}", ex, resource);
		}
	}

	private void loadFromFile(Path file) {
		try (InputStream in = new FileInputStream(file.toFile())) {
			properties.load(in);
		} catch (IOException ex) {
			Logger.error("Failed to load properties from file: {}", ex, file);
		}
	}

	private String getRequired(String key) {
		String v = getOptional(key, null);
		if (v == null) {
			throw new IllegalStateException("Missing required property: " + key);
		}
		return v;
	}

	private String getOptional(String key, String defaultVal) {
		String v = properties.getProperty(key);
		if (v == null)
			return defaultVal;
		v = v.trim();
		return v.isEmpty() ? defaultVal : v;
	}

	private int getInt(String key, int defaultVal) {
		String raw = getOptional(key, null);
		if (raw == null)
			return defaultVal;
		try {
			return Integer.parseInt(raw);
		} catch (NumberFormatException nfe) {
			Logger.warn("Invalid integer for {}: '{}'. Using default {}", key, raw, defaultVal);
			return defaultVal;
		}
	}

	private double getDouble(String key, double defaultVal) {
		String raw = getOptional(key, null);
		if (raw == null)
			return defaultVal;
		try {
			return Double.parseDouble(raw);
		} catch (NumberFormatException nfe) {
			Logger.warn("Invalid number for {}: '{}'. Using default {}", key, raw, defaultVal);
			return defaultVal;
		}
	}

	private static String normalizedDir(String path) {
		if (path == null || path.isBlank())
			return path;
		String p = path.trim();
		if (!p.endsWith("/"))
			p = p + "/";
		return p;
	}

	private void requireNonBlank(String key, List<String> issues) {
		if (StringUtils.isBlank(properties.getProperty(key))) {
			issues.add("Missing required property: " + key);
		}
	}
}
