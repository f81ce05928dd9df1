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

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.conceptlens.om.CombinedPattern;
import org.conceptlens.om.ConceptRecord;
import org.conceptlens.util.Logger;

/**
 * Expands a compact keyword ontology (one row per concept:
 * {@code uid,keyword,cluster,cluster_title,source,keyword_hints}) into concept
 * database sources.
 * <ul>
 * <li>the keyword becomes the preferred name;</li>
 * <li>each {@code |}-separated hint becomes a synonym, with the combined-hint
 * marker replaced by a space; names already seen for the concept
 * (case-insensitive) are skipped;</li>
 * <li>each hint with two or more marker-separated parts also becomes a
 * {@link CombinedPattern} with the configured gap.</li>
 * </ul>
 * The cluster id is the concept's type tag.
 */
public class KeywordHintExpander {

	private static final CSVFormat HEADER_CSV = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true)
			.setIgnoreHeaderCase(true).setTrim(true).setIgnoreEmptyLines(true).build();

	private final int maxGap;
	private final List<ConceptRecord> records = new ArrayList<>();
	private final List<CombinedPattern> patterns = new ArrayList<>();

	public KeywordHintExpander(int maxGap) {
		if (maxGap < 0)
			throw new IllegalArgumentException("maxGap must be >= 0");
		this.maxGap = maxGap;
	}

	public KeywordHintExpander expand(Path file) {
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			return expand(reader, file.toString());
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to read keyword file " + file, e);
		}
	}

	public KeywordHintExpander expand(Reader reader, String sourceName) {
		int rows = 0;
		try (CSVParser csv = new CSVParser(reader, HEADER_CSV)) {
			for (CSVRecord rec : csv) {
				String uid = ConceptSourceLoader.column(rec, "uid");
				if (uid.isEmpty()) {
					Logger.warn("Skipping row {} of {}: missing uid", rec.getRecordNumber(), sourceName);
					continue;
				}
				expandRow(uid, ConceptSourceLoader.column(rec, "keyword"), ConceptSourceLoader.column(rec, "cluster"),
						ConceptSourceLoader.column(rec, "keyword_hints"));
				rows++;
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to parse keyword source " + sourceName, e);
		}
		Logger.info("Expanded {} keyword rows from {} into {} names and {} patterns", rows, sourceName,
				records.size(), patterns.size());
		return this;
	}

	/** Expands one keyword row. */
	public void expandRow(String uid, String keyword, String cluster, String hintsField) {
		List<String> types = StringUtils.isBlank(cluster) ? new ArrayList<>() : List.of(cluster.trim());
		Set<String> seen = new HashSet<>();
		if (StringUtils.isNotBlank(keyword)) {
			records.add(new ConceptRecord(uid, keyword.trim(), true, types, 0L));
			seen.add(fold(keyword));
		}
		Set<List<String>> seenPatterns = new HashSet<>();
		for (String rawHint : ConceptSourceLoader.splitMulti(hintsField)) {
			List<String> parts = ConceptSourceLoader.splitComponents(rawHint);
			if (parts.isEmpty())
				continue;
			String cleaned = String.join(" ", parts);
			if (parts.size() > 1 && seenPatterns.add(parts)) {
				patterns.add(new CombinedPattern(uid, cleaned, parts, maxGap));
			}
			if (seen.add(fold(cleaned))) {
				records.add(new ConceptRecord(uid, cleaned, false, types, 0L));
			}
		}
	}

	public List<ConceptRecord> getRecords() {
		return records;
	}

	public List<CombinedPattern> getPatterns() {
		return patterns;
	}

	private static String fold(String s) {
		return StringUtils.normalizeSpace(s).toLowerCase(Locale.ROOT);
	}
}
