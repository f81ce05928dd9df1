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
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.conceptlens.om.CombinedPattern;
import org.conceptlens.om.ConceptRecord;
import org.conceptlens.util.Logger;

/**
 * Reads concept database sources from CSV.
 *
 * <h3>Concept file</h3> Header {@code cui,name,name_status,type_ids,frequency};
 * {@code name_status} {@code P} marks the preferred name, {@code type_ids} may
 * hold several tags separated by {@code |}, {@code frequency} is optional.
 *
 * <h3>Pattern file</h3> Header {@code cui,name,components,max_gap}; components
 * are separated by the {@value #COMBINED_HINT_MARKER} marker. A blank
 * {@code max_gap} takes the default gap.
 *
 * Rows without an identifier, or with an unparsable number, are skipped with a
 * warning and counted in {@link #getSkippedRows()}. Pattern rows with fewer
 * than two components are kept so that {@link ConceptDatabase#build} rejects
 * them.
 */
public class ConceptSourceLoader {

	public static final String COMBINED_HINT_MARKER = "[combined_hint]";
	public static final String MULTI_VALUE_DELIM = "|";

	private static final Pattern MARKER_SPLIT = Pattern.compile("\\s*" + Pattern.quote(COMBINED_HINT_MARKER) + "\\s*");

	private static final CSVFormat HEADER_CSV = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true)
			.setIgnoreHeaderCase(true).setTrim(true).setIgnoreEmptyLines(true).build();

	private int skippedRows;

	public List<ConceptRecord> loadConcepts(Path file) {
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			return loadConcepts(reader, file.toString());
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to read concept file " + file, e);
		}
	}

	public List<ConceptRecord> loadConcepts(Reader reader, String sourceName) {
		List<ConceptRecord> out = new ArrayList<>();
		try (CSVParser csv = new CSVParser(reader, HEADER_CSV)) {
			for (CSVRecord rec : csv) {
				String cui = column(rec, "cui");
				String name = column(rec, "name");
				if (cui.isEmpty() || name.isEmpty()) {
					skip(sourceName, rec, "missing cui or name");
					continue;
				}
				long frequency;
				try {
					String f = column(rec, "frequency");
					frequency = f.isEmpty() ? 0L : Long.parseLong(f);
				} catch (NumberFormatException nfe) {
					skip(sourceName, rec, "unparsable frequency");
					continue;
				}
				boolean preferred = "P".equalsIgnoreCase(column(rec, "name_status"));
				out.add(new ConceptRecord(cui, name, preferred, splitMulti(column(rec, "type_ids")), frequency));
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to parse concept source " + sourceName, e);
		}
		Logger.info("Loaded {} concept name rows from {}", out.size(), sourceName);
		return out;
	}

	public List<CombinedPattern> loadPatterns(Path file, int defaultMaxGap) {
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			return loadPatterns(reader, file.toString(), defaultMaxGap);
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to read pattern file " + file, e);
		}
	}

	public List<CombinedPattern> loadPatterns(Reader reader, String sourceName, int defaultMaxGap) {
		List<CombinedPattern> out = new ArrayList<>();
		try (CSVParser csv = new CSVParser(reader, HEADER_CSV)) {
			for (CSVRecord rec : csv) {
				String cui = column(rec, "cui");
				List<String> components = splitComponents(column(rec, "components"));
				if (cui.isEmpty()) {
					skip(sourceName, rec, "missing cui");
					continue;
				}
				int maxGap;
				try {
					String g = column(rec, "max_gap");
					maxGap = g.isEmpty() ? defaultMaxGap : Integer.parseInt(g);
				} catch (NumberFormatException nfe) {
					skip(sourceName, rec, "unparsable max_gap");
					continue;
				}
				String name = column(rec, "name");
				out.add(new CombinedPattern(cui, name.isEmpty() ? String.join(" ", components) : name, components,
						maxGap));
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to parse pattern source " + sourceName, e);
		}
		Logger.info("Loaded {} combined patterns from {}", out.size(), sourceName);
		return out;
	}

	/**
	 * Splits a hint on {@value #COMBINED_HINT_MARKER}; blank parts are dropped.
	 * A hint without the marker yields one component.
	 */
	public static List<String> splitComponents(String hint) {
		if (StringUtils.isBlank(hint))
			return new ArrayList<>();
		return Arrays.stream(MARKER_SPLIT.split(hint.trim())).map(String::trim).filter(StringUtils::isNotEmpty)
				.collect(Collectors.toList());
	}

	/** Splits a {@code |}-separated multi-value cell, dropping blanks. */
	public static List<String> splitMulti(String cell) {
		if (StringUtils.isBlank(cell))
			return new ArrayList<>();
		return Arrays.stream(StringUtils.split(cell, MULTI_VALUE_DELIM)).map(String::trim)
				.filter(StringUtils::isNotEmpty).collect(Collectors.toList());
	}

	public int getSkippedRows() {
		return skippedRows;
	}

	static String column(CSVRecord rec, String name) {
		if (!rec.isMapped(name) || !rec.isSet(name))
			return "";
		return StringUtils.trimToEmpty(rec.get(name));
	}

	private void skip(String sourceName, CSVRecord rec, String why) {
		skippedRows++;
		Logger.warn("Skipping row {} of {}: {}", rec.getRecordNumber(), sourceName, why);
	}
}
