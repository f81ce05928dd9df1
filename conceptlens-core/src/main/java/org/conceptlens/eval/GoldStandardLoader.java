package org.conceptlens.eval;

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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.conceptlens.cdb.ConceptSourceLoader;
import org.conceptlens.om.GoldAnnotation;
import org.conceptlens.util.Logger;

/**
 * Reads reference annotations, header {@code doc_id,start,end,cui,types}, with
 * {@code types} separated by {@code |}. Rows with a missing id, a bad offset
 * or {@code start >= end} are skipped with a warning.
 */
public class GoldStandardLoader {

	private static final CSVFormat HEADER_CSV = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true)
			.setIgnoreHeaderCase(true).setTrim(true).setIgnoreEmptyLines(true).build();

	private int skippedRows;

	/** Reference annotations keyed by document id, in file order. */
	public Map<String, List<GoldAnnotation>> load(Path file) {
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			return load(reader, file.toString());
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to read gold file " + file, e);
		}
	}

	public Map<String, List<GoldAnnotation>> load(Reader reader, String sourceName) {
		Map<String, List<GoldAnnotation>> out = new LinkedHashMap<>();
		int rows = 0;
		try (CSVParser csv = new CSVParser(reader, HEADER_CSV)) {
			for (CSVRecord rec : csv) {
				String docId = column(rec, "doc_id");
				String cui = column(rec, "cui");
				if (docId.isEmpty() || cui.isEmpty()) {
					skip(sourceName, rec, "missing doc_id or cui");
					continue;
				}
				int start;
				int end;
				try {
					start = Integer.parseInt(column(rec, "start"));
					end = Integer.parseInt(column(rec, "end"));
				} catch (NumberFormatException nfe) {
					skip(sourceName, rec, "unparsable offset");
					continue;
				}
				if (start < 0 || start >= end) {
					skip(sourceName, rec, "empty or negative span");
					continue;
				}
				out.computeIfAbsent(docId, k -> new ArrayList<>()).add(new GoldAnnotation(start, end, cui,
						new LinkedHashSet<>(ConceptSourceLoader.splitMulti(column(rec, "types")))));
				rows++;
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to parse gold source " + sourceName, e);
		}
		Logger.info("Loaded {} gold annotations for {} documents from {}", rows, out.size(), sourceName);
		return out;
	}

	public int getSkippedRows() {
		return skippedRows;
	}

	private static String column(CSVRecord rec, String name) {
		if (!rec.isMapped(name) || !rec.isSet(name))
			return "";
		return StringUtils.trimToEmpty(rec.get(name));
	}

	private void skip(String sourceName, CSVRecord rec, String why) {
		skippedRows++;
		Logger.warn("Skipping row {} of {}: {}", rec.getRecordNumber(), sourceName, why);
	}
}
