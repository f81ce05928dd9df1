package org.conceptlens;

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
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.lang3.StringUtils;
import org.conceptlens.cdb.ConceptDatabase;
import org.conceptlens.cdb.ConceptSourceLoader;
import org.conceptlens.cdb.KeywordHintExpander;
import org.conceptlens.conf.ConfigLoader;
import org.conceptlens.eval.EntityDetectionValidator;
import org.conceptlens.eval.GoldStandardLoader;
import org.conceptlens.evolution.CsvMetricsSink;
import org.conceptlens.evolution.EvolutionController;
import org.conceptlens.evolution.LoggingMetricsSink;
import org.conceptlens.nlp.DocumentTokenizer;
import org.conceptlens.nlp.HashedCharNGramEmbedder;
import org.conceptlens.om.Annotation;
import org.conceptlens.om.CombinedPattern;
import org.conceptlens.om.ConceptRecord;
import org.conceptlens.om.GoldAnnotation;
import org.conceptlens.om.TokenizedDocument;
import org.conceptlens.processing.AnnotationResult;
import org.conceptlens.processing.BatchAnnotator;
import org.conceptlens.processing.ConceptAnnotator;
import org.conceptlens.processing.DocumentOutcome;
import org.conceptlens.semantic.NGramWindowStrategy;
import org.conceptlens.semantic.SemanticFallback;
import org.conceptlens.semantic.VectorIndexBackend;
import org.conceptlens.util.Logger;

/**
 * Command line entry point: builds the concept database from the configured
 * CSV sources, annotates every {@code .txt} file under {@code INPUT_PATH} and
 * writes {@code annotations.csv} to {@code OUTPUT_PATH}.
 */
public class ConceptLensMain {

	static final String OUTPUT_FILE = "annotations.csv";
	static final String[] OUTPUT_HEADER = { "doc_id", "start", "end", "cui", "preferred_name", "confidence", "source",
			"text" };
	static final String DEFAULT_BACKEND_ID = "char-ngram";

	private final ConfigLoader cfg;

	public ConceptLensMain(ConfigLoader cfg) {
		this.cfg = cfg;
	}

	public static void main(String[] args) {
		ConfigLoader cfg = new ConfigLoader();
		List<String> issues = cfg.validate();
		if (!issues.isEmpty()) {
			issues.forEach(i -> Logger.error(i));
			System.exit(1);
		}
		new ConceptLensMain(cfg).run();
	}

	void run() {
		DocumentTokenizer tokenizer = new DocumentTokenizer();
		ConceptDatabase db = loadDatabase(cfg, tokenizer);

		ConceptAnnotator.Builder builder = ConceptAnnotator.builder(db).maxNameTokens(cfg.getMaxNameTokens())
				.ambiguousConfidence(cfg.getAmbiguousConfidence()).preferPreferredName(cfg.isPreferPreferredName())
				.typePriority(cfg.getTypePriority());

		Map<String, List<GoldAnnotation>> gold = null;
		if (StringUtils.isNotBlank(cfg.getGoldCsv())) {
			if (cfg.isSemanticEnabled())
				gold = new GoldStandardLoader().load(Path.of(cfg.getGoldCsv()));
			else
				Logger.warn("GOLD_CSV is ignored while SEMANTIC_ENABLED is false");
		}

		SemanticFallback fallback = null;
		CsvMetricsSink csvSink = null;
		Consumer<AnnotationResult> listener = r -> {
		};
		if (cfg.isSemanticEnabled()) {
			EvolutionController controller = new EvolutionController(() -> db, cfg.getEvolutionThresholds(),
					cfg.getBackoffBase(), cfg.getBackoffMax());
			controller.addSink(new LoggingMetricsSink());
			if (StringUtils.isNotBlank(cfg.getMetricsCsv())) {
				csvSink = new CsvMetricsSink(Path.of(cfg.getMetricsCsv()));
				controller.addSink(csvSink);
			}
			controller.start(VectorIndexBackend.provider(DEFAULT_BACKEND_ID, new HashedCharNGramEmbedder()));
			fallback = new SemanticFallback(new NGramWindowStrategy(cfg.getSemanticMaxWindowTokens()),
					cfg.getSemanticTopK(), cfg.getSemanticMinSimilarity(), cfg.getSemanticTimeoutMillis());
			builder.semantic(fallback, controller::activeBackend);
			if (gold != null)
				listener = outcomeReporter(controller, new EntityDetectionValidator(db), gold);
		}

		try {
			List<TokenizedDocument> docs = readDocuments(Path.of(cfg.getInputPath()), tokenizer);
			Logger.info("Documents to annotate: {}", docs.size());

			BatchAnnotator batch = new BatchAnnotator(builder.build(), cfg.getParallelDocumentLimit(), listener);
			List<DocumentOutcome> outcomes = batch.annotateAll(docs);

			Path out = Path.of(cfg.getOutputPath()).resolve(OUTPUT_FILE);
			int rows = writeAnnotations(out, outcomes, docs, db);
			Logger.info("Wrote {} annotations to {}", rows, out);
		} finally {
			if (fallback != null)
				fallback.close();
			closeQuietly(csvSink);
		}
		Logger.info("End");
	}

	/**
	 * Scores each annotated document that has reference annotations and reports
	 * the result to the controller. Documents without reference annotations, or
	 * annotated without a semantic backend, are not reported.
	 */
	static Consumer<AnnotationResult> outcomeReporter(EvolutionController controller,
			EntityDetectionValidator validator, Map<String, List<GoldAnnotation>> gold) {
		Logger.info("Scoring {} labelled documents for backend evolution", gold.size());
		return r -> {
			List<GoldAnnotation> expected = gold.get(r.getDocumentId());
			if (expected == null || r.getBackendId() == null)
				return;
			controller.reportOutcome(
					validator.toSample(r.getBackendId(), r.getAnnotations(), expected, r.getElapsedMillis()));
		};
	}

	/** Builds the database from CONCEPT_CSV, PATTERN_CSV and KEYWORD_CSV. */
	static ConceptDatabase loadDatabase(ConfigLoader cfg, DocumentTokenizer tokenizer) {
		List<ConceptRecord> records = new ArrayList<>();
		List<CombinedPattern> patterns = new ArrayList<>();
		ConceptSourceLoader loader = new ConceptSourceLoader();

		if (StringUtils.isNotBlank(cfg.getConceptCsv())) {
			records.addAll(loader.loadConcepts(Path.of(cfg.getConceptCsv())));
		}
		if (StringUtils.isNotBlank(cfg.getPatternCsv())) {
			patterns.addAll(loader.loadPatterns(Path.of(cfg.getPatternCsv()), cfg.getDefaultMaxGap()));
		}
		if (StringUtils.isNotBlank(cfg.getKeywordCsv())) {
			KeywordHintExpander expander = new KeywordHintExpander(cfg.getDefaultMaxGap())
					.expand(Path.of(cfg.getKeywordCsv()));
			records.addAll(expander.getRecords());
			patterns.addAll(expander.getPatterns());
		}
		if (loader.getSkippedRows() > 0) {
			Logger.warn("Skipped {} malformed source rows", loader.getSkippedRows());
		}
		return ConceptDatabase.build(records, patterns, tokenizer::tokenizeName);
	}

	static List<TokenizedDocument> readDocuments(Path dir, DocumentTokenizer tokenizer) {
		List<Path> files;
		try (Stream<Path> s = Files.list(dir)) {
			files = s.filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".txt")).sorted()
					.collect(Collectors.toList());
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to list input directory " + dir, e);
		}
		List<TokenizedDocument> docs = new ArrayList<>(files.size());
		for (Path f : files) {
			try {
				String name = f.getFileName().toString();
				docs.add(tokenizer.tokenize(name.substring(0, name.length() - 4), Files.readString(f, StandardCharsets.UTF_8)));
			} catch (IOException e) {
				Logger.warn("Skipping unreadable document {}", e, f);
			}
		}
		return docs;
	}

	/** @return number of annotation rows written */
	static int writeAnnotations(Path out, List<DocumentOutcome> outcomes, List<TokenizedDocument> docs,
			ConceptDatabase db) {
		int rows = 0;
		try {
			if (out.getParent() != null)
				Files.createDirectories(out.getParent());
			try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8);
					CSVPrinter printer = new CSVPrinter(w, CSVFormat.DEFAULT.builder().setHeader(OUTPUT_HEADER).build())) {
				for (int i = 0; i < outcomes.size(); i++) {
					DocumentOutcome o = outcomes.get(i);
					if (!o.isSuccess())
						continue;
					TokenizedDocument doc = docs.get(i);
					for (Annotation a : o.getResult().getAnnotations()) {
						String text = (doc.getText() == null) ? a.getMatchedText()
								: doc.getText().substring(a.getStartChar(), a.getEndChar());
						printer.printRecord(o.getDocumentId(), a.getStartChar(), a.getEndChar(), a.getConceptId(),
								db.preferredName(a.getConceptId()), String.format(Locale.ROOT, "%.4f", a.getConfidence()),
								a.getSource(), text);
						rows++;
					}
				}
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to write annotations to " + out, e);
		}
		return rows;
	}

	private static void closeQuietly(CsvMetricsSink sink) {
		if (sink == null)
			return;
		try {
			sink.close();
		} catch (IOException e) {
			Logger.warn("Unable to close metrics sink", e);
		}
	}
}
