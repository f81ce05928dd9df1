package org.conceptlens.nlp;

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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.conceptlens.om.Token;
import org.conceptlens.om.TokenizedDocument;
import org.conceptlens.util.Logger;

import opennlp.tools.tokenize.SimpleTokenizer;
import opennlp.tools.tokenize.Tokenizer;
import opennlp.tools.tokenize.TokenizerME;
import opennlp.tools.tokenize.TokenizerModel;
import opennlp.tools.util.Span;

/**
 * Turns raw text into a {@link TokenizedDocument} with character offsets.
 * <p>
 * Uses OpenNLP's {@link TokenizerME} when a model is found at
 * {@value #DEFAULT_MODEL_PATH} (file system first, then classpath) or at the
 * path named by system property {@value #SYS_PROP_MODEL}; otherwise OpenNLP's
 * rule-based {@link SimpleTokenizer}. The same splitting is exposed for concept
 * names through {@link #tokenizeName(String)} so names and documents agree.
 */
public class DocumentTokenizer {

	public static final String DEFAULT_MODEL_PATH = "models/en-token.bin";
	public static final String SYS_PROP_MODEL = "conceptlens.tokenizer.model";

	private static final AtomicReference<TokenizerModel> MODEL_REF = new AtomicReference<>();

	// TokenizerME is not thread-safe; the model is
	private final ThreadLocal<Tokenizer> tokenizer;
	private final boolean modelBased;

	/** Model-based when a model can be found, rule-based otherwise. */
	public DocumentTokenizer() {
		TokenizerModel model = loadModel(System.getProperty(SYS_PROP_MODEL, DEFAULT_MODEL_PATH));
		if (model != null) {
			this.tokenizer = ThreadLocal.withInitial(() -> new TokenizerME(model));
			this.modelBased = true;
		} else {
			this.tokenizer = ThreadLocal.withInitial(() -> SimpleTokenizer.INSTANCE);
			this.modelBased = false;
		}
	}

	private DocumentTokenizer(boolean ignored) {
		this.tokenizer = ThreadLocal.withInitial(() -> SimpleTokenizer.INSTANCE);
		this.modelBased = false;
	}

	/** Rule-based tokenizer, no model lookup. */
	public static DocumentTokenizer simple() {
		return new DocumentTokenizer(false);
	}

	public boolean isModelBased() {
		return modelBased;
	}

	public TokenizedDocument tokenize(String id, String text) {
		List<Token> tokens = new ArrayList<>();
		if (text != null && !text.isEmpty()) {
			for (Span s : tokenizer.get().tokenizePos(text)) {
				tokens.add(new Token(text.substring(s.getStart(), s.getEnd()), s.getStart(), s.getEnd()));
			}
		}
		return new TokenizedDocument(id, text, tokens);
	}

	/** Name tokenizer for the concept database. */
	public String[] tokenizeName(String normalizedName) {
		return tokenizer.get().tokenize(normalizedName);
	}

	private static TokenizerModel loadModel(String path) {
		TokenizerModel m = MODEL_REF.get();
		if (m != null)
			return m;
		try (InputStream in = tryOpen(path)) {
			if (in == null)
				return null;
			TokenizerModel nm = new TokenizerModel(in);
			MODEL_REF.compareAndSet(null, nm);
			Logger.info("Loaded tokenizer model from {}", path);
			return MODEL_REF.get();
		} catch (IOException e) {
			Logger.warn("Unable to load tokenizer model {}; falling back to rule-based tokenization", e, path);
			return null;
		}
	}

	private static InputStream tryOpen(String path) throws IOException {
		Path p = Path.of(path);
		if (Files.isReadable(p))
			return new FileInputStream(p.toFile());
		return DocumentTokenizer.class.getClassLoader().getResourceAsStream(path);
	}
}
