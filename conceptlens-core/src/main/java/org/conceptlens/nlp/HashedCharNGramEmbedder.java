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

import java.util.Collections;

import org.apache.commons.lang3.StringUtils;
import org.conceptlens.semantic.Embedder;
import org.conceptlens.util.TermNormalizer;

import opennlp.tools.doccat.FeatureGenerator;

/**
 * Deterministic embedder: character n-gram features hashed into a fixed number
 * of signed buckets, then L2-normalized. Spelling variants and inflections of a
 * name land close to it; unrelated strings land near zero similarity.
 */
public class HashedCharNGramEmbedder implements Embedder {

	public static final int DEFAULT_DIMENSION = 512;

	private final int dimension;
	private final FeatureGenerator features;

	public HashedCharNGramEmbedder() {
		this(DEFAULT_DIMENSION, new CharNGramFeatureGenerator());
	}

	public HashedCharNGramEmbedder(int dimension, FeatureGenerator features) {
		if (dimension < 8)
			throw new IllegalArgumentException("dimension must be >= 8");
		this.dimension = dimension;
		this.features = features;
	}

	@Override
	public int dimension() {
		return dimension;
	}

	@Override
	public float[] embed(String text) {
		float[] v = new float[dimension];
		String[] toks = StringUtils.split(TermNormalizer.normalize(text));
		if (toks == null || toks.length == 0)
			return v;

		for (String f : features.extractFeatures(toks, Collections.emptyMap())) {
			int h = f.hashCode();
			int bucket = Math.floorMod(h, dimension);
			v[bucket] += ((h >>> 16) & 1) == 0 ? 1f : -1f;
		}

		double norm = 0.0;
		for (float x : v)
			norm += x * x;
		if (norm == 0.0)
			return v;
		float inv = (float) (1.0 / Math.sqrt(norm));
		for (int i = 0; i < v.length; i++)
			v[i] *= inv;
		return v;
	}
}
