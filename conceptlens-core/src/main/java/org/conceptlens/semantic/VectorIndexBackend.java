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
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.conceptlens.cdb.ConceptDatabase;
import org.conceptlens.om.Concept;
import org.conceptlens.util.Logger;

/**
 * Exact cosine nearest-neighbour search over embeddings of every concept name.
 * A concept's similarity to a query is the best similarity over its names.
 * The matrix is built once; lookups do not mutate state.
 */
public class VectorIndexBackend implements SemanticBackend {

	private static final Comparator<SemanticMatch> RANKING = Comparator
			.comparingDouble(SemanticMatch::getSimilarity).reversed().thenComparing(SemanticMatch::getConceptId);

	private final String id;
	private final Embedder embedder;
	private final String[] rowConcept;
	private final float[][] rows;

	public VectorIndexBackend(String id, ConceptDatabase db, Embedder embedder) {
		this.id = id;
		this.embedder = embedder;
		List<String> owners = new ArrayList<>();
		List<float[]> vectors = new ArrayList<>();
		for (Concept c : db.concepts()) {
			for (String name : c.getNames()) {
				float[] v = embedder.embed(name);
				if (v.length != embedder.dimension())
					throw new IllegalStateException("Embedder returned " + v.length + " dims, expected " + embedder.dimension());
				owners.add(c.getId());
				vectors.add(v);
			}
		}
		this.rowConcept = owners.toArray(new String[0]);
		this.rows = vectors.toArray(new float[0][]);
		Logger.info("Semantic index '{}' built: {} name vectors, {} dims", id, rows.length, embedder.dimension());
	}

	@Override
	public String id() {
		return id;
	}

	@Override
	public float[] embed(String text) {
		return embedder.embed(text);
	}

	@Override
	public List<SemanticMatch> nearest(float[] vector, int k, double minSimilarity) {
		if (vector == null || vector.length != embedder.dimension() || k <= 0)
			return List.of();

		Map<String, Double> best = new HashMap<>();
		for (int r = 0; r < rows.length; r++) {
			double sim = dot(rows[r], vector);
			if (sim < minSimilarity)
				continue;
			best.merge(rowConcept[r], sim, Math::max);
		}

		List<SemanticMatch> out = new ArrayList<>(best.size());
		best.forEach((cid, sim) -> out.add(new SemanticMatch(cid, sim)));
		out.sort(RANKING);
		return (out.size() > k) ? new ArrayList<>(out.subList(0, k)) : out;
	}

	public int size() {
		return rows.length;
	}

	// both sides are unit length, so the dot product is the cosine
	private static double dot(float[] a, float[] b) {
		double s = 0.0;
		for (int i = 0; i < a.length; i++) {
			s += a[i] * b[i];
		}
		return s;
	}

	/** Provider that builds a fresh index for each database. */
	public static SemanticBackendProvider provider(String id, Embedder embedder) {
		return new SemanticBackendProvider() {
			@Override
			public String id() {
				return id;
			}

			@Override
			public SemanticBackend create(ConceptDatabase db) throws BackendUnavailableException {
				try {
					return new VectorIndexBackend(id, db, embedder);
				} catch (RuntimeException e) {
					throw new BackendUnavailableException("Failed to build semantic index '" + id + "'", e);
				}
			}
		};
	}
}
