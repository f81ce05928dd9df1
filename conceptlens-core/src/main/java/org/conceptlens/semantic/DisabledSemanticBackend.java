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

import java.util.List;

/**
 * Backend that never matches. Active when no real backend could be created.
 */
public final class DisabledSemanticBackend implements SemanticBackend {

	public static final String ID = "none";
	public static final DisabledSemanticBackend INSTANCE = new DisabledSemanticBackend();

	private DisabledSemanticBackend() {
	}

	@Override
	public String id() {
		return ID;
	}

	@Override
	public float[] embed(String text) {
		return new float[0];
	}

	@Override
	public List<SemanticMatch> nearest(float[] vector, int k, double minSimilarity) {
		return List.of();
	}
}
