package org.conceptlens.processing;

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
import java.util.Map;

import org.conceptlens.om.Annotation;
import org.conceptlens.om.SpanSource;

import lombok.Value;

/**
 * Annotations of one document, ordered by start offset, with what it took to
 * produce them.
 */
@Value
public class AnnotationResult {

	String documentId;
	List<Annotation> annotations;
	double elapsedMillis;

	/** Semantic backend used, or null when the fallback did not run. */
	String backendId;
	Map<SpanSource, Integer> countsBySource;
}
