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

import lombok.Value;

/**
 * Result of one document in a batch: either annotations or the reason the
 * document was rejected.
 */
@Value
public class DocumentOutcome {

	String documentId;
	AnnotationResult result;
	String error;

	public static DocumentOutcome success(AnnotationResult result) {
		return new DocumentOutcome(result.getDocumentId(), result, null);
	}

	public static DocumentOutcome failure(String documentId, String error) {
		return new DocumentOutcome(documentId, null, error);
	}

	public boolean isSuccess() {
		return result != null;
	}
}
