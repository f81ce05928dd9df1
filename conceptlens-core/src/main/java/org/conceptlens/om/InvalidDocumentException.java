package org.conceptlens.om;

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

/**
 * A document whose token stream cannot be matched (bad offsets, overlapping
 * tokens). Raised before any matching so the caller can reject only that
 * document.
 */
public class InvalidDocumentException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String documentId;

	public InvalidDocumentException(String documentId, String message) {
		super("Document " + documentId + ": " + message);
		this.documentId = documentId;
	}

	public String getDocumentId() {
		return documentId;
	}
}
