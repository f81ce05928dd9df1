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

/**
 * Raised when a concept database cannot be built from its sources. Fatal to
 * that build only; a database already in service is unaffected.
 */
public class ConceptBuildException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public enum Reason {
		/** A record or pattern with a blank concept id. */
		MISSING_IDENTIFIER,
		/** One concept id declared with conflicting preferred names. */
		DUPLICATE_IDENTIFIER,
		/** A concept whose names are all blank. */
		EMPTY_NAME_SET,
		/** Fewer than two components, a blank component, or a negative gap. */
		INVALID_PATTERN,
		/** A pattern owned by a concept the database does not hold. */
		UNKNOWN_CONCEPT
	}

	private final Reason reason;
	private final String conceptId;

	public ConceptBuildException(Reason reason, String conceptId, String message) {
		super(reason + " [" + conceptId + "]: " + message);
		this.reason = reason;
		this.conceptId = conceptId;
	}

	public Reason getReason() {
		return reason;
	}

	public String getConceptId() {
		return conceptId;
	}
}
