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

/**
 * A semantic backend could not be initialised (missing model, index build
 * failure). Callers keep the backend they already have.
 */
public class BackendUnavailableException extends Exception {

	private static final long serialVersionUID = 1L;

	public BackendUnavailableException(String message) {
		super(message);
	}

	public BackendUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}
}
