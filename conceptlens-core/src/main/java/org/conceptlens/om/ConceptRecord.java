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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One input row for the concept database: a surface name of a concept, with
 * the concept-level attributes repeated on each row (MedCAT CSV style).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConceptRecord {

	/** Concept identifier (CUI). */
	private String conceptId;

	/** Surface name. */
	private String name;

	/** True when {@link #name} is the concept's preferred name (name_status P). */
	private boolean preferred;

	/** Flat semantic type tags. */
	private List<String> types = new ArrayList<>();

	/** Optional frequency prior; 0 when unknown. */
	private long frequency;

	public void setTypes(List<String> types) {
		this.types = (types == null) ? new ArrayList<>() : new ArrayList<>(types);
	}

	public static ConceptRecord preferred(String conceptId, String name, String... types) {
		return new ConceptRecord(conceptId, name, true, Arrays.asList(types), 0L);
	}

	public static ConceptRecord synonym(String conceptId, String name) {
		return new ConceptRecord(conceptId, name, false, new ArrayList<>(), 0L);
	}
}
