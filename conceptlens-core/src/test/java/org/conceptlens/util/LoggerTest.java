package org.conceptlens.util;

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

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import org.conceptlens.util.Logger.Level;
import org.junit.jupiter.api.Test;

class LoggerTest {

	@Test
	void null_level_is_never_enabled() {
		assertFalse(Logger.isEnabled(null));
	}

	@Test
	void error_is_always_enabled() {
		assertTrue(Logger.isEnabled(Level.ERROR));
	}

	@Test
	void default_threshold_is_info() {
		assumeTrue(System.getProperty(Logger.SYS_PROP_LEVEL) == null);
		assertTrue(Logger.isEnabled(Level.INFO));
		assertTrue(Logger.isEnabled(Level.WARN));
		assertFalse(Logger.isEnabled(Level.DEBUG));
		assertFalse(Logger.isEnabled(Level.TRACE));
	}
}
