/*
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2026 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */
package sc.fiji.qcviz.surface;

import java.util.Locale;

/**
 * Brain structures a mesh or a brain model (grayordinate block) can describe.
 * Names follow the CIFTI convention (e.g., {@code CIFTI_STRUCTURE_CORTEX_LEFT}).
 */
public enum AnatomicalStructure {

	CORTEX_LEFT, CORTEX_RIGHT, OTHER;

	/**
	 * Parses a structure name, with or without the {@code CIFTI_STRUCTURE_}
	 * prefix. GIFTI names (e.g., {@code CortexLeft}) are also recognized.
	 * Unknown names map to {@link #OTHER}.
	 *
	 * @param name the structure name
	 * @return the structure
	 */
	public static AnatomicalStructure fromName(final String name) {
		if (name == null) return OTHER;
		final String key = name.trim().toUpperCase(Locale.US).replace("CIFTI_STRUCTURE_", "").replace("_", "");
		switch (key) {
		case "CORTEXLEFT":
			return CORTEX_LEFT;
		case "CORTEXRIGHT":
			return CORTEX_RIGHT;
		default:
			return OTHER;
		}
	}

	/** @return the CIFTI name of this structure */
	public String ciftiName() {
		return "CIFTI_STRUCTURE_" + name();
	}

}
