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
package sc.fiji.qcviz.viewer;

import java.util.Optional;

import sc.fiji.qcviz.volume.Axis;

/**
 * A rendered view produced by a {@link RenderingBackend}. Slice panels keep
 * the axis and physical coordinates of their slices so that overlays can be
 * placed on the slice they belong to; surface panels have no slicing axis.
 * The content of a panel is opaque to composers.
 */
public interface Panel {

	/** @return the panel title */
	String getTitle();

	/** @return the slicing axis, or an empty optional for non-slice panels */
	Optional<Axis> getAxis();

	/** @return the physical coordinates of the slices, in display order */
	double[] getCoordinates();

	/** @return the number of slices in this panel */
	default int getSliceCount() {
		return getCoordinates().length;
	}

}
