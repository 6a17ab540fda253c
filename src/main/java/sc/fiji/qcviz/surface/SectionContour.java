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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import sc.fiji.qcviz.volume.Axis;

/**
 * The polylines formed by the intersection of a mesh with one slicing plane.
 * A plane missing the mesh yields an empty contour.
 */
public class SectionContour {

	private final Axis normal;
	private final double height;
	private final List<Polyline> polylines;

	public SectionContour(final Axis normal, final double height, final List<Polyline> polylines) {
		this.normal = normal;
		this.height = height;
		this.polylines = Collections.unmodifiableList(new ArrayList<>(polylines));
	}

	/** @return the axis normal to the slicing plane */
	public Axis getNormal() {
		return normal;
	}

	/** @return the coordinate of the slicing plane along its normal */
	public double getHeight() {
		return height;
	}

	public List<Polyline> getPolylines() {
		return polylines;
	}

	public boolean isEmpty() {
		return polylines.isEmpty();
	}

	@Override
	public String toString() {
		return "SectionContour[" + normal.label() + "=" + height + ", " + polylines.size() + " polyline(s)]";
	}

}
