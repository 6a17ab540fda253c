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

/**
 * An ordered sequence of 2D points lying on a slicing plane, expressed in the
 * plane's in-plane axes. The first point of a closed polyline is not repeated
 * at its end.
 */
public class Polyline {

	private final List<double[]> points;
	private final boolean closed;

	public Polyline(final List<double[]> points, final boolean closed) {
		final List<double[]> copy = new ArrayList<>(points.size());
		points.forEach(p -> copy.add(new double[] { p[0], p[1] }));
		this.points = Collections.unmodifiableList(copy);
		this.closed = closed;
	}

	/** @return the {u, v} points of this polyline */
	public List<double[]> getPoints() {
		return points;
	}

	public int size() {
		return points.size();
	}

	public boolean isClosed() {
		return closed;
	}

	/** @return the u coordinates of all points */
	public float[] getUs() {
		final float[] us = new float[points.size()];
		for (int i = 0; i < us.length; i++)
			us[i] = (float) points.get(i)[0];
		return us;
	}

	/** @return the v coordinates of all points */
	public float[] getVs() {
		final float[] vs = new float[points.size()];
		for (int i = 0; i < vs.length; i++)
			vs[i] = (float) points.get(i)[1];
		return vs;
	}

	@Override
	public String toString() {
		return "Polyline[" + points.size() + " points" + ((closed) ? ", closed]" : "]");
	}

}
