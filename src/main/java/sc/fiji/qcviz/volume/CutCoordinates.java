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
package sc.fiji.qcviz.volume;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import sc.fiji.qcviz.ConfigurationException;

/**
 * Physical coordinates at which a volume is sliced, per {@link Axis}.
 * Coordinates are strictly increasing along each axis.
 */
public class CutCoordinates {

	private final Map<Axis, double[]> cuts;

	CutCoordinates(final Map<Axis, double[]> cuts) {
		this.cuts = new EnumMap<>(Axis.class);
		cuts.forEach((axis, coords) -> this.cuts.put(axis, coords.clone()));
	}

	/**
	 * @param axis the slicing axis
	 * @return a copy of the cut coordinates along the axis
	 * @throws ConfigurationException if no cuts were computed for {@code axis}
	 */
	public double[] get(final Axis axis) {
		final double[] coords = cuts.get(axis);
		if (coords == null)
			throw new ConfigurationException("CutCoordinates", "No cuts computed for axis " + axis.label());
		return coords.clone();
	}

	/**
	 * @param axis the slicing axis
	 * @param start the index of the first cut (inclusive)
	 * @param end the index of the last cut (exclusive)
	 * @return the cut coordinates along the axis in {@code [start, end)}
	 */
	public double[] get(final Axis axis, final int start, final int end) {
		return Arrays.copyOfRange(get(axis), start, end);
	}

	public Set<Axis> axes() {
		return Collections.unmodifiableSet(cuts.keySet());
	}

	/** @return the number of cuts along the specified axis */
	public int count(final Axis axis) {
		return get(axis).length;
	}

	@Override
	public String toString() {
		final StringBuilder sb = new StringBuilder("CutCoordinates[");
		cuts.forEach((axis, coords) -> sb.append(axis.label()).append('=').append(Arrays.toString(coords)).append(' '));
		return sb.toString().trim() + "]";
	}

}
