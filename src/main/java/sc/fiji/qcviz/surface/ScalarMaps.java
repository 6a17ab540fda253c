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

import sc.fiji.qcviz.InputShapeException;

/**
 * A batch of scalar maps sharing the same indexing (grayordinates or mesh
 * vertices): {@code values[map][index]}. A single map is always handled as a
 * batch of length 1.
 */
public class ScalarMaps {

	private final double[][] values;

	private ScalarMaps(final double[][] values) {
		this.values = values;
	}

	/**
	 * Promotes a single map to a batch of length 1.
	 *
	 * @param map the scalar values
	 * @return the batch
	 */
	public static ScalarMaps of(final double[] map) {
		if (map == null) throw new InputShapeException("ScalarMaps", "Map cannot be null");
		return new ScalarMaps(new double[][] { map.clone() });
	}

	/**
	 * @param maps the scalar values, one row per map. All rows must have the
	 *          same length
	 * @return the batch
	 */
	public static ScalarMaps of(final double[][] maps) {
		if (maps == null || maps.length == 0)
			throw new InputShapeException("ScalarMaps", "At least one map is required");
		final double[][] copy = new double[maps.length][];
		for (int m = 0; m < maps.length; m++) {
			if (maps[m] == null || maps[m].length != maps[0].length)
				throw new InputShapeException("ScalarMaps", "Map " + m + " does not have " + maps[0].length + " values");
			copy[m] = maps[m].clone();
		}
		return new ScalarMaps(copy);
	}

	public int getMapCount() {
		return values.length;
	}

	/** @return the number of values per map */
	public int getLength() {
		return values[0].length;
	}

	/** @return the value of a map at the specified index */
	public double get(final int map, final int index) {
		return values[map][index];
	}

	/** @return a copy of the specified map */
	public double[] getMap(final int map) {
		return values[map].clone();
	}

	/** @return a copy of all maps */
	public double[][] toArray() {
		final double[][] copy = new double[values.length][];
		for (int m = 0; m < values.length; m++)
			copy[m] = values[m].clone();
		return copy;
	}

	@Override
	public String toString() {
		return "ScalarMaps[" + getMapCount() + "x" + getLength() + "]";
	}

}
