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

/**
 * The extent of the foreground (non-background) voxels of a {@link Volume}.
 * Voxel extents are half-open: {@code [start, stop)}, with {@code stop} one
 * past the last foreground voxel. Physical extrema are those of the voxel box
 * corners mapped through the volume's affine.
 */
public class BoundingBox {

	private final long[] start;
	private final long[] stop;
	private final double[] min;
	private final double[] max;
	private final boolean fallback;

	BoundingBox(final long[] start, final long[] stop, final VoxelAffine affine, final boolean fallback) {
		this.start = start.clone();
		this.stop = stop.clone();
		this.fallback = fallback;
		min = new double[] { Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY };
		max = new double[] { Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY };
		for (int corner = 0; corner < 8; corner++) {
			final double[] voxel = new double[3];
			for (int d = 0; d < 3; d++)
				voxel[d] = ((corner >> d) & 1) == 0 ? start[d] : stop[d];
			final double[] p = affine.apply(voxel);
			for (int d = 0; d < 3; d++) {
				min[d] = Math.min(min[d], p[d]);
				max[d] = Math.max(max[d], p[d]);
			}
		}
	}

	/** @return the first foreground voxel index along each voxel dimension */
	public long[] getStart() {
		return start.clone();
	}

	/** @return one past the last foreground voxel index along each voxel dimension */
	public long[] getStop() {
		return stop.clone();
	}

	/** @return the lowest physical coordinate along the specified axis */
	public double getMin(final Axis axis) {
		return min[axis.index()];
	}

	/** @return the highest physical coordinate along the specified axis */
	public double getMax(final Axis axis) {
		return max[axis.index()];
	}

	/**
	 * @return whether the physical coordinate lies within the box extent along
	 *         the specified axis
	 */
	public boolean contains(final Axis axis, final double coordinate) {
		return coordinate >= getMin(axis) && coordinate <= getMax(axis);
	}

	/**
	 * @return whether this box is the full-volume fallback used when no
	 *         foreground voxel was found
	 */
	public boolean isFallback() {
		return fallback;
	}

	@Override
	public String toString() {
		return "BoundingBox[start=" + Arrays.toString(start) + ", stop=" + Arrays.toString(stop) + ", min="
				+ Arrays.toString(min) + ", max=" + Arrays.toString(max) + ((fallback) ? ", fallback]" : "]");
	}

}
