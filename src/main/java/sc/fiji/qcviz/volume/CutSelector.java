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
import java.util.EnumMap;
import java.util.Map;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import sc.fiji.qcviz.ConfigurationException;
import sc.fiji.qcviz.util.Logger;

/**
 * Selects slicing coordinates from the extent of the foreground of a volume.
 * The foreground is the set of voxels whose intensity exceeds a background
 * threshold. Cuts are evenly spaced strictly inside the foreground extent of
 * each axis.
 * <p>
 * The volume used to compute the foreground extent does not need to be the
 * volume being displayed: a brain mask, e.g., can be used to frame the cuts
 * of an anatomical image.
 * </p>
 */
public class CutSelector {

	/** The default background threshold */
	public static final double DEFAULT_THRESHOLD = 1e-3;

	private final double threshold;
	private Logger logger;

	public CutSelector() {
		this(DEFAULT_THRESHOLD);
	}

	/**
	 * @param threshold voxels at or below this value are considered background
	 */
	public CutSelector(final double threshold) {
		this.threshold = threshold;
	}

	public double getThreshold() {
		return threshold;
	}

	/**
	 * Computes the extent of the voxels above threshold. If there are none, a
	 * box spanning the whole volume is returned.
	 *
	 * @param volume the (3D or 4D) volume. 4D volumes are reduced to their
	 *          first 3D volume
	 * @return the bounding box
	 */
	public BoundingBox boundingBox(final Volume volume) {
		final Volume vol = volume.to3D();
		final RandomAccessibleInterval<DoubleType> data = vol.getData();
		final long[] start = { Long.MAX_VALUE, Long.MAX_VALUE, Long.MAX_VALUE };
		final long[] last = { Long.MIN_VALUE, Long.MIN_VALUE, Long.MIN_VALUE };
		boolean found = false;
		final Cursor<DoubleType> cursor = Views.iterable(data).localizingCursor();
		while (cursor.hasNext()) {
			if (cursor.next().getRealDouble() > threshold) {
				found = true;
				for (int d = 0; d < 3; d++) {
					final long p = cursor.getLongPosition(d);
					if (p < start[d]) start[d] = p;
					if (p > last[d]) last[d] = p;
				}
			}
		}
		if (!found) {
			log().debug("No voxels above " + threshold + " in " + vol + ": Framing whole volume");
			return new BoundingBox(new long[3], vol.spatialDimensions(), vol.getAffine(), true);
		}
		final long[] stop = { last[0] + 1, last[1] + 1, last[2] + 1 };
		return new BoundingBox(start, stop, vol.getAffine(), false);
	}

	/**
	 * Computes cut coordinates for all three axes.
	 *
	 * @param boxSource the volume defining the foreground extent
	 * @param nCuts the number of cuts per axis
	 * @return the cut coordinates
	 */
	public CutCoordinates cuts(final Volume boxSource, final int nCuts) {
		return cuts(boxSource, nCuts, Axis.values());
	}

	/**
	 * Computes cut coordinates for the specified axes.
	 *
	 * @param boxSource the volume defining the foreground extent
	 * @param nCuts the number of cuts per axis
	 * @param axes the axes for which cuts should be computed
	 * @return the cut coordinates
	 * @throws ConfigurationException if nCuts is not positive
	 */
	public CutCoordinates cuts(final Volume boxSource, final int nCuts, final Axis... axes) {
		return cuts(boundingBox(boxSource), boxSource.getAffine(), nCuts, axes);
	}

	/**
	 * Computes cut coordinates evenly spaced within a bounding box.
	 *
	 * @param box the bounding box
	 * @param affine the affine of the volume the box was computed from
	 * @param nCuts the number of cuts per axis
	 * @param axes the axes for which cuts should be computed
	 * @return the cut coordinates
	 * @throws ConfigurationException if nCuts is not positive
	 */
	public CutCoordinates cuts(final BoundingBox box, final VoxelAffine affine, final int nCuts,
			final Axis... axes) {
		ConfigurationException.requirePositive("CutSelector", "Number of cuts", nCuts);
		final long[] start = box.getStart();
		final long[] stop = box.getStop();

		// each cut i of all three voxel dimensions is one voxel position
		final double[][] physical = new double[nCuts][];
		for (int i = 0; i < nCuts; i++) {
			final double[] voxel = new double[3];
			for (int d = 0; d < 3; d++) {
				final double inc = Math.abs(stop[d] - start[d]) / (nCuts + 1d);
				voxel[d] = start[d] + (i + 1) * inc;
			}
			physical[i] = affine.apply(voxel);
		}

		final Map<Axis, double[]> cuts = new EnumMap<>(Axis.class);
		for (final Axis axis : axes) {
			final double[] coords = new double[nCuts];
			for (int i = 0; i < nCuts; i++)
				coords[i] = physical[i][axis.index()];
			Arrays.sort(coords);
			cuts.put(axis, coords);
		}
		final CutCoordinates result = new CutCoordinates(cuts);
		log().debug("Cuts from " + box + ": " + result);
		return result;
	}

	private Logger log() {
		if (logger == null) logger = new Logger(CutSelector.class);
		return logger;
	}

}
