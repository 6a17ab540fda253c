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

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.converter.Converters;
import net.imglib2.converter.RealDoubleConverter;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import sc.fiji.qcviz.ConfigurationException;
import sc.fiji.qcviz.InputShapeException;

/**
 * A read-only 3D (or 4D) grid of scalar intensities, together with the
 * {@link VoxelAffine} mapping its voxel indices to physical space. The
 * underlying data is accessed as a lazily converted {@link DoubleType} view,
 * so that any {@link RealType} image can be wrapped without copying.
 *
 * @see #to3D()
 */
public class Volume {

	private final RandomAccessibleInterval<DoubleType> data;
	private final VoxelAffine affine;
	private final String name;

	private Volume(final RandomAccessibleInterval<DoubleType> data, final VoxelAffine affine, final String name) {
		if (data.numDimensions() < 3 || data.numDimensions() > 4)
			throw new InputShapeException("Volume",
					"Only 3D and 4D images are supported but image has " + data.numDimensions() + " dimensions");
		if (affine == null)
			throw new InputShapeException("Volume", "Affine is required");
		this.data = data;
		this.affine = affine;
		this.name = name;
	}

	/**
	 * Wraps an image as a Volume.
	 *
	 * @param img the 3D or 4D image
	 * @param affine the voxel-to-physical mapping
	 * @return the (read-only) volume
	 */
	public static <T extends RealType<T>> Volume of(final RandomAccessibleInterval<T> img, final VoxelAffine affine) {
		return of(img, affine, null);
	}

	public static <T extends RealType<T>> Volume of(final RandomAccessibleInterval<T> img, final VoxelAffine affine,
			final String name) {
		final RandomAccessibleInterval<T> zeroMin = Views.zeroMin(img);
		final RandomAccessibleInterval<DoubleType> doubles = Converters.convert(zeroMin,
				new RealDoubleConverter<T>(), new DoubleType());
		return new Volume(doubles, affine, name);
	}

	/** @return whether this volume has a 4th (e.g., time) axis */
	public boolean is4D() {
		return data.numDimensions() == 4;
	}

	/**
	 * Reduces a 4D volume to 3D by extracting the first index of the 4th axis.
	 * 3D volumes are returned unchanged.
	 *
	 * @return the 3D volume
	 */
	public Volume to3D() {
		return to3D(0);
	}

	/**
	 * Reduces a 4D volume to 3D by extracting a single index along the 4th
	 * axis. 3D volumes are returned unchanged.
	 *
	 * @param index the index along the 4th axis
	 * @return the 3D volume
	 * @throws ConfigurationException if index is out of bounds
	 */
	public Volume to3D(final int index) {
		if (!is4D()) return this;
		if (index < 0 || index >= data.dimension(3))
			throw new ConfigurationException("Volume", "Volume index " + index + " out of bounds [0, "
					+ data.dimension(3) + ")");
		return new Volume(Views.hyperSlice(data, 3, index), affine, name);
	}

	public RandomAccessibleInterval<DoubleType> getData() {
		return data;
	}

	public VoxelAffine getAffine() {
		return affine;
	}

	public String getName() {
		return name;
	}

	public int numDimensions() {
		return data.numDimensions();
	}

	public long dimension(final int d) {
		return data.dimension(d);
	}

	/** @return the spatial dimensions (first three) of this volume */
	public long[] spatialDimensions() {
		return new long[] { data.dimension(0), data.dimension(1), data.dimension(2) };
	}

	/** @return the number of voxels of the (3D) volume */
	public long size() {
		return Intervals.numElements(data);
	}

	/**
	 * @return the intensity at the specified voxel
	 */
	public double getValue(final long... position) {
		final RandomAccess<DoubleType> ra = data.randomAccess();
		ra.setPosition(position);
		return ra.get().getRealDouble();
	}

	/**
	 * Returns a copy of all intensities in flat iteration order.
	 *
	 * @return the flattened intensities
	 * @throws InputShapeException if volume is too large to be flattened
	 */
	public double[] flatten() {
		final long n = size();
		if (n > Integer.MAX_VALUE - 8)
			throw new InputShapeException("Volume", "Volume too large to be sampled: " + n + " voxels");
		final double[] values = new double[(int) n];
		final Cursor<DoubleType> cursor = Views.flatIterable(data).cursor();
		int i = 0;
		while (cursor.hasNext())
			values[i++] = cursor.next().getRealDouble();
		return values;
	}

	/**
	 * Returns a view of this volume in which all voxels at or below the
	 * specified threshold are set to zero.
	 *
	 * @param threshold the background threshold
	 * @return the thresholded (lazy) view
	 */
	public Volume threshold(final double threshold) {
		final RandomAccessibleInterval<DoubleType> thresholded = Converters.convert(data, (final DoubleType in, final DoubleType out) -> {
			final double v = in.getRealDouble();
			out.set((v > threshold) ? v : 0d);
		}, new DoubleType());
		return new Volume(thresholded, affine, name);
	}

	/**
	 * @return whether both volumes share the same spatial dimensions and affine
	 */
	public boolean isSameGrid(final Volume other) {
		return Arrays.equals(spatialDimensions(), other.spatialDimensions()) && affine.equals(other.affine);
	}

	@Override
	public String toString() {
		return ((name == null) ? "Volume" : name) + Arrays.toString(Intervals.dimensionsAsLongArray(data));
	}

}
