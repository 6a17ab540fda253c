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

import java.util.Locale;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessible;
import net.imglib2.RealRandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.interpolation.InterpolatorFactory;
import net.imglib2.interpolation.randomaccess.NLinearInterpolatorFactory;
import net.imglib2.interpolation.randomaccess.NearestNeighborInterpolatorFactory;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import sc.fiji.qcviz.ConfigurationException;

/**
 * Resamples a volume onto the voxel grid of a reference volume, going through
 * physical space: each reference voxel is mapped to physical coordinates by
 * the reference affine, then back into the source grid by the inverse of the
 * source affine. Positions outside the source are zero.
 */
public class Resampler {

	public enum Interpolation {
		NEAREST, LINEAR;

		public static Interpolation fromName(final String name) {
			if (name != null) {
				switch (name.trim().toLowerCase(Locale.US)) {
				case "nearest":
					return NEAREST;
				case "linear":
				case "trilinear":
					return LINEAR;
				default:
					break;
				}
			}
			throw new ConfigurationException("Resampler", "Unknown interpolation '" + name + "'");
		}
	}

	private Resampler() {}

	/**
	 * Resamples {@code source} onto the grid of {@code reference}.
	 *
	 * @param source the volume to resample (4D volumes are reduced to their
	 *          first 3D volume)
	 * @param reference the volume defining the target grid
	 * @param interpolation the interpolation scheme
	 * @return the resampled volume, sharing the grid (dimensions and affine) of
	 *         the reference
	 */
	public static Volume resample(final Volume source, final Volume reference, final Interpolation interpolation) {
		final Volume src = source.to3D();
		final Volume ref = reference.to3D();
		if (src.isSameGrid(ref)) return src;

		final InterpolatorFactory<DoubleType, RandomAccessible<DoubleType>> factory;
		if (interpolation == Interpolation.NEAREST)
			factory = new NearestNeighborInterpolatorFactory<>();
		else
			factory = new NLinearInterpolatorFactory<>();
		final RealRandomAccess<DoubleType> access = Views.interpolate(Views.extendZero(src.getData()), factory)
				.realRandomAccess();

		final Img<DoubleType> out = ArrayImgs.doubles(ref.spatialDimensions());
		final Cursor<DoubleType> cursor = out.localizingCursor();
		final double[] voxel = new double[3];
		while (cursor.hasNext()) {
			cursor.fwd();
			cursor.localize(voxel);
			final double[] physical = ref.getAffine().apply(voxel);
			access.setPosition(src.getAffine().applyInverse(physical));
			cursor.get().set(access.get().getRealDouble());
		}
		return Volume.of(out, ref.getAffine(), source.getName());
	}

}
