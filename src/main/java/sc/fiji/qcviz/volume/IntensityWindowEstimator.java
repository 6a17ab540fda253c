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
import java.util.Optional;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import sc.fiji.qcviz.ConfigurationException;

/**
 * Estimates a display range that is robust to outlier voxels. The lower bound
 * is a low percentile of all intensities; the upper bound a high percentile
 * of the intensities above the lower bound, so that a dominant background
 * cannot compress the dynamic range of the foreground.
 */
public class IntensityWindowEstimator {

	public static final double DEFAULT_LOWER_PERCENTILE = 15;
	public static final double DEFAULT_UPPER_PERCENTILE = 99.8;

	private final double lowerPercentile;
	private final double upperPercentile;

	public IntensityWindowEstimator() {
		this(DEFAULT_LOWER_PERCENTILE, DEFAULT_UPPER_PERCENTILE);
	}

	/**
	 * @param lowerPercentile the percentile (in ]0, 100]) of all intensities
	 *          defining the lower bound
	 * @param upperPercentile the percentile (in ]0, 100]) of intensities above
	 *          the lower bound defining the upper bound
	 * @throws ConfigurationException if either percentile is out of range
	 */
	public IntensityWindowEstimator(final double lowerPercentile, final double upperPercentile) {
		if (lowerPercentile <= 0 || lowerPercentile > 100 || upperPercentile <= 0 || upperPercentile > 100)
			throw new ConfigurationException("IntensityWindowEstimator", "Percentiles must be within ]0, 100] but were "
					+ lowerPercentile + " and " + upperPercentile);
		this.lowerPercentile = lowerPercentile;
		this.upperPercentile = upperPercentile;
	}

	/**
	 * @param volume the volume to be sampled (4D volumes are reduced to their
	 *          first 3D volume)
	 * @return the window, or an empty optional if volume has no valid voxels
	 */
	public Optional<IntensityWindow> estimate(final Volume volume) {
		return estimate(volume.to3D().flatten());
	}

	/**
	 * @param sample the flattened intensities. NaNs are ignored
	 * @return the window, or an empty optional if sample has no valid values
	 */
	public Optional<IntensityWindow> estimate(final double[] sample) {
		final double[] values = Arrays.stream(sample).filter(v -> !Double.isNaN(v)).toArray();
		if (values.length == 0)
			return Optional.empty();
		final double lower = percentile(values, lowerPercentile);
		final double[] above = Arrays.stream(values).filter(v -> v > lower).toArray();
		final double upper = (above.length == 0) ? lower : percentile(above, upperPercentile);
		return Optional.of(new IntensityWindow(lower, Math.max(lower, upper)));
	}

	/**
	 * Computes a percentile using linear interpolation between closest ranks
	 * (R-7 estimation: linear interpolation between closest ranks).
	 *
	 * @param values the values. NaNs are ignored
	 * @param p the percentile in ]0, 100]
	 * @return the percentile or NaN if values has no valid entries
	 */
	public static double percentile(final double[] values, final double p) {
		final double[] valid = Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
		if (valid.length == 0) return Double.NaN;
		return new Percentile().withEstimationType(EstimationType.R_7).evaluate(valid, p);
	}

}
