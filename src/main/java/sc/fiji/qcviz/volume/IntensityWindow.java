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

import sc.fiji.qcviz.InputShapeException;

/**
 * A display range: intensities at or below {@code lower} are rendered at the
 * bottom of the colormap, those at or above {@code upper} at its top.
 */
public class IntensityWindow {

	private final double lower;
	private final double upper;

	public IntensityWindow(final double lower, final double upper) {
		if (Double.isNaN(lower) || Double.isNaN(upper) || lower > upper)
			throw new InputShapeException("IntensityWindow", "Invalid window [" + lower + ", " + upper + "]");
		this.lower = lower;
		this.upper = upper;
	}

	public double getLower() {
		return lower;
	}

	public double getUpper() {
		return upper;
	}

	/**
	 * Normalizes a value to [0, 1] within this window. Values outside the
	 * window are clamped.
	 *
	 * @param value the intensity
	 * @return the normalized intensity
	 */
	public double normalize(final double value) {
		if (upper == lower) return (value > lower) ? 1d : 0d;
		final double n = (value - lower) / (upper - lower);
		return Math.max(0d, Math.min(1d, n));
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof IntensityWindow)) return false;
		final IntensityWindow other = (IntensityWindow) o;
		return Double.compare(lower, other.lower) == 0 && Double.compare(upper, other.upper) == 0;
	}

	@Override
	public int hashCode() {
		return Double.hashCode(lower) * 31 + Double.hashCode(upper);
	}

	@Override
	public String toString() {
		return "[" + lower + ", " + upper + "]";
	}

}
