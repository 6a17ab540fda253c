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
package sc.fiji.qcviz.viewer;

import java.util.Objects;
import java.util.Optional;

import sc.fiji.qcviz.ConfigurationException;
import sc.fiji.qcviz.volume.IntensityWindow;

/**
 * Immutable render parameters handed to a {@link RenderingBackend}. Unset
 * display limits ({@code null}) let the backend apply its own default
 * scaling (full intensity range).
 */
public class DisplaySettings {

	/** The colormap used for anatomical slices */
	public static final String DEFAULT_COLORMAP = "grays";

	private final Double vmin;
	private final Double vmax;
	private final String colormap;
	private final double alpha;

	public DisplaySettings() {
		this(null, null, DEFAULT_COLORMAP, 1d);
	}

	private DisplaySettings(final Double vmin, final Double vmax, final String colormap, final double alpha) {
		this.vmin = vmin;
		this.vmax = vmax;
		this.colormap = (colormap == null) ? DEFAULT_COLORMAP : colormap;
		this.alpha = alpha;
	}

	public DisplaySettings withVmin(final Double vmin) {
		return new DisplaySettings(vmin, vmax, colormap, alpha);
	}

	public DisplaySettings withVmax(final Double vmax) {
		return new DisplaySettings(vmin, vmax, colormap, alpha);
	}

	public DisplaySettings withColormap(final String colormap) {
		return new DisplaySettings(vmin, vmax, colormap, alpha);
	}

	/**
	 * @param alpha the opacity of the rendered layer, in [0, 1]
	 * @return the updated settings
	 * @throws ConfigurationException if alpha is outside [0, 1]
	 */
	public DisplaySettings withAlpha(final double alpha) {
		if (!(alpha >= 0 && alpha <= 1))
			throw new ConfigurationException("DisplaySettings", "Alpha must be within [0, 1] but got " + alpha);
		return new DisplaySettings(vmin, vmax, colormap, alpha);
	}

	/**
	 * Merges an estimated window into these settings. Limits already set
	 * explicitly are kept.
	 *
	 * @param window the estimated window (may be empty)
	 * @return the merged settings
	 */
	public DisplaySettings withDefaults(final Optional<IntensityWindow> window) {
		if (window == null || window.isEmpty()) return this;
		return new DisplaySettings((vmin == null) ? window.get().getLower() : vmin,
				(vmax == null) ? window.get().getUpper() : vmax, colormap, alpha);
	}

	public Double getVmin() {
		return vmin;
	}

	public Double getVmax() {
		return vmax;
	}

	public String getColormap() {
		return colormap;
	}

	public double getAlpha() {
		return alpha;
	}

	/**
	 * Resolves the window to be used when rendering data spanning
	 * {@code [dataMin, dataMax]}: unset limits default to the data range.
	 */
	public IntensityWindow resolve(final double dataMin, final double dataMax) {
		final double lo = (vmin == null) ? dataMin : vmin;
		final double hi = (vmax == null) ? dataMax : vmax;
		return new IntensityWindow(Math.min(lo, hi), Math.max(lo, hi));
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof DisplaySettings)) return false;
		final DisplaySettings other = (DisplaySettings) o;
		return Objects.equals(vmin, other.vmin) && Objects.equals(vmax, other.vmax)
				&& colormap.equals(other.colormap) && alpha == other.alpha;
	}

	@Override
	public int hashCode() {
		return Objects.hash(vmin, vmax, colormap, alpha);
	}

	@Override
	public String toString() {
		return "DisplaySettings[vmin=" + vmin + ", vmax=" + vmax + ", colormap=" + colormap + ", alpha=" + alpha + "]";
	}

}
