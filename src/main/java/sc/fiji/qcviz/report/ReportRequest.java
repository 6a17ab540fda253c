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
package sc.fiji.qcviz.report;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import sc.fiji.qcviz.ConfigurationException;
import sc.fiji.qcviz.surface.SurfaceView;
import sc.fiji.qcviz.volume.Axis;
import sc.fiji.qcviz.volume.Resampler.Interpolation;

/**
 * The immutable parameters of one report: its kind, output file and the
 * scalar options of the corresponding composer. Unset optional values
 * ({@code null}) leave the composer defaults in place.
 * <p>
 * Requests are assembled with a {@link Builder}, either programmatically or
 * from {@code KEY=VALUE} strings, e.g.:
 * </p>
 *
 * <pre>
 * ReportRequest request = ReportRequest.builder(ReportKind.ANATOMICAL, new File("anat.png"))
 * 		.set("n_cuts=8").set("display_modes=z,x").build();
 * </pre>
 */
public class ReportRequest {

	private final ReportKind kind;
	private final File output;
	private final String title;
	private final Integer nCuts;
	private final int nCols;
	private final List<Axis> axes;
	private final Axis montageAxis;
	private final String colormap;
	private final double darkness;
	private final Boolean autoBrightness;
	private final boolean zeroNaN;
	private final boolean allMaps;
	private final Boolean filled;
	private final Double alpha;
	private final Interpolation interpolation;
	private final List<SurfaceView> views;
	private final Double vmin;
	private final Double vmax;
	private final int volumeIndex;
	private final boolean rewrite;

	private ReportRequest(final Builder b) {
		kind = b.kind;
		output = b.output;
		title = (b.title == null) ? b.kind.id() : b.title;
		nCuts = b.nCuts;
		nCols = b.nCols;
		axes = (b.axes == null) ? null : Collections.unmodifiableList(new ArrayList<>(b.axes));
		montageAxis = b.montageAxis;
		colormap = b.colormap;
		darkness = b.darkness;
		autoBrightness = b.autoBrightness;
		zeroNaN = b.zeroNaN;
		allMaps = b.allMaps;
		filled = b.filled;
		alpha = b.alpha;
		interpolation = b.interpolation;
		views = (b.views == null) ? null : Collections.unmodifiableList(new ArrayList<>(b.views));
		vmin = b.vmin;
		vmax = b.vmax;
		volumeIndex = b.volumeIndex;
		rewrite = b.rewrite;
	}

	public static Builder builder(final ReportKind kind, final File output) {
		return new Builder(kind, output);
	}

	/**
	 * Parses a request from {@code KEY=VALUE} options.
	 *
	 * @param kind the report kind
	 * @param output the output file
	 * @param options the options, e.g., {@code n_cuts=7}
	 * @return the request
	 * @throws ConfigurationException if an option is unknown or invalid
	 */
	public static ReportRequest parse(final ReportKind kind, final File output, final String... options) {
		final Builder builder = builder(kind, output);
		for (final String option : options)
			builder.set(option);
		return builder.build();
	}

	public ReportKind getKind() {
		return kind;
	}

	public File getOutput() {
		return output;
	}

	public String getTitle() {
		return title;
	}

	/** @return the number of cuts, or null for the report's default */
	public Integer getCuts() {
		return nCuts;
	}

	public int getColumns() {
		return nCols;
	}

	/** @return the display modes, or null for the report's default */
	public List<Axis> getAxes() {
		return axes;
	}

	public Axis getMontageAxis() {
		return montageAxis;
	}

	/** @return the colormap name, or null for the report's default */
	public String getColormap() {
		return colormap;
	}

	public double getDarkness() {
		return darkness;
	}

	/** @return the auto-brightness flag, or null for the report's default */
	public Boolean getAutoBrightness() {
		return autoBrightness;
	}

	public boolean isZeroNaN() {
		return zeroNaN;
	}

	public boolean isAllMaps() {
		return allMaps;
	}

	/** @return the filled flag, or null for the report's default */
	public Boolean getFilled() {
		return filled;
	}

	/** @return the mask opacity, or null for the report's default */
	public Double getAlpha() {
		return alpha;
	}

	public Interpolation getInterpolation() {
		return interpolation;
	}

	/** @return the surface views, or null for the default views */
	public List<SurfaceView> getViews() {
		return views;
	}

	public Double getVmin() {
		return vmin;
	}

	public Double getVmax() {
		return vmax;
	}

	/** @return the index of the 3D volume displayed from 4D inputs */
	public int getVolumeIndex() {
		return volumeIndex;
	}

	/** @return whether an existing output should be overwritten */
	public boolean isRewrite() {
		return rewrite;
	}

	@Override
	public String toString() {
		return "ReportRequest[" + kind + " -> " + output + "]";
	}

	/**
	 * Assembles {@link ReportRequest}s.
	 */
	public static class Builder {

		private final ReportKind kind;
		private final File output;
		private String title;
		private Integer nCuts;
		private int nCols = 5;
		private List<Axis> axes;
		private Axis montageAxis = Axis.Z;
		private String colormap;
		private double darkness = 0.3;
		private Boolean autoBrightness;
		private boolean zeroNaN;
		private boolean allMaps;
		private Boolean filled;
		private Double alpha;
		private Interpolation interpolation = Interpolation.LINEAR;
		private List<SurfaceView> views;
		private Double vmin;
		private Double vmax;
		private int volumeIndex;
		private boolean rewrite;

		private Builder(final ReportKind kind, final File output) {
			if (kind == null) throw new ConfigurationException("ReportRequest", "Report kind is required");
			if (output == null) throw new ConfigurationException("ReportRequest", "Output file is required");
			this.kind = kind;
			this.output = output;
		}

		public Builder title(final String title) {
			this.title = title;
			return this;
		}

		public Builder cuts(final int nCuts) {
			this.nCuts = ConfigurationException.requirePositive("ReportRequest", "n_cuts", nCuts);
			return this;
		}

		public Builder columns(final int nCols) {
			this.nCols = ConfigurationException.requirePositive("ReportRequest", "n_cols", nCols);
			return this;
		}

		public Builder axes(final List<Axis> axes) {
			if (axes != null && axes.isEmpty())
				throw new ConfigurationException("ReportRequest", "At least one display mode is required");
			this.axes = axes;
			return this;
		}

		public Builder axes(final Axis... axes) {
			return axes(Arrays.asList(axes));
		}

		public Builder montageAxis(final Axis axis) {
			if (axis == null) throw new ConfigurationException("ReportRequest", "Montage axis cannot be null");
			this.montageAxis = axis;
			return this;
		}

		public Builder colormap(final String colormap) {
			this.colormap = colormap;
			return this;
		}

		public Builder darkness(final double darkness) {
			if (!(darkness >= 0 && darkness <= 1))
				throw new ConfigurationException("ReportRequest", "darkness must be within [0, 1] but was " + darkness);
			this.darkness = darkness;
			return this;
		}

		public Builder autoBrightness(final boolean autoBrightness) {
			this.autoBrightness = autoBrightness;
			return this;
		}

		public Builder zeroNaN(final boolean zeroNaN) {
			this.zeroNaN = zeroNaN;
			return this;
		}

		public Builder allMaps(final boolean allMaps) {
			this.allMaps = allMaps;
			return this;
		}

		public Builder filled(final boolean filled) {
			this.filled = filled;
			return this;
		}

		public Builder alpha(final double alpha) {
			if (!(alpha >= 0 && alpha <= 1))
				throw new ConfigurationException("ReportRequest", "alpha must be within [0, 1] but was " + alpha);
			this.alpha = alpha;
			return this;
		}

		public Builder interpolation(final Interpolation interpolation) {
			if (interpolation == null)
				throw new ConfigurationException("ReportRequest", "Interpolation cannot be null");
			this.interpolation = interpolation;
			return this;
		}

		public Builder views(final List<SurfaceView> views) {
			if (views != null && views.isEmpty())
				throw new ConfigurationException("ReportRequest", "At least one view is required");
			this.views = views;
			return this;
		}

		public Builder vmin(final Double vmin) {
			this.vmin = vmin;
			return this;
		}

		public Builder vmax(final Double vmax) {
			this.vmax = vmax;
			return this;
		}

		public Builder volumeIndex(final int volumeIndex) {
			if (volumeIndex < 0)
				throw new ConfigurationException("ReportRequest", "volume_index must be >= 0 but was " + volumeIndex);
			this.volumeIndex = volumeIndex;
			return this;
		}

		public Builder rewrite(final boolean rewrite) {
			this.rewrite = rewrite;
			return this;
		}

		/**
		 * Sets an option from a {@code KEY=VALUE} string.
		 *
		 * @param option the option
		 * @return this builder
		 * @throws ConfigurationException if the option is malformed, unknown or
		 *           invalid
		 */
		public Builder set(final String option) {
			final int idx = (option == null) ? -1 : option.indexOf('=');
			if (idx <= 0)
				throw new ConfigurationException("ReportRequest", "Expected KEY=VALUE but got '" + option + "'");
			return set(option.substring(0, idx), option.substring(idx + 1));
		}

		/**
		 * Sets an option by name.
		 *
		 * @param key the option name (case insensitive)
		 * @param value the option value
		 * @return this builder
		 * @throws ConfigurationException if the option is unknown or its value
		 *           invalid
		 */
		public Builder set(final String key, final String value) {
			final String k = key.trim().toLowerCase(Locale.US);
			final String v = value.trim();
			switch (k) {
			case "title":
			case "figure_title":
				return title(v);
			case "n_cuts":
				return cuts(parseInt(k, v));
			case "n_cols":
				return columns(parseInt(k, v));
			case "display_modes":
				return axes(Axis.fromNames(Arrays.asList(v.split(","))));
			case "axis":
			case "orientation":
				return montageAxis(Axis.fromName(v));
			case "colormap":
			case "cmap":
				return colormap(v);
			case "darkness":
				return darkness(parseDouble(k, v));
			case "auto_brightness":
				return autoBrightness(parseBoolean(k, v));
			case "zero_nan":
				return zeroNaN(parseBoolean(k, v));
			case "visualize_all_maps":
			case "all_maps":
				return allMaps(parseBoolean(k, v));
			case "filled":
				return filled(parseBoolean(k, v));
			case "alpha":
				return alpha(parseDouble(k, v));
			case "interpolation":
				return interpolation(Interpolation.fromName(v));
			case "views": {
				final List<SurfaceView> list = new ArrayList<>();
				for (final String pair : v.split(","))
					list.add(SurfaceView.parse(pair));
				return views(list);
			}
			case "vmin":
				return vmin(parseDouble(k, v));
			case "vmax":
				return vmax(parseDouble(k, v));
			case "volume_index":
				return volumeIndex(parseInt(k, v));
			case "rewrite":
				return rewrite(parseBoolean(k, v));
			default:
				throw new ConfigurationException("ReportRequest", "Unknown option '" + key + "'");
			}
		}

		public ReportRequest build() {
			if (vmin != null && vmax != null && vmin > vmax)
				throw new ConfigurationException("ReportRequest", "vmin (" + vmin + ") > vmax (" + vmax + ")");
			return new ReportRequest(this);
		}

		private static int parseInt(final String key, final String value) {
			try {
				return Integer.parseInt(value);
			}
			catch (final NumberFormatException ex) {
				throw new ConfigurationException("ReportRequest", key + ": '" + value + "' is not an integer", ex);
			}
		}

		private static double parseDouble(final String key, final String value) {
			try {
				return Double.parseDouble(value);
			}
			catch (final NumberFormatException ex) {
				throw new ConfigurationException("ReportRequest", key + ": '" + value + "' is not a number", ex);
			}
		}

		private static boolean parseBoolean(final String key, final String value) {
			switch (value.toLowerCase(Locale.US)) {
			case "true":
			case "yes":
			case "1":
				return true;
			case "false":
			case "no":
			case "0":
				return false;
			default:
				throw new ConfigurationException("ReportRequest", key + ": '" + value + "' is not a boolean");
			}
		}
	}

}
