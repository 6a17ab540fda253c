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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import sc.fiji.qcviz.ConfigurationException;
import sc.fiji.qcviz.surface.BrainModelIndex;
import sc.fiji.qcviz.surface.Mesh;
import sc.fiji.qcviz.surface.ScalarMaps;
import sc.fiji.qcviz.surface.SurfaceScalarMapper;
import sc.fiji.qcviz.surface.SurfaceView;
import sc.fiji.qcviz.surface.SurfaceView.Hemisphere;
import sc.fiji.qcviz.util.Logger;
import sc.fiji.qcviz.volume.IntensityWindow;

/**
 * Renders grayordinate maps onto the two cortical hemispheres as a
 * (map x view) grid: one row per map, one column per view. Panels are
 * returned in row-major order and titled {@code <figureTitle>:<map>-<view>}.
 */
public class SurfaceMapComposer {

	public static final String DEFAULT_COLORMAP = "plasma";
	public static final double DEFAULT_DARKNESS = 0.3;

	private final RenderingBackend backend;
	private List<SurfaceView> views = SurfaceView.DEFAULT_VIEWS;
	private String colormap = DEFAULT_COLORMAP;
	private double darkness = DEFAULT_DARKNESS;
	private boolean allMaps;
	private boolean zeroNaN;
	private String title = "surface";
	private Logger logger;

	public SurfaceMapComposer(final RenderingBackend backend) {
		if (backend == null) throw new IllegalArgumentException("Backend cannot be null");
		this.backend = backend;
	}

	public void setViews(final List<SurfaceView> views) {
		this.views = (views == null || views.isEmpty()) ? SurfaceView.DEFAULT_VIEWS : new ArrayList<>(views);
	}

	public List<SurfaceView> getViews() {
		return views;
	}

	public void setColormap(final String colormap) {
		this.colormap = (colormap == null) ? DEFAULT_COLORMAP : colormap;
	}

	/**
	 * @param darkness the weight of the background map onto the data colors,
	 *          in [0, 1]
	 * @throws ConfigurationException if darkness is outside [0, 1]
	 */
	public void setDarkness(final double darkness) {
		if (!(darkness >= 0 && darkness <= 1))
			throw new ConfigurationException("SurfaceMapComposer", "Darkness must be within [0, 1] but got " + darkness);
		this.darkness = darkness;
	}

	/** @param allMaps whether every map should be rendered, or only the first */
	public void setAllMaps(final boolean allMaps) {
		this.allMaps = allMaps;
	}

	/** @param zeroNaN whether vertices without data should be displayed as 0 */
	public void setZeroNaN(final boolean zeroNaN) {
		this.zeroNaN = zeroNaN;
	}

	public void setTitle(final String title) {
		this.title = (title == null) ? "" : title;
	}

	/** @return the number of panels per row */
	public int getColumns() {
		return views.size();
	}

	/**
	 * Composes the surface figure.
	 *
	 * @param left the left hemisphere mesh
	 * @param right the right hemisphere mesh
	 * @param data the grayordinate maps to display, or null to render the
	 *          meshes only
	 * @param dataIndex the index table of {@code data}
	 * @param bgMap the background map (e.g., sulcal depth), or null
	 * @param bgIndex the index table of {@code bgMap}. If null,
	 *          {@code dataIndex} is used
	 * @return the panels in row-major order
	 */
	public List<Panel> compose(final Mesh left, final Mesh right, final ScalarMaps data,
			final BrainModelIndex dataIndex, final ScalarMaps bgMap, final BrainModelIndex bgIndex) {
		int nMaps = 1;
		double[][] leftMaps = null;
		double[][] rightMaps = null;
		DisplaySettings display = new DisplaySettings().withColormap(colormap);
		if (data != null) {
			leftMaps = SurfaceScalarMapper.map(left, data, dataIndex, zeroNaN);
			rightMaps = SurfaceScalarMapper.map(right, data, dataIndex, zeroNaN);
			if (allMaps) nMaps = data.getMapCount();
			final Optional<IntensityWindow> limits = SurfaceScalarMapper.colorLimits(data);
			display = display.withDefaults(limits);
		}
		double[] leftBg = null;
		double[] rightBg = null;
		if (bgMap != null) {
			final BrainModelIndex index = (bgIndex == null) ? dataIndex : bgIndex;
			leftBg = SurfaceScalarMapper.select(SurfaceScalarMapper.map(left, bgMap, index, false), 0);
			rightBg = SurfaceScalarMapper.select(SurfaceScalarMapper.map(right, bgMap, index, false), 0);
		}

		final List<Panel> panels = new ArrayList<>(nMaps * views.size());
		for (int m = 0; m < nMaps; m++) {
			for (final SurfaceView view : views) {
				final boolean isLeft = view.getHemisphere() == Hemisphere.LEFT;
				final double[] values = (data == null) ? null
						: SurfaceScalarMapper.select((isLeft) ? leftMaps : rightMaps, m);
				panels.add(backend.renderSurface((isLeft) ? left : right, values, (isLeft) ? leftBg : rightBg, view,
						display, darkness, title + ":" + m + "-" + view));
			}
		}
		log().debug("Composed " + nMaps + " map(s) x " + views.size() + " view(s) with " + display);
		return panels;
	}

	private Logger log() {
		if (logger == null) logger = new Logger(SurfaceMapComposer.class);
		return logger;
	}

}
