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

import java.awt.Color;
import java.util.ArrayList;
import java.util.List;

import net.imglib2.display.ColorTable;
import sc.fiji.qcviz.ConfigurationException;
import sc.fiji.qcviz.surface.Mesh;
import sc.fiji.qcviz.surface.MeshSectioner;
import sc.fiji.qcviz.surface.SectionContour;
import sc.fiji.qcviz.util.ColorMaps;
import sc.fiji.qcviz.util.Logger;
import sc.fiji.qcviz.volume.Axis;
import sc.fiji.qcviz.volume.CutSelector;
import sc.fiji.qcviz.volume.IntensityWindow;
import sc.fiji.qcviz.volume.Resampler;
import sc.fiji.qcviz.volume.Resampler.Interpolation;
import sc.fiji.qcviz.volume.Volume;

/**
 * Checks the coregistration of a surface with a volume: the contours of the
 * full-brain mesh are drawn over axial slices of the volume. Optionally, a
 * foreground volume is resampled onto the background grid and blended
 * through a fading color ramp.
 */
public class SurfaceVolumeComposer {

	public static final int DEFAULT_CUTS = 7;
	/** Base colormap of the foreground ramp */
	public static final String FOREGROUND_COLORMAP = "viridis_r";
	public static final Color CONTOUR_COLOR = Color.RED;
	public static final double CONTOUR_WIDTH = 0.5;

	private final RenderingBackend backend;
	private final MeshSectioner sectioner = new MeshSectioner();
	private CutSelector cutSelector = new CutSelector();
	private int nCuts = DEFAULT_CUTS;
	private Interpolation interpolation = Interpolation.LINEAR;
	private String title = "surface_coreg";
	private Logger logger;

	public SurfaceVolumeComposer(final RenderingBackend backend) {
		if (backend == null) throw new IllegalArgumentException("Backend cannot be null");
		this.backend = backend;
	}

	public void setCuts(final int nCuts) {
		this.nCuts = ConfigurationException.requirePositive("SurfaceVolumeComposer", "nCuts", nCuts);
	}

	public int getCuts() {
		return nCuts;
	}

	/** @param interpolation the interpolation used to resample the foreground */
	public void setInterpolation(final Interpolation interpolation) {
		this.interpolation = (interpolation == null) ? Interpolation.LINEAR : interpolation;
	}

	public void setCutSelector(final CutSelector cutSelector) {
		this.cutSelector = cutSelector;
	}

	public void setTitle(final String title) {
		this.title = (title == null) ? "" : title;
	}

	/**
	 * Composes the coregistration panel.
	 *
	 * @param background the background volume. 4D volumes are reduced to their
	 *          first 3D volume
	 * @param left the left hemisphere mesh
	 * @param right the right hemisphere mesh
	 * @param foreground the foreground volume, or null
	 * @return the single axial panel
	 */
	public List<Panel> compose(final Volume background, final Mesh left, final Mesh right, final Volume foreground) {
		final Volume bg = background.to3D();
		final double[] heights = cutSelector.cuts(bg.threshold(cutSelector.getThreshold()), nCuts, Axis.Z).get(Axis.Z);
		final Mesh brain = Mesh.merge(left, right).getMesh();
		final List<SectionContour> contours = sectioner.section(brain, Axis.Z, heights);

		final Panel panel = backend.renderSlices(bg, Axis.Z, heights, new DisplaySettings(), title);
		int drawn = 0;
		for (int i = 0; i < contours.size(); i++) {
			final SectionContour contour = contours.get(i);
			if (contour.isEmpty()) continue;
			backend.overlayContours(panel, i, contour.getPolylines(), CONTOUR_COLOR, CONTOUR_WIDTH);
			drawn++;
		}
		if (drawn == 0)
			log().warn("No slice intersects " + brain + ": Is the surface in the space of " + bg + "?");
		else
			log().debug(drawn + "/" + heights.length + " slice(s) intersect " + brain);

		if (foreground != null) {
			final Volume fg = Resampler.resample(foreground.to3D(), bg, interpolation);
			final ColorTable ramp = ColorMaps.fadingRamp(FOREGROUND_COLORMAP);
			backend.overlayScalar(panel, fg, ramp, dataRange(fg));
		}
		final List<Panel> panels = new ArrayList<>(1);
		panels.add(panel);
		return panels;
	}

	private static IntensityWindow dataRange(final Volume vol) {
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (final double v : vol.flatten()) {
			if (Double.isNaN(v)) continue;
			min = Math.min(min, v);
			max = Math.max(max, v);
		}
		return (min > max) ? new IntensityWindow(0, 1) : new IntensityWindow(min, max);
	}

	private Logger log() {
		if (logger == null) logger = new Logger(SurfaceVolumeComposer.class);
		return logger;
	}

}
