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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import sc.fiji.qcviz.ConfigurationException;
import sc.fiji.qcviz.label.LabelColor;
import sc.fiji.qcviz.label.RankedLabels;
import sc.fiji.qcviz.util.ColorMaps;
import sc.fiji.qcviz.util.Logger;
import sc.fiji.qcviz.volume.Axis;
import sc.fiji.qcviz.volume.CutCoordinates;
import sc.fiji.qcviz.volume.Volume;

/**
 * Draws binary masks (segmentations, or the regions of a parcellation) over
 * orthogonal views of an anatomical volume. Masks are either outlined or
 * filled with a uniform opacity.
 */
public class SegmentationComposer extends SliceComposer {

	public static final int DEFAULT_CUTS = 7;
	/** Opacity of filled regions */
	public static final double DEFAULT_ALPHA = 0.3;
	public static final List<Axis> DEFAULT_AXES = Collections.unmodifiableList(Arrays.asList(Axis.Z, Axis.X, Axis.Y));

	private List<Axis> axes = DEFAULT_AXES;
	private boolean filled;
	private double alpha = DEFAULT_ALPHA;
	private Logger logger;

	public SegmentationComposer(final RenderingBackend backend) {
		super(backend, DEFAULT_CUTS);
		setAutoBrightness(true);
		setTitle("segmentation");
	}

	public void setAxes(final List<Axis> axes) {
		this.axes = (axes == null || axes.isEmpty()) ? DEFAULT_AXES : new ArrayList<>(axes);
	}

	public void setFilled(final boolean filled) {
		this.filled = filled;
	}

	public boolean isFilled() {
		return filled;
	}

	/**
	 * @param alpha the opacity of filled masks, in [0, 1]
	 * @throws ConfigurationException if alpha is outside [0, 1]
	 */
	public void setAlpha(final double alpha) {
		if (!(alpha >= 0 && alpha <= 1))
			throw new ConfigurationException("SegmentationComposer", "Alpha must be within [0, 1] but got " + alpha);
		this.alpha = alpha;
	}

	/**
	 * Composes mask overlays.
	 *
	 * @param anatomy the background volume. 4D volumes are reduced to their
	 *          first 3D volume
	 * @param masks the masks to overlay
	 * @param colors the color of each mask. If null, distinct colors are
	 *          assigned
	 * @param boxVolume the volume defining the extent of the cuts (e.g., a
	 *          brain mask). If null, the thresholded anatomy is used
	 * @return the panels, one per axis
	 */
	public List<Panel> compose(final Volume anatomy, final List<Volume> masks, final List<LabelColor> colors,
			final Volume boxVolume) {
		final List<LabelColor> palette = (colors == null) ? defaultColors(masks.size()) : colors;
		if (palette.size() != masks.size())
			throw new ConfigurationException("SegmentationComposer",
					masks.size() + " masks but " + palette.size() + " colors");
		final Volume data = anatomy.to3D();
		final Volume box = boxSource(data, boxVolume);
		final CutCoordinates cuts = cutSelector.cuts(box, nCuts, axes.toArray(new Axis[0]));
		final DisplaySettings display = displaySettings(data);
		final List<Panel> panels = new ArrayList<>(axes.size());
		for (final Axis axis : axes) {
			final Panel panel = backend.renderSlices(data, axis, cuts.get(axis), display, title + "-" + axis.label());
			backend.overlayMasks(panel, masks, palette, alpha, filled);
			panels.add(panel);
		}
		log().debug("Composed " + masks.size() + " mask(s) over " + data + ((filled) ? " (filled)" : ""));
		return panels;
	}

	/**
	 * Composes a parcellation overlay: the regions of a rank-remapped label
	 * volume are resampled onto the anatomy's grid and filled with their
	 * lookup colors. Rank 0 (typically the unlabeled background) is drawn
	 * like every other region.
	 *
	 * @param anatomy the background volume
	 * @param labels the rank-remapped labels
	 * @param boxVolume the volume defining the extent of the cuts, or null
	 * @return the panels, one per axis
	 */
	public List<Panel> compose(final Volume anatomy, final RankedLabels labels, final Volume boxVolume) {
		final RankedLabels resampled = labels.resampleTo(anatomy.to3D());
		return compose(anatomy, resampled.masks(), resampled.getColors(), boxVolume);
	}

	/**
	 * @return red, green, and blue, followed by distinct colors
	 */
	public static List<LabelColor> defaultColors(final int n) {
		final List<LabelColor> colors = new ArrayList<>(n);
		final Color[] primaries = { Color.RED, Color.GREEN, Color.BLUE };
		final Color[] distinct = ColorMaps.glasbeyColorsAWT(Math.min(256, Math.max(1, n)));
		for (int i = 0; i < n; i++) {
			final Color c = (i < primaries.length) ? primaries[i] : distinct[i % distinct.length];
			colors.add(LabelColor.fromRGB255(i, "mask-" + i, c.getRed(), c.getGreen(), c.getBlue()));
		}
		return colors;
	}

	private Logger log() {
		if (logger == null) logger = new Logger(SegmentationComposer.class);
		return logger;
	}

}
