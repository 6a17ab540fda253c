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

import sc.fiji.qcviz.label.LabelColor;
import sc.fiji.qcviz.util.Logger;
import sc.fiji.qcviz.volume.Axis;
import sc.fiji.qcviz.volume.CutCoordinates;
import sc.fiji.qcviz.volume.Volume;

/**
 * Renders two already registered volumes (fixed and moving) at the very same
 * cuts, so that alignment can be judged by flipping between them. An
 * optional contour volume (e.g., a white matter ribbon) is outlined on every
 * panel of both volumes and, when present, defines the extent of the cuts.
 */
public class RegistrationComposer extends SliceComposer {

	public static final int DEFAULT_CUTS = 7;
	public static final List<Axis> DEFAULT_AXES = Collections.unmodifiableList(Arrays.asList(Axis.Z, Axis.X, Axis.Y));
	public static final Color DEFAULT_CONTOUR_COLOR = Color.RED;

	private List<Axis> axes = DEFAULT_AXES;
	private Color contourColor = DEFAULT_CONTOUR_COLOR;
	private String fixedLabel = "fixed-image";
	private String movingLabel = "moving-image";
	private Logger logger;

	public RegistrationComposer(final RenderingBackend backend) {
		super(backend, DEFAULT_CUTS);
		setAutoBrightness(true);
	}

	public void setAxes(final List<Axis> axes) {
		this.axes = (axes == null || axes.isEmpty()) ? DEFAULT_AXES : new ArrayList<>(axes);
	}

	public void setContourColor(final Color contourColor) {
		this.contourColor = (contourColor == null) ? DEFAULT_CONTOUR_COLOR : contourColor;
	}

	public void setLabels(final String fixedLabel, final String movingLabel) {
		if (fixedLabel != null) this.fixedLabel = fixedLabel;
		if (movingLabel != null) this.movingLabel = movingLabel;
	}

	/**
	 * Composes the registration panels.
	 *
	 * @param fixed the reference volume
	 * @param moving the volume registered onto {@code fixed}
	 * @param contour the volume whose foreground is outlined, or null
	 * @return the panels of the fixed volume (one per axis) followed by those of
	 *         the moving volume
	 */
	public List<Panel> compose(final Volume fixed, final Volume moving, final Volume contour) {
		final Volume fixed3D = fixed.to3D();
		final Volume moving3D = moving.to3D();
		final Volume box = (contour == null) ? boxSource(fixed3D, null) : contour.to3D();
		final CutCoordinates cuts = cutSelector.cuts(box, nCuts, axes.toArray(new Axis[0]));
		final List<Panel> panels = new ArrayList<>(2 * axes.size());
		panels.addAll(render(fixed3D, cuts, contour, fixedLabel));
		panels.addAll(render(moving3D, cuts, contour, movingLabel));
		log().debug("Composed registration of " + moving3D + " onto " + fixed3D + " at " + cuts);
		return panels;
	}

	private List<Panel> render(final Volume vol, final CutCoordinates cuts, final Volume contour,
			final String label) {
		final DisplaySettings display = displaySettings(vol.threshold(cutSelector.getThreshold()));
		final List<Panel> panels = new ArrayList<>(axes.size());
		for (final Axis axis : axes) {
			final Panel panel = backend.renderSlices(vol, axis, cuts.get(axis), display,
					title + ((title.isEmpty()) ? "" : ":") + label + "-" + axis.label());
			if (contour != null) {
				backend.overlayMasks(panel, Collections.singletonList(contour), Collections.singletonList(
						LabelColor.fromRGB255(1, "contour", contourColor.getRed(), contourColor.getGreen(),
								contourColor.getBlue())),
						1d, false);
			}
			panels.add(panel);
		}
		return panels;
	}

	private Logger log() {
		if (logger == null) logger = new Logger(RegistrationComposer.class);
		return logger;
	}

}
