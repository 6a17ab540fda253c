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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import sc.fiji.qcviz.util.Logger;
import sc.fiji.qcviz.volume.Axis;
import sc.fiji.qcviz.volume.CutCoordinates;
import sc.fiji.qcviz.volume.Volume;

/**
 * Renders one panel per display axis, each holding the volume's slices at
 * that axis's cut coordinates. All panels share the same display settings.
 * Panels are titled {@code <figureTitle>-<axis>}.
 */
public class OrthogonalViewComposer extends SliceComposer {

	/** Default number of cuts per axis */
	public static final int DEFAULT_CUTS = 10;
	public static final List<Axis> DEFAULT_AXES = Collections.unmodifiableList(Arrays.asList(Axis.values()));

	private List<Axis> axes = DEFAULT_AXES;
	private CutCoordinates lastCuts;
	private Logger logger;

	public OrthogonalViewComposer(final RenderingBackend backend) {
		super(backend, DEFAULT_CUTS);
	}

	/**
	 * @param axes the display modes, in panel order
	 */
	public void setAxes(final List<Axis> axes) {
		this.axes = (axes == null || axes.isEmpty()) ? DEFAULT_AXES : new ArrayList<>(axes);
	}

	public List<Axis> getAxes() {
		return Collections.unmodifiableList(axes);
	}

	/**
	 * @see #compose(Volume, Volume)
	 */
	public List<Panel> compose(final Volume volume) {
		return compose(volume, null);
	}

	/**
	 * Composes the orthogonal views of a volume.
	 *
	 * @param volume the rendered volume. 4D volumes are reduced to their first
	 *          3D volume
	 * @param boxVolume the volume defining the foreground extent (e.g., a brain
	 *          mask). If null, the thresholded data is used
	 * @return the panels, one per axis
	 */
	public List<Panel> compose(final Volume volume, final Volume boxVolume) {
		final Volume data = volume.to3D();
		final Volume box = boxSource(data, boxVolume);
		lastCuts = cutSelector.cuts(box, nCuts, axes.toArray(new Axis[0]));
		final DisplaySettings display = displaySettings(box);
		final List<Panel> panels = new ArrayList<>(axes.size());
		for (final Axis axis : axes) {
			panels.add(backend.renderSlices(data, axis, lastCuts.get(axis), display, title + "-" + axis.label()));
		}
		log().debug("Composed " + panels.size() + " orthogonal view(s) of " + data + " with " + display);
		return panels;
	}

	/** @return the cuts of the last composition, or null */
	public CutCoordinates getLastCuts() {
		return lastCuts;
	}

	private Logger log() {
		if (logger == null) logger = new Logger(OrthogonalViewComposer.class);
		return logger;
	}

}
