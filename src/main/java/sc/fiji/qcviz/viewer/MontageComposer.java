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

import sc.fiji.qcviz.ConfigurationException;
import sc.fiji.qcviz.util.Logger;
import sc.fiji.qcviz.volume.Axis;
import sc.fiji.qcviz.volume.CutCoordinates;
import sc.fiji.qcviz.volume.Volume;

/**
 * Renders the cuts of a single axis as a montage: rows of at most
 * {@code nCols} slices, each row titled {@code <figureTitle>:<start>-<end>}.
 */
public class MontageComposer extends SliceComposer {

	public static final int DEFAULT_CUTS = 15;
	public static final int DEFAULT_COLUMNS = 5;

	private Axis axis = Axis.Z;
	private int nCols = DEFAULT_COLUMNS;
	private Logger logger;

	public MontageComposer(final RenderingBackend backend) {
		super(backend, DEFAULT_CUTS);
		setTitle("figure");
	}

	public void setAxis(final Axis axis) {
		if (axis == null) throw new IllegalArgumentException("Axis cannot be null");
		this.axis = axis;
	}

	public Axis getAxis() {
		return axis;
	}

	/**
	 * @param nCols the number of slices per row
	 * @throws ConfigurationException if nCols is not positive
	 */
	public void setColumns(final int nCols) {
		this.nCols = ConfigurationException.requirePositive("MontageComposer", "nCols", nCols);
	}

	public int getColumns() {
		return nCols;
	}

	/**
	 * @see #compose(Volume, Volume)
	 */
	public List<Panel> compose(final Volume volume) {
		return compose(volume, null);
	}

	/**
	 * Composes the montage of a volume.
	 *
	 * @param volume the rendered volume. 4D volumes are reduced to their first
	 *          3D volume
	 * @param boxVolume the volume defining the foreground extent. If null, the
	 *          thresholded data is used
	 * @return the panels, one per row
	 */
	public List<Panel> compose(final Volume volume, final Volume boxVolume) {
		final List<MontageRow> rows = MontageLayout.rows(nCuts, nCols);
		final Volume data = volume.to3D();
		final Volume box = boxSource(data, boxVolume);
		final CutCoordinates cuts = cutSelector.cuts(box, nCuts, axis);
		final DisplaySettings display = displaySettings(box);
		final List<Panel> panels = new ArrayList<>(rows.size());
		for (final MontageRow row : rows) {
			panels.add(backend.renderSlices(data, axis, cuts.get(axis, row.getStart(), row.getEnd()), display,
					row.title(title)));
		}
		log().debug("Composed " + axis.label() + " montage of " + data + ": rows " + rows);
		return panels;
	}

	private Logger log() {
		if (logger == null) logger = new Logger(MontageComposer.class);
		return logger;
	}

}
