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
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import ij.ImagePlus;
import ij.gui.Overlay;
import ij.gui.Roi;
import ij.process.ColorProcessor;
import sc.fiji.qcviz.volume.Axis;

/**
 * A {@link Panel} rendered by {@link IJRenderingBackend}: an RGB raster plus
 * a vector {@link Overlay} holding contours. Overlays are only burned into
 * the pixels when the panel is flattened.
 */
public class IJPanel implements Panel {

	private final String title;
	private final Axis axis;
	private final ColorProcessor canvas;
	private final Overlay overlay;
	private final List<SliceGeometry> slices;

	IJPanel(final String title, final Axis axis, final ColorProcessor canvas, final List<SliceGeometry> slices) {
		this.title = title;
		this.axis = axis;
		this.canvas = canvas;
		this.overlay = new Overlay();
		this.slices = Collections.unmodifiableList(new ArrayList<>(slices));
	}

	@Override
	public String getTitle() {
		return title;
	}

	@Override
	public Optional<Axis> getAxis() {
		return Optional.ofNullable(axis);
	}

	@Override
	public double[] getCoordinates() {
		return slices.stream().mapToDouble(SliceGeometry::getCoordinate).toArray();
	}

	/** @return the geometry of each slice, in display order */
	public List<SliceGeometry> getSlices() {
		return slices;
	}

	/** @return the geometry of the specified slice */
	public SliceGeometry getSlice(final int index) {
		return slices.get(index);
	}

	/** @return the (mutable) RGB raster of this panel */
	public ColorProcessor getProcessor() {
		return canvas;
	}

	public Overlay getOverlay() {
		return overlay;
	}

	public int getWidth() {
		return canvas.getWidth();
	}

	public int getHeight() {
		return canvas.getHeight();
	}

	/**
	 * @return an image of this panel with its overlay attached (not burned in)
	 */
	public ImagePlus getImagePlus() {
		final ImagePlus imp = new ImagePlus(title, canvas);
		if (overlay.size() > 0) imp.setOverlay(overlay.duplicate());
		return imp;
	}

	/**
	 * @return a copy of the raster with all overlay elements drawn into it
	 */
	public ColorProcessor flatten() {
		final ColorProcessor flat = (ColorProcessor) canvas.duplicate();
		for (int i = 0; i < overlay.size(); i++) {
			final Roi roi = overlay.get(i);
			flat.setColor(roi.getStrokeColor());
			flat.setLineWidth(Math.max(1, (int) Math.round(roi.getStrokeWidth())));
			roi.drawPixels(flat);
		}
		flat.setLineWidth(1);
		return flat;
	}

	@Override
	public String toString() {
		return "IJPanel[" + title + ", " + canvas.getWidth() + "x" + canvas.getHeight() + ", " + slices.size()
				+ " slice(s), " + overlay.size() + " overlay element(s)]";
	}

}
