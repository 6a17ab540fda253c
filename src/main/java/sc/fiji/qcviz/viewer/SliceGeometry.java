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

import sc.fiji.qcviz.volume.Axis;

/**
 * Maps the pixels of one rendered slice to physical space. Slices are
 * sampled on a regular grid of the two in-plane axes (u horizontal, v
 * vertical pointing up) at a fixed coordinate along the slicing axis.
 */
public class SliceGeometry {

	private final Axis axis;
	private final double coordinate;
	private final double uMin;
	private final double vMax;
	private final double pixelSize;
	private final int width;
	private final int height;
	private final int xOffset;
	private final int yOffset;

	public SliceGeometry(final Axis axis, final double coordinate, final double uMin, final double vMax,
			final double pixelSize, final int width, final int height, final int xOffset, final int yOffset) {
		this.axis = axis;
		this.coordinate = coordinate;
		this.uMin = uMin;
		this.vMax = vMax;
		this.pixelSize = pixelSize;
		this.width = width;
		this.height = height;
		this.xOffset = xOffset;
		this.yOffset = yOffset;
	}

	/**
	 * @param col the pixel column within the slice
	 * @param row the pixel row within the slice
	 * @return the physical (x, y, z) position of the pixel center
	 */
	public double[] toPhysical(final int col, final int row) {
		final Axis[] plane = axis.inPlane();
		final double[] p = new double[3];
		p[axis.index()] = coordinate;
		p[plane[0].index()] = uMin + col * pixelSize;
		p[plane[1].index()] = vMax - row * pixelSize;
		return p;
	}

	/** @return the canvas x position of an in-plane u coordinate */
	public double toCanvasX(final double u) {
		return xOffset + (u - uMin) / pixelSize;
	}

	/** @return the canvas y position of an in-plane v coordinate */
	public double toCanvasY(final double v) {
		return yOffset + (vMax - v) / pixelSize;
	}

	public Axis getAxis() {
		return axis;
	}

	public double getCoordinate() {
		return coordinate;
	}

	public double getPixelSize() {
		return pixelSize;
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public int getXOffset() {
		return xOffset;
	}

	public int getYOffset() {
		return yOffset;
	}

	@Override
	public String toString() {
		return "SliceGeometry[" + axis.label() + "=" + coordinate + ", " + width + "x" + height + " @ (" + xOffset
				+ ", " + yOffset + ")]";
	}

}
