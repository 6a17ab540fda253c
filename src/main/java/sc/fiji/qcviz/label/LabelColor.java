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
package sc.fiji.qcviz.label;

import java.awt.Color;

import org.scijava.util.ColorRGB;

/**
 * An entry of a {@link ColorLookupTable}: a named region and its display
 * color, with components normalized to [0, 1].
 */
public class LabelColor {

	private final int code;
	private final String name;
	private final double red;
	private final double green;
	private final double blue;

	/**
	 * @param code the integer label code
	 * @param name the region name (may be null)
	 * @param red the red component, in [0, 1]
	 * @param green the green component, in [0, 1]
	 * @param blue the blue component, in [0, 1]
	 */
	public LabelColor(final int code, final String name, final double red, final double green, final double blue) {
		this.code = code;
		this.name = name;
		this.red = clamp(red);
		this.green = clamp(green);
		this.blue = clamp(blue);
	}

	/**
	 * Creates a color from 8-bit components.
	 */
	public static LabelColor fromRGB255(final int code, final String name, final int r, final int g, final int b) {
		return new LabelColor(code, name, r / 255d, g / 255d, b / 255d);
	}

	private static double clamp(final double v) {
		return Math.max(0d, Math.min(1d, v));
	}

	public int code() {
		return code;
	}

	public String name() {
		return name;
	}

	public double red() {
		return red;
	}

	public double green() {
		return green;
	}

	public double blue() {
		return blue;
	}

	/** @return the normalized {r, g, b} triple */
	public double[] rgb() {
		return new double[] { red, green, blue };
	}

	public ColorRGB toColorRGB() {
		return new ColorRGB((int) Math.round(red * 255), (int) Math.round(green * 255), (int) Math.round(blue * 255));
	}

	public Color toAWT() {
		return new Color((float) red, (float) green, (float) blue);
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof LabelColor)) return false;
		final LabelColor other = (LabelColor) o;
		return code == other.code && Double.compare(red, other.red) == 0 && Double.compare(green, other.green) == 0
				&& Double.compare(blue, other.blue) == 0;
	}

	@Override
	public int hashCode() {
		int result = Integer.hashCode(code);
		result = 31 * result + Double.hashCode(red);
		result = 31 * result + Double.hashCode(green);
		return 31 * result + Double.hashCode(blue);
	}

	@Override
	public String toString() {
		return code + " " + ((name == null) ? "" : name + " ") + "(" + red + ", " + green + ", " + blue + ")";
	}

}
