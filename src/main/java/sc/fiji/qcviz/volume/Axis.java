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
package sc.fiji.qcviz.volume;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

import sc.fiji.qcviz.ConfigurationException;

/**
 * The three orthogonal slicing axes of a volume, in physical (RAS) space:
 * X (sagittal cuts), Y (coronal cuts) and Z (axial cuts).
 */
public enum Axis {

	X(0), Y(1), Z(2);

	private final int index;

	Axis(final int index) {
		this.index = index;
	}

	/** @return the dimension index of this axis: X=0; Y=1; Z=2 */
	public int index() {
		return index;
	}

	/** @return the lower case name of this axis ("x", "y" or "z") */
	public String label() {
		return name().toLowerCase(Locale.US);
	}

	/**
	 * @return the two in-plane axes of a cut along this axis, in increasing
	 *         order (e.g., X and Y for an axial (Z) cut)
	 */
	public Axis[] inPlane() {
		switch (this) {
		case X:
			return new Axis[] { Y, Z };
		case Y:
			return new Axis[] { X, Z };
		default:
			return new Axis[] { X, Y };
		}
	}

	public static Axis of(final int index) {
		for (final Axis axis : values()) {
			if (axis.index == index) return axis;
		}
		throw new ConfigurationException("Axis", "Invalid axis index: " + index);
	}

	/**
	 * Parses an axis name.
	 *
	 * @param name the axis name, case insensitive ("x", "y", or "z")
	 * @return the parsed axis
	 * @throws ConfigurationException if name is not a valid axis name
	 */
	public static Axis fromName(final String name) {
		if (name != null) {
			switch (name.trim().toLowerCase(Locale.US)) {
			case "x":
				return X;
			case "y":
				return Y;
			case "z":
				return Z;
			default:
				break;
			}
		}
		throw new ConfigurationException("Axis", "Unknown axis '" + name + "': Valid options are x, y, or z");
	}

	public static List<Axis> fromNames(final Collection<String> names) {
		final List<Axis> axes = new ArrayList<>(names.size());
		names.forEach(n -> axes.add(fromName(n)));
		return axes;
	}

}
