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
package sc.fiji.qcviz;

/**
 * Thrown when a caller requests an invalid parameter: non-positive counts,
 * unknown axis or view names, map indices out of range, etc.
 */
public class ConfigurationException extends QCVizException {

	private static final long serialVersionUID = 1L;

	public ConfigurationException(final String component, final String message) {
		super(component, message);
	}

	public ConfigurationException(final String component, final String message, final Throwable cause) {
		super(component, message, cause);
	}

	/**
	 * Asserts that a count parameter is strictly positive.
	 *
	 * @param component the component validating the parameter
	 * @param name the parameter name
	 * @param value the parameter value
	 * @return {@code value}
	 * @throws ConfigurationException if {@code value <= 0}
	 */
	public static int requirePositive(final String component, final String name, final int value) {
		if (value <= 0)
			throw new ConfigurationException(component, name + " must be > 0 but was " + value);
		return value;
	}

}
