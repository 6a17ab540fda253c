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
package sc.fiji.qcviz.surface;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import sc.fiji.qcviz.ConfigurationException;

/**
 * A camera position for surface renders: one of the canonical views of one
 * hemisphere.
 */
public class SurfaceView {

	public enum View {
		LATERAL, MEDIAL, DORSAL, VENTRAL
	}

	public enum Hemisphere {
		LEFT, RIGHT;

		/** @return the structure of a mesh describing this hemisphere */
		public AnatomicalStructure structure() {
			return (this == LEFT) ? AnatomicalStructure.CORTEX_LEFT : AnatomicalStructure.CORTEX_RIGHT;
		}
	}

	/** Lateral and medial views of both hemispheres */
	public static final List<SurfaceView> DEFAULT_VIEWS = Collections.unmodifiableList(Arrays.asList(
			new SurfaceView(View.LATERAL, Hemisphere.LEFT), new SurfaceView(View.MEDIAL, Hemisphere.LEFT),
			new SurfaceView(View.LATERAL, Hemisphere.RIGHT), new SurfaceView(View.MEDIAL, Hemisphere.RIGHT)));

	private final View view;
	private final Hemisphere hemisphere;

	public SurfaceView(final View view, final Hemisphere hemisphere) {
		this.view = Objects.requireNonNull(view);
		this.hemisphere = Objects.requireNonNull(hemisphere);
	}

	/**
	 * Parses a {@code view:hemisphere} pair, e.g., {@code lateral:left}.
	 *
	 * @param pair the string to parse
	 * @return the surface view
	 * @throws ConfigurationException if the string is not a valid pair
	 */
	public static SurfaceView parse(final String pair) {
		final String[] tokens = (pair == null) ? new String[0] : pair.trim().split(":");
		if (tokens.length != 2)
			throw new ConfigurationException("SurfaceView", "Expected view:hemisphere but got '" + pair + "'");
		try {
			return new SurfaceView(View.valueOf(tokens[0].trim().toUpperCase(Locale.US)),
					Hemisphere.valueOf(tokens[1].trim().toUpperCase(Locale.US)));
		}
		catch (final IllegalArgumentException ex) {
			throw new ConfigurationException("SurfaceView", "Unknown view or hemisphere in '" + pair + "'", ex);
		}
	}

	public View getView() {
		return view;
	}

	public Hemisphere getHemisphere() {
		return hemisphere;
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof SurfaceView)) return false;
		final SurfaceView other = (SurfaceView) o;
		return view == other.view && hemisphere == other.hemisphere;
	}

	@Override
	public int hashCode() {
		return Objects.hash(view, hemisphere);
	}

	@Override
	public String toString() {
		return view.name().toLowerCase(Locale.US) + ":" + hemisphere.name().toLowerCase(Locale.US);
	}

}
