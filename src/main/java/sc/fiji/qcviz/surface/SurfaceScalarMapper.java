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
import java.util.Optional;

import sc.fiji.qcviz.ConfigurationException;
import sc.fiji.qcviz.InputShapeException;
import sc.fiji.qcviz.MissingMappingException;
import sc.fiji.qcviz.util.Logger;
import sc.fiji.qcviz.volume.IntensityWindow;
import sc.fiji.qcviz.volume.IntensityWindowEstimator;

/**
 * Translates scalar data indexed by grayordinates (dense indices spanning
 * both hemispheres and, possibly, subcortical structures) into per-vertex
 * values of a hemisphere {@link Mesh}, using the {@link BrainModelIndex} of
 * the dataset. Mapping is a pure function of its inputs.
 */
public class SurfaceScalarMapper {

	/** Lower percentile of surface colour limits */
	public static final double LOWER_LIMIT_PERCENTILE = 2d;
	/** Upper percentile of surface colour limits */
	public static final double UPPER_LIMIT_PERCENTILE = 98d;

	private static Logger logger;

	private SurfaceScalarMapper() {
	}

	/**
	 * Maps a batch of grayordinate maps onto the vertices of a mesh.
	 *
	 * @param mesh the target mesh. Its structure selects the brain model
	 * @param data the grayordinate data
	 * @param index the structural index table of the data
	 * @param zeroNaN whether vertices without a grayordinate should be set to 0
	 *          rather than NaN
	 * @return the mapped values, {@code [map][vertex]}
	 * @throws MissingMappingException if the index table has no brain model for
	 *           the mesh's structure
	 * @throws InputShapeException if the brain model does not fit the mesh or
	 *           the data
	 */
	public static double[][] map(final Mesh mesh, final ScalarMaps data, final BrainModelIndex index,
			final boolean zeroNaN) {
		final AnatomicalStructure structure = mesh.getStructure();
		final BrainModel model = index.find(structure).orElseThrow(() -> new MissingMappingException(
				"SurfaceScalarMapper", structure.ciftiName(), "No brain model for structure " + structure.ciftiName()));
		final int nVertices = mesh.getVertexCount();
		if (model.getSurfaceVertexCount() != nVertices)
			throw new InputShapeException("SurfaceScalarMapper", "Brain model of " + structure + " expects "
					+ model.getSurfaceVertexCount() + " vertices but mesh has " + nVertices);
		if (model.getOffset() + model.getCount() > data.getLength())
			throw new InputShapeException("SurfaceScalarMapper", "Grayordinates [" + model.getOffset() + ", "
					+ (model.getOffset() + model.getCount()) + ") exceed data length " + data.getLength());

		final double fill = (zeroNaN) ? 0d : Double.NaN;
		final double[][] out = new double[data.getMapCount()][nVertices];
		for (int m = 0; m < out.length; m++) {
			Arrays.fill(out[m], fill);
			for (int k = 0; k < model.getCount(); k++) {
				final int vertex = model.getVertexIndex(k);
				if (vertex < 0 || vertex >= nVertices)
					throw new InputShapeException("SurfaceScalarMapper", "Grayordinate " + (model.getOffset() + k)
							+ " maps to vertex " + vertex + " but mesh has " + nVertices + " vertices");
				final double value = data.get(m, model.getOffset() + k);
				out[m][vertex] = (zeroNaN && Double.isNaN(value)) ? 0d : value;
			}
		}
		log().debug("Mapped " + model.getCount() + " grayordinates x " + out.length + " map(s) onto " + mesh);
		return out;
	}

	/**
	 * Convenience method for single map mode.
	 *
	 * @see #map(Mesh, ScalarMaps, BrainModelIndex, boolean)
	 */
	public static double[] map(final Mesh mesh, final double[] data, final BrainModelIndex index,
			final boolean zeroNaN) {
		return map(mesh, ScalarMaps.of(data), index, zeroNaN)[0];
	}

	/**
	 * Picks one map of a mapped batch.
	 *
	 * @param mapped the mapped batch
	 * @param index the map index
	 * @return the selected map
	 * @throws ConfigurationException if index is out of range
	 */
	public static double[] select(final double[][] mapped, final int index) {
		if (index < 0 || index >= mapped.length)
			throw new ConfigurationException("SurfaceScalarMapper",
					"Map index " + index + " out of range [0, " + mapped.length + ")");
		return mapped[index];
	}

	/**
	 * Computes the colour limits of a surface figure: the 2nd and 98th
	 * percentiles of all the non-NaN data values.
	 *
	 * @param data the grayordinate data
	 * @return the limits, or an empty optional if all data is NaN
	 */
	public static Optional<IntensityWindow> colorLimits(final ScalarMaps data) {
		final double[] values = new double[data.getMapCount() * data.getLength()];
		int n = 0;
		for (int m = 0; m < data.getMapCount(); m++) {
			for (int i = 0; i < data.getLength(); i++) {
				final double v = data.get(m, i);
				if (!Double.isNaN(v)) values[n++] = v;
			}
		}
		if (n == 0) return Optional.empty();
		final double[] sample = Arrays.copyOf(values, n);
		final double lower = IntensityWindowEstimator.percentile(sample, LOWER_LIMIT_PERCENTILE);
		final double upper = IntensityWindowEstimator.percentile(sample, UPPER_LIMIT_PERCENTILE);
		return Optional.of(new IntensityWindow(lower, upper));
	}

	private static Logger log() {
		if (logger == null) logger = new Logger(SurfaceScalarMapper.class);
		return logger;
	}

}
