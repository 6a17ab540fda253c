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

import java.util.Arrays;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;

import sc.fiji.qcviz.InputShapeException;

/**
 * A 4x4 homogeneous affine mapping voxel indices (i, j, k) to physical
 * coordinates (x, y, z), as stored in NIfTI/MGH headers.
 */
public class VoxelAffine {

	private final RealMatrix matrix;
	private RealMatrix inverse;

	/**
	 * @param matrix the 4x4 (or 3x4) row-major affine. The last row, if
	 *          present, must be {@code [0 0 0 1]}
	 */
	public VoxelAffine(final double[][] matrix) {
		if (matrix == null || matrix.length < 3 || matrix.length > 4)
			throw new InputShapeException("VoxelAffine", "Affine must have 3 or 4 rows");
		final double[][] m = new double[4][];
		for (int r = 0; r < 3; r++) {
			if (matrix[r].length != 4)
				throw new InputShapeException("VoxelAffine", "Affine row " + r + " must have 4 columns");
			m[r] = matrix[r].clone();
		}
		m[3] = new double[] { 0, 0, 0, 1 };
		this.matrix = new Array2DRowRealMatrix(m, false);
	}

	/** @return the identity affine (1 mm isotropic voxels, origin at voxel 0) */
	public static VoxelAffine identity() {
		return scaling(1, 1, 1);
	}

	/**
	 * @return an axis-aligned affine with the given voxel sizes and a zero
	 *         origin
	 */
	public static VoxelAffine scaling(final double sx, final double sy, final double sz) {
		return new VoxelAffine(new double[][] { { sx, 0, 0, 0 }, { 0, sy, 0, 0 }, { 0, 0, sz, 0 } });
	}

	/** @return a copy of this affine with the specified translation (origin) */
	public VoxelAffine withOrigin(final double x, final double y, final double z) {
		final double[][] m = matrix.getData();
		m[0][3] = x;
		m[1][3] = y;
		m[2][3] = z;
		return new VoxelAffine(m);
	}

	/**
	 * Maps a voxel position to physical space.
	 *
	 * @param voxel the (i, j, k) position (fractional positions allowed)
	 * @return the physical (x, y, z) coordinates
	 */
	public double[] apply(final double... voxel) {
		final double[] out = new double[3];
		for (int r = 0; r < 3; r++) {
			out[r] = matrix.getEntry(r, 0) * voxel[0] + matrix.getEntry(r, 1) * voxel[1]
					+ matrix.getEntry(r, 2) * voxel[2] + matrix.getEntry(r, 3);
		}
		return out;
	}

	/**
	 * Maps a physical position to (fractional) voxel space.
	 *
	 * @param physical the (x, y, z) coordinates
	 * @return the voxel (i, j, k) position
	 */
	public double[] applyInverse(final double... physical) {
		final RealMatrix inv = inverse();
		final double[] out = new double[3];
		for (int r = 0; r < 3; r++) {
			out[r] = inv.getEntry(r, 0) * physical[0] + inv.getEntry(r, 1) * physical[1]
					+ inv.getEntry(r, 2) * physical[2] + inv.getEntry(r, 3);
		}
		return out;
	}

	/**
	 * Returns the voxel dimension that varies the most along a physical axis,
	 * i.e., the grid axis that best matches it. For axis-aligned affines this
	 * is the exact correspondence.
	 *
	 * @param axis the physical axis
	 * @return the voxel dimension (0, 1, or 2)
	 */
	public int gridDimension(final Axis axis) {
		int best = 0;
		double max = -1;
		for (int c = 0; c < 3; c++) {
			final double v = Math.abs(matrix.getEntry(axis.index(), c));
			if (v > max) {
				max = v;
				best = c;
			}
		}
		return best;
	}

	/** @return the voxel size along the specified voxel dimension */
	public double voxelSize(final int dimension) {
		return matrix.getColumnVector(dimension).getSubVector(0, 3).getNorm();
	}

	private synchronized RealMatrix inverse() {
		if (inverse == null) {
			try {
				inverse = new LUDecomposition(matrix).getSolver().getInverse();
			} catch (final SingularMatrixException e) {
				throw new InputShapeException("VoxelAffine", "Affine is not invertible", e);
			}
		}
		return inverse;
	}

	/** @return a copy of the 4x4 affine */
	public double[][] getMatrix() {
		return matrix.getData();
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof VoxelAffine)) return false;
		return Arrays.deepEquals(matrix.getData(), ((VoxelAffine) o).matrix.getData());
	}

	@Override
	public int hashCode() {
		return Arrays.deepHashCode(matrix.getData());
	}

	@Override
	public String toString() {
		return "VoxelAffine" + Arrays.deepToString(matrix.getData());
	}

}
