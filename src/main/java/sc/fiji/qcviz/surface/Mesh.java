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

import sc.fiji.qcviz.InputShapeException;
import sc.fiji.qcviz.volume.Axis;

/**
 * A triangulated surface: vertices in physical coordinates and faces as
 * triples of vertex indices. Meshes are immutable; construction validates
 * that every face index refers to an existing vertex.
 */
public class Mesh {

	private final double[][] vertices;
	private final int[][] faces;
	private final AnatomicalStructure structure;

	/**
	 * @param vertices the {x, y, z} vertex coordinates
	 * @param faces the vertex index triples
	 * @param structure the structure this mesh describes
	 * @throws InputShapeException if vertices or faces are malformed
	 */
	public Mesh(final double[][] vertices, final int[][] faces, final AnatomicalStructure structure) {
		if (vertices == null || faces == null)
			throw new InputShapeException("Mesh", "Vertices and faces are required");
		this.vertices = new double[vertices.length][];
		for (int i = 0; i < vertices.length; i++) {
			if (vertices[i] == null || vertices[i].length != 3)
				throw new InputShapeException("Mesh", "Vertex " + i + " does not have 3 coordinates");
			this.vertices[i] = vertices[i].clone();
		}
		this.faces = new int[faces.length][];
		for (int f = 0; f < faces.length; f++) {
			if (faces[f] == null || faces[f].length != 3)
				throw new InputShapeException("Mesh", "Face " + f + " is not a triangle");
			for (final int idx : faces[f]) {
				if (idx < 0 || idx >= vertices.length)
					throw new InputShapeException("Mesh", "Face " + f + " references vertex " + idx
							+ " but mesh has " + vertices.length + " vertices");
			}
			this.faces[f] = faces[f].clone();
		}
		this.structure = (structure == null) ? AnatomicalStructure.OTHER : structure;
	}

	public Mesh(final double[][] vertices, final int[][] faces) {
		this(vertices, faces, AnatomicalStructure.OTHER);
	}

	/**
	 * Merges two hemispheres into a single full-brain mesh. Vertices of the
	 * right hemisphere are appended to those of the left one, and its face
	 * indices shifted by the number of left vertices.
	 *
	 * @param left the left hemisphere
	 * @param right the right hemisphere
	 * @return the merged mesh
	 */
	public static MergedMesh merge(final Mesh left, final Mesh right) {
		final int offset = left.vertices.length;
		final double[][] v = new double[offset + right.vertices.length][];
		System.arraycopy(left.vertices, 0, v, 0, offset);
		System.arraycopy(right.vertices, 0, v, offset, right.vertices.length);
		final int[][] f = new int[left.faces.length + right.faces.length][];
		System.arraycopy(left.faces, 0, f, 0, left.faces.length);
		for (int i = 0; i < right.faces.length; i++) {
			final int[] face = right.faces[i];
			f[left.faces.length + i] = new int[] { face[0] + offset, face[1] + offset, face[2] + offset };
		}
		return new MergedMesh(new Mesh(v, f, AnatomicalStructure.OTHER), offset);
	}

	public int getVertexCount() {
		return vertices.length;
	}

	public int getFaceCount() {
		return faces.length;
	}

	/** @return the coordinates of the specified vertex */
	public double[] getVertex(final int index) {
		return vertices[index].clone();
	}

	/** @return the vertex indices of the specified face */
	public int[] getFace(final int index) {
		return faces[index].clone();
	}

	/** @return the coordinate of a vertex along the specified axis (no copy) */
	public double coordinate(final int vertex, final Axis axis) {
		return vertices[vertex][axis.index()];
	}

	/** @return the vertex index of the specified corner of a face (no copy) */
	public int faceVertex(final int face, final int corner) {
		return faces[face][corner];
	}

	public AnatomicalStructure getStructure() {
		return structure;
	}

	/**
	 * @return the {min, max} vertex coordinates along the specified axis, or
	 *         {NaN, NaN} if mesh has no vertices
	 */
	public double[] range(final Axis axis) {
		if (vertices.length == 0) return new double[] { Double.NaN, Double.NaN };
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (final double[] v : vertices) {
			min = Math.min(min, v[axis.index()]);
			max = Math.max(max, v[axis.index()]);
		}
		return new double[] { min, max };
	}

	@Override
	public String toString() {
		return "Mesh[" + structure + ", " + vertices.length + " vertices, " + faces.length + " faces]";
	}

}
