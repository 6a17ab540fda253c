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

/**
 * One block of a dense grayordinate dataset: the grayordinates
 * {@code [offset, offset + count)} of a dataset map onto the listed vertices
 * of a surface with {@code surfaceVertexCount} vertices.
 */
public class BrainModel {

	private final AnatomicalStructure structure;
	private final int offset;
	private final int[] vertexIndices;
	private final int surfaceVertexCount;

	/**
	 * @param structure the structure this block describes
	 * @param offset the index of the first grayordinate of the block
	 * @param vertexIndices the surface vertex of each grayordinate of the block
	 * @param surfaceVertexCount the number of vertices of the surface the block
	 *          was defined on
	 */
	public BrainModel(final AnatomicalStructure structure, final int offset, final int[] vertexIndices,
			final int surfaceVertexCount) {
		if (offset < 0)
			throw new InputShapeException("BrainModel", "Negative grayordinate offset: " + offset);
		if (surfaceVertexCount < 0)
			throw new InputShapeException("BrainModel", "Negative surface vertex count: " + surfaceVertexCount);
		this.structure = (structure == null) ? AnatomicalStructure.OTHER : structure;
		this.offset = offset;
		this.vertexIndices = (vertexIndices == null) ? new int[0] : vertexIndices.clone();
		this.surfaceVertexCount = surfaceVertexCount;
	}

	public AnatomicalStructure getStructure() {
		return structure;
	}

	public int getOffset() {
		return offset;
	}

	/** @return the number of grayordinates in this block */
	public int getCount() {
		return vertexIndices.length;
	}

	/** @return the surface vertex index of the k-th grayordinate of the block */
	public int getVertexIndex(final int k) {
		return vertexIndices[k];
	}

	public int[] getVertexIndices() {
		return vertexIndices.clone();
	}

	public int getSurfaceVertexCount() {
		return surfaceVertexCount;
	}

	@Override
	public String toString() {
		return "BrainModel[" + structure + ", offset=" + offset + ", count=" + getCount() + ", surfaceVertices="
				+ surfaceVertexCount + "]";
	}

}
