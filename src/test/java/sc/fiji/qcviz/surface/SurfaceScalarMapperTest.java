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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.Before;
import org.junit.Test;

import sc.fiji.qcviz.ConfigurationException;
import sc.fiji.qcviz.InputShapeException;
import sc.fiji.qcviz.MissingMappingException;
import sc.fiji.qcviz.SyntheticData;
import sc.fiji.qcviz.volume.IntensityWindow;

/**
 * Tests for {@link SurfaceScalarMapper}
 */
public class SurfaceScalarMapperTest {

	private Mesh left;
	private Mesh right;
	private BrainModelIndex index;

	@Before
	public void setUp() {
		left = SyntheticData.octahedron(new double[] { -2, 0, 0 }, 1, AnatomicalStructure.CORTEX_LEFT);
		right = SyntheticData.octahedron(new double[] { 2, 0, 0 }, 1, AnatomicalStructure.CORTEX_RIGHT);
		// the medial wall (vertex 1 on the left, vertex 0 on the right) has no grayordinate
		index = new BrainModelIndex(new BrainModel(AnatomicalStructure.CORTEX_LEFT, 0, new int[] { 0, 2, 3, 4, 5 }, 6),
				new BrainModel(AnatomicalStructure.CORTEX_RIGHT, 5, new int[] { 1, 2, 3, 4, 5 }, 6));
	}

	@Test
	public void testMapping() {
		final double[] data = { 0, 1, 2, 3, 4, 10, 11, 12, 13, 14 };
		assertEquals(10, index.getGrayordinateCount());
		final double[] l = SurfaceScalarMapper.map(left, data, index, false);
		assertEquals(0d, l[0], 0);
		assertTrue(Double.isNaN(l[1]));
		assertEquals(4d, l[5], 0);
		final double[] r = SurfaceScalarMapper.map(right, data, index, true);
		assertEquals("Unmapped vertex is zeroed", 0d, r[0], 0);
		assertArrayEquals(new double[] { 10, 11, 12, 13, 14 }, Arrays.copyOfRange(r, 1, 6), 0);
	}

	@Test
	public void testBatch() {
		final double[][] maps = new double[3][10];
		for (int m = 0; m < 3; m++)
			Arrays.fill(maps[m], m);
		maps[1][6] = Double.NaN;
		final double[][] mapped = SurfaceScalarMapper.map(right, ScalarMaps.of(maps), index, true);
		assertEquals(3, mapped.length);
		assertEquals(2d, SurfaceScalarMapper.select(mapped, 2)[3], 0);
		assertEquals("NaN data is zeroed", 0d, mapped[1][2], 0);
	}

	@Test(expected = ConfigurationException.class)
	public void testSelectOutOfRange() {
		SurfaceScalarMapper.select(new double[2][4], 2);
	}

	@Test
	public void testMissingStructure() {
		final BrainModelIndex leftOnly = new BrainModelIndex(
				new BrainModel(AnatomicalStructure.CORTEX_LEFT, 0, new int[] { 0, 1 }, 6));
		try {
			SurfaceScalarMapper.map(right, new double[2], leftOnly, false);
			fail("Right hemisphere has no brain model");
		} catch (final MissingMappingException e) {
			assertEquals("CIFTI_STRUCTURE_CORTEX_RIGHT", e.getKey());
		}
	}

	@Test(expected = InputShapeException.class)
	public void testVertexCountMismatch() {
		final Mesh small = new Mesh(new double[][] { { 0, 0, 0 }, { 1, 0, 0 }, { 0, 1, 0 } },
				new int[][] { { 0, 1, 2 } }, AnatomicalStructure.CORTEX_LEFT);
		SurfaceScalarMapper.map(small, new double[10], index, false);
	}

	@Test(expected = InputShapeException.class)
	public void testDataTooShort() {
		SurfaceScalarMapper.map(right, new double[8], index, false);
	}

	@Test(expected = InputShapeException.class)
	public void testUnequalMapLengths() {
		ScalarMaps.of(new double[][] { new double[3], new double[4] });
	}

	@Test
	public void testColorLimits() {
		final double[] data = new double[101];
		for (int i = 0; i < data.length; i++)
			data[i] = i;
		data[50] = Double.NaN;
		final IntensityWindow limits = SurfaceScalarMapper.colorLimits(ScalarMaps.of(data)).get();
		assertTrue(limits.getLower() > 1 && limits.getLower() < 3);
		assertTrue(limits.getUpper() > 97 && limits.getUpper() < 99);
		assertFalse(SurfaceScalarMapper.colorLimits(ScalarMaps.of(new double[] { Double.NaN })).isPresent());
	}

}
