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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Before;
import org.junit.Test;

import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import sc.fiji.qcviz.ConfigurationException;
import sc.fiji.qcviz.SyntheticData;

/**
 * Tests for {@link CutSelector}
 */
public class CutSelectorTest {

	private static final double EPSILON = 1e-9;
	private CutSelector selector;

	@Before
	public void setUp() {
		selector = new CutSelector();
	}

	@Test
	public void testCenteredBlock() {
		final Volume volume = SyntheticData.centeredBlock();
		final BoundingBox box = selector.boundingBox(volume);
		assertFalse(box.isFallback());
		assertArrayEquals(new long[] { 3, 3, 3 }, box.getStart());
		assertArrayEquals(new long[] { 7, 7, 7 }, box.getStop());
		assertEquals(3d, box.getMin(Axis.Z), EPSILON);
		assertEquals(7d, box.getMax(Axis.Z), EPSILON);

		final double[] z = selector.cuts(volume, 3, Axis.Z).get(Axis.Z);
		assertArrayEquals(new double[] { 4, 5, 6 }, z, EPSILON);
		for (final double c : z)
			assertTrue(box.contains(Axis.Z, c));
	}

	@Test
	public void testAffineIsApplied() {
		final VoxelAffine affine = VoxelAffine.scaling(2, 2, 2).withOrigin(-10, -10, -10);
		final Volume volume = SyntheticData.block(10, 3, 6, 5f, affine);
		final CutCoordinates cuts = selector.cuts(volume, 3);
		for (final Axis axis : Axis.values())
			assertArrayEquals(new double[] { -2, 0, 2 }, cuts.get(axis), EPSILON);
	}

	@Test
	public void testCutsAreIncreasingWithFlippedAxis() {
		final VoxelAffine flipped = new VoxelAffine(new double[][] { { -1, 0, 0, 9 }, { 0, 1, 0, 0 }, { 0, 0, 1, 0 } });
		final Volume volume = SyntheticData.block(10, 2, 8, 1f, flipped);
		final double[] x = selector.cuts(volume, 5, Axis.X).get(Axis.X);
		assertEquals(5, x.length);
		for (int i = 1; i < x.length; i++)
			assertTrue(x[i] > x[i - 1]);
		final BoundingBox box = selector.boundingBox(volume);
		for (final double c : x)
			assertTrue(box.contains(Axis.X, c));
	}

	@Test
	public void testEmptyVolumeFallsBackToFullExtent() {
		final Volume empty = Volume.of(ArrayImgs.floats(4, 5, 6), VoxelAffine.identity());
		final BoundingBox box = selector.boundingBox(empty);
		assertTrue(box.isFallback());
		assertArrayEquals(new long[] { 0, 0, 0 }, box.getStart());
		assertArrayEquals(new long[] { 4, 5, 6 }, box.getStop());
		final CutCoordinates cuts = selector.cuts(empty, 2);
		assertEquals(2, cuts.count(Axis.Y));
		assertEquals(2, selector.cuts(empty, 2).get(Axis.Z).length);
	}

	@Test
	public void testFullForegroundSpansFullExtent() {
		final Img<FloatType> img = ArrayImgs.floats(4, 5, 6);
		for (final FloatType t : img)
			t.set(1f);
		final BoundingBox box = selector.boundingBox(Volume.of(img, VoxelAffine.identity()));
		assertFalse(box.isFallback());
		assertArrayEquals(new long[] { 0, 0, 0 }, box.getStart());
		assertArrayEquals(new long[] { 4, 5, 6 }, box.getStop());
	}

	@Test
	public void testBoxFromCompanionMask() {
		final Volume mask = SyntheticData.block(10, 0, 1, 1f, VoxelAffine.identity());
		final double[] z = selector.cuts(mask, 1, Axis.Z).get(Axis.Z);
		assertArrayEquals(new double[] { 1 }, z, EPSILON);
	}

	@Test
	public void testThreshold() {
		final Volume faint = SyntheticData.block(10, 3, 6, 1e-4f, VoxelAffine.identity());
		assertTrue(new CutSelector().boundingBox(faint).isFallback());
		assertFalse(new CutSelector(0).boundingBox(faint).isFallback());
	}

	@Test(expected = ConfigurationException.class)
	public void testNonPositiveCuts() {
		selector.cuts(SyntheticData.centeredBlock(), 0);
	}

	@Test(expected = ConfigurationException.class)
	public void testMissingAxis() {
		selector.cuts(SyntheticData.centeredBlock(), 3, Axis.Z).get(Axis.X);
	}

}
