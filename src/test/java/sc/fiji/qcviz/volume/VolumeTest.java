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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

import net.imglib2.Cursor;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.view.Views;
import sc.fiji.qcviz.ConfigurationException;
import sc.fiji.qcviz.InputShapeException;
import sc.fiji.qcviz.SyntheticData;

/**
 * Tests for {@link Volume}
 */
public class VolumeTest {

	private static Volume timeSeries() {
		final Img<UnsignedShortType> img = ArrayImgs.unsignedShorts(3, 3, 3, 4);
		final Cursor<UnsignedShortType> c = img.localizingCursor();
		while (c.hasNext()) {
			c.fwd();
			c.get().set(10 * c.getIntPosition(3) + 1);
		}
		return Volume.of(img, VoxelAffine.identity(), "bold");
	}

	@Test
	public void testTranslatedImageIsZeroMin() {
		final Img<UnsignedShortType> img = ArrayImgs.unsignedShorts(2, 2, 2);
		img.firstElement().set(7);
		final Volume vol = Volume.of(Views.translate(img, 5, 5, 5), VoxelAffine.identity());
		assertEquals(0, vol.getData().min(0));
		assertEquals(7d, vol.getValue(0, 0, 0), 0);
		assertArrayEquals(new long[] { 2, 2, 2 }, vol.spatialDimensions());
	}

	@Test
	public void testTo3D() {
		final Volume vol = timeSeries();
		assertTrue(vol.is4D());
		final Volume first = vol.to3D();
		assertFalse(first.is4D());
		assertArrayEquals(new long[] { 3, 3, 3 }, first.spatialDimensions());
		assertEquals(1d, first.getValue(1, 1, 1), 0);
		assertEquals(31d, vol.to3D(3).getValue(0, 2, 1), 0);
		final Volume vol3D = SyntheticData.centeredBlock();
		assertSame(vol3D, vol3D.to3D(5));
	}

	@Test(expected = ConfigurationException.class)
	public void testTo3DOutOfBounds() {
		timeSeries().to3D(4);
	}

	@Test(expected = InputShapeException.class)
	public void testRejects2D() {
		Volume.of(ArrayImgs.floats(4, 4), VoxelAffine.identity());
	}

	@Test
	public void testThresholdIsLazyAndReadOnly() {
		final Volume block = SyntheticData.block(5, 1, 2, 0.5f, VoxelAffine.identity());
		final Volume thresholded = block.threshold(1);
		assertEquals(0d, thresholded.getValue(1, 1, 1), 0);
		assertEquals(0.5, block.getValue(1, 1, 1), 1e-6);
		assertTrue(thresholded.isSameGrid(block));
	}

	@Test
	public void testFlatten() {
		final double[] values = SyntheticData.centeredBlock().flatten();
		assertEquals(1000, values.length);
		assertEquals(64 * 5d, Arrays.stream(values).sum(), 1e-6);
	}

	@Test(expected = InputShapeException.class)
	public void testSingularAffine() {
		new VoxelAffine(new double[][] { { 1, 0, 0, 0 }, { 0, 0, 0, 0 }, { 0, 0, 1, 0 } }).applyInverse(1, 1, 1);
	}

	@Test
	public void testVoxelAffine() {
		final VoxelAffine affine = VoxelAffine.scaling(2, 3, 4).withOrigin(1, 1, 1);
		assertArrayEquals(new double[] { 3, 4, 5 }, affine.apply(1, 1, 1), 1e-12);
		assertArrayEquals(new double[] { 1, 1, 1 }, affine.applyInverse(3, 4, 5), 1e-12);
		assertEquals(4d, affine.voxelSize(2), 1e-12);
		assertEquals(1, affine.gridDimension(Axis.Y));
	}

}
