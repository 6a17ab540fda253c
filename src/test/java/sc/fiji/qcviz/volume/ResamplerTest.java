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
import static org.junit.Assert.assertSame;

import org.junit.Test;

import net.imglib2.img.array.ArrayImgs;
import sc.fiji.qcviz.ConfigurationException;
import sc.fiji.qcviz.SyntheticData;
import sc.fiji.qcviz.volume.Resampler.Interpolation;

/**
 * Tests for {@link Resampler}
 */
public class ResamplerTest {

	@Test
	public void testSameGridIsUnchanged() {
		final Volume vol = SyntheticData.centeredBlock();
		final Volume reference = Volume.of(ArrayImgs.bytes(10, 10, 10), VoxelAffine.identity());
		assertSame(vol, Resampler.resample(vol, reference, Interpolation.LINEAR));
	}

	@Test
	public void testNearestOntoFinerGrid() {
		final Volume coarse = SyntheticData.block(4, 1, 1, 3f, VoxelAffine.scaling(2, 2, 2));
		final Volume fine = Volume.of(ArrayImgs.floats(8, 8, 8), VoxelAffine.identity());
		final Volume resampled = Resampler.resample(coarse, fine, Interpolation.NEAREST);
		assertArrayEquals(new long[] { 8, 8, 8 }, resampled.spatialDimensions());
		assertEquals(fine.getAffine(), resampled.getAffine());
		assertEquals(3d, resampled.getValue(2, 2, 2), 1e-6);
		assertEquals(0d, resampled.getValue(6, 6, 6), 1e-6);
	}

	@Test
	public void testLinearAndOutOfBounds() {
		final Volume vol = SyntheticData.block(2, 1, 1, 8f, VoxelAffine.identity());
		final Volume reference = Volume.of(ArrayImgs.floats(3, 3, 3),
				VoxelAffine.scaling(0.5, 0.5, 0.5).withOrigin(0.5, 0.5, 0.5));
		final Volume resampled = Resampler.resample(vol, reference, Interpolation.LINEAR);
		// (0.5, 0.5, 0.5) lies halfway between 0 and the corner voxel on every axis
		assertEquals(1d, resampled.getValue(0, 0, 0), 1e-6);
		assertEquals(8d, resampled.getValue(1, 1, 1), 1e-6);
		final Volume shifted = Volume.of(ArrayImgs.floats(2, 2, 2), VoxelAffine.identity().withOrigin(10, 10, 10));
		assertEquals(0d, Resampler.resample(vol, shifted, Interpolation.LINEAR).getValue(0, 0, 0), 0);
	}

	@Test(expected = ConfigurationException.class)
	public void testUnknownInterpolation() {
		Interpolation.fromName("cubic");
	}

}
