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
package sc.fiji.qcviz.label;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import net.imglib2.img.array.ArrayImgs;
import sc.fiji.qcviz.MissingMappingException;
import sc.fiji.qcviz.SyntheticData;
import sc.fiji.qcviz.volume.Volume;
import sc.fiji.qcviz.volume.VoxelAffine;

/**
 * Tests for {@link LabelRecolorer} and {@link RankedLabels}
 */
public class LabelRecolorerTest {

	private LabelRecolorer recolorer;

	@Before
	public void setUp() throws IOException {
		try (InputStream is = getClass().getResourceAsStream("TestColorLUT.txt")) {
			recolorer = new LabelRecolorer(ColorLookupTable.parse(new InputStreamReader(is, StandardCharsets.UTF_8)));
		}
	}

	@Test
	public void testRanksFollowSortedCodes() {
		final Volume labels = SyntheticData.labels(new long[] { 3, 2, 2 }, 7, 3, 9);
		assertArrayEquals(new int[] { 3, 7, 9 }, LabelRecolorer.distinctCodes(labels));

		final RankedLabels ranked = recolorer.recolor(labels);
		assertEquals(3, ranked.size());
		assertArrayEquals(new int[] { 3, 7, 9 }, ranked.getCodes());
		final List<LabelColor> colors = ranked.getColors();
		assertEquals("Color of rank 0 is the color of code 3", recolorer.getLookupTable().get(3), colors.get(0));
		assertEquals(recolorer.getLookupTable().get(7), colors.get(1));
		assertEquals(recolorer.getLookupTable().get(9), colors.get(2));

		// first voxel holds code 7, second code 3, third code 9
		final Volume rankVolume = ranked.getRankVolume();
		assertEquals(1d, rankVolume.getValue(0, 0, 0), 0);
		assertEquals(0d, rankVolume.getValue(1, 0, 0), 0);
		assertEquals(2d, rankVolume.getValue(2, 0, 0), 0);
		assertEquals(7, ranked.getCode(1));
	}

	@Test
	public void testUnknownCode() {
		final Volume labels = SyntheticData.labels(new long[] { 2, 2, 2 }, 3, 5);
		try {
			recolorer.recolor(labels);
			fail("Code 5 has no lookup entry");
		} catch (final MissingMappingException e) {
			assertEquals(5, e.getKey());
		}
	}

	@Test
	public void testMasksPartitionTheVolume() {
		final RankedLabels ranked = recolorer.recolor(SyntheticData.labels(new long[] { 4, 3, 2 }, 0, 2, 41, 2));
		final List<Volume> masks = ranked.masks();
		assertEquals(3, masks.size());
		assertSame("Masks are computed once", masks, ranked.masks());
		final double[][] flat = new double[masks.size()][];
		for (int i = 0; i < masks.size(); i++)
			flat[i] = masks.get(i).flatten();
		for (int v = 0; v < flat[0].length; v++) {
			double sum = 0;
			for (final double[] m : flat)
				sum += m[v];
			assertEquals("Voxel " + v + " belongs to exactly one mask", 1d, sum, 0);
		}
		// traversing again yields the same content
		for (int i = 0; i < masks.size(); i++)
			assertArrayEquals(flat[i], ranked.masks().get(i).flatten(), 0);
		assertEquals(12d, Arrays.stream(ranked.mask(1).flatten()).sum(), 0);
	}

	@Test
	public void testResampleKeepsColors() {
		final RankedLabels ranked = recolorer.recolor(SyntheticData.labels(new long[] { 2, 2, 2 }, 3, 9));
		final Volume reference = Volume.of(ArrayImgs.floats(4, 4, 4), VoxelAffine.scaling(0.5, 0.5, 0.5));
		final RankedLabels resampled = ranked.resampleTo(reference);
		assertArrayEquals(new long[] { 4, 4, 4 }, resampled.getRankVolume().spatialDimensions());
		assertEquals(ranked.getColors(), resampled.getColors());
		assertEquals(ranked.getRankVolume().getValue(1, 0, 0), resampled.getRankVolume().getValue(2, 0, 0), 0);
		assertSame(ranked, ranked.resampleTo(ranked.getRankVolume()));
	}

}
