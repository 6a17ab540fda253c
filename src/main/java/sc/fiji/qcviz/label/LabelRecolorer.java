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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.integer.IntType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import sc.fiji.qcviz.MissingMappingException;
import sc.fiji.qcviz.util.Logger;
import sc.fiji.qcviz.volume.Volume;

/**
 * Remaps a categorical label volume (e.g., a FreeSurfer parcellation) to
 * dense ranks and binds it to the colors of an external lookup table.
 * <p>
 * Codes are voxel values truncated to integers. Ranks follow the ascending
 * order of the distinct codes present in the data; the i-th entry of the
 * resulting color table is the lookup color of the i-th smallest code.
 * </p>
 */
public class LabelRecolorer {

	private final ColorLookupTable lookupTable;
	private Logger logger;

	/**
	 * @param lookupTable the lookup table mapping original codes to colors
	 */
	public LabelRecolorer(final ColorLookupTable lookupTable) {
		if (lookupTable == null) throw new IllegalArgumentException("Lookup table cannot be null");
		this.lookupTable = lookupTable;
	}

	/**
	 * Retrieves the sorted distinct codes of a label volume.
	 *
	 * @param labels the label volume (4D volumes are reduced to their first 3D
	 *          volume)
	 * @return the distinct codes, in ascending order
	 */
	public static int[] distinctCodes(final Volume labels) {
		final Cursor<DoubleType> cursor = Views.iterable(labels.to3D().getData()).cursor();
		final Set<Integer> codes = new HashSet<>();
		while (cursor.hasNext())
			codes.add((int) cursor.next().getRealDouble());
		return codes.stream().mapToInt(Integer::intValue).sorted().toArray();
	}

	/**
	 * Rank-remaps a label volume.
	 *
	 * @param labels the label volume (4D volumes are reduced to their first 3D
	 *          volume)
	 * @return the rank-remapped labels and their color table
	 * @throws MissingMappingException if a code present in the
	 *           data has no entry in the lookup table
	 */
	public RankedLabels recolor(final Volume labels) {
		final Volume vol = labels.to3D();
		final int[] codes = distinctCodes(vol);

		// resolve all colors before allocating: fails on the first unknown code
		final List<LabelColor> colors = new ArrayList<>(codes.length);
		for (final int code : codes)
			colors.add(lookupTable.get(code));

		final Img<IntType> ranks = ArrayImgs.ints(vol.spatialDimensions());
		final Cursor<IntType> cursor = ranks.localizingCursor();
		final RandomAccess<DoubleType> in = vol.getData().randomAccess();
		while (cursor.hasNext()) {
			cursor.fwd();
			in.setPosition(cursor);
			cursor.get().set(Arrays.binarySearch(codes, (int) in.get().getRealDouble()));
		}
		log().debug("Remapped " + codes.length + " labels: " + Arrays.toString(codes));
		return new RankedLabels(ranks, vol.getAffine(), codes, colors);
	}

	public ColorLookupTable getLookupTable() {
		return lookupTable;
	}

	private Logger log() {
		if (logger == null) logger = new Logger(LabelRecolorer.class);
		return logger;
	}

}
