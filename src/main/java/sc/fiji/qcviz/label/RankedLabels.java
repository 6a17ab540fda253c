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
import java.util.Collections;
import java.util.List;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.integer.IntType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import sc.fiji.qcviz.ConfigurationException;
import sc.fiji.qcviz.volume.Resampler;
import sc.fiji.qcviz.volume.Resampler.Interpolation;
import sc.fiji.qcviz.volume.Volume;
import sc.fiji.qcviz.volume.VoxelAffine;

/**
 * A label volume whose (sparse, unordered) codes have been replaced by their
 * dense 0-based rank among the sorted distinct codes present, together with
 * the color table matching those ranks: {@code colors.get(rank)} is the
 * lookup color of {@code codes[rank]}.
 *
 * @see LabelRecolorer
 */
public class RankedLabels {

	private final Img<IntType> ranks;
	private final VoxelAffine affine;
	private final int[] codes;
	private final List<LabelColor> colors;
	private List<Volume> masks;

	RankedLabels(final Img<IntType> ranks, final VoxelAffine affine, final int[] codes, final List<LabelColor> colors) {
		this.ranks = ranks;
		this.affine = affine;
		this.codes = codes;
		this.colors = Collections.unmodifiableList(new ArrayList<>(colors));
	}

	/** @return the rank-remapped volume */
	public Volume getRankVolume() {
		return Volume.of(ranks, affine, "ranks");
	}

	public Img<IntType> getRanks() {
		return ranks;
	}

	/** @return the sorted distinct codes, indexed by rank */
	public int[] getCodes() {
		return codes.clone();
	}

	/** @return the original code of the specified rank */
	public int getCode(final int rank) {
		checkRank(rank);
		return codes[rank];
	}

	/** @return the color table, indexed by rank */
	public List<LabelColor> getColors() {
		return colors;
	}

	/** @return the number of distinct labels (regions) */
	public int size() {
		return codes.length;
	}

	public VoxelAffine getAffine() {
		return affine;
	}

	/**
	 * Decomposes the rank volume into one binary mask per rank. The list is
	 * materialized once and can be traversed any number of times. Masks are
	 * pairwise disjoint and their union is the whole rank volume.
	 *
	 * @return the masks, indexed by rank
	 */
	public synchronized List<Volume> masks() {
		if (masks == null) {
			final List<Img<BitType>> bits = new ArrayList<>(codes.length);
			for (int i = 0; i < codes.length; i++)
				bits.add(ArrayImgs.bits(Intervals.dimensionsAsLongArray(ranks)));
			final List<RandomAccess<BitType>> accesses = new ArrayList<>(codes.length);
			bits.forEach(b -> accesses.add(b.randomAccess()));
			final Cursor<IntType> cursor = ranks.localizingCursor();
			while (cursor.hasNext()) {
				final int rank = cursor.next().get();
				final RandomAccess<BitType> ra = accesses.get(rank);
				ra.setPosition(cursor);
				ra.get().set(true);
			}
			final List<Volume> list = new ArrayList<>(codes.length);
			for (int i = 0; i < codes.length; i++)
				list.add(Volume.of(bits.get(i), affine, "label-" + codes[i]));
			masks = Collections.unmodifiableList(list);
		}
		return masks;
	}

	/**
	 * @param rank the label rank
	 * @return the binary mask of the specified rank
	 */
	public Volume mask(final int rank) {
		checkRank(rank);
		return masks().get(rank);
	}

	/**
	 * Resamples the rank volume onto the grid of a reference volume, using
	 * nearest neighbor interpolation. Voxels falling outside this volume are
	 * assigned rank 0.
	 *
	 * @param reference the volume defining the target grid
	 * @return the resampled labels, sharing codes and colors with this instance
	 */
	public RankedLabels resampleTo(final Volume reference) {
		final Volume rankVolume = getRankVolume();
		if (rankVolume.isSameGrid(reference.to3D())) return this;
		final Volume resampled = Resampler.resample(rankVolume, reference, Interpolation.NEAREST);
		final Img<IntType> out = ArrayImgs.ints(resampled.spatialDimensions());
		final Cursor<IntType> outCursor = out.localizingCursor();
		final RandomAccess<DoubleType> in = resampled.getData().randomAccess();
		while (outCursor.hasNext()) {
			outCursor.fwd();
			in.setPosition(outCursor);
			outCursor.get().set((int) Math.round(in.get().getRealDouble()));
		}
		return new RankedLabels(out, resampled.getAffine(), codes, colors);
	}

	private void checkRank(final int rank) {
		if (rank < 0 || rank >= codes.length)
			throw new ConfigurationException("RankedLabels", "Rank " + rank + " out of bounds [0, " + codes.length + ")");
	}

	@Override
	public String toString() {
		return "RankedLabels" + Arrays.toString(codes);
	}

}
