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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The structural index table of a dense grayordinate dataset: the ordered
 * list of its {@link BrainModel}s.
 */
public class BrainModelIndex {

	private final List<BrainModel> models;

	public BrainModelIndex(final List<BrainModel> models) {
		this.models = Collections.unmodifiableList(new ArrayList<>(models));
	}

	public BrainModelIndex(final BrainModel... models) {
		this(Arrays.asList(models));
	}

	public List<BrainModel> getModels() {
		return models;
	}

	/**
	 * @param structure the structure to look for
	 * @return the first brain model describing the structure, if any
	 */
	public Optional<BrainModel> find(final AnatomicalStructure structure) {
		return models.stream().filter(m -> m.getStructure() == structure).findFirst();
	}

	/** @return the total number of grayordinates described by this table */
	public int getGrayordinateCount() {
		int max = 0;
		for (final BrainModel m : models)
			max = Math.max(max, m.getOffset() + m.getCount());
		return max;
	}

	@Override
	public String toString() {
		return "BrainModelIndex" + models;
	}

}
