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
package sc.fiji.qcviz.viewer;

import java.util.ArrayList;
import java.util.List;

import sc.fiji.qcviz.ConfigurationException;

/**
 * Splits a sequence of cuts into montage rows of fixed width.
 */
public class MontageLayout {

	private MontageLayout() {
	}

	/**
	 * Computes the rows of a montage. All rows hold {@code nCols} cuts except
	 * the last one, which holds the remainder.
	 *
	 * @param nCuts the total number of cuts
	 * @param nCols the number of cuts per row
	 * @return the {@code ceil(nCuts / nCols)} rows, in order
	 * @throws ConfigurationException if either count is not positive
	 */
	public static List<MontageRow> rows(final int nCuts, final int nCols) {
		ConfigurationException.requirePositive("MontageLayout", "nCuts", nCuts);
		ConfigurationException.requirePositive("MontageLayout", "nCols", nCols);
		final int nRows = nCuts / nCols + ((nCuts % nCols == 0) ? 0 : 1);
		final List<MontageRow> rows = new ArrayList<>(nRows);
		for (int i = 0; i < nRows; i++) {
			final long start = (long) i * nCols;
			rows.add(new MontageRow((int) start, (int) Math.min(start + nCols, nCuts)));
		}
		return rows;
	}

}
