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

/**
 * A contiguous range {@code [start, end)} of cut indices displayed on one
 * montage row.
 */
public class MontageRow {

	private final int start;
	private final int end;

	public MontageRow(final int start, final int end) {
		if (start < 0 || end < start)
			throw new IllegalArgumentException("Invalid row range [" + start + ", " + end + ")");
		this.start = start;
		this.end = end;
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	/** @return the number of cuts on this row */
	public int size() {
		return end - start;
	}

	/** @return the row title, e.g., {@code figure:0-5} */
	public String title(final String figureTitle) {
		return figureTitle + ":" + start + "-" + end;
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof MontageRow)) return false;
		final MontageRow other = (MontageRow) o;
		return start == other.start && end == other.end;
	}

	@Override
	public int hashCode() {
		return 31 * start + end;
	}

	@Override
	public String toString() {
		return "[" + start + ", " + end + ")";
	}

}
