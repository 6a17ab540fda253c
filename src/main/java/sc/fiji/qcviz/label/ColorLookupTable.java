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

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import sc.fiji.qcviz.InputShapeException;
import sc.fiji.qcviz.MissingMappingException;

/**
 * A mapping of integer label codes to display colors, e.g., as read from a
 * FreeSurfer {@code FreeSurferColorLUT.txt} file.
 * <p>
 * Text tables list one region per line as whitespace-separated
 * {@code code name r g b alpha} fields, with r, g, b in [0, 255]. Blank lines
 * and lines starting with {@code #} are ignored.
 * </p>
 */
public class ColorLookupTable {

	private final Map<Integer, LabelColor> colors;

	public ColorLookupTable() {
		colors = new TreeMap<>();
	}

	public ColorLookupTable(final Collection<LabelColor> entries) {
		this();
		entries.forEach(this::put);
	}

	/**
	 * Adds (or replaces) an entry.
	 *
	 * @param color the entry
	 */
	public void put(final LabelColor color) {
		colors.put(color.code(), color);
	}

	/**
	 * @param code the label code
	 * @return whether this table has an entry for {@code code}
	 */
	public boolean contains(final int code) {
		return colors.containsKey(code);
	}

	/**
	 * @param code the label code
	 * @return the color of {@code code}
	 * @throws MissingMappingException if this table has no entry for code
	 */
	public LabelColor get(final int code) {
		final LabelColor color = colors.get(code);
		if (color == null)
			throw new MissingMappingException("ColorLookupTable", code,
					"Label " + code + " has no entry in color lookup table");
		return color;
	}

	public int size() {
		return colors.size();
	}

	/** @return an unmodifiable view of the entries, sorted by code */
	public Map<Integer, LabelColor> asMap() {
		return Collections.unmodifiableMap(colors);
	}

	/**
	 * Parses a FreeSurfer-style lookup table file.
	 *
	 * @param file the table file
	 * @return the parsed table
	 * @throws IOException if file could not be read
	 * @throws InputShapeException if file contains a malformed entry
	 */
	public static ColorLookupTable parse(final File file) throws IOException {
		try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
			return parse(reader);
		}
	}

	/**
	 * Parses a FreeSurfer-style lookup table.
	 *
	 * @param reader the table contents
	 * @return the parsed table
	 * @throws IOException if contents could not be read
	 * @throws InputShapeException if contents contain a malformed entry
	 */
	public static ColorLookupTable parse(final Reader reader) throws IOException {
		final ColorLookupTable table = new ColorLookupTable();
		final BufferedReader br = (reader instanceof BufferedReader) ? (BufferedReader) reader
				: new BufferedReader(reader);
		String line;
		int lineNumber = 0;
		while ((line = br.readLine()) != null) {
			lineNumber++;
			final String trimmed = line.trim();
			if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
			final String[] fields = trimmed.split("\\s+");
			if (fields.length != 6)
				throw new InputShapeException("ColorLookupTable",
						"Line " + lineNumber + ": Expected 6 fields (code name r g b alpha) but found " + fields.length);
			try {
				final int code = Integer.parseInt(fields[0]);
				final int r = component(fields[2], lineNumber);
				final int g = component(fields[3], lineNumber);
				final int b = component(fields[4], lineNumber);
				table.put(LabelColor.fromRGB255(code, fields[1], r, g, b));
			} catch (final NumberFormatException e) {
				throw new InputShapeException("ColorLookupTable", "Line " + lineNumber + ": Invalid number", e);
			}
		}
		return table;
	}

	private static int component(final String field, final int lineNumber) {
		final int value = Integer.parseInt(field);
		if (value < 0 || value > 255)
			throw new InputShapeException("ColorLookupTable",
					"Line " + lineNumber + ": Color component " + value + " outside [0, 255]");
		return value;
	}

}
