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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.awt.Color;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import sc.fiji.qcviz.InputShapeException;
import sc.fiji.qcviz.MissingMappingException;

/**
 * Tests for {@link ColorLookupTable}
 */
public class ColorLookupTableTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private ColorLookupTable table;

	@Before
	public void setUp() throws IOException {
		try (InputStream is = getClass().getResourceAsStream("TestColorLUT.txt")) {
			assertNotNull("Test table not found", is);
			table = ColorLookupTable.parse(new InputStreamReader(is, StandardCharsets.UTF_8));
		}
	}

	@Test
	public void testParse() {
		assertEquals("Comments and blank lines are skipped", 7, table.size());
		final LabelColor cortex = table.get(3);
		assertEquals("Left-Cerebral-Cortex", cortex.name());
		assertEquals(205 / 255d, cortex.red(), 1e-12);
		assertEquals(62 / 255d, cortex.green(), 1e-12);
		assertEquals(78 / 255d, cortex.blue(), 1e-12);
		assertEquals(new Color(205, 62, 78), cortex.toAWT());
		assertTrue(table.contains(41));
		assertFalse(table.contains(5));
		assertEquals(Integer.valueOf(0), table.asMap().keySet().iterator().next());
	}

	@Test
	public void testParseFile() throws IOException {
		final File file = folder.newFile("lut.txt");
		Files.write(file.toPath(), "# header\n\n17 Left-Hippocampus 220 216 20 0\n".getBytes(StandardCharsets.UTF_8));
		final ColorLookupTable fromFile = ColorLookupTable.parse(file);
		assertEquals(1, fromFile.size());
		assertEquals("Left-Hippocampus", fromFile.get(17).name());
	}

	@Test
	public void testMissingCode() {
		try {
			table.get(5);
			fail("Unknown code should not resolve");
		} catch (final MissingMappingException e) {
			assertEquals(5, e.getKey());
		}
	}

	@Test
	public void testMalformedLineIsReported() throws IOException {
		try {
			ColorLookupTable.parse(new StringReader("0 Unknown 0 0 0 0\n\n3 Cortex 205 62\n"));
			fail("Truncated entry should be rejected");
		} catch (final InputShapeException e) {
			assertTrue(e.getMessage(), e.getMessage().contains("Line 3"));
		}
	}

	@Test(expected = InputShapeException.class)
	public void testComponentOutOfRange() throws IOException {
		ColorLookupTable.parse(new StringReader("3 Cortex 205 62 300 0\n"));
	}

	@Test(expected = InputShapeException.class)
	public void testInvalidCode() throws IOException {
		ColorLookupTable.parse(new StringReader("x Cortex 205 62 78 0\n"));
	}

}
