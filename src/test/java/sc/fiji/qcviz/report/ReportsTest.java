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
package sc.fiji.qcviz.report;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import sc.fiji.qcviz.SyntheticData;
import sc.fiji.qcviz.label.ColorLookupTable;
import sc.fiji.qcviz.surface.AnatomicalStructure;
import sc.fiji.qcviz.surface.BrainModel;
import sc.fiji.qcviz.surface.BrainModelIndex;
import sc.fiji.qcviz.surface.Mesh;
import sc.fiji.qcviz.surface.ScalarMaps;
import sc.fiji.qcviz.viewer.Panel;
import sc.fiji.qcviz.viewer.RecordingBackend;
import sc.fiji.qcviz.volume.Volume;
import sc.fiji.qcviz.volume.VoxelAffine;

/**
 * Tests the translation of requests into composer calls for each report kind
 */
public class ReportsTest {

	private static final File OUT = new File("qc.png");
	private RecordingBackend backend;
	private Volume block;

	@Before
	public void setUp() {
		backend = new RecordingBackend();
		block = SyntheticData.centeredBlock();
	}

	private List<Panel> compose(final ReportInputs inputs, final ReportKind kind, final String... options) {
		final ReportRequest request = ReportRequest.parse(kind, OUT, options);
		return kind.create().compose(inputs, request, backend);
	}

	@Test
	public void testFunctional() {
		compose(new ReportInputs().image(block), ReportKind.FUNCTIONAL, "display_modes=y", "n_cuts=2");
		assertEquals(Arrays.asList("functional-y"), backend.titles());
		assertEquals("No auto brightness by default", null, backend.settings.get(0).getVmin());
		assertEquals(2, backend.slicePanels.get(0).getSliceCount());
	}

	@Test
	public void testAnatomicalOptions() {
		compose(new ReportInputs().image(block), ReportKind.ANATOMICAL, "vmin=1", "cmap=viridis");
		assertEquals(1d, backend.settings.get(0).getVmin(), 0);
		assertEquals(5d, backend.settings.get(0).getVmax(), 1e-9);
		assertEquals("viridis", backend.settings.get(0).getColormap());
	}

	@Test
	public void testMontage() {
		final List<Panel> panels = compose(new ReportInputs().image(block), ReportKind.MONTAGE, "n_cuts=6",
				"n_cols=4", "axis=x");
		assertEquals(2, panels.size());
		assertEquals(Arrays.asList("montage:0-4", "montage:4-6"), backend.titles());
	}

	@Test
	public void testSegmentation() {
		final Volume seg = SyntheticData.block(10, 4, 5, 1f, VoxelAffine.identity());
		final ReportInputs inputs = new ReportInputs().image(block).segmentation(seg).segmentation(seg);
		assertEquals(3, compose(inputs, ReportKind.SEGMENTATION).size());
		assertTrue(backend.overlays.get(0).endsWith(":2:outline"));
	}

	@Test
	public void testParcellation() throws IOException {
		final ColorLookupTable lut;
		try (InputStream is = getClass().getResourceAsStream("/sc/fiji/qcviz/label/TestColorLUT.txt")) {
			lut = ColorLookupTable.parse(new InputStreamReader(is, StandardCharsets.UTF_8));
		}
		final ReportInputs inputs = new ReportInputs().background(block).lookupTable(lut)
				.labels(SyntheticData.labels(new long[] { 10, 10, 10 }, 0, 2, 41));
		final List<Panel> panels = compose(inputs, ReportKind.fromName("freesurfer_parcellation"),
				"display_modes=z");
		assertEquals(1, panels.size());
		assertEquals("masks:parcellation-z:3:filled", backend.overlays.get(0));
	}

	@Test
	public void testSurfaceReports() {
		final Mesh left = SyntheticData.octahedron(new double[] { 3, 5, 5 }, 2, AnatomicalStructure.CORTEX_LEFT);
		final Mesh right = SyntheticData.octahedron(new double[] { 7, 5, 5 }, 2, AnatomicalStructure.CORTEX_RIGHT);
		final int[] all = { 0, 1, 2, 3, 4, 5 };
		final BrainModelIndex index = new BrainModelIndex(new BrainModel(AnatomicalStructure.CORTEX_LEFT, 0, all, 6),
				new BrainModel(AnatomicalStructure.CORTEX_RIGHT, 6, all, 6));
		final ReportInputs inputs = new ReportInputs().surfaces(left, right)
				.surfaceData(ScalarMaps.of(new double[12]), index).background(block).foreground(block);

		final ReportRequest surface = ReportRequest.parse(ReportKind.SURFACE, OUT, "views=dorsal:left");
		final Report report = surface.getKind().create();
		assertEquals(1, report.compose(inputs, surface, backend).size());
		assertEquals(1, report.getColumns(surface));

		final List<Panel> coreg = compose(inputs, ReportKind.SURFACE_COREG, "n_cuts=3");
		assertEquals(1, coreg.size());
		assertEquals(3, coreg.get(0).getSliceCount());
		assertTrue(backend.overlays.get(backend.overlays.size() - 1).startsWith("scalar:surface_coreg:"));
	}

}
