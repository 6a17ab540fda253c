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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.awt.Color;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import sc.fiji.qcviz.ConfigurationException;
import sc.fiji.qcviz.SyntheticData;
import sc.fiji.qcviz.label.LabelColor;
import sc.fiji.qcviz.surface.AnatomicalStructure;
import sc.fiji.qcviz.surface.BrainModel;
import sc.fiji.qcviz.surface.BrainModelIndex;
import sc.fiji.qcviz.surface.Mesh;
import sc.fiji.qcviz.surface.ScalarMaps;
import sc.fiji.qcviz.surface.SurfaceView;
import sc.fiji.qcviz.volume.Axis;
import sc.fiji.qcviz.volume.Volume;
import sc.fiji.qcviz.volume.VoxelAffine;

/**
 * Tests for the slice and surface composers
 */
public class ComposerTest {

	private static final double EPSILON = 1e-9;
	private RecordingBackend backend;
	private Volume block;

	@Before
	public void setUp() {
		backend = new RecordingBackend();
		block = SyntheticData.centeredBlock();
	}

	@Test
	public void testOrthogonalViews() {
		final OrthogonalViewComposer composer = new OrthogonalViewComposer(backend);
		composer.setCuts(3);
		composer.setTitle("anat");
		final List<Panel> panels = composer.compose(block);
		assertEquals(3, panels.size());
		assertEquals(Arrays.asList("anat-x", "anat-y", "anat-z"), backend.titles());
		assertArrayEquals(new double[] { 4, 5, 6 }, panels.get(2).getCoordinates(), EPSILON);
		assertEquals(Axis.Z, panels.get(2).getAxis().get());
		assertNull("Display range left to the backend", backend.settings.get(0).getVmin());
	}

	@Test
	public void testAutoBrightnessKeepsExplicitLimits() {
		final OrthogonalViewComposer composer = new OrthogonalViewComposer(backend);
		composer.setAutoBrightness(true);
		composer.setDisplaySettings(new DisplaySettings().withVmax(3d));
		composer.setAxes(Collections.singletonList(Axis.Y));
		composer.compose(block);
		final DisplaySettings used = backend.settings.get(0);
		assertEquals(0d, used.getVmin(), EPSILON);
		assertEquals(3d, used.getVmax(), EPSILON);
		assertEquals(OrthogonalViewComposer.DEFAULT_CUTS, composer.getLastCuts().count(Axis.Y));
	}

	@Test
	public void testBoxVolumeFramesCuts() {
		final Volume mask = SyntheticData.block(10, 0, 1, 1f, VoxelAffine.identity());
		final OrthogonalViewComposer composer = new OrthogonalViewComposer(backend);
		composer.setCuts(1);
		composer.compose(block, mask);
		for (final RecordingBackend.StubPanel panel : backend.slicePanels)
			assertArrayEquals(new double[] { 1 }, panel.getCoordinates(), EPSILON);
	}

	@Test
	public void testMontage() {
		final MontageComposer composer = new MontageComposer(backend);
		composer.setCuts(12);
		composer.setColumns(5);
		final List<Panel> panels = composer.compose(block);
		assertEquals(3, panels.size());
		assertEquals(Arrays.asList("figure:0-5", "figure:5-10", "figure:10-12"), backend.titles());
		assertEquals(2, panels.get(2).getSliceCount());
		final double[] all = new double[12];
		int i = 0;
		for (final Panel p : panels) {
			for (final double c : p.getCoordinates())
				all[i++] = c;
		}
		for (int k = 1; k < all.length; k++)
			assertTrue(all[k] > all[k - 1]);
	}

	@Test(expected = ConfigurationException.class)
	public void testInvalidCuts() {
		new MontageComposer(backend).setCuts(0);
	}

	@Test
	public void testSegmentation() {
		final Volume seg = SyntheticData.block(10, 4, 5, 1f, VoxelAffine.identity());
		final SegmentationComposer composer = new SegmentationComposer(backend);
		final List<Panel> panels = composer.compose(block, Arrays.asList(seg, seg), null, null);
		assertEquals(3, panels.size());
		assertEquals(Arrays.asList("segmentation-z", "segmentation-x", "segmentation-y"), backend.titles());
		assertEquals(3, backend.overlays.size());
		assertTrue(backend.overlays.get(0).endsWith(":2:outline"));
		assertEquals(7, panels.get(0).getSliceCount());
		composer.setFilled(true);
		composer.compose(block, Collections.singletonList(seg), null, null);
		assertTrue(backend.overlays.get(3).endsWith(":1:filled"));
	}

	@Test(expected = ConfigurationException.class)
	public void testSegmentationColorMismatch() {
		new SegmentationComposer(backend).compose(block, Collections.singletonList(block),
				SegmentationComposer.defaultColors(2), null);
	}

	@Test
	public void testDefaultColors() {
		final List<LabelColor> colors = SegmentationComposer.defaultColors(5);
		assertEquals(5, colors.size());
		assertEquals(Color.RED, colors.get(0).toAWT());
		assertEquals(Color.BLUE, colors.get(2).toAWT());
	}

	@Test
	public void testRegistration() {
		final Volume moving = SyntheticData.block(10, 2, 6, 3f, VoxelAffine.identity());
		final RegistrationComposer composer = new RegistrationComposer(backend);
		composer.setCuts(3);
		final List<Panel> panels = composer.compose(block, moving, block);
		assertEquals(6, panels.size());
		assertEquals("fixed-image-z", panels.get(0).getTitle());
		assertEquals("moving-image-y", panels.get(5).getTitle());
		for (int i = 0; i < 3; i++)
			assertArrayEquals("Both volumes share cuts", panels.get(i).getCoordinates(),
					panels.get(i + 3).getCoordinates(), 0);
		assertEquals(6, backend.overlays.size());
		backend.overlays.forEach(o -> assertTrue(o, o.endsWith(":1:outline")));
	}

	@Test
	public void testRegistrationWithoutContour() {
		final RegistrationComposer composer = new RegistrationComposer(backend);
		composer.setAxes(Collections.singletonList(Axis.X));
		composer.setTitle("reg");
		composer.compose(block, block, null);
		assertEquals(Arrays.asList("reg:fixed-image-x", "reg:moving-image-x"), backend.titles());
		assertTrue(backend.overlays.isEmpty());
	}

	@Test
	public void testSurfaceVolume() {
		final Mesh left = SyntheticData.octahedron(new double[] { 3, 5, 5 }, 2, AnatomicalStructure.CORTEX_LEFT);
		final Mesh right = SyntheticData.octahedron(new double[] { 7, 5, 5 }, 2, AnatomicalStructure.CORTEX_RIGHT);
		final SurfaceVolumeComposer composer = new SurfaceVolumeComposer(backend);
		composer.setCuts(3);
		final List<Panel> panels = composer.compose(block, left, right, block);
		assertEquals(1, panels.size());
		assertArrayEquals(new double[] { 4, 5, 6 }, panels.get(0).getCoordinates(), EPSILON);
		assertEquals(4, backend.overlays.size());
		assertTrue(backend.overlays.get(0).startsWith("contours:surface_coreg:0:"));
		assertEquals("scalar:surface_coreg:0.0-5.0", backend.overlays.get(3));
	}

	@Test
	public void testSurfaceMaps() {
		final Mesh left = SyntheticData.octahedron(new double[] { -2, 0, 0 }, 1, AnatomicalStructure.CORTEX_LEFT);
		final Mesh right = SyntheticData.octahedron(new double[] { 2, 0, 0 }, 1, AnatomicalStructure.CORTEX_RIGHT);
		final int[] all = { 0, 1, 2, 3, 4, 5 };
		final BrainModelIndex index = new BrainModelIndex(new BrainModel(AnatomicalStructure.CORTEX_LEFT, 0, all, 6),
				new BrainModel(AnatomicalStructure.CORTEX_RIGHT, 6, all, 6));
		final double[][] maps = new double[2][12];
		for (int i = 0; i < 12; i++) {
			maps[0][i] = i;
			maps[1][i] = -i;
		}
		final SurfaceMapComposer composer = new SurfaceMapComposer(backend);
		composer.setAllMaps(true);
		composer.setViews(Arrays.asList(SurfaceView.parse("lateral:left"), SurfaceView.parse("medial:right")));
		final List<Panel> panels = composer.compose(left, right, ScalarMaps.of(maps), index, null, null);
		assertEquals(4, panels.size());
		assertEquals(2, composer.getColumns());
		assertEquals(Arrays.asList("surface:0-lateral:left", "surface:0-medial:right", "surface:1-lateral:left",
				"surface:1-medial:right"), backend.titles());
		assertEquals(11d, backend.surfaceValues.get(1)[5], 0);
		assertEquals(-3d, backend.surfaceValues.get(2)[3], 0);
		assertEquals("plasma", backend.settings.get(0).getColormap());
		assertTrue(backend.settings.get(0).getVmin() < 0);

		composer.setAllMaps(false);
		assertEquals(2, composer.compose(left, right, ScalarMaps.of(maps), index, null, null).size());
	}

	@Test(expected = ConfigurationException.class)
	public void testInvalidDarkness() {
		new SurfaceMapComposer(backend).setDarkness(2);
	}

}
