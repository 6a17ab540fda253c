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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import sc.fiji.qcviz.SyntheticData;
import sc.fiji.qcviz.volume.Axis;

/**
 * Tests for {@link MeshSectioner}
 */
public class MeshSectionerTest {

	private static final double EPSILON = 1e-9;
	private Mesh octahedron;
	private MeshSectioner sectioner;

	@Before
	public void setUp() {
		octahedron = SyntheticData.octahedron(new double[] { 0, 0, 0 }, 1, AnatomicalStructure.OTHER);
		sectioner = new MeshSectioner();
	}

	@Test
	public void testSectionThroughEquator() {
		// four vertices lie on the plane: each equator edge is drawn once
		final SectionContour contour = sectioner.section(octahedron, Axis.Z, 0d);
		assertEquals(Axis.Z, contour.getNormal());
		assertEquals(1, contour.getPolylines().size());
		final Polyline polyline = contour.getPolylines().get(0);
		assertTrue(polyline.isClosed());
		assertEquals(4, polyline.size());
		for (final double[] p : polyline.getPoints())
			assertEquals(1d, Math.abs(p[0]) + Math.abs(p[1]), EPSILON);
	}

	@Test
	public void testSectionAboveEquator() {
		final SectionContour contour = sectioner.section(octahedron, Axis.Z, 0.5);
		assertEquals(1, contour.getPolylines().size());
		final Polyline polyline = contour.getPolylines().get(0);
		assertTrue(polyline.isClosed());
		assertEquals(4, polyline.size());
		for (final double[] p : polyline.getPoints())
			assertEquals(0.5, Math.abs(p[0]) + Math.abs(p[1]), EPSILON);
	}

	@Test
	public void testInPlaneAxes() {
		final Mesh shifted = SyntheticData.octahedron(new double[] { 10, 20, 30 }, 2, AnatomicalStructure.OTHER);
		final Polyline polyline = sectioner.section(shifted, Axis.X, 10d).getPolylines().get(0);
		// sections normal to X are expressed in (y, z)
		for (final double[] p : polyline.getPoints())
			assertEquals(2d, Math.abs(p[0] - 20) + Math.abs(p[1] - 30), EPSILON);
	}

	@Test
	public void testHeightsOutsideMesh() {
		final List<SectionContour> contours = sectioner.section(octahedron, Axis.Z, -5, 0.25, 1.5);
		assertEquals(3, contours.size());
		assertTrue(contours.get(0).isEmpty());
		assertFalse(contours.get(1).isEmpty());
		assertEquals(0.25, contours.get(1).getHeight(), 0);
		assertTrue(contours.get(2).isEmpty());
	}

	@Test
	public void testTouchingVertexOnly() {
		// apex touches the plane without crossing it
		assertTrue(sectioner.section(octahedron, Axis.Z, 1d).isEmpty());
	}

	@Test
	public void testOpenSheet() {
		final Mesh sheet = new Mesh(new double[][] { { 0, 0, -1 }, { 0, 0, 1 }, { 1, 0, -1 }, { 1, 0, 1 } },
				new int[][] { { 0, 1, 2 }, { 2, 1, 3 } });
		final List<Polyline> polylines = sectioner.section(sheet, Axis.Z, 0d).getPolylines();
		assertEquals(1, polylines.size());
		assertFalse(polylines.get(0).isClosed());
		assertEquals(3, polylines.get(0).size());
	}

	@Test
	public void testSectionAtCubeFaces() {
		// faces lying in the plane are outlined whether the mesh is above or below
		final Mesh cube = new Mesh(new double[][] { { 0, 0, 0 }, { 1, 0, 0 }, { 0, 1, 0 }, { 1, 1, 0 }, //
				{ 0, 0, 1 }, { 1, 0, 1 }, { 0, 1, 1 }, { 1, 1, 1 } }, //
				new int[][] { { 0, 2, 1 }, { 1, 2, 3 }, { 4, 5, 6 }, { 5, 7, 6 }, { 0, 1, 5 }, { 0, 5, 4 }, //
						{ 2, 6, 7 }, { 2, 7, 3 }, { 0, 4, 6 }, { 0, 6, 2 }, { 1, 3, 7 }, { 1, 7, 5 } });
		for (final double height : new double[] { 0, 1 }) {
			final List<Polyline> polylines = sectioner.section(cube, Axis.Z, height).getPolylines();
			assertEquals("z=" + height, 1, polylines.size());
			assertTrue(polylines.get(0).isClosed());
			assertEquals(4, polylines.get(0).size());
			for (final double[] p : polylines.get(0).getPoints()) {
				assertEquals(0.5, Math.abs(p[0] - 0.5), EPSILON);
				assertEquals(0.5, Math.abs(p[1] - 0.5), EPSILON);
			}
		}
	}

}
