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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.util.Arrays;

import org.junit.Test;

import sc.fiji.qcviz.ConfigurationException;
import sc.fiji.qcviz.surface.SurfaceView;
import sc.fiji.qcviz.volume.Axis;
import sc.fiji.qcviz.volume.Resampler.Interpolation;

/**
 * Tests for {@link ReportRequest}
 */
public class ReportRequestTest {

	private static final File OUT = new File("qc.png");

	@Test
	public void testDefaults() {
		final ReportRequest request = ReportRequest.builder(ReportKind.MONTAGE, OUT).build();
		assertEquals("montage", request.getTitle());
		assertNull(request.getCuts());
		assertEquals(5, request.getColumns());
		assertNull(request.getAxes());
		assertEquals(Axis.Z, request.getMontageAxis());
		assertEquals(0.3, request.getDarkness(), 0);
		assertNull(request.getAutoBrightness());
		assertEquals(Interpolation.LINEAR, request.getInterpolation());
		assertEquals(0, request.getVolumeIndex());
		assertFalse(request.isRewrite());
	}

	@Test
	public void testParseOptions() {
		final ReportRequest request = ReportRequest.parse(ReportKind.SURFACE, OUT, "figure_title=sub-01",
				"N_CUTS=9", "display_modes=z,x", "cmap=viridis", "darkness=0.5", "zero_nan=yes",
				"visualize_all_maps=1", "views=lateral:left,ventral:right", "vmin=-2", "vmax=2", "volume_index=3",
				"rewrite=true", "interpolation=nearest", "orientation=y", "filled=no", "alpha=0.6");
		assertEquals("sub-01", request.getTitle());
		assertEquals(Integer.valueOf(9), request.getCuts());
		assertEquals(Arrays.asList(Axis.Z, Axis.X), request.getAxes());
		assertEquals("viridis", request.getColormap());
		assertEquals(0.5, request.getDarkness(), 0);
		assertTrue(request.isZeroNaN());
		assertTrue(request.isAllMaps());
		assertEquals(Arrays.asList(SurfaceView.parse("lateral:left"), SurfaceView.parse("ventral:right")),
				request.getViews());
		assertEquals(-2d, request.getVmin(), 0);
		assertEquals(2d, request.getVmax(), 0);
		assertEquals(3, request.getVolumeIndex());
		assertTrue(request.isRewrite());
		assertEquals(Interpolation.NEAREST, request.getInterpolation());
		assertEquals(Axis.Y, request.getMontageAxis());
		assertFalse(request.getFilled());
		assertEquals(0.6, request.getAlpha(), 0);
	}

	@Test(expected = ConfigurationException.class)
	public void testUnknownOption() {
		ReportRequest.parse(ReportKind.ANATOMICAL, OUT, "n_slices=3");
	}

	@Test(expected = ConfigurationException.class)
	public void testMalformedOption() {
		ReportRequest.parse(ReportKind.ANATOMICAL, OUT, "n_cuts");
	}

	@Test(expected = ConfigurationException.class)
	public void testInvalidNumber() {
		ReportRequest.parse(ReportKind.ANATOMICAL, OUT, "n_cuts=many");
	}

	@Test(expected = ConfigurationException.class)
	public void testNonPositiveCuts() {
		ReportRequest.parse(ReportKind.ANATOMICAL, OUT, "n_cuts=0");
	}

	@Test(expected = ConfigurationException.class)
	public void testInvalidBoolean() {
		ReportRequest.parse(ReportKind.ANATOMICAL, OUT, "rewrite=maybe");
	}

	@Test(expected = ConfigurationException.class)
	public void testInvertedLimits() {
		ReportRequest.parse(ReportKind.ANATOMICAL, OUT, "vmin=5", "vmax=1");
	}

}
