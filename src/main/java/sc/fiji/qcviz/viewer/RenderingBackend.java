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

import java.awt.Color;
import java.io.File;
import java.io.IOException;
import java.util.List;

import net.imglib2.display.ColorTable;
import sc.fiji.qcviz.label.LabelColor;
import sc.fiji.qcviz.surface.Mesh;
import sc.fiji.qcviz.surface.Polyline;
import sc.fiji.qcviz.surface.SurfaceView;
import sc.fiji.qcviz.volume.Axis;
import sc.fiji.qcviz.volume.IntensityWindow;
import sc.fiji.qcviz.volume.Volume;

/**
 * The drawing surface QC composers render into. Composers decide what is
 * drawn (slices, coordinates, display ranges, overlays); implementations
 * decide how. Panels are only ever passed back to the backend that created
 * them.
 */
public interface RenderingBackend {

	/**
	 * Renders a row of slices of a volume.
	 *
	 * @param volume the 3D volume
	 * @param axis the slicing axis
	 * @param coordinates the physical coordinates of the slices along
	 *          {@code axis}
	 * @param settings the display settings (unset limits default to the data
	 *          range)
	 * @param title the panel title
	 * @return the rendered panel
	 */
	Panel renderSlices(Volume volume, Axis axis, double[] coordinates, DisplaySettings settings, String title);

	/**
	 * Draws polylines on one slice of a panel.
	 *
	 * @param panel the target panel
	 * @param slice the index of the slice within the panel
	 * @param polylines the polylines, in the in-plane coordinates of the slice
	 * @param color the line color
	 * @param lineWidth the line width, in pixels
	 */
	void overlayContours(Panel panel, int slice, List<Polyline> polylines, Color color, double lineWidth);

	/**
	 * Draws binary masks on every slice of a panel.
	 *
	 * @param panel the target panel
	 * @param masks the masks (voxels above 0 are inside)
	 * @param colors the color of each mask
	 * @param alpha the opacity of filled masks
	 * @param filled whether masks are filled or outlined
	 */
	void overlayMasks(Panel panel, List<Volume> masks, List<LabelColor> colors, double alpha, boolean filled);

	/**
	 * Blends a scalar volume on every slice of a panel.
	 *
	 * @param panel the target panel
	 * @param scalar the scalar volume (zero intensities are never drawn)
	 * @param ramp the RGBA color table
	 * @param window the intensity range mapped onto the ramp (values outside
	 *          it are clamped)
	 */
	void overlayScalar(Panel panel, Volume scalar, ColorTable ramp, IntensityWindow window);

	/**
	 * Renders a surface mesh from one of the canonical view points.
	 *
	 * @param mesh the hemisphere mesh
	 * @param values the per-vertex data (null to render the mesh only). NaN
	 *          values are drawn in the background color
	 * @param background the per-vertex background map (e.g., sulcal depth), or
	 *          null
	 * @param view the camera position
	 * @param settings the display settings of {@code values}
	 * @param darkness the weight of the background map onto the data colors
	 * @param title the panel title
	 * @return the rendered panel
	 */
	Panel renderSurface(Mesh mesh, double[] values, double[] background, SurfaceView view, DisplaySettings settings,
			double darkness, String title);

	/**
	 * Assembles panels into a single document.
	 *
	 * @param panels the panels, in reading order
	 * @param columns the number of panels per row
	 * @param title the document title
	 * @return the composed panel
	 */
	Panel compose(List<Panel> panels, int columns, String title);

	/**
	 * Saves a (composed) panel.
	 *
	 * @param panel the panel
	 * @param file the output file. Its extension selects the format
	 * @throws IOException if the file could not be written
	 */
	void write(Panel panel, File file) throws IOException;

}
