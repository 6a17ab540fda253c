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

import java.util.List;

import sc.fiji.qcviz.surface.SurfaceView;
import sc.fiji.qcviz.viewer.Panel;
import sc.fiji.qcviz.viewer.RenderingBackend;
import sc.fiji.qcviz.viewer.SurfaceMapComposer;

/**
 * Grayordinate maps rendered on the cortical surfaces, one row per map and
 * one column per view.
 */
public class SurfaceReport implements Report {

	@Override
	public List<Panel> compose(final ReportInputs inputs, final ReportRequest request,
			final RenderingBackend backend) {
		final SurfaceMapComposer composer = new SurfaceMapComposer(backend);
		composer.setViews(request.getViews());
		composer.setColormap(request.getColormap());
		composer.setDarkness(request.getDarkness());
		composer.setAllMaps(request.isAllMaps());
		composer.setZeroNaN(request.isZeroNaN());
		composer.setTitle(request.getTitle());
		return composer.compose(inputs.requireLeftSurface(), inputs.requireRightSurface(), inputs.getSurfaceData(),
				inputs.getSurfaceIndex(), inputs.getBackgroundMap(), inputs.getBackgroundIndex());
	}

	@Override
	public int getColumns(final ReportRequest request) {
		return (request.getViews() == null) ? SurfaceView.DEFAULT_VIEWS.size() : request.getViews().size();
	}

}
