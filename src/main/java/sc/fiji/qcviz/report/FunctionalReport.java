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

import sc.fiji.qcviz.viewer.OrthogonalViewComposer;
import sc.fiji.qcviz.viewer.Panel;
import sc.fiji.qcviz.viewer.RenderingBackend;

/**
 * Orthogonal views of a functional (EPI) volume. The display range is left
 * to the backend unless requested otherwise.
 */
public class FunctionalReport extends SliceReport {

	@Override
	protected boolean defaultAutoBrightness() {
		return false;
	}

	@Override
	public List<Panel> compose(final ReportInputs inputs, final ReportRequest request,
			final RenderingBackend backend) {
		final OrthogonalViewComposer composer = configure(new OrthogonalViewComposer(backend), request);
		composer.setAxes(request.getAxes());
		return composer.compose(select(inputs.requireImage(), request), select(inputs.getMask(), request));
	}

}
