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

import sc.fiji.qcviz.viewer.Panel;
import sc.fiji.qcviz.viewer.RegistrationComposer;
import sc.fiji.qcviz.viewer.RenderingBackend;
import sc.fiji.qcviz.volume.Volume;

/**
 * Registration of a moving (background) volume onto a fixed (foreground)
 * one. The FreeSurfer coregistration variant outlines a mandatory contour
 * volume, typically the cortical ribbon of the subject.
 */
public class RegistrationReport extends SliceReport {

	private final boolean requireContour;

	/**
	 * @param requireContour whether the contour volume is mandatory
	 */
	public RegistrationReport(final boolean requireContour) {
		this.requireContour = requireContour;
	}

	@Override
	protected boolean defaultAutoBrightness() {
		return true;
	}

	@Override
	public List<Panel> compose(final ReportInputs inputs, final ReportRequest request,
			final RenderingBackend backend) {
		final RegistrationComposer composer = configure(new RegistrationComposer(backend), request);
		composer.setAxes(request.getAxes());
		final Volume contour = (requireContour) ? inputs.requireContour() : inputs.getContour();
		return composer.compose(select(inputs.requireForeground(), request),
				select(inputs.requireBackground(), request), select(contour, request));
	}

	@Override
	public int getColumns(final ReportRequest request) {
		return (request.getAxes() == null) ? RegistrationComposer.DEFAULT_AXES.size() : request.getAxes().size();
	}

}
