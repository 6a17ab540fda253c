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

import sc.fiji.qcviz.label.LabelRecolorer;
import sc.fiji.qcviz.label.RankedLabels;
import sc.fiji.qcviz.viewer.Panel;
import sc.fiji.qcviz.viewer.RenderingBackend;
import sc.fiji.qcviz.viewer.SegmentationComposer;

/**
 * The regions of a parcellation (e.g., a FreeSurfer segmentation), filled
 * with the colors of a lookup table over a background volume.
 */
public class ParcellationReport extends SliceReport {

	@Override
	protected boolean defaultAutoBrightness() {
		return true;
	}

	@Override
	public List<Panel> compose(final ReportInputs inputs, final ReportRequest request,
			final RenderingBackend backend) {
		final RankedLabels labels = new LabelRecolorer(inputs.requireLookupTable()).recolor(inputs.requireLabels());
		final SegmentationComposer composer = configure(new SegmentationComposer(backend), request);
		composer.setAxes(request.getAxes());
		composer.setFilled(request.getFilled() == null || request.getFilled());
		composer.setAlpha((request.getAlpha() == null) ? SegmentationComposer.DEFAULT_ALPHA : request.getAlpha());
		return composer.compose(select(inputs.requireBackground(), request), labels,
				select(inputs.getMask(), request));
	}

}
