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

import sc.fiji.qcviz.viewer.DisplaySettings;
import sc.fiji.qcviz.viewer.SliceComposer;
import sc.fiji.qcviz.volume.Volume;

/**
 * Base class of reports rendering volume slices: applies the common request
 * options to a {@link SliceComposer}.
 */
abstract class SliceReport implements Report {

	/** @return whether the display range is estimated unless the request says otherwise */
	protected abstract boolean defaultAutoBrightness();

	protected <T extends SliceComposer> T configure(final T composer, final ReportRequest request) {
		if (request.getCuts() != null) composer.setCuts(request.getCuts());
		composer.setAutoBrightness((request.getAutoBrightness() == null) ? defaultAutoBrightness()
				: request.getAutoBrightness());
		composer.setTitle(request.getTitle());
		DisplaySettings settings = new DisplaySettings().withVmin(request.getVmin()).withVmax(request.getVmax());
		if (request.getColormap() != null) settings = settings.withColormap(request.getColormap());
		composer.setDisplaySettings(settings);
		return composer;
	}

	/** Reduces 4D inputs to the 3D volume selected by the request. */
	protected static Volume select(final Volume volume, final ReportRequest request) {
		return (volume == null) ? null : volume.to3D(request.getVolumeIndex());
	}

}
