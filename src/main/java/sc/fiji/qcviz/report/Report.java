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
import sc.fiji.qcviz.viewer.RenderingBackend;

/**
 * A QC report: composes the panels of one figure from a bundle of in-memory
 * inputs. Reports are stateless; a failed composition aborts the whole
 * figure.
 */
public interface Report {

	/**
	 * Composes the panels of the report.
	 *
	 * @param inputs the data to visualize
	 * @param request the report parameters
	 * @param backend the backend rendering the panels
	 * @return the panels, in reading order
	 * @throws sc.fiji.qcviz.QCVizException if inputs are missing or invalid
	 */
	List<Panel> compose(ReportInputs inputs, ReportRequest request, RenderingBackend backend);

	/**
	 * @return the number of panels per row of the composed figure
	 */
	default int getColumns(final ReportRequest request) {
		return 1;
	}

}
