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

/**
 * A report request together with the data it visualizes.
 */
public class ReportJob {

	private final ReportRequest request;
	private final ReportInputs inputs;

	public ReportJob(final ReportRequest request, final ReportInputs inputs) {
		if (request == null || inputs == null)
			throw new IllegalArgumentException("Request and inputs are required");
		this.request = request;
		this.inputs = inputs;
	}

	public ReportRequest getRequest() {
		return request;
	}

	public ReportInputs getInputs() {
		return inputs;
	}

}
