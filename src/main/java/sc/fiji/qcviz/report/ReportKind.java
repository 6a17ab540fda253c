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

import java.util.Locale;
import java.util.function.Supplier;

import sc.fiji.qcviz.ConfigurationException;

/**
 * The kinds of QC reports, each bound to the {@link Report} implementation
 * composing it.
 */
public enum ReportKind {

	ANATOMICAL("anatomical", AnatomicalReport::new), //
	FUNCTIONAL("functional", FunctionalReport::new), //
	MONTAGE("montage", MontageReport::new), //
	REGISTRATION("registration", () -> new RegistrationReport(false)), //
	SEGMENTATION("segmentation", SegmentationReport::new), //
	SURFACE("surface", SurfaceReport::new), //
	SURFACE_COREG("surface_coreg", SurfaceCoregReport::new), //
	PARCELLATION("parcellation", ParcellationReport::new), //
	FREESURFER_COREG("freesurfer_coreg", () -> new RegistrationReport(true));

	private final String id;
	private final Supplier<Report> factory;

	ReportKind(final String id, final Supplier<Report> factory) {
		this.id = id;
		this.factory = factory;
	}

	/** @return a new report of this kind */
	public Report create() {
		return factory.get();
	}

	/** @return the identifier of this kind, e.g., {@code surface_coreg} */
	public String id() {
		return id;
	}

	/**
	 * Parses a report kind. Besides identifiers (case insensitive), the
	 * {@code freesurfer_parcellation} alias is recognized.
	 *
	 * @param name the report name
	 * @return the report kind
	 * @throws ConfigurationException if name is not a known report
	 */
	public static ReportKind fromName(final String name) {
		if (name == null)
			throw new ConfigurationException("ReportKind", "Report name is required");
		final String key = name.trim().toLowerCase(Locale.US).replace('-', '_');
		if ("freesurfer_parcellation".equals(key)) return PARCELLATION;
		for (final ReportKind kind : values()) {
			if (kind.id.equals(key)) return kind;
		}
		throw new ConfigurationException("ReportKind", "Unknown report '" + name + "'");
	}

	@Override
	public String toString() {
		return id;
	}

}
