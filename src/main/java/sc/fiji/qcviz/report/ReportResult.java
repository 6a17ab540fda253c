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

import java.util.Optional;

/**
 * The outcome of one report request.
 */
public class ReportResult {

	public enum Status {
		WRITTEN, SKIPPED, FAILED
	}

	private final ReportRequest request;
	private final Status status;
	private final Throwable cause;

	private ReportResult(final ReportRequest request, final Status status, final Throwable cause) {
		this.request = request;
		this.status = status;
		this.cause = cause;
	}

	public static ReportResult written(final ReportRequest request) {
		return new ReportResult(request, Status.WRITTEN, null);
	}

	public static ReportResult skipped(final ReportRequest request) {
		return new ReportResult(request, Status.SKIPPED, null);
	}

	public static ReportResult failed(final ReportRequest request, final Throwable cause) {
		return new ReportResult(request, Status.FAILED, cause);
	}

	public ReportRequest getRequest() {
		return request;
	}

	public Status getStatus() {
		return status;
	}

	public boolean isFailed() {
		return status == Status.FAILED;
	}

	/** @return the error that aborted the request, if it failed */
	public Optional<Throwable> getCause() {
		return Optional.ofNullable(cause);
	}

	@Override
	public String toString() {
		return request.getOutput().getName() + ": " + status + ((cause == null) ? "" : " (" + cause.getMessage() + ")");
	}

}
