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
package sc.fiji.qcviz;

/**
 * Base class of the errors raised while composing a QC figure. Carries the
 * name of the component that failed so that callers can log the failure
 * meaningfully.
 */
public class QCVizException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final String component;

	public QCVizException(final String component, final String message) {
		super(message);
		this.component = component;
	}

	public QCVizException(final String component, final String message, final Throwable cause) {
		super(message, cause);
		this.component = component;
	}

	/** @return the name of the component that raised this error */
	public String getComponent() {
		return component;
	}

	@Override
	public String getMessage() {
		return (component == null) ? super.getMessage() : "[" + component + "] " + super.getMessage();
	}

}
