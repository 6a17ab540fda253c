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

import java.io.File;
import java.util.Locale;

import org.scijava.Context;
import org.scijava.log.LogService;

/** Static utilities for QCViz **/
public class QCVizUtils {

	private static Context context;
	private static volatile boolean verbose;

	private QCVizUtils() {}

	/**
	 * Assesses if QCViz is running in debug mode
	 *
	 * @return the debug flag
	 */
	public static boolean isDebugMode() {
		return verbose;
	}

	/**
	 * Enables/disables debug mode. In debug mode, every {@link sc.fiji.qcviz.util.Logger}
	 * reports debug messages regardless of the log level of the
	 * LogService.
	 *
	 * @param b verbose flag
	 */
	public static void setDebugMode(final boolean b) {
		verbose = b;
	}

	public static String stripExtension(final String filename) {
		final int lastDot = filename.lastIndexOf(".");
		return (lastDot > 0) ? filename.substring(0, lastDot) : filename;
	}

	/** @return the lower case extension of a file, or an empty string */
	public static String getExtension(final File file) {
		final String name = file.getName();
		final int lastDot = name.lastIndexOf(".");
		return (lastDot > 0 && lastDot < name.length() - 1) ? name.substring(lastDot + 1).toLowerCase(Locale.US) : "";
	}

	/**
	 * Retrieves the SciJava context shared by all QCViz loggers, creating a
	 * minimal one (holding only a LogService) on first use.
	 *
	 * @return the context
	 */
	public static synchronized Context getContext() {
		if (context == null) {
			try {
				context = new Context(LogService.class);
			} catch (final Throwable e) {
				System.out.println("[ERROR] [QCViz] Failed to initialize context: " + e.getMessage());
				throw e;
			}
		}
		return context;
	}

	/**
	 * Sets the context used by loggers created from now on, e.g., the
	 * context of a running Fiji instance.
	 *
	 * @param context the SciJava context
	 */
	public static synchronized void setContext(final Context context) {
		QCVizUtils.context = context;
	}

}
