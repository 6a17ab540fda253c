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

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import sc.fiji.qcviz.ConfigurationException;
import sc.fiji.qcviz.QCVizUtils;
import sc.fiji.qcviz.util.Logger;
import sc.fiji.qcviz.viewer.Panel;
import sc.fiji.qcviz.viewer.RenderingBackend;

/**
 * Generates reports and writes them to disk. Independent jobs run on a
 * fixed-size worker pool; a failed job is logged and reported without
 * affecting the others. Existing outputs are skipped unless the request
 * asks for them to be rewritten. Artifacts are written to a temporary file
 * next to the target and then moved over it, so that an output file is
 * either complete or absent.
 */
public class ReportRunner {

	private final RenderingBackend backend;
	private int nThreads;
	private Logger logger;

	/**
	 * @param backend the backend rendering all reports. It must tolerate
	 *          concurrent use when more than one thread is used
	 */
	public ReportRunner(final RenderingBackend backend) {
		if (backend == null) throw new IllegalArgumentException("Backend cannot be null");
		this.backend = backend;
		this.nThreads = Math.max(1, Runtime.getRuntime().availableProcessors());
	}

	/**
	 * @param nThreads the number of reports generated concurrently
	 */
	public void setNumThreads(final int nThreads) {
		this.nThreads = ConfigurationException.requirePositive("ReportRunner", "nThreads", nThreads);
	}

	public int getNumThreads() {
		return nThreads;
	}

	/**
	 * Runs a batch of jobs.
	 *
	 * @param jobs the jobs
	 * @return one result per job, in the same order as {@code jobs}
	 */
	public List<ReportResult> run(final List<ReportJob> jobs) {
		final List<ReportResult> results = new ArrayList<>(jobs.size());
		if (jobs.isEmpty()) return results;
		final ExecutorService es = Executors.newFixedThreadPool(Math.min(nThreads, jobs.size()));
		try {
			final List<Future<ReportResult>> futures = new ArrayList<>(jobs.size());
			for (final ReportJob job : jobs)
				futures.add(es.submit(() -> run(job.getRequest(), job.getInputs())));
			for (int i = 0; i < futures.size(); i++) {
				final ReportRequest request = jobs.get(i).getRequest();
				try {
					results.add(futures.get(i).get());
				}
				catch (final ExecutionException ex) {
					log().error("Report " + request.getOutput().getName() + " failed", ex.getCause());
					results.add(ReportResult.failed(request, ex.getCause()));
				}
				catch (final InterruptedException ex) {
					Thread.currentThread().interrupt();
					results.add(ReportResult.failed(request, ex));
				}
			}
		}
		finally {
			es.shutdownNow();
		}
		final long failures = results.stream().filter(ReportResult::isFailed).count();
		log().info(jobs.size() + " report(s) processed, " + failures + " failure(s)");
		return results;
	}

	/**
	 * Runs a single job in the calling thread.
	 *
	 * @param request the report parameters
	 * @param inputs the data to visualize
	 * @return the result of the job
	 */
	public ReportResult run(final ReportRequest request, final ReportInputs inputs) {
		final File output = request.getOutput();
		if (output.exists() && !request.isRewrite()) {
			log().debug("Skipping " + output + ": File exists");
			return ReportResult.skipped(request);
		}
		try {
			final Report report = request.getKind().create();
			final List<Panel> panels = report.compose(inputs, request, backend);
			final Panel document = backend.compose(panels, report.getColumns(request), request.getTitle());
			write(document, output);
			log().info("Saved " + request.getKind() + " report to " + output);
			return ReportResult.written(request);
		}
		catch (final IOException | RuntimeException ex) {
			log().error("Report " + output.getName() + " failed", ex);
			return ReportResult.failed(request, ex);
		}
	}

	private void write(final Panel document, final File output) throws IOException {
		final File dir = output.getAbsoluteFile().getParentFile();
		if (dir != null && !dir.exists() && !dir.mkdirs())
			throw new IOException("Could not create directory " + dir);
		final String ext = QCVizUtils.getExtension(output);
		final File tmp = File.createTempFile("." + QCVizUtils.stripExtension(output.getName()) + "-", "." + ext, dir);
		try {
			backend.write(document, tmp);
			try {
				Files.move(tmp.toPath(), output.toPath(), StandardCopyOption.ATOMIC_MOVE,
						StandardCopyOption.REPLACE_EXISTING);
			}
			catch (final AtomicMoveNotSupportedException ex) {
				log().debug("Atomic move not supported: " + ex.getMessage());
				Files.move(tmp.toPath(), output.toPath(), StandardCopyOption.REPLACE_EXISTING);
			}
		}
		finally {
			Files.deleteIfExists(tmp.toPath());
		}
	}

	private Logger log() {
		if (logger == null) logger = new Logger(ReportRunner.class);
		return logger;
	}

}
