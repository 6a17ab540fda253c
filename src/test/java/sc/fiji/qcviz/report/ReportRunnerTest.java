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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import sc.fiji.qcviz.ConfigurationException;
import sc.fiji.qcviz.SyntheticData;
import sc.fiji.qcviz.report.ReportResult.Status;
import sc.fiji.qcviz.viewer.RecordingBackend;
import sc.fiji.qcviz.volume.Volume;

/**
 * Tests for {@link ReportRunner}
 */
public class ReportRunnerTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private RecordingBackend backend;
	private ReportRunner runner;
	private Volume block;

	@Before
	public void setUp() {
		backend = new RecordingBackend();
		runner = new ReportRunner(backend);
		block = SyntheticData.centeredBlock();
	}

	private static String read(final File file) throws IOException {
		return new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
	}

	@Test
	public void testWrite() throws IOException {
		final File out = new File(folder.getRoot(), "sub-01/anat.png");
		final ReportRequest request = ReportRequest.parse(ReportKind.ANATOMICAL, out, "title=anat", "n_cuts=4");
		final ReportResult result = runner.run(request, new ReportInputs().image(block));
		assertEquals(Status.WRITTEN, result.getStatus());
		assertEquals("anat", read(out));
		assertEquals(1, backend.composeCount);
		assertEquals(3, backend.slicePanels.size());
		assertEquals(4, backend.slicePanels.get(0).getSliceCount());
		final String[] leftovers = out.getParentFile().list((dir, name) -> name.startsWith("."));
		assertArrayEquals("Temporary file is removed", new String[0], leftovers);
	}

	@Test
	public void testSkipExisting() throws IOException {
		final File out = folder.newFile("anat.png");
		Files.write(out.toPath(), "old".getBytes(StandardCharsets.UTF_8));
		final ReportRequest request = ReportRequest.builder(ReportKind.ANATOMICAL, out).build();
		assertEquals(Status.SKIPPED, runner.run(request, new ReportInputs().image(block)).getStatus());
		assertEquals("old", read(out));
		assertEquals(0, backend.composeCount);

		final ReportRequest rewrite = ReportRequest.builder(ReportKind.ANATOMICAL, out).rewrite(true).build();
		assertEquals(Status.WRITTEN, runner.run(rewrite, new ReportInputs().image(block)).getStatus());
		assertEquals("anatomical", read(out));
	}

	@Test
	public void testMissingInputFails() {
		final File out = new File(folder.getRoot(), "reg.png");
		final ReportResult result = runner.run(ReportRequest.builder(ReportKind.FREESURFER_COREG, out).build(),
				new ReportInputs().foreground(block).background(block));
		assertTrue(result.isFailed());
		assertTrue(result.getCause().get() instanceof ConfigurationException);
		assertTrue(!out.exists());
	}

	@Test
	public void testBatchIsolatesFailures() throws IOException {
		runner.setNumThreads(2);
		final File a = new File(folder.getRoot(), "a.png");
		final File b = new File(folder.getRoot(), "b.png");
		final File c = new File(folder.getRoot(), "c.png");
		final List<ReportJob> jobs = Arrays.asList(
				new ReportJob(ReportRequest.builder(ReportKind.MONTAGE, a).build(), new ReportInputs().image(block)),
				new ReportJob(ReportRequest.builder(ReportKind.SEGMENTATION, b).build(), new ReportInputs()),
				new ReportJob(ReportRequest.builder(ReportKind.REGISTRATION, c).build(),
						new ReportInputs().foreground(block).background(block)));
		final List<ReportResult> results = runner.run(jobs);
		assertEquals(3, results.size());
		assertEquals(Status.WRITTEN, results.get(0).getStatus());
		assertEquals(Status.FAILED, results.get(1).getStatus());
		assertEquals(Status.WRITTEN, results.get(2).getStatus());
		assertEquals(b, results.get(1).getRequest().getOutput());
		assertEquals("montage", read(a));
		assertTrue(c.exists());
	}

	@Test
	public void testVolumeIndexOutOfRange() {
		final File out = new File(folder.getRoot(), "func.png");
		final ReportRequest request = ReportRequest.parse(ReportKind.FUNCTIONAL, out, "volume_index=2");
		final ReportResult result = runner.run(request, new ReportInputs().image(block));
		assertEquals("3D inputs ignore the volume index", Status.WRITTEN, result.getStatus());
	}

	@Test(expected = ConfigurationException.class)
	public void testInvalidThreads() {
		runner.setNumThreads(0);
	}

}
