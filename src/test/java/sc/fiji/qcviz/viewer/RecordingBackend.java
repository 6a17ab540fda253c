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
package sc.fiji.qcviz.viewer;

import java.awt.Color;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import net.imglib2.display.ColorTable;
import sc.fiji.qcviz.label.LabelColor;
import sc.fiji.qcviz.surface.Mesh;
import sc.fiji.qcviz.surface.Polyline;
import sc.fiji.qcviz.surface.SurfaceView;
import sc.fiji.qcviz.volume.Axis;
import sc.fiji.qcviz.volume.IntensityWindow;
import sc.fiji.qcviz.volume.Volume;

/**
 * A {@link RenderingBackend} that draws nothing and records what it was
 * asked to draw. Safe for concurrent use.
 */
public class RecordingBackend implements RenderingBackend {

	public final List<StubPanel> slicePanels = new ArrayList<>();
	public final List<StubPanel> surfacePanels = new ArrayList<>();
	public final List<DisplaySettings> settings = new ArrayList<>();
	public final List<String> overlays = new ArrayList<>();
	public final List<double[]> surfaceValues = new ArrayList<>();
	public int composeCount;
	public int lastColumns;
	public RuntimeException failure;

	public static class StubPanel implements Panel {

		final String title;
		final Axis axis;
		final double[] coordinates;
		final List<Panel> children;

		StubPanel(final String title, final Axis axis, final double[] coordinates, final List<Panel> children) {
			this.title = title;
			this.axis = axis;
			this.coordinates = coordinates;
			this.children = children;
		}

		@Override
		public String getTitle() {
			return title;
		}

		@Override
		public Optional<Axis> getAxis() {
			return Optional.ofNullable(axis);
		}

		@Override
		public double[] getCoordinates() {
			return coordinates.clone();
		}

		public List<Panel> getChildren() {
			return children;
		}

	}

	@Override
	public synchronized Panel renderSlices(final Volume volume, final Axis axis, final double[] coordinates,
			final DisplaySettings displaySettings, final String title) {
		if (failure != null) throw failure;
		final StubPanel panel = new StubPanel(title, axis, coordinates.clone(), null);
		slicePanels.add(panel);
		settings.add(displaySettings);
		return panel;
	}

	@Override
	public synchronized void overlayContours(final Panel panel, final int slice, final List<Polyline> polylines, final Color color,
			final double lineWidth) {
		overlays.add("contours:" + panel.getTitle() + ":" + slice + ":" + polylines.size());
	}

	@Override
	public synchronized void overlayMasks(final Panel panel, final List<Volume> masks, final List<LabelColor> colors,
			final double alpha, final boolean filled) {
		overlays.add("masks:" + panel.getTitle() + ":" + masks.size() + ":" + ((filled) ? "filled" : "outline"));
	}

	@Override
	public synchronized void overlayScalar(final Panel panel, final Volume scalar, final ColorTable ramp,
			final IntensityWindow window) {
		overlays.add("scalar:" + panel.getTitle() + ":" + window.getLower() + "-" + window.getUpper());
	}

	@Override
	public synchronized Panel renderSurface(final Mesh mesh, final double[] values, final double[] background,
			final SurfaceView view, final DisplaySettings displaySettings, final double darkness, final String title) {
		final StubPanel panel = new StubPanel(title, null, new double[0], null);
		surfacePanels.add(panel);
		surfaceValues.add(values);
		settings.add(displaySettings);
		return panel;
	}

	@Override
	public synchronized Panel compose(final List<Panel> panels, final int columns, final String title) {
		composeCount++;
		lastColumns = columns;
		return new StubPanel(title, null, new double[0], new ArrayList<>(panels));
	}

	@Override
	public void write(final Panel panel, final File file) throws IOException {
		Files.write(file.toPath(), panel.getTitle().getBytes(StandardCharsets.UTF_8));
	}

	public synchronized List<String> titles() {
		final List<String> titles = new ArrayList<>();
		slicePanels.forEach(p -> titles.add(p.getTitle()));
		surfacePanels.forEach(p -> titles.add(p.getTitle()));
		return titles;
	}

}
