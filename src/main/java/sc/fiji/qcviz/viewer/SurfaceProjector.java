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
import java.awt.Polygon;
import java.util.Arrays;
import java.util.Comparator;

import ij.process.ColorProcessor;
import net.imglib2.display.ColorTable;
import sc.fiji.qcviz.surface.Mesh;
import sc.fiji.qcviz.surface.SurfaceView;
import sc.fiji.qcviz.surface.SurfaceView.Hemisphere;
import sc.fiji.qcviz.util.ColorMaps;
import sc.fiji.qcviz.volume.IntensityWindow;

/**
 * Renders a triangulated mesh into an RGB raster using an orthographic
 * camera and the painter's algorithm: faces are filled from the farthest to
 * the nearest, each one shaded by the angle between its normal and the
 * viewing direction.
 */
public class SurfaceProjector {

	/** Color of faces without data */
	private static final double[] MESH_RGB = { 0.8, 0.8, 0.8 };
	private static final double AMBIENT = 0.35;

	private final int size;
	private final int margin;
	private Color background = Color.BLACK;

	/**
	 * @param size the width and height of rendered images, in pixels
	 */
	public SurfaceProjector(final int size) {
		this.size = size;
		this.margin = Math.max(2, size / 20);
	}

	public void setBackground(final Color background) {
		this.background = background;
	}

	/**
	 * Renders a mesh.
	 *
	 * @param mesh the mesh
	 * @param values per-vertex data values, or null
	 * @param bgValues per-vertex background values, or null
	 * @param view the camera position
	 * @param window the data range mapped onto the colormap
	 * @param table the colormap
	 * @param darkness the weight of the background map, in [0, 1]
	 * @return the rendered image
	 */
	public ColorProcessor render(final Mesh mesh, final double[] values, final double[] bgValues,
			final SurfaceView view, final IntensityWindow window, final ColorTable table, final double darkness) {
		final double[][] camera = camera(view);
		final double[] right = camera[0];
		final double[] up = camera[1];
		final double[] toward = camera[2];

		final int nV = mesh.getVertexCount();
		final double[] sx = new double[nV];
		final double[] sy = new double[nV];
		final double[] depth = new double[nV];
		double minX = Double.POSITIVE_INFINITY, maxX = Double.NEGATIVE_INFINITY;
		double minY = Double.POSITIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
		for (int i = 0; i < nV; i++) {
			final double[] v = mesh.getVertex(i);
			sx[i] = dot(v, right);
			sy[i] = dot(v, up);
			depth[i] = dot(v, toward);
			minX = Math.min(minX, sx[i]);
			maxX = Math.max(maxX, sx[i]);
			minY = Math.min(minY, sy[i]);
			maxY = Math.max(maxY, sy[i]);
		}

		final ColorProcessor ip = new ColorProcessor(size, size);
		ip.setColor(background);
		ip.fill();
		if (nV == 0 || mesh.getFaceCount() == 0) return ip;

		final double extent = Math.max(Math.max(maxX - minX, maxY - minY), 1e-9);
		final double scale = (size - 2d * margin) / extent;
		final double offsetX = (size - (maxX - minX) * scale) / 2;
		final double offsetY = (size - (maxY - minY) * scale) / 2;

		final double[] bgRange = (bgValues == null) ? null : finiteRange(bgValues);
		final Integer[] order = new Integer[mesh.getFaceCount()];
		final double[] faceDepth = new double[order.length];
		for (int f = 0; f < order.length; f++) {
			order[f] = f;
			faceDepth[f] = (depth[mesh.faceVertex(f, 0)] + depth[mesh.faceVertex(f, 1)]
					+ depth[mesh.faceVertex(f, 2)]) / 3;
		}
		Arrays.sort(order, Comparator.comparingDouble(f -> faceDepth[f]));

		final int[] xs = new int[3];
		final int[] ys = new int[3];
		for (final int f : order) {
			final int a = mesh.faceVertex(f, 0);
			final int b = mesh.faceVertex(f, 1);
			final int c = mesh.faceVertex(f, 2);
			final double[] rgb = faceColor(values, a, b, c, window, table);
			double factor = AMBIENT + (1 - AMBIENT) * Math.abs(dot(normal(mesh, a, b, c), toward));
			if (bgRange != null) {
				final double bg = mean(bgValues, a, b, c);
				if (!Double.isNaN(bg) && bgRange[1] > bgRange[0])
					factor *= 1 - darkness * (bg - bgRange[0]) / (bgRange[1] - bgRange[0]);
			}
			for (int k = 0; k < 3; k++) {
				final int v = mesh.faceVertex(f, k);
				xs[k] = (int) Math.round(offsetX + (sx[v] - minX) * scale);
				ys[k] = (int) Math.round(size - offsetY - (sy[v] - minY) * scale);
			}
			ip.setColor(new Color(channel(rgb[0] * factor), channel(rgb[1] * factor), channel(rgb[2] * factor)));
			final Polygon polygon = new Polygon(xs, ys, 3);
			ip.fillPolygon(polygon);
			ip.drawPolygon(polygon);
		}
		return ip;
	}

	/*
	 * Returns the {right, up, toward-camera} unit vectors of a view. Lateral
	 * views look at a hemisphere from its outer side, medial views from the
	 * midline.
	 */
	static double[][] camera(final SurfaceView view) {
		final boolean left = view.getHemisphere() == Hemisphere.LEFT;
		final double[] up;
		final double[] toward;
		switch (view.getView()) {
		case LATERAL:
			up = new double[] { 0, 0, 1 };
			toward = new double[] { (left) ? -1 : 1, 0, 0 };
			break;
		case MEDIAL:
			up = new double[] { 0, 0, 1 };
			toward = new double[] { (left) ? 1 : -1, 0, 0 };
			break;
		case DORSAL:
			up = new double[] { 0, 1, 0 };
			toward = new double[] { 0, 0, 1 };
			break;
		case VENTRAL:
			up = new double[] { 0, 1, 0 };
			toward = new double[] { 0, 0, -1 };
			break;
		default:
			throw new IllegalArgumentException("Unsupported view: " + view);
		}
		return new double[][] { cross(up, toward), up, toward };
	}

	private double[] faceColor(final double[] values, final int a, final int b, final int c,
			final IntensityWindow window, final ColorTable table) {
		if (values == null) return MESH_RGB;
		final double value = mean(values, a, b, c);
		if (Double.isNaN(value)) return new double[] { 0.5, 0.5, 0.5 };
		final Color color = ColorMaps.lookup(table, window.normalize(value));
		return new double[] { color.getRed() / 255d, color.getGreen() / 255d, color.getBlue() / 255d };
	}

	private static double mean(final double[] values, final int a, final int b, final int c) {
		double sum = 0;
		int n = 0;
		for (final int i : new int[] { a, b, c }) {
			if (!Double.isNaN(values[i])) {
				sum += values[i];
				n++;
			}
		}
		return (n == 0) ? Double.NaN : sum / n;
	}

	private static double[] finiteRange(final double[] values) {
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (final double v : values) {
			if (Double.isNaN(v)) continue;
			min = Math.min(min, v);
			max = Math.max(max, v);
		}
		return new double[] { min, max };
	}

	private static double[] normal(final Mesh mesh, final int a, final int b, final int c) {
		final double[] pa = mesh.getVertex(a);
		final double[] pb = mesh.getVertex(b);
		final double[] pc = mesh.getVertex(c);
		final double[] n = cross(new double[] { pb[0] - pa[0], pb[1] - pa[1], pb[2] - pa[2] },
				new double[] { pc[0] - pa[0], pc[1] - pa[1], pc[2] - pa[2] });
		final double norm = Math.sqrt(dot(n, n));
		if (norm == 0) return n;
		return new double[] { n[0] / norm, n[1] / norm, n[2] / norm };
	}

	private static double[] cross(final double[] u, final double[] v) {
		return new double[] { u[1] * v[2] - u[2] * v[1], u[2] * v[0] - u[0] * v[2], u[0] * v[1] - u[1] * v[0] };
	}

	private static double dot(final double[] u, final double[] v) {
		return u[0] * v[0] + u[1] * v[1] + u[2] * v[2];
	}

	private static int channel(final double value) {
		return (int) Math.round(255 * Math.max(0, Math.min(1, value)));
	}

}
