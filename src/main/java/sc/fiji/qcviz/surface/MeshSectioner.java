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
package sc.fiji.qcviz.surface;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import sc.fiji.qcviz.util.Logger;
import sc.fiji.qcviz.volume.Axis;

/**
 * Intersects a triangulated mesh with a set of parallel planes normal to one
 * axis, yielding the contour of the mesh on each plane.
 * <p>
 * For every triangle crossing a plane, one segment is computed by linear
 * interpolation along the crossing edges. Segments sharing endpoints are then
 * chained into polylines. A triangle with one edge lying on the plane
 * contributes that edge; an edge shared by two such triangles is drawn once.
 * Triangles lying entirely on the plane are ignored.
 * </p>
 */
public class MeshSectioner {

	/** Distance under which a vertex is considered to lie on a plane */
	public static final double DEFAULT_TOLERANCE = 1e-9;

	/** Grid used to merge segment endpoints */
	private static final double MERGE_PRECISION = 1e-6;

	private final double tolerance;
	private Logger logger;

	public MeshSectioner() {
		this(DEFAULT_TOLERANCE);
	}

	public MeshSectioner(final double tolerance) {
		this.tolerance = Math.abs(tolerance);
	}

	/**
	 * Sections a mesh at each of the specified heights.
	 *
	 * @param mesh the mesh (typically a merged full-brain mesh)
	 * @param normal the axis normal to the slicing planes
	 * @param heights the plane coordinates along {@code normal}
	 * @return one contour per height, in the same order as {@code heights}
	 */
	public List<SectionContour> section(final Mesh mesh, final Axis normal, final double... heights) {
		final List<SectionContour> contours = new ArrayList<>(heights.length);
		final double[] range = mesh.range(normal);
		for (final double h : heights) {
			if (mesh.getVertexCount() == 0 || h < range[0] - tolerance || h > range[1] + tolerance) {
				contours.add(new SectionContour(normal, h, new ArrayList<>()));
				continue;
			}
			contours.add(section(mesh, normal, h));
		}
		return contours;
	}

	/**
	 * Sections a mesh with a single plane.
	 *
	 * @param mesh the mesh
	 * @param normal the axis normal to the slicing plane
	 * @param height the plane coordinate along {@code normal}
	 * @return the contour, possibly empty
	 */
	public SectionContour section(final Mesh mesh, final Axis normal, final double height) {
		final List<double[][]> segments = segments(mesh, normal, height);
		final List<Polyline> polylines = chain(segments);
		log().debug("Plane " + normal.label() + "=" + height + ": " + segments.size() + " segment(s), "
				+ polylines.size() + " polyline(s)");
		return new SectionContour(normal, height, polylines);
	}

	private List<double[][]> segments(final Mesh mesh, final Axis normal, final double height) {
		final Axis[] plane = normal.inPlane();
		final List<double[][]> segments = new ArrayList<>();
		final Set<String> seen = new HashSet<>();
		final double[] d = new double[3];
		final int[] v = new int[3];
		for (int f = 0; f < mesh.getFaceCount(); f++) {
			int nZero = 0;
			int nPos = 0;
			int nNeg = 0;
			for (int c = 0; c < 3; c++) {
				v[c] = mesh.faceVertex(f, c);
				d[c] = mesh.coordinate(v[c], normal) - height;
				if (Math.abs(d[c]) <= tolerance) {
					d[c] = 0;
					nZero++;
				}
				else if (d[c] > 0) nPos++;
				else nNeg++;
			}
			double[] p = null;
			double[] q = null;
			if (nZero == 3) {
				continue;
			}
			else if (nZero == 2) {
				// edge lies in the plane; shared edges are kept once below
				final int k = (d[0] != 0) ? 0 : (d[1] != 0) ? 1 : 2;
				p = project(mesh, v[(k + 1) % 3], plane);
				q = project(mesh, v[(k + 2) % 3], plane);
			}
			else if (nZero == 1) {
				final int z = (d[0] == 0) ? 0 : (d[1] == 0) ? 1 : 2;
				final int j = (z + 1) % 3;
				final int k = (z + 2) % 3;
				if (d[j] * d[k] > 0) continue; // touches the plane at a single vertex
				p = project(mesh, v[z], plane);
				q = interpolate(mesh, v[j], d[j], v[k], d[k], plane);
			}
			else {
				if (nPos == 0 || nNeg == 0) continue;
				// the vertex alone on its side of the plane
				final int lone;
				if (nPos == 1) lone = (d[0] > 0) ? 0 : (d[1] > 0) ? 1 : 2;
				else lone = (d[0] < 0) ? 0 : (d[1] < 0) ? 1 : 2;
				final int j = (lone + 1) % 3;
				final int k = (lone + 2) % 3;
				p = interpolate(mesh, v[lone], d[lone], v[j], d[j], plane);
				q = interpolate(mesh, v[lone], d[lone], v[k], d[k], plane);
			}
			final String kp = key(p);
			final String kq = key(q);
			if (kp.equals(kq)) continue;
			final String segmentKey = (kp.compareTo(kq) < 0) ? kp + "|" + kq : kq + "|" + kp;
			if (seen.add(segmentKey)) segments.add(new double[][] { p, q });
		}
		return segments;
	}

	private static List<Polyline> chain(final List<double[][]> segments) {
		final Map<String, List<Integer>> incidence = new HashMap<>();
		for (int s = 0; s < segments.size(); s++) {
			for (final double[] p : segments.get(s))
				incidence.computeIfAbsent(key(p), k -> new ArrayList<>()).add(s);
		}
		final boolean[] used = new boolean[segments.size()];
		final List<Polyline> polylines = new ArrayList<>();
		for (int s = 0; s < segments.size(); s++) {
			if (used[s]) continue;
			used[s] = true;
			final Deque<double[]> points = new ArrayDeque<>();
			points.add(segments.get(s)[0]);
			points.add(segments.get(s)[1]);
			final String startKey = key(points.getFirst());
			boolean closed = false;

			String endKey = key(points.getLast());
			while (true) {
				final double[] next = advance(segments, incidence, used, endKey);
				if (next == null) break;
				endKey = key(next);
				if (endKey.equals(startKey)) {
					closed = true;
					break;
				}
				points.addLast(next);
			}
			if (!closed) {
				String headKey = startKey;
				while (true) {
					final double[] previous = advance(segments, incidence, used, headKey);
					if (previous == null) break;
					headKey = key(previous);
					points.addFirst(previous);
				}
			}
			polylines.add(new Polyline(new ArrayList<>(points), closed));
		}
		return polylines;
	}

	/* Consumes an unused segment incident to the given endpoint, returning its other endpoint. */
	private static double[] advance(final List<double[][]> segments, final Map<String, List<Integer>> incidence,
			final boolean[] used, final String endpoint) {
		for (final int t : incidence.getOrDefault(endpoint, new ArrayList<>())) {
			if (used[t]) continue;
			used[t] = true;
			final double[][] seg = segments.get(t);
			return (key(seg[0]).equals(endpoint)) ? seg[1] : seg[0];
		}
		return null;
	}

	private static double[] project(final Mesh mesh, final int vertex, final Axis[] plane) {
		return new double[] { mesh.coordinate(vertex, plane[0]), mesh.coordinate(vertex, plane[1]) };
	}

	/* Edge/plane intersection. Vertices are ordered so that a shared edge yields identical points. */
	private static double[] interpolate(final Mesh mesh, final int a, final double da, final int b, final double db,
			final Axis[] plane) {
		if (a > b) return interpolate(mesh, b, db, a, da, plane);
		final double t = da / (da - db);
		final double[] p = new double[2];
		for (int i = 0; i < 2; i++) {
			final double ca = mesh.coordinate(a, plane[i]);
			final double cb = mesh.coordinate(b, plane[i]);
			p[i] = ca + t * (cb - ca);
		}
		return p;
	}

	private static String key(final double[] p) {
		return Math.round(p[0] / MERGE_PRECISION) + ":" + Math.round(p[1] / MERGE_PRECISION);
	}

	private Logger log() {
		if (logger == null) logger = new Logger(MeshSectioner.class);
		return logger;
	}

}
