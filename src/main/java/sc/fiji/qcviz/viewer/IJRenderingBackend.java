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
import java.awt.Font;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import ij.IJ;
import ij.ImagePlus;
import ij.gui.PolygonRoi;
import ij.gui.Roi;
import ij.io.FileSaver;
import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.FloatPolygon;
import ij.process.FloatProcessor;
import net.imglib2.RandomAccessible;
import net.imglib2.RealRandomAccess;
import net.imglib2.display.ColorTable;
import net.imglib2.interpolation.InterpolatorFactory;
import net.imglib2.interpolation.randomaccess.NLinearInterpolatorFactory;
import net.imglib2.interpolation.randomaccess.NearestNeighborInterpolatorFactory;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import sc.fiji.qcviz.ConfigurationException;
import sc.fiji.qcviz.QCVizUtils;
import sc.fiji.qcviz.label.LabelColor;
import sc.fiji.qcviz.surface.Mesh;
import sc.fiji.qcviz.surface.Polyline;
import sc.fiji.qcviz.surface.SurfaceView;
import sc.fiji.qcviz.util.ColorMaps;
import sc.fiji.qcviz.util.Logger;
import sc.fiji.qcviz.volume.Axis;
import sc.fiji.qcviz.volume.IntensityWindow;
import sc.fiji.qcviz.volume.Volume;
import sc.fiji.qcviz.volume.VoxelAffine;

/**
 * {@link RenderingBackend} based on ImageJ1 processors. Slices are resampled
 * on an isotropic grid of physical coordinates, so that panels of volumes
 * with different (or oblique) affines line up and overlays can be sampled
 * at the very same positions.
 */
public class IJRenderingBackend implements RenderingBackend {

	/** Default size (in pixels) of surface renders */
	public static final int DEFAULT_SURFACE_SIZE = 300;
	/** Largest width or height of a rendered slice */
	public static final int MAX_SLICE_SIZE = 512;

	private static final int GAP = 2;
	private static final int LABEL_HEIGHT = 18;

	private Color background = Color.BLACK;
	private Color foreground = Color.WHITE;
	private boolean drawLabels = true;
	private int surfaceSize = DEFAULT_SURFACE_SIZE;
	private Logger logger;

	/**
	 * Sets whether panel and document titles are drawn into composed images.
	 * Text rendering requires fonts to be available to the JVM.
	 */
	public void setDrawLabels(final boolean drawLabels) {
		this.drawLabels = drawLabels;
	}

	public void setBackground(final Color background) {
		this.background = background;
	}

	public void setForeground(final Color foreground) {
		this.foreground = foreground;
	}

	public void setSurfaceSize(final int surfaceSize) {
		this.surfaceSize = ConfigurationException.requirePositive("IJRenderingBackend", "surfaceSize", surfaceSize);
	}

	@Override
	public IJPanel renderSlices(final Volume volume, final Axis axis, final double[] coordinates,
			final DisplaySettings settings, final String title) {
		final Volume vol = volume.to3D();
		final IntensityWindow window = resolveWindow(vol, settings);
		final ColorTable table = ColorMaps.get(settings.getColormap());

		final Axis[] plane = axis.inPlane();
		final double[][] corners = corners(vol);
		final double[] uRange = range(corners, plane[0]);
		final double[] vRange = range(corners, plane[1]);
		final VoxelAffine affine = vol.getAffine();
		double pixelSize = Math.min(affine.voxelSize(0), Math.min(affine.voxelSize(1), affine.voxelSize(2)));
		final double span = Math.max(uRange[1] - uRange[0], vRange[1] - vRange[0]);
		if (span / pixelSize + 1 > MAX_SLICE_SIZE) pixelSize = span / (MAX_SLICE_SIZE - 1);
		final int width = (int) Math.floor((uRange[1] - uRange[0]) / pixelSize) + 1;
		final int height = (int) Math.floor((vRange[1] - vRange[0]) / pixelSize) + 1;

		final int n = coordinates.length;
		final ColorProcessor canvas = new ColorProcessor(Math.max(1, n * width + (n - 1) * GAP), height);
		canvas.setColor(background);
		canvas.fill();

		final RealRandomAccess<DoubleType> sampler = sampler(vol, false);
		final List<SliceGeometry> slices = new ArrayList<>(n);
		for (int s = 0; s < n; s++) {
			final SliceGeometry g = new SliceGeometry(axis, coordinates[s], uRange[0], vRange[1], pixelSize, width,
					height, s * (width + GAP), 0);
			final FloatProcessor fp = new FloatProcessor(width, height);
			for (int row = 0; row < height; row++) {
				for (int col = 0; col < width; col++) {
					sampler.setPosition(affine.applyInverse(g.toPhysical(col, row)));
					fp.setf(col, row, (float) sampler.get().getRealDouble());
				}
			}
			fp.setMinAndMax(window.getLower(), window.getUpper());
			final ByteProcessor bp = fp.convertToByteProcessor(true);
			bp.setColorModel(ColorMaps.toColorModel(table));
			canvas.insert(bp.convertToColorProcessor(), g.getXOffset(), g.getYOffset());
			slices.add(g);
		}
		log().debug("Rendered " + title + ": " + n + " slice(s) along " + axis.label() + ", window " + window);
		return new IJPanel(title, axis, canvas, slices);
	}

	@Override
	public void overlayContours(final Panel panel, final int slice, final List<Polyline> polylines,
			final Color color, final double lineWidth) {
		final IJPanel p = asIJ(panel);
		final SliceGeometry g = p.getSlice(slice);
		for (final Polyline polyline : polylines) {
			if (polyline.size() < 2) continue;
			final FloatPolygon fp = new FloatPolygon();
			for (final double[] point : polyline.getPoints())
				fp.addPoint(g.toCanvasX(point[0]), g.toCanvasY(point[1]));
			final PolygonRoi roi = new PolygonRoi(fp, (polyline.isClosed()) ? Roi.POLYGON : Roi.POLYLINE);
			roi.enableSubPixelResolution();
			roi.setStrokeColor(color);
			roi.setStrokeWidth(lineWidth);
			roi.setName(String.format("%s-%d-%04d", p.getTitle(), slice, p.getOverlay().size()));
			p.getOverlay().add(roi);
		}
	}

	@Override
	public void overlayMasks(final Panel panel, final List<Volume> masks, final List<LabelColor> colors,
			final double alpha, final boolean filled) {
		if (masks.size() != colors.size())
			throw new ConfigurationException("IJRenderingBackend",
					masks.size() + " masks but " + colors.size() + " colors");
		final IJPanel p = asIJ(panel);
		final ColorProcessor ip = p.getProcessor();
		for (final SliceGeometry g : p.getSlices()) {
			final int w = g.getWidth();
			final int h = g.getHeight();
			final int[] owner = new int[w * h];
			Arrays.fill(owner, -1);
			final Map<VoxelAffine, double[][]> voxelCache = new HashMap<>();
			for (int m = 0; m < masks.size(); m++) {
				final Volume mask = masks.get(m).to3D();
				final double[][] voxels = voxelCache.computeIfAbsent(mask.getAffine(), a -> voxelPositions(g, a));
				final RealRandomAccess<DoubleType> sampler = sampler(mask, false);
				for (int i = 0; i < owner.length; i++) {
					sampler.setPosition(voxels[i]);
					if (sampler.get().getRealDouble() > 0) owner[i] = m;
				}
			}
			for (int row = 0; row < h; row++) {
				for (int col = 0; col < w; col++) {
					final int m = owner[row * w + col];
					if (m < 0) continue;
					final int x = g.getXOffset() + col;
					final int y = g.getYOffset() + row;
					final Color c = colors.get(m).toAWT();
					if (filled)
						ip.set(x, y, blend(ip.get(x, y), c, alpha));
					else if (isEdge(owner, w, h, col, row))
						ip.set(x, y, c.getRGB() & 0xffffff);
				}
			}
		}
	}

	@Override
	public void overlayScalar(final Panel panel, final Volume scalar, final ColorTable ramp,
			final IntensityWindow window) {
		final IJPanel p = asIJ(panel);
		final ColorProcessor ip = p.getProcessor();
		final Volume vol = scalar.to3D();
		final RealRandomAccess<DoubleType> sampler = sampler(vol, true);
		for (final SliceGeometry g : p.getSlices()) {
			final double[][] voxels = voxelPositions(g, vol.getAffine());
			for (int row = 0; row < g.getHeight(); row++) {
				for (int col = 0; col < g.getWidth(); col++) {
					sampler.setPosition(voxels[row * g.getWidth() + col]);
					final double value = sampler.get().getRealDouble();
					if (value == 0 || Double.isNaN(value)) continue;
					final Color c = ColorMaps.lookup(ramp, window.normalize(value));
					if (c.getAlpha() == 0) continue;
					final int x = g.getXOffset() + col;
					final int y = g.getYOffset() + row;
					ip.set(x, y, blend(ip.get(x, y), c, c.getAlpha() / 255d));
				}
			}
		}
	}

	@Override
	public IJPanel renderSurface(final Mesh mesh, final double[] values, final double[] background,
			final SurfaceView view, final DisplaySettings settings, final double darkness, final String title) {
		IntensityWindow window = new IntensityWindow(0, 1);
		if (values != null) {
			final double[] range = finiteRange(values);
			window = settings.resolve(range[0], range[1]);
		}
		final SurfaceProjector projector = new SurfaceProjector(surfaceSize);
		projector.setBackground(this.background);
		final ColorProcessor ip = projector.render(mesh, values, background, view, window,
				ColorMaps.get(settings.getColormap()), darkness);
		log().debug("Rendered " + title + ": " + mesh + " (" + view + ")");
		return new IJPanel(title, null, ip, new ArrayList<>());
	}

	@Override
	public IJPanel compose(final List<Panel> panels, final int columns, final String title) {
		ConfigurationException.requirePositive("IJRenderingBackend", "columns", columns);
		final int labelBand = (drawLabels) ? LABEL_HEIGHT : 0;
		final int nRows = (panels.size() + columns - 1) / columns;
		final int[] rowHeights = new int[nRows];
		final int[] rowWidths = new int[nRows];
		final List<ColorProcessor> flats = new ArrayList<>(panels.size());
		for (int i = 0; i < panels.size(); i++) {
			final ColorProcessor flat = asIJ(panels.get(i)).flatten();
			flats.add(flat);
			final int r = i / columns;
			rowHeights[r] = Math.max(rowHeights[r], flat.getHeight() + labelBand);
			rowWidths[r] += flat.getWidth() + ((i % columns > 0) ? GAP : 0);
		}
		final int width = Math.max(1, Arrays.stream(rowWidths).max().orElse(1));
		final int height = Math.max(1, labelBand + Arrays.stream(rowHeights).sum() + GAP * Math.max(0, nRows - 1));

		final ColorProcessor canvas = new ColorProcessor(width, height);
		canvas.setColor(background);
		canvas.fill();
		if (drawLabels) label(canvas, title, 2, LABEL_HEIGHT - 4);
		int y = labelBand;
		for (int r = 0; r < nRows; r++) {
			int x = 0;
			for (int i = r * columns; i < Math.min(panels.size(), (r + 1) * columns); i++) {
				final ColorProcessor flat = flats.get(i);
				if (drawLabels) label(canvas, panels.get(i).getTitle(), x + 2, y + LABEL_HEIGHT - 4);
				canvas.insert(flat, x, y + labelBand);
				x += flat.getWidth() + GAP;
			}
			y += rowHeights[r] + GAP;
		}
		log().debug("Composed " + title + ": " + panels.size() + " panel(s) into " + width + "x" + height);
		return new IJPanel(title, null, canvas, new ArrayList<>());
	}

	@Override
	public void write(final Panel panel, final File file) throws IOException {
		final ImagePlus imp = new ImagePlus(panel.getTitle(), asIJ(panel).flatten());
		final String ext = QCVizUtils.getExtension(file).toLowerCase(Locale.US);
		final boolean saved;
		switch (ext) {
		case "png":
			saved = new FileSaver(imp).saveAsPng(file.getAbsolutePath());
			break;
		case "tif":
		case "tiff":
			saved = IJ.saveAsTiff(imp, file.getAbsolutePath());
			break;
		case "jpg":
		case "jpeg":
			saved = new FileSaver(imp).saveAsJpeg(file.getAbsolutePath());
			break;
		default:
			throw new ConfigurationException("IJRenderingBackend",
					"Unsupported output format '" + ext + "': Valid options are png, tif, jpg");
		}
		if (!saved) throw new IOException("Could not save " + file.getAbsolutePath());
	}

	private IntensityWindow resolveWindow(final Volume vol, final DisplaySettings settings) {
		if (settings.getVmin() != null && settings.getVmax() != null)
			return settings.resolve(settings.getVmin(), settings.getVmax());
		final double[] range = finiteRange(vol.flatten());
		return settings.resolve(range[0], range[1]);
	}

	private void label(final ColorProcessor ip, final String text, final int x, final int y) {
		if (text == null || text.isEmpty()) return;
		ip.setColor(foreground);
		ip.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 12));
		ip.setAntialiasedText(true);
		ip.drawString(text, x, y);
	}

	private static IJPanel asIJ(final Panel panel) {
		if (panel instanceof IJPanel) return (IJPanel) panel;
		throw new IllegalArgumentException("Not a panel of this backend: " + panel);
	}

	private static RealRandomAccess<DoubleType> sampler(final Volume vol, final boolean linear) {
		final InterpolatorFactory<DoubleType, RandomAccessible<DoubleType>> factory;
		if (linear) factory = new NLinearInterpolatorFactory<>();
		else factory = new NearestNeighborInterpolatorFactory<>();
		return Views.interpolate(Views.extendZero(vol.getData()), factory).realRandomAccess();
	}

	private static double[][] voxelPositions(final SliceGeometry g, final VoxelAffine affine) {
		final double[][] voxels = new double[g.getWidth() * g.getHeight()][];
		for (int row = 0; row < g.getHeight(); row++) {
			for (int col = 0; col < g.getWidth(); col++)
				voxels[row * g.getWidth() + col] = affine.applyInverse(g.toPhysical(col, row));
		}
		return voxels;
	}

	private static double[][] corners(final Volume vol) {
		final long[] dims = vol.spatialDimensions();
		final double[][] corners = new double[8][];
		for (int i = 0; i < 8; i++) {
			corners[i] = vol.getAffine().apply(((i & 1) == 0) ? 0 : dims[0] - 1, ((i & 2) == 0) ? 0 : dims[1] - 1,
					((i & 4) == 0) ? 0 : dims[2] - 1);
		}
		return corners;
	}

	private static double[] range(final double[][] points, final Axis axis) {
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (final double[] p : points) {
			min = Math.min(min, p[axis.index()]);
			max = Math.max(max, p[axis.index()]);
		}
		return new double[] { min, max };
	}

	private static double[] finiteRange(final double[] values) {
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (final double v : values) {
			if (Double.isNaN(v) || Double.isInfinite(v)) continue;
			min = Math.min(min, v);
			max = Math.max(max, v);
		}
		if (min > max) return new double[] { 0, 1 };
		return new double[] { min, max };
	}

	private static boolean isEdge(final int[] owner, final int w, final int h, final int col, final int row) {
		final int m = owner[row * w + col];
		return col == 0 || row == 0 || col == w - 1 || row == h - 1 || owner[row * w + col - 1] != m
				|| owner[row * w + col + 1] != m || owner[(row - 1) * w + col] != m || owner[(row + 1) * w + col] != m;
	}

	private static int blend(final int rgb, final Color c, final double alpha) {
		final int r = (int) Math.round(alpha * c.getRed() + (1 - alpha) * ((rgb >> 16) & 0xff));
		final int g = (int) Math.round(alpha * c.getGreen() + (1 - alpha) * ((rgb >> 8) & 0xff));
		final int b = (int) Math.round(alpha * c.getBlue() + (1 - alpha) * (rgb & 0xff));
		return (r << 16) | (g << 8) | b;
	}

	private Logger log() {
		if (logger == null) logger = new Logger(IJRenderingBackend.class);
		return logger;
	}

}
