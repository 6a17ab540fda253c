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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import sc.fiji.qcviz.ConfigurationException;
import sc.fiji.qcviz.label.ColorLookupTable;
import sc.fiji.qcviz.surface.BrainModelIndex;
import sc.fiji.qcviz.surface.Mesh;
import sc.fiji.qcviz.surface.ScalarMaps;
import sc.fiji.qcviz.volume.Volume;

/**
 * The in-memory data a report visualizes. Which fields are required depends
 * on the report kind; reports retrieve mandatory inputs through the
 * {@code require*} accessors, which fail with a {@link ConfigurationException}
 * naming the missing input.
 */
public class ReportInputs {

	private Volume image;
	private Volume background;
	private Volume foreground;
	private Volume mask;
	private Volume contour;
	private final List<Volume> segmentations = new ArrayList<>();
	private Volume labels;
	private ColorLookupTable lookupTable;
	private Mesh leftSurface;
	private Mesh rightSurface;
	private ScalarMaps surfaceData;
	private BrainModelIndex surfaceIndex;
	private ScalarMaps backgroundMap;
	private BrainModelIndex backgroundIndex;

	/** @param image the primary volume (anatomical, functional or montage reports) */
	public ReportInputs image(final Volume image) {
		this.image = image;
		return this;
	}

	/** @param background the background (or moving) volume */
	public ReportInputs background(final Volume background) {
		this.background = background;
		return this;
	}

	/** @param foreground the foreground (or fixed) volume */
	public ReportInputs foreground(final Volume foreground) {
		this.foreground = foreground;
		return this;
	}

	/** @param mask the volume defining the extent of the cuts */
	public ReportInputs mask(final Volume mask) {
		this.mask = mask;
		return this;
	}

	/** @param contour the volume outlined on registration panels */
	public ReportInputs contour(final Volume contour) {
		this.contour = contour;
		return this;
	}

	/** @param segmentation a segmentation mask to overlay */
	public ReportInputs segmentation(final Volume segmentation) {
		this.segmentations.add(segmentation);
		return this;
	}

	/** @param labels the parcellation (label) volume */
	public ReportInputs labels(final Volume labels) {
		this.labels = labels;
		return this;
	}

	public ReportInputs lookupTable(final ColorLookupTable lookupTable) {
		this.lookupTable = lookupTable;
		return this;
	}

	public ReportInputs surfaces(final Mesh left, final Mesh right) {
		this.leftSurface = left;
		this.rightSurface = right;
		return this;
	}

	/**
	 * @param data the grayordinate maps
	 * @param index the index table of the maps
	 */
	public ReportInputs surfaceData(final ScalarMaps data, final BrainModelIndex index) {
		this.surfaceData = data;
		this.surfaceIndex = index;
		return this;
	}

	/**
	 * @param data the background grayordinate map (e.g., sulcal depth)
	 * @param index the index table of the map
	 */
	public ReportInputs backgroundMap(final ScalarMaps data, final BrainModelIndex index) {
		this.backgroundMap = data;
		this.backgroundIndex = index;
		return this;
	}

	public Volume requireImage() {
		return require("image", image);
	}

	public Volume requireBackground() {
		return require("background", background);
	}

	public Volume requireForeground() {
		return require("foreground", foreground);
	}

	public Volume requireContour() {
		return require("contour", contour);
	}

	public Volume requireLabels() {
		return require("labels", labels);
	}

	public ColorLookupTable requireLookupTable() {
		return require("lookupTable", lookupTable);
	}

	public Mesh requireLeftSurface() {
		return require("leftSurface", leftSurface);
	}

	public Mesh requireRightSurface() {
		return require("rightSurface", rightSurface);
	}

	public List<Volume> requireSegmentations() {
		if (segmentations.isEmpty())
			throw new ConfigurationException("ReportInputs", "Missing required input: segmentations");
		return Collections.unmodifiableList(segmentations);
	}

	public Volume getForeground() {
		return foreground;
	}

	public Volume getMask() {
		return mask;
	}

	public Volume getContour() {
		return contour;
	}

	public ScalarMaps getSurfaceData() {
		return surfaceData;
	}

	public BrainModelIndex getSurfaceIndex() {
		return surfaceIndex;
	}

	public ScalarMaps getBackgroundMap() {
		return backgroundMap;
	}

	public BrainModelIndex getBackgroundIndex() {
		return backgroundIndex;
	}

	private static <T> T require(final String name, final T value) {
		if (value == null)
			throw new ConfigurationException("ReportInputs", "Missing required input: " + name);
		return value;
	}

}
