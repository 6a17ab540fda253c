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

import java.util.Optional;

import sc.fiji.qcviz.ConfigurationException;
import sc.fiji.qcviz.volume.CutSelector;
import sc.fiji.qcviz.volume.IntensityWindow;
import sc.fiji.qcviz.volume.IntensityWindowEstimator;
import sc.fiji.qcviz.volume.Volume;

/**
 * Common parameters of composers rendering slices of a single volume: the
 * number of cuts, the figure title, the display settings and whether the
 * display range should be estimated from the data.
 */
public abstract class SliceComposer {

	protected final RenderingBackend backend;
	protected CutSelector cutSelector;
	protected IntensityWindowEstimator estimator;
	protected int nCuts;
	protected boolean autoBrightness;
	protected String title = "";
	protected DisplaySettings settings = new DisplaySettings();

	protected SliceComposer(final RenderingBackend backend, final int defaultCuts) {
		if (backend == null) throw new IllegalArgumentException("Backend cannot be null");
		this.backend = backend;
		this.nCuts = defaultCuts;
		this.cutSelector = new CutSelector();
		this.estimator = new IntensityWindowEstimator();
	}

	/**
	 * @param nCuts the number of cuts per axis
	 * @throws ConfigurationException if nCuts is not positive
	 */
	public void setCuts(final int nCuts) {
		this.nCuts = ConfigurationException.requirePositive(getClass().getSimpleName(), "nCuts", nCuts);
	}

	public int getCuts() {
		return nCuts;
	}

	/**
	 * @param autoBrightness whether the display range should be estimated from
	 *          the foreground voxels. Display limits set explicitly are never
	 *          overridden
	 */
	public void setAutoBrightness(final boolean autoBrightness) {
		this.autoBrightness = autoBrightness;
	}

	public boolean isAutoBrightness() {
		return autoBrightness;
	}

	public void setTitle(final String title) {
		this.title = (title == null) ? "" : title;
	}

	public String getTitle() {
		return title;
	}

	public void setDisplaySettings(final DisplaySettings settings) {
		this.settings = (settings == null) ? new DisplaySettings() : settings;
	}

	public DisplaySettings getDisplaySettings() {
		return settings;
	}

	public void setCutSelector(final CutSelector cutSelector) {
		this.cutSelector = cutSelector;
	}

	public void setEstimator(final IntensityWindowEstimator estimator) {
		this.estimator = estimator;
	}

	/**
	 * Returns the volume defining the extent of the cuts: the supplied one, or
	 * the data itself thresholded at the selector's threshold.
	 */
	protected Volume boxSource(final Volume data, final Volume boxVolume) {
		return (boxVolume == null) ? data.threshold(cutSelector.getThreshold()) : boxVolume.to3D();
	}

	/**
	 * Resolves the display settings shared by all the panels of a figure.
	 */
	protected DisplaySettings displaySettings(final Volume boxSource) {
		if (!autoBrightness) return settings;
		final Optional<IntensityWindow> window = estimator.estimate(boxSource);
		return settings.withDefaults(window);
	}

}
