/*-
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

package sc.fiji.pst.plugin;

import ij.ImagePlus;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import org.scijava.ItemIO;
import org.scijava.command.Command;
import org.scijava.command.ContextCommand;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;
import org.scijava.plugin.Plugin;
import org.scijava.widget.NumberWidget;
import sc.fiji.pst.ImageShapeException;
import sc.fiji.pst.PSTParameters;
import sc.fiji.pst.PSTUtils;
import sc.fiji.pst.ParameterValidationException;
import sc.fiji.pst.PSTPrefs;
import sc.fiji.pst.PSTResult;
import sc.fiji.pst.PhaseStretchTransform;

/**
 * Command running the Phase Stretch Transform on a single-plane grayscale
 * image. Outputs the binary edge map (8-bit, 0/255) or the continuous phase
 * map (32-bit), together with the PST kernel.
 */
@Plugin(type = Command.class, menuPath = "Plugins>Filters>Phase Stretch Transform...",
		label = "Phase Stretch Transform", initializer = "init")
public class PhaseStretchTransformCmd extends ContextCommand {

	@Parameter
	private LogService logService;

	@Parameter
	private ImagePlus imp;

	@Parameter(label = "Localization filter (LPF)", min = "0.001", max = "1", stepSize = "0.01",
			style = NumberWidget.SPINNER_STYLE + ",format:0.000", persist = false,
			description = "<HTML>FWHM of the isotropic Gaussian localization filter")
	private double lpf;

	@Parameter(label = "Phase strength", min = "0", max = "1", stepSize = "0.01",
			style = NumberWidget.SPINNER_STYLE + ",format:0.000", persist = false)
	private double phaseStrength;

	@Parameter(label = "Warp strength", min = "0", stepSize = "0.1",
			style = NumberWidget.SPINNER_STYLE + ",format:0.00", persist = false)
	private double warpStrength;

	@Parameter(label = "Min. threshold", min = "-1", max = "0", stepSize = "0.001",
			style = NumberWidget.SPINNER_STYLE + ",format:0.0000", persist = false)
	private double thresholdMin;

	@Parameter(label = "Max. threshold", min = "0", max = "1", stepSize = "0.001",
			style = NumberWidget.SPINNER_STYLE + ",format:0.0000", persist = false)
	private double thresholdMax;

	@Parameter(label = "Binary edge map (threshold + morphology)", persist = false,
			description = "<HTML>If unchecked, the continuous phase map is returned")
	private boolean morph;

	@Parameter(label = "Debug mode", persist = false)
	private boolean debug;

	@Parameter(type = ItemIO.OUTPUT, label = "PST edges")
	private ImagePlus edges;

	@Parameter(type = ItemIO.OUTPUT, label = "PST kernel")
	private ImagePlus kernel;

	@SuppressWarnings("unused")
	private void init() {
		final PSTParameters stored = new PSTPrefs(getContext()).getParameters();
		lpf = stored.lpf();
		phaseStrength = stored.phaseStrength();
		warpStrength = stored.warpStrength();
		thresholdMin = stored.thresholdMin();
		thresholdMax = stored.thresholdMax();
		morph = stored.morph();
		debug = PSTUtils.isDebugMode();
	}

	@Override
	public void run() {
		if (imp == null) {
			cancel("No image available.");
			return;
		}
		if (!PSTUtils.isContextSet()) PSTUtils.setContext(getContext());
		PSTUtils.setDebugMode(debug);
		final PSTParameters parameters;
		try {
			parameters = new PSTParameters(lpf, phaseStrength, warpStrength, thresholdMin, thresholdMax, morph);
		} catch (final ParameterValidationException ex) {
			logService.warn(ex.getMessage());
			cancel(ex.getMessage());
			return;
		}
		PSTUtils.log("Running " + PSTUtils.getReadableVersion() + " on " + imp.getTitle());
		try {
			final PSTResult result = process(imp, parameters);
			edges = toImagePlus(result, imp.getShortTitle() + "_edge");
			kernel = new ImagePlus(imp.getShortTitle() + "_PST_kernel", toFloatProcessor(result.kernel()));
			new PSTPrefs(getContext()).setParameters(parameters);
		} catch (final ImageShapeException ex) {
			PSTUtils.error("Cannot process " + imp.getTitle(), ex);
			cancel(ex.getMessage());
		}
	}

	/**
	 * Runs the transform on the current plane of a grayscale image.
	 *
	 * @throws ImageShapeException if the image is RGB or has more than one
	 *                             plane
	 */
	public static PSTResult process(final ImagePlus imp, final PSTParameters parameters) {
		if (imp.getType() == ImagePlus.COLOR_RGB || imp.getType() == ImagePlus.COLOR_256)
			throw new ImageShapeException("Only grayscale images are supported");
		if (imp.getStackSize() > 1)
			throw new ImageShapeException("Only single-plane images are supported", imp.getWidth(),
					imp.getHeight(), imp.getStackSize());
		return new PhaseStretchTransform(parameters).compute(wrap(imp.getProcessor()));
	}

	/**
	 * Copies the pixels of {@code ip} into a 32-bit image (calibration
	 * tables are applied).
	 */
	public static Img<FloatType> wrap(final ImageProcessor ip) {
		final FloatProcessor fp = ip.convertToFloatProcessor();
		return ArrayImgs.floats((float[]) fp.getPixels(), fp.getWidth(), fp.getHeight());
	}

	/**
	 * Renders the final output of a result: the binary edge map as an 8-bit
	 * 0/255 image, or the phase map as a 32-bit image.
	 */
	public static ImagePlus toImagePlus(final PSTResult result, final String title) {
		if (!result.isBinary())
			return new ImagePlus(title, toFloatProcessor(result.phaseMap()));
		final Img<BitType> edgeMap = result.edgeMap();
		final ByteProcessor bp = new ByteProcessor((int) edgeMap.dimension(0), (int) edgeMap.dimension(1));
		final Cursor<BitType> cursor = edgeMap.localizingCursor();
		while (cursor.hasNext()) {
			if (cursor.next().get())
				bp.set(cursor.getIntPosition(0), cursor.getIntPosition(1), 255);
		}
		return new ImagePlus(title, bp);
	}

	private static FloatProcessor toFloatProcessor(final RandomAccessibleInterval<DoubleType> img) {
		final FloatProcessor fp = new FloatProcessor((int) img.dimension(0), (int) img.dimension(1));
		final Cursor<DoubleType> cursor = Views.iterable(img).localizingCursor();
		while (cursor.hasNext()) {
			final double v = cursor.next().get();
			fp.setf(cursor.getIntPosition(0), cursor.getIntPosition(1), (float) v);
		}
		fp.resetMinAndMax();
		return fp;
	}

}
