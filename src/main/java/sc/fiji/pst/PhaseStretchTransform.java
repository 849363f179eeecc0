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

package sc.fiji.pst;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import sc.fiji.pst.fft.FourierTransformer;
import sc.fiji.pst.fft.JTransformsFourierTransformer;
import sc.fiji.pst.filter.CoordinateGridBuilder;
import sc.fiji.pst.filter.EdgeFeatureExtractor;
import sc.fiji.pst.filter.FrequencyGrid;
import sc.fiji.pst.filter.GaussianLocalizationFilter;
import sc.fiji.pst.filter.PhaseKernelApplier;
import sc.fiji.pst.filter.PhaseKernelBuilder;
import sc.fiji.pst.morphology.BinaryMorphology;
import sc.fiji.pst.morphology.DefaultBinaryMorphology;
import sc.fiji.pst.util.ImgUtils;
import sc.fiji.pst.util.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Phase Stretch Transform (PST) edge detection.
 * <p>
 * The transform smooths the image with a Gaussian localization filter, applies
 * a nonlinear frequency-dependent phase kernel to its spectrum and returns the
 * phase of the result in the spatial domain. Optionally, the phase is
 * thresholded and cleaned up morphologically into a binary edge map.
 * </p>
 * <p>
 * Instances are immutable and hold no state between calls: the same instance
 * may process any number of images, from any number of threads.
 * </p>
 * M. H. Asghari and B. Jalali, "Edge detection in digital images using
 * dispersive phase stretch," International Journal of Biomedical Imaging,
 * Vol. 2015, Article ID 687819, pp. 1-6 (2015).
 */
public class PhaseStretchTransform {

	private final PSTParameters parameters;
	private final FourierTransformer fft;
	private final BinaryMorphology morphology;
	private final Logger logger;

	/**
	 * Creates a transform using JTransforms and the default morphology
	 * implementation.
	 *
	 * @param parameters the (already validated) parameters
	 */
	public PhaseStretchTransform(final PSTParameters parameters) {
		this(parameters, new JTransformsFourierTransformer(), new DefaultBinaryMorphology());
	}

	public PhaseStretchTransform(final PSTParameters parameters, final FourierTransformer fft,
			final BinaryMorphology morphology) {
		if (parameters == null) throw new NullPointerException("parameters cannot be null");
		if (fft == null) throw new NullPointerException("Fourier transformer cannot be null");
		if (morphology == null) throw new NullPointerException("morphology cannot be null");
		this.parameters = parameters;
		this.fft = fft;
		this.morphology = morphology;
		this.logger = new Logger(PhaseStretchTransform.class);
	}

	public PSTParameters getParameters() {
		return parameters;
	}

	/**
	 * Runs the transform.
	 *
	 * @param image a 2D grayscale image
	 * @return the phase map, the kernel and, if requested, the edge map
	 * @throws ImageShapeException if the image is not a non-empty 2D image
	 */
	public <T extends RealType<T>> PSTResult compute(final RandomAccessibleInterval<T> image) {
		final long[] dims = ImgUtils.requirePlanar(image);
		final RandomAccessibleInterval<T> input = Views.zeroMin(image);
		logger.debug(String.format("Processing %dx%d image with %s", dims[0], dims[1], parameters));

		final FrequencyGrid grid = new CoordinateGridBuilder().buildGrid(dims[1], dims[0]);
		final Img<DoubleType> filtered = new GaussianLocalizationFilter(parameters.lpf(), fft)
				.apply(input, grid.rho());
		final Img<DoubleType> kernel = new PhaseKernelBuilder(parameters.warpStrength(),
				parameters.phaseStrength()).buildKernel(grid.rho());
		final Img<DoubleType> phase = new PhaseKernelApplier(fft).apply(filtered, kernel);
		if (!parameters.morph()) {
			return new PSTResult(phase, null, kernel);
		}
		final Img<BitType> edges = new EdgeFeatureExtractor(parameters.thresholdMin(),
				parameters.thresholdMax(), morphology).extract(phase, input);
		return new PSTResult(phase, edges, kernel);
	}

	/**
	 * Runs the transform on a {@code [row][column]} array.
	 *
	 * @throws ImageShapeException if the array is empty or ragged
	 */
	public PSTResult compute(final double[][] image) {
		return compute(ImgUtils.toImg(image));
	}

	/**
	 * Runs the transform on several independent images in parallel.
	 *
	 * @param images   the images to process
	 * @param nThreads the number of worker threads (clamped to [1, number of
	 *                 available processors])
	 * @return the results, in the order of {@code images}
	 * @throws ImageShapeException   if any image is invalid
	 * @throws IllegalStateException if interrupted while waiting for results
	 */
	public <T extends RealType<T>> List<PSTResult> computeAll(
			final List<? extends RandomAccessibleInterval<T>> images, final int nThreads) {
		final int threads = Math.max(1, Math.min(nThreads, Runtime.getRuntime().availableProcessors()));
		if (threads != nThreads)
			logger.warn("Requested " + nThreads + " thread(s), using " + threads);
		logger.debug("Processing " + images.size() + " image(s) using " + threads + " thread(s)");
		final ExecutorService es = Executors.newFixedThreadPool(threads);
		try {
			final List<Future<PSTResult>> futures = new ArrayList<>(images.size());
			for (final RandomAccessibleInterval<T> image : images) {
				futures.add(es.submit(() -> compute(image)));
			}
			final List<PSTResult> results = new ArrayList<>(futures.size());
			for (final Future<PSTResult> future : futures) {
				results.add(future.get());
			}
			return results;
		} catch (final InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while computing PST", e);
		} catch (final ExecutionException e) {
			if (e.getCause() instanceof RuntimeException)
				throw (RuntimeException) e.getCause();
			if (e.getCause() instanceof Error)
				throw (Error) e.getCause();
			throw new IllegalStateException("PST computation failed", e.getCause());
		} finally {
			es.shutdownNow();
		}
	}

}
