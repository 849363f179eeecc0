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

package sc.fiji.pst.filter;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.loops.LoopBuilder;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import sc.fiji.pst.morphology.BinaryMorphology;
import sc.fiji.pst.morphology.Connectivity;
import sc.fiji.pst.morphology.StructuringElement;
import sc.fiji.pst.util.ImgUtils;
import sc.fiji.pst.util.Logger;

/**
 * Converts a PST phase map into a binary edge map: two-sided thresholding,
 * suppression of detections in near-black regions, then a fixed morphological
 * cleanup (thin, 4-connected perimeter, thin, erode).
 */
public class EdgeFeatureExtractor {

	/** Pixels darker than {@code max / DARK_REGION_DIVISOR} never hold edges */
	public static final double DARK_REGION_DIVISOR = 20;

	/** Thinning sweeps per thinning step */
	public static final int THINNING_ITERATIONS = 1;

	/**
	 * 1x1 erosion, a no-op on binary images. Kept as the last step of the
	 * published PST cleanup sequence.
	 */
	public static final StructuringElement FINAL_EROSION_ELEMENT = StructuringElement.ones(1, 1);

	private final double thresholdMin;
	private final double thresholdMax;
	private final BinaryMorphology morphology;
	private final Logger logger = new Logger(EdgeFeatureExtractor.class);

	/**
	 * @param thresholdMin phase values below this are edges
	 * @param thresholdMax phase values above this are edges
	 * @param morphology   the morphology implementation
	 */
	public EdgeFeatureExtractor(final double thresholdMin, final double thresholdMax,
			final BinaryMorphology morphology) {
		this.thresholdMin = thresholdMin;
		this.thresholdMax = thresholdMax;
		this.morphology = morphology;
	}

	/**
	 * @param phaseMap the PST phase map
	 * @param original the unfiltered input image
	 * @return the binary edge map
	 */
	public <T extends RealType<T>> Img<BitType> extract(final RandomAccessibleInterval<DoubleType> phaseMap,
			final RandomAccessibleInterval<T> original) {
		ImgUtils.requirePlanar(phaseMap);
		ImgUtils.requireSameDimensions(phaseMap, original, "Original image");
		final Img<BitType> features = threshold(phaseMap);
		suppressDarkRegions(features, original);
		return cleanup(features);
	}

	/**
	 * Marks pixels whose phase is above {@code thresholdMax} or below
	 * {@code thresholdMin}: the phase of an edge can swing either way.
	 */
	public Img<BitType> threshold(final RandomAccessibleInterval<DoubleType> phaseMap) {
		final Img<BitType> features = ArrayImgs.bits(Intervals.dimensionsAsLongArray(phaseMap));
		LoopBuilder.setImages(Views.zeroMin(phaseMap), features).forEachPixel((p, f) -> {
			final double phi = p.get();
			f.set(phi > thresholdMax || phi < thresholdMin);
		});
		return features;
	}

	/**
	 * Clears features wherever the original image is darker than
	 * {@code max(original) / 20}. In place.
	 */
	public <T extends RealType<T>> void suppressDarkRegions(final RandomAccessibleInterval<BitType> features,
			final RandomAccessibleInterval<T> original) {
		final double cutoff = ImgUtils.max(original) / DARK_REGION_DIVISOR;
		logger.debug("Suppressing edges below intensity " + cutoff);
		LoopBuilder.setImages(Views.zeroMin(features), Views.zeroMin(original)).forEachPixel((f, o) -> {
			if (o.getRealDouble() < cutoff) f.set(false);
		});
	}

	/**
	 * Runs the cleanup sequence. The order matters: thin, 4-connected
	 * perimeter, thin, erode.
	 */
	public Img<BitType> cleanup(final RandomAccessibleInterval<BitType> features) {
		Img<BitType> out = morphology.thin(features, THINNING_ITERATIONS);
		out = morphology.perimeter(out, Connectivity.FOUR);
		out = morphology.thin(out, THINNING_ITERATIONS);
		return morphology.erode(out, FINAL_EROSION_ELEMENT);
	}

}
