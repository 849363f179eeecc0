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

package sc.fiji.pst.morphology;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.logic.BitType;
import sc.fiji.pst.util.ImgUtils;

/**
 * {@link BinaryMorphology} on flat pixel arrays. Pixels outside the image are
 * treated as background by every operation.
 * <p>
 * Thinning uses the hit-or-miss transform with the eight classic thinning
 * elements (Gonzalez &amp; Woods; HIPR2 "Thinning"), removing matches of each
 * element in turn so that every removal is seen by the next element.
 * </p>
 */
public class DefaultBinaryMorphology implements BinaryMorphology {

	/** Element values: 1 = foreground, 0 = background, DONT_CARE = either */
	private static final int DONT_CARE = 2;

	/** Thinning elements, indexed [dy + 1][dx + 1] */
	private static final int[][][] THINNING_ELEMENTS = {
			{ { 0, 0, 0 }, { 2, 1, 2 }, { 1, 1, 1 } },
			{ { 2, 0, 0 }, { 1, 1, 0 }, { 2, 1, 2 } },
			{ { 1, 2, 0 }, { 1, 1, 0 }, { 1, 2, 0 } },
			{ { 2, 1, 2 }, { 1, 1, 0 }, { 2, 0, 0 } },
			{ { 1, 1, 1 }, { 2, 1, 2 }, { 0, 0, 0 } },
			{ { 2, 1, 2 }, { 0, 1, 1 }, { 0, 0, 2 } },
			{ { 0, 2, 1 }, { 0, 1, 1 }, { 0, 2, 1 } },
			{ { 0, 0, 2 }, { 0, 1, 1 }, { 2, 1, 2 } } };

	@Override
	public Img<BitType> thin(final RandomAccessibleInterval<BitType> image, final int maxIterations) {
		final int width = width(image);
		final int height = height(image);
		final boolean[] pixels = ImgUtils.toBooleans(image);
		final boolean[] hits = new boolean[pixels.length];
		int iteration = 0;
		boolean changed = true;
		while (changed && (maxIterations <= 0 || iteration < maxIterations)) {
			changed = false;
			for (final int[][] element : THINNING_ELEMENTS) {
				hitOrMiss(pixels, width, height, element, hits);
				for (int i = 0; i < pixels.length; i++) {
					if (hits[i]) {
						pixels[i] = false;
						changed = true;
					}
				}
			}
			iteration++;
		}
		return ImgUtils.toBitImg(pixels, width, height);
	}

	@Override
	public Img<BitType> perimeter(final RandomAccessibleInterval<BitType> image, final Connectivity connectivity) {
		final int width = width(image);
		final int height = height(image);
		final boolean[] pixels = ImgUtils.toBooleans(image);
		final boolean[] result = new boolean[pixels.length];
		final int[][] offsets = connectivity.offsets();
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				if (!pixels[y * width + x]) continue;
				for (final int[] o : offsets) {
					if (!get(pixels, width, height, x + o[0], y + o[1])) {
						result[y * width + x] = true;
						break;
					}
				}
			}
		}
		return ImgUtils.toBitImg(result, width, height);
	}

	@Override
	public Img<BitType> erode(final RandomAccessibleInterval<BitType> image, final StructuringElement element) {
		final int width = width(image);
		final int height = height(image);
		final boolean[] pixels = ImgUtils.toBooleans(image);
		final boolean[] result = new boolean[pixels.length];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				result[y * width + x] = fits(pixels, width, height, x, y, element);
			}
		}
		return ImgUtils.toBitImg(result, width, height);
	}

	private static boolean fits(final boolean[] pixels, final int width, final int height, final int x,
			final int y, final StructuringElement element) {
		for (int r = 0; r < element.rows(); r++) {
			for (int c = 0; c < element.cols(); c++) {
				if (element.isSet(r, c)
						&& !get(pixels, width, height, x + c - element.centerCol(), y + r - element.centerRow()))
					return false;
			}
		}
		return true;
	}

	private static void hitOrMiss(final boolean[] pixels, final int width, final int height,
			final int[][] element, final boolean[] hits) {
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				hits[y * width + x] = matches(pixels, width, height, x, y, element);
			}
		}
	}

	private static boolean matches(final boolean[] pixels, final int width, final int height, final int x,
			final int y, final int[][] element) {
		for (int dy = -1; dy <= 1; dy++) {
			for (int dx = -1; dx <= 1; dx++) {
				final int expected = element[dy + 1][dx + 1];
				if (expected == DONT_CARE) continue;
				if (get(pixels, width, height, x + dx, y + dy) != (expected == 1)) return false;
			}
		}
		return true;
	}

	private static boolean get(final boolean[] pixels, final int width, final int height, final int x,
			final int y) {
		return x >= 0 && y >= 0 && x < width && y < height && pixels[y * width + x];
	}

	private static int width(final RandomAccessibleInterval<BitType> image) {
		return (int) ImgUtils.requirePlanar(image)[0];
	}

	private static int height(final RandomAccessibleInterval<BitType> image) {
		return (int) ImgUtils.requirePlanar(image)[1];
	}

}
