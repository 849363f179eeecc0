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
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import sc.fiji.pst.fft.FourierTransformer;
import sc.fiji.pst.util.ImgUtils;

/**
 * Applies a PST phase kernel to the spectrum of an image and returns the phase
 * of the resulting spatial signal.
 * <p>
 * The spectrum is multiplied by the unit-modulus factor
 * {@code exp(-i * kernel)} (frequency shifted to match the spectrum), so only
 * the phase of each frequency component changes. The output is the per-pixel
 * angle {@code atan2(imag, real)} of the inverse transform, in [-&pi;,
 * &pi;].
 * </p>
 */
public class PhaseKernelApplier {

	private final FourierTransformer fft;

	public PhaseKernelApplier(final FourierTransformer fft) {
		this.fft = fft;
	}

	/**
	 * @param image  the (localization-filtered) image
	 * @param kernel the phase kernel, with the dimensions of {@code image}
	 * @return the phase map
	 */
	public <T extends RealType<T>> Img<DoubleType> apply(final RandomAccessibleInterval<T> image,
			final RandomAccessibleInterval<DoubleType> kernel) {
		ImgUtils.requirePlanar(image);
		ImgUtils.requireSameDimensions(image, kernel, "PST kernel");
		final Img<ComplexDoubleType> spectrum = fft.forward(image);
		LoopBuilder.setImages(spectrum, fft.shift(Views.zeroMin(kernel))).forEachPixel((s, k) -> {
			final double phi = k.getRealDouble();
			final double cos = Math.cos(phi);
			final double sin = -Math.sin(phi);
			final double re = s.getRealDouble();
			final double im = s.getImaginaryDouble();
			s.set(re * cos - im * sin, re * sin + im * cos);
		});
		final Img<ComplexDoubleType> transformed = fft.inverse(spectrum);
		final Img<DoubleType> phase = ArrayImgs.doubles(Intervals.dimensionsAsLongArray(transformed));
		LoopBuilder.setImages(transformed, phase).forEachPixel(
				(c, p) -> p.set(Math.atan2(c.getImaginaryDouble(), c.getRealDouble())));
		return phase;
	}

}
