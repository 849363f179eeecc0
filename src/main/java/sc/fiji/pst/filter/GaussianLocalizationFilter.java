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
import sc.fiji.pst.ParameterValidationException;
import sc.fiji.pst.fft.FourierTransformer;
import sc.fiji.pst.util.ImgUtils;

/**
 * Isotropic Gaussian low-pass filter applied in the frequency domain. Smooths
 * the image before the PST kernel, which amplifies high-frequency noise.
 * <p>
 * The window is {@code exp(-(rho / sigma)^2)} with
 * {@code sigma = sqrt(LPF^2 / ln 2)}, so that {@code LPF} sets the full width
 * at half maximum of the filter on the normalized frequency grid.
 * </p>
 */
public class GaussianLocalizationFilter {

	private final double lpf;
	private final FourierTransformer fft;

	/**
	 * @param lpf FWHM of the localization filter. Must be positive
	 * @param fft the Fourier transform implementation
	 * @throws ParameterValidationException if {@code lpf} is not a positive
	 *                                      finite number
	 */
	public GaussianLocalizationFilter(final double lpf, final FourierTransformer fft) {
		if (!(lpf > 0) || !Double.isFinite(lpf))
			throw new ParameterValidationException("LPF", lpf, "must be a positive finite number");
		this.lpf = lpf;
		this.fft = fft;
	}

	/**
	 * @return the Gaussian window over {@code rho}, centered at the zero
	 *         frequency (not shifted)
	 */
	public Img<DoubleType> window(final RandomAccessibleInterval<DoubleType> rho) {
		final double sigma = Math.sqrt(lpf * lpf / Math.log(2));
		final Img<DoubleType> window = ArrayImgs.doubles(Intervals.dimensionsAsLongArray(rho));
		LoopBuilder.setImages(Views.zeroMin(rho), window).forEachPixel((r, w) -> {
			final double s = r.getRealDouble() / sigma;
			w.setReal(Math.exp(-s * s));
		});
		return window;
	}

	/**
	 * Filters the image.
	 *
	 * @param image the input image
	 * @param rho   the radius grid matching the image dimensions
	 * @return the real part of the filtered image
	 */
	public <T extends RealType<T>> Img<DoubleType> apply(final RandomAccessibleInterval<T> image,
			final RandomAccessibleInterval<DoubleType> rho) {
		ImgUtils.requirePlanar(image);
		ImgUtils.requireSameDimensions(image, rho, "Frequency grid");
		final Img<ComplexDoubleType> spectrum = fft.forward(image);
		LoopBuilder.setImages(spectrum, fft.shift(window(rho))).forEachPixel((s, w) -> s.mul(w.getRealDouble()));
		final Img<ComplexDoubleType> filtered = fft.inverse(spectrum);
		final Img<DoubleType> result = ArrayImgs.doubles(Intervals.dimensionsAsLongArray(filtered));
		LoopBuilder.setImages(filtered, result).forEachPixel((c, r) -> r.set(c.getRealDouble()));
		return result;
	}

}
