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

package sc.fiji.pst.fft;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.view.Views;

/**
 * Discrete 2D Fourier transform of planar images of arbitrary size.
 * <p>
 * Implementations use the common DFT conventions: the forward transform is
 * unscaled, the inverse transform is scaled by {@code 1/(width *
 * height)}, and the zero frequency sits at index {@code (0, 0)} of the
 * spectrum. No padding is applied: the spectrum has the dimensions of the
 * input.
 * </p>
 */
public interface FourierTransformer {

	/**
	 * Computes the forward 2D DFT of a real image.
	 *
	 * @param image a 2D image
	 * @return a new zero-min complex image with the dimensions of {@code image}
	 */
	<T extends RealType<T>> Img<ComplexDoubleType> forward(RandomAccessibleInterval<T> image);

	/**
	 * Computes the inverse 2D DFT of a spectrum.
	 *
	 * @param spectrum a 2D complex image
	 * @return a new zero-min complex image with the dimensions of
	 *         {@code spectrum}
	 */
	Img<ComplexDoubleType> inverse(RandomAccessibleInterval<ComplexDoubleType> spectrum);

	/**
	 * Returns a view of {@code img} circularly shifted by {@code floor(n/2)}
	 * along every dimension of size {@code n} (the usual {@code fftshift}).
	 * Shifted position {@code p} shows source position {@code (p - floor(n/2))
	 * mod n}.
	 */
	default <T> RandomAccessibleInterval<T> shift(final RandomAccessibleInterval<T> img) {
		final long[] offset = new long[img.numDimensions()];
		for (int d = 0; d < offset.length; ++d) {
			offset[d] = img.dimension(d) / 2;
		}
		return Views.interval(Views.translate(Views.extendPeriodic(img), offset), img);
	}

}
