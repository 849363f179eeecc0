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

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.view.Views;
import org.jtransforms.fft.DoubleFFT_1D;
import org.jtransforms.fft.DoubleFFT_2D;
import sc.fiji.pst.util.ImgUtils;

/**
 * {@link FourierTransformer} backed by JTransforms' mixed-radix
 * {@link DoubleFFT_2D}, which handles sizes that are not powers of two
 * without padding. Single-row and single-column images are transformed with
 * {@link DoubleFFT_1D}.
 * <p>
 * Data is exchanged with JTransforms as a flat interleaved array
 * ({@code re, im} pairs in row-major order), which is also the storage layout
 * of an imglib2 {@link ComplexDoubleType} array image: results are wrapped
 * without copying.
 * </p>
 */
public class JTransformsFourierTransformer implements FourierTransformer {

	@Override
	public <T extends RealType<T>> Img<ComplexDoubleType> forward(final RandomAccessibleInterval<T> image) {
		final long[] dims = ImgUtils.requirePlanar(image);
		final double[] data = new double[2 * (int) (dims[0] * dims[1])];
		final Cursor<T> cursor = Views.flatIterable(image).cursor();
		int k = 0;
		while (cursor.hasNext()) {
			data[k] = cursor.next().getRealDouble();
			k += 2;
		}
		transform(data, dims[0], dims[1], false);
		return ArrayImgs.complexDoubles(data, dims);
	}

	@Override
	public Img<ComplexDoubleType> inverse(final RandomAccessibleInterval<ComplexDoubleType> spectrum) {
		final long[] dims = ImgUtils.requirePlanar(spectrum);
		final double[] data = new double[2 * (int) (dims[0] * dims[1])];
		final Cursor<ComplexDoubleType> cursor = Views.flatIterable(spectrum).cursor();
		int k = 0;
		while (cursor.hasNext()) {
			final ComplexDoubleType c = cursor.next();
			data[k++] = c.getRealDouble();
			data[k++] = c.getImaginaryDouble();
		}
		transform(data, dims[0], dims[1], true);
		return ArrayImgs.complexDoubles(data, dims);
	}

	private static void transform(final double[] data, final long width, final long height,
			final boolean inverse) {
		if (width > 1 && height > 1) {
			final DoubleFFT_2D fft = new DoubleFFT_2D(height, width);
			if (inverse)
				fft.complexInverse(data, true);
			else
				fft.complexForward(data);
		} else if (width * height > 1) {
			// DoubleFFT_2D rejects singleton dimensions. A single row or column
			// is contiguous, and its 2D transform is the 1D transform
			final DoubleFFT_1D fft = new DoubleFFT_1D(width * height);
			if (inverse)
				fft.complexInverse(data, true);
			else
				fft.complexForward(data);
		}
		// 1x1: the transform is the identity
	}

}
