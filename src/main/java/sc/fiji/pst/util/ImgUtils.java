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

package sc.fiji.pst.util;

import net.imglib2.Cursor;
import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import sc.fiji.pst.ImageShapeException;

import java.util.Arrays;

/**
 * Static utilities for handling planar {@link RandomAccessibleInterval}s.
 * <p>
 * Throughout PST, dimension 0 of an image runs along columns (x) and
 * dimension 1 along rows (y). Plain Java arrays are indexed
 * {@code [row][column]}.
 * </p>
 */
public class ImgUtils {

    private ImgUtils() { }

    /**
     * Checks that the image is a non-empty 2D interval whose complex spectrum
     * fits into a single Java array.
     *
     * @param img the image to check
     * @return the image dimensions as {@code {width, height}}
     * @throws ImageShapeException if the image is not a valid 2D image
     */
    public static long[] requirePlanar(final Interval img) {
        if (img == null)
            throw new ImageShapeException("Image is null");
        final long[] dims = Intervals.dimensionsAsLongArray(img);
        if (img.numDimensions() != 2)
            throw new ImageShapeException("Only 2D images are supported", dims);
        if (dims[0] < 1 || dims[1] < 1)
            throw new ImageShapeException("Image has an empty dimension", dims);
        if (dims[0] * dims[1] > Integer.MAX_VALUE / 2)
            throw new ImageShapeException("Image too large", dims);
        return dims;
    }

    /**
     * @throws ImageShapeException if both intervals do not have the same
     *                             dimensions
     */
    public static void requireSameDimensions(final Interval expected, final Interval actual, final String what) {
        if (!Intervals.equalDimensions(expected, actual)) {
            throw new ImageShapeException(what + " does not match image dimensions "
                    + Arrays.toString(Intervals.dimensionsAsLongArray(expected)),
                    Intervals.dimensionsAsLongArray(actual));
        }
    }

    /**
     * Wraps a {@code [row][column]} array into a {@code width x height} image.
     *
     * @throws ImageShapeException if the array is empty or ragged
     */
    public static Img<DoubleType> toImg(final double[][] data) {
        if (data == null || data.length == 0 || data[0] == null || data[0].length == 0)
            throw new ImageShapeException("Image array is empty");
        final int height = data.length;
        final int width = data[0].length;
        requirePlanar(new FinalInterval(width, height));
        final double[] flat = new double[width * height];
        for (int row = 0; row < height; row++) {
            if (data[row] == null || data[row].length != width)
                throw new ImageShapeException("Image array is ragged at row " + row, width, height);
            System.arraycopy(data[row], 0, flat, row * width, width);
        }
        return ArrayImgs.doubles(flat, width, height);
    }

    /**
     * Copies a 2D image into a {@code [row][column]} array.
     */
    public static <T extends RealType<T>> double[][] toArray(final RandomAccessibleInterval<T> img) {
        final long[] dims = requirePlanar(img);
        final double[][] data = new double[(int) dims[1]][(int) dims[0]];
        final Cursor<T> cursor = Views.flatIterable(Views.zeroMin(img)).localizingCursor();
        while (cursor.hasNext()) {
            cursor.fwd();
            data[cursor.getIntPosition(1)][cursor.getIntPosition(0)] = cursor.get().getRealDouble();
        }
        return data;
    }

    /**
     * @return the largest value of the image, or {@code NaN} if it holds no
     *         comparable value (i.e., it is all {@code NaN})
     */
    public static <T extends RealType<T>> double max(final RandomAccessibleInterval<T> img) {
        double max = Double.NaN;
        for (final T t : Views.iterable(img)) {
            final double v = t.getRealDouble();
            if (Double.isNaN(max) || v > max) max = v;
        }
        return max;
    }

    /**
     * Flattens a binary image into a row-major array ({@code index = y * width + x}).
     */
    public static boolean[] toBooleans(final RandomAccessibleInterval<BitType> img) {
        final boolean[] pixels = new boolean[(int) Intervals.numElements(img)];
        final Cursor<BitType> cursor = Views.flatIterable(img).cursor();
        int i = 0;
        while (cursor.hasNext()) {
            pixels[i++] = cursor.next().get();
        }
        return pixels;
    }

    /**
     * Creates a binary image from a row-major array.
     */
    public static Img<BitType> toBitImg(final boolean[] pixels, final long width, final long height) {
        if (pixels.length != width * height)
            throw new ImageShapeException("Pixel array does not match image size", width, height);
        final Img<BitType> img = ArrayImgs.bits(width, height);
        final Cursor<BitType> cursor = img.cursor();
        int i = 0;
        while (cursor.hasNext()) {
            cursor.next().set(pixels[i++]);
        }
        return img;
    }

}
