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

import net.imglib2.Cursor;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.DoubleType;
import sc.fiji.pst.ImageShapeException;

/**
 * Builds the normalized polar coordinate grid used by the localization filter
 * and the PST kernel.
 * <p>
 * Both axes span [-0.5, 0.5]. The first Cartesian coordinate ({@code x})
 * follows image <em>rows</em> and the second ({@code y}) image
 * <em>columns</em>, i.e., the mesh is transposed with respect to the usual
 * (column, row) order of a meshgrid. This orientation is an invariant: the
 * kernel is radially symmetric but {@code theta} is not, and swapping the
 * axes mirrors every angle-dependent result.
 * </p>
 */
public class CoordinateGridBuilder {

	/** Half-width of the normalized coordinate range */
	public static final double HALF_RANGE = 0.5;

	/**
	 * @param height number of image rows
	 * @param width  number of image columns
	 * @return the polar grid, as {@code width x height} images
	 * @throws ImageShapeException if either dimension is not positive
	 */
	public FrequencyGrid buildGrid(final long height, final long width) {
		if (height < 1 || width < 1 || height > Integer.MAX_VALUE || width > Integer.MAX_VALUE)
			throw new ImageShapeException("Invalid grid size", width, height);
		final double[] rowCoords = linspace((int) height);
		final double[] colCoords = linspace((int) width);
		final Img<DoubleType> theta = ArrayImgs.doubles(width, height);
		final Img<DoubleType> rho = ArrayImgs.doubles(width, height);
		final Cursor<DoubleType> tc = theta.localizingCursor();
		final Cursor<DoubleType> rc = rho.cursor();
		while (tc.hasNext()) {
			tc.fwd();
			rc.fwd();
			final double x = rowCoords[tc.getIntPosition(1)];
			final double y = colCoords[tc.getIntPosition(0)];
			tc.get().set(Math.atan2(y, x));
			rc.get().set(Math.hypot(x, y));
		}
		return new FrequencyGrid(theta, rho);
	}

	/**
	 * Returns {@code n} evenly spaced samples over [-0.5, 0.5], endpoints
	 * included. Samples are exactly antisymmetric ({@code v[i] == -v[n-1-i]}).
	 * A single sample is placed at the center of the range.
	 */
	public static double[] linspace(final int n) {
		final double[] values = new double[n];
		if (n == 1) return values;
		final double center = (n - 1) / 2.0;
		for (int i = 0; i < n; i++) {
			values[i] = 2 * HALF_RANGE * (i - center) / (n - 1);
		}
		return values;
	}

}
