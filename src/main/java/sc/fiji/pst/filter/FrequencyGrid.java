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

import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Polar coordinates of the normalized frequency plane, sampled on the pixel
 * grid of an image.
 *
 * @param theta angle of each sample, in radians
 * @param rho   radius of each sample, never negative
 * @see CoordinateGridBuilder
 */
public record FrequencyGrid(Img<DoubleType> theta, Img<DoubleType> rho) {

	/** @return the number of image columns */
	public long width() {
		return rho.dimension(0);
	}

	/** @return the number of image rows */
	public long height() {
		return rho.dimension(1);
	}

}
