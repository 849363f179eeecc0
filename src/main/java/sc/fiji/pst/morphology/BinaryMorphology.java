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

/**
 * Binary morphological operations on planar images, as used by the PST edge
 * feature extraction. Implementations never modify their input and return
 * zero-min images with the dimensions of the input.
 */
public interface BinaryMorphology {

	/**
	 * Thins foreground regions towards unit-width lines.
	 *
	 * @param image         binary input
	 * @param maxIterations the maximum number of thinning sweeps, or a
	 *                      non-positive value to iterate until the image no
	 *                      longer changes
	 * @return the thinned image
	 */
	Img<BitType> thin(RandomAccessibleInterval<BitType> image, int maxIterations);

	/**
	 * Extracts the boundary of foreground regions: the foreground pixels that
	 * have at least one background neighbour.
	 *
	 * @param image        binary input
	 * @param connectivity the neighbourhood used to find background neighbours
	 * @return the perimeter image
	 */
	Img<BitType> perimeter(RandomAccessibleInterval<BitType> image, Connectivity connectivity);

	/**
	 * Binary erosion: a pixel is kept if every set element of
	 * {@code element}, placed at that pixel, covers foreground.
	 *
	 * @param image   binary input
	 * @param element the structuring element
	 * @return the eroded image
	 */
	Img<BitType> erode(RandomAccessibleInterval<BitType> image, StructuringElement element);

}
