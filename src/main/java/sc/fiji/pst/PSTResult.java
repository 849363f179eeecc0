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

package sc.fiji.pst;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Output of {@link PhaseStretchTransform}.
 *
 * @param phaseMap the continuous phase of the transformed image, in radians
 * @param edgeMap  the binary edge map, or {@code null} if morphological
 *                 post-processing was not requested
 * @param kernel   the normalized PST phase kernel, for diagnostics
 */
public record PSTResult(Img<DoubleType> phaseMap, Img<BitType> edgeMap, Img<DoubleType> kernel) {

	public PSTResult {
		if (phaseMap == null || kernel == null)
			throw new NullPointerException("phase map and kernel are required");
	}

	/**
	 * @return true if this result holds a binary edge map
	 */
	public boolean isBinary() {
		return edgeMap != null;
	}

	/**
	 * Returns the final output of the transform: the binary edge map if one was
	 * computed, the continuous phase map otherwise.
	 */
	public RandomAccessibleInterval<? extends RealType<?>> getOutput() {
		if (isBinary())
			return edgeMap;
		return phaseMap;
	}

}
