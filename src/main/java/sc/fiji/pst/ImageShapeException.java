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

import java.util.Arrays;

/**
 * Thrown when an image cannot be processed because of its shape: it is not
 * planar, has an empty dimension, is ragged, or does not match the shape of
 * another image it is combined with.
 */
public class ImageShapeException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final long[] dimensions;

	public ImageShapeException(final String message, final long... dimensions) {
		super((dimensions == null || dimensions.length == 0) ? message
				: message + " (dimensions: " + Arrays.toString(dimensions) + ")");
		this.dimensions = (dimensions == null) ? new long[0] : dimensions.clone();
	}

	/**
	 * @return the dimensions of the offending image, possibly empty if unknown
	 */
	public long[] getDimensions() {
		return dimensions.clone();
	}

}
