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

import java.util.Arrays;

/**
 * Rectangular binary structuring element. The origin is the center pixel
 * ({@code floor(rows/2), floor(cols/2)}).
 */
public final class StructuringElement {

	private final boolean[][] mask;

	/**
	 * @param mask the element, indexed {@code [row][column]}. Must be
	 *             rectangular with at least one element set
	 */
	public StructuringElement(final boolean[][] mask) {
		if (mask == null || mask.length == 0 || mask[0].length == 0)
			throw new IllegalArgumentException("Structuring element cannot be empty");
		boolean any = false;
		this.mask = new boolean[mask.length][];
		for (int r = 0; r < mask.length; r++) {
			if (mask[r].length != mask[0].length)
				throw new IllegalArgumentException("Structuring element must be rectangular");
			this.mask[r] = mask[r].clone();
			for (final boolean b : mask[r]) any |= b;
		}
		if (!any)
			throw new IllegalArgumentException("Structuring element has no foreground element");
	}

	/**
	 * @return a {@code rows x cols} element with every element set
	 */
	public static StructuringElement ones(final int rows, final int cols) {
		if (rows < 1 || cols < 1)
			throw new IllegalArgumentException("Invalid structuring element size: " + rows + "x" + cols);
		final boolean[][] mask = new boolean[rows][cols];
		for (final boolean[] row : mask) Arrays.fill(row, true);
		return new StructuringElement(mask);
	}

	public int rows() {
		return mask.length;
	}

	public int cols() {
		return mask[0].length;
	}

	public int centerRow() {
		return rows() / 2;
	}

	public int centerCol() {
		return cols() / 2;
	}

	public boolean isSet(final int row, final int col) {
		return mask[row][col];
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof StructuringElement)) return false;
		return Arrays.deepEquals(mask, ((StructuringElement) o).mask);
	}

	@Override
	public int hashCode() {
		return Arrays.deepHashCode(mask);
	}

	@Override
	public String toString() {
		return "StructuringElement" + Arrays.deepToString(mask);
	}

}
