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

/**
 * Pixel neighbourhoods of planar binary images.
 */
public enum Connectivity {

	/** Edge-sharing neighbours: left, right, up, down */
	FOUR(new int[][] { { -1, 0 }, { 1, 0 }, { 0, -1 }, { 0, 1 } }),

	/** Edge- and corner-sharing neighbours */
	EIGHT(new int[][] { { -1, -1 }, { 0, -1 }, { 1, -1 }, { -1, 0 }, { 1, 0 }, { -1, 1 }, { 0, 1 }, { 1, 1 } });

	private final int[][] offsets;

	Connectivity(final int[][] offsets) {
		this.offsets = offsets;
	}

	/**
	 * @return the {@code {dx, dy}} offsets of the neighbours
	 */
	public int[][] offsets() {
		final int[][] copy = new int[offsets.length][];
		for (int i = 0; i < offsets.length; i++) {
			copy[i] = offsets[i].clone();
		}
		return copy;
	}

}
