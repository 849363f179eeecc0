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

import net.imglib2.FinalInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.DoubleType;
import org.junit.Test;
import sc.fiji.pst.ImageShapeException;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * Tests for {@link ImgUtils}
 */
public class ImgUtilsTest {

	@Test
	public void testArrayOrientation() {
		final double[][] data = { { 1, 2, 3 }, { 4, 5, 6 } };
		final Img<DoubleType> img = ImgUtils.toImg(data);
		assertEquals(3, img.dimension(0));
		assertEquals(2, img.dimension(1));
		final double[][] copy = ImgUtils.toArray(img);
		assertArrayEquals(data[0], copy[0], 0);
		assertArrayEquals(data[1], copy[1], 0);
	}

	@Test
	public void testRequirePlanar() {
		assertArrayEquals(new long[] { 7, 3 }, ImgUtils.requirePlanar(new FinalInterval(7, 3)));
		for (final FinalInterval invalid : new FinalInterval[] { new FinalInterval(4),
				new FinalInterval(2, 2, 2), new FinalInterval(0, 5) }) {
			try {
				ImgUtils.requirePlanar(invalid);
				throw new AssertionError("Accepted " + invalid);
			} catch (final ImageShapeException expected) {
				assertTrue(expected.getMessage().length() > 0);
			}
		}
	}

	@Test(expected = ImageShapeException.class)
	public void testNullImage() {
		ImgUtils.requirePlanar(null);
	}

	@Test
	public void testMax() {
		assertEquals(9, ImgUtils.max(ArrayImgs.doubles(new double[] { Double.NaN, 3, 9, -2 }, 2, 2)), 0);
		assertTrue(Double.isNaN(ImgUtils.max(ArrayImgs.doubles(new double[] { Double.NaN }, 1, 1))));
		assertEquals(-2, ImgUtils.max(ArrayImgs.doubles(new double[] { -5, -2 }, 2, 1)), 0);
	}

	@Test
	public void testBitImageRowMajor() {
		final boolean[] pixels = { true, false, false, false, false, true };
		final Img<BitType> img = ImgUtils.toBitImg(pixels, 3, 2);
		assertEquals(3, img.dimension(0));
		assertArrayEquals(pixels, ImgUtils.toBooleans(img));
	}

	@Test(expected = ImageShapeException.class)
	public void testBitImageSizeMismatch() {
		ImgUtils.toBitImg(new boolean[5], 3, 2);
	}

}
