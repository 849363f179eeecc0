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

import net.imglib2.img.Img;
import net.imglib2.type.logic.BitType;
import org.junit.Test;
import sc.fiji.pst.util.ImgUtils;

import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * Tests for {@link DefaultBinaryMorphology}
 */
public class DefaultBinaryMorphologyTest {

	private final BinaryMorphology morphology = new DefaultBinaryMorphology();

	private static boolean[] block(final int w, final int h, final int x0, final int y0, final int x1,
			final int y1) {
		final boolean[] pixels = new boolean[w * h];
		for (int y = y0; y <= y1; y++) {
			for (int x = x0; x <= x1; x++) {
				pixels[y * w + x] = true;
			}
		}
		return pixels;
	}

	private static boolean[] parse(final String... rows) {
		final int w = rows[0].length();
		final boolean[] pixels = new boolean[w * rows.length];
		for (int y = 0; y < rows.length; y++) {
			for (int x = 0; x < w; x++) {
				pixels[y * w + x] = rows[y].charAt(x) == '#';
			}
		}
		return pixels;
	}

	private boolean[] thinOnce(final String... rows) {
		return ImgUtils.toBooleans(morphology.thin(ImgUtils.toBitImg(parse(rows), rows[0].length(), rows.length), 1));
	}

	private static int count(final boolean[] pixels) {
		int n = 0;
		for (final boolean b : pixels) if (b) n++;
		return n;
	}

	private static void assertSubset(final boolean[] subset, final boolean[] set) {
		for (int i = 0; i < set.length; i++) {
			if (subset[i]) assertTrue("Pixel " + i + " was added", set[i]);
		}
	}

	@Test
	public void testErodeWithSinglePixelIsIdentity() {
		final boolean[] pixels = block(9, 7, 1, 2, 6, 5);
		pixels[0] = true;
		pixels[62] = true;
		final Img<BitType> eroded = morphology.erode(ImgUtils.toBitImg(pixels, 9, 7), StructuringElement.ones(1, 1));
		assertArrayEquals(pixels, ImgUtils.toBooleans(eroded));
	}

	@Test
	public void testErodeWithSquare() {
		final boolean[] pixels = block(9, 9, 2, 2, 6, 6);
		final Img<BitType> eroded = morphology.erode(ImgUtils.toBitImg(pixels, 9, 9), StructuringElement.ones(3, 3));
		assertArrayEquals(block(9, 9, 3, 3, 5, 5), ImgUtils.toBooleans(eroded));
	}

	@Test
	public void testErodeTreatsOutsideAsBackground() {
		final boolean[] full = new boolean[6 * 5];
		Arrays.fill(full, true);
		final Img<BitType> eroded = morphology.erode(ImgUtils.toBitImg(full, 6, 5), StructuringElement.ones(3, 3));
		assertArrayEquals(block(6, 5, 1, 1, 4, 3), ImgUtils.toBooleans(eroded));
	}

	@Test
	public void testPerimeterOfRectangle() {
		final boolean[] pixels = block(9, 9, 2, 2, 6, 6);
		final boolean[] perimeter = ImgUtils.toBooleans(morphology.perimeter(ImgUtils.toBitImg(pixels, 9, 9),
				Connectivity.FOUR));
		assertEquals(16, count(perimeter));
		assertSubset(perimeter, pixels);
		for (int y = 3; y <= 5; y++) {
			for (int x = 3; x <= 5; x++) {
				assertFalse(perimeter[y * 9 + x]);
			}
		}
	}

	@Test
	public void testPerimeterTouchingImageBorder() {
		final boolean[] full = new boolean[7 * 4];
		Arrays.fill(full, true);
		final boolean[] perimeter = ImgUtils.toBooleans(morphology.perimeter(ImgUtils.toBitImg(full, 7, 4),
				Connectivity.FOUR));
		assertEquals(2 * 7 + 2 * 2, count(perimeter));
		assertFalse(perimeter[7 + 1]);
	}

	@Test
	public void testPerimeterConnectivity() {
		// a diagonal staircase: every pixel touches background through an edge
		final boolean[] pixels = block(5, 5, 0, 0, 4, 4);
		pixels[0] = false;
		final Img<BitType> img = ImgUtils.toBitImg(pixels, 5, 5);
		final boolean[] four = ImgUtils.toBooleans(morphology.perimeter(img, Connectivity.FOUR));
		final boolean[] eight = ImgUtils.toBooleans(morphology.perimeter(img, Connectivity.EIGHT));
		// pixel (1, 1) sees the removed corner only diagonally
		assertFalse(four[5 + 1]);
		assertTrue(eight[5 + 1]);
		assertSubset(four, eight);
	}

	@Test
	public void testThinningPreservesLines() {
		final boolean[] line = block(11, 5, 2, 2, 8, 2);
		assertArrayEquals(line, ImgUtils.toBooleans(morphology.thin(ImgUtils.toBitImg(line, 11, 5), 0)));
		final boolean[] dot = block(5, 5, 2, 2, 2, 2);
		assertArrayEquals(dot, ImgUtils.toBooleans(morphology.thin(ImgUtils.toBitImg(dot, 5, 5), 1)));
	}

	@Test
	public void testSingleThinningIteration() {
		final boolean[] pixels = block(11, 11, 2, 2, 8, 8);
		final boolean[] thinned = ImgUtils.toBooleans(morphology.thin(ImgUtils.toBitImg(pixels, 11, 11), 1));
		assertSubset(thinned, pixels);
		assertTrue(count(thinned) < count(pixels));
		assertTrue(thinned[5 * 11 + 5]);
		// the block interior is untouched by a single sweep
		for (int y = 4; y <= 6; y++) {
			for (int x = 4; x <= 6; x++) {
				assertTrue(thinned[y * 11 + x]);
			}
		}
	}

	@Test
	public void testSingleSweepOnBlock() {
		// each element removes its matches before the next one is evaluated
		final boolean[] thinned = thinOnce( //
				"...........", //
				"...........", //
				"..#######..", //
				"..#######..", //
				"..#######..", //
				"..#######..", //
				"..#######..", //
				"..#######..", //
				"..#######..", //
				"...........", //
				"...........");
		assertArrayEquals(parse( //
				"...........", //
				"...........", //
				"..#.....#..", //
				"..######...", //
				"...#####...", //
				"...#####...", //
				"...#####...", //
				"...#####...", //
				"..#.....#..", //
				"...........", //
				"..........."), thinned);
	}

	@Test
	public void testSingleSweepFollowsElementOrder() {
		// the result of this L-shape changes if the elements are reordered or
		// applied simultaneously
		final boolean[] thinned = thinOnce( //
				".....", //
				".#...", //
				".#...", //
				".###.", //
				".###.", //
				".....");
		assertArrayEquals(parse( //
				".....", //
				".#...", //
				".#...", //
				".##..", //
				"..##.", //
				"....."), thinned);
	}

	@Test
	public void testThinningToConvergence() {
		final boolean[] pixels = block(11, 11, 2, 2, 8, 8);
		final Img<BitType> skeleton = morphology.thin(ImgUtils.toBitImg(pixels, 11, 11), 0);
		final boolean[] thinned = ImgUtils.toBooleans(skeleton);
		assertSubset(thinned, pixels);
		assertTrue(thinned[5 * 11 + 5]);
		assertTrue(count(thinned) < count(block(11, 11, 3, 3, 7, 7)));
		assertArrayEquals(thinned, ImgUtils.toBooleans(morphology.thin(skeleton, 1)));
		assertArrayEquals(parse( //
				"...........", //
				"...........", //
				"..#.....#..", //
				"..#....#...", //
				"...#..#....", //
				"....###....", //
				"....#.#....", //
				"...#...#...", //
				"..#.....#..", //
				"...........", //
				"..........."), thinned);
	}

	@Test
	public void testEmptyImage() {
		final boolean[] empty = new boolean[12];
		final Img<BitType> img = ImgUtils.toBitImg(empty, 4, 3);
		assertArrayEquals(empty, ImgUtils.toBooleans(morphology.thin(img, 1)));
		assertArrayEquals(empty, ImgUtils.toBooleans(morphology.perimeter(img, Connectivity.FOUR)));
		assertArrayEquals(empty, ImgUtils.toBooleans(morphology.erode(img, StructuringElement.ones(1, 1))));
	}

}
