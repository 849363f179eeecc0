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
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.DoubleType;
import org.junit.Test;
import sc.fiji.pst.ImageShapeException;
import sc.fiji.pst.fft.JTransformsFourierTransformer;

import java.util.Random;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * Tests for {@link PhaseKernelApplier}
 */
public class PhaseKernelApplierTest {

	private final PhaseKernelApplier applier = new PhaseKernelApplier(new JTransformsFourierTransformer());

	private static Img<DoubleType> randomImage(final int w, final int h, final double min, final double max) {
		final Random random = new Random(42);
		final Img<DoubleType> img = ArrayImgs.doubles(w, h);
		for (final DoubleType t : img) {
			t.set(min + random.nextDouble() * (max - min));
		}
		return img;
	}

	@Test
	public void testZeroKernelKeepsPositiveImageAtZeroPhase() {
		final Img<DoubleType> img = randomImage(11, 6, 1, 255);
		final Img<DoubleType> phase = applier.apply(img, ArrayImgs.doubles(11, 6));
		for (final DoubleType p : phase) {
			assertEquals(0, p.get(), 1e-9);
		}
	}

	@Test
	public void testZeroKernelGivesPiForNegativePixels() {
		final Img<DoubleType> img = randomImage(5, 5, -10, -1);
		final Img<DoubleType> phase = applier.apply(img, ArrayImgs.doubles(5, 5));
		for (final DoubleType p : phase) {
			assertEquals(Math.PI, Math.abs(p.get()), 1e-9);
		}
	}

	@Test
	public void testUniformKernelShiftsPhaseUniformly() {
		final Img<DoubleType> img = randomImage(8, 7, 1, 10);
		final Img<DoubleType> kernel = ArrayImgs.doubles(8, 7);
		for (final DoubleType k : kernel) k.set(0.3);
		final Img<DoubleType> phase = applier.apply(img, kernel);
		for (final DoubleType p : phase) {
			assertEquals(-0.3, p.get(), 1e-9);
		}
	}

	@Test
	public void testPhaseRange() {
		final Img<DoubleType> img = randomImage(17, 13, 0, 255);
		final FrequencyGrid grid = new CoordinateGridBuilder().buildGrid(13, 17);
		final Img<DoubleType> kernel = new PhaseKernelBuilder(12.14, 1).buildKernel(grid.rho());
		final Img<DoubleType> phase = applier.apply(img, kernel);
		for (final DoubleType p : phase) {
			assertTrue(p.get() >= -Math.PI && p.get() <= Math.PI);
		}
	}

	@Test(expected = ImageShapeException.class)
	public void testKernelMismatch() {
		applier.apply(ArrayImgs.doubles(4, 4), ArrayImgs.doubles(4, 5));
	}

}
