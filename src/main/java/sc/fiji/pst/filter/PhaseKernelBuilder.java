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

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.loops.LoopBuilder;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import sc.fiji.pst.util.Logger;

/**
 * Synthesizes the PST phase kernel: a warped, radially symmetric phase profile
 * that grows monotonically with frequency, so that high-frequency content
 * (edges, corners) receives more phase than smooth regions.
 * <p>
 * With {@code u = rho * warpStrength}, the raw kernel is
 * {@code u * atan(u) - ln(1 + u^2) / 2}; it is then normalized so that its
 * largest magnitude equals {@code phaseStrength}.
 * </p>
 */
public class PhaseKernelBuilder {

	private final double warpStrength;
	private final double phaseStrength;
	private final Logger logger = new Logger(PhaseKernelBuilder.class);

	/**
	 * @param warpStrength  the kernel warp strength
	 * @param phaseStrength the largest phase (radians) applied by the kernel
	 */
	public PhaseKernelBuilder(final double warpStrength, final double phaseStrength) {
		this.warpStrength = warpStrength;
		this.phaseStrength = phaseStrength;
	}

	/**
	 * @return the raw (unnormalized) kernel value at radius {@code rho}
	 */
	public static double rawKernel(final double rho, final double warpStrength) {
		final double u = rho * warpStrength;
		return u * Math.atan(u) - 0.5 * Math.log1p(u * u);
	}

	/**
	 * Builds the normalized kernel. If the raw kernel vanishes everywhere
	 * (zero warp strength or a grid collapsed to its origin), an all-zero
	 * kernel is returned.
	 *
	 * @param rho the radius grid
	 * @return the kernel, in radians, with the dimensions of {@code rho}
	 */
	public Img<DoubleType> buildKernel(final RandomAccessibleInterval<DoubleType> rho) {
		final Img<DoubleType> kernel = ArrayImgs.doubles(Intervals.dimensionsAsLongArray(rho));
		LoopBuilder.setImages(Views.zeroMin(rho), kernel).forEachPixel(
				(r, k) -> k.set(rawKernel(r.getRealDouble(), warpStrength)));

		final double maxAbs = maxAbs(kernel);
		if (maxAbs == 0 || !Double.isFinite(maxAbs)) {
			logger.debug("Degenerate PST kernel (max |k| = " + maxAbs + "): using zero kernel");
			for (final DoubleType k : kernel) {
				k.setZero();
			}
			return kernel;
		}
		for (final DoubleType k : kernel) {
			k.set(k.get() / maxAbs * phaseStrength);
		}
		logger.debug(String.format("PST kernel built: warp=%.4f, phase=%.4f, raw max=%.6g",
				warpStrength, phaseStrength, maxAbs));
		return kernel;
	}

	/**
	 * @return the largest magnitude of {@code kernel}
	 */
	public static double maxAbs(final RandomAccessibleInterval<DoubleType> kernel) {
		double maxAbs = 0;
		for (final DoubleType k : Views.iterable(kernel)) {
			maxAbs = Math.max(maxAbs, Math.abs(k.get()));
		}
		return maxAbs;
	}

}
