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

import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.DoubleType;
import org.junit.After;
import org.junit.Test;
import sc.fiji.pst.PSTUtils;
import sc.fiji.pst.filter.CoordinateGridBuilder;
import sc.fiji.pst.filter.FrequencyGrid;
import sc.fiji.pst.filter.PhaseKernelBuilder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * Tests for {@link Logger}
 */
public class LoggerTest {

	@After
	public void tearDown() {
		PSTUtils.setDebugMode(false);
	}

	@Test
	public void testDebugFollowsDebugMode() {
		PSTUtils.setDebugMode(true);
		assertTrue(new Logger(PhaseKernelBuilder.class).isDebug());
		final Logger logger = new Logger(PSTUtils.getContext(), "LoggerTest");
		logger.setDebug(false);
		assertFalse(logger.isDebug());
	}

	@Test
	public void testStagesLogInDebugMode() {
		PSTUtils.setDebugMode(true);
		final FrequencyGrid grid = new CoordinateGridBuilder().buildGrid(6, 6);
		final Img<DoubleType> degenerate = new PhaseKernelBuilder(0, 0.48).buildKernel(grid.rho());
		assertEquals(0, PhaseKernelBuilder.maxAbs(degenerate), 0);
		final Img<DoubleType> kernel = new PhaseKernelBuilder(12.14, 0.48).buildKernel(grid.rho());
		assertEquals(0.48, PhaseKernelBuilder.maxAbs(kernel), 1e-12);
	}

}
