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

/**
 * Immutable set of Phase Stretch Transform parameters. All values are
 * validated on construction: an invalid set can never reach the pipeline.
 *
 * @param lpf           FWHM of the isotropic Gaussian localization filter, in (0, 1]
 * @param phaseStrength PST kernel phase strength, in [0, 1]
 * @param warpStrength  PST kernel warp strength, documented range [0, 1] but any
 *                      finite non-negative value is accepted
 * @param thresholdMin  lower (negative) phase threshold, in [-1, 0]
 * @param thresholdMax  upper (positive) phase threshold, in [0, 1]
 * @param morph         whether to compute the binary edge map (thresholding +
 *                      morphological cleanup) rather than the continuous phase
 */
public record PSTParameters(double lpf, double phaseStrength, double warpStrength, double thresholdMin,
		double thresholdMax, boolean morph) {

	/** Published PST values: LPF=0.21, phase=0.48, warp=12.14, thresholds [-1, 0.0019], binary output */
	public static final PSTParameters DEFAULTS = new PSTParameters(0.21, 0.48, 12.14, -1, 0.0019, true);

	public PSTParameters {
		requireFinite("LPF", lpf);
		requireFinite("PhaseStrength", phaseStrength);
		requireFinite("WarpStrength", warpStrength);
		requireFinite("ThresholdMin", thresholdMin);
		requireFinite("ThresholdMax", thresholdMax);
		if (lpf <= 0 || lpf > 1)
			throw new ParameterValidationException("LPF", lpf, "must be in (0, 1]");
		if (phaseStrength < 0 || phaseStrength > 1)
			throw new ParameterValidationException("PhaseStrength", phaseStrength, "must be in [0, 1]");
		if (warpStrength < 0)
			throw new ParameterValidationException("WarpStrength", warpStrength, "must not be negative");
		if (thresholdMin < -1 || thresholdMin > 0)
			throw new ParameterValidationException("ThresholdMin", thresholdMin, "must be in [-1, 0]");
		if (thresholdMax < 0 || thresholdMax > 1)
			throw new ParameterValidationException("ThresholdMax", thresholdMax, "must be in [0, 1]");
	}

	/**
	 * Creates a parameter set using the integer morphology flag of the original
	 * PST formulation.
	 *
	 * @param morphFlag 1 to compute the binary edge map, 0 for the continuous
	 *                  phase map
	 * @throws ParameterValidationException if any value is out of range, or if
	 *                                      {@code morphFlag} is neither 0 nor 1
	 */
	public static PSTParameters of(final double lpf, final double phaseStrength, final double warpStrength,
			final double thresholdMin, final double thresholdMax, final int morphFlag) {
		if (morphFlag != 0 && morphFlag != 1)
			throw new ParameterValidationException("MorphFlag", morphFlag, "must be 0 or 1");
		return new PSTParameters(lpf, phaseStrength, warpStrength, thresholdMin, thresholdMax, morphFlag == 1);
	}

	/**
	 * @return 1 if the binary edge map is computed, 0 otherwise
	 */
	public int morphFlag() {
		return morph ? 1 : 0;
	}

	public PSTParameters withLpf(final double lpf) {
		return new PSTParameters(lpf, phaseStrength, warpStrength, thresholdMin, thresholdMax, morph);
	}

	public PSTParameters withPhaseStrength(final double phaseStrength) {
		return new PSTParameters(lpf, phaseStrength, warpStrength, thresholdMin, thresholdMax, morph);
	}

	public PSTParameters withWarpStrength(final double warpStrength) {
		return new PSTParameters(lpf, phaseStrength, warpStrength, thresholdMin, thresholdMax, morph);
	}

	public PSTParameters withThresholds(final double thresholdMin, final double thresholdMax) {
		return new PSTParameters(lpf, phaseStrength, warpStrength, thresholdMin, thresholdMax, morph);
	}

	public PSTParameters withMorph(final boolean morph) {
		return new PSTParameters(lpf, phaseStrength, warpStrength, thresholdMin, thresholdMax, morph);
	}

	private static void requireFinite(final String name, final double value) {
		if (!Double.isFinite(value))
			throw new ParameterValidationException(name, value, "must be a finite number");
	}

}
