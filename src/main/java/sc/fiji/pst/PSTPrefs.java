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

import org.scijava.Context;
import org.scijava.prefs.PrefService;

/**
 * Class handling PST preferences: the last-used transform parameters.
 */
public class PSTPrefs {

	private static final String LPF = "pst.lpf";
	private static final String PHASE_STRENGTH = "pst.phase";
	private static final String WARP_STRENGTH = "pst.warp";
	private static final String THRESHOLD_MIN = "pst.tmin";
	private static final String THRESHOLD_MAX = "pst.tmax";
	private static final String MORPH = "pst.morph";

	private final PrefService prefService;

	public PSTPrefs(final Context context) {
		prefService = context.getService(PrefService.class);
		if (prefService == null)
			throw new IllegalArgumentException("Context does not provide a PrefService");
	}

	/**
	 * @return the stored parameters, or {@link PSTParameters#DEFAULTS} if the
	 *         stored set is invalid
	 */
	public PSTParameters getParameters() {
		final PSTParameters def = PSTParameters.DEFAULTS;
		try {
			return new PSTParameters( //
					prefService.getDouble(PSTPrefs.class, LPF, def.lpf()), //
					prefService.getDouble(PSTPrefs.class, PHASE_STRENGTH, def.phaseStrength()), //
					prefService.getDouble(PSTPrefs.class, WARP_STRENGTH, def.warpStrength()), //
					prefService.getDouble(PSTPrefs.class, THRESHOLD_MIN, def.thresholdMin()), //
					prefService.getDouble(PSTPrefs.class, THRESHOLD_MAX, def.thresholdMax()), //
					prefService.getBoolean(PSTPrefs.class, MORPH, def.morph()));
		} catch (final ParameterValidationException ex) {
			PSTUtils.log("Ignoring stored parameters: " + ex.getMessage());
			return def;
		}
	}

	public void setParameters(final PSTParameters parameters) {
		prefService.put(PSTPrefs.class, LPF, parameters.lpf());
		prefService.put(PSTPrefs.class, PHASE_STRENGTH, parameters.phaseStrength());
		prefService.put(PSTPrefs.class, WARP_STRENGTH, parameters.warpStrength());
		prefService.put(PSTPrefs.class, THRESHOLD_MIN, parameters.thresholdMin());
		prefService.put(PSTPrefs.class, THRESHOLD_MAX, parameters.thresholdMax());
		prefService.put(PSTPrefs.class, MORPH, parameters.morph());
	}

	/** Forgets all stored parameters. */
	public void reset() {
		prefService.clear(PSTPrefs.class);
	}

}
