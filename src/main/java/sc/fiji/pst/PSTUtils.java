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
import org.scijava.log.LogService;
import org.scijava.prefs.PrefService;
import org.scijava.util.VersionUtils;

/** Static utilities for PST: context retrieval, logging and debug mode **/
public class PSTUtils {

	private static Context context;
	private static LogService logService;
	private static boolean debugMode;

	public static final String VERSION = getVersion();

	private static boolean initialized;

	private PSTUtils() {}

	private static synchronized void initialize() {
		if (initialized) return;
		if (context == null) getContext();
		if (logService == null) logService = context.getService(LogService.class);
		initialized = true;
	}

	public static String getReadableVersion() {
		if (VERSION.length() < 21) return "PST " + VERSION;
		return "PST " + VERSION.substring(0, 21) + "...";
	}

	/**
	 * Retrieves the version of this library
	 *
	 * @return the version or a non-empty place holder string if version could
	 *         not be retrieved.
	 */
	private static String getVersion() {
		try {
			return VersionUtils.getVersion(PhaseStretchTransform.class);
		} catch (final Throwable ignored) {
			return "N/A";
		}
	}

	public static synchronized void error(final String string) {
		if (!initialized) initialize();
		logService.error("[PST] " + string);
	}

	public static synchronized void error(final String string, final Throwable t) {
		if (!initialized) initialize();
		if (t == null)
			logService.error("[PST] " + string);
		else
			logService.error("[PST] " + string, t);
	}

	public static synchronized void log(final String string) {
		if (!isDebugMode()) return;
		if (!initialized) initialize();
		logService.info("[PST] " + string);
	}

	public static synchronized void warn(final String string) {
		if (!initialized) initialize();
		logService.warn("[PST] " + string);
	}

	/**
	 * Convenience method to access the context of the running Fiji instance. If
	 * ImageJ is not running, a minimal context holding only the services needed
	 * by PST is created.
	 *
	 * @return the context of the active ImageJ instance. Never null
	 */
	public static synchronized Context getContext() {
		if (context == null) {
			try {
				if (ij.IJ.getInstance() != null)
					context = (Context) ij.IJ.runPlugIn("org.scijava.Context", "");
			} catch (final Throwable ex) {
				System.out.println("[ERROR] [PST] Failed to retrieve context from IJ1: " + ex.getMessage());
			} finally {
				if (context == null) context = new Context(LogService.class, PrefService.class);
			}
		}
		return context;
	}

	public static boolean isContextSet() {
		return null != PSTUtils.context;
	}

	public static synchronized void setContext(final Context context) {
		PSTUtils.context = context;
		PSTUtils.logService = null;
		PSTUtils.initialized = false;
	}

	public static boolean isDebugMode() {
		return debugMode;
	}

	public static synchronized void setDebugMode(final boolean b) {
		if (isDebugMode() && !b) {
			log("Exiting debug mode...");
		}
		debugMode = b;
		if (isDebugMode()) {
			log("Entering debug mode...");
		}
	}

}
