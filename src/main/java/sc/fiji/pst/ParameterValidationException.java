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
 * Thrown when a transform parameter lies outside its documented range. Raised
 * before any computation takes place.
 */
public class ParameterValidationException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final String parameter;
	private final Object value;

	/**
	 * @param parameter  the name of the offending parameter, e.g. {@code "LPF"}
	 * @param value      the rejected value
	 * @param constraint human readable description of the accepted range
	 */
	public ParameterValidationException(final String parameter, final Object value, final String constraint) {
		super(String.format("Invalid %s=%s: %s", parameter, value, constraint));
		this.parameter = parameter;
		this.value = value;
	}

	/**
	 * @return the name of the rejected parameter
	 */
	public String getParameter() {
		return parameter;
	}

	/**
	 * @return the rejected value
	 */
	public Object getValue() {
		return value;
	}

}
