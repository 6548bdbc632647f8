package org.metricshub.jpascal.jrt;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jpascal
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import org.metricshub.jpascal.ErrorKind;
import org.metricshub.jpascal.PascalException;

/**
 * Raised while a program is evaluated: a variable read before any
 * assignment, a division by zero or an integer overflow.
 */
public class PascalRuntimeException extends PascalException {

	private static final long serialVersionUID = 1L;

	/**
	 * <p>
	 * Constructor for PascalRuntimeException.
	 * </p>
	 *
	 * @param kind category of the failure
	 * @param lineno line of the failing expression
	 * @param msg a {@link java.lang.String} object
	 */
	public PascalRuntimeException(ErrorKind kind, int lineno, String msg) {
		this(kind, null, lineno, msg);
	}

	/**
	 * @param kind category of the failure
	 * @param sourceDescription description of the running program, may be {@code null}
	 * @param lineno line of the failing expression
	 * @param msg a {@link java.lang.String} object
	 */
	public PascalRuntimeException(ErrorKind kind, String sourceDescription, int lineno, String msg) {
		super(kind, msg, sourceDescription, lineno);
	}
}
