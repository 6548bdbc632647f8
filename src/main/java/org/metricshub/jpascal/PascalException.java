package org.metricshub.jpascal;

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

/**
 * Base class of every failure raised while lexing, parsing, checking or
 * evaluating a program. The first failure aborts the run, so there is never
 * more than one of them per invocation.
 */
public abstract class PascalException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final ErrorKind kind;
	private final String sourceDescription;
	private final int lineNumber;

	/**
	 * @param kind category of the failure
	 * @param msg description of the failure
	 * @param sourceDescription description of the offending source, may be {@code null}
	 * @param lineno 1-based line of the failure, or {@code -1}
	 */
	protected PascalException(ErrorKind kind, String msg, String sourceDescription, int lineno) {
		super(msg);
		this.kind = kind;
		this.sourceDescription = sourceDescription;
		this.lineNumber = lineno;
	}

	public ErrorKind getKind() {
		return kind;
	}

	/**
	 * @return the description of the source the failure comes from, or {@code null}
	 */
	public String getSourceDescription() {
		return sourceDescription;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}
}
