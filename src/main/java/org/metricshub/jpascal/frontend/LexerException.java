package org.metricshub.jpascal.frontend;

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
 * Raised by the {@link Lexer} when the source text cannot be split into tokens.
 */
public class LexerException extends PascalException {

	private static final long serialVersionUID = 1L;

	private final int column;

	/**
	 * <p>
	 * Constructor for LexerException.
	 * </p>
	 *
	 * @param kind one of the lexical error kinds
	 * @param msg a {@link java.lang.String} object
	 * @param sourceDescription description of the source being lexed
	 * @param lineNo line of the offending character
	 * @param column column of the offending character
	 */
	public LexerException(ErrorKind kind, String msg, String sourceDescription, int lineNo, int column) {
		super(kind, msg + " (" + sourceDescription + ", line " + lineNo + ", column " + column + ")", sourceDescription, lineNo);
		this.column = column;
	}

	public int getColumn() {
		return column;
	}
}
