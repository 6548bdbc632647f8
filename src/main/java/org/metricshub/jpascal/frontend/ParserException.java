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
 * Raised by the {@link PascalParser} at the first token that violates the grammar.
 */
public class ParserException extends PascalException {

	private static final long serialVersionUID = 1L;

	private final transient Token token;

	/**
	 * <p>
	 * Constructor for ParserException.
	 * </p>
	 *
	 * @param msg a {@link java.lang.String} object
	 * @param sourceDescription description of the source being parsed
	 * @param token the offending lookahead token
	 */
	public ParserException(String msg, String sourceDescription, Token token) {
		super(
				ErrorKind.INVALID_SYNTAX,
				msg + " (" + sourceDescription + ", line " + token.getLineNumber() + ", column " + token.getColumn() + ")",
				sourceDescription,
				token.getLineNumber());
		this.token = token;
	}

	/**
	 * @return the lookahead token the parser could not accept
	 */
	public Token getToken() {
		return token;
	}
}
