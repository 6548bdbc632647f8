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

/**
 * One lexical unit handed from the {@link Lexer} to the {@link PascalParser}.
 * <p>
 * The value is a {@link Long} for {@link TokenType#INTEGER_CONST}, a
 * {@link Double} for {@link TokenType#REAL_CONST}, the uppercased text for
 * identifiers and keywords, the lexeme for punctuation and {@code null}
 * for {@link TokenType#EOF}.
 */
public final class Token {

	private final TokenType type;
	private final Object value;
	private final int lineNumber;
	private final int column;

	public Token(TokenType type, Object value, int lineNumber, int column) {
		this.type = type;
		this.value = value;
		this.lineNumber = lineNumber;
		this.column = column;
	}

	public TokenType getType() {
		return type;
	}

	public Object getValue() {
		return value;
	}

	/**
	 * @return the 1-based line where the token starts
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return the 1-based column where the token starts
	 */
	public int getColumn() {
		return column;
	}

	/**
	 * @return the value as text, for identifiers and keywords
	 */
	public String getText() {
		return value == null ? "" : value.toString();
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return "Token(" + type + ", " + value + ")";
	}
}
