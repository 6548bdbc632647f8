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
 * Failure categories reported by the stages of the pipeline.
 * Each {@link PascalException} carries exactly one of them.
 */
public enum ErrorKind {

	/** The lexer met a character no lexical rule accepts. */
	INVALID_CHARACTER("InvalidCharacter"),

	/** A <code>{</code> comment was never closed. */
	UNTERMINATED_COMMENT("UnterminatedComment"),

	/** An integer literal does not fit into a <code>long</code>. */
	NUMBER_OUT_OF_RANGE("NumberOutOfRange"),

	/** The lookahead token did not match the grammar. */
	INVALID_SYNTAX("InvalidSyntax"),

	/** A name was declared twice in the same symbol table. */
	DUPLICATE_IDENTIFIER("DuplicateIdentifier"),

	/** A name was used without being declared. */
	UNDECLARED_IDENTIFIER("UndeclaredIdentifier"),

	/** A variable was read before it was ever assigned. */
	UNDEFINED_VARIABLE("UndefinedVariable"),

	/** The right operand of <code>/</code> or <code>DIV</code> was zero. */
	DIVISION_BY_ZERO("DivisionByZero"),

	/** Integer arithmetic left the range of a <code>long</code>. */
	ARITHMETIC_OVERFLOW("ArithmeticOverflow");

	private final String displayName;

	ErrorKind(String displayName) {
		this.displayName = displayName;
	}

	/**
	 * @return the name used when the failure is reported to a user
	 */
	public String getDisplayName() {
		return displayName;
	}
}
