package org.metricshub.jpascal.semantic;

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
 * Raised by the {@link SymbolTableBuilder} when a name is declared twice or
 * used without a declaration.
 */
public class SemanticException extends PascalException {

	private static final long serialVersionUID = 1L;

	private final String identifier;

	/**
	 * @param kind {@link ErrorKind#DUPLICATE_IDENTIFIER} or {@link ErrorKind#UNDECLARED_IDENTIFIER}
	 * @param identifier the offending name
	 * @param msg description of the failure
	 * @param sourceDescription description of the checked source
	 * @param lineno line of the offending declaration or reference
	 */
	public SemanticException(ErrorKind kind, String identifier, String msg, String sourceDescription, int lineno) {
		super(kind, msg, sourceDescription, lineno);
		this.identifier = identifier;
	}

	public String getIdentifier() {
		return identifier;
	}
}
