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

import java.util.Locale;
import java.util.Map;
import org.metricshub.jpascal.semantic.SymbolTable;

/**
 * Outcome of one successful program run: the symbol table built by the
 * declaration check and the final global variables.
 */
public final class ExecutionResult {

	private final SymbolTable symbolTable;
	private final Map<String, Number> variables;

	/**
	 * @param symbolTable the populated table, or {@code null} if the check was skipped
	 * @param variables the unmodifiable final store
	 */
	public ExecutionResult(SymbolTable symbolTable, Map<String, Number> variables) {
		this.symbolTable = symbolTable;
		this.variables = variables;
	}

	/**
	 * @return the symbol table, or {@code null} when the semantic check was disabled
	 */
	public SymbolTable getSymbolTable() {
		return symbolTable;
	}

	/**
	 * @return the global variables in first-assignment order
	 */
	public Map<String, Number> getVariables() {
		return variables;
	}

	/**
	 * Looks a variable up, ignoring the case of its name.
	 *
	 * @param name variable name
	 * @return its final value, or {@code null} if it was never assigned
	 */
	public Number getVariable(String name) {
		return variables.get(name.toUpperCase(Locale.ROOT));
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return variables.toString();
	}
}
