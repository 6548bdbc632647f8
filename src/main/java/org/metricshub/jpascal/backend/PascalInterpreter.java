package org.metricshub.jpascal.backend;

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

import java.util.Map;
import org.metricshub.jpascal.frontend.ast.ProgramAst;

/**
 * Executes a parsed program within this JVM.
 */
public interface PascalInterpreter {
	/**
	 * Traverse the syntax tree, evaluating each statement in turn.
	 *
	 * @param program the program to run
	 * @return the global variables after the main compound statement completed,
	 *         keyed by uppercased name in first-assignment order
	 * @throws org.metricshub.jpascal.jrt.PascalRuntimeException upon an evaluation failure
	 */
	Map<String, Number> interpret(ProgramAst program);
}
