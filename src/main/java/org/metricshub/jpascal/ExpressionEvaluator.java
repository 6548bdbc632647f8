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

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import org.metricshub.jpascal.backend.GlobalScope;
import org.metricshub.jpascal.backend.Interpreter;
import org.metricshub.jpascal.frontend.Lexer;
import org.metricshub.jpascal.frontend.PascalParser;
import org.metricshub.jpascal.frontend.ast.AstNode;
import org.metricshub.jpascal.jrt.Arithmetic;

/**
 * Utility class to evaluate standalone expressions.
 * <p>
 * No declaration check applies: a name is valid as long as it is bound.
 */
public final class ExpressionEvaluator {

	private ExpressionEvaluator() {}

	public static Number eval(String expression) {
		return eval(expression, Collections.<String, Number>emptyMap());
	}

	/**
	 * @param expression expression to evaluate
	 * @param bindings initial variable values, names are case-insensitive
	 * @return the value of the expression, a {@link Long} or a {@link Double}
	 * @throws org.metricshub.jpascal.frontend.ParserException if the text is not a single expression
	 * @throws org.metricshub.jpascal.jrt.PascalRuntimeException upon an unbound name or an arithmetic failure
	 */
	public static Number eval(String expression, Map<String, ? extends Number> bindings) {
		AstNode ast = new PascalParser(new Lexer(expression)).parseExpression();

		GlobalScope scope = new GlobalScope();
		for (Map.Entry<String, ? extends Number> binding : bindings.entrySet()) {
			scope.setVariable(binding.getKey().toUpperCase(Locale.ROOT), Arithmetic.normalize(binding.getValue()));
		}
		return new Interpreter(scope).evaluate(ast);
	}
}
