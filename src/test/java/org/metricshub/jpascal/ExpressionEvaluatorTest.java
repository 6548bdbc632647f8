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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.junit.Test;
import org.metricshub.jpascal.frontend.ParserException;
import org.metricshub.jpascal.jrt.PascalRuntimeException;

public class ExpressionEvaluatorTest {

	@Test
	public void testArithmetic() {
		assertEquals(17.0, ExpressionEvaluator.eval("14 + 2 * 3 - 6 / 2"));
		assertEquals(10L, ExpressionEvaluator.eval("(2 + 3) * 2"));
		assertEquals(-3L, ExpressionEvaluator.eval("-5 DIV 2"));
	}

	@Test
	public void testBindingsAreCaseInsensitive() {
		Map<String, Number> bindings = new HashMap<String, Number>();
		bindings.put("width", 3);
		bindings.put("Height", 2.5);
		assertEquals(7.5, ExpressionEvaluator.eval("WIDTH * height", bindings));
	}

	@Test
	public void testIntegerBindingIsNormalized() {
		assertEquals(4L, ExpressionEvaluator.eval("n + 1", Collections.singletonMap("n", 3)));
	}

	@Test
	public void testUnboundName() {
		PascalRuntimeException e = assertThrows(PascalRuntimeException.class, () -> ExpressionEvaluator.eval("a + 1"));
		assertEquals(ErrorKind.UNDEFINED_VARIABLE, e.getKind());
	}

	@Test
	public void testNotAnExpression() {
		assertThrows(ParserException.class, () -> ExpressionEvaluator.eval("a := 1"));
		assertThrows(ParserException.class, () -> ExpressionEvaluator.eval(""));
	}
}
