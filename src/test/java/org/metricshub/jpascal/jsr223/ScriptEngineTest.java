package org.metricshub.jpascal.jsr223;

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
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Map;
import javax.script.Bindings;
import javax.script.ScriptEngine;
import javax.script.ScriptEngineManager;
import javax.script.ScriptException;
import org.junit.Test;
import org.metricshub.jpascal.PascalException;
import org.metricshub.jpascal.frontend.Lexer;
import org.metricshub.jpascal.frontend.PascalParser;
import org.metricshub.jpascal.frontend.ast.ProgramAst;

public class ScriptEngineTest {

	@Test
	public void testLookupByName() {
		ScriptEngineManager manager = new ScriptEngineManager();
		ScriptEngine engine = manager.getEngineByName("jpascal");
		assertNotNull(engine);
		assertTrue(engine instanceof PascalScriptEngine);
		assertNotNull(manager.getEngineByExtension("pas"));
	}

	@Test
	public void testEvalReturnsVariables() throws Exception {
		ScriptEngine engine = new PascalScriptEngineFactory().getScriptEngine();

		Bindings bindings = engine.createBindings();
		Object result = engine.eval("PROGRAM P; VAR a : INTEGER; b : REAL; BEGIN a := 6; b := a / 4 END.", bindings);

		assertTrue(result instanceof Map);
		assertEquals(6L, ((Map<?, ?>) result).get("A"));
		assertEquals(1.5, bindings.get("B"));
	}

	@Test
	public void testEngineScope() throws Exception {
		ScriptEngine engine = new PascalScriptEngineFactory().getScriptEngine();
		engine.eval("PROGRAM P; VAR n : INTEGER; BEGIN n := 2 * 21 END.");
		assertEquals(42L, engine.get("N"));
	}

	@Test
	public void testFailure() {
		ScriptEngine engine = new PascalScriptEngineFactory().getScriptEngine();
		ScriptException e = assertThrows(ScriptException.class, () -> engine.eval("PROGRAM P; VAR x : INTEGER;\nBEGIN x := 1 DIV 0 END."));
		assertEquals(2, e.getLineNumber());
		assertTrue(e.getCause() instanceof PascalException);
	}

	@Test
	public void testGeneratedProgramParses() {
		PascalScriptEngineFactory factory = new PascalScriptEngineFactory();
		String program = factory.getProgram("a := 1", "b := a + 1");
		assertEquals("PROGRAM Script;\nBEGIN\n\ta := 1;\n\tb := a + 1\nEND.\n", program);

		ProgramAst ast = new PascalParser(new Lexer(program)).parse();
		assertEquals(2, ast.getBlock().getCompoundStatement().getStatements().size());
	}

	@Test
	public void testNoMethodCallOrOutputSyntax() {
		PascalScriptEngineFactory factory = new PascalScriptEngineFactory();
		assertThrows(UnsupportedOperationException.class, () -> factory.getMethodCallSyntax("a", "m"));
		assertThrows(UnsupportedOperationException.class, () -> factory.getOutputStatement("hello"));
	}

	@Test
	public void testFactoryParameters() {
		PascalScriptEngineFactory factory = new PascalScriptEngineFactory();
		assertEquals("Jpascal", factory.getParameter(ScriptEngine.NAME));
		assertEquals("pascal", factory.getParameter(ScriptEngine.LANGUAGE));
		assertEquals(null, factory.getParameter("THREADING"));
	}
}
