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
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;

import java.io.IOException;
import java.io.StringReader;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Test;
import org.metricshub.jpascal.frontend.LexerException;
import org.metricshub.jpascal.frontend.ParserException;
import org.metricshub.jpascal.frontend.ast.ProgramAst;
import org.metricshub.jpascal.jrt.PascalRuntimeException;
import org.metricshub.jpascal.semantic.SemanticException;
import org.metricshub.jpascal.util.PascalSettings;
import org.metricshub.jpascal.util.ScriptSource;

public class PascalTest {

	private static final Pascal PASCAL = new Pascal();

	private static Map<String, Number> vars(Object... namesAndValues) {
		Map<String, Number> map = new LinkedHashMap<String, Number>();
		for (int i = 0; i < namesAndValues.length; i += 2) {
			map.put((String) namesAndValues[i], (Number) namesAndValues[i + 1]);
		}
		return map;
	}

	@Test
	public void testSimpleProgram() throws Exception {
		PascalTestSupport
				.pascalTest("two integer assignments")
				.script("PROGRAM Test; VAR a, b : INTEGER; BEGIN a := 10; b := a + 5 * 2; END.")
				.expectExactly(vars("A", 10L, "B", 20L))
				.build()
				.runAndAssert();
	}

	@Test
	public void testSymbolTableOfSimpleProgram() {
		ExecutionResult result = PASCAL.run("PROGRAM Test; VAR a, b : INTEGER; BEGIN a := 10; b := a + 5 * 2; END.");
		assertNotNull(result.getSymbolTable());
		assertEquals(4, result.getSymbolTable().size());
		assertEquals("<A:INTEGER>", result.getSymbolTable().lookup("A").toString());
		assertEquals("<B:INTEGER>", result.getSymbolTable().lookup("B").toString());
	}

	@Test
	public void testLeadingCommentAndRealDivision() {
		PascalTestSupport
				.pascalTest("comment before program, real division")
				.script("{ this is ignored } PROGRAM P; VAR x:REAL; BEGIN x := 7 / 2; END.")
				.expectExactly(vars("X", 3.5))
				.build()
				.runAndAssert();
	}

	@Test
	public void testCaseInsensitiveNames() {
		PascalTestSupport
				.pascalTest("mixed case identifiers")
				.script("program p; var Total : integer; begin total := 4; TOTAL := ToTaL * 2 end.")
				.expectVariable("total", 8L)
				.build()
				.runAndAssert();
	}

	@Test
	public void testPart10() {
		PascalTestSupport
				.pascalTest("part10.pas")
				.script(PascalTest.class.getResourceAsStream("/part10.pas"))
				.expectExactly(vars("NUMBER", 2L, "A", 2L, "B", 25L, "C", 27L, "X", 11L, "Y", 5.997142857142857))
				.build()
				.runAndAssert();
	}

	@Test
	public void testPart12ProceduresAreIgnoredAtRuntime() {
		PascalTestSupport
				.pascalTest("part12.pas")
				.script(PascalTest.class.getResourceAsStream("/part12.pas"))
				.expectExactly(vars("A", 10L))
				.build()
				.runAndAssert();
	}

	@Test
	public void testDuplicateIdentifier() {
		PascalTestSupport
				.pascalTest("duplicate.pas")
				.script(PascalTestSupport.resource("duplicate.pas"))
				.expectThrow(SemanticException.class)
				.expectError(ErrorKind.DUPLICATE_IDENTIFIER)
				.build()
				.runAndAssert();
	}

	@Test
	public void testUndeclaredIdentifierStopsBeforeEvaluation() {
		// 1 DIV 0 would fail at runtime, the semantic check must fail first
		PascalTestSupport
				.pascalTest("undeclared target")
				.script("PROGRAM P; VAR x : INTEGER; BEGIN x := 1 DIV 0; y := 1; END.")
				.expectThrow(SemanticException.class)
				.expectError(ErrorKind.UNDECLARED_IDENTIFIER)
				.build()
				.runAndAssert();
	}

	@Test
	public void testUndefinedVariableAfterSuccessfulCheck() {
		PascalTestSupport
				.pascalTest("declared but never assigned")
				.script("PROGRAM P; VAR x, y : INTEGER; BEGIN y := x END.")
				.expectThrow(PascalRuntimeException.class)
				.expectError(ErrorKind.UNDEFINED_VARIABLE)
				.build()
				.runAndAssert();
	}

	@Test
	public void testDivisionByZero() {
		PascalTestSupport
				.pascalTest("division by zero")
				.script("PROGRAM P; VAR x : REAL; BEGIN x := 1 / (3 - 3) END.")
				.expectError(ErrorKind.DIVISION_BY_ZERO)
				.build()
				.runAndAssert();
	}

	@Test
	public void testSyntaxAndLexicalErrors() {
		PascalTestSupport
				.pascalTest("missing final dot")
				.script("PROGRAM P; BEGIN END")
				.expectThrow(ParserException.class)
				.expectError(ErrorKind.INVALID_SYNTAX)
				.build()
				.runAndAssert();
		PascalTestSupport
				.pascalTest("unterminated comment")
				.script("PROGRAM P; { BEGIN END.")
				.expectThrow(LexerException.class)
				.expectError(ErrorKind.UNTERMINATED_COMMENT)
				.build()
				.runAndAssert();
	}

	@Test
	public void testWithoutSemanticCheck() {
		PascalTestSupport
				.pascalTest("undeclared names run when the check is off")
				.script("PROGRAM P; BEGIN y := 1; z := y + 1 END.")
				.withoutSemanticCheck()
				.expectExactly(vars("Y", 1L, "Z", 2L))
				.build()
				.runAndAssert();

		PascalSettings settings = new PascalSettings();
		settings.setSemanticCheck(false);
		assertNull(new Pascal(settings).run("PROGRAM P; BEGIN y := 1 END.").getSymbolTable());
	}

	@Test
	public void testRunFromScriptSource() throws IOException {
		ExecutionResult result = PASCAL.run(new ScriptSource("in-memory.pas", new StringReader("PROGRAM P; VAR n : INTEGER; BEGIN n := 3 * 4 END.")));
		assertEquals(12L, result.getVariable("n"));
	}

	@Test
	public void testErrorCarriesSourceDescription() {
		ScriptSource source = new ScriptSource("broken.pas", new StringReader("PROGRAM P;\nBEGIN x := $ END."));
		LexerException e = assertThrows(LexerException.class, () -> PASCAL.run(source));
		assertEquals("broken.pas", e.getSourceDescription());
		assertEquals(2, e.getLineNumber());
	}

	@Test
	public void testStagesSeparately() {
		Pascal pascal = new Pascal();
		ProgramAst program = pascal.compile("PROGRAM P; VAR r : REAL; BEGIN r := 2 * 1.5 END.");
		assertSame(program, pascal.getLastAst());
		assertEquals(3, pascal.analyze(program).size());
		assertEquals(vars("R", 3.0), pascal.interpret(program));
	}

	@Test
	public void testDeterminism() {
		String text = "PROGRAM P; VAR a, b : REAL; BEGIN a := 10 / 4; b := a * (a - 1) DIV 1 END.";
		assertEquals(PASCAL.run(text).getVariables(), PASCAL.run(text).getVariables());
	}

	@Test
	public void testEval() {
		assertEquals(17.0, PASCAL.eval("14 + 2 * 3 - 6 / 2"));
		assertEquals(6L, PASCAL.eval("x * 2", vars("X", 3L)));
	}
}
