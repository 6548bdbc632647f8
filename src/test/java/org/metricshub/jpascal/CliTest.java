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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.net.URISyntaxException;
import java.nio.file.Paths;
import org.junit.Test;
import org.metricshub.jpascal.util.ScriptFileSource;

public class CliTest {

	private static String pathTo(String name) throws URISyntaxException {
		File file = Paths.get(CliTest.class.getResource("/" + name).toURI()).toFile();
		return file.getAbsolutePath();
	}

	@Test
	public void testProgramOnCommandLine() {
		PascalTestSupport
				.cliTest("symbol table and variables")
				.argument("PROGRAM Test; VAR a, b : INTEGER; BEGIN a := 10; b := a + 5 * 2; END.")
				.expectLines(
						"Symbol table contents",
						"_____________________",
						"INTEGER: INTEGER",
						"   REAL: REAL",
						"      A: <A:INTEGER>",
						"      B: <B:INTEGER>",
						"",
						"A = 10",
						"B = 20")
				.runAndAssert();
	}

	@Test
	public void testQuiet() {
		PascalTestSupport
				.cliTest("-q only prints variables")
				.argument("-q", "PROGRAM P; VAR x : REAL; BEGIN x := 7 / 2 END.")
				.expectLines("X = 3.5")
				.runAndAssert();
	}

	@Test
	public void testProgramFile() throws Exception {
		PascalTestSupport
				.cliTest("part12.pas from file")
				.argument("-q", "-f", pathTo("part12.pas"))
				.expectLines("A = 10")
				.runAndAssert();
	}

	@Test
	public void testNoSemanticCheck() {
		PascalTestSupport
				.cliTest("--no-semantic skips the table")
				.argument("--no-semantic", "PROGRAM P; BEGIN y := 2 END.")
				.expectLines("Y = 2")
				.runAndAssert();
	}

	@Test
	public void testDumpSyntax() {
		PascalTestSupport
				.cliTest("--dump-syntax")
				.argument("--dump-syntax", "PROGRAM P; BEGIN y := 2 END.")
				.expectLines(
						"ProgramAst (P)",
						" BlockAst",
						"  CompoundStatementAst",
						"   AssignmentAst",
						"    VariableAst (Y)",
						"    NumberAst (2)")
				.runAndAssert();
	}

	@Test
	public void testProgramError() {
		PascalTestSupport
				.cliTest("undeclared identifier")
				.argument("PROGRAM P;\nBEGIN\n  y := 1;\nEND.")
				.expectLines()
				.expectErrorLines("UndeclaredIdentifier (line 3): Symbol (identifier) not found 'Y'")
				.expectExit(Cli.EXIT_PROGRAM_ERROR)
				.runAndAssert();
	}

	@Test
	public void testRuntimeError() {
		PascalTestSupport
				.cliTest("division by zero")
				.argument("PROGRAM P; VAR x : INTEGER; BEGIN x := 1 DIV 0 END.")
				.expectErrorLines("DivisionByZero (line 1): Division by zero")
				.expectExit(Cli.EXIT_PROGRAM_ERROR)
				.runAndAssert();
	}

	@Test
	public void testMissingFile() {
		PascalTestSupport
				.cliTest("program file does not exist")
				.argument("-f", "does-not-exist.pas")
				.expectExit(Cli.EXIT_PROGRAM_ERROR)
				.runAndAssert();
	}

	@Test
	public void testUsage() {
		PascalTestSupport.CliResult result = PascalTestSupport.cliTest("usage").argument("-h").run();
		assertEquals(Cli.EXIT_OK, result.exitCode());
		assertEquals("Usage:", result.lines().get(0));
	}

	@Test
	public void testNoArgumentsPrintsUsage() {
		PascalTestSupport.CliResult result = PascalTestSupport.cliTest("no arguments").run();
		assertEquals(Cli.EXIT_OK, result.exitCode());
		assertTrue(result.output().startsWith("Usage:"));
	}

	@Test
	public void testArgumentErrors() {
		PascalTestSupport.cliTest("unknown option").argument("--bogus").expectExit(Cli.EXIT_USAGE_ERROR).runAndAssert();
		PascalTestSupport.cliTest("-f without file").argument("-f").expectExit(Cli.EXIT_USAGE_ERROR).runAndAssert();
		PascalTestSupport.cliTest("options only").argument("-q").expectExit(Cli.EXIT_USAGE_ERROR).runAndAssert();
		PascalTestSupport
				.cliTest("extra argument")
				.argument("PROGRAM P; BEGIN END.", "extra")
				.expectExit(Cli.EXIT_USAGE_ERROR)
				.runAndAssert();
		PascalTestSupport
				.cliTest("help with other arguments")
				.argument("-q", "-h")
				.expectExit(Cli.EXIT_USAGE_ERROR)
				.runAndAssert();
	}

	@Test
	public void testParseCommandLineArguments() {
		Cli cli = Cli.parseCommandLineArguments(new String[] { "--no-semantic", "-q", "-f", "x.pas" });
		assertFalse(cli.getSettings().isSemanticCheck());
		assertFalse(cli.getSettings().isPrintSymbolTable());
		assertFalse(cli.getSettings().isDumpSyntaxTree());
		assertTrue(cli.getScriptSource() instanceof ScriptFileSource);
		assertEquals("x.pas", cli.getScriptSource().getDescription());

		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "" }));
	}
}
