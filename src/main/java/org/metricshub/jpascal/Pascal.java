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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.util.Map;
import org.metricshub.jpascal.backend.Interpreter;
import org.metricshub.jpascal.frontend.Lexer;
import org.metricshub.jpascal.frontend.PascalParser;
import org.metricshub.jpascal.frontend.ast.ProgramAst;
import org.metricshub.jpascal.semantic.SymbolTable;
import org.metricshub.jpascal.semantic.SymbolTableBuilder;
import org.metricshub.jpascal.util.PascalLogger;
import org.metricshub.jpascal.util.PascalSettings;
import org.metricshub.jpascal.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point into the parsing, analysis, and execution
 * of a program.
 * <p>
 * A run goes through four stages:
 * <ul>
 * <li>Lex and parse the program text, producing an abstract syntax tree.
 * <li>Traverse the tree once with a {@link SymbolTableBuilder}, checking
 * that every used name is declared exactly once.
 * <li>Traverse the tree once more with an {@link Interpreter}, which
 * executes the statements and fills the global variables.
 * <li>Return both the symbol table and the variables.
 * </ul>
 * Each run creates its own lexer, parser, table and store. An instance
 * only remembers its settings and the last tree it parsed.
 *
 * @see org.metricshub.jpascal.backend.Interpreter
 */
public class Pascal {

	private static final Logger LOG = PascalLogger.getLogger(Pascal.class);

	private final PascalSettings settings;

	/**
	 * The last parsed {@link ProgramAst} produced by {@link #compile(ScriptSource)}.
	 */
	private ProgramAst lastAst;

	/**
	 * Create a new instance with default settings
	 */
	public Pascal() {
		this(new PascalSettings());
	}

	/**
	 * @param settings settings applied to every run of this instance
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Pascal(PascalSettings settings) {
		this.settings = settings;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PascalSettings getSettings() {
		return settings;
	}

	/**
	 * Returns the last tree produced by {@link #compile(ScriptSource)}.
	 *
	 * @return the last {@link ProgramAst}, or {@code null} if nothing was parsed yet
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public ProgramAst getLastAst() {
		return lastAst;
	}

	/**
	 * Parses the specified program text.
	 *
	 * @param script program text
	 * @return the syntax tree
	 * @throws org.metricshub.jpascal.frontend.LexerException upon a lexical error
	 * @throws org.metricshub.jpascal.frontend.ParserException upon a syntax error
	 */
	public ProgramAst compile(String script) {
		return compile(script, ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT);
	}

	/**
	 * Reads and parses the specified program source.
	 *
	 * @param source program source, read in full
	 * @return the syntax tree
	 * @throws IOException if the source cannot be read
	 */
	public ProgramAst compile(ScriptSource source) throws IOException {
		return compile(source.readText(), source.getDescription());
	}

	private ProgramAst compile(String text, String description) {
		lastAst = null;
		LOG.debug("Parsing {}", description);
		PascalParser parser = new PascalParser(new Lexer(text, description));
		ProgramAst program = parser.parse();
		lastAst = program;
		LOG.debug("Parsed program {} with {} declarations", program.getName(), program.getBlock().getDeclarations().size());
		return program;
	}

	/**
	 * Runs the declaration/usage check on a fresh symbol table.
	 *
	 * @param program the tree to check
	 * @return the populated table
	 * @throws org.metricshub.jpascal.semantic.SemanticException upon a duplicate or undeclared identifier
	 */
	public SymbolTable analyze(ProgramAst program) {
		SymbolTable symbolTable = new SymbolTableBuilder().build(program);
		LOG.debug("Semantic check passed, {} symbols defined", symbolTable.size());
		return symbolTable;
	}

	/**
	 * Evaluates the program with a fresh interpreter.
	 *
	 * @param program the tree to run
	 * @return the final global variables
	 * @throws org.metricshub.jpascal.jrt.PascalRuntimeException upon an evaluation failure
	 */
	public Map<String, Number> interpret(ProgramAst program) {
		Map<String, Number> variables = new Interpreter().interpret(program);
		LOG.debug("Program {} completed with {} variables", program.getName(), variables.size());
		return variables;
	}

	/**
	 * Parses, checks and runs the specified program text.
	 *
	 * @param script program text
	 * @return the symbol table and the final variables
	 * @throws PascalException upon the first failure of any stage
	 */
	public ExecutionResult run(String script) {
		return run(compile(script));
	}

	/**
	 * Reads, parses, checks and runs the specified program source.
	 *
	 * @param source program source
	 * @return the symbol table and the final variables
	 * @throws IOException if the source cannot be read
	 * @throws PascalException upon the first failure of any stage
	 */
	public ExecutionResult run(ScriptSource source) throws IOException {
		return run(compile(source));
	}

	/**
	 * Checks (unless disabled in the settings) and runs an already parsed program.
	 *
	 * @param program the tree to run
	 * @return the symbol table and the final variables
	 */
	public ExecutionResult run(ProgramAst program) {
		SymbolTable symbolTable = null;
		if (settings.isSemanticCheck()) {
			symbolTable = analyze(program);
		} else {
			LOG.debug("Semantic check disabled");
		}
		return new ExecutionResult(symbolTable, interpret(program));
	}

	/**
	 * Evaluates a single expression (e.g. <code>2 + 3 DIV 2</code>).
	 *
	 * @param expression expression to evaluate
	 * @return its value, a {@link Long} or a {@link Double}
	 */
	public Number eval(String expression) {
		return ExpressionEvaluator.eval(expression);
	}

	/**
	 * Evaluates a single expression against the specified variables.
	 *
	 * @param expression expression to evaluate
	 * @param bindings initial variable values, names are case-insensitive
	 * @return its value, a {@link Long} or a {@link Double}
	 */
	public Number eval(String expression, Map<String, ? extends Number> bindings) {
		return ExpressionEvaluator.eval(expression, bindings);
	}
}
