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
import org.metricshub.jpascal.ErrorKind;
import org.metricshub.jpascal.frontend.ast.AssignmentAst;
import org.metricshub.jpascal.frontend.ast.AstNode;
import org.metricshub.jpascal.frontend.ast.AstVisitor;
import org.metricshub.jpascal.frontend.ast.BinaryExpressionAst;
import org.metricshub.jpascal.frontend.ast.BlockAst;
import org.metricshub.jpascal.frontend.ast.CompoundStatementAst;
import org.metricshub.jpascal.frontend.ast.EmptyStatementAst;
import org.metricshub.jpascal.frontend.ast.NumberAst;
import org.metricshub.jpascal.frontend.ast.ProcedureDeclAst;
import org.metricshub.jpascal.frontend.ast.ProgramAst;
import org.metricshub.jpascal.frontend.ast.UnaryExpressionAst;
import org.metricshub.jpascal.frontend.ast.VarDeclAst;
import org.metricshub.jpascal.frontend.ast.VariableAst;
import org.metricshub.jpascal.jrt.Arithmetic;
import org.metricshub.jpascal.jrt.PascalRuntimeException;
import org.metricshub.jpascal.util.PascalLogger;
import org.slf4j.Logger;

/**
 * The tree-walking interpreter.
 * <p>
 * Statements are executed in source order against a {@link GlobalScope};
 * expressions evaluate to a {@link Long} or a {@link Double}, following the
 * rules of {@link Arithmetic}. Declarations have no runtime effect, and
 * procedure bodies are never executed since the language has no call
 * statement.
 * <p>
 * One instance serves one run: the scope it writes into is not reset.
 */
public class Interpreter implements PascalInterpreter, AstVisitor<Number> {

	private static final Logger LOG = PascalLogger.getLogger(Interpreter.class);

	private final GlobalScope globalScope;
	private String sourceDescription;

	/**
	 * Creates an interpreter with an empty global scope.
	 */
	public Interpreter() {
		this(new GlobalScope());
	}

	/**
	 * @param globalScope the scope variables are read from and written to
	 */
	public Interpreter(GlobalScope globalScope) {
		this.globalScope = globalScope;
	}

	/** {@inheritDoc} */
	@Override
	public Map<String, Number> interpret(ProgramAst program) {
		program.accept(this);
		return globalScope.snapshot();
	}

	/**
	 * Evaluates a single expression against the current scope.
	 *
	 * @param expression the expression tree
	 * @return the value, a {@link Long} or a {@link Double}
	 * @throws PascalRuntimeException upon an evaluation failure
	 */
	public Number evaluate(AstNode expression) {
		return expression.accept(this);
	}

	public GlobalScope getGlobalScope() {
		return globalScope;
	}

	@Override
	public Number visitProgram(ProgramAst node) {
		sourceDescription = node.getSourceDescription();
		return node.getBlock().accept(this);
	}

	@Override
	public Number visitBlock(BlockAst node) {
		for (AstNode declaration : node.getDeclarations()) {
			declaration.accept(this);
		}
		return node.getCompoundStatement().accept(this);
	}

	@Override
	public Number visitVarDecl(VarDeclAst node) {
		return null;
	}

	@Override
	public Number visitProcedureDecl(ProcedureDeclAst node) {
		return null;
	}

	@Override
	public Number visitCompoundStatement(CompoundStatementAst node) {
		for (AstNode statement : node.getStatements()) {
			statement.accept(this);
		}
		return null;
	}

	@Override
	public Number visitAssignment(AssignmentAst node) {
		String name = node.getTarget().getName();
		Number value = node.getValue().accept(this);
		globalScope.setVariable(name, value);
		LOG.trace("{} := {}", name, value);
		return null;
	}

	@Override
	public Number visitEmptyStatement(EmptyStatementAst node) {
		return null;
	}

	@Override
	public Number visitBinaryExpression(BinaryExpressionAst node) {
		Number left = node.getLeft().accept(this);
		Number right = node.getRight().accept(this);
		try {
			switch (node.getOperator()) {
			case PLUS:
				return Arithmetic.add(left, right);
			case MINUS:
				return Arithmetic.subtract(left, right);
			case MUL:
				return Arithmetic.multiply(left, right);
			case INTEGER_DIV:
				checkDivisor(right, node);
				return Arithmetic.integerDivide(left, right);
			case FLOAT_DIV:
				checkDivisor(right, node);
				return Arithmetic.floatDivide(left, right);
			default:
				throw new Error("Unhandled op: " + node.getOperator());
			}
		} catch (ArithmeticException ae) {
			throw overflow(node, ae);
		}
	}

	@Override
	public Number visitUnaryExpression(UnaryExpressionAst node) {
		Number operand = node.getOperand().accept(this);
		switch (node.getOperator()) {
		case PLUS:
			return operand;
		case MINUS:
			try {
				return Arithmetic.negate(operand);
			} catch (ArithmeticException ae) {
				throw overflow(node, ae);
			}
		default:
			throw new Error("Unhandled op: " + node.getOperator());
		}
	}

	@Override
	public Number visitNumber(NumberAst node) {
		return node.getValue();
	}

	@Override
	public Number visitVariable(VariableAst node) {
		String name = node.getName();
		Number value = globalScope.getVariable(name);
		if (value == null) {
			throw new PascalRuntimeException(
					ErrorKind.UNDEFINED_VARIABLE,
					sourceDescription,
					node.getLineNumber(),
					"Variable '" + name + "' is used before being assigned");
		}
		return value;
	}

	private void checkDivisor(Number divisor, AstNode node) {
		if (Arithmetic.isZero(divisor)) {
			throw new PascalRuntimeException(ErrorKind.DIVISION_BY_ZERO, sourceDescription, node.getLineNumber(), "Division by zero");
		}
	}

	private PascalRuntimeException overflow(AstNode node, ArithmeticException cause) {
		PascalRuntimeException pre = new PascalRuntimeException(
				ErrorKind.ARITHMETIC_OVERFLOW,
				sourceDescription,
				node.getLineNumber(),
				"Integer overflow: " + cause.getMessage());
		pre.initCause(cause);
		return pre;
	}
}
