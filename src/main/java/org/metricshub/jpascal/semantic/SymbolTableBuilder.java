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

/**
 * Declaration/usage check of a program.
 * <p>
 * Walks the tree once, entering every variable declaration into a
 * {@link SymbolTable} and checking that every assigned or read name has
 * been declared before. The first failure is thrown as a
 * {@link SemanticException}.
 * <p>
 * Procedure bodies are not checked: their declarations stay out of the
 * table and their statements are not looked at.
 */
public class SymbolTableBuilder implements AstVisitor<Void> {

	private final SymbolTable symbolTable;
	private String sourceDescription;

	/**
	 * Creates a builder filling a new table.
	 */
	public SymbolTableBuilder() {
		this(new SymbolTable());
	}

	/**
	 * @param symbolTable the table to fill
	 */
	public SymbolTableBuilder(SymbolTable symbolTable) {
		this.symbolTable = symbolTable;
	}

	/**
	 * Checks the whole program.
	 *
	 * @param program the tree to check
	 * @return the populated symbol table
	 * @throws SemanticException upon a duplicate or undeclared identifier
	 */
	public SymbolTable build(ProgramAst program) {
		program.accept(this);
		return symbolTable;
	}

	public SymbolTable getSymbolTable() {
		return symbolTable;
	}

	@Override
	public Void visitProgram(ProgramAst node) {
		sourceDescription = node.getSourceDescription();
		return node.getBlock().accept(this);
	}

	@Override
	public Void visitBlock(BlockAst node) {
		for (AstNode declaration : node.getDeclarations()) {
			declaration.accept(this);
		}
		return node.getCompoundStatement().accept(this);
	}

	@Override
	public Void visitVarDecl(VarDeclAst node) {
		Symbol typeSymbol = symbolTable.lookup(node.getTypeName());
		if (!(typeSymbol instanceof BuiltinTypeSymbol)) {
			throw semanticException(
					ErrorKind.UNDECLARED_IDENTIFIER,
					node.getTypeName(),
					"Unknown type '" + node.getTypeName() + "'",
					node);
		}

		String varName = node.getVariableName();
		if (!symbolTable.define(new VarSymbol(varName, (BuiltinTypeSymbol) typeSymbol))) {
			throw semanticException(ErrorKind.DUPLICATE_IDENTIFIER, varName, "Duplicate identifier '" + varName + "'", node);
		}
		return null;
	}

	@Override
	public Void visitProcedureDecl(ProcedureDeclAst node) {
		// procedure bodies are neither scoped nor checked
		return null;
	}

	@Override
	public Void visitCompoundStatement(CompoundStatementAst node) {
		for (AstNode statement : node.getStatements()) {
			statement.accept(this);
		}
		return null;
	}

	@Override
	public Void visitAssignment(AssignmentAst node) {
		checkDeclared(node.getTarget());
		return node.getValue().accept(this);
	}

	@Override
	public Void visitEmptyStatement(EmptyStatementAst node) {
		return null;
	}

	@Override
	public Void visitBinaryExpression(BinaryExpressionAst node) {
		node.getLeft().accept(this);
		return node.getRight().accept(this);
	}

	@Override
	public Void visitUnaryExpression(UnaryExpressionAst node) {
		return node.getOperand().accept(this);
	}

	@Override
	public Void visitNumber(NumberAst node) {
		return null;
	}

	@Override
	public Void visitVariable(VariableAst node) {
		checkDeclared(node);
		return null;
	}

	private void checkDeclared(VariableAst variable) {
		String varName = variable.getName();
		if (symbolTable.lookup(varName) == null) {
			throw semanticException(
					ErrorKind.UNDECLARED_IDENTIFIER,
					varName,
					"Symbol (identifier) not found '" + varName + "'",
					variable);
		}
	}

	private SemanticException semanticException(ErrorKind kind, String identifier, String msg, AstNode node) {
		return new SemanticException(kind, identifier, msg, sourceDescription, node.getLineNumber());
	}
}
