package org.metricshub.jpascal.frontend.ast;

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

/**
 * One pass over the syntax tree. There is one method per node class, so
 * a pass that forgets a node kind does not compile.
 *
 * @param <R> what the pass computes per node
 */
public interface AstVisitor<R> {
	R visitProgram(ProgramAst node);

	R visitBlock(BlockAst node);

	R visitVarDecl(VarDeclAst node);

	R visitProcedureDecl(ProcedureDeclAst node);

	R visitCompoundStatement(CompoundStatementAst node);

	R visitAssignment(AssignmentAst node);

	R visitEmptyStatement(EmptyStatementAst node);

	R visitBinaryExpression(BinaryExpressionAst node);

	R visitUnaryExpression(UnaryExpressionAst node);

	R visitNumber(NumberAst node);

	R visitVariable(VariableAst node);
}
