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

import java.util.Collections;
import java.util.List;
import org.metricshub.jpascal.frontend.TokenType;

/**
 * Unary <code>+</code> or <code>-</code> applied to a factor.
 */
public final class UnaryExpressionAst extends AstNode {

	private final TokenType op;
	private final AstNode operand;

	public UnaryExpressionAst(int lineNo, TokenType op, AstNode operand) {
		super(lineNo);
		this.op = op;
		this.operand = operand;
	}

	public TokenType getOperator() {
		return op;
	}

	public AstNode getOperand() {
		return operand;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitUnaryExpression(this);
	}

	@Override
	protected List<AstNode> children() {
		return Collections.singletonList(operand);
	}

	@Override
	public String toString() {
		return super.toString() + " (" + op + ")";
	}
}
