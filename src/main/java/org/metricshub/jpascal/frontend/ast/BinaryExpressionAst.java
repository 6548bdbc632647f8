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

import java.util.Arrays;
import java.util.List;
import org.metricshub.jpascal.frontend.TokenType;

/**
 * <code>left op right</code>, where op is one of
 * {@link TokenType#PLUS}, {@link TokenType#MINUS}, {@link TokenType#MUL},
 * {@link TokenType#INTEGER_DIV} and {@link TokenType#FLOAT_DIV}.
 */
public final class BinaryExpressionAst extends AstNode {

	private final AstNode left;
	private final TokenType op;
	private final AstNode right;

	public BinaryExpressionAst(int lineNo, AstNode left, TokenType op, AstNode right) {
		super(lineNo);
		this.left = left;
		this.op = op;
		this.right = right;
	}

	public AstNode getLeft() {
		return left;
	}

	public TokenType getOperator() {
		return op;
	}

	public AstNode getRight() {
		return right;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitBinaryExpression(this);
	}

	@Override
	protected List<AstNode> children() {
		return Arrays.asList(left, right);
	}

	@Override
	public String toString() {
		return super.toString() + " (" + op + ")";
	}
}
