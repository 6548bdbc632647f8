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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Declarations followed by the compound statement they apply to.
 * The declarations are {@link VarDeclAst} and {@link ProcedureDeclAst}
 * nodes in source order.
 */
public final class BlockAst extends AstNode {

	private final List<AstNode> declarations;
	private final CompoundStatementAst compoundStatement;

	public BlockAst(int lineNo, List<AstNode> declarations, CompoundStatementAst compoundStatement) {
		super(lineNo);
		this.declarations = Collections.unmodifiableList(new ArrayList<AstNode>(declarations));
		this.compoundStatement = compoundStatement;
	}

	public List<AstNode> getDeclarations() {
		return declarations;
	}

	public CompoundStatementAst getCompoundStatement() {
		return compoundStatement;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitBlock(this);
	}

	@Override
	protected List<AstNode> children() {
		List<AstNode> children = new ArrayList<AstNode>(declarations);
		children.add(compoundStatement);
		return children;
	}
}
