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
 * A <code>BEGIN ... END</code> sequence of statements.
 */
public final class CompoundStatementAst extends AstNode {

	private final List<AstNode> statements;

	public CompoundStatementAst(int lineNo, List<AstNode> statements) {
		super(lineNo);
		this.statements = Collections.unmodifiableList(new ArrayList<AstNode>(statements));
	}

	public List<AstNode> getStatements() {
		return statements;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitCompoundStatement(this);
	}

	@Override
	protected List<AstNode> children() {
		return statements;
	}
}
