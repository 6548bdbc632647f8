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
 * Declaration of one variable. <code>a, b : INTEGER</code> yields two of them.
 */
public final class VarDeclAst extends AstNode {

	private final String variableName;
	private final String typeName;

	public VarDeclAst(int lineNo, String variableName, String typeName) {
		super(lineNo);
		this.variableName = variableName;
		this.typeName = typeName;
	}

	public String getVariableName() {
		return variableName;
	}

	public String getTypeName() {
		return typeName;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitVarDecl(this);
	}

	@Override
	public String toString() {
		return super.toString() + " (" + variableName + " : " + typeName + ")";
	}
}
