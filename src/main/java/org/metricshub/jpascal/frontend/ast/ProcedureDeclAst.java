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

/**
 * <code>PROCEDURE name; block;</code>
 * <p>
 * The body is parsed and kept in the tree, but procedures can be neither
 * called nor checked: both passes skip it.
 */
public final class ProcedureDeclAst extends AstNode {

	private final String name;
	private final BlockAst block;

	public ProcedureDeclAst(int lineNo, String name, BlockAst block) {
		super(lineNo);
		this.name = name;
		this.block = block;
	}

	public String getName() {
		return name;
	}

	public BlockAst getBlock() {
		return block;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitProcedureDecl(this);
	}

	@Override
	protected List<AstNode> children() {
		return Collections.<AstNode>singletonList(block);
	}

	@Override
	public String toString() {
		return super.toString() + " (" + name + ")";
	}
}
