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
 * Root of the tree: <code>PROGRAM name; block.</code>
 */
public final class ProgramAst extends AstNode {

	private final String name;
	private final BlockAst block;
	private final String sourceDescription;

	public ProgramAst(int lineNo, String name, BlockAst block, String sourceDescription) {
		super(lineNo);
		this.name = name;
		this.block = block;
		this.sourceDescription = sourceDescription;
	}

	public String getName() {
		return name;
	}

	public BlockAst getBlock() {
		return block;
	}

	/**
	 * @return where the program text came from, for error messages
	 */
	public String getSourceDescription() {
		return sourceDescription;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitProgram(this);
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
