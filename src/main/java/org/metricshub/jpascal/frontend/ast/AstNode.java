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

import java.io.PrintStream;
import java.util.Collections;
import java.util.List;

/**
 * A node of the abstract syntax tree built by the parser.
 * <p>
 * Each node owns its children: the tree has no shared nodes and no
 * back references, and it is never modified once the parser returns it.
 * The passes over the tree are {@link AstVisitor} implementations.
 */
public abstract class AstNode {

	private final int lineNo;

	protected AstNode(int lineNo) {
		this.lineNo = lineNo;
	}

	/**
	 * @return the line where the construct starts in the source
	 */
	public final int getLineNumber() {
		return lineNo;
	}

	/**
	 * Dispatches to the visitor method matching the concrete node class.
	 *
	 * @param visitor the pass to apply
	 * @param <R> result type of the pass
	 * @return whatever the visitor returns for this node
	 */
	public abstract <R> R accept(AstVisitor<R> visitor);

	/**
	 * @return the direct children of this node, in source order
	 */
	protected List<AstNode> children() {
		return Collections.emptyList();
	}

	/**
	 * Dump a meaningful text representation of this
	 * abstract syntax tree node, and of its children,
	 * to the output (print) stream.
	 *
	 * @param ps The print stream to dump the text representation.
	 */
	public void dump(PrintStream ps) {
		dump(ps, 0);
	}

	private void dump(PrintStream ps, int lvl) {
		StringBuilder spaces = new StringBuilder();
		for (int i = 0; i < lvl; i++) {
			spaces.append(' ');
		}
		ps.println(spaces + toString());
		for (AstNode child : children()) {
			child.dump(ps, lvl + 1);
		}
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getClass().getSimpleName();
	}
}
