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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps names to {@link Symbol}s for one program.
 * <p>
 * The table is flat: there is one table per run and no nested scopes,
 * so declarations inside procedures never reach it. Names are unique,
 * and the predefined types count as names. Symbols are kept in the
 * order they were defined.
 */
public class SymbolTable {

	private final Map<String, Symbol> symbols = new LinkedHashMap<String, Symbol>();

	/**
	 * Creates a table holding only the built-in types.
	 */
	public SymbolTable() {
		initBuiltins();
	}

	private void initBuiltins() {
		define(new BuiltinTypeSymbol("INTEGER"));
		define(new BuiltinTypeSymbol("REAL"));
	}

	/**
	 * Adds a symbol unless its name is already taken.
	 *
	 * @param symbol the symbol to add
	 * @return {@code true} if the symbol was added, {@code false} if the name already exists
	 */
	public boolean define(Symbol symbol) {
		return symbols.putIfAbsent(symbol.getName(), symbol) == null;
	}

	/**
	 * @param name name to look up, in any case
	 * @return the symbol, or {@code null} if the name is not defined
	 */
	public Symbol lookup(String name) {
		return symbols.get(name.toUpperCase(Locale.ROOT));
	}

	/**
	 * @return all symbols, built-in types first, in definition order
	 */
	public Collection<Symbol> getSymbols() {
		return Collections.unmodifiableCollection(symbols.values());
	}

	public int size() {
		return symbols.size();
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		String header = "Symbol table contents";
		List<String> lines = new ArrayList<String>();
		lines.add(header);
		StringBuilder underline = new StringBuilder();
		for (int i = 0; i < header.length(); i++) {
			underline.append('_');
		}
		lines.add(underline.toString());
		for (Map.Entry<String, Symbol> entry : symbols.entrySet()) {
			lines.add(String.format(Locale.ROOT, "%7s: %s", entry.getKey(), entry.getValue()));
		}
		return String.join(System.lineSeparator(), lines) + System.lineSeparator();
	}
}
