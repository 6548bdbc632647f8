package org.metricshub.jpascal.backend;

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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The global variables of one program run.
 * <p>
 * A variable exists here only once it has been assigned; a declared
 * but unassigned variable is absent. Entries keep first-assignment order.
 */
public class GlobalScope {

	private final Map<String, Number> variables = new LinkedHashMap<String, Number>();

	/**
	 * @param name uppercased variable name
	 * @return the current value, or {@code null} if the variable was never assigned
	 */
	public Number getVariable(String name) {
		return variables.get(name);
	}

	/**
	 * Stores a value, overwriting any previous one.
	 *
	 * @param name uppercased variable name
	 * @param value a {@link Long} or a {@link Double}
	 */
	public void setVariable(String name, Number value) {
		variables.put(name, value);
	}

	public boolean isAssigned(String name) {
		return variables.containsKey(name);
	}

	public int size() {
		return variables.size();
	}

	/**
	 * @return an unmodifiable copy of the current contents
	 */
	public Map<String, Number> snapshot() {
		return Collections.unmodifiableMap(new LinkedHashMap<String, Number>(variables));
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return variables.toString();
	}
}
