package org.metricshub.jpascal.jsr223;

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

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.Map;
import javax.script.AbstractScriptEngine;
import javax.script.Bindings;
import javax.script.ScriptContext;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptException;
import javax.script.SimpleBindings;
import org.metricshub.jpascal.ExecutionResult;
import org.metricshub.jpascal.Pascal;
import org.metricshub.jpascal.PascalException;
import org.metricshub.jpascal.util.ScriptSource;

/**
 * Simple JSR-223 script engine for Jpascal.
 * <p>
 * Each call to <code>eval</code> runs a whole program. The final global
 * variables are copied into the engine scope bindings and returned as a map.
 */
public class PascalScriptEngine extends AbstractScriptEngine {

	private final ScriptEngineFactory factory;

	public PascalScriptEngine(ScriptEngineFactory factory) {
		this.factory = factory;
	}

	@Override
	public Object eval(Reader scriptReader, ScriptContext context) throws ScriptException {
		try {
			Pascal pascal = new Pascal();
			ExecutionResult result = pascal.run(new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, scriptReader));
			Map<String, Number> variables = result.getVariables();
			Bindings bindings = context.getBindings(ScriptContext.ENGINE_SCOPE);
			if (bindings != null) {
				bindings.putAll(variables);
			}
			return variables;
		} catch (PascalException e) {
			ScriptException se = new ScriptException(
					e.getKind().getDisplayName() + ": " + e.getMessage(),
					e.getSourceDescription(),
					e.getLineNumber());
			se.initCause(e);
			throw se;
		} catch (IOException e) {
			throw new ScriptException(e);
		}
	}

	@Override
	public Object eval(String script, ScriptContext context) throws ScriptException {
		return eval(new StringReader(script), context);
	}

	@Override
	public Bindings createBindings() {
		return new SimpleBindings();
	}

	@Override
	public ScriptEngineFactory getFactory() {
		return factory;
	}
}
