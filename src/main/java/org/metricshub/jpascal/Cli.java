package org.metricshub.jpascal;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Map;
import org.metricshub.jpascal.frontend.ast.ProgramAst;
import org.metricshub.jpascal.util.PascalLogger;
import org.metricshub.jpascal.util.PascalSettings;
import org.metricshub.jpascal.util.ScriptFileSource;
import org.metricshub.jpascal.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Command-line interface for Jpascal.
 */
public final class Cli {

	private static final Logger LOG = PascalLogger.getLogger(Cli.class);

	/** Exit code of a successful run. */
	public static final int EXIT_OK = 0;

	/** Exit code when the program fails in any stage. */
	public static final int EXIT_PROGRAM_ERROR = 1;

	/** Exit code when the command line itself is invalid. */
	public static final int EXIT_USAGE_ERROR = 2;

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "jpascal.jar";
		}
		JAR_NAME = myName;
	}

	private final PascalSettings settings = new PascalSettings();
	private final PrintStream out;
	private final PrintStream err;

	private ScriptSource scriptSource;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output and error streams.
	 */
	public Cli() {
		this(System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param out stream where reports are written
	 * @param err stream where error messages are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out, PrintStream err) {
		this.out = out;
		this.err = err;
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link PascalSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PascalSettings getSettings() {
		return settings;
	}

	/**
	 * @return the program source given on the command line, or {@code null}
	 */
	public ScriptSource getScriptSource() {
		return scriptSource;
	}

	public boolean isPrintUsage() {
		return printUsage;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 * @throws IllegalArgumentException upon an unknown or incomplete option
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options
				break;
			} else if (arg.equals("-f")) {
				// -f filename : load program from file
				checkParameterHasArgument(args, argIdx);
				if (scriptSource != null) {
					throw new IllegalArgumentException("Only one program may be specified.");
				}
				scriptSource = new ScriptFileSource(args[++argIdx]);
			} else if (arg.equals("--dump-syntax")) {
				// --dump-syntax : print the syntax tree and stop
				settings.setDumpSyntaxTree(true);
			} else if (arg.equals("--no-semantic")) {
				settings.setSemanticCheck(false);
			} else if (arg.equals("-q")) {
				settings.setPrintSymbolTable(false);
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (scriptSource == null) {
			if (argIdx >= args.length) {
				throw new IllegalArgumentException("Program not provided.");
			}
			scriptSource = ScriptSource.fromString(args[argIdx++]);
		}

		if (argIdx < args.length) {
			throw new IllegalArgumentException("Unexpected argument: " + args[argIdx]);
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws IOException if the program file cannot be read
	 * @throws PascalException upon the first failure of the program
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}

		if (LOG.isDebugEnabled()) {
			LOG.debug("Running {} with settings:\n{}", scriptSource, settings.toDescriptionString());
		}
		PrintStream output = settings.getOutputStream();
		Pascal pascal = new Pascal(settings);
		ProgramAst program = pascal.compile(scriptSource);
		if (settings.isDumpSyntaxTree()) {
			program.dump(output);
			return;
		}

		ExecutionResult result = pascal.run(program);
		if (settings.isPrintSymbolTable() && result.getSymbolTable() != null) {
			output.print(result.getSymbolTable());
			output.println();
		}
		for (Map.Entry<String, Number> variable : result.getVariables().entrySet()) {
			output.println(variable.getKey() + " = " + variable.getValue());
		}
	}

	/**
	 * Parses the arguments, runs the program and reports any failure on the
	 * error stream.
	 *
	 * @param args command-line arguments
	 * @return the process exit code
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public int execute(String[] args) {
		try {
			parse(args);
		} catch (IllegalArgumentException e) {
			err.println(e.getMessage());
			err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			return EXIT_USAGE_ERROR;
		}
		try {
			run();
			return EXIT_OK;
		} catch (PascalException e) {
			LOG.debug("Program failed", e);
			if (e.getLineNumber() >= 0) {
				err.printf("%s (line %d): %s\n", e.getKind().getDisplayName(), e.getLineNumber(), e.getMessage());
			} else {
				err.printf("%s: %s\n", e.getKind().getDisplayName(), e.getMessage());
			}
			return EXIT_PROGRAM_ERROR;
		} catch (IOException | UncheckedIOException e) {
			LOG.debug("Cannot read program", e);
			err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			return EXIT_PROGRAM_ERROR;
		}
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest.println("java -jar " + JAR_NAME + " [-f program-filename] [--dump-syntax] [--no-semantic] [-q] [program]");
		dest.println();
		dest.println(" -f filename = Use contents of filename for the program.");
		dest.println(" --dump-syntax = Print the syntax tree and stop.");
		dest.println(" --no-semantic = Skip the declaration check.");
		dest.println(" -q = Do not print the symbol table.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}
}
