package org.javai.dygram.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.javai.dygram.build.CompilationResult;
import org.javai.dygram.build.MachineCompiler;
import org.javai.dygram.config.DygramConfig;
import org.javai.dygram.diagnostics.Diagnostic;
import org.javai.dygram.diagram.DotGenerator;
import org.javai.dygram.exec.DecisionMaker;
import org.javai.dygram.exec.ExecutionEngine;
import org.javai.dygram.exec.ExecutionFault;
import org.javai.dygram.exec.ExecutionResult;
import org.javai.dygram.exec.MachineRunner;
import org.javai.dygram.json.MachineJsonMapper;
import org.javai.dygram.model.Machine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The named operations behind the command line. Each returns the process exit code:
 * {@value #OK} on success, {@value #FAILED} when the source has errors or the run failed.
 */
public class DygramCommands {

	private static final Logger logger = LoggerFactory.getLogger(DygramCommands.class);

	public static final int OK = 0;
	public static final int FAILED = 1;

	private final DygramConfig config;
	private final PrintStream out;
	private final PrintStream err;
	private final MachineJsonMapper jsonMapper = new MachineJsonMapper();

	public DygramCommands(DygramConfig config, PrintStream out, PrintStream err) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.out = Objects.requireNonNull(out, "out must not be null");
		this.err = Objects.requireNonNull(err, "err must not be null");
	}

	/**
	 * Parses and validates a file, printing every diagnostic.
	 */
	public int validate(Path source) {
		CompilationResult result = compile(source);
		if (result == null) {
			return FAILED;
		}
		if (!result.hasErrors()) {
			out.printf("%s: %d nodes, %d edges, %d warnings%n", source, result.machine().nodes().size(),
					result.machine().edges().size(), result.warnings().size());
		}
		return result.hasErrors() ? FAILED : OK;
	}

	/**
	 * Writes the canonical JSON of a file to {@code target}, or to standard output when
	 * {@code target} is {@code null}.
	 */
	public int json(Path source, Path target) {
		CompilationResult result = compile(source);
		if (result == null || result.hasErrors()) {
			return FAILED;
		}
		return emit(jsonMapper.toJson(result.machine()), target);
	}

	/**
	 * Writes a Graphviz DOT diagram of a file.
	 */
	public int dot(Path source, Path target) {
		CompilationResult result = compile(source);
		if (result == null || result.hasErrors()) {
			return FAILED;
		}
		return emit(new DotGenerator().generate(result.machine()), target);
	}

	/**
	 * Runs a file against a decision-maker and prints the run report as JSON.
	 */
	public int run(Path source, DecisionMaker decisionMaker) {
		CompilationResult result = compile(source);
		if (result == null || result.hasErrors()) {
			return FAILED;
		}
		Machine machine = result.machine();
		MachineRunner runner = new MachineRunner(new ExecutionEngine(), decisionMaker, config.execution());
		ExecutionResult execution;
		try {
			execution = runner.run(machine);
		} catch (ExecutionFault e) {
			err.println("error: " + e.getMessage());
			return FAILED;
		}
		out.println(jsonMapper.toJson(execution));
		return execution.completed() ? OK : FAILED;
	}

	private CompilationResult compile(Path source) {
		String text;
		try {
			text = Files.readString(source, StandardCharsets.UTF_8);
		} catch (IOException e) {
			logger.debug("Cannot read {}", source, e);
			err.println("error: cannot read " + source + ": " + e.getMessage());
			return null;
		}
		CompilationResult result = new MachineCompiler(config).compile(text);
		for (Diagnostic diagnostic : result.diagnostics()) {
			err.println(source + ": " + diagnostic);
		}
		return result;
	}

	private int emit(String content, Path target) {
		if (target == null) {
			out.print(content);
			return OK;
		}
		try {
			Files.writeString(target, content, StandardCharsets.UTF_8);
			out.println("wrote " + target);
			return OK;
		} catch (IOException e) {
			err.println("error: cannot write " + target + ": " + e.getMessage());
			return FAILED;
		}
	}
}
