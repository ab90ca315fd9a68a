package org.javai.dygram.cli;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.javai.dygram.config.DygramConfig;
import org.javai.dygram.config.DygramConfigException;
import org.javai.dygram.config.DygramConfigLoader;
import org.javai.dygram.exec.FirstTransitionDecisionMaker;

/**
 * Command line entry point.
 *
 * <pre>
 * dygram validate|json|dot|run &lt;file&gt; [--config &lt;yaml&gt;] [--out &lt;file&gt;]
 * </pre>
 *
 * {@code run} uses {@link FirstTransitionDecisionMaker}; other decision-makers are wired
 * through {@link DygramCommands#run} directly.
 */
public class Main {

	static final String USAGE = "usage: dygram validate|json|dot|run <file> [--config <yaml>] [--out <file>]";

	private final PrintStream out;
	private final PrintStream err;

	public Main(PrintStream out, PrintStream err) {
		this.out = out;
		this.err = err;
	}

	public static void main(String[] args) {
		System.exit(new Main(System.out, System.err).execute(args));
	}

	public int execute(String[] args) {
		List<String> positional = new ArrayList<>();
		Path configPath = null;
		Path outPath = null;
		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			if ((arg.equals("--config") || arg.equals("--out")) && i + 1 < args.length) {
				Path value = Path.of(args[++i]);
				if (arg.equals("--config")) {
					configPath = value;
				} else {
					outPath = value;
				}
			} else if (arg.startsWith("--")) {
				err.println(USAGE);
				return DygramCommands.FAILED;
			} else {
				positional.add(arg);
			}
		}
		if (positional.size() != 2) {
			err.println(USAGE);
			return DygramCommands.FAILED;
		}

		DygramConfig config;
		try {
			DygramConfigLoader loader = new DygramConfigLoader();
			config = configPath == null ? loader.loadDefault() : loader.load(configPath);
		} catch (DygramConfigException e) {
			err.println("error: " + e.getMessage());
			return DygramCommands.FAILED;
		}

		DygramCommands commands = new DygramCommands(config, out, err);
		Path source = Path.of(positional.get(1));
		return switch (positional.get(0)) {
			case "validate" -> commands.validate(source);
			case "json" -> commands.json(source, outPath);
			case "dot" -> commands.dot(source, outPath);
			case "run" -> commands.run(source, new FirstTransitionDecisionMaker());
			default -> {
				err.println(USAGE);
				yield DygramCommands.FAILED;
			}
		};
	}
}
