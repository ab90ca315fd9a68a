package org.javai.dygram.cli;

import static org.assertj.core.api.Assertions.assertThat;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {

	@TempDir
	Path dir;

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();
	private final Main main = new Main(new PrintStream(out, true, StandardCharsets.UTF_8),
			new PrintStream(err, true, StandardCharsets.UTF_8));

	@Test
	void validatesFileWithDefaultConfiguration() throws IOException {
		Path source = Files.writeString(dir.resolve("ok.dy"), "init start; state done; start -> done;");

		assertThat(main.execute(new String[] {"validate", source.toString()})).isZero();
		assertThat(out.toString(StandardCharsets.UTF_8)).contains("2 nodes, 1 edges");
	}

	@Test
	void configFileChangesCompilation() throws IOException {
		Path source = Files.writeString(dir.resolve("loose.dy"), "init start; start -> later;");
		Path config = Files.writeString(dir.resolve("dygram.yaml"), """
				compile:
				  autoCreateMissingNodes: true
				""");

		assertThat(main.execute(new String[] {"validate", source.toString()})).isEqualTo(1);
		assertThat(main.execute(new String[] {"validate", source.toString(), "--config", config.toString()})).isZero();
	}

	@Test
	void outOptionWritesTarget() throws IOException {
		Path source = Files.writeString(dir.resolve("ok.dy"), "init start; state done; start -> done;");
		Path target = dir.resolve("ok.json");

		assertThat(main.execute(new String[] {"json", source.toString(), "--out", target.toString()})).isZero();
		assertThat(target).exists();
	}

	@Test
	void runUsesFirstTransition() throws IOException {
		Path source = Files.writeString(dir.resolve("ok.dy"), "init start; state done; start -> done;");

		assertThat(main.execute(new String[] {"run", source.toString()})).isZero();
		assertThat(out.toString(StandardCharsets.UTF_8)).contains("\"status\" : \"COMPLETED\"");
	}

	@Test
	void badConfigurationIsReported() throws IOException {
		Path source = Files.writeString(dir.resolve("ok.dy"), "init start;");
		Path config = Files.writeString(dir.resolve("bad.yaml"), "runtime:\n  threads: 4\n");

		assertThat(main.execute(new String[] {"validate", source.toString(), "--config", config.toString()})).isEqualTo(1);
		assertThat(err.toString(StandardCharsets.UTF_8)).contains("Unknown configuration section 'runtime'");
	}

	@Test
	void usageIsPrintedForBadArguments() {
		assertThat(main.execute(new String[] {})).isEqualTo(1);
		assertThat(main.execute(new String[] {"render", "x.dy"})).isEqualTo(1);
		assertThat(main.execute(new String[] {"validate", "x.dy", "--verbose"})).isEqualTo(1);
		assertThat(err.toString(StandardCharsets.UTF_8)).contains(Main.USAGE);
	}
}
