package org.javai.dygram.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.javai.dygram.diagnostics.Severity;
import org.javai.dygram.exec.ExecutionConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DygramConfigLoaderTest {

	private final DygramConfigLoader loader = new DygramConfigLoader();

	@Test
	void emptyDocumentYieldsDefaults() {
		assertThat(loader.loadString("")).isEqualTo(DygramConfig.defaults());
	}

	@Test
	void readsEverySection() {
		DygramConfig config = loader.loadString("""
				compile:
				  autoCreateMissingNodes: true
				validation:
				  orphans: false
				  cycleSeverity: error
				execution:
				  maxSteps: 12
				  decisionTimeoutMillis: 2500
				  decisionRetries: 0
				""");

		assertThat(config.autoCreateMissingNodes()).isTrue();
		assertThat(config.validation().checkOrphans()).isFalse();
		assertThat(config.validation().checkCycles()).isTrue();
		assertThat(config.validation().cycleSeverity()).isEqualTo(Severity.ERROR);
		assertThat(config.execution().maxSteps()).isEqualTo(12);
		assertThat(config.execution().decisionTimeout()).isEqualTo(Duration.ofMillis(2500));
		assertThat(config.execution().decisionRetries()).isZero();
	}

	@Test
	void rejectsUnknownSection() {
		assertThatThrownBy(() -> loader.loadString("runtime:\n  maxSteps: 3\n"))
				.isInstanceOf(DygramConfigException.class)
				.hasMessageContaining("Unknown configuration section 'runtime'");
	}

	@Test
	void rejectsWronglyTypedValues() {
		assertThatThrownBy(() -> loader.loadString("validation:\n  orphans: sometimes\n"))
				.isInstanceOf(DygramConfigException.class)
				.hasMessageContaining("'orphans' must be true or false");
		assertThatThrownBy(() -> loader.loadString("execution:\n  maxSteps: many\n"))
				.isInstanceOf(DygramConfigException.class)
				.hasMessageContaining("'maxSteps' must be an integer");
		assertThatThrownBy(() -> loader.loadString("validation:\n  cycleSeverity: fatal\n"))
				.isInstanceOf(DygramConfigException.class)
				.hasMessageContaining("'cycleSeverity'");
	}

	@Test
	void rejectsOutOfRangeExecutionSettings() {
		assertThatThrownBy(() -> loader.loadString("execution:\n  maxSteps: 0\n"))
				.isInstanceOf(DygramConfigException.class)
				.hasMessageContaining("maxSteps must be positive")
				.hasCauseInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void wrapsMalformedYaml() {
		assertThatThrownBy(() -> loader.loadString("execution: [unclosed"))
				.isInstanceOf(DygramConfigException.class)
				.hasMessageContaining("Failed to read configuration from string");
	}

	@Test
	void loadsFromFileAndStream(@TempDir Path directory) throws Exception {
		Path file = directory.resolve("dygram.yaml");
		Files.writeString(file, "execution:\n  maxSteps: 7\n");

		assertThat(loader.load(file).execution().maxSteps()).isEqualTo(7);
		assertThat(loader.load(new ByteArrayInputStream("compile:\n  autoCreateMissingNodes: true\n"
				.getBytes(StandardCharsets.UTF_8))).autoCreateMissingNodes()).isTrue();
	}

	@Test
	void missingFileIsAConfigError(@TempDir Path directory) {
		assertThatThrownBy(() -> loader.load(directory.resolve("absent.yaml")))
				.isInstanceOf(DygramConfigException.class)
				.hasMessageContaining("absent.yaml");
	}

	@Test
	void loadsClasspathDefaults() {
		DygramConfig config = loader.loadDefault();

		assertThat(config.autoCreateMissingNodes()).isFalse();
		assertThat(config.execution().maxSteps()).isEqualTo(ExecutionConfig.DEFAULT_MAX_STEPS);
		assertThat(config.validation().cycleSeverity()).isEqualTo(Severity.WARNING);
	}

	@Test
	void builderOverridesDefaults() {
		DygramConfig config = DygramConfig.builder()
				.autoCreateMissingNodes(true)
				.execution(ExecutionConfig.builder().maxSteps(5).build())
				.build();

		assertThat(config.autoCreateMissingNodes()).isTrue();
		assertThat(config.execution().maxSteps()).isEqualTo(5);
		assertThat(config.validation()).isEqualTo(DygramConfig.defaults().validation());
	}
}
