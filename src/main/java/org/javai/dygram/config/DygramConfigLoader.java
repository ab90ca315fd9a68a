package org.javai.dygram.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import org.javai.dygram.diagnostics.Severity;
import org.javai.dygram.exec.ExecutionConfig;
import org.javai.dygram.validate.ValidationOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads {@link DygramConfig} from YAML. Missing keys keep their defaults; unknown sections are
 * rejected so that typos do not go unnoticed.
 *
 * <pre>
 * compile:
 *   autoCreateMissingNodes: false
 * validation:
 *   orphans: true
 *   cycleSeverity: warning
 * execution:
 *   maxSteps: 100
 *   decisionTimeoutMillis: 60000
 *   decisionRetries: 1
 * </pre>
 */
public class DygramConfigLoader {

	private static final Logger logger = LoggerFactory.getLogger(DygramConfigLoader.class);

	public static final String DEFAULT_RESOURCE = "dygram.yaml";

	private static final Set<String> SECTIONS = Set.of("compile", "validation", "execution");

	private final Yaml yaml = new Yaml();

	/**
	 * Loads {@value #DEFAULT_RESOURCE} from the classpath, or the defaults when it is absent.
	 */
	public DygramConfig loadDefault() {
		InputStream in = DygramConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
		if (in == null) {
			logger.debug("No {} on the classpath; using defaults", DEFAULT_RESOURCE);
			return DygramConfig.defaults();
		}
		try (in) {
			return load(in);
		} catch (IOException e) {
			throw new DygramConfigException("Failed to read " + DEFAULT_RESOURCE, e);
		}
	}

	public DygramConfig load(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return build(yaml.load(reader), path.toString());
		} catch (IOException | YAMLException e) {
			throw new DygramConfigException("Failed to read configuration from " + path, e);
		}
	}

	public DygramConfig load(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream), "input stream");
		} catch (YAMLException e) {
			throw new DygramConfigException("Failed to read configuration from input stream", e);
		}
	}

	public DygramConfig loadString(String content) {
		try {
			return build(yaml.load(content), "string");
		} catch (YAMLException e) {
			throw new DygramConfigException("Failed to read configuration from string", e);
		}
	}

	private DygramConfig build(Object data, String origin) {
		if (data == null) {
			return DygramConfig.defaults();
		}
		Map<String, Object> root = asMap(data, "root");
		for (String key : root.keySet()) {
			if (!SECTIONS.contains(key)) {
				throw new DygramConfigException("Unknown configuration section '%s' in %s".formatted(key, origin));
			}
		}
		Map<String, Object> compile = section(root, "compile");
		Map<String, Object> validation = section(root, "validation");
		Map<String, Object> execution = section(root, "execution");

		ValidationOptions defaults = ValidationOptions.defaults();
		ValidationOptions options = ValidationOptions.builder()
				.checkUnreachable(bool(validation, "unreachable", defaults.checkUnreachable()))
				.checkOrphans(bool(validation, "orphans", defaults.checkOrphans()))
				.checkCycles(bool(validation, "cycles", defaults.checkCycles()))
				.checkDuplicateStates(bool(validation, "duplicateStates", defaults.checkDuplicateStates()))
				.checkAnnotations(bool(validation, "annotations", defaults.checkAnnotations()))
				.checkMultiplicity(bool(validation, "multiplicity", defaults.checkMultiplicity()))
				.checkTypes(bool(validation, "types", defaults.checkTypes()))
				.inferDependencies(bool(validation, "dependencies", defaults.inferDependencies()))
				.cycleSeverity(severity(validation, "cycleSeverity", defaults.cycleSeverity()))
				.build();

		ExecutionConfig executionDefaults = ExecutionConfig.defaults();
		ExecutionConfig executionConfig;
		try {
			executionConfig = ExecutionConfig.builder()
					.maxSteps(integer(execution, "maxSteps", executionDefaults.maxSteps()))
					.decisionTimeout(Duration.ofMillis(integer(execution, "decisionTimeoutMillis",
							(int) executionDefaults.decisionTimeout().toMillis())))
					.decisionRetries(integer(execution, "decisionRetries", executionDefaults.decisionRetries()))
					.build();
		} catch (IllegalArgumentException e) {
			throw new DygramConfigException("Invalid execution settings in %s: %s".formatted(origin, e.getMessage()), e);
		}

		DygramConfig config = new DygramConfig(bool(compile, "autoCreateMissingNodes", false), options, executionConfig);
		logger.debug("Loaded configuration from {}: {}", origin, config);
		return config;
	}

	private Map<String, Object> section(Map<String, Object> root, String name) {
		Object value = root.get(name);
		return value == null ? Map.of() : asMap(value, name);
	}

	@SuppressWarnings("unchecked")
	private Map<String, Object> asMap(Object value, String name) {
		if (!(value instanceof Map<?, ?>)) {
			throw new DygramConfigException("Section '%s' must be a mapping".formatted(name));
		}
		return (Map<String, Object>) value;
	}

	private boolean bool(Map<String, Object> section, String key, boolean defaultValue) {
		Object value = section.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Boolean b) {
			return b;
		}
		throw new DygramConfigException("'%s' must be true or false, was '%s'".formatted(key, value));
	}

	private int integer(Map<String, Object> section, String key, int defaultValue) {
		Object value = section.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Integer i) {
			return i;
		}
		throw new DygramConfigException("'%s' must be an integer, was '%s'".formatted(key, value));
	}

	private Severity severity(Map<String, Object> section, String key, Severity defaultValue) {
		Object value = section.get(key);
		if (value == null) {
			return defaultValue;
		}
		try {
			return Severity.fromName(value.toString());
		} catch (IllegalArgumentException e) {
			throw new DygramConfigException("'%s' must be error, warning or info, was '%s'".formatted(key, value), e);
		}
	}
}
