package org.javai.dygram.model;

import java.util.Objects;

/**
 * {@code @Name} or {@code @Name("value")}.
 */
public record Annotation(String name, String value) {

	public Annotation {
		Objects.requireNonNull(name, "name must not be null");
	}

	public static Annotation of(String name) {
		return new Annotation(name, null);
	}
}
