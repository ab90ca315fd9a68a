package org.javai.dygram.model;

import java.util.Objects;

/**
 * A named, optionally typed attribute.
 *
 * @param name attribute name
 * @param type declared type such as {@code number} or {@code Array<string>}, or {@code null}
 * @param value literal value
 */
public record Attribute(String name, String type, AttributeValue value) {

	public Attribute {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(value, "value must not be null");
	}

	public static Attribute of(String name, AttributeValue value) {
		return new Attribute(name, null, value);
	}

	public Attribute withValue(AttributeValue newValue) {
		return new Attribute(name, type, newValue);
	}
}
