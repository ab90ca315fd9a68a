package org.javai.dygram.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Literal value of a node, machine or edge attribute.
 */
public sealed interface AttributeValue {

	/**
	 * Renders the value the way it would appear in source text, without string quoting.
	 */
	String asText();

	/**
	 * Converts the value to a plain Java object: {@link String}, {@link BigDecimal},
	 * {@link Boolean} or a {@link List} of those.
	 */
	Object toJava();

	static AttributeValue text(String value) {
		return new Text(value);
	}

	static AttributeValue number(BigDecimal value) {
		return new Number(value);
	}

	static AttributeValue number(long value) {
		return new Number(BigDecimal.valueOf(value));
	}

	static AttributeValue bool(boolean value) {
		return new Bool(value);
	}

	static AttributeValue list(List<AttributeValue> items) {
		return new ListValue(items);
	}

	/**
	 * Wraps a plain Java value; the inverse of {@link #toJava()}.
	 */
	static AttributeValue fromJava(Object value) {
		if (value == null) {
			return new Text("null");
		}
		if (value instanceof AttributeValue av) {
			return av;
		}
		if (value instanceof BigDecimal bd) {
			return new Number(bd);
		}
		if (value instanceof java.lang.Number n) {
			return new Number(new BigDecimal(n.toString()));
		}
		if (value instanceof Boolean b) {
			return new Bool(b);
		}
		if (value instanceof List<?> items) {
			return new ListValue(items.stream().map(AttributeValue::fromJava).toList());
		}
		return new Text(value.toString());
	}

	record Text(String value) implements AttributeValue {
		public Text {
			Objects.requireNonNull(value, "value must not be null");
		}

		@Override
		public String asText() {
			return value;
		}

		@Override
		public Object toJava() {
			return value;
		}
	}

	/**
	 * Numeric literal. Equality ignores scale so that {@code 1.0} equals {@code 1}.
	 */
	record Number(BigDecimal value) implements AttributeValue {
		public Number {
			Objects.requireNonNull(value, "value must not be null");
		}

		@Override
		public String asText() {
			return value.toPlainString();
		}

		@Override
		public Object toJava() {
			return value;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Number other && value.compareTo(other.value) == 0;
		}

		@Override
		public int hashCode() {
			return value.signum() == 0 ? 0 : value.stripTrailingZeros().hashCode();
		}
	}

	record Bool(boolean value) implements AttributeValue {
		@Override
		public String asText() {
			return Boolean.toString(value);
		}

		@Override
		public Object toJava() {
			return value;
		}
	}

	record ListValue(List<AttributeValue> items) implements AttributeValue {
		public ListValue {
			items = List.copyOf(items);
		}

		@Override
		public String asText() {
			return items.stream().map(AttributeValue::asText).collect(Collectors.joining(", ", "[", "]"));
		}

		@Override
		public Object toJava() {
			return items.stream().map(AttributeValue::toJava).toList();
		}
	}
}
