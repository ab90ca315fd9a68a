package org.javai.dygram.exec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.util.List;
import org.javai.dygram.model.AttributeValue;
import org.junit.jupiter.api.Test;

class ValueCoercionTest {

	private static final ObjectMapper JSON = new ObjectMapper();

	@Test
	void untypedValuesKeepTheirJsonKind() {
		assertThat(ValueCoercion.coerce(null, json("3.5"))).isEqualTo(AttributeValue.number(new BigDecimal("3.5")));
		assertThat(ValueCoercion.coerce(null, json("true"))).isEqualTo(AttributeValue.bool(true));
		assertThat(ValueCoercion.coerce(null, json("\"hi\""))).isEqualTo(AttributeValue.text("hi"));
		assertThat(ValueCoercion.coerce(null, json("{\"a\":1}"))).isEqualTo(AttributeValue.text("{\"a\":1}"));
	}

	@Test
	void numericTextIsAcceptedForNumbers() {
		assertThat(ValueCoercion.coerce("number", json("\" 12.5 \""))).isEqualTo(AttributeValue.number(new BigDecimal("12.5")));
		assertThat(ValueCoercion.coerce("integer", json("4.0"))).isEqualTo(AttributeValue.number(4));
	}

	@Test
	void fractionIsNotAnInteger() {
		assertThatThrownBy(() -> ValueCoercion.coerce("integer", json("4.5")))
				.isInstanceOf(ToolInvocationException.class)
				.hasMessageContaining("does not match declared type integer");
	}

	@Test
	void booleansAcceptTextualForms() {
		assertThat(ValueCoercion.coerce("boolean", json("\"FALSE\""))).isEqualTo(AttributeValue.bool(false));
		assertThatThrownBy(() -> ValueCoercion.coerce("boolean", json("1")))
				.isInstanceOf(ToolInvocationException.class);
	}

	@Test
	void typedArraysCoerceEachElement() {
		assertThat(ValueCoercion.coerce("Array<number>", json("[1, \"2\"]")))
				.isEqualTo(AttributeValue.list(List.of(AttributeValue.number(1), AttributeValue.number(2))));
		assertThat(ValueCoercion.coerce("Array<string>", json("\"[\\\"a\\\"]\"")))
				.isEqualTo(AttributeValue.list(List.of(AttributeValue.text("a"))));
		assertThatThrownBy(() -> ValueCoercion.coerce("Array<number>", json("[\"x\"]")))
				.isInstanceOf(ToolInvocationException.class);
	}

	@Test
	void missingValueIsRejected() {
		assertThatThrownBy(() -> ValueCoercion.coerce("string", null))
				.isInstanceOf(ToolInvocationException.class)
				.hasMessage("A value is required");
	}

	@Test
	void schemaTypesFollowDeclaredTypes() {
		assertThat(ValueCoercion.schemaType("Integer")).isEqualTo("integer");
		assertThat(ValueCoercion.schemaType("Array<string>")).isEqualTo("array");
		assertThat(ValueCoercion.schemaType("Duration")).isNull();
		assertThat(ValueCoercion.schemaType(null)).isNull();
	}

	private static JsonNode json(String text) {
		try {
			return JSON.readTree(text);
		} catch (Exception e) {
			throw new IllegalArgumentException(e);
		}
	}
}
