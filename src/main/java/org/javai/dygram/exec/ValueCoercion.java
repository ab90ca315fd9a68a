package org.javai.dygram.exec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.javai.dygram.model.AttributeValue;

/**
 * Converts tool input values to attribute values, checking them against declared types.
 * Objects have no attribute representation and are stored as JSON text.
 */
public final class ValueCoercion {

	private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

	private ValueCoercion() {
	}

	/**
	 * @param declaredType declared attribute type, or {@code null} to accept any value
	 * @param input JSON value supplied by the decision-maker
	 * @throws ToolInvocationException when the value cannot be coerced
	 */
	public static AttributeValue coerce(String declaredType, JsonNode input) {
		if (input == null || input.isNull() || input.isMissingNode()) {
			throw new ToolInvocationException("A value is required");
		}
		if (declaredType == null || declaredType.isBlank()) {
			return infer(input);
		}
		String base = baseName(declaredType);
		return switch (base) {
			case "number", "float", "double" -> AttributeValue.number(number(declaredType, input));
			case "integer", "int" -> {
				BigDecimal value = number(declaredType, input);
				if (value.signum() != 0 && value.stripTrailingZeros().scale() > 0) {
					throw mismatch(declaredType, input);
				}
				yield AttributeValue.number(value);
			}
			case "boolean", "bool" -> {
				if (input.isBoolean()) {
					yield AttributeValue.bool(input.booleanValue());
				}
				if (input.isTextual() && (input.asText().equalsIgnoreCase("true") || input.asText().equalsIgnoreCase("false"))) {
					yield AttributeValue.bool(Boolean.parseBoolean(input.asText().toLowerCase(Locale.ROOT)));
				}
				throw mismatch(declaredType, input);
			}
			case "string" -> {
				if (input.isValueNode()) {
					yield AttributeValue.text(input.asText());
				}
				throw mismatch(declaredType, input);
			}
			case "array", "list" -> {
				JsonNode array = input;
				if (input.isTextual()) {
					array = parse(input.asText(), declaredType);
				}
				if (!array.isArray()) {
					throw mismatch(declaredType, input);
				}
				String element = elementType(declaredType);
				List<AttributeValue> items = new ArrayList<>();
				array.forEach(item -> items.add(coerce(element, item)));
				yield AttributeValue.list(items);
			}
			default -> infer(input);
		};
	}

	/**
	 * JSON schema type name for a declared attribute type.
	 */
	public static String schemaType(String declaredType) {
		if (declaredType == null) {
			return null;
		}
		return switch (baseName(declaredType)) {
			case "number", "float", "double" -> "number";
			case "integer", "int" -> "integer";
			case "boolean", "bool" -> "boolean";
			case "string" -> "string";
			case "array", "list" -> "array";
			default -> null;
		};
	}

	/**
	 * JSON representation of an attribute value.
	 */
	public static JsonNode toJson(AttributeValue value) {
		return JSON_MAPPER.valueToTree(value.toJava());
	}

	private static AttributeValue infer(JsonNode input) {
		if (input.isNumber()) {
			return AttributeValue.number(input.decimalValue());
		}
		if (input.isBoolean()) {
			return AttributeValue.bool(input.booleanValue());
		}
		if (input.isTextual()) {
			return AttributeValue.text(input.asText());
		}
		if (input.isArray()) {
			List<AttributeValue> items = new ArrayList<>();
			input.forEach(item -> items.add(infer(item)));
			return AttributeValue.list(items);
		}
		return AttributeValue.text(input.toString());
	}

	private static BigDecimal number(String declaredType, JsonNode input) {
		if (input.isNumber()) {
			return input.decimalValue();
		}
		if (input.isTextual()) {
			try {
				return new BigDecimal(input.asText().trim());
			} catch (NumberFormatException e) {
				throw mismatch(declaredType, input);
			}
		}
		throw mismatch(declaredType, input);
	}

	private static JsonNode parse(String text, String declaredType) {
		try {
			return JSON_MAPPER.readTree(text);
		} catch (JsonProcessingException e) {
			throw new ToolInvocationException("Value '%s' is not a valid %s".formatted(text, declaredType), e);
		}
	}

	private static ToolInvocationException mismatch(String declaredType, JsonNode input) {
		return new ToolInvocationException("Value %s does not match declared type %s".formatted(input, declaredType));
	}

	private static String baseName(String type) {
		int generic = type.indexOf('<');
		String base = generic >= 0 ? type.substring(0, generic) : type;
		return base.trim().toLowerCase(Locale.ROOT);
	}

	private static String elementType(String type) {
		int open = type.indexOf('<');
		int close = type.lastIndexOf('>');
		return open < 0 || close <= open ? null : type.substring(open + 1, close).trim();
	}
}
