package org.javai.dygram.validate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.javai.dygram.diagnostics.Diagnostic;
import org.javai.dygram.diagnostics.DiagnosticKind;
import org.javai.dygram.model.Attribute;
import org.javai.dygram.model.AttributeValue;
import org.javai.dygram.model.Machine;
import org.javai.dygram.model.MachineNode;

/**
 * Checks attribute values against their declared types. Known types are {@code string},
 * {@code number}, {@code integer}, {@code boolean} and {@code Array<T>} / {@code List<T>};
 * other declared types are accepted as they are.
 */
public class AttributeTypeChecker {

	public List<Diagnostic> check(Machine machine) {
		List<Diagnostic> diagnostics = new ArrayList<>();
		for (Attribute attribute : machine.attributes()) {
			mismatch(attribute).ifPresent(reason -> diagnostics.add(diagnostic("machine", attribute, reason, null)));
		}
		for (MachineNode node : machine.nodes()) {
			String path = machine.qualifiedName(node.id());
			for (Attribute attribute : node.attributes()) {
				mismatch(attribute).ifPresent(reason -> diagnostics.add(diagnostic(path, attribute, reason, path)));
			}
		}
		return diagnostics;
	}

	/**
	 * @return a description of the mismatch, or empty when the value fits its type
	 */
	public Optional<String> mismatch(Attribute attribute) {
		if (attribute.type() == null) {
			return Optional.empty();
		}
		return mismatch(attribute.type().trim(), attribute.value());
	}

	private Optional<String> mismatch(String type, AttributeValue value) {
		if (value instanceof AttributeValue.Text text && text.value().contains("{{")) {
			return Optional.empty();
		}
		String base = baseName(type);
		switch (base) {
			case "string":
				return value instanceof AttributeValue.Text ? Optional.empty() : expected(type, value);
			case "number":
				return value instanceof AttributeValue.Number ? Optional.empty() : expected(type, value);
			case "integer", "int":
				if (value instanceof AttributeValue.Number number && isIntegral(number.value())) {
					return Optional.empty();
				}
				return expected(type, value);
			case "boolean", "bool":
				return value instanceof AttributeValue.Bool ? Optional.empty() : expected(type, value);
			case "array", "list":
				if (!(value instanceof AttributeValue.ListValue list)) {
					return expected(type, value);
				}
				String element = elementType(type);
				if (element == null) {
					return Optional.empty();
				}
				for (AttributeValue item : list.items()) {
					Optional<String> itemMismatch = mismatch(element, item);
					if (itemMismatch.isPresent()) {
						return Optional.of("element " + itemMismatch.get());
					}
				}
				return Optional.empty();
			default:
				return Optional.empty();
		}
	}

	private Optional<String> expected(String type, AttributeValue value) {
		return Optional.of("expected %s but got %s".formatted(type, describe(value)));
	}

	private String describe(AttributeValue value) {
		if (value instanceof AttributeValue.Text text) {
			return "string \"" + text.value() + "\"";
		}
		if (value instanceof AttributeValue.Number number) {
			return "number " + number.asText();
		}
		if (value instanceof AttributeValue.Bool bool) {
			return "boolean " + bool.asText();
		}
		return "array " + value.asText();
	}

	private String baseName(String type) {
		int generic = type.indexOf('<');
		String base = generic >= 0 ? type.substring(0, generic) : type;
		return base.trim().toLowerCase(Locale.ROOT);
	}

	private String elementType(String type) {
		int open = type.indexOf('<');
		int close = type.lastIndexOf('>');
		if (open < 0 || close <= open) {
			return null;
		}
		return type.substring(open + 1, close).trim();
	}

	private boolean isIntegral(BigDecimal value) {
		return value.signum() == 0 || value.scale() <= 0 || value.stripTrailingZeros().scale() <= 0;
	}

	private Diagnostic diagnostic(String owner, Attribute attribute, String reason, String path) {
		Diagnostic diagnostic = Diagnostic.error(DiagnosticKind.TYPE_MISMATCH, "TYPE_MISMATCH",
				"Attribute '%s' of %s: %s".formatted(attribute.name(), owner, reason));
		return path == null ? diagnostic : diagnostic.atNode(path);
	}
}
