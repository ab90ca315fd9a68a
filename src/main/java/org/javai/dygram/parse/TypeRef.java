package org.javai.dygram.parse;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Declared attribute type, possibly generic: {@code Promise<Array<Record>>}.
 */
public record TypeRef(String name, List<TypeRef> arguments) {

	public TypeRef {
		Objects.requireNonNull(name, "name must not be null");
		arguments = arguments == null ? List.of() : List.copyOf(arguments);
	}

	public static TypeRef simple(String name) {
		return new TypeRef(name, List.of());
	}

	public String render() {
		if (arguments.isEmpty()) {
			return name;
		}
		return name + arguments.stream().map(TypeRef::render).collect(Collectors.joining(", ", "<", ">"));
	}

	@Override
	public String toString() {
		return render();
	}
}
