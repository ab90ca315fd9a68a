package org.javai.dygram.validate;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.dygram.diagnostics.Diagnostic;
import org.javai.dygram.diagnostics.DiagnosticKind;
import org.javai.dygram.model.Edge;
import org.javai.dygram.model.Machine;

/**
 * Checks edge multiplicities against {@code N}, {@code *}, {@code N..M} and {@code N..*}.
 */
public class MultiplicityValidator {

	private static final Pattern SINGLE = Pattern.compile("^(\\d+|\\*)$");
	private static final Pattern RANGE = Pattern.compile("^(\\d+)\\.\\.(\\d+|\\*)$");

	public List<Diagnostic> validate(Machine machine) {
		List<Diagnostic> diagnostics = new ArrayList<>();
		for (Edge edge : machine.edges()) {
			String description = "%s %s %s".formatted(machine.qualifiedName(edge.source()), edge.arrowType().symbol(),
					machine.qualifiedName(edge.target()));
			boolean present = edge.sourceMultiplicity() != null || edge.targetMultiplicity() != null;
			if (present && !edge.arrowType().supportsMultiplicity()) {
				diagnostics.add(Diagnostic.warning(DiagnosticKind.GRAPH, "MULTIPLICITY_NOT_APPLICABLE",
						"Multiplicity has no meaning on %s edge %s".formatted(edge.arrowType().name().toLowerCase(),
								description)).atNode(machine.qualifiedName(edge.source())));
			}
			check(edge.sourceMultiplicity(), description, machine.qualifiedName(edge.source()), diagnostics);
			check(edge.targetMultiplicity(), description, machine.qualifiedName(edge.source()), diagnostics);
		}
		return diagnostics;
	}

	void check(String multiplicity, String description, String nodePath, List<Diagnostic> diagnostics) {
		if (multiplicity == null) {
			return;
		}
		String value = multiplicity.trim();
		if (SINGLE.matcher(value).matches()) {
			return;
		}
		Matcher range = RANGE.matcher(value);
		if (!range.matches()) {
			diagnostics.add(Diagnostic.error(DiagnosticKind.GRAPH, "INVALID_MULTIPLICITY",
					"Invalid multiplicity \"%s\" on %s; expected N, *, N..M or N..*".formatted(value, description))
					.atNode(nodePath));
			return;
		}
		BigInteger lower = new BigInteger(range.group(1));
		String upperText = range.group(2);
		if (upperText.equals("*")) {
			if (lower.compareTo(BigInteger.ONE) > 0) {
				diagnostics.add(Diagnostic.warning(DiagnosticKind.GRAPH, "UNUSUAL_MULTIPLICITY",
						"Unusual multiplicity \"%s\" on %s".formatted(value, description)).atNode(nodePath));
			}
			return;
		}
		BigInteger upper = new BigInteger(upperText);
		if (lower.compareTo(upper) > 0) {
			diagnostics.add(Diagnostic.error(DiagnosticKind.GRAPH, "MULTIPLICITY_RANGE",
					"Lower bound exceeds upper bound in \"%s\" on %s".formatted(value, description)).atNode(nodePath));
		} else if (lower.equals(upper)) {
			diagnostics.add(Diagnostic.warning(DiagnosticKind.GRAPH, "UNUSUAL_MULTIPLICITY",
					"Multiplicity \"%s\" on %s can be written as \"%s\"".formatted(value, description, lower))
					.atNode(nodePath));
		}
	}
}
