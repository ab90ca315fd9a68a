package org.javai.dygram.condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.javai.dygram.model.Attribute;
import org.javai.dygram.model.Edge;

/**
 * Reads the guard attributes of an edge ({@code when}, {@code unless}, {@code if}) and
 * decides whether the edge is eligible.
 */
public final class EdgeConditions {

	public static final String WHEN = "when";
	public static final String UNLESS = "unless";
	public static final String IF = "if";

	private static final Pattern LABEL_GUARD = Pattern.compile("^\\s*(when|unless|if)\\s*:\\s*(.+?)\\s*;?\\s*$", Pattern.DOTALL);

	private EdgeConditions() {
	}

	public record Guard(String keyword, String expression) {

		/**
		 * The guard as a boolean expression; {@code unless} is negated.
		 */
		public String effectiveExpression() {
			String normalized = ConditionParser.normalize(expression);
			return keyword.equals(UNLESS) ? "!(" + normalized + ")" : "(" + normalized + ")";
		}
	}

	/**
	 * Guards of the edge in evaluation order: {@code when}, {@code unless}, {@code if}. A
	 * label of the form {@code when: "..."} counts when no guard attribute is present.
	 */
	public static List<Guard> guards(Edge edge) {
		List<Guard> guards = new ArrayList<>();
		for (String keyword : List.of(WHEN, UNLESS, IF)) {
			Optional<Attribute> attribute = edge.attribute(keyword);
			attribute.ifPresent(a -> guards.add(new Guard(keyword, a.value().asText())));
		}
		if (guards.isEmpty() && edge.label() != null) {
			Matcher matcher = LABEL_GUARD.matcher(edge.label());
			if (matcher.matches()) {
				guards.add(new Guard(matcher.group(1), matcher.group(2)));
			}
		}
		return guards;
	}

	public static boolean hasGuard(Edge edge) {
		return !guards(edge).isEmpty();
	}

	/**
	 * All guards joined with {@code &&}, or empty when the edge is unguarded.
	 */
	public static Optional<String> combinedExpression(Edge edge) {
		List<Guard> guards = guards(edge);
		if (guards.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(guards.stream().map(Guard::effectiveExpression).collect(Collectors.joining(" && ")));
	}

	/**
	 * An unguarded edge is always eligible; a guarded one only when every guard holds.
	 */
	public static boolean isEligible(Edge edge, ConditionEvaluator evaluator, EvaluationContext context) {
		return combinedExpression(edge).map(e -> evaluator.evaluate(e, context)).orElse(true);
	}
}
