package org.javai.dygram.exec;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.dygram.condition.EvaluationContext;
import org.javai.dygram.model.Attribute;
import org.javai.dygram.model.MachineNode;

/**
 * Renders the system prompt shown to the decision-maker at the current node.
 */
public class ExecutionPromptBuilder {

	public static final String PROMPT_ATTRIBUTE = "prompt";

	private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([^}]+?)\\s*}}");

	private final ExecutionEngine engine;

	public ExecutionPromptBuilder(ExecutionEngine engine) {
		this.engine = Objects.requireNonNull(engine, "engine must not be null");
	}

	public String build(ExecutionState state, ToolSet tools) {
		MachineNode node = state.graph().require(state.currentNode());
		EvaluationContext context = engine.evaluationContext(state);
		StringBuilder sb = new StringBuilder();

		String title = state.source().title();
		sb.append("You are executing the state machine");
		if (title != null && !title.isBlank()) {
			sb.append(" \"").append(title).append("\"");
		}
		sb.append(".\n");
		sb.append("Current node: ").append(state.currentNodePath());
		if (node.type() != null) {
			sb.append(" (").append(node.type()).append(")");
		}
		sb.append("\n");
		if (node.title() != null && !node.title().isBlank()) {
			sb.append("Title: ").append(node.title()).append("\n");
		}
		sb.append("Visit: ").append(state.visitCount(node.id())).append("\n");
		if (state.activeState() != null) {
			sb.append("Active state: ").append(state.activeState()).append("\n");
		}

		Optional<Attribute> prompt = node.attribute(PROMPT_ATTRIBUTE);
		prompt.ifPresent(p -> sb.append("\n").append(render(p.value().asText(), context)).append("\n"));

		List<ToolDefinition> transitions = tools.transitions();
		if (!transitions.isEmpty()) {
			sb.append("\nAvailable transitions:\n");
			transitions.forEach(t -> sb.append("- ").append(t.name()).append(": ").append(t.description()).append("\n"));
		}
		if (tools.size() > transitions.size()) {
			sb.append("\nOther tools:\n");
			tools.definitions().stream()
					.filter(t -> !transitions.contains(t))
					.forEach(t -> sb.append("- ").append(t.name()).append(": ").append(t.description()).append("\n"));
		}

		List<StepRecord> history = state.history();
		if (!history.isEmpty()) {
			StepRecord last = history.get(history.size() - 1);
			sb.append("\nLast step: ").append(last.tool()).append(last.success() ? " succeeded" : " failed");
			if (last.detail() != null && !last.detail().isBlank()) {
				sb.append(" (").append(last.detail()).append(")");
			}
			sb.append("\n");
		}
		sb.append("\nChoose exactly one tool.");
		return sb.toString();
	}

	/**
	 * Replaces {@code {{ node.attr }}} with the current value; unknown references are kept as written.
	 */
	static String render(String template, EvaluationContext context) {
		if (template == null || template.isBlank()) {
			return template;
		}
		Matcher matcher = PLACEHOLDER.matcher(template);
		StringBuilder sb = new StringBuilder();
		while (matcher.find()) {
			String key = matcher.group(1).trim();
			Optional<Object> value = context.lookup(key);
			String replacement = value.map(ExecutionPromptBuilder::display).orElse(matcher.group(0));
			matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
		}
		matcher.appendTail(sb);
		return sb.toString();
	}

	private static String display(Object value) {
		if (value instanceof BigDecimal number) {
			return number.stripTrailingZeros().toPlainString();
		}
		return String.valueOf(value);
	}
}
