package org.javai.dygram.validate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.dygram.condition.ConditionException;
import org.javai.dygram.condition.ConditionParser;
import org.javai.dygram.condition.EdgeConditions;
import org.javai.dygram.condition.EvaluationContext;
import org.javai.dygram.diagnostics.Diagnostic;
import org.javai.dygram.diagnostics.DiagnosticKind;
import org.javai.dygram.model.Attribute;
import org.javai.dygram.model.AttributeValue;
import org.javai.dygram.model.Edge;
import org.javai.dygram.model.InferredDependency;
import org.javai.dygram.model.Machine;
import org.javai.dygram.model.MachineNode;
import org.javai.dygram.model.NodeId;
import org.javai.dygram.resolve.Resolution;
import org.javai.dygram.resolve.ReferenceResolver;

/**
 * Infers dependencies from {@code {{ node.attribute }}} references in attribute values and
 * from variables used in edge guards.
 */
public class DependencyAnalyzer {

	public static final Pattern TEMPLATE_REFERENCE = Pattern.compile("\\{\\{\\s*([a-zA-Z_][a-zA-Z0-9_.]*)\\s*}}");

	public record Analysis(List<InferredDependency> dependencies, List<Diagnostic> diagnostics) {
		public Analysis {
			dependencies = List.copyOf(dependencies);
			diagnostics = List.copyOf(diagnostics);
		}
	}

	private record Target(NodeId node, String[] remainder) {
	}

	public Analysis analyze(Machine machine) {
		ReferenceResolver resolver = new ReferenceResolver(machine);
		Set<InferredDependency> dependencies = new LinkedHashSet<>();
		List<Diagnostic> diagnostics = new ArrayList<>();

		for (MachineNode node : machine.nodes()) {
			String sourcePath = machine.qualifiedName(node.id());
			for (Attribute attribute : node.attributes()) {
				for (String reference : templateReferences(attribute.value())) {
					String head = reference.split("\\.")[0];
					if (EvaluationContext.BUILT_INS.contains(head)) {
						continue;
					}
					Optional<Target> target = resolveTarget(resolver, reference, sourcePath);
					if (target.isEmpty()) {
						diagnostics.add(unresolved(sourcePath, attribute.name(), reference,
								"no node matches '%s'".formatted(reference)));
						continue;
					}
					NodeId targetId = target.get().node();
					String[] remainder = target.get().remainder();
					if (remainder.length > 0 && machine.node(targetId).attribute(remainder[0]).isEmpty()) {
						diagnostics.add(unresolved(sourcePath, attribute.name(), reference,
								"node '%s' has no attribute '%s'".formatted(machine.qualifiedName(targetId), remainder[0])));
						continue;
					}
					if (!targetId.equals(node.id())) {
						dependencies.add(new InferredDependency(node.id(), targetId, "reads " + attribute.name(), reference));
					}
				}
			}
		}

		for (Edge edge : machine.edges()) {
			for (EdgeConditions.Guard guard : EdgeConditions.guards(edge)) {
				Set<String> variables;
				try {
					variables = ConditionParser.parse(guard.expression()).variables();
				} catch (ConditionException e) {
					continue;
				}
				for (String variable : variables) {
					if (EvaluationContext.BUILT_INS.contains(variable.split("\\.")[0])) {
						continue;
					}
					conditionTarget(machine, resolver, variable, machine.qualifiedName(edge.source()))
							.filter(target -> !target.equals(edge.source()))
							.ifPresent(target -> dependencies.add(new InferredDependency(edge.source(), target,
									"condition references " + variable, guard.expression())));
				}
			}
		}
		return new Analysis(new ArrayList<>(dependencies), diagnostics);
	}

	/**
	 * Every template reference in a value, including inside array items.
	 */
	public static List<String> templateReferences(AttributeValue value) {
		List<String> references = new ArrayList<>();
		if (value instanceof AttributeValue.Text text) {
			Matcher matcher = TEMPLATE_REFERENCE.matcher(text.value());
			while (matcher.find()) {
				references.add(matcher.group(1));
			}
		} else if (value instanceof AttributeValue.ListValue list) {
			list.items().forEach(item -> references.addAll(templateReferences(item)));
		}
		return references;
	}

	/**
	 * Resolves the longest node prefix of a dotted reference; the rest names an attribute.
	 */
	private Optional<Target> resolveTarget(ReferenceResolver resolver, String reference, String scopePath) {
		String[] segments = reference.split("\\.");
		for (int split = segments.length; split >= 1; split--) {
			String prefix = String.join(".", Arrays.copyOfRange(segments, 0, split));
			Resolution resolution = resolver.resolve(prefix, scopePath);
			if (resolution instanceof Resolution.Resolved resolved) {
				return Optional.of(new Target(resolved.node(), Arrays.copyOfRange(segments, split, segments.length)));
			}
		}
		return Optional.empty();
	}

	private Optional<NodeId> conditionTarget(Machine machine, ReferenceResolver resolver, String variable,
			String scopePath) {
		Optional<Target> target = resolveTarget(resolver, variable, scopePath);
		if (target.isPresent()) {
			return Optional.of(target.get().node());
		}
		List<MachineNode> owners = machine.nodes().stream().filter(n -> n.attribute(variable).isPresent()).toList();
		return owners.size() == 1 ? Optional.of(owners.get(0).id()) : Optional.empty();
	}

	private Diagnostic unresolved(String sourcePath, String attributeName, String reference, String reason) {
		return Diagnostic.error(DiagnosticKind.REFERENCE_ERROR, "UNRESOLVED_TEMPLATE_REFERENCE",
				"Attribute '%s' of %s references {{ %s }}: %s".formatted(attributeName, sourcePath, reference, reason))
				.atNode(sourcePath);
	}
}
