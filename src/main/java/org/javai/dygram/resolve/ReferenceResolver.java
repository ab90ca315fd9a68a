package org.javai.dygram.resolve;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.dygram.diagnostics.Diagnostic;
import org.javai.dygram.diagnostics.DiagnosticKind;
import org.javai.dygram.model.Machine;
import org.javai.dygram.model.MachineNode;
import org.javai.dygram.model.NodeId;

/**
 * Resolves simple or dotted node references against a machine's node tree.
 * <p>
 * Lookup order:
 * <ol>
 *     <li>the reference as a qualified path from the root</li>
 *     <li>the reference as a path below the declaring scope, then below each enclosing scope</li>
 *     <li>every node whose qualified name ends with the reference on a segment boundary;
 *     a single match wins, otherwise the match inside the nearest enclosing scope</li>
 * </ol>
 * Anything else is {@link Resolution.Ambiguous} or {@link Resolution.Unresolved}.
 */
public class ReferenceResolver {

	private final Machine machine;

	public ReferenceResolver(Machine machine) {
		this.machine = Objects.requireNonNull(machine, "machine must not be null");
	}

	public Resolution resolve(String reference) {
		return resolve(reference, null);
	}

	/**
	 * @param reference simple or dotted name as written
	 * @param scopePath qualified path of the block the reference was written in, or {@code null}
	 */
	public Resolution resolve(String reference, String scopePath) {
		Objects.requireNonNull(reference, "reference must not be null");
		NodeId scope = scopePath == null ? null : machine.findByPath(scopePath).map(MachineNode::id).orElse(null);

		Optional<MachineNode> exact = machine.findByPath(reference);
		if (exact.isPresent()) {
			return new Resolution.Resolved(reference, exact.get().id());
		}
		for (NodeId cursor : scopeChain(scope)) {
			String candidatePath = machine.qualifiedName(cursor) + "." + reference;
			Optional<MachineNode> found = machine.findByPath(candidatePath);
			if (found.isPresent()) {
				return new Resolution.Resolved(reference, found.get().id());
			}
		}

		List<MachineNode> candidates = suffixMatches(reference);
		if (candidates.isEmpty()) {
			return new Resolution.Unresolved(reference);
		}
		if (candidates.size() == 1) {
			return new Resolution.Resolved(reference, candidates.get(0).id());
		}
		for (NodeId cursor : scopeChain(scope)) {
			List<MachineNode> inScope = candidates.stream().filter(c -> isDescendant(c.id(), cursor)).toList();
			if (inScope.size() == 1) {
				return new Resolution.Resolved(reference, inScope.get(0).id());
			}
			if (inScope.size() > 1) {
				return ambiguous(reference, inScope);
			}
		}
		return ambiguous(reference, candidates);
	}

	/**
	 * Turns a failed resolution into a reference error naming what referred to it.
	 */
	public static Diagnostic toDiagnostic(Resolution resolution, String referrer) {
		if (resolution instanceof Resolution.Ambiguous ambiguous) {
			return Diagnostic.error(DiagnosticKind.REFERENCE_ERROR, "AMBIGUOUS_REFERENCE",
							"%s refers to '%s', which matches %s; qualify the name".formatted(referrer,
									ambiguous.reference(), String.join(", ", ambiguous.candidates())))
					.withRelated(ambiguous.candidates());
		}
		return Diagnostic.error(DiagnosticKind.REFERENCE_ERROR, "UNRESOLVED_REFERENCE",
				"%s refers to undefined node '%s'".formatted(referrer, resolution.reference()));
	}

	private Resolution ambiguous(String reference, List<MachineNode> nodes) {
		return new Resolution.Ambiguous(reference, nodes.stream().map(n -> machine.qualifiedName(n.id())).toList());
	}

	private List<MachineNode> suffixMatches(String reference) {
		String suffix = "." + reference;
		List<MachineNode> result = new ArrayList<>();
		for (MachineNode node : machine.nodes()) {
			String path = machine.qualifiedName(node.id());
			if (path.equals(reference) || path.endsWith(suffix)) {
				result.add(node);
			}
		}
		return result;
	}

	private List<NodeId> scopeChain(NodeId scope) {
		List<NodeId> chain = new ArrayList<>();
		if (scope != null) {
			chain.add(scope);
			chain.addAll(machine.ancestors(scope));
		}
		return chain;
	}

	private boolean isDescendant(NodeId candidate, NodeId ancestor) {
		return machine.ancestors(candidate).contains(ancestor);
	}
}
