package org.javai.dygram.validate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.javai.dygram.build.TypeConflict;
import org.javai.dygram.diagnostics.Diagnostic;
import org.javai.dygram.diagnostics.DiagnosticKind;
import org.javai.dygram.diagnostics.Severity;
import org.javai.dygram.model.InferredDependency;
import org.javai.dygram.model.Machine;
import org.javai.dygram.model.MachineNode;
import org.javai.dygram.model.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the semantic and graph checks enabled by {@link ValidationOptions}.
 */
public class MachineValidator {

	private static final Logger logger = LoggerFactory.getLogger(MachineValidator.class);

	private final ValidationOptions options;
	private final MultiplicityValidator multiplicityValidator = new MultiplicityValidator();
	private final AttributeTypeChecker typeChecker = new AttributeTypeChecker();
	private final DependencyAnalyzer dependencyAnalyzer = new DependencyAnalyzer();

	public MachineValidator() {
		this(ValidationOptions.defaults());
	}

	public MachineValidator(ValidationOptions options) {
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	public ValidationReport validate(Machine machine) {
		return validate(machine, List.of());
	}

	/**
	 * @param typeConflicts type conflicts recorded while merging declarations
	 */
	public ValidationReport validate(Machine machine, List<TypeConflict> typeConflicts) {
		List<Diagnostic> diagnostics = new ArrayList<>();
		List<InferredDependency> dependencies = List.of();
		GraphAnalyzer graph = new GraphAnalyzer(machine);

		checkEntryPoints(machine, graph, diagnostics);
		if (options.checkUnreachable()) {
			for (MachineNode node : graph.unreachableNodes()) {
				String path = machine.qualifiedName(node.id());
				diagnostics.add(Diagnostic.warning(DiagnosticKind.GRAPH, "UNREACHABLE_NODE",
						"Node '%s' is not reachable from any init node".formatted(path)).atNode(path));
			}
		}
		if (options.checkOrphans()) {
			for (MachineNode node : graph.orphanNodes()) {
				String path = machine.qualifiedName(node.id());
				diagnostics.add(Diagnostic.warning(DiagnosticKind.GRAPH, "ORPHAN_NODE",
						"Node '%s' has no incoming or outgoing edges".formatted(path)).atNode(path));
			}
		}
		if (options.checkCycles()) {
			for (List<NodeId> cycle : graph.cycles()) {
				List<String> paths = cycle.stream().map(machine::qualifiedName).toList();
				diagnostics.add(new Diagnostic(options.cycleSeverity(), DiagnosticKind.GRAPH, "CYCLE_DETECTED",
						"Cycle detected: " + String.join(" -> ", paths), paths.get(0), null, paths));
			}
		}
		if (options.checkDuplicateStates()) {
			for (TypeConflict conflict : typeConflicts) {
				Severity severity = conflict.strict() ? Severity.ERROR : Severity.WARNING;
				Diagnostic diagnostic = new Diagnostic(severity, DiagnosticKind.MERGE_CONFLICT, "DUPLICATE_STATE",
						"Node '%s' is declared as both '%s' and '%s'; using '%s'".formatted(conflict.path(),
								conflict.existingType(), conflict.declaredType(), conflict.keptType()),
						conflict.path(), conflict.position(), null);
				diagnostics.add(diagnostic);
			}
		}
		if (options.checkAnnotations()) {
			for (MachineNode node : machine.nodes()) {
				String path = machine.qualifiedName(node.id());
				for (AnnotationRule rule : AnnotationRule.values()) {
					rule.check(node, path).ifPresent(diagnostics::add);
				}
			}
		}
		if (options.checkMultiplicity()) {
			diagnostics.addAll(multiplicityValidator.validate(machine));
		}
		if (options.checkTypes()) {
			diagnostics.addAll(typeChecker.check(machine));
		}
		if (options.inferDependencies()) {
			DependencyAnalyzer.Analysis analysis = dependencyAnalyzer.analyze(machine);
			dependencies = analysis.dependencies();
			diagnostics.addAll(analysis.diagnostics());
		}

		if (logger.isDebugEnabled()) {
			logger.debug("Validation produced {} diagnostics: {}", diagnostics.size(),
					diagnostics.stream().map(Diagnostic::code).collect(Collectors.joining(", ")));
		}
		return new ValidationReport(diagnostics, dependencies);
	}

	private void checkEntryPoints(Machine machine, GraphAnalyzer graph, List<Diagnostic> diagnostics) {
		List<MachineNode> entries = graph.entryPoints();
		if (entries.isEmpty()) {
			if (!machine.nodes().isEmpty()) {
				diagnostics.add(Diagnostic.warning(DiagnosticKind.GRAPH, "MISSING_ENTRY_POINT",
						"Machine has no init node; reachability was not checked"));
			}
			return;
		}
		for (MachineNode entry : entries) {
			if (machine.outgoing(entry.id()).isEmpty()) {
				String path = machine.qualifiedName(entry.id());
				diagnostics.add(Diagnostic.warning(DiagnosticKind.SEMANTIC_VIOLATION, "INIT_WITHOUT_TRANSITIONS",
						"Init node '%s' has no outgoing edges".formatted(path)).atNode(path));
			}
		}
	}
}
