package org.javai.dygram.build;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.dygram.config.DygramConfig;
import org.javai.dygram.diagnostics.Diagnostic;
import org.javai.dygram.diagnostics.Diagnostics;
import org.javai.dygram.model.Annotation;
import org.javai.dygram.model.Attribute;
import org.javai.dygram.model.Edge;
import org.javai.dygram.model.Machine;
import org.javai.dygram.model.NodeId;
import org.javai.dygram.model.Note;
import org.javai.dygram.parse.DygramParser;
import org.javai.dygram.parse.EdgeDeclaration;
import org.javai.dygram.parse.EdgeSegment;
import org.javai.dygram.parse.NoteDeclaration;
import org.javai.dygram.parse.ParsedDocument;
import org.javai.dygram.resolve.ReferenceResolver;
import org.javai.dygram.resolve.Resolution;
import org.javai.dygram.validate.MachineValidator;
import org.javai.dygram.validate.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Source text to validated {@link Machine}: parse, expand qualified names, resolve edge and
 * note references against the expanded tree, then validate.
 * <p>
 * Syntax errors stop the pipeline; every later problem is collected so that one compilation
 * reports everything it found.
 */
public class MachineCompiler {

	private static final Logger logger = LoggerFactory.getLogger(MachineCompiler.class);

	private final DygramConfig config;

	public MachineCompiler() {
		this(DygramConfig.defaults());
	}

	public MachineCompiler(DygramConfig config) {
		this.config = Objects.requireNonNull(config, "config must not be null");
	}

	public CompilationResult compile(String source) {
		Objects.requireNonNull(source, "source must not be null");
		ParsedDocument document = new DygramParser().parse(source);
		if (document.hasSyntaxErrors()) {
			logger.info("Parsing failed with {} syntax errors", document.syntaxErrors().size());
			return new CompilationResult(null, document.syntaxErrors());
		}
		return compile(document);
	}

	public CompilationResult compile(ParsedDocument document) {
		Objects.requireNonNull(document, "document must not be null");
		if (document.hasSyntaxErrors()) {
			return new CompilationResult(null, document.syntaxErrors());
		}
		List<Attribute> attributes = document.attributes().stream().map(QualifiedNameExpander::toAttribute).toList();
		List<Annotation> annotations = document.annotations().stream().map(QualifiedNameExpander::toAnnotation).toList();
		boolean strict = annotations.stream().anyMatch(a -> a.name().equalsIgnoreCase(Machine.STRICT_MODE));

		ExpansionResult expansion = new QualifiedNameExpander(strict).expand(document);
		Machine skeleton = expansion.tree().freeze(document.title(), attributes, annotations, List.of(), List.of());
		if (config.autoCreateMissingNodes() && !strict && createMissingEndpoints(expansion, skeleton)) {
			skeleton = expansion.tree().freeze(document.title(), attributes, annotations, List.of(), List.of());
		}

		Diagnostics diagnostics = new Diagnostics();
		ReferenceResolver resolver = new ReferenceResolver(skeleton);
		List<Edge> edges = new ArrayList<>();
		for (ScopedEdge scoped : expansion.edges()) {
			edges.addAll(resolveEdge(resolver, scoped, diagnostics));
		}
		List<Note> notes = new ArrayList<>();
		for (ScopedNote scoped : expansion.notes()) {
			NoteDeclaration declaration = scoped.declaration();
			Resolution resolution = resolver.resolve(declaration.target(), scoped.scopePath());
			if (resolution instanceof Resolution.Resolved resolved) {
				notes.add(new Note(resolved.node(), skeleton.qualifiedName(resolved.node()), declaration.content(),
						declaration.attributes().stream().map(QualifiedNameExpander::toAttribute).toList(),
						declaration.annotations().stream().map(QualifiedNameExpander::toAnnotation).toList()));
			} else {
				diagnostics.add(ReferenceResolver.toDiagnostic(resolution, "Note for '" + declaration.target() + "'")
						.at(declaration.position()));
			}
		}

		Machine machine = new Machine(skeleton.title(), skeleton.attributes(), skeleton.annotations(), skeleton.nodes(),
				edges, notes, List.of());
		ValidationReport report = new MachineValidator(config.validation()).validate(machine, expansion.typeConflicts());
		diagnostics.addAll(report.diagnostics());
		machine = machine.withInferredDependencies(report.dependencies());

		CompilationResult result = new CompilationResult(machine, diagnostics.all());
		logger.info("Compiled '{}': {} nodes, {} edges, {} errors, {} warnings", machine.title(), machine.nodes().size(),
				machine.edges().size(), result.errors().size(), result.warnings().size());
		return result;
	}

	/**
	 * Expands a chained declaration: every segment connects each of the previous targets to
	 * each of its own targets.
	 */
	private List<Edge> resolveEdge(ReferenceResolver resolver, ScopedEdge scoped, Diagnostics diagnostics) {
		EdgeDeclaration declaration = scoped.declaration();
		List<Edge> edges = new ArrayList<>();
		Map<String, NodeId> sources = resolveAll(resolver, declaration.sources(), scoped, diagnostics);
		List<String> previous = declaration.sources();
		for (EdgeSegment segment : declaration.segments()) {
			Map<String, NodeId> targets = resolveAll(resolver, segment.targets(), scoped, diagnostics);
			List<Attribute> attributes = segment.attributes().stream().map(QualifiedNameExpander::toAttribute).toList();
			for (String source : previous) {
				for (String target : segment.targets()) {
					NodeId from = sources.get(source);
					NodeId to = targets.get(target);
					if (from != null && to != null) {
						edges.add(new Edge(from, to, segment.arrowType(), segment.label(), attributes,
								segment.sourceMultiplicity(), segment.targetMultiplicity()));
					}
				}
			}
			previous = segment.targets();
			sources = targets;
		}
		return edges;
	}

	private Map<String, NodeId> resolveAll(ReferenceResolver resolver, List<String> references, ScopedEdge scoped,
			Diagnostics diagnostics) {
		Map<String, NodeId> resolved = new LinkedHashMap<>();
		for (String reference : references) {
			Resolution resolution = resolver.resolve(reference, scoped.scopePath());
			if (resolution instanceof Resolution.Resolved r) {
				resolved.put(reference, r.node());
			} else {
				Diagnostic diagnostic = ReferenceResolver.toDiagnostic(resolution, "Edge " + describe(scoped.declaration()))
						.at(scoped.declaration().position());
				diagnostics.add(scoped.scopePath() == null ? diagnostic : diagnostic.atNode(scoped.scopePath()));
			}
		}
		return resolved;
	}

	/**
	 * Creates untyped nodes for edge endpoints that resolve to nothing, in the block the edge
	 * was declared in.
	 *
	 * @return whether any node was created
	 */
	private boolean createMissingEndpoints(ExpansionResult expansion, Machine skeleton) {
		ReferenceResolver resolver = new ReferenceResolver(skeleton);
		boolean created = false;
		for (ScopedEdge scoped : expansion.edges()) {
			List<String> references = new ArrayList<>(scoped.declaration().sources());
			scoped.declaration().segments().forEach(s -> references.addAll(s.targets()));
			for (String reference : references) {
				if (!(resolver.resolve(reference, scoped.scopePath()) instanceof Resolution.Unresolved)) {
					continue;
				}
				NodeTree tree = expansion.tree();
				MutableNode scope = scoped.scopePath() == null ? null : tree.descend(null, scoped.scopePath()).orElse(null);
				if (tree.lookup(scope, reference).isPresent()) {
					continue;
				}
				MutableNode node = tree.ensurePath(scope, reference);
				logger.debug("Created missing edge endpoint {}", node.path());
				created = true;
			}
		}
		return created;
	}

	private static String describe(EdgeDeclaration declaration) {
		StringBuilder sb = new StringBuilder(String.join(", ", declaration.sources()));
		for (EdgeSegment segment : declaration.segments()) {
			sb.append(' ').append(segment.arrowType().symbol()).append(' ').append(String.join(", ", segment.targets()));
		}
		return sb.toString();
	}
}
