package org.javai.dygram.build;

import java.util.ArrayList;
import java.util.List;
import org.javai.dygram.model.Annotation;
import org.javai.dygram.model.Attribute;
import org.javai.dygram.model.AttributeValue;
import org.javai.dygram.parse.AnnotationDeclaration;
import org.javai.dygram.parse.AttributeDeclaration;
import org.javai.dygram.parse.EdgeDeclaration;
import org.javai.dygram.parse.NodeDeclaration;
import org.javai.dygram.parse.NoteDeclaration;
import org.javai.dygram.parse.ParsedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns dotted node declarations into a nested tree, merging declarations that land on
 * the same path.
 * <p>
 * For {@code task a.b.c;} the nodes {@code a} and {@code a.b} are found or created and
 * only {@code c} receives the declaration's type, title, attributes and annotations.
 * Newly created intermediates take the leaf's type as an inherited type; an explicit
 * declaration of the intermediate path replaces it. Declarations of an existing path are
 * merged:
 * <ul>
 *     <li>title: a later non-empty title replaces the earlier one</li>
 *     <li>type: see {@link TypeConflict}; strict machines keep the first type</li>
 *     <li>attributes: replaced in place by name, new names appended</li>
 *     <li>annotations: added unless the name is already present</li>
 *     <li>children: merged recursively, edges and notes appended</li>
 * </ul>
 */
public class QualifiedNameExpander {

	private static final Logger logger = LoggerFactory.getLogger(QualifiedNameExpander.class);

	public static final String NOTE_TYPE = "note";
	public static final String NOTE_TARGET_ATTRIBUTE = "target";

	private final boolean strict;
	private final NodeTree tree = new NodeTree();
	private final List<ScopedEdge> edges = new ArrayList<>();
	private final List<ScopedNote> notes = new ArrayList<>();
	private final List<TypeConflict> conflicts = new ArrayList<>();

	public QualifiedNameExpander(boolean strict) {
		this.strict = strict;
	}

	/**
	 * Expands every node declaration of the document, then places notes whose qualified
	 * target does not exist yet as {@code note} nodes.
	 */
	public ExpansionResult expand(ParsedDocument document) {
		for (NodeDeclaration declaration : document.nodes()) {
			declare(null, declaration);
		}
		for (EdgeDeclaration edge : document.edges()) {
			edges.add(new ScopedEdge(edge, null));
		}
		for (NoteDeclaration note : document.notes()) {
			notes.add(new ScopedNote(note, null));
		}
		for (ScopedNote note : List.copyOf(notes)) {
			placeNote(note);
		}
		logger.debug("Expanded {} declarations into {} nodes", document.nodes().size(), tree.size());
		return new ExpansionResult(tree, edges, notes, conflicts);
	}

	private void declare(MutableNode scope, NodeDeclaration declaration) {
		String[] segments = relativeSegments(scope, declaration.name());

		MutableNode cursor = scope;
		for (int i = 0; i < segments.length - 1; i++) {
			cursor = intermediate(cursor, segments[i], declaration.type());
		}

		String leafName = segments[segments.length - 1];
		MutableNode parent = cursor;
		MutableNode leaf = tree.child(parent, leafName).orElse(null);
		if (leaf == null) {
			leaf = tree.create(parent, leafName);
			leaf.type = declaration.type();
			leaf.position = declaration.position();
		} else {
			logger.debug("Merging declaration into existing node {}", leaf.path());
			mergeType(leaf, declaration);
		}
		apply(leaf, declaration);
	}

	/**
	 * Inside a block, a path that repeats the block's own name ({@code Group.Sub.Item} within
	 * {@code Group}) continues from the block rather than nesting {@code Group} again.
	 */
	private String[] relativeSegments(MutableNode scope, String name) {
		String[] segments = name.split("\\.");
		if (scope != null && segments.length > 1 && segments[0].equals(scope.name) && scope.child(segments[0]).isEmpty()) {
			String[] rest = new String[segments.length - 1];
			System.arraycopy(segments, 1, rest, 0, rest.length);
			return rest;
		}
		return segments;
	}

	private MutableNode intermediate(MutableNode parent, String name, String leafType) {
		MutableNode node = tree.child(parent, name).orElse(null);
		if (node == null) {
			node = tree.create(parent, name);
			node.type = leafType;
			node.typeInherited = leafType != null;
		} else if (node.type == null && leafType != null) {
			node.type = leafType;
			node.typeInherited = true;
		}
		return node;
	}

	private void mergeType(MutableNode node, NodeDeclaration declaration) {
		String declared = declaration.type();
		if (declared == null) {
			return;
		}
		if (node.type == null || node.typeInherited) {
			node.type = declared;
			node.typeInherited = false;
			return;
		}
		if (!node.type.equals(declared)) {
			String kept = strict ? node.type : declared;
			conflicts.add(new TypeConflict(node.path(), node.type, declared, kept, strict, declaration.position()));
			logger.warn("Conflicting types for {}: '{}' and '{}', keeping '{}'", node.path(), node.type, declared, kept);
			node.type = kept;
		}
	}

	private void apply(MutableNode node, NodeDeclaration declaration) {
		if (declaration.title() != null && !declaration.title().isEmpty()) {
			node.title = declaration.title();
		}
		declaration.annotations().forEach(a -> node.mergeAnnotation(toAnnotation(a)));
		declaration.attributes().forEach(a -> node.upsertAttribute(toAttribute(a)));
		for (NodeDeclaration child : declaration.children()) {
			declare(node, child);
		}
		String scopePath = node.path();
		for (EdgeDeclaration edge : declaration.edges()) {
			edges.add(new ScopedEdge(edge, scopePath));
		}
		for (NoteDeclaration note : declaration.notes()) {
			notes.add(new ScopedNote(note, scopePath));
		}
	}

	private void placeNote(ScopedNote scoped) {
		NoteDeclaration note = scoped.declaration();
		MutableNode scope = scoped.scopePath() == null ? null : tree.descend(null, scoped.scopePath()).orElse(null);
		if (tree.lookup(scope, note.target()).isPresent() || !note.target().contains(".")) {
			return;
		}

		NodeDeclaration asNode = new NodeDeclaration(NOTE_TYPE, note.target(), note.content(), note.annotations(),
				note.attributes(), List.of(), List.of(), List.of(), note.position());
		declare(scope, asNode);

		MutableNode created = tree.lookup(scope, String.join(".", relativeSegments(scope, note.target())))
				.orElseThrow(() -> new IllegalStateException("note node was not created for " + note.target()));
		created.upsertAttribute(Attribute.of(NOTE_TARGET_ATTRIBUTE,
				AttributeValue.text(created.path())));
		logger.debug("Created note node {} for missing target", created.path());
	}

	static Attribute toAttribute(AttributeDeclaration declaration) {
		String type = declaration.type() == null ? null : declaration.type().render();
		return new Attribute(declaration.name(), type, declaration.value());
	}

	static Annotation toAnnotation(AnnotationDeclaration declaration) {
		return new Annotation(declaration.name(), declaration.value());
	}
}
