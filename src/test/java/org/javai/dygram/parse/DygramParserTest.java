package org.javai.dygram.parse;

import static org.assertj.core.api.Assertions.assertThat;
import java.math.BigDecimal;
import org.javai.dygram.diagnostics.Diagnostic;
import org.javai.dygram.diagnostics.DiagnosticKind;
import org.javai.dygram.model.ArrowType;
import org.javai.dygram.model.AttributeValue;
import org.junit.jupiter.api.Test;

class DygramParserTest {

	private final DygramParser parser = new DygramParser();

	@Test
	void parsesMachineTitleAnnotationsAndAttributes() {
		ParsedDocument document = parser.parse("""
				machine "Order Flow" @StrictMode
				version: "1.2";
				maxRetries<number>: 3;
				""");

		assertThat(document.hasSyntaxErrors()).isFalse();
		assertThat(document.title()).isEqualTo("Order Flow");
		assertThat(document.annotations()).extracting(AnnotationDeclaration::name).containsExactly("StrictMode");
		assertThat(document.attributes()).extracting(AttributeDeclaration::name).containsExactly("version", "maxRetries");
		AttributeDeclaration retries = document.attributes().get(1);
		assertThat(retries.type().render()).isEqualTo("number");
		assertThat(retries.value()).isEqualTo(AttributeValue.number(3));
	}

	@Test
	void parsesTypedNodesWithTitlesAnnotationsAndBlocks() {
		ParsedDocument document = parser.parse("""
				init start "Begin";
				Task process "Process order" @Async {
				    timeout<integer>: 30;
				    tags<Array<string>>: ["a", "b"];
				}
				""");

		assertThat(document.syntaxErrors()).isEmpty();
		assertThat(document.nodes()).hasSize(2);
		NodeDeclaration start = document.nodes().get(0);
		assertThat(start.type()).isEqualTo("init");
		assertThat(start.name()).isEqualTo("start");
		assertThat(start.title()).isEqualTo("Begin");

		NodeDeclaration process = document.nodes().get(1);
		assertThat(process.type()).isEqualTo("task");
		assertThat(process.annotations()).extracting(AnnotationDeclaration::name).containsExactly("Async");
		assertThat(process.attributes()).extracting(a -> a.type().render())
				.containsExactly("integer", "Array<string>");
	}

	@Test
	void parsesDeeplyNestedGenericTypes() {
		ParsedDocument document = parser.parse("result<Promise<Array<Record>>>: \"x\";");

		assertThat(document.syntaxErrors()).isEmpty();
		AttributeDeclaration result = document.attributes().get(0);
		assertThat(result.type().render()).isEqualTo("Promise<Array<Record>>");
		assertThat(result.value()).isEqualTo(AttributeValue.text("x"));
	}

	@Test
	void acceptsUnicodeIdentifiersTitlesAndLabels() {
		ParsedDocument document = parser.parse("""
				state café "Über";
				state 注文;
				café -"確認"-> 注文;
				""");

		assertThat(document.syntaxErrors()).isEmpty();
		assertThat(document.nodes()).extracting(NodeDeclaration::name).containsExactly("café", "注文");
		assertThat(document.nodes().get(0).title()).isEqualTo("Über");
		EdgeDeclaration edge = document.edges().get(0);
		assertThat(edge.sources()).containsExactly("café");
		assertThat(edge.segments().get(0).label()).isEqualTo("確認");
		assertThat(edge.segments().get(0).targets()).containsExactly("注文");
	}

	@Test
	void untypedAttributeOfBooleanLiteralHasNoType() {
		ParsedDocument document = parser.parse("flag { enabled: true; }");

		AttributeDeclaration enabled = document.nodes().get(0).attributes().get(0);
		assertThat(enabled.type()).isNull();
		assertThat(enabled.value()).isEqualTo(AttributeValue.bool(true));
	}

	@Test
	void parsesNestedBlocksAndQualifiedNames() {
		ParsedDocument document = parser.parse("""
				Group {
				    task inner;
				    inner -> Other.leaf;
				}
				task Other.leaf;
				""");

		assertThat(document.syntaxErrors()).isEmpty();
		NodeDeclaration group = document.nodes().get(0);
		assertThat(group.children()).extracting(NodeDeclaration::name).containsExactly("inner");
		assertThat(group.edges()).hasSize(1);
		assertThat(group.edges().get(0).segments().get(0).targets()).containsExactly("Other.leaf");
		assertThat(document.nodes().get(1).isQualified()).isTrue();
	}

	@Test
	void parsesChainedAndFannedEdgesWithEveryArrowType() {
		ParsedDocument document = parser.parse("""
				a, b -> c --> d;
				e <|-- f;
				g *--> h;
				i o--> j;
				k <--> l;
				m => n;
				""");

		assertThat(document.syntaxErrors()).isEmpty();
		EdgeDeclaration chain = document.edges().get(0);
		assertThat(chain.sources()).containsExactly("a", "b");
		assertThat(chain.segments()).extracting(EdgeSegment::arrowType)
				.containsExactly(ArrowType.ASSOCIATION, ArrowType.DEPENDENCY);
		assertThat(document.edges().subList(1, 6)).extracting(e -> e.segments().get(0).arrowType())
				.containsExactly(ArrowType.INHERITANCE, ArrowType.COMPOSITION, ArrowType.AGGREGATION,
						ArrowType.BIDIRECTIONAL, ArrowType.EMPHASIS);
	}

	@Test
	void parsesEdgeLabelsAndGuardAttributes() {
		ParsedDocument document = parser.parse("""
				a -"approved"-> b;
				b -when: "count > 10"-> c;
				c -retry later-> a;
				""");

		assertThat(document.syntaxErrors()).isEmpty();
		assertThat(document.edges().get(0).segments().get(0).label()).isEqualTo("approved");
		EdgeSegment guarded = document.edges().get(1).segments().get(0);
		assertThat(guarded.label()).isNull();
		assertThat(guarded.attributes()).singleElement().satisfies(a -> {
			assertThat(a.name()).isEqualTo("when");
			assertThat(a.value()).isEqualTo(AttributeValue.text("count > 10"));
		});
		assertThat(document.edges().get(2).segments().get(0).label()).isEqualTo("retry later");
	}

	@Test
	void parsesMultiplicities() {
		ParsedDocument document = parser.parse("Order \"1\" -> \"0..*\" Item;");

		EdgeSegment segment = document.edges().get(0).segments().get(0);
		assertThat(segment.sourceMultiplicity()).isEqualTo("1");
		assertThat(segment.targetMultiplicity()).isEqualTo("0..*");
		assertThat(segment.targets()).containsExactly("Item");
	}

	@Test
	void parsesNotesWithOptionalForKeyword() {
		ParsedDocument document = parser.parse("""
				note for API.Authentication "Uses OAuth" @Critical;
				note process "Runs nightly" { owner: "ops"; }
				""");

		assertThat(document.syntaxErrors()).isEmpty();
		assertThat(document.notes()).extracting(NoteDeclaration::target).containsExactly("API.Authentication", "process");
		assertThat(document.notes().get(0).annotations()).extracting(AnnotationDeclaration::name).containsExactly("Critical");
		assertThat(document.notes().get(1).attributes()).extracting(AttributeDeclaration::name).containsExactly("owner");
	}

	@Test
	void parsesNumbersAsExactDecimals() {
		ParsedDocument document = parser.parse("config { rate: 0.1; limit: -5; }");

		assertThat(document.nodes().get(0).attributes()).extracting(AttributeDeclaration::value)
				.containsExactly(AttributeValue.number(new BigDecimal("0.1")), AttributeValue.number(-5));
	}

	@Test
	void collectsEverySyntaxErrorAndKeepsGoing() {
		ParsedDocument document = parser.parse("""
				task ok1;
				a -> ;
				task ok2;
				b: ;
				task ok3;
				""");

		assertThat(document.syntaxErrors()).hasSize(2);
		assertThat(document.syntaxErrors()).allSatisfy(d -> {
			assertThat(d.kind()).isEqualTo(DiagnosticKind.SYNTAX_ERROR);
			assertThat(d.position()).isNotNull();
		});
		assertThat(document.nodes()).extracting(NodeDeclaration::name).containsExactly("ok1", "ok2", "ok3");
	}

	@Test
	void reportsLineOfSyntaxError() {
		ParsedDocument document = parser.parse("task a;\ntask b;\nc -> ;\n");

		Diagnostic error = document.syntaxErrors().get(0);
		assertThat(error.position().line()).isEqualTo(3);
	}

	@Test
	void reportsUnclosedBlock() {
		ParsedDocument document = parser.parse("Group {\n task inner;\n");

		assertThat(document.hasSyntaxErrors()).isTrue();
		assertThat(document.syntaxErrors().get(0).message()).contains("'}'");
	}

	@Test
	void ignoresComments() {
		ParsedDocument document = parser.parse("""
				// a line comment
				task a; /* block
				comment */ task b;
				""");

		assertThat(document.syntaxErrors()).isEmpty();
		assertThat(document.nodes()).extracting(NodeDeclaration::name).containsExactly("a", "b");
	}
}
