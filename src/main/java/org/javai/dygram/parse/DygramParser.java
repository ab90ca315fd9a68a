package org.javai.dygram.parse;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.javai.dygram.diagnostics.Diagnostic;
import org.javai.dygram.diagnostics.DiagnosticKind;
import org.javai.dygram.diagnostics.SourcePosition;
import org.javai.dygram.model.ArrowType;
import org.javai.dygram.model.AttributeValue;
import org.javai.dygram.parse.DygramToken.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser for DyGram source.
 * <p>
 * Grammar (informal):
 * <pre>
 * document   := statement*
 * statement  := machine | note | attribute | annotation | node | edge | ';'
 * machine    := 'machine' STRING annotation* block?
 * node       := [type] qname STRING? annotation* block? ';'?
 * edge       := qnames (STRING? arrow STRING? qnames)+ ';'?
 * arrow      := ARROW | '-' label '->' | '--' label '-->' | '=' label '=>'
 * note       := 'note' ['for'] qname STRING? annotation* block? ';'?
 * attribute  := IDENT ('&lt;' type '&gt;')? ':' value ';'?
 * </pre>
 * Syntax errors are collected as diagnostics; after an error the parser skips to the
 * next statement boundary and continues.
 */
public class DygramParser {

	private static final Logger logger = LoggerFactory.getLogger(DygramParser.class);

	private List<DygramToken> tokens;
	private int current;
	private List<Diagnostic> errors;

	/**
	 * Parses a complete document.
	 *
	 * @param source DyGram source text
	 * @return raw declarations plus every syntax error found
	 */
	public synchronized ParsedDocument parse(String source) {
		DygramTokenizer tokenizer = new DygramTokenizer(source);
		this.tokens = tokenizer.tokenize();
		this.current = 0;
		this.errors = new ArrayList<>();
		tokenizer.errors().forEach(this::record);

		BlockContent content = new BlockContent();
		parseStatements(content, true);

		logger.debug("Parsed {} node, {} edge and {} note declarations with {} syntax errors",
				content.nodes.size(), content.edges.size(), content.notes.size(), errors.size());
		return new ParsedDocument(content.title, content.annotations, content.attributes, content.nodes,
				content.edges, content.notes, errors);
	}

	private void parseStatements(BlockContent out, boolean topLevel) {
		while (!isAtEnd()) {
			if (check(TokenType.RBRACE)) {
				if (!topLevel) {
					return;
				}
				record(new DygramParseException("Unexpected '}'", peek().position()));
				advance();
				continue;
			}
			try {
				parseStatement(out, topLevel);
			} catch (DygramParseException e) {
				record(e);
				synchronize();
			}
		}
	}

	private void parseStatement(BlockContent out, boolean topLevel) {
		DygramToken token = peek();
		switch (token.type()) {
			case SEMICOLON -> advance();
			case AT -> out.annotations.addAll(parseAnnotations());
			case IDENTIFIER -> {
				if (topLevel && token.text().equals("machine") && checkAt(1, TokenType.STRING)) {
					parseMachine(out);
				} else if (token.text().equalsIgnoreCase("note") && checkAt(1, TokenType.IDENTIFIER)) {
					out.notes.add(parseNote());
				} else if (checkAt(1, TokenType.COLON) || checkAt(1, TokenType.LT)) {
					out.attributes.add(parseAttribute());
				} else {
					parseNodeOrEdge(out);
				}
			}
			default -> throw error("Unexpected " + describe(token));
		}
	}

	private void parseMachine(BlockContent out) {
		advance(); // machine
		out.title = advance().text();
		out.annotations.addAll(parseAnnotations());
		if (match(TokenType.LBRACE)) {
			parseStatements(out, false);
			expect(TokenType.RBRACE, "Expected '}' to close machine block");
		}
		match(TokenType.SEMICOLON);
	}

	private void parseNodeOrEdge(BlockContent out) {
		SourcePosition position = peek().position();
		String first = parseQualifiedName();

		if (check(TokenType.COMMA) || isArrowStart(0) || (check(TokenType.STRING) && isArrowStart(1))) {
			out.edges.add(parseEdge(first, position));
			return;
		}

		String type = null;
		String name = first;
		if (check(TokenType.IDENTIFIER)) {
			if (first.contains(".")) {
				throw error("Node type must be a simple keyword, found '" + first + "'");
			}
			type = first.toLowerCase(Locale.ROOT);
			position = peek().position();
			name = parseQualifiedName();
		}
		out.nodes.add(parseNodeRest(type, name, position));
	}

	private NodeDeclaration parseNodeRest(String type, String name, SourcePosition position) {
		String title = check(TokenType.STRING) ? advance().text() : null;
		List<AnnotationDeclaration> annotations = parseAnnotations();
		BlockContent block = new BlockContent();
		if (match(TokenType.LBRACE)) {
			parseStatements(block, false);
			expect(TokenType.RBRACE, "Expected '}' to close block of '" + name + "'");
		}
		match(TokenType.SEMICOLON);
		List<AnnotationDeclaration> allAnnotations = new ArrayList<>(annotations);
		allAnnotations.addAll(block.annotations);
		return new NodeDeclaration(type, name, title, allAnnotations, block.attributes, block.nodes, block.edges,
				block.notes, position);
	}

	private EdgeDeclaration parseEdge(String first, SourcePosition position) {
		List<String> sources = new ArrayList<>();
		sources.add(first);
		while (match(TokenType.COMMA)) {
			sources.add(parseQualifiedName());
		}

		List<EdgeSegment> segments = new ArrayList<>();
		do {
			String sourceMultiplicity = check(TokenType.STRING) ? advance().text() : null;
			ArrowSpec arrow = parseArrow();
			String targetMultiplicity = null;
			if (check(TokenType.STRING) && checkAt(1, TokenType.IDENTIFIER)) {
				targetMultiplicity = advance().text();
			}
			List<String> targets = new ArrayList<>();
			targets.add(parseQualifiedName());
			while (match(TokenType.COMMA)) {
				targets.add(parseQualifiedName());
			}
			segments.add(new EdgeSegment(arrow.type(), arrow.label(), arrow.attributes(), sourceMultiplicity,
					targetMultiplicity, targets));
		} while (isArrowStart(0) || (check(TokenType.STRING) && isArrowStart(1)));

		match(TokenType.SEMICOLON);
		return new EdgeDeclaration(sources, segments, position);
	}

	private ArrowSpec parseArrow() {
		DygramToken opener = peek();
		if (opener.type() == TokenType.ARROW) {
			advance();
			return new ArrowSpec(arrowType(opener), null, List.of());
		}
		if (!isArrowStart(0)) {
			throw error("Expected arrow but found " + describe(opener));
		}
		advance();

		List<DygramToken> labelTokens = new ArrayList<>();
		while (!check(TokenType.ARROW)) {
			if (isAtEnd() || check(TokenType.LBRACE) || check(TokenType.RBRACE)) {
				throw new DygramParseException("Unterminated edge label", opener.position());
			}
			labelTokens.add(advance());
		}
		DygramToken closer = advance();
		ArrowType type = arrowType(closer);

		List<AttributeDeclaration> attributes = labelAttributes(labelTokens);
		if (attributes != null) {
			return new ArrowSpec(type, null, attributes);
		}
		if (labelTokens.size() == 1 && labelTokens.get(0).type() == TokenType.STRING) {
			return new ArrowSpec(type, labelTokens.get(0).text(), List.of());
		}
		return new ArrowSpec(type, joinWords(labelTokens), List.of());
	}

	/**
	 * Interprets label tokens of the form {@code key: value; key: value} as attributes, or
	 * returns {@code null} when the label is plain text.
	 */
	private List<AttributeDeclaration> labelAttributes(List<DygramToken> labelTokens) {
		if (labelTokens.size() < 3
				|| labelTokens.get(0).type() != TokenType.IDENTIFIER
				|| labelTokens.get(1).type() != TokenType.COLON) {
			return null;
		}
		List<AttributeDeclaration> attributes = new ArrayList<>();
		int i = 0;
		while (i < labelTokens.size()) {
			DygramToken name = labelTokens.get(i);
			if (name.type() != TokenType.IDENTIFIER || i + 1 >= labelTokens.size()
					|| labelTokens.get(i + 1).type() != TokenType.COLON) {
				return null;
			}
			int end = i + 2;
			while (end < labelTokens.size() && labelTokens.get(end).type() != TokenType.SEMICOLON) {
				end++;
			}
			List<DygramToken> valueTokens = labelTokens.subList(i + 2, end);
			if (valueTokens.isEmpty()) {
				return null;
			}
			attributes.add(new AttributeDeclaration(name.text(), null, labelValue(valueTokens), name.position()));
			i = end + 1;
		}
		return attributes;
	}

	private AttributeValue labelValue(List<DygramToken> valueTokens) {
		if (valueTokens.size() == 1) {
			DygramToken only = valueTokens.get(0);
			return switch (only.type()) {
				case STRING -> AttributeValue.text(only.text());
				case NUMBER -> AttributeValue.number(new BigDecimal(only.text()));
				case IDENTIFIER -> literalIdentifier(only.text());
				default -> AttributeValue.text(only.text());
			};
		}
		return AttributeValue.text(joinWords(valueTokens));
	}

	private String joinWords(List<DygramToken> words) {
		StringBuilder sb = new StringBuilder();
		DygramToken previous = null;
		for (DygramToken word : words) {
			boolean glue = previous != null
					&& (word.type() == TokenType.DOT || previous.type() == TokenType.DOT || word.type() == TokenType.COLON);
			if (previous != null && !glue) {
				sb.append(' ');
			}
			sb.append(word.text());
			previous = word;
		}
		return sb.toString();
	}

	private NoteDeclaration parseNote() {
		advance(); // note
		if (check(TokenType.IDENTIFIER) && peek().text().equals("for") && checkAt(1, TokenType.IDENTIFIER)) {
			advance();
		}
		SourcePosition position = peek().position();
		String target = parseQualifiedName();
		String content = check(TokenType.STRING) ? advance().text() : "";
		List<AnnotationDeclaration> annotations = new ArrayList<>(parseAnnotations());
		BlockContent block = new BlockContent();
		if (match(TokenType.LBRACE)) {
			parseStatements(block, false);
			expect(TokenType.RBRACE, "Expected '}' to close note block");
		}
		annotations.addAll(block.annotations);
		match(TokenType.SEMICOLON);
		return new NoteDeclaration(target, content, annotations, block.attributes, position);
	}

	private AttributeDeclaration parseAttribute() {
		DygramToken name = advance();
		TypeRef type = null;
		if (match(TokenType.LT)) {
			type = parseType();
			expect(TokenType.GT, "Expected '>' to close type of attribute '" + name.text() + "'");
		}
		expect(TokenType.COLON, "Expected ':' after attribute '" + name.text() + "'");
		AttributeValue value = parseValue();
		match(TokenType.SEMICOLON);
		return new AttributeDeclaration(name.text(), type, value, name.position());
	}

	private TypeRef parseType() {
		DygramToken name = expect(TokenType.IDENTIFIER, "Expected type name");
		List<TypeRef> arguments = new ArrayList<>();
		if (match(TokenType.LT)) {
			do {
				arguments.add(parseType());
			} while (match(TokenType.COMMA));
			expect(TokenType.GT, "Expected '>' to close generic type '" + name.text() + "'");
		}
		return new TypeRef(name.text(), arguments);
	}

	private AttributeValue parseValue() {
		DygramToken token = peek();
		return switch (token.type()) {
			case STRING -> AttributeValue.text(advance().text());
			case NUMBER -> AttributeValue.number(new BigDecimal(advance().text()));
			case IDENTIFIER -> literalIdentifier(parseQualifiedName());
			case LBRACKET -> {
				advance();
				List<AttributeValue> items = new ArrayList<>();
				if (!check(TokenType.RBRACKET)) {
					do {
						items.add(parseValue());
					} while (match(TokenType.COMMA));
				}
				expect(TokenType.RBRACKET, "Expected ']' to close array");
				yield AttributeValue.list(items);
			}
			default -> throw error("Expected attribute value but found " + describe(token));
		};
	}

	private AttributeValue literalIdentifier(String text) {
		return switch (text) {
			case "true" -> AttributeValue.bool(true);
			case "false" -> AttributeValue.bool(false);
			default -> AttributeValue.text(text);
		};
	}

	private List<AnnotationDeclaration> parseAnnotations() {
		List<AnnotationDeclaration> annotations = new ArrayList<>();
		while (check(TokenType.AT)) {
			DygramToken at = advance();
			DygramToken name = expect(TokenType.IDENTIFIER, "Expected annotation name after '@'");
			String value = null;
			if (match(TokenType.LPAREN)) {
				if (check(TokenType.STRING) || check(TokenType.NUMBER) || check(TokenType.IDENTIFIER)) {
					value = advance().text();
				}
				expect(TokenType.RPAREN, "Expected ')' to close annotation @" + name.text());
			}
			annotations.add(new AnnotationDeclaration(name.text(), value, at.position()));
		}
		return annotations;
	}

	private String parseQualifiedName() {
		StringBuilder sb = new StringBuilder(expect(TokenType.IDENTIFIER, "Expected name but found " + describe(peek())).text());
		while (check(TokenType.DOT) && checkAt(1, TokenType.IDENTIFIER)) {
			advance();
			sb.append('.').append(advance().text());
		}
		return sb.toString();
	}

	private ArrowType arrowType(DygramToken token) {
		return ArrowType.fromSymbol(token.text())
				.orElseThrow(() -> new DygramParseException("Unknown arrow '" + token.text() + "'", token.position()));
	}

	private boolean isArrowStart(int offset) {
		DygramToken token = peekAt(offset);
		return switch (token.type()) {
			case ARROW, DASH, DOUBLE_DASH, EQUALS -> true;
			default -> false;
		};
	}

	/**
	 * Skips to the next statement boundary: past a {@code ;} or a balanced block, or up to
	 * (not past) the {@code }} closing the enclosing block.
	 */
	private void synchronize() {
		int depth = 0;
		while (!isAtEnd()) {
			TokenType type = peek().type();
			if (type == TokenType.SEMICOLON && depth == 0) {
				advance();
				return;
			}
			if (type == TokenType.LBRACE) {
				depth++;
			} else if (type == TokenType.RBRACE) {
				if (depth == 0) {
					return;
				}
				depth--;
				advance();
				if (depth == 0) {
					return;
				}
				continue;
			}
			advance();
		}
	}

	private void record(DygramParseException e) {
		Diagnostic diagnostic = Diagnostic.error(DiagnosticKind.SYNTAX_ERROR, "SYNTAX_ERROR", e.getMessage());
		errors.add(e.position() != null ? diagnostic.at(e.position()) : diagnostic);
	}

	private DygramParseException error(String message) {
		return new DygramParseException(message, peek().position());
	}

	private String describe(DygramToken token) {
		return token.type() == TokenType.EOF ? "end of input" : "'" + token.text() + "'";
	}

	private DygramToken expect(TokenType type, String message) {
		if (check(type)) {
			return advance();
		}
		throw error(message);
	}

	private boolean match(TokenType type) {
		if (check(type)) {
			advance();
			return true;
		}
		return false;
	}

	private DygramToken peek() {
		return tokens.get(current);
	}

	private DygramToken peekAt(int offset) {
		int index = Math.min(current + offset, tokens.size() - 1);
		return tokens.get(index);
	}

	private DygramToken advance() {
		if (!isAtEnd()) {
			current++;
		}
		return tokens.get(current - 1);
	}

	private boolean check(TokenType type) {
		return peek().type() == type;
	}

	private boolean checkAt(int offset, TokenType type) {
		return peekAt(offset).type() == type;
	}

	private boolean isAtEnd() {
		return peek().type() == TokenType.EOF;
	}

	private record ArrowSpec(ArrowType type, String label, List<AttributeDeclaration> attributes) {
	}

	private static final class BlockContent {
		private String title;
		private final List<AnnotationDeclaration> annotations = new ArrayList<>();
		private final List<AttributeDeclaration> attributes = new ArrayList<>();
		private final List<NodeDeclaration> nodes = new ArrayList<>();
		private final List<EdgeDeclaration> edges = new ArrayList<>();
		private final List<NoteDeclaration> notes = new ArrayList<>();
	}
}
