package org.javai.dygram.condition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.math.BigDecimal;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConditionEvaluatorTest {

	private final ConditionEvaluator evaluator = new ConditionEvaluator();

	@Test
	void comparesNumbers() {
		EvaluationContext context = EvaluationContext.builder().variable("count", 5).build();

		assertThat(evaluator.evaluate("(count > 10)", context)).isFalse();
		assertThat(evaluator.evaluate("count < 10", context)).isTrue();
		assertThat(evaluator.evaluate("count >= 5 && count <= 5", context)).isTrue();
		assertThat(evaluator.evaluate("count == 5.0", context)).isTrue();
		assertThat(evaluator.evaluate("count != 5", context)).isFalse();
	}

	@Test
	void malformedExpressionIsFalseWithoutThrowing() {
		EvaluationContext context = EvaluationContext.builder().variable("count", 5).build();

		assertThat(evaluator.evaluate("(count >", context)).isFalse();
		assertThat(evaluator.evaluate("", context)).isFalse();
		assertThat(evaluator.evaluate("count ? 1", context)).isFalse();
	}

	@Test
	void arithmeticIsNotPartOfTheLanguage() {
		EvaluationContext context = EvaluationContext.builder().variable("count", 5).build();

		assertThat(evaluator.evaluate("count + 1 > 5", context)).isFalse();
		assertThatThrownBy(() -> ConditionParser.parse("count / 0 == 1")).isInstanceOf(ConditionException.class);
	}

	@Test
	void deeplyNestedExpressionIsFalseWithoutOverflowingTheStack() {
		String parens = "(".repeat(50_000) + "true" + ")".repeat(50_000);
		String negations = "!".repeat(50_000) + "true";

		assertThat(evaluator.evaluate(parens, EvaluationContext.empty())).isFalse();
		assertThat(evaluator.evaluate(negations, EvaluationContext.empty())).isFalse();
		assertThatThrownBy(() -> ConditionParser.parse(parens))
				.isInstanceOf(ConditionException.class)
				.hasMessageContaining("nests deeper than");
	}

	@Test
	void moderateNestingStillEvaluates() {
		String nested = "(".repeat(20) + "!!true" + ")".repeat(20);

		assertThat(evaluator.evaluate(nested, EvaluationContext.empty())).isTrue();
		assertThat(evaluator.evaluate("!(!(count > 1) || false)", EvaluationContext.builder().variable("count", 2).build()))
				.isTrue();
	}

	@Test
	void undefinedVariableIsFalse() {
		assertThat(evaluator.evaluate("missing > 1", EvaluationContext.empty())).isFalse();
	}

	@Test
	void resolvesTemplateSyntaxAgainstNodeAttributes() {
		EvaluationContext context = EvaluationContext.builder()
				.node("config", Map.of("maxRetries", new BigDecimal("3")))
				.errorCount(2)
				.build();

		assertThat(evaluator.evaluate("{{ config.maxRetries }} == 3", context)).isTrue();
		assertThat(evaluator.evaluate("errorCount < {{ config.maxRetries }}", context)).isTrue();
		assertThat(evaluator.evaluate("errors == 2", context)).isTrue();
	}

	@Test
	void acceptsLegacyStrictEqualityAndWrappingQuotes() {
		EvaluationContext context = EvaluationContext.builder().variable("status", "ready").build();

		assertThat(evaluator.evaluate("status === 'ready'", context)).isTrue();
		assertThat(evaluator.evaluate("\"status !== 'done'\"", context)).isTrue();
	}

	@Test
	void booleanOperatorsShortCircuitPastUndefinedOperands() {
		EvaluationContext context = EvaluationContext.builder().variable("flag", true).build();

		assertThat(evaluator.evaluate("flag || missing > 1", context)).isTrue();
		assertThat(evaluator.evaluate("!flag && missing > 1", context)).isFalse();
		assertThat(evaluator.evaluate("flag && missing > 1", context)).isFalse();
	}

	@Test
	void comparingDifferentTypesIsFalse() {
		EvaluationContext context = EvaluationContext.builder().variable("status", "ready").build();

		assertThat(evaluator.evaluate("status > 1", context)).isFalse();
		assertThat(evaluator.evaluate("status == 1", context)).isFalse();
	}

	@Test
	void activeStateBuiltInDefaultsToEmptyString() {
		EvaluationContext context = EvaluationContext.builder().activeState(null).build();

		assertThat(evaluator.evaluate("activeState == ''", context)).isTrue();
	}

	@Test
	void nullLiteralMatchesVariableHoldingNull() {
		EvaluationContext context = EvaluationContext.builder().variable("value", null).build();

		assertThat(evaluator.evaluate("value == null", context)).isTrue();
	}

	@Test
	void parserReportsTrailingTokens() {
		assertThatThrownBy(() -> ConditionParser.parse("a == 1 b"))
				.isInstanceOf(ConditionException.class)
				.hasMessageContaining("Unexpected 'b'");
	}

	@Test
	void parserCollectsVariables() {
		assertThat(ConditionParser.parse("config.retries > 1 && !(done == true)").variables())
				.containsExactly("config.retries", "done");
	}
}
