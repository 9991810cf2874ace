package io.modelvalidator.core.engine.rules;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.modelvalidator.core.error.RuleSyntaxException;
import org.junit.jupiter.api.Test;

/** Tests for {@link RuleExpressionParser}. */
class RuleExpressionParserTest {

    @Test
    void splitsPipesAndCommas() {
        var rules = RuleExpressionParser.parse("qty", "required|numeric|between:1, 10");

        assertThat(rules).extracting(ParsedRule::name).containsExactly("required", "numeric", "between");
        assertThat(rules.get(2).params()).containsExactly("1", "10");
        assertThat(rules.get(2).token()).isEqualTo("between:1, 10");
        assertThat(rules.get(0).params()).isEmpty();
    }

    @Test
    void regexParameterIsTakenVerbatim() {
        var rules = RuleExpressionParser.parse("code", "regex:^\\d{2,3}$");

        assertThat(rules).singleElement().satisfies(rule -> {
            assertThat(rule.name()).isEqualTo("regex");
            assertThat(rule.params()).containsExactly("^\\d{2,3}$");
        });
    }

    @Test
    void blankExpressionHasNoRules() {
        assertThat(RuleExpressionParser.parse("name", "  ")).isEmpty();
        assertThat(RuleExpressionParser.parse("name", null)).isEmpty();
    }

    @Test
    void emptyTokenIsRejected() {
        assertThatThrownBy(() -> RuleExpressionParser.parse("name", "required||email"))
                .isInstanceOf(RuleSyntaxException.class)
                .hasMessageContaining("Empty rule")
                .satisfies(e -> assertThat(((RuleSyntaxException) e).field()).isEqualTo("name"));
    }

    @Test
    void missingRuleNameIsRejected() {
        assertThatThrownBy(() -> RuleExpressionParser.parse("age", ":5"))
                .isInstanceOf(RuleSyntaxException.class)
                .hasMessageContaining("Rule name missing");
    }

    @Test
    void trailingCommaYieldsEmptyParameter() {
        var rules = RuleExpressionParser.parse("color", "in:red,");

        assertThat(rules.get(0).params()).containsExactly("red", "");
    }
}
