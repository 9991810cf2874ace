package io.modelvalidator.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link RuleSpec}. */
class RuleSpecTest {

    @Test
    void preservesDeclarationOrder() {
        var rules = RuleSpec.builder()
                .rule("name", "required")
                .rule("age", "numeric|max:99")
                .rule("email", "email")
                .build();

        assertThat(rules.fields()).containsExactly("name", "age", "email");
        assertThat(rules.rulesFor("age")).isEqualTo("numeric|max:99");
        assertThat(rules.rulesFor("unknown")).isNull();
    }

    @Test
    void isDefensivelyCopied() {
        Map<String, String> source = new LinkedHashMap<>();
        source.put("name", "required");
        var rules = RuleSpec.of(source);

        source.put("age", "numeric");

        assertThat(rules.fields()).containsExactly("name");
        assertThatThrownBy(() -> rules.asMap().put("x", "required"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void rejectsNullExpression() {
        Map<String, String> source = new HashMap<>();
        source.put("name", null);

        assertThatThrownBy(() -> RuleSpec.of(source))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("name");
    }

    @Test
    void equalityIsByContent() {
        assertThat(RuleSpec.of(Map.of("a", "required"))).isEqualTo(RuleSpec.builder().rule("a", "required").build());
        assertThat(RuleSpec.empty().isEmpty()).isTrue();
    }
}
