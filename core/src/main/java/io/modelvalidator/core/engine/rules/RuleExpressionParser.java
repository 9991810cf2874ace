package io.modelvalidator.core.engine.rules;

import io.modelvalidator.core.error.RuleSyntaxException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits a pipe expression such as {@code numeric|between:1,99} into {@link ParsedRule}s.
 *
 * <p>Parameters are comma-separated, except for {@code regex}, whose parameter is taken verbatim
 * up to the next pipe.
 */
final class RuleExpressionParser {

    private RuleExpressionParser() {}

    static List<ParsedRule> parse(String field, String expression) {
        List<ParsedRule> rules = new ArrayList<>();
        if (expression == null || expression.isBlank()) {
            return rules;
        }
        for (String rawToken : expression.split("\\|")) {
            String token = rawToken.trim();
            if (token.isEmpty()) {
                throw new RuleSyntaxException(
                        "Empty rule in expression '" + expression + "' for field '" + field + "'", field, expression);
            }
            int colon = token.indexOf(':');
            if (colon < 0) {
                rules.add(new ParsedRule(token, List.of(), token));
                continue;
            }
            String name = token.substring(0, colon).trim();
            String paramText = token.substring(colon + 1);
            if (name.isEmpty()) {
                throw new RuleSyntaxException("Rule name missing in '" + token + "' for field '" + field + "'", field, token);
            }
            List<String> params = "regex".equals(name)
                    ? List.of(paramText)
                    : Arrays.stream(paramText.split(",", -1)).map(String::trim).toList();
            rules.add(new ParsedRule(name, params, token));
        }
        return rules;
    }
}
