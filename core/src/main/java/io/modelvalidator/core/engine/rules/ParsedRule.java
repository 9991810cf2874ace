package io.modelvalidator.core.engine.rules;

import java.util.List;

/**
 * One rule of a field's pipe expression, e.g. {@code between:5,20}.
 *
 * @param name the rule name ({@code between})
 * @param params raw parameters ({@code ["5", "20"]}), empty if none
 * @param token the original token, used in error reports
 */
record ParsedRule(String name, List<String> params, String token) {

    ParsedRule {
        params = List.copyOf(params);
    }

    String param(int index) {
        return params.get(index);
    }
}
