package io.modelvalidator.core.error;

/**
 * Thrown when a known rule carries malformed parameters (missing, non-numeric where a number is
 * expected, or an invalid regular expression).
 */
public final class RuleSyntaxException extends RuleConfigurationException {

    private static final long serialVersionUID = 1L;

    public RuleSyntaxException(String message, String field, String rule) {
        super(message, field, rule);
    }

    public RuleSyntaxException(String message, Throwable cause, String field, String rule) {
        super(message, cause, field, rule);
    }
}
