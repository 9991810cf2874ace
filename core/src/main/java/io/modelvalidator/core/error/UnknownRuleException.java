package io.modelvalidator.core.error;

/** Thrown when a rule expression names a rule the evaluator does not know. */
public final class UnknownRuleException extends RuleConfigurationException {

    private static final long serialVersionUID = 1L;

    public UnknownRuleException(String message, String field, String rule) {
        super(message, field, rule);
    }
}
