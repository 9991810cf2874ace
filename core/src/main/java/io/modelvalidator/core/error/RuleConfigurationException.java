package io.modelvalidator.core.error;

/**
 * Abstract parent for rule configuration errors: a rule expression the evaluator cannot interpret.
 * Raised while a validation pass runs and never absorbed by the validator; it reaches the caller
 * of {@code validateField}, {@code validateForm}, {@code setModel}, {@code setRules} or the
 * mutating call on an observed model. Carries the offending {@code rule} token.
 */
public abstract class RuleConfigurationException extends ModelValidatorException {

    private static final long serialVersionUID = 1L;

    private final String rule;

    protected RuleConfigurationException(String message, String field, String rule) {
        super(Stage.VALIDATION_PASS, field, message, null);
        this.rule = rule;
    }

    protected RuleConfigurationException(String message, Throwable cause, String field, String rule) {
        super(Stage.VALIDATION_PASS, field, message, cause);
        this.rule = rule;
    }

    /** The rule token (e.g. {@code "max:abc"}) that could not be interpreted. */
    public String rule() {
        return rule;
    }
}
