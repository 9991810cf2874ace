package io.modelvalidator.core.error;

/**
 * Common parent of the errors this library raises. A model that does not satisfy its rules is not
 * an error: its messages live in {@link io.modelvalidator.core.model.EvaluationResult}.
 *
 * <p>Subclasses report the {@link Stage} that failed and, when the problem belongs to one rule
 * expression, the field that expression is declared for.
 */
public abstract class ModelValidatorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Where the failure was detected. */
    public enum Stage {
        /** Reading or schema-checking a validation config document. */
        CONFIG_LOAD,
        /** Compiling the rule spec at the start of a validation pass. */
        VALIDATION_PASS
    }

    private final Stage stage;
    private final String field;

    protected ModelValidatorException(Stage stage, String field, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.field = field;
    }

    public Stage stage() {
        return stage;
    }

    /** Field whose rule expression is at fault, or {@code null}. */
    public String field() {
        return field;
    }

    public boolean hasField() {
        return field != null;
    }
}
