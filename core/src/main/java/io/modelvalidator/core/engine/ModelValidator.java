package io.modelvalidator.core.engine;

import io.modelvalidator.core.model.EvaluationResult;
import io.modelvalidator.core.model.RuleSpec;
import io.modelvalidator.core.spi.Subscription;
import io.modelvalidator.core.spi.ValidationStateListener;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validation state of one model, as seen by a rendering layer.
 *
 * <p>Every validate call evaluates the whole model; the field argument of {@link
 * #validateField(String)} only decides which field may display its errors afterwards. All
 * collections returned are unmodifiable.
 */
public interface ModelValidator extends AutoCloseable {

    /**
     * Sets the data to be validated and runs a validation pass. A new model identity clears all
     * touched fields; passing the current model is a no-op.
     */
    void setModel(Object model);

    /** The current model, or {@code null}. */
    Object getModel();

    /** Replaces the rules and resets the validator. */
    void setRules(RuleSpec rules);

    RuleSpec getRules();

    /**
     * Clears all touched fields and re-evaluates the model, so no errors are displayed until fields
     * are validated again. The touched fields are cleared even when the pass throws.
     */
    void reset();

    /**
     * Validates the model and marks the given field as touched. Call this when a field changes or
     * loses focus.
     *
     * @param field the field name
     * @return {@code true} if the field has no errors
     */
    boolean validateField(String field);

    /**
     * Validates the model and marks every failing field as touched. Call this on submit.
     *
     * @return {@code true} if the model has no errors
     */
    boolean validateForm();

    /** Errors of the latest pass, keyed by field. */
    Map<String, List<String>> errors();

    /** Total number of errors of the latest pass. */
    int errorCount();

    /** {@code true} while the latest pass found no errors. Covers the whole model. */
    boolean isValid();

    /** The immutable result of the latest pass. */
    EvaluationResult getLastResult();

    /**
     * Whether errors of the given field may be displayed right now. Says nothing about whether the
     * field actually has errors.
     */
    boolean showErrorsOnField(String field);

    /** Read-only view of the fields that may display errors. */
    Set<String> fieldsThatMayShowErrors();

    /** {@code true} while no field has been touched since the last reset. */
    boolean isPristine();

    /**
     * Registers a listener notified after every validation pass.
     *
     * @return handle to remove the listener
     */
    Subscription addStateListener(ValidationStateListener listener);

    /** Detaches from the model. The model itself is left untouched. */
    @Override
    void close();
}
