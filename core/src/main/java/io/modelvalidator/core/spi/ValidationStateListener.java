package io.modelvalidator.core.spi;

import io.modelvalidator.core.model.EvaluationResult;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Hook for rendering layers that need to react to validity changes.
 *
 * <p>Called after every validation pass, synchronously on the validating thread. Exceptions thrown
 * by listeners are caught by the validator and logged; they do NOT affect validation.
 */
@FunctionalInterface
public interface ValidationStateListener {

    /**
     * Called after a validation pass has been applied.
     *
     * @param event the trigger, the new result and the fields that may show errors
     */
    void onValidated(ValidationStateEvent event);

    /** What caused a validation pass. */
    enum Trigger {
        FIELD,
        FORM,
        RESET
    }

    /**
     * Event emitted after a validation pass.
     *
     * @param trigger what caused the pass
     * @param field the field for {@link Trigger#FIELD}, otherwise {@code null}
     * @param result the new evaluation result
     * @param fieldsThatMayShowErrors unmodifiable copy of the touched fields after the pass, in touch order
     */
    record ValidationStateEvent(
            Trigger trigger, String field, EvaluationResult result, Set<String> fieldsThatMayShowErrors) {

        public ValidationStateEvent {
            fieldsThatMayShowErrors = Collections.unmodifiableSet(new LinkedHashSet<>(fieldsThatMayShowErrors));
        }

        public boolean valid() {
            return result.isValid();
        }
    }
}
