package io.modelvalidator.core.engine;

import io.modelvalidator.core.spi.ModelChange;
import io.modelvalidator.core.spi.ObservableModel;
import io.modelvalidator.core.spi.Subscription;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires mutation notifications of an {@link ObservableModel} to validation calls.
 *
 * <p>{@code UPDATE} and {@code ADD} notifications that name a field validate that field; those
 * without a field name validate the whole form. Other kinds are ignored. Models that are not
 * observable, and any model in manual mode, get no subscription.
 */
public final class ModelBinding {

    private static final Logger LOG = LoggerFactory.getLogger(ModelBinding.class);

    /** Receives the validation calls routed by the binding. */
    public interface Target {

        boolean validateField(String field);

        boolean validateForm();
    }

    private final Target target;
    private Subscription subscription;

    public ModelBinding(Target target) {
        this.target = Objects.requireNonNull(target, "target must not be null");
    }

    /**
     * Detaches from the previous model and, unless {@code manual}, subscribes to the new one.
     *
     * @param model the new model, possibly {@code null}
     * @param manual if {@code true}, no subscription is installed
     */
    public void bind(Object model, boolean manual) {
        unbind();
        if (manual || !(model instanceof ObservableModel observable)) {
            LOG.debug(
                    "Model not observed: model_type={} manual={}",
                    model != null ? model.getClass().getSimpleName() : "none",
                    manual);
            return;
        }
        subscription = observable.subscribe(this::onChange);
        LOG.debug("Subscribed to model: model_type={}", model.getClass().getSimpleName());
    }

    /** Removes the current subscription, if any. Safe to call repeatedly. */
    public void unbind() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
            LOG.debug("Unsubscribed from model");
        }
    }

    public boolean isSubscribed() {
        return subscription != null;
    }

    void onChange(ModelChange change) {
        switch (change.kind()) {
            case UPDATE, ADD -> {
                if (change.hasFieldName()) {
                    target.validateField(change.fieldName());
                } else {
                    target.validateForm();
                }
            }
            default -> LOG.trace("Ignoring model change: kind={} field={}", change.kind(), change.fieldName());
        }
    }
}
