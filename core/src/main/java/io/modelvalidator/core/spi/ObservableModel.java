package io.modelvalidator.core.spi;

import java.util.Map;

/**
 * A model that publishes mutation notifications. This is the only contract the validator assumes
 * of a reactive model; it does not depend on any particular observable-state framework.
 *
 * <p>Notifications are delivered synchronously, before the mutating call returns. A listener that
 * throws makes the mutating call throw.
 */
public interface ObservableModel {

    /**
     * Registers a listener for mutation notifications.
     *
     * @param listener the listener to notify
     * @return a handle whose {@link Subscription#unsubscribe()} detaches the listener
     */
    Subscription subscribe(ModelChangeListener listener);

    /**
     * Returns a plain field→value copy of the current state. Mutating the returned map MUST NOT
     * affect the model.
     */
    Map<String, Object> snapshot();
}
