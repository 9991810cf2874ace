package io.modelvalidator.core.spi;

/**
 * Handle returned by a subscribe call. {@link #unsubscribe()} MUST be idempotent and MUST NOT
 * mutate the observed source.
 */
@FunctionalInterface
public interface Subscription {

    /** Detaches the listener. Calling it again has no effect. */
    void unsubscribe();
}
