package io.modelvalidator.core.spi;

/** Receives {@link ModelChange} notifications, synchronously on the mutating thread. */
@FunctionalInterface
public interface ModelChangeListener {

    void onChange(ModelChange change);
}
