package com.questrail.gridcheck.observability;

/**
 * Receives one event per validation call.
 * Implementations can provide logging, metrics, or tracing.
 * <p>
 * Sinks are invoked synchronously on the validating thread and must therefore
 * be thread-safe if the validator is shared.
 */
public interface ValidationObservabilitySink {
    /**
     * Called when a candidate satisfied every rule.
     * @param event the accepted candidate
     */
    void onAccepted(ValidationEvent event);

    /**
     * Called when a candidate was rejected.
     * @param event the rejected candidate; {@link ValidationEvent#violation()} is present
     */
    void onRejected(ValidationEvent event);
}
