package com.questrail.gridcheck.observability;

/**
 * No-op implementation of ValidationObservabilitySink.
 */
public final class NullObservabilitySink implements ValidationObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onAccepted(ValidationEvent event) {}

    @Override
    public void onRejected(ValidationEvent event) {}
}
