package com.questrail.gridcheck.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ValidationObservabilitySink that emits logs via SLF4J.
 * <p>
 * Rejections are ordinary results, so everything is logged at debug level.
 */
public final class Slf4jValidationObservabilitySink implements ValidationObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jValidationObservabilitySink.class);

    @Override
    public void onAccepted(ValidationEvent event) {
        log.debug("{} accepted: {}", event.subject(), event.input());
    }

    @Override
    public void onRejected(ValidationEvent event) {
        event.violation().ifPresent(v ->
            log.debug("{} rejected: {} [{}] {}", event.subject(), event.input(), v.kind(), v.detail()));
    }
}
