package com.questrail.gridcheck.observability;

import com.questrail.gridcheck.api.ValidationResult;
import com.questrail.gridcheck.api.ValidationSubject;
import com.questrail.gridcheck.api.Violation;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Record describing the outcome of a single validation call.
 *
 * @param input a short rendering of the candidate, never the full structure
 */
public record ValidationEvent(
    Instant timestamp,
    ValidationSubject subject,
    String input,
    Optional<Violation> violation
) {
    public ValidationEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(violation, "violation");
        violation.ifPresent(v -> {
            if (!v.kind().appliesTo(subject)) {
                throw new IllegalArgumentException(v.kind() + " cannot be reported for " + subject);
            }
        });
    }

    public static ValidationEvent of(ValidationSubject subject, String input, ValidationResult result) {
        return new ValidationEvent(Instant.now(), subject, input, result.violation());
    }

    public boolean isAccepted() {
        return violation.isEmpty();
    }
}
