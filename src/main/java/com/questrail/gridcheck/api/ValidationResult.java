package com.questrail.gridcheck.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a single {@link Validator#validate(Object)} call.
 * <p>
 * A result is valid exactly when it carries no {@link Violation}.
 */
public record ValidationResult(Optional<Violation> violation)
{
    private static final ValidationResult VALID = new ValidationResult(Optional.empty());

    public ValidationResult {
        Objects.requireNonNull(violation, "violation");
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult rejected(Violation violation) {
        return new ValidationResult(Optional.of(Objects.requireNonNull(violation, "violation")));
    }

    public static ValidationResult rejected(ViolationKind kind, String detail) {
        return rejected(new Violation(kind, detail));
    }

    public boolean isValid() {
        return violation.isEmpty();
    }

    /**
     * Returns the kind of the violation, if the result is a rejection.
     */
    public Optional<ViolationKind> kind() {
        return violation.map(Violation::kind);
    }
}
