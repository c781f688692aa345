package com.questrail.gridcheck.api;

import java.util.Objects;

/**
 * The first rule a candidate broke.
 *
 * @param kind   which rule was violated
 * @param detail human-readable diagnostic, intended for logs only
 */
public record Violation(ViolationKind kind, String detail)
{
    public Violation {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(detail, "detail");
    }

    @Override
    public String toString() {
        return kind + ": " + detail;
    }
}
