package com.questrail.gridcheck.ipv4;

import com.questrail.gridcheck.api.ViolationKind;

import java.util.Objects;

/**
 * Raised by {@link Ipv4Segments} when a candidate breaks a dotted-quad rule.
 * Never escapes {@link Ipv4AddressValidator}.
 */
final class SegmentException extends Exception
{
    private final ViolationKind kind;

    SegmentException(ViolationKind kind, String message)
    {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    SegmentException(ViolationKind kind, String message, Throwable cause)
    {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    ViolationKind kind()
    {
        return kind;
    }
}
