package com.questrail.gridcheck.ipv4;

import com.questrail.gridcheck.api.ValidationResult;
import com.questrail.gridcheck.api.ValidationSubject;
import com.questrail.gridcheck.api.Validator;
import com.questrail.gridcheck.api.ViolationKind;
import com.questrail.gridcheck.config.ValidationConfig;
import com.questrail.gridcheck.observability.ValidationEvent;
import com.questrail.gridcheck.observability.ValidationObservabilitySink;

import java.util.List;
import java.util.Objects;

/**
 * Ipv4AddressValidator
 * -----------------------------------------------------------------------------
 * Syntactic checker for dotted-quad IPv4 address strings such as
 * {@code "192.168.0.1"}.
 *
 * <p>A candidate is valid iff splitting it on {@code '.'} yields exactly four
 * segments and every segment passes the rules in {@link Ipv4Segments}. No
 * trimming, hex, octal or shorthand forms are accepted: {@code " 1.2.3.4"},
 * {@code "01.2.3.4"} and {@code "1.2.3"} are all rejected.</p>
 *
 * <p>The validator never throws for any candidate. Rule failures raised
 * internally are converted into a rejected {@link ValidationResult} here.</p>
 */
public final class Ipv4AddressValidator implements Validator<String>
{
    private static final Ipv4AddressValidator DEFAULT = new Ipv4AddressValidator();

    /** Longest candidate prefix carried into observability events. */
    static final int MAX_RENDERED_LENGTH = 64;

    private final ValidationObservabilitySink sink;

    public Ipv4AddressValidator()
    {
        this(ValidationConfig.defaults());
    }

    public Ipv4AddressValidator(ValidationConfig config)
    {
        this.sink = Objects.requireNonNull(config, "config").sink();
    }

    /**
     * Returns {@code true} iff {@code candidate} is a well-formed dotted-quad
     * IPv4 address.
     */
    public static boolean isValidIPv4(String candidate)
    {
        return DEFAULT.isValid(candidate);
    }

    @Override
    public ValidationResult validate(String candidate)
    {
        ValidationResult result = check(candidate);
        ValidationEvent event = ValidationEvent.of(ValidationSubject.IPV4, render(candidate), result);
        if (result.isValid()) {
            sink.onAccepted(event);
        } else {
            sink.onRejected(event);
        }
        return result;
    }

    static String render(String candidate)
    {
        if (candidate == null) {
            return "null";
        }
        if (candidate.length() <= MAX_RENDERED_LENGTH) {
            return candidate;
        }
        return candidate.substring(0, MAX_RENDERED_LENGTH) + "... (" + candidate.length() + " chars)";
    }

    private static ValidationResult check(String candidate)
    {
        if (candidate == null) {
            return ValidationResult.rejected(ViolationKind.NULL_INPUT, "candidate is null");
        }
        try {
            List<String> segments = Ipv4Segments.requireFourSegments(candidate);
            for (int i = 0; i < segments.size(); i++) {
                Ipv4Segments.checkSegment(i, segments.get(i));
            }
            return ValidationResult.valid();
        }
        catch (SegmentException e) {
            return ValidationResult.rejected(e.kind(), e.getMessage());
        }
    }
}
