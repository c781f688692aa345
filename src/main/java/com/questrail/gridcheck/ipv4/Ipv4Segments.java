package com.questrail.gridcheck.ipv4;

import com.questrail.gridcheck.api.ViolationKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Ipv4Segments
 * -----------------------------------------------------------------------------
 * Dotted-quad rules for IPv4 address candidates.
 *
 * <p>A candidate is split on the literal {@code '.'} into segments. Empty
 * segments are preserved, so a leading, trailing or doubled dot yields an
 * empty segment that fails {@link #checkSegment(int, String)} rather than
 * being special-cased.</p>
 *
 * <p>Each segment must, in order:</p>
 * <ol>
 *   <li>be non-empty</li>
 *   <li>have at most {@value #MAX_SEGMENT_LENGTH} characters</li>
 *   <li>consist only of ASCII digits {@code 0-9}</li>
 *   <li>have a value in [0, {@value #MAX_SEGMENT_VALUE}]</li>
 *   <li>not start with {@code '0'} unless it is exactly {@code "0"}</li>
 * </ol>
 */
final class Ipv4Segments
{
    static final char SEPARATOR = '.';
    static final int SEGMENT_COUNT = 4;
    static final int MAX_SEGMENT_LENGTH = 3;
    static final int MAX_SEGMENT_VALUE = 255;

    private Ipv4Segments() {}

    /**
     * Splits {@code candidate} on every {@code '.'}, keeping empty segments.
     * A string with no separator yields a single segment.
     */
    static List<String> split(String candidate)
    {
        List<String> segments = new ArrayList<>(SEGMENT_COUNT);
        int start = 0;
        for (int i = 0; i < candidate.length(); i++) {
            if (candidate.charAt(i) == SEPARATOR) {
                segments.add(candidate.substring(start, i));
                start = i + 1;
            }
        }
        segments.add(candidate.substring(start));
        return segments;
    }

    /**
     * Splits the candidate and checks that exactly four segments result.
     *
     * @throws SegmentException with {@link ViolationKind#SEGMENT_COUNT} otherwise
     */
    static List<String> requireFourSegments(String candidate) throws SegmentException
    {
        List<String> segments = split(candidate);
        if (segments.size() != SEGMENT_COUNT) {
            throw new SegmentException(ViolationKind.SEGMENT_COUNT,
                    "expected " + SEGMENT_COUNT + " segments, found " + segments.size());
        }
        return segments;
    }

    /**
     * Applies every per-segment rule and returns the segment's value.
     *
     * @param position 0-based segment position, for diagnostics only
     * @throws SegmentException describing the first rule broken
     */
    static int checkSegment(int position, String segment) throws SegmentException
    {
        if (segment.isEmpty()) {
            throw new SegmentException(ViolationKind.EMPTY_SEGMENT,
                    "segment " + position + " is empty");
        }
        if (segment.length() > MAX_SEGMENT_LENGTH) {
            throw new SegmentException(ViolationKind.SEGMENT_TOO_LONG,
                    describe(position, segment) + " is longer than " + MAX_SEGMENT_LENGTH + " characters");
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!isAsciiDigit(segment.charAt(i))) {
                throw new SegmentException(ViolationKind.NON_DIGIT_SEGMENT,
                        describe(position, segment) + " contains a non-digit at offset " + i);
            }
        }

        final int value;
        try {
            value = Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            throw new SegmentException(ViolationKind.NON_DIGIT_SEGMENT,
                    describe(position, segment) + " is not a decimal number", e);
        }
        if (value > MAX_SEGMENT_VALUE) {
            throw new SegmentException(ViolationKind.SEGMENT_OUT_OF_RANGE,
                    describe(position, segment) + " exceeds " + MAX_SEGMENT_VALUE);
        }

        if (segment.length() > 1 && segment.charAt(0) == '0') {
            throw new SegmentException(ViolationKind.LEADING_ZERO,
                    describe(position, segment) + " has a leading zero");
        }
        return value;
    }

    static boolean isAsciiDigit(char c)
    {
        return c >= '0' && c <= '9';
    }

    private static String describe(int position, String segment)
    {
        return "segment " + position + " (\"" + segment + "\")";
    }
}
