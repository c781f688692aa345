package com.questrail.gridcheck.api;

/**
 * ViolationKind
 * -----------------------------------------------------------------------------
 * Enumerates every rule a validator in this library can report as broken.
 *
 * <h2>Ordering</h2>
 * Validators stop at the first violated rule. The constants are declared in
 * the order each validator checks them, so the kind reported for a candidate
 * that breaks several rules is the earliest applicable one below.
 *
 * <h2>Subjects</h2>
 * Each kind belongs to one {@link ValidationSubject}, except
 * {@link #NULL_INPUT}, which any validator may report.
 */
public enum ViolationKind
{
    /**
     * The candidate itself was {@code null}.
     */
    NULL_INPUT(null),

    // -------------------------------------------------------------------------
    // IPv4
    // -------------------------------------------------------------------------

    /**
     * Splitting on {@code '.'} did not yield exactly four segments.
     */
    SEGMENT_COUNT(ValidationSubject.IPV4),

    /**
     * A segment was empty (leading, trailing or doubled dot).
     */
    EMPTY_SEGMENT(ValidationSubject.IPV4),

    /**
     * A segment had more than three characters.
     */
    SEGMENT_TOO_LONG(ValidationSubject.IPV4),

    /**
     * A segment contained a character other than an ASCII decimal digit.
     */
    NON_DIGIT_SEGMENT(ValidationSubject.IPV4),

    /**
     * A segment's decimal value was outside [0, 255].
     */
    SEGMENT_OUT_OF_RANGE(ValidationSubject.IPV4),

    /**
     * A multi-character segment started with {@code '0'}.
     */
    LEADING_ZERO(ValidationSubject.IPV4),

    // -------------------------------------------------------------------------
    // Sudoku
    // -------------------------------------------------------------------------

    /**
     * The board had no rows.
     */
    EMPTY_BOARD(ValidationSubject.SUDOKU),

    /**
     * A row was missing or its length differed from the number of rows.
     */
    NOT_SQUARE(ValidationSubject.SUDOKU),

    /**
     * The board dimension N has no integer square root.
     */
    SIZE_NOT_PERFECT_SQUARE(ValidationSubject.SUDOKU),

    /**
     * The board dimension exceeds what the symbol alphabet can encode.
     */
    SIZE_UNSUPPORTED(ValidationSubject.SUDOKU),

    /**
     * A filled cell held something other than a digit or uppercase letter.
     */
    INVALID_SYMBOL(ValidationSubject.SUDOKU),

    /**
     * A filled cell decoded to a value outside [1, N].
     */
    VALUE_OUT_OF_RANGE(ValidationSubject.SUDOKU),

    DUPLICATE_IN_ROW(ValidationSubject.SUDOKU),

    DUPLICATE_IN_COLUMN(ValidationSubject.SUDOKU),

    DUPLICATE_IN_BOX(ValidationSubject.SUDOKU);

    private final ValidationSubject subject;

    ViolationKind(ValidationSubject subject)
    {
        this.subject = subject;
    }

    /**
     * Returns {@code true} if a validator for {@code subject} may report this
     * kind.
     */
    public boolean appliesTo(ValidationSubject subject)
    {
        return this.subject == null || this.subject == subject;
    }
}
