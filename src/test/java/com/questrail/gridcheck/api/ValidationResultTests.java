package com.questrail.gridcheck.api;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ValidationResultTests
{
    @Test
    void validCarriesNoViolation()
    {
        ValidationResult result = ValidationResult.valid();
        assertTrue(result.isValid());
        assertTrue(result.violation().isEmpty());
        assertTrue(result.kind().isEmpty());
    }

    @Test
    void rejectedCarriesKindAndDetail()
    {
        ValidationResult result = ValidationResult.rejected(ViolationKind.EMPTY_BOARD, "board has no rows");
        assertFalse(result.isValid());
        assertEquals(Optional.of(ViolationKind.EMPTY_BOARD), result.kind());
        assertEquals("board has no rows", result.violation().orElseThrow().detail());
        assertEquals("EMPTY_BOARD: board has no rows", result.violation().orElseThrow().toString());
    }

    @Test
    void nullsAreRejected()
    {
        assertThrows(NullPointerException.class, () -> new ValidationResult(null));
        assertThrows(NullPointerException.class, () -> ValidationResult.rejected(null));
        assertThrows(NullPointerException.class, () -> new Violation(null, "x"));
        assertThrows(NullPointerException.class, () -> new Violation(ViolationKind.NULL_INPUT, null));
    }

    @Test
    void validatorDefaultDelegatesToValidate()
    {
        Validator<String> nonEmpty = s -> s == null || s.isEmpty()
                ? ValidationResult.rejected(ViolationKind.NULL_INPUT, "empty")
                : ValidationResult.valid();

        assertTrue(nonEmpty.isValid("x"));
        assertFalse(nonEmpty.isValid(""));
    }

    @Test
    void kindsBelongToTheirSubject()
    {
        assertTrue(ViolationKind.NULL_INPUT.appliesTo(ValidationSubject.IPV4));
        assertTrue(ViolationKind.NULL_INPUT.appliesTo(ValidationSubject.SUDOKU));
        assertTrue(ViolationKind.LEADING_ZERO.appliesTo(ValidationSubject.IPV4));
        assertFalse(ViolationKind.LEADING_ZERO.appliesTo(ValidationSubject.SUDOKU));
        assertTrue(ViolationKind.DUPLICATE_IN_BOX.appliesTo(ValidationSubject.SUDOKU));
        assertFalse(ViolationKind.DUPLICATE_IN_BOX.appliesTo(ValidationSubject.IPV4));
    }
}
