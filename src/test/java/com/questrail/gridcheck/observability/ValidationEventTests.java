package com.questrail.gridcheck.observability;

import com.questrail.gridcheck.api.ValidationResult;
import com.questrail.gridcheck.api.ValidationSubject;
import com.questrail.gridcheck.api.ViolationKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValidationEventTests
{
    @Test
    void acceptedEventHasNoViolation()
    {
        ValidationEvent event = ValidationEvent.of(ValidationSubject.IPV4, "1.2.3.4", ValidationResult.valid());
        assertTrue(event.isAccepted());
        assertNotNull(event.timestamp());
    }

    @Test
    void rejectsKindFromAnotherSubject()
    {
        ValidationResult sudokuFailure = ValidationResult.rejected(ViolationKind.DUPLICATE_IN_ROW, "dup");
        assertThrows(IllegalArgumentException.class,
                () -> ValidationEvent.of(ValidationSubject.IPV4, "1.2.3.4", sudokuFailure));
    }

    @Test
    void nullInputKindFitsEverySubject()
    {
        ValidationResult nullInput = ValidationResult.rejected(ViolationKind.NULL_INPUT, "null");
        assertFalse(ValidationEvent.of(ValidationSubject.IPV4, "null", nullInput).isAccepted());
        assertFalse(ValidationEvent.of(ValidationSubject.SUDOKU, "null", nullInput).isAccepted());
    }

    /**
     * The SLF4J sink only logs; it must accept both event shapes without
     * throwing regardless of the configured level.
     */
    @Test
    void slf4jSinkHandlesAcceptedAndRejected()
    {
        Slf4jValidationObservabilitySink sink = new Slf4jValidationObservabilitySink();
        assertDoesNotThrow(() -> sink.onAccepted(
                ValidationEvent.of(ValidationSubject.SUDOKU, "9x9 board", ValidationResult.valid())));
        assertDoesNotThrow(() -> sink.onRejected(
                ValidationEvent.of(ValidationSubject.SUDOKU, "9x9 board",
                        ValidationResult.rejected(ViolationKind.DUPLICATE_IN_BOX, "value 5 repeated in box 0"))));
    }

    @Test
    void nullSinkIgnoresEverything()
    {
        ValidationEvent event = ValidationEvent.of(ValidationSubject.IPV4, "x", ValidationResult.valid());
        assertDoesNotThrow(() -> NullObservabilitySink.INSTANCE.onAccepted(event));
        assertDoesNotThrow(() -> NullObservabilitySink.INSTANCE.onRejected(event));
    }
}
