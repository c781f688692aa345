package com.questrail.gridcheck.sudoku;

import com.questrail.gridcheck.api.ViolationKind;

import java.util.Objects;

/**
 * Raised by {@link BoardShape} when a grid cannot be a Sudoku board.
 * Never escapes {@link SudokuValidator}.
 */
final class BoardShapeException extends Exception
{
    private final ViolationKind kind;

    BoardShapeException(ViolationKind kind, String message)
    {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    ViolationKind kind()
    {
        return kind;
    }
}
