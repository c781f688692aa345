package com.questrail.gridcheck.sudoku;

/**
 * Raised by {@link SudokuSymbols} when a cell does not hold a decodable
 * symbol. Never escapes {@link SudokuValidator}.
 */
final class SymbolException extends Exception
{
    SymbolException(String message)
    {
        super(message);
    }
}
