package com.questrail.gridcheck.sudoku;

/**
 * SudokuSymbols
 * -----------------------------------------------------------------------------
 * Decodes cell symbols into integer values.
 *
 * <pre>
 * '0'..'9' → 0..9
 * 'A'..'Z' → 10..35
 * </pre>
 *
 * Anything else is undecodable: lowercase letters, punctuation, non-ASCII
 * digits, empty or multi-character symbols. Decoding does not range-check;
 * {@code '0'} decodes cleanly to 0 and is rejected later against [1, N].
 */
final class SudokuSymbols
{
    static final int FIRST_LETTER_VALUE = 10;

    /** Largest value any symbol can decode to ('Z'). */
    static final int MAX_VALUE = FIRST_LETTER_VALUE + ('Z' - 'A');

    private SudokuSymbols() {}

    static boolean isEmpty(String symbol, char emptyMarker)
    {
        return symbol != null && symbol.length() == 1 && symbol.charAt(0) == emptyMarker;
    }

    /**
     * @throws SymbolException if the symbol is not a single digit or uppercase letter
     */
    static int decode(String symbol) throws SymbolException
    {
        if (symbol == null) {
            throw new SymbolException("missing symbol");
        }
        if (symbol.length() != 1) {
            throw new SymbolException("symbol \"" + symbol + "\" is not a single character");
        }

        char c = symbol.charAt(0);
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'A' && c <= 'Z') {
            return FIRST_LETTER_VALUE + (c - 'A');
        }
        throw new SymbolException("symbol '" + c + "' is not a digit or uppercase letter");
    }
}
