package com.questrail.gridcheck.sudoku;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SudokuSymbolsTest
{
    @Test
    void digitsDecodeToFaceValue() throws SymbolException
    {
        for (char c = '0'; c <= '9'; c++) {
            assertEquals(c - '0', SudokuSymbols.decode(String.valueOf(c)));
        }
    }

    @Test
    void uppercaseLettersContinueAfterNine() throws SymbolException
    {
        assertEquals(10, SudokuSymbols.decode("A"));
        assertEquals(16, SudokuSymbols.decode("G"));
        assertEquals(35, SudokuSymbols.decode("Z"));
        assertEquals(SudokuSymbols.MAX_VALUE, SudokuSymbols.decode("Z"));
    }

    @Test
    void everythingElseIsUndecodable()
    {
        for (String symbol : new String[] { "a", "z", "-", " ", "*", "@", "[", "10", "", "١" }) {
            assertThrows(SymbolException.class, () -> SudokuSymbols.decode(symbol), symbol);
        }
        assertThrows(SymbolException.class, () -> SudokuSymbols.decode(null));
    }

    @Test
    void emptyMarkerMatchesOnlyItself()
    {
        assertTrue(SudokuSymbols.isEmpty("-", '-'));
        assertFalse(SudokuSymbols.isEmpty("--", '-'));
        assertFalse(SudokuSymbols.isEmpty(".", '-'));
        assertFalse(SudokuSymbols.isEmpty(null, '-'));
        assertTrue(SudokuSymbols.isEmpty(".", '.'));
    }
}
