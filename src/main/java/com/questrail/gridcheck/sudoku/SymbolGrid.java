package com.questrail.gridcheck.sudoku;

import java.util.List;

/**
 * SymbolGrid
 * -----------------------------------------------------------------------------
 * A read-only view of a two-dimensional grid of Sudoku symbols, indexed by
 * 0-based row and column.
 *
 * <h2>Why this exists</h2>
 * Callers hold boards in different shapes ({@code char[][]}, lists of string
 * cells parsed from text). This interface isolates that representation from
 * {@link SudokuValidator}, which only needs row counts, row lengths and the
 * symbol in each cell.
 *
 * <h2>No Copying, No Mutation</h2>
 * Views returned by the factories wrap the caller's data directly. They never
 * copy or modify it, and they make no attempt to validate it: ragged rows,
 * {@code null} rows and multi-character symbols are all representable and are
 * the validator's business to reject.
 */
public interface SymbolGrid
{
    /**
     * Returned by {@link #rowLength(int)} for a row that is {@code null}.
     */
    int MISSING_ROW = -1;

    /**
     * Returns the number of rows.
     */
    int rowCount();

    /**
     * Returns the number of cells in the given row, or {@link #MISSING_ROW}
     * if the row is {@code null}.
     *
     * @param row 0-based row, in [0, {@link #rowCount()})
     */
    int rowLength(int row);

    /**
     * Returns the symbol in the given cell.
     * <p>
     * For character grids this is always a one-character string. For list
     * grids it is whatever the caller stored, possibly {@code null}, empty or
     * longer than one character.
     *
     * @param row 0-based row, in [0, {@link #rowCount()})
     * @param col 0-based column, in [0, {@link #rowLength(int)})
     */
    String symbolAt(int row, int col);

    /**
     * Wraps a character grid. The outer array is the row sequence.
     */
    static SymbolGrid of(char[][] board)
    {
        return new CharArraySymbolGrid(board);
    }

    /**
     * Wraps a grid of string cells. The outer list is the row sequence.
     */
    static SymbolGrid of(List<? extends List<String>> board)
    {
        return new ListSymbolGrid(board);
    }
}
