package com.questrail.gridcheck.sudoku;

import java.util.Objects;

/**
 * {@link SymbolGrid} over a {@code char[][]}.
 */
final class CharArraySymbolGrid implements SymbolGrid
{
    private final char[][] board;

    CharArraySymbolGrid(char[][] board)
    {
        this.board = Objects.requireNonNull(board, "board");
    }

    @Override
    public int rowCount()
    {
        return board.length;
    }

    @Override
    public int rowLength(int row)
    {
        char[] cells = board[row];
        return cells == null ? MISSING_ROW : cells.length;
    }

    @Override
    public String symbolAt(int row, int col)
    {
        return String.valueOf(board[row][col]);
    }

    @Override
    public String toString()
    {
        return SudokuValidator.describe(this);
    }
}
