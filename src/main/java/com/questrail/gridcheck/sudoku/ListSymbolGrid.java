package com.questrail.gridcheck.sudoku;

import java.util.List;
import java.util.Objects;

/**
 * {@link SymbolGrid} over a list of rows of string cells.
 */
final class ListSymbolGrid implements SymbolGrid
{
    private final List<? extends List<String>> board;

    ListSymbolGrid(List<? extends List<String>> board)
    {
        this.board = Objects.requireNonNull(board, "board");
    }

    @Override
    public int rowCount()
    {
        return board.size();
    }

    @Override
    public int rowLength(int row)
    {
        List<String> cells = board.get(row);
        return cells == null ? MISSING_ROW : cells.size();
    }

    @Override
    public String symbolAt(int row, int col)
    {
        return board.get(row).get(col);
    }

    @Override
    public String toString()
    {
        return SudokuValidator.describe(this);
    }
}
