package com.questrail.gridcheck.sudoku;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Boards shared by the Sudoku tests.
 */
final class SudokuFixtures
{
    private SudokuFixtures() {}

    static char[][] partial9x9()
    {
        return rows(
                "53--7----",
                "6--195---",
                "-98----6-",
                "8---6---3",
                "4--8-3--1",
                "7---2---6",
                "-6----28-",
                "---419--5",
                "----8--79");
    }

    static char[][] valid4x4()
    {
        return rows(
                "1--4",
                "-32-",
                "-23-",
                "4--1");
    }

    static char[][] empty(int n)
    {
        char[][] board = new char[n][n];
        for (char[] row : board) {
            Arrays.fill(row, '-');
        }
        return board;
    }

    /**
     * A fully solved N×N board, N = k², using the shifted-row pattern.
     */
    static char[][] solved(int k)
    {
        int n = k * k;
        char[][] board = new char[n][n];
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                board[r][c] = symbolFor((k * (r % k) + r / k + c) % n + 1);
            }
        }
        return board;
    }

    static char symbolFor(int value)
    {
        return value < 10 ? (char) ('0' + value) : (char) ('A' + value - 10);
    }

    static char[][] rows(String... rows)
    {
        char[][] board = new char[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            board[i] = rows[i].toCharArray();
        }
        return board;
    }

    static char[][] deepCopy(char[][] board)
    {
        char[][] copy = new char[board.length][];
        for (int i = 0; i < board.length; i++) {
            copy[i] = board[i] == null ? null : board[i].clone();
        }
        return copy;
    }

    static List<List<String>> asLists(char[][] board)
    {
        List<List<String>> rows = new ArrayList<>(board.length);
        for (char[] row : board) {
            List<String> cells = new ArrayList<>(row.length);
            for (char c : row) {
                cells.add(String.valueOf(c));
            }
            rows.add(cells);
        }
        return rows;
    }
}
