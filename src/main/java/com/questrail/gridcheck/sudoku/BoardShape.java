package com.questrail.gridcheck.sudoku;

import com.questrail.gridcheck.api.ViolationKind;

/**
 * BoardShape
 * -----------------------------------------------------------------------------
 * The geometry of an N×N Sudoku board with k×k sub-boxes, where N = k².
 *
 * <p>{@link #of(SymbolGrid, int)} applies the structural preconditions in
 * priority order, stopping at the first failure:</p>
 * <ol>
 *   <li>at least one row</li>
 *   <li>every row present and exactly N cells long</li>
 *   <li>N a perfect square</li>
 *   <li>N no larger than the configured maximum</li>
 * </ol>
 *
 * <p>Sub-boxes are numbered left to right, top to bottom:</p>
 * <pre>
 * box(r, c) = (r / k) * k + (c / k)
 * </pre>
 */
final class BoardShape
{
    private final int dimension;
    private final int boxSize;

    private BoardShape(int dimension, int boxSize)
    {
        this.dimension = dimension;
        this.boxSize = boxSize;
    }

    /**
     * @throws BoardShapeException describing the first precondition broken
     */
    static BoardShape of(SymbolGrid grid, int maxDimension) throws BoardShapeException
    {
        final int n = grid.rowCount();
        if (n <= 0) {
            throw new BoardShapeException(ViolationKind.EMPTY_BOARD, "board has no rows (rowCount=" + n + ")");
        }

        for (int row = 0; row < n; row++) {
            int length = grid.rowLength(row);
            if (length == SymbolGrid.MISSING_ROW) {
                throw new BoardShapeException(ViolationKind.NOT_SQUARE, "row " + row + " is missing");
            }
            if (length != n) {
                throw new BoardShapeException(ViolationKind.NOT_SQUARE,
                        "row " + row + " has " + length + " cells, expected " + n);
            }
        }

        final int k = integerSqrt(n);
        if (k * k != n) {
            throw new BoardShapeException(ViolationKind.SIZE_NOT_PERFECT_SQUARE,
                    "dimension " + n + " is not a perfect square");
        }

        if (n > maxDimension) {
            throw new BoardShapeException(ViolationKind.SIZE_UNSUPPORTED,
                    "dimension " + n + " exceeds the supported maximum of " + maxDimension);
        }

        return new BoardShape(n, k);
    }

    /**
     * Returns floor(√n) for n ≥ 0, computed exactly.
     */
    static int integerSqrt(int n)
    {
        if (n < 0) {
            throw new IllegalArgumentException("n must be non-negative: " + n);
        }
        long k = (long) Math.sqrt(n);
        // Correct any floating-point rounding in either direction.
        while (k * k > n) {
            k--;
        }
        while ((k + 1) * (k + 1) <= n) {
            k++;
        }
        return (int) k;
    }

    int dimension()
    {
        return dimension;
    }

    int boxSize()
    {
        return boxSize;
    }

    int boxIndex(int row, int col)
    {
        return (row / boxSize) * boxSize + (col / boxSize);
    }
}
