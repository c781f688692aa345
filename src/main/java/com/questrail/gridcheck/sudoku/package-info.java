/**
 * Sudoku Board Validation
 * =============================================================================
 *
 * <p>Checks that a grid of symbols is a structurally valid N×N Sudoku board.
 * Solving, generation and normalization are out of scope.</p>
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   char[][] / List&lt;List&lt;String&gt;&gt;
 *        → SymbolGrid            (read-only view, no copy)
 *        → BoardShape.of         (emptiness, squareness, perfect-square N)
 *        → SudokuSymbols.decode  (per filled cell)
 *        → SeenValues            (row / column / box duplicate tracking)
 *        → ValidationResult
 * </pre>
 *
 * <p>Only {@link com.questrail.gridcheck.sudoku.SudokuValidator} and
 * {@link com.questrail.gridcheck.sudoku.SymbolGrid} are public. Any failure
 * inside the pipeline results in a rejected board, never an exception.</p>
 */
package com.questrail.gridcheck.sudoku;
