package com.questrail.gridcheck.sudoku;

import com.questrail.gridcheck.api.ValidationResult;
import com.questrail.gridcheck.api.ValidationSubject;
import com.questrail.gridcheck.api.Validator;
import com.questrail.gridcheck.api.ViolationKind;
import com.questrail.gridcheck.config.ValidationConfig;
import com.questrail.gridcheck.observability.ValidationEvent;
import com.questrail.gridcheck.observability.ValidationObservabilitySink;

import java.util.List;
import java.util.Objects;

/**
 * SudokuValidator
 * -----------------------------------------------------------------------------
 * Structural and constraint checker for generalized N×N Sudoku boards, where
 * N is a perfect square (4, 9, 16, 25).
 *
 * <h2>What "valid" means</h2>
 * A board is valid if it is well-shaped (see {@link BoardShape}), every
 * filled cell holds a symbol decoding to a value in [1, N], and no value
 * repeats within a row, a column, or a sub-box. Empty cells never conflict.
 * A valid board need not be solved, nor even solvable.
 *
 * <h2>Algorithm</h2>
 * After the shape checks, a single row-major pass visits every cell. Each
 * filled cell is decoded, range-checked, and then looked up in three
 * {@link SeenValues} families (rows, columns, sub-boxes). A hit in any family
 * is a duplicate; otherwise the value is recorded in all three. The pass is
 * O(N²) in time and uses 3·N² bits of call-local state.
 *
 * <h2>Failure Handling</h2>
 * The validator never throws for any board. Shape and symbol failures raised
 * internally are converted into a rejected {@link ValidationResult}, and the
 * first failure ends the scan. The board is never modified.
 */
public final class SudokuValidator implements Validator<SymbolGrid>
{
    private static final SudokuValidator DEFAULT = new SudokuValidator();

    private final char emptyMarker;
    private final int maxDimension;
    private final ValidationObservabilitySink sink;

    public SudokuValidator()
    {
        this(ValidationConfig.defaults());
    }

    public SudokuValidator(ValidationConfig config)
    {
        Objects.requireNonNull(config, "config");
        this.emptyMarker = config.emptyMarker();
        this.maxDimension = config.maxDimension();
        this.sink = config.sink();
    }

    /**
     * Returns {@code true} iff {@code board} is a valid (not necessarily
     * solved) Sudoku board, using {@code '-'} as the empty marker.
     */
    public static boolean isValidSudoku(char[][] board)
    {
        return DEFAULT.isValid(board == null ? null : SymbolGrid.of(board));
    }

    /**
     * As {@link #isValidSudoku(char[][])}, for boards whose cells are strings.
     * Cells that are not exactly one character are invalid symbols.
     */
    public static boolean isValidSudoku(List<? extends List<String>> board)
    {
        return DEFAULT.isValid(board == null ? null : SymbolGrid.of(board));
    }

    @Override
    public ValidationResult validate(SymbolGrid board)
    {
        ValidationResult result = check(board);
        ValidationEvent event = ValidationEvent.of(ValidationSubject.SUDOKU, describe(board), result);
        if (result.isValid()) {
            sink.onAccepted(event);
        } else {
            sink.onRejected(event);
        }
        return result;
    }

    private ValidationResult check(SymbolGrid board)
    {
        if (board == null) {
            return ValidationResult.rejected(ViolationKind.NULL_INPUT, "board is null");
        }

        final BoardShape shape;
        try {
            shape = BoardShape.of(board, maxDimension);
        }
        catch (BoardShapeException e) {
            return ValidationResult.rejected(e.kind(), e.getMessage());
        }

        final int n = shape.dimension();
        final SeenValues rows = new SeenValues(n, n);
        final SeenValues cols = new SeenValues(n, n);
        final SeenValues boxes = new SeenValues(n, n);

        for (int row = 0; row < n; row++) {
            for (int col = 0; col < n; col++) {
                final String symbol = board.symbolAt(row, col);
                if (SudokuSymbols.isEmpty(symbol, emptyMarker)) {
                    continue;
                }

                final int value;
                try {
                    value = SudokuSymbols.decode(symbol);
                }
                catch (SymbolException e) {
                    return ValidationResult.rejected(ViolationKind.INVALID_SYMBOL,
                            at(row, col) + ": " + e.getMessage());
                }

                if (value < 1 || value > n) {
                    return ValidationResult.rejected(ViolationKind.VALUE_OUT_OF_RANGE,
                            at(row, col) + ": value " + value + " is outside [1, " + n + "]");
                }

                final int box = shape.boxIndex(row, col);
                if (rows.contains(row, value)) {
                    return ValidationResult.rejected(ViolationKind.DUPLICATE_IN_ROW,
                            at(row, col) + ": value " + value + " repeated in row " + row);
                }
                if (cols.contains(col, value)) {
                    return ValidationResult.rejected(ViolationKind.DUPLICATE_IN_COLUMN,
                            at(row, col) + ": value " + value + " repeated in column " + col);
                }
                if (boxes.contains(box, value)) {
                    return ValidationResult.rejected(ViolationKind.DUPLICATE_IN_BOX,
                            at(row, col) + ": value " + value + " repeated in box " + box);
                }

                rows.add(row, value);
                cols.add(col, value);
                boxes.add(box, value);
            }
        }
        return ValidationResult.valid();
    }

    private static String at(int row, int col)
    {
        return "cell (" + row + ", " + col + ")";
    }

    /**
     * Short rendering for logs: dimensions only, never the cell contents.
     */
    static String describe(SymbolGrid board)
    {
        if (board == null) {
            return "null";
        }
        int rows = board.rowCount();
        if (rows <= 0) {
            return "0x0 board";
        }
        int cols = board.rowLength(0);
        return rows + "x" + (cols == SymbolGrid.MISSING_ROW ? "?" : String.valueOf(cols)) + " board";
    }
}
