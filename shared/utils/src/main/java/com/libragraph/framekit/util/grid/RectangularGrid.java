package com.libragraph.framekit.util.grid;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable fixed-size grid where every row has the same number of columns.
 *
 * <p>Cells are stored row-major. Cells that were never given a value hold the
 * fill value the grid was built with, which is {@code null} unless the caller
 * supplied one.
 */
public final class RectangularGrid<T> {

    private final int rows;
    private final int columns;
    private final Object[] cells;

    private RectangularGrid(int rows, int columns, Object[] cells) {
        this.rows = rows;
        this.columns = columns;
        this.cells = cells;
    }

    /**
     * Creates a grid with every cell set to {@code fill}.
     */
    public static <T> RectangularGrid<T> filled(int rows, int columns, T fill) {
        checkDimensions(rows, columns);
        Object[] cells = new Object[Math.multiplyExact(rows, columns)];
        Arrays.fill(cells, fill);
        return new RectangularGrid<>(rows, columns, cells);
    }

    /**
     * Creates a grid from equal-length rows. The array is copied.
     *
     * @throws IllegalArgumentException if the rows differ in length or a row is null
     */
    @SafeVarargs
    public static <T> RectangularGrid<T> of(T[]... rows) {
        Objects.requireNonNull(rows, "rows cannot be null");

        int columns = rows.length == 0 ? 0 : lengthOf(rows[0], 0);
        Object[] cells = new Object[Math.multiplyExact(rows.length, columns)];
        for (int r = 0; r < rows.length; r++) {
            int length = lengthOf(rows[r], r);
            if (length != columns) {
                throw new IllegalArgumentException(
                    "Row " + r + " has " + length + " columns, expected " + columns
                );
            }
            System.arraycopy(rows[r], 0, cells, r * columns, columns);
        }
        return new RectangularGrid<>(rows.length, columns, cells);
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    @SuppressWarnings("unchecked")
    public T get(int row, int column) {
        Objects.checkIndex(row, rows);
        Objects.checkIndex(column, columns);
        return (T) cells[row * columns + column];
    }

    /**
     * Returns a copy of one row.
     */
    @SuppressWarnings("unchecked")
    public List<T> row(int row) {
        Objects.checkIndex(row, rows);
        List<T> result = new ArrayList<>(columns);
        for (int c = 0; c < columns; c++) {
            result.add((T) cells[row * columns + c]);
        }
        return result;
    }

    /**
     * Swaps rows and columns: cell {@code (c, r)} of the result is cell {@code (r, c)} of this grid.
     */
    public RectangularGrid<T> transpose() {
        Object[] result = new Object[cells.length];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                result[c * rows + r] = cells[r * columns + c];
            }
        }
        return new RectangularGrid<>(columns, rows, result);
    }

    /**
     * Returns the rows as independent lists, each exactly {@link #columns()} long.
     */
    public List<List<T>> toRows() {
        List<List<T>> result = new ArrayList<>(rows);
        for (int r = 0; r < rows; r++) {
            result.add(row(r));
        }
        return result;
    }

    /**
     * Package-private builder used by {@link Grids} to place cells without copying twice.
     */
    static <T> RectangularGrid<T> fromCells(int rows, int columns, Object[] cells) {
        checkDimensions(rows, columns);
        if (cells.length != Math.multiplyExact(rows, columns)) {
            throw new IllegalArgumentException(
                "Expected " + rows * columns + " cells, got: " + cells.length
            );
        }
        return new RectangularGrid<>(rows, columns, cells);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RectangularGrid<?> other)) return false;
        return rows == other.rows
                && columns == other.columns
                && Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + columns) + Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        return toRows().toString();
    }

    private static void checkDimensions(int rows, int columns) {
        if (rows < 0 || columns < 0) {
            throw new IllegalArgumentException(
                "Grid dimensions must be >= 0, got: " + rows + "x" + columns
            );
        }
    }

    private static int lengthOf(Object[] row, int index) {
        if (row == null) {
            throw new IllegalArgumentException("Row " + index + " is null");
        }
        return row.length;
    }
}
