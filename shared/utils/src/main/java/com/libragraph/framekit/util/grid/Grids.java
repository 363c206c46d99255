package com.libragraph.framekit.util.grid;

import java.util.List;

/**
 * Conversions between rectangular and jagged two-dimensional layouts.
 *
 * <p>A jagged grid is a list of rows of any length. {@code null} rows are read
 * as empty; rows produced here are never {@code null}. Every method returns
 * {@code null} when given {@code null}, and none modify their input.
 */
public final class Grids {

    private Grids() {
    }

    /**
     * Converts a rectangular grid to rows of exactly {@code grid.columns()} cells.
     * A grid with zero columns yields {@code grid.rows()} empty rows.
     */
    public static <T> List<List<T>> toJagged(RectangularGrid<T> grid) {
        if (grid == null) {
            return null;
        }
        return grid.toRows();
    }

    /**
     * Converts jagged rows to a rectangular grid, padding with {@code null}.
     *
     * @see #toRectangular(List, Object)
     */
    public static <T> RectangularGrid<T> toRectangular(List<? extends List<? extends T>> jagged) {
        return toRectangular(jagged, null);
    }

    /**
     * Converts jagged rows to a rectangular grid as wide as the longest row.
     * Cells past the end of a short row, and every cell of a {@code null} row, take {@code fill}.
     */
    public static <T> RectangularGrid<T> toRectangular(List<? extends List<? extends T>> jagged, T fill) {
        if (jagged == null) {
            return null;
        }

        int rows = jagged.size();
        int columns = 0;
        for (List<? extends T> row : jagged) {
            if (row != null) {
                columns = Math.max(columns, row.size());
            }
        }

        Object[] cells = new Object[Math.multiplyExact(rows, columns)];
        for (int r = 0; r < rows; r++) {
            List<? extends T> row = jagged.get(r);
            int length = row == null ? 0 : row.size();
            for (int c = 0; c < columns; c++) {
                cells[r * columns + c] = c < length ? row.get(c) : fill;
            }
        }
        return RectangularGrid.fromCells(rows, columns, cells);
    }

    /**
     * Swaps rows and columns of a rectangular grid.
     */
    public static <T> RectangularGrid<T> transpose(RectangularGrid<T> grid) {
        if (grid == null) {
            return null;
        }
        return grid.transpose();
    }

    /**
     * Transposes jagged rows, padding with {@code null}.
     *
     * @see #transpose(List, Object)
     */
    public static <T> List<List<T>> transpose(List<? extends List<? extends T>> jagged) {
        return transpose(jagged, null);
    }

    /**
     * Transposes jagged rows by squaring them off first: the result always has
     * (longest input row) rows of (input row count) cells each, with {@code fill}
     * where an input row was short or {@code null}.
     */
    public static <T> List<List<T>> transpose(List<? extends List<? extends T>> jagged, T fill) {
        return toJagged(transpose(toRectangular(jagged, fill)));
    }
}
