package com.elssolution.livestxm.domain;

/**
 * A cell of the display grid. Row 0 is physical y-min, column 0 physical x-min.
 */
public record GridPosition(int row, int col) {

    /**
     * Where the {@code index}-th accepted frame of a scan lands. Arrival is row-major
     * (one row of x steps per y step); inverted axes are mirrored so the display grid
     * stays Cartesian whatever direction the motors travelled.
     */
    public static GridPosition forArrival(int index, int rows, int cols, boolean invertX, boolean invertY) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("grid must be non-empty: " + rows + "x" + cols);
        }
        if (index < 0 || index >= rows * cols) {
            throw new IndexOutOfBoundsException("arrival index " + index + " outside " + rows + "x" + cols);
        }
        int rawRow = index / cols;
        int rawCol = index % cols;
        int row = invertY ? (rows - 1 - rawRow) : rawRow;
        int col = invertX ? (cols - 1 - rawCol) : rawCol;
        return new GridPosition(row, col);
    }

    public static GridPosition forArrival(int index, ScanMetadata md) {
        return forArrival(index, md.rows(), md.cols(), md.invertX(), md.invertY());
    }
}
