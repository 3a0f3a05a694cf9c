package com.elssolution.livestxm.domain;

import java.util.Arrays;

/**
 * Live intensity grid for one scan. Not thread-safe: only the assembler writes it,
 * and it hands out {@link ScanMapSnapshot} copies to everybody else.
 */
public final class ScanMap {
    private final int rows;
    private final int cols;
    private final double[] values;
    private final boolean[] written;
    private int writtenCount;

    public ScanMap(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("map shape must be positive: " + rows + "x" + cols);
        }
        this.rows = rows;
        this.cols = cols;
        this.values = new double[rows * cols];
        this.written = new boolean[rows * cols];
    }

    public int rows() { return rows; }
    public int cols() { return cols; }
    public int writtenCount() { return writtenCount; }

    public void put(GridPosition p, double value) {
        int i = p.row() * cols + p.col();
        values[i] = value;
        if (!written[i]) {
            written[i] = true;
            writtenCount++;
        }
    }

    public double get(int row, int col) {
        return values[row * cols + col];
    }

    public ScanMapSnapshot snapshot(String scanId, long version) {
        return new ScanMapSnapshot(scanId, version, rows, cols,
                Arrays.copyOf(values, values.length), Arrays.copyOf(written, written.length), writtenCount);
    }
}
