package com.elssolution.livestxm.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Immutable copy of a {@link ScanMap}. {@code version} grows with every write of the
 * owning map, so readers can skip re-rendering when nothing changed.
 */
public final class ScanMapSnapshot {
    private final String scanId;
    private final long version;
    private final int rows;
    private final int cols;
    private final double[] values;
    private final boolean[] written;
    private final int writtenCount;

    ScanMapSnapshot(String scanId, long version, int rows, int cols,
                    double[] values, boolean[] written, int writtenCount) {
        this.scanId = scanId;
        this.version = version;
        this.rows = rows;
        this.cols = cols;
        this.values = values;
        this.written = written;
        this.writtenCount = writtenCount;
    }

    public String getScanId()     { return scanId; }
    public long getVersion()      { return version; }
    public int getRows()          { return rows; }
    public int getCols()          { return cols; }
    public int getWrittenCount()  { return writtenCount; }

    public double get(int row, int col) {
        return values[row * cols + col];
    }

    public boolean isWritten(int row, int col) {
        return written[row * cols + col];
    }

    /** Row-major nested copy, row 0 = y-min. */
    public double[][] getValues() {
        double[][] out = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(values, r * cols, out[r], 0, cols);
        }
        return out;
    }

    /** Flat row-major copy. */
    @JsonIgnore
    public double[] flatValues() {
        return values.clone();
    }

    /** Min and max over written cells; {0, 0} when nothing is written yet. */
    @JsonIgnore
    public double[] writtenRange() {
        double lo = Double.POSITIVE_INFINITY;
        double hi = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < values.length; i++) {
            if (!written[i]) continue;
            lo = Math.min(lo, values[i]);
            hi = Math.max(hi, values[i]);
        }
        return writtenCount == 0 ? new double[] {0.0, 0.0} : new double[] {lo, hi};
    }
}
