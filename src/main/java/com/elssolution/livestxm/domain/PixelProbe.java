package com.elssolution.livestxm.domain;

/**
 * One map cell read back in stage coordinates. Cell (0,0) sits at (x-min, y-min);
 * columns and rows are spread evenly up to x-max and y-max.
 */
public record PixelProbe(int row, int col, double x, double y, double value, boolean written) {

    public static PixelProbe of(ScanMetadata md, ScanMapSnapshot map, int row, int col) {
        if (row < 0 || row >= map.getRows() || col < 0 || col >= map.getCols()) {
            throw new IndexOutOfBoundsException("cell (" + row + "," + col + ") outside "
                    + map.getRows() + "x" + map.getCols() + " map");
        }
        double x = axis(md.xMin(), md.xMax(), col, map.getCols());
        double y = axis(md.yMin(), md.yMax(), row, map.getRows());
        return new PixelProbe(row, col, x, y, map.get(row, col), map.isWritten(row, col));
    }

    static double axis(double min, double max, int idx, int n) {
        if (n <= 1) return min;
        return min + (double) idx / (n - 1) * (max - min);
    }
}
