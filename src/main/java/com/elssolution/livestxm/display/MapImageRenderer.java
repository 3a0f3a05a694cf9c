package com.elssolution.livestxm.display;

import com.elssolution.livestxm.domain.ScanMapSnapshot;
import lombok.Getter;
import lombok.Setter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;

/**
 * Grayscale rendering of a scan map. Row 0 (y-min) is drawn at the bottom, column 0
 * (x-min) on the left. Levels stretch over written cells only; unwritten cells are black.
 * Cells shrink on large grids so the longest side stays within {@link #MAX_SIDE}, down
 * to one pixel per cell.
 */
@Component
public class MapImageRenderer {

    static final int MAX_SIDE = 4096;

    @Value("${stxm.display.pixelsPerCell:16}")
    @Getter @Setter private int pixelsPerCell = 16;

    public BufferedImage render(ScanMapSnapshot map) {
        int rows = map.getRows();
        int cols = map.getCols();
        int scale = scaleFor(rows, cols);
        BufferedImage img = new BufferedImage(cols * scale, rows * scale, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = img.getRaster();

        double[] range = map.writtenRange();
        double lo = range[0];
        double span = range[1] - range[0];

        int[] block = new int[scale * scale];
        for (int r = 0; r < rows; r++) {
            int top = (rows - 1 - r) * scale;
            for (int c = 0; c < cols; c++) {
                int level = map.isWritten(r, c) ? level(map.get(r, c), lo, span) : 0;
                java.util.Arrays.fill(block, level);
                raster.setPixels(c * scale, top, scale, scale, block);
            }
        }
        return img;
    }

    int scaleFor(int rows, int cols) {
        int longest = Math.max(1, Math.max(rows, cols));
        return Math.max(1, Math.min(pixelsPerCell, MAX_SIDE / longest));
    }

    static int level(double v, double lo, double span) {
        if (!(span > 0) || Double.isNaN(v)) return 255;
        long g = Math.round((v - lo) / span * 255.0);
        return (int) Math.max(0, Math.min(255, g));
    }
}
