package com.elssolution.livestxm.domain;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * One detector frame as it came off the wire. Pixels stay in their encoded form
 * (little-endian buffer + dtype) so a 4k x 4k frame is never widened in memory.
 */
public final class RawFrame {
    /** Marks a frame header that carried no sequence number. */
    public static final long NO_SEQ = -1L;

    private final PixelType type;
    private final int height;
    private final int width;
    private final ByteBuffer pixels;
    private final long seq;
    private final String scanId;

    public RawFrame(PixelType type, int height, int width, ByteBuffer pixels, long seq, String scanId) {
        if (height <= 0 || width <= 0) {
            throw new IllegalArgumentException("frame shape must be positive: " + height + "x" + width);
        }
        long expected = (long) height * width * type.bytes();
        if (pixels.remaining() != expected) {
            throw new IllegalArgumentException("payload is " + pixels.remaining()
                    + " bytes, shape " + height + "x" + width + " " + type.dtype() + " needs " + expected);
        }
        this.type = type;
        this.height = height;
        this.width = width;
        this.pixels = pixels.slice().order(ByteOrder.LITTLE_ENDIAN);
        this.seq = seq;
        this.scanId = scanId;
    }

    public PixelType type()    { return type; }
    public int height()        { return height; }
    public int width()         { return width; }
    public int pixelCount()    { return height * width; }
    public long seq()          { return seq; }
    public String scanId()     { return scanId; }

    /** Read-only view, positioned at 0. */
    public ByteBuffer pixels() {
        return pixels.asReadOnlyBuffer().order(ByteOrder.LITTLE_ENDIAN);
    }

    public double value(int row, int col) {
        return type.readDouble(pixels, row * width + col);
    }

    /** Same pixels, stamped with the identity the reducer resolved for it. */
    public RawFrame withIdentity(long newSeq, String newScanId) {
        return new RawFrame(type, height, width, pixels, newSeq, newScanId);
    }

    @Override
    public String toString() {
        return "RawFrame{scan=" + scanId + ", seq=" + seq + ", " + height + "x" + width + " " + type.dtype() + "}";
    }
}
