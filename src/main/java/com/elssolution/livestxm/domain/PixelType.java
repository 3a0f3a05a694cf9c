package com.elssolution.livestxm.domain;

import java.nio.ByteBuffer;
import java.util.Locale;

/**
 * Pixel encodings accepted on the wire. Names follow numpy dtype strings so frames
 * from a Python source decode without translation. All payloads are little-endian.
 */
public enum PixelType {
    UINT8("uint8", "|u1", 1, true),
    UINT16("uint16", "<u2", 2, true),
    INT16("int16", "<i2", 2, true),
    INT32("int32", "<i4", 4, true),
    UINT32("uint32", "<u4", 4, true),
    FLOAT32("float32", "<f4", 4, false),
    FLOAT64("float64", "<f8", 8, false);

    private final String dtype;
    private final String code;
    private final int bytes;
    private final boolean integral;

    PixelType(String dtype, String code, int bytes, boolean integral) {
        this.dtype = dtype;
        this.code = code;
        this.bytes = bytes;
        this.integral = integral;
    }

    public String dtype()      { return dtype; }
    public int bytes()         { return bytes; }
    public boolean integral()  { return integral; }

    /** Pixel {@code index} as a long. Only meaningful for integral types. */
    public long readLong(ByteBuffer buf, int index) {
        int at = index * bytes;
        return switch (this) {
            case UINT8 -> buf.get(at) & 0xFFL;
            case UINT16 -> buf.getShort(at) & 0xFFFFL;
            case INT16 -> buf.getShort(at);
            case INT32 -> buf.getInt(at);
            case UINT32 -> buf.getInt(at) & 0xFFFF_FFFFL;
            case FLOAT32 -> (long) buf.getFloat(at);
            case FLOAT64 -> (long) buf.getDouble(at);
        };
    }

    public double readDouble(ByteBuffer buf, int index) {
        int at = index * bytes;
        return switch (this) {
            case FLOAT32 -> buf.getFloat(at);
            case FLOAT64 -> buf.getDouble(at);
            default -> readLong(buf, index);
        };
    }

    /**
     * Accepts numpy names ("float32") and array-interface codes ("&lt;f4", "=u2").
     * Big-endian codes are rejected.
     */
    public static PixelType fromDtype(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("missing dtype");
        }
        String v = s.trim().toLowerCase(Locale.ROOT);
        for (PixelType t : values()) {
            if (t.dtype.equals(v)) return t;
        }
        if (v.startsWith(">")) {
            throw new IllegalArgumentException("big-endian dtype not supported: " + s);
        }
        String bare = (v.startsWith("<") || v.startsWith("=") || v.startsWith("|")) ? v.substring(1) : v;
        for (PixelType t : values()) {
            if (t.code.substring(1).equals(bare)) return t;
        }
        throw new IllegalArgumentException("unsupported dtype: " + s);
    }
}
