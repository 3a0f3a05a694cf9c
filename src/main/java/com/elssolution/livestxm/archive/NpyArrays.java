package com.elssolution.livestxm.archive;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimal NPY v1.0 reader/writer for 2-D little-endian float64 arrays in C order,
 * the layout numpy.save produces for a float64 map.
 */
public final class NpyArrays {

    private static final byte[] MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};
    private static final int PREAMBLE = MAGIC.length + 2 + 2;
    private static final Pattern SHAPE = Pattern.compile("'shape':\\s*\\((\\d+),\\s*(\\d+),?\\)");

    private NpyArrays() {}

    public static void writeFloat64(OutputStream out, int rows, int cols, double[] rowMajor) throws IOException {
        if (rowMajor.length != rows * cols) {
            throw new IllegalArgumentException("data length " + rowMajor.length + " != " + rows + "x" + cols);
        }
        StringBuilder header = new StringBuilder("{'descr': '<f8', 'fortran_order': False, 'shape': (")
                .append(rows).append(", ").append(cols).append("), }");
        // total preamble + header is a multiple of 64, header ends with '\n'
        int unpadded = PREAMBLE + header.length() + 1;
        int pad = (64 - unpadded % 64) % 64;
        header.append(" ".repeat(pad)).append('\n');
        byte[] h = header.toString().getBytes(StandardCharsets.US_ASCII);

        ByteBuffer pre = ByteBuffer.allocate(PREAMBLE).order(ByteOrder.LITTLE_ENDIAN);
        pre.put(MAGIC).put((byte) 1).put((byte) 0).putShort((short) h.length);
        out.write(pre.array());
        out.write(h);

        ByteBuffer body = ByteBuffer.allocate(rowMajor.length * Double.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (double v : rowMajor) body.putDouble(v);
        out.write(body.array());
        out.flush();
    }

    /** Reads back what {@link #writeFloat64} wrote. */
    public static Array2D readFloat64(InputStream in) throws IOException {
        DataInputStream din = new DataInputStream(in);
        byte[] pre = new byte[PREAMBLE];
        din.readFully(pre);
        for (int i = 0; i < MAGIC.length; i++) {
            if (pre[i] != MAGIC[i]) throw new IOException("not an .npy stream");
        }
        if (pre[6] != 1) throw new IOException("unsupported .npy version " + pre[6] + "." + pre[7]);
        int headerLen = ByteBuffer.wrap(pre, 8, 2).order(ByteOrder.LITTLE_ENDIAN).getShort() & 0xFFFF;
        byte[] h = new byte[headerLen];
        din.readFully(h);
        String header = new String(h, StandardCharsets.US_ASCII);

        if (!header.contains("'descr': '<f8'")) throw new IOException("expected <f8 array, header: " + header.trim());
        if (header.contains("'fortran_order': True")) throw new IOException("fortran order not supported");
        Matcher m = SHAPE.matcher(header);
        if (!m.find()) throw new IOException("expected a 2-D shape, header: " + header.trim());
        int rows = Integer.parseInt(m.group(1));
        int cols = Integer.parseInt(m.group(2));

        byte[] raw = new byte[rows * cols * Double.BYTES];
        din.readFully(raw);
        ByteBuffer body = ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN);
        double[] data = new double[rows * cols];
        for (int i = 0; i < data.length; i++) data[i] = body.getDouble();
        return new Array2D(rows, cols, data);
    }

    public record Array2D(int rows, int cols, double[] data) {
        public double get(int r, int c) { return data[r * cols + c]; }
    }
}
