package com.elssolution.livestxm.support;

import com.elssolution.livestxm.domain.DownsampledImage;
import com.elssolution.livestxm.domain.PixelType;
import com.elssolution.livestxm.domain.RawFrame;
import com.elssolution.livestxm.domain.ReducedFrame;
import com.elssolution.livestxm.domain.ScanMetadata;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/** Fixtures shared by the tests. */
public final class Scans {

    private Scans() {}

    /** x_num columns by y_num rows, both axes ascending from 0 to 1. */
    public static ScanMetadata grid(String scanId, int xNum, int yNum) {
        return axes(scanId, xNum, 0.0, 1.0, yNum, 0.0, 1.0);
    }

    public static ScanMetadata axes(String scanId, int xNum, double xStart, double xStop,
                                    int yNum, double yStart, double yStop) {
        return ScanMetadata.builder()
                .scanId(scanId)
                .xStart(xStart).xStop(xStop).xNum(xNum)
                .xStep(ScanMetadata.derivedStep(xStart, xStop, xNum))
                .yStart(yStart).yStop(yStop).yNum(yNum)
                .yStep(ScanMetadata.derivedStep(yStart, yStop, yNum))
                .exposureTimeS(0.001)
                .detectorHeight(4)
                .detectorWidth(4)
                .build();
    }

    public static ReducedFrame reduced(String scanId, long seq, double intensity) {
        return new ReducedFrame(scanId, seq, intensity, new DownsampledImage(1, 1, new float[] {(float) intensity}));
    }

    public static RawFrame uint16(int h, int w, int... values) {
        ByteBuffer buf = ByteBuffer.allocate(h * w * 2).order(ByteOrder.LITTLE_ENDIAN);
        for (int v : values) buf.putShort((short) v);
        buf.flip();
        return new RawFrame(PixelType.UINT16, h, w, buf, RawFrame.NO_SEQ, null);
    }

    public static RawFrame float32(int h, int w, float fill) {
        ByteBuffer buf = ByteBuffer.allocate(h * w * 4).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < h * w; i++) buf.putFloat(fill);
        buf.flip();
        return new RawFrame(PixelType.FLOAT32, h, w, buf, RawFrame.NO_SEQ, null);
    }
}
