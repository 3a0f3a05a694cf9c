package com.elssolution.livestxm.pipeline;

import com.elssolution.livestxm.domain.DownsampledImage;
import com.elssolution.livestxm.domain.PixelType;
import com.elssolution.livestxm.domain.RawFrame;
import com.elssolution.livestxm.domain.ReducedFrame;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;

/**
 * Per-frame reduction:
 *   1) intensity = sum of all pixels. Integral dtypes accumulate in a long (exact up
 *      to 4k x 4k x 32 bit), float dtypes in a double.
 *   2) display image = block average with a square factor chosen so the longer side
 *      fits {@code displaySize}. Edge blocks average over the pixels they actually cover.
 */
@Slf4j
@Component
@Getter @Setter
public class FrameReduction {

    /** Longest side of the display image, in pixels. */
    @Value("${stxm.reducer.displaySize:100}")
    private int displaySize = 100;

    public ReducedFrame reduce(RawFrame frame) {
        double intensity = sum(frame);
        DownsampledImage img = downsample(frame, factorFor(frame.height(), frame.width(), displaySize));
        return new ReducedFrame(frame.scanId(), frame.seq(), intensity, img);
    }

    public static double sum(RawFrame frame) {
        PixelType type = frame.type();
        ByteBuffer px = frame.pixels();
        int n = frame.pixelCount();
        if (type.integral()) {
            long acc = 0L;
            for (int i = 0; i < n; i++) acc += type.readLong(px, i);
            return acc;
        }
        double acc = 0.0;
        for (int i = 0; i < n; i++) acc += type.readDouble(px, i);
        return acc;
    }

    public static int factorFor(int height, int width, int displaySize) {
        int target = Math.max(1, displaySize);
        int longest = Math.max(height, width);
        return Math.max(1, (longest + target - 1) / target);
    }

    public static DownsampledImage downsample(RawFrame frame, int factor) {
        int h = frame.height();
        int w = frame.width();
        int outH = (h + factor - 1) / factor;
        int outW = (w + factor - 1) / factor;
        double[] acc = new double[outH * outW];
        int[] cnt = new int[outH * outW];

        PixelType type = frame.type();
        ByteBuffer px = frame.pixels();
        for (int r = 0; r < h; r++) {
            int rowBase = (r / factor) * outW;
            int inBase = r * w;
            for (int c = 0; c < w; c++) {
                int o = rowBase + c / factor;
                acc[o] += type.readDouble(px, inBase + c);
                cnt[o]++;
            }
        }

        float[] out = new float[outH * outW];
        for (int i = 0; i < out.length; i++) out[i] = (float) (acc[i] / cnt[i]);
        return new DownsampledImage(outH, outW, out);
    }
}
