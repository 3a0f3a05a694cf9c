package com.elssolution.livestxm.pipeline;

import com.elssolution.livestxm.domain.DownsampledImage;
import com.elssolution.livestxm.domain.PixelType;
import com.elssolution.livestxm.domain.RawFrame;
import com.elssolution.livestxm.domain.ReducedFrame;
import com.elssolution.livestxm.support.Scans;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FrameReductionTest {

    @Test
    void intensity_is_the_exact_pixel_sum_for_unsigned_16_bit() {
        RawFrame f = Scans.uint16(2, 2, 1, 2, 3, 65535);
        assertThat(FrameReduction.sum(f)).isEqualTo(65541.0);
    }

    @Test
    void integral_sum_does_not_lose_precision_on_large_frames() {
        int h = 1024, w = 1024;
        ByteBuffer buf = ByteBuffer.allocate(h * w * 4).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < h * w; i++) buf.putInt(i % 2 == 0 ? 2_000_000_001 : 1);
        buf.flip();
        RawFrame f = new RawFrame(PixelType.UINT32, h, w, buf, 0, "s");

        long expected = (long) (h * w / 2) * 2_000_000_001L + (h * w / 2);
        assertThat((long) FrameReduction.sum(f)).isEqualTo(expected);
    }

    @Test
    void float_frames_sum_in_double() {
        RawFrame f = Scans.float32(10, 10, 0.5f);
        assertThat(FrameReduction.sum(f)).isCloseTo(50.0, within(1e-9));
    }

    @Test
    void factor_fits_the_longer_side_into_the_display_size() {
        assertThat(FrameReduction.factorFor(200, 200, 100)).isEqualTo(2);
        assertThat(FrameReduction.factorFor(250, 80, 100)).isEqualTo(3);
        assertThat(FrameReduction.factorFor(64, 64, 100)).isEqualTo(1);
        assertThat(FrameReduction.factorFor(4096, 4096, 0)).isEqualTo(4096);
    }

    @Test
    void edge_blocks_average_only_the_pixels_they_cover() {
        // 3x3, factor 2 → 2x2 output
        RawFrame f = Scans.uint16(3, 3,
                1, 2, 3,
                4, 5, 6,
                7, 8, 9);
        DownsampledImage img = FrameReduction.downsample(f, 2);

        assertThat(img.getHeight()).isEqualTo(2);
        assertThat(img.getWidth()).isEqualTo(2);
        assertThat(img.get(0, 0)).isEqualTo(3.0f);   // (1+2+4+5)/4
        assertThat(img.get(0, 1)).isEqualTo(4.5f);   // (3+6)/2
        assertThat(img.get(1, 0)).isEqualTo(7.5f);   // (7+8)/2
        assertThat(img.get(1, 1)).isEqualTo(9.0f);
    }

    @Test
    void reduce_keeps_identity_and_bounds_the_display_image() {
        FrameReduction reduction = new FrameReduction();
        reduction.setDisplaySize(100);
        RawFrame f = Scans.float32(200, 200, 1.0f).withIdentity(7, "scan-x");

        ReducedFrame r = reduction.reduce(f);

        assertThat(r.getScanId()).isEqualTo("scan-x");
        assertThat(r.getSeq()).isEqualTo(7);
        assertThat(r.getIntensity()).isCloseTo(40_000.0, within(1e-6));
        assertThat(r.getImage().getHeight()).isEqualTo(100);
        assertThat(r.getImage().getWidth()).isEqualTo(100);
        assertThat(r.getImage().get(50, 50)).isEqualTo(1.0f);
    }
}
