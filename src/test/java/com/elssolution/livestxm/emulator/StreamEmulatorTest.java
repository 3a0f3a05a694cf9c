package com.elssolution.livestxm.emulator;

import com.elssolution.livestxm.codec.MessageCodec;
import com.elssolution.livestxm.domain.ScanMetadata;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StreamEmulatorTest {

    @Test
    void random_scans_stay_within_the_configured_envelope() {
        StreamEmulator emulator = new StreamEmulator(null, new MessageCodec());
        boolean sawInvertedX = false;
        boolean sawForwardX = false;

        for (int i = 0; i < 200; i++) {
            ScanMetadata md = emulator.nextScan();
            assertThat(md.getXNum()).isBetween(10, 19);
            assertThat(md.getYNum()).isBetween(10, 19);
            assertThat(md.getExposureTimeS()).isBetween(1e-3, 0.005);
            assertThat(md.getDetectorHeight()).isEqualTo(200);
            assertThat(md.getScanId()).isNull();
            sawInvertedX |= md.invertX();
            sawForwardX |= !md.invertX();
        }
        assertThat(sawInvertedX).isTrue();
        assertThat(sawForwardX).isTrue();
    }
}
