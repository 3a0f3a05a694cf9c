package com.elssolution.livestxm.display;

import com.elssolution.livestxm.domain.ReducedFrame;
import com.elssolution.livestxm.domain.ScanMapSnapshot;
import com.elssolution.livestxm.domain.ScanMetadata;
import com.elssolution.livestxm.domain.ScanProgress;
import com.elssolution.livestxm.pipeline.AssemblerState;
import lombok.Builder;
import lombok.Value;

/**
 * What one render tick hands to the sinks. {@code latestFrame} and {@code map} are
 * null when they did not change since the previous tick.
 */
@Value @Builder
public class DisplayUpdate {
    ScanMetadata metadata;
    ReducedFrame latestFrame;
    ScanMapSnapshot map;
    ScanProgress progress;
    AssemblerState state;
    long renderedAtMs;
}
