package com.elssolution.livestxm.display;

import com.elssolution.livestxm.domain.ReducedFrame;
import com.elssolution.livestxm.domain.ScanMapSnapshot;
import com.elssolution.livestxm.domain.ScanProgress;
import com.elssolution.livestxm.pipeline.AssemblerState;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Sink that keeps whatever was last rendered, for the HTTP view. A new scan drops the
 * previous scan's frame so the view never mixes two scans.
 */
@Component
public class LiveViewState implements DisplaySink {

    private volatile ReducedFrame frame;
    private volatile ScanMapSnapshot map;
    private volatile ScanProgress progress = ScanProgress.NONE;
    private volatile AssemblerState state = AssemblerState.AWAITING_METADATA;
    private volatile long lastRenderMs;
    private volatile long lastFrameMs;

    @Override
    public void render(DisplayUpdate u) {
        if (u.getMap() != null) {
            if (map != null && !Objects.equals(map.getScanId(), u.getMap().getScanId())) frame = null;
            map = u.getMap();
        }
        if (u.getLatestFrame() != null) {
            frame = u.getLatestFrame();
            lastFrameMs = u.getRenderedAtMs();
        }
        progress = u.getProgress();
        state = u.getState();
        lastRenderMs = u.getRenderedAtMs();
    }

    public Optional<ReducedFrame> frame()      { return Optional.ofNullable(frame); }
    public Optional<ScanMapSnapshot> map()     { return Optional.ofNullable(map); }
    public ScanProgress progress()             { return progress; }
    public AssemblerState state()              { return state; }
    public long lastRenderMs()                 { return lastRenderMs; }
    public long lastFrameMs()                  { return lastFrameMs; }
}
