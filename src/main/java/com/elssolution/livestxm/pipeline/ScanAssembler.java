package com.elssolution.livestxm.pipeline;

import com.elssolution.livestxm.domain.GridPosition;
import com.elssolution.livestxm.domain.ReducedFrame;
import com.elssolution.livestxm.domain.ScanMap;
import com.elssolution.livestxm.domain.ScanMapSnapshot;
import com.elssolution.livestxm.domain.ScanMetadata;
import com.elssolution.livestxm.domain.ScanProgress;
import com.elssolution.livestxm.pipeline.events.ScanCompletedEvent;
import com.elssolution.livestxm.pipeline.events.ScanStartedEvent;
import com.elssolution.livestxm.pipeline.events.StandbyChangedEvent;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns the active scan: its metadata, its {@link ScanMap}, the latest-frame slot for
 * the display and the liveness state.
 *
 * Driven by three inputs:
 *   - {@link #onMetadata}      new scan: epoch++, fresh map, counter reset, ACTIVE
 *   - {@link #onReducedFrame}  place the frame at the cell its arrival index maps to,
 *                              unless it belongs to another scan (zombie data)
 *   - {@link #tick}            ACTIVE → STANDBY after {@code standbyTimeoutMs} idle
 *
 * Frames and metadata come from the receive thread, ticks from the scheduler and
 * snapshots from the render tick; all state sits behind one lock and no method does I/O.
 * Events are published after the lock is released.
 */
@Slf4j
@Component
public class ScanAssembler {

    @org.springframework.beans.factory.annotation.Value("${stxm.assembler.standbyTimeoutMs:15000}")
    @Getter @Setter private long standbyTimeoutMs = 15_000;

    private final Clock clock;
    private final ApplicationEventPublisher events;
    private final LatestValueSlot<ReducedFrame> latestFrame = new LatestValueSlot<>();

    private final Object lock = new Object();
    private AssemblerState state = AssemblerState.AWAITING_METADATA;
    private ScanMetadata active;
    private ScanMap map;
    private long epoch = 0;
    private int accepted = 0;
    private long mapVersion = 0;
    private long lastActivityMs;

    // counters since start
    private long zombieFrames = 0;
    private long overflowFrames = 0;
    private long placedFrames = 0;

    public ScanAssembler(Clock clock, ApplicationEventPublisher events) {
        this.clock = clock;
        this.events = events;
        this.lastActivityMs = clock.millis();
    }

    // ---------------------- events ----------------------

    /**
     * Start a new scan. Metadata without a scan id (a source feeding this stage
     * directly, not through the reducer) gets one assigned here.
     */
    public void onMetadata(ScanMetadata announced) {
        ScanMetadata md;
        boolean leftStandby;
        long newEpoch;
        int flushedBehind;
        synchronized (lock) {
            flushedBehind = active != null ? active.totalPoints() - accepted : 0;
            leftStandby = state == AssemblerState.STANDBY;
            epoch++;
            newEpoch = epoch;
            md = announced.getScanId() != null && !announced.getScanId().isBlank()
                    ? announced
                    : announced.toBuilder().scanId("scan-" + clock.millis() + "-e" + epoch).build();
            active = md;
            map = new ScanMap(md.rows(), md.cols());
            accepted = 0;
            mapVersion++;
            state = AssemblerState.ACTIVE;
            lastActivityMs = clock.millis();
        }
        latestFrame.clear();

        log.info("scan_started epoch={} scan={} grid={}x{} invertX={} invertY={} (previous scan left {} points unfilled)",
                newEpoch, md.getScanId(), md.rows(), md.cols(), md.invertX(), md.invertY(), Math.max(0, flushedBehind));
        if (leftStandby) events.publishEvent(new StandbyChangedEvent(false, 0));
        events.publishEvent(new ScanStartedEvent(md, newEpoch));
    }

    /**
     * Place one reduced frame. Returns false when the frame was dropped: no scan yet,
     * a scan id other than the active one, or more frames than the grid holds.
     */
    public boolean onReducedFrame(ReducedFrame f) {
        boolean leftStandby;
        ScanCompletedEvent completed = null;
        synchronized (lock) {
            if (active == null || !Objects.equals(active.getScanId(), f.getScanId())) {
                zombieFrames++;
                if (log.isDebugEnabled()) {
                    log.debug("zombie_frame dropped scan={} seq={} (active={})",
                            f.getScanId(), f.getSeq(), active == null ? "-" : active.getScanId());
                }
                return false;
            }
            if (accepted >= active.totalPoints()) {
                overflowFrames++;
                if (log.isDebugEnabled()) log.debug("overflow_frame dropped scan={} seq={}", f.getScanId(), f.getSeq());
                return false;
            }

            GridPosition pos = GridPosition.forArrival(accepted, active);
            map.put(pos, f.getIntensity());
            accepted++;
            placedFrames++;
            mapVersion++;
            lastActivityMs = clock.millis();
            leftStandby = state == AssemblerState.STANDBY;
            state = AssemblerState.ACTIVE;

            if (accepted == active.totalPoints()) {
                completed = new ScanCompletedEvent(active, map.snapshot(active.getScanId(), mapVersion));
            }
        }
        latestFrame.offer(f);

        if (leftStandby) {
            log.info("stream_resumed scan={} → ACTIVE", f.getScanId());
            events.publishEvent(new StandbyChangedEvent(false, 0));
        }
        if (completed != null) {
            log.info("scan_complete scan={} points={}", completed.metadata().getScanId(), completed.metadata().totalPoints());
            events.publishEvent(completed);
        }
        return true;
    }

    /** Watchdog tick. Returns the state after the check. */
    public AssemblerState tick() {
        long idle;
        synchronized (lock) {
            idle = clock.millis() - lastActivityMs;
            if (state != AssemblerState.ACTIVE || idle <= standbyTimeoutMs) {
                return state;
            }
            state = AssemblerState.STANDBY;
        }
        log.info("stream_idle no data for {} ms → STANDBY", idle);
        events.publishEvent(new StandbyChangedEvent(true, idle));
        return AssemblerState.STANDBY;
    }

    // ---------------------- reads ----------------------

    /** Display hand-off: newest reduced frame since the last poll. */
    public LatestValueSlot<ReducedFrame> latestFrame() {
        return latestFrame;
    }

    public Optional<ScanMapSnapshot> snapshot() {
        synchronized (lock) {
            if (map == null) return Optional.empty();
            return Optional.of(map.snapshot(active.getScanId(), mapVersion));
        }
    }

    /** A copy only if the map changed since {@code seenVersion}. */
    public Optional<ScanMapSnapshot> snapshotIfNewer(long seenVersion) {
        synchronized (lock) {
            if (map == null || mapVersion == seenVersion) return Optional.empty();
            return Optional.of(map.snapshot(active.getScanId(), mapVersion));
        }
    }

    public Optional<ScanMetadata> activeMetadata() {
        synchronized (lock) {
            return Optional.ofNullable(active);
        }
    }

    public AssemblerState state() {
        synchronized (lock) {
            return state;
        }
    }

    public ScanProgress progress() {
        synchronized (lock) {
            return active == null ? ScanProgress.NONE : new ScanProgress(accepted, active.totalPoints());
        }
    }

    public AssemblerView view() {
        synchronized (lock) {
            return AssemblerView.builder()
                    .state(state)
                    .epoch(epoch)
                    .scanId(active == null ? null : active.getScanId())
                    .progress(active == null ? ScanProgress.NONE : new ScanProgress(accepted, active.totalPoints()))
                    .idleMs(clock.millis() - lastActivityMs)
                    .placedFrames(placedFrames)
                    .zombieFrames(zombieFrames)
                    .overflowFrames(overflowFrames)
                    .displayOverwrites(latestFrame.overwrittenCount())
                    .displayOffers(latestFrame.offeredCount())
                    .build();
        }
    }

    @Value @Builder
    public static class AssemblerView {
        AssemblerState state;
        long epoch;
        String scanId;
        ScanProgress progress;
        long idleMs;
        long placedFrames;
        long zombieFrames;
        long overflowFrames;
        long displayOverwrites;
        long displayOffers;
    }
}
