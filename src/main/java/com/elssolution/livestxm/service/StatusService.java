package com.elssolution.livestxm.service;

import com.elssolution.livestxm.alerts.AlertService;
import com.elssolution.livestxm.archive.ScanArchiveService;
import com.elssolution.livestxm.display.LiveViewState;
import com.elssolution.livestxm.domain.ScanMetadata;
import com.elssolution.livestxm.domain.ScanProgress;
import com.elssolution.livestxm.pipeline.AssemblerState;
import com.elssolution.livestxm.pipeline.FrameReducer;
import com.elssolution.livestxm.pipeline.ScanAssembler;
import com.elssolution.livestxm.pipeline.events.ScanStartedEvent;
import com.elssolution.livestxm.pipeline.events.StandbyChangedEvent;
import com.elssolution.livestxm.transport.LinkState;
import com.elssolution.livestxm.transport.ZmqStage;
import jakarta.annotation.PostConstruct;
import lombok.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Status aggregation.
 * - Scan state and progress from the assembler, render age from the live view.
 * - Per-stage counters and link states.
 * - Turns standby transitions into the STREAM_STANDBY alert.
 */
@Slf4j
@Component
public class StatusService {

    static final String STANDBY_ALERT = "STREAM_STANDBY";

    private final ScheduledExecutorService scheduler;
    private final ScanAssembler assembler;
    private final LiveViewState view;
    private final List<ZmqStage> stages;
    private final FrameReducer reducer;
    private final ScanArchiveService archive;
    private final AlertService alerts;
    private final Clock clock;

    public StatusService(ScheduledExecutorService scheduler,
                         ScanAssembler assembler,
                         LiveViewState view,
                         List<ZmqStage> stages,
                         FrameReducer reducer,
                         ScanArchiveService archive,
                         AlertService alerts,
                         Clock clock) {
        this.scheduler = scheduler;
        this.assembler = assembler;
        this.view = view;
        this.stages = stages;
        this.reducer = reducer;
        this.archive = archive;
        this.alerts = alerts;
        this.clock = clock;
    }

    @Value("${stxm.status.summaryPeriodSec:30}")
    private int summaryEverySec = 30;

    @PostConstruct
    void startSummaryLogger() {
        int period = Math.max(1, summaryEverySec);
        scheduler.scheduleAtFixedRate(this::logSummarySafe, 10, period, TimeUnit.SECONDS);
        log.info("Status summary logger started: every {}s", period);
    }

    // ---------------------- Events ----------------------

    @EventListener
    public void onStandbyChanged(StandbyChangedEvent evt) {
        if (evt.standby()) {
            alerts.raise(STANDBY_ALERT, "no data for " + humanAge(evt.idleMs()), AlertService.Severity.INFO);
        } else {
            alerts.resolve(STANDBY_ALERT);
        }
    }

    @EventListener
    public void onScanStarted(ScanStartedEvent evt) {
        ScanMetadata md = evt.metadata();
        log.info("Scan #{} started: {} | x: {} pts {} → {} | y: {} pts {} → {} | detector {}x{} | exposure {}s",
                evt.epoch(), md.getScanId(),
                md.getXNum(), md.getXStart(), md.getXStop(),
                md.getYNum(), md.getYStart(), md.getYStop(),
                md.getDetectorHeight(), md.getDetectorWidth(), md.getExposureTimeS());
    }

    // ---------------------- Public API ----------------------

    /** Used by controllers, the health indicator and the periodic logger. */
    public StatusView buildStatusView() {
        long now = clock.millis();
        ScanAssembler.AssemblerView a = assembler.view();
        ScanProgress p = a.getProgress();

        Map<String, StageView> stageViews = new LinkedHashMap<>();
        Map<String, LinkState> links = new TreeMap<>();
        boolean connected = true;
        for (ZmqStage s : stages) {
            if (!s.isEnabled()) continue;
            Map<String, LinkState> sl = s.linkStates();
            links.putAll(sl);
            connected &= s.isRunning() && sl.values().stream().noneMatch(l -> l == LinkState.DOWN);
            stageViews.put(s.getStageName(), StageView.builder()
                    .running(s.isRunning())
                    .received(s.receivedCount())
                    .malformed(s.malformedCount())
                    .transportFaults(s.transportFaultCount())
                    .build());
        }

        long renderAge = view.lastRenderMs() == 0 ? -1 : Math.max(0, now - view.lastRenderMs());
        long frameAge = view.lastFrameMs() == 0 ? -1 : Math.max(0, now - view.lastFrameMs());

        return StatusView.builder()
                .state(a.getState().name())
                .standby(a.getState() == AssemblerState.STANDBY)
                .scanId(a.getScanId())
                .epoch(a.getEpoch())
                .progressLabel(p.label())
                .progressPercent(p.percent())
                .accepted(p.accepted())
                .total(p.total())
                .idleMs(a.getIdleMs())
                .idleHuman(humanAge(a.getIdleMs()))
                .renderAgeMs(renderAge)
                .lastFrameAgeHuman(humanAge(frameAge))
                .zombieFrames(a.getZombieFrames())
                .overflowFrames(a.getOverflowFrames())
                .displayOverwrites(a.getDisplayOverwrites())
                .displayOffers(a.getDisplayOffers())
                .reducedScans(reducer.scanCount())
                .shapeRejects(reducer.shapeRejectCount())
                .lastSavedPath(archive.lastSaved().map(Object::toString).orElse(null))
                .stages(stageViews)
                .links(links)
                .linkAlerts(alerts.anyActiveWithPrefix(ZmqStage.LINK_ALERT_PREFIX))
                .connected(connected)
                .build();
    }

    // ---------------------- Log summary ----------------------

    private void logSummarySafe() {
        try {
            StatusView v = buildStatusView();
            log.info("Status: {} scan={} {} idle={}; zombies={} overflow={} skippedRenders={}; links={}",
                    v.state, v.scanId == null ? "-" : v.scanId, v.progressLabel, v.idleHuman,
                    v.zombieFrames, v.overflowFrames, v.displayOverwrites, v.links);
        } catch (Exception e) {
            log.warn("status_summary_failed: {}", e.getMessage());
        }
    }

    // ---------------------- formatting helpers ----------------------

    static String humanAge(long ageMs) {
        if (ageMs < 0) return "-";
        if (ageMs < 1000) return ageMs + " ms";
        long s = ageMs / 1000;
        if (s < 60) return s + " s";
        long m = s / 60;
        long remS = s % 60;
        return m + " min " + remS + " s";
    }

    @Builder @Getter @ToString @EqualsAndHashCode @AllArgsConstructor
    public static class StageView {
        boolean running;
        long received;
        long malformed;
        long transportFaults;
    }

    @Builder @Getter @ToString @EqualsAndHashCode @AllArgsConstructor
    public static class StatusView {
        // Scan
        String  state;
        boolean standby;
        String  scanId;
        long    epoch;
        String  progressLabel;
        int     progressPercent;
        int     accepted;
        int     total;

        // Liveness
        long   idleMs;
        String idleHuman;
        long   renderAgeMs;
        String lastFrameAgeHuman;

        // Drops
        long zombieFrames;
        long overflowFrames;
        long displayOverwrites;
        long displayOffers;

        // Reducer
        long reducedScans;
        long shapeRejects;

        // Archive
        String lastSavedPath;

        // Transport
        Map<String, StageView> stages;
        Map<String, LinkState> links;
        boolean linkAlerts;
        boolean connected;
    }
}
