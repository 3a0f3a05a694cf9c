package com.elssolution.livestxm.display;

import com.elssolution.livestxm.domain.ReducedFrame;
import com.elssolution.livestxm.domain.ScanMapSnapshot;
import com.elssolution.livestxm.pipeline.ScanAssembler;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Render tick. Takes at most one frame from the latest-value slot and a map copy only
 * when the map version moved, then fans the update out to every {@link DisplaySink}.
 * Frames that arrive between ticks are overwritten in the slot, never queued.
 */
@Slf4j
@Component
public class DisplayRefresher {

    @Value("${stxm.display.refreshPeriodMs:33}")
    private long refreshPeriodMs;

    private final ScanAssembler assembler;
    private final List<DisplaySink> sinks;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private long seenMapVersion = -1;
    private ScheduledFuture<?> task;

    public DisplayRefresher(ScanAssembler assembler, List<DisplaySink> sinks,
                            ScheduledExecutorService scheduler, Clock clock) {
        this.assembler = assembler;
        this.sinks = sinks;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @PostConstruct
    void start() {
        long period = Math.max(10, refreshPeriodMs);
        task = scheduler.scheduleAtFixedRate(this::refreshSafe, period, period, TimeUnit.MILLISECONDS);
        log.info("display refresh every {} ms → {} sink(s)", period, sinks.size());
    }

    @PreDestroy
    void stop() {
        if (task != null) task.cancel(false);
    }

    private void refreshSafe() {
        try {
            refresh();
        } catch (RuntimeException e) {
            log.warn("display_refresh_failed: {}", e.toString());
        }
    }

    /** One tick; package-visible for tests. */
    synchronized DisplayUpdate refresh() {
        ReducedFrame frame = assembler.latestFrame().poll().orElse(null);
        ScanMapSnapshot map = assembler.snapshotIfNewer(seenMapVersion).orElse(null);
        if (map != null) seenMapVersion = map.getVersion();

        DisplayUpdate update = DisplayUpdate.builder()
                .metadata(assembler.activeMetadata().orElse(null))
                .latestFrame(frame)
                .map(map)
                .progress(assembler.progress())
                .state(assembler.state())
                .renderedAtMs(clock.millis())
                .build();
        for (DisplaySink sink : sinks) {
            sink.render(update);
        }
        return update;
    }
}
