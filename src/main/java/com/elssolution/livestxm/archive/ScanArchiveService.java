package com.elssolution.livestxm.archive;

import com.elssolution.livestxm.alerts.AlertService;
import com.elssolution.livestxm.display.MapImageRenderer;
import com.elssolution.livestxm.domain.ScanMapSnapshot;
import com.elssolution.livestxm.domain.ScanMetadata;
import com.elssolution.livestxm.pipeline.ScanAssembler;
import com.elssolution.livestxm.pipeline.events.ScanCompletedEvent;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Save on demand, and automatically when a scan fills its grid. Auto-saves run on
 * the scheduler so the receive thread never waits on disk.
 */
@Slf4j
@Service
public class ScanArchiveService {

    static final String ALERT_KEY = "ARCHIVE_FAILED";

    @Value("${stxm.archive.autoSave:true}")
    @Getter @Setter private boolean autoSave = true;

    private final ScanArchiver archiver;
    private final MapImageRenderer renderer;
    private final ScanAssembler assembler;
    private final ScheduledExecutorService scheduler;
    private final AlertService alerts;

    private volatile Path lastSaved;

    public ScanArchiveService(ScanArchiver archiver, MapImageRenderer renderer, ScanAssembler assembler,
                              ScheduledExecutorService scheduler, AlertService alerts) {
        this.archiver = archiver;
        this.renderer = renderer;
        this.assembler = assembler;
        this.scheduler = scheduler;
        this.alerts = alerts;
    }

    @EventListener
    public void onScanCompleted(ScanCompletedEvent evt) {
        if (!autoSave) return;
        scheduler.execute(() -> {
            try {
                save(evt.metadata(), evt.map());
            } catch (IOException | RuntimeException e) {
                log.warn("auto_save_failed scan={}: {}", evt.metadata().getScanId(), e.toString());
            }
        });
    }

    /** Save whatever the current scan holds. Empty when no scan has started yet. */
    public Optional<Path> saveCurrent() throws IOException {
        Optional<ScanMetadata> md = assembler.activeMetadata();
        Optional<ScanMapSnapshot> map = assembler.snapshot();
        if (md.isEmpty() || map.isEmpty()) return Optional.empty();
        return Optional.of(save(md.get(), map.get()));
    }

    /** Render failures surface as {@link IOException} so callers handle one failure type. */
    Path save(ScanMetadata md, ScanMapSnapshot map) throws IOException {
        try {
            Path p = archiver.save(md, map, renderer.render(map));
            lastSaved = p;
            alerts.resolve(ALERT_KEY);
            return p;
        } catch (IOException e) {
            raiseFailed(md, e);
            throw e;
        } catch (RuntimeException e) {
            raiseFailed(md, e);
            throw new IOException("saving scan " + md.getScanId() + " failed", e);
        }
    }

    private void raiseFailed(ScanMetadata md, Exception e) {
        alerts.raise(ALERT_KEY, "saving scan " + md.getScanId() + " failed: " + e,
                AlertService.Severity.ERROR);
    }

    public Optional<Path> lastSaved() {
        return Optional.ofNullable(lastSaved);
    }
}
