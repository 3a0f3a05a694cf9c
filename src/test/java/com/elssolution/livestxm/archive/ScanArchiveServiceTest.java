package com.elssolution.livestxm.archive;

import com.elssolution.livestxm.alerts.AlertService;
import com.elssolution.livestxm.display.MapImageRenderer;
import com.elssolution.livestxm.domain.ScanMapSnapshot;
import com.elssolution.livestxm.domain.ScanMetadata;
import com.elssolution.livestxm.pipeline.ScanAssembler;
import com.elssolution.livestxm.pipeline.events.ScanCompletedEvent;
import com.elssolution.livestxm.support.MutableClock;
import com.elssolution.livestxm.support.RecordingEvents;
import com.elssolution.livestxm.support.Scans;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScanArchiveServiceTest {

    private ScanArchiver archiver;
    private ScanAssembler assembler;
    private ScheduledExecutorService scheduler;
    private AlertService alerts;
    private ScanArchiveService service;

    @BeforeEach
    void setUp() {
        archiver = mock(ScanArchiver.class);
        assembler = new ScanAssembler(new MutableClock(0), new RecordingEvents());
        scheduler = mock(ScheduledExecutorService.class);
        // run background work inline
        doAnswer(inv -> {
            ((Runnable) inv.getArgument(0)).run();
            return null;
        }).when(scheduler).execute(any(Runnable.class));
        alerts = new AlertService();
        service = new ScanArchiveService(archiver, new MapImageRenderer(), assembler, scheduler, alerts);
    }

    @Test
    void nothing_to_save_before_the_first_scan() throws IOException {
        assertThat(service.saveCurrent()).isEmpty();
        verify(archiver, never()).save(any(), any(), any());
    }

    @Test
    void saves_the_partial_map_on_demand() throws IOException {
        ScanMetadata md = Scans.grid("s", 3, 3);
        assembler.onMetadata(md);
        assembler.onReducedFrame(Scans.reduced("s", 0, 5));
        when(archiver.save(any(), any(), any())).thenReturn(Path.of("saved_data/stxm_scan_x"));

        assertThat(service.saveCurrent()).contains(Path.of("saved_data/stxm_scan_x"));

        ArgumentCaptor<ScanMapSnapshot> map = ArgumentCaptor.forClass(ScanMapSnapshot.class);
        verify(archiver).save(eq(md), map.capture(), any());
        assertThat(map.getValue().getWrittenCount()).isEqualTo(1);
    }

    @Test
    void completed_scans_are_saved_automatically_unless_disabled() throws IOException {
        ScanMetadata md = Scans.grid("s", 1, 1);
        assembler.onMetadata(md);
        assembler.onReducedFrame(Scans.reduced("s", 0, 5));
        ScanMapSnapshot snap = assembler.snapshot().orElseThrow();

        service.setAutoSave(false);
        service.onScanCompleted(new ScanCompletedEvent(md, snap));
        verify(archiver, never()).save(any(), any(), any());

        service.setAutoSave(true);
        service.onScanCompleted(new ScanCompletedEvent(md, snap));
        verify(archiver).save(eq(md), eq(snap), any());
    }

    @Test
    void failed_save_raises_an_alert_and_the_next_success_resolves_it() throws IOException {
        assembler.onMetadata(Scans.grid("s", 2, 2));
        when(archiver.save(any(), any(), any()))
                .thenThrow(new IOException("disk full"))
                .thenReturn(Path.of("ok"));

        assertThatThrownBy(() -> service.saveCurrent()).isInstanceOf(IOException.class).hasMessage("disk full");
        assertThat(alerts.isActive(ScanArchiveService.ALERT_KEY)).isTrue();

        service.saveCurrent();
        assertThat(alerts.isActive(ScanArchiveService.ALERT_KEY)).isFalse();
    }

    @Test
    void render_failure_on_auto_save_raises_the_alert_instead_of_escaping() throws IOException {
        MapImageRenderer renderer = mock(MapImageRenderer.class);
        when(renderer.render(any())).thenThrow(new IllegalArgumentException("image too large"));
        service = new ScanArchiveService(archiver, renderer, assembler, scheduler, alerts);
        ScanMetadata md = Scans.grid("s", 1, 1);
        assembler.onMetadata(md);
        assembler.onReducedFrame(Scans.reduced("s", 0, 5));

        service.onScanCompleted(new ScanCompletedEvent(md, assembler.snapshot().orElseThrow()));

        assertThat(alerts.isActive(ScanArchiveService.ALERT_KEY)).isTrue();
        verify(archiver, never()).save(any(), any(), any());
        assertThatThrownBy(() -> service.saveCurrent())
                .isInstanceOf(IOException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }
}
