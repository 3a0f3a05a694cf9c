package com.elssolution.livestxm.pipeline;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/** Periodically asks the assembler whether the stream has gone quiet. */
@Slf4j
@Component
public class ScanWatchdog {

    @Value("${stxm.assembler.watchdogPeriodMs:1000}")
    private long periodMs;

    private final ScanAssembler assembler;
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;

    public ScanWatchdog(ScanAssembler assembler, ScheduledExecutorService scheduler) {
        this.assembler = assembler;
        this.scheduler = scheduler;
    }

    @PostConstruct
    void start() {
        long period = Math.max(100, periodMs);
        task = scheduler.scheduleAtFixedRate(this::check, period, period, TimeUnit.MILLISECONDS);
        log.info("watchdog checking every {} ms (standby after {} ms idle)", period, assembler.getStandbyTimeoutMs());
    }

    private void check() {
        try {
            assembler.tick();
        } catch (RuntimeException e) {
            // keep the periodic task alive
            log.warn("watchdog_tick_failed: {}", e.toString());
        }
    }

    @PreDestroy
    void stop() {
        if (task != null) task.cancel(false);
    }
}
