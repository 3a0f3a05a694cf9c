package com.elssolution.livestxm.config;

import com.elssolution.livestxm.alerts.GlobalUncaughtHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * Shared scheduler for the periodic, non-blocking work: watchdog tick, render tick,
 * status summary and background archiving. Socket loops do NOT run here; each stage
 * owns its own thread.
 */
@Slf4j
@Configuration
@EnableScheduling
public class SchedulingConfig implements SchedulingConfigurer {
    private final GlobalUncaughtHandler handler;

    @Value("${stxm.scheduler.poolSize:4}")
    private int poolSize;

    public SchedulingConfig(GlobalUncaughtHandler handler) {
        this.handler = handler;
    }

    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService scheduler() {
        ScheduledThreadPoolExecutor ex = new ScheduledThreadPoolExecutor(Math.max(2, poolSize), r -> {
            Thread t = new Thread(r);
            t.setName("stxm-sched-" + t.getId());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler(handler);
            return t;
        });
        ex.setRemoveOnCancelPolicy(true);
        ex.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        ex.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        log.info("scheduler_ready poolSize={}", ex.getCorePoolSize());
        return ex;
    }

    /** Wall clock for liveness arithmetic; tests swap in their own. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        taskRegistrar.setScheduler(scheduler());
    }

}
