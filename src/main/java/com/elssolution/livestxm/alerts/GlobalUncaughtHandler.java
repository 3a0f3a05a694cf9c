package com.elssolution.livestxm.alerts;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class GlobalUncaughtHandler implements Thread.UncaughtExceptionHandler {

    /** Socket loop threads are named with this prefix followed by the stage name. */
    public static final String STAGE_THREAD_PREFIX = "zmq-";

    private final AlertService alerts;
    private final ApplicationEventPublisher publisher;

    private volatile boolean stopping = false;

    @PostConstruct
    void registerAsDefault() {
        Thread.setDefaultUncaughtExceptionHandler(this);
        log.info("Global uncaught handler installed");
    }

    @EventListener
    public void onContextClosed(ContextClosedEvent e) {
        stopping = true;
    }

    @Override
    public void uncaughtException(Thread t, Throwable e) {
        if (stopping) return;

        String name = t.getName() == null ? "" : t.getName();
        log.error("Uncaught in {} -> {}", name, e.toString(), e);

        if (name.startsWith(STAGE_THREAD_PREFIX) || isTransport(e)) {
            alerts.raise("TRANSPORT_UNCAUGHT", name + ": " + e, AlertService.Severity.CRITICAL);
            if (name.startsWith(STAGE_THREAD_PREFIX)) {
                publisher.publishEvent(new StageCrashedEvent(name.substring(STAGE_THREAD_PREFIX.length()), e));
            }
        } else {
            alerts.raise("UNCAUGHT", name + ": " + e, AlertService.Severity.CRITICAL);
        }
    }

    private boolean isTransport(Throwable e) {
        for (StackTraceElement st : e.getStackTrace()) {
            if (st.getClassName().startsWith("org.zeromq") || st.getClassName().startsWith("zmq.")) return true;
        }
        return false;
    }
}
