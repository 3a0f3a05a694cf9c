package com.elssolution.livestxm.alerts;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keyed alert episodes for the failure-adjacent signals the pipeline surfaces:
 * link state, stage transport faults, standby, archive errors.
 *
 * A key is either active (raised, not yet resolved) or idle. Raising an idle key
 * starts a new episode; raising an active key only refreshes it.
 */
@Slf4j
@Service
public class AlertService {

    public enum Severity { INFO, WARN, ERROR, CRITICAL }

    @Value @Builder
    public static class AlertView {
        String key;
        String message;
        Severity severity;
        long firstSeen;   // epoch ms, start of the current episode
        long lastSeen;    // epoch ms
        int count;        // raises within this episode
        boolean active;
    }

    @Value @Builder
    public static class EventView {
        String key;
        String message;
        Severity severity;
        long ts;
        String type;      // RAISE / RESOLVE
    }

    @Value @Builder
    public static class AlertsSnapshot {
        List<AlertView> active;
        List<EventView> recent; // newest first
    }

    private static final int RECENT_CAPACITY = 50;

    private final Map<String, Episode> episodes = new ConcurrentHashMap<>();
    private final Deque<EventView> recent = new ArrayDeque<>();

    /** Raise or refresh an alert. */
    public void raise(String key, String message, Severity sev) {
        long now = System.currentTimeMillis();
        Episode e = episodes.computeIfAbsent(key, Episode::new);

        boolean started;
        synchronized (e) {
            started = !e.active;
            if (started) {
                e.firstSeen = now;
                e.count = 0;
            }
            e.active = true;
            e.severity = sev;
            e.message = message;
            e.lastSeen = now;
            e.count++;
        }

        if (started) {
            if (sev == Severity.INFO) log.info("ALERT RAISE key={} msg={}", key, message);
            else log.warn("ALERT RAISE key={} sev={} msg={}", key, sev, message);
            record(key, message, sev, "RAISE", now);
        } else if (log.isDebugEnabled()) {
            log.debug("alert_refresh key={} msg={}", key, message);
        }
    }

    /** Close the episode for this key. No-op if it is not active. */
    public void resolve(String key) {
        Episode e = episodes.get(key);
        if (e == null) return;

        long now = System.currentTimeMillis();
        Severity sev;
        synchronized (e) {
            if (!e.active) return;
            e.active = false;
            e.lastSeen = now;
            sev = e.severity;
        }
        log.info("ALERT RESOLVE key={}", key);
        record(key, "recovered", sev, "RESOLVE", now);
    }

    public boolean isActive(String key) {
        Episode e = episodes.get(key);
        return e != null && e.active;
    }

    public boolean anyActiveWithPrefix(String prefix) {
        return episodes.values().stream().anyMatch(e -> e.active && e.key.startsWith(prefix));
    }

    public AlertsSnapshot snapshot() {
        List<AlertView> active = episodes.values().stream()
                .filter(e -> e.active)
                .map(Episode::view)
                .sorted(Comparator.comparingLong(AlertView::getLastSeen).reversed())
                .toList();

        List<EventView> events;
        synchronized (recent) {
            events = new ArrayList<>(recent);
        }
        Collections.reverse(events);
        return AlertsSnapshot.builder().active(active).recent(events).build();
    }

    private void record(String key, String msg, Severity sev, String type, long ts) {
        EventView ev = EventView.builder().key(key).message(msg).severity(sev).type(type).ts(ts).build();
        synchronized (recent) {
            recent.addLast(ev);
            while (recent.size() > RECENT_CAPACITY) recent.removeFirst();
        }
    }

    private static final class Episode {
        final String key;
        volatile String message;
        volatile Severity severity = Severity.INFO;
        volatile boolean active;
        volatile long firstSeen;
        volatile long lastSeen;
        volatile int count;

        Episode(String key) {
            this.key = key;
        }

        synchronized AlertView view() {
            return AlertView.builder()
                    .key(key).message(message).severity(severity).active(active)
                    .firstSeen(firstSeen).lastSeen(lastSeen).count(count)
                    .build();
        }
    }
}
