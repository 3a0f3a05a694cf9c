package com.elssolution.livestxm.transport;

import com.elssolution.livestxm.alerts.AlertService;
import com.elssolution.livestxm.alerts.GlobalUncaughtHandler;
import com.elssolution.livestxm.alerts.StageCrashedEvent;
import com.elssolution.livestxm.codec.MalformedMessageException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.zeromq.SocketType;
import org.zeromq.ZContext;
import org.zeromq.ZFrame;
import org.zeromq.ZMQ;
import org.zeromq.ZMQException;
import org.zeromq.ZMsg;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One pipeline hop: a dedicated thread that owns a few ZeroMQ sockets and runs a
 * poll loop over its inputs.
 *
 * Loop contract:
 *   - poll with a short timeout, so {@link #stop()} is seen within one interval
 *   - any ZMQException closes every socket of the stage and reopens them after an
 *     exponential backoff; transport faults are never fatal
 *   - malformed input is logged, counted and dropped
 *   - every socket opened with a link name is monitored; its state is the
 *     connection-status indicator ({@code LINK_DOWN:<link>} alert while down)
 *
 * Sockets are created, used and closed on the loop thread only.
 */
@Slf4j
public abstract class ZmqStage {

    private static final AtomicInteger MONITOR_IDS = new AtomicInteger();
    private static final int MAX_BATCH = 256;
    private static final int MONITORED_EVENTS = ZMQ.EVENT_CONNECTED | ZMQ.EVENT_ACCEPTED
            | ZMQ.EVENT_DISCONNECTED | ZMQ.EVENT_CONNECT_RETRIED | ZMQ.EVENT_BIND_FAILED;

    // ==== Config ====
    public static final String LINK_ALERT_PREFIX = "LINK_DOWN:";

    @Value("${stxm.transport.pollTimeoutMs:100}")
    @Getter @Setter private long pollTimeoutMs = 100;
    @Value("${stxm.transport.reconnectBackoffMs:500}")
    @Getter @Setter private long reconnectBackoffMs = 500;
    @Value("${stxm.transport.maxReconnectBackoffMs:10000}")
    @Getter @Setter private long maxReconnectBackoffMs = 10_000;

    // ==== Infra ====
    protected final ZContext zmq;
    protected final AlertService alerts;
    @Getter private final String stageName;

    // ==== Loop-thread state ====
    private final List<ZMQ.Socket> inputs = new ArrayList<>();
    private final List<ZMQ.Socket> owned = new ArrayList<>();
    private final Map<ZMQ.Socket, String> monitors = new LinkedHashMap<>();

    // ==== State exposed to others ====
    private final Map<String, LinkState> links = new ConcurrentHashMap<>();
    private final AtomicLong received = new AtomicLong();
    private final AtomicLong malformed = new AtomicLong();
    private final AtomicLong transportFaults = new AtomicLong();
    @Getter private volatile boolean running = false;

    private volatile ExecutorService worker;
    private volatile boolean stopping = false;

    protected ZmqStage(String stageName, ZContext zmq, AlertService alerts) {
        this.stageName = stageName;
        this.zmq = zmq;
        this.alerts = alerts;
    }

    // ---- Subclass hooks ----

    /** Whether the stage should start with the application context. */
    public abstract boolean isEnabled();

    /** Open sockets with {@link #openSocket} and register inputs with {@link #pollInput}. */
    protected abstract void openSockets();

    /** One complete multipart message from input {@code inputIndex}, in registration order. */
    protected abstract void onMessage(int inputIndex, ZMsg msg);

    /** Called when a poll interval passes with nothing to read. */
    protected void onIdle() {
    }

    // ---- Lifecycle ----

    @PostConstruct
    public void startIfEnabled() {
        if (!isEnabled()) {
            log.info("{} disabled", stageName);
            return;
        }
        start();
    }

    public synchronized void start() {
        if (worker != null) return;
        stopping = false;
        worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, GlobalUncaughtHandler.STAGE_THREAD_PREFIX + stageName);
            t.setDaemon(true);
            return t;
        });
        // execute(), not submit(): a dying loop must reach the uncaught handler
        worker.execute(this::runLoop);
        log.info("{} started", stageName);
    }

    @PreDestroy
    public synchronized void stop() {
        stopping = true;
        ExecutorService w = worker;
        if (w == null) return;
        w.shutdown();
        try {
            long waitMs = Math.max(1000, pollTimeoutMs * 10);
            if (!w.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
                log.warn("{} loop did not exit within {} ms", stageName, waitMs);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        worker = null;
        log.info("{} stopped", stageName);
    }

    @EventListener
    public void onStageCrashed(StageCrashedEvent evt) {
        if (!stageName.equals(evt.stageName())) return;
        ExecutorService w = worker;
        if (stopping || w == null || w.isShutdown()) return;
        log.warn("{} loop crashed ({}) → restarting", stageName, evt.cause().toString());
        w.execute(this::runLoop);
    }

    // ---- Loop ----

    private void runLoop() {
        running = true;
        int failures = 0;
        try {
            while (!stopping) {
                try {
                    openSockets();
                    if (failures > 0) {
                        log.info("{} sockets reopened after {} failed attempt(s)", stageName, failures);
                    }
                    failures = 0;
                    alerts.resolve(faultKey());
                    pollUntilStopped();
                } catch (ZMQException e) {
                    if (stopping || e.getErrorCode() == ZMQ.Error.ETERM.getCode()) break;
                    failures++;
                    transportFaults.incrementAndGet();
                    long backoff = backoffFor(failures);
                    log.warn("{}_transport_err (attempt #{}) → reopen in {} ms: {}", stageName, failures, backoff, e.toString());
                    alerts.raise(faultKey(), stageName + " transport fault: " + e.getMessage(), AlertService.Severity.ERROR);
                    closeSockets();
                    sleepQuiet(backoff);
                } catch (IllegalStateException e) {
                    // ZContext already closed underneath us
                    if (stopping || zmq.isClosed()) break;
                    throw e;
                } finally {
                    closeSockets();
                }
            }
        } finally {
            running = false;
            log.info("{} loop exited", stageName);
        }
    }

    private void pollUntilStopped() {
        List<ZMQ.Socket> monitorSockets = new ArrayList<>(monitors.keySet());
        ZMQ.Poller poller = zmq.createPoller(inputs.size() + monitorSockets.size());
        try {
            for (ZMQ.Socket s : inputs) poller.register(s, ZMQ.Poller.POLLIN);
            for (ZMQ.Socket m : monitorSockets) poller.register(m, ZMQ.Poller.POLLIN);

            while (!stopping) {
                int ready = poller.poll(pollTimeoutMs);
                if (ready <= 0) {
                    onIdle();
                    continue;
                }
                for (int i = 0; i < inputs.size(); i++) {
                    if (poller.pollin(i)) drain(i, inputs.get(i));
                }
                for (int j = 0; j < monitorSockets.size(); j++) {
                    if (poller.pollin(inputs.size() + j)) drainMonitor(monitorSockets.get(j));
                }
            }
        } finally {
            poller.close();
        }
    }

    private void drain(int index, ZMQ.Socket socket) {
        for (int n = 0; n < MAX_BATCH && !stopping; n++) {
            ZMsg msg = ZMsg.recvMsg(socket, ZMQ.DONTWAIT);
            if (msg == null) return;
            received.incrementAndGet();
            try {
                onMessage(index, msg);
            } catch (ZMQException e) {
                throw e;
            } catch (MalformedMessageException e) {
                malformed.incrementAndGet();
                log.warn("{}_malformed_message dropped: {}", stageName, e.getMessage());
            } catch (RuntimeException e) {
                malformed.incrementAndGet();
                log.error("{}_message_failed dropped: {}", stageName, e.toString(), e);
            }
        }
    }

    private void drainMonitor(ZMQ.Socket pair) {
        String link = monitors.get(pair);
        ZMQ.Event ev;
        while ((ev = ZMQ.Event.recv(pair, ZMQ.DONTWAIT)) != null) {
            switch (ev.getEvent()) {
                case ZMQ.EVENT_CONNECTED, ZMQ.EVENT_ACCEPTED -> markLink(link, LinkState.UP, ev.getAddress());
                case ZMQ.EVENT_DISCONNECTED, ZMQ.EVENT_CONNECT_RETRIED, ZMQ.EVENT_BIND_FAILED ->
                        markLink(link, LinkState.DOWN, ev.getAddress());
                default -> {
                    if (log.isTraceEnabled()) log.trace("{} monitor event {} on {}", stageName, ev.getEvent(), link);
                }
            }
        }
    }

    private void markLink(String link, LinkState state, String address) {
        LinkState prev = links.put(link, state);
        if (prev == state) return;
        if (state == LinkState.UP) {
            log.info("link_up stage={} link={} addr={}", stageName, link, address);
            alerts.resolve(linkKey(link));
        } else {
            log.warn("link_down stage={} link={} addr={}", stageName, link, address);
            alerts.raise(linkKey(link), stageName + "/" + link + " lost (" + address + ")", AlertService.Severity.WARN);
        }
    }

    // ---- Helpers for subclasses ----

    /**
     * New socket owned by this stage; closed on reopen and stop. A non-null
     * {@code link} attaches a monitor so the socket's connection state is reported.
     */
    protected ZMQ.Socket openSocket(SocketType type, String link) {
        ZMQ.Socket s = zmq.createSocket(type);
        s.setLinger(0);
        owned.add(s);
        if (link != null) {
            String addr = "inproc://monitor-" + stageName + "-" + MONITOR_IDS.incrementAndGet();
            s.monitor(addr, MONITORED_EVENTS);
            ZMQ.Socket pair = zmq.createSocket(SocketType.PAIR);
            pair.setLinger(0);
            pair.connect(addr);
            monitors.put(pair, link);
            links.putIfAbsent(link, LinkState.CONNECTING);
        }
        return s;
    }

    protected void pollInput(ZMQ.Socket s) {
        inputs.add(s);
    }

    /**
     * Push a message without shedding it: waits in poll-interval slices until the
     * peer accepts it or the stage is stopping. The output socket needs a send
     * timeout (see {@link #configureOutput}). Returns false only when stopping.
     */
    protected boolean sendReliably(ZMQ.Socket out, ZMsg msg) {
        List<ZFrame> parts = new ArrayList<>(msg);
        if (parts.isEmpty()) return true;
        int last = parts.size() - 1;
        while (!stopping) {
            if (parts.get(0).send(out, (last > 0 ? ZFrame.MORE : 0) | ZFrame.REUSE)) {
                for (int i = 1; i <= last; i++) {
                    parts.get(i).send(out, (i < last ? ZFrame.MORE : 0) | ZFrame.REUSE);
                }
                return true;
            }
            if (log.isDebugEnabled()) log.debug("{} downstream busy, retrying send", stageName);
        }
        return false;
    }

    /** Send timeout = poll interval, so a blocked push still notices stop(). */
    protected void configureOutput(ZMQ.Socket out, int highWaterMark) {
        out.setSndHWM(highWaterMark);
        out.setSendTimeOut((int) Math.max(1, pollTimeoutMs));
    }

    protected boolean isStopping() {
        return stopping;
    }

    // ---- Status ----

    public Map<String, LinkState> linkStates() {
        return Map.copyOf(links);
    }

    public long receivedCount()         { return received.get(); }
    public long malformedCount()        { return malformed.get(); }
    public long transportFaultCount()   { return transportFaults.get(); }

    protected String faultKey() {
        return stageName.toUpperCase().replace('-', '_') + "_TRANSPORT";
    }

    private static String linkKey(String link) {
        return LINK_ALERT_PREFIX + link;
    }

    // ---- Internals ----

    private void closeSockets() {
        for (ZMQ.Socket s : owned) {
            try {
                s.monitor(null, 0);
            } catch (RuntimeException e) {
                log.debug("{} monitor detach failed: {}", stageName, e.toString());
            }
            destroyQuietly(s);
        }
        for (ZMQ.Socket pair : monitors.keySet()) destroyQuietly(pair);
        owned.clear();
        inputs.clear();
        monitors.clear();
    }

    private void destroyQuietly(ZMQ.Socket s) {
        try {
            zmq.destroySocket(s);
        } catch (RuntimeException e) {
            log.debug("{} socket close failed: {}", stageName, e.toString());
        }
    }

    private long backoffFor(int failures) {
        long base = Math.max(50, reconnectBackoffMs);
        long exp = base << Math.min(failures - 1, 10);
        return Math.min(exp, Math.max(base, maxReconnectBackoffMs));
    }

    private void sleepQuiet(long ms) {
        long deadline = System.currentTimeMillis() + ms;
        while (!stopping && System.currentTimeMillis() < deadline) {
            try {
                Thread.sleep(Math.min(pollTimeoutMs, Math.max(1, deadline - System.currentTimeMillis())));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
