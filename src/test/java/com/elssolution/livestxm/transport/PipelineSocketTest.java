package com.elssolution.livestxm.transport;

import com.elssolution.livestxm.alerts.AlertService;
import com.elssolution.livestxm.codec.MessageCodec;
import com.elssolution.livestxm.domain.RawFrame;
import com.elssolution.livestxm.domain.ScanMapSnapshot;
import com.elssolution.livestxm.domain.ScanMetadata;
import com.elssolution.livestxm.pipeline.FrameForwarder;
import com.elssolution.livestxm.pipeline.FrameReducer;
import com.elssolution.livestxm.pipeline.FrameReduction;
import com.elssolution.livestxm.pipeline.ScanAssembler;
import com.elssolution.livestxm.pipeline.ScanStreamReceiver;
import com.elssolution.livestxm.support.RecordingEvents;
import com.elssolution.livestxm.support.Scans;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.zeromq.SocketType;
import org.zeromq.ZContext;
import org.zeromq.ZMQ;
import org.zeromq.ZMsg;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Clock;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

/**
 * Source PUBs → forwarder → reducer → assembler over loopback TCP.
 * PUB/SUB drops messages until the subscription is in place, so every test first
 * repeats a warm-up scan until it shows up downstream.
 */
class PipelineSocketTest {

    private static final long TIMEOUT_MS = 10_000;

    private ZContext zmq;
    private MessageCodec codec;
    private AlertService alerts;
    private ScanAssembler assembler;
    private FrameForwarder forwarder;
    private FrameReducer reducer;
    private ScanStreamReceiver receiver;
    private ZMQ.Socket mdPub;
    private ZMQ.Socket dataPub;

    @BeforeEach
    void setUp() throws IOException {
        zmq = new ZContext();
        codec = new MessageCodec();
        alerts = new AlertService();
        assembler = new ScanAssembler(Clock.systemUTC(), new RecordingEvents());

        String mdEndpoint = "tcp://127.0.0.1:" + freePort();
        String dataEndpoint = "tcp://127.0.0.1:" + freePort();
        String reducerQueue = "tcp://127.0.0.1:" + freePort();
        String assemblerQueue = "tcp://127.0.0.1:" + freePort();

        mdPub = zmq.createSocket(SocketType.PUB);
        mdPub.setLinger(0);
        mdPub.bind(mdEndpoint);
        dataPub = zmq.createSocket(SocketType.PUB);
        dataPub.setLinger(0);
        dataPub.bind(dataEndpoint);

        forwarder = new FrameForwarder(zmq, alerts);
        forwarder.setSourceEndpoint(dataEndpoint);
        forwarder.setOutputEndpoint(reducerQueue);
        forwarder.setPollTimeoutMs(20);

        reducer = new FrameReducer(zmq, alerts, codec, new FrameReduction());
        reducer.setMetadataEndpoint(mdEndpoint);
        reducer.setInputEndpoint(reducerQueue);
        reducer.setOutputEndpoint(assemblerQueue);
        reducer.setPollTimeoutMs(20);

        receiver = new ScanStreamReceiver(zmq, alerts, codec, assembler);
        receiver.setInputEndpoint(assemblerQueue);
        receiver.setPollTimeoutMs(20);

        forwarder.start();
        reducer.start();
        receiver.start();
        warmUp();
    }

    @AfterEach
    void tearDown() {
        receiver.stop();
        reducer.stop();
        forwarder.stop();
        zmq.close();
    }

    @Test
    void frames_are_reduced_and_placed_in_arrival_order() {
        ScanMetadata md = Scans.grid("s1", 3, 2);
        startScan(md);

        for (int i = 0; i < 6; i++) {
            publishFrame(uniform(i + 1));
        }
        await(() -> assembler.progress().accepted() == 6);

        ScanMapSnapshot map = assembler.snapshot().orElseThrow();
        // 4x4 detector, every pixel = i + 1
        assertThat(map.get(0, 0)).isEqualTo(16.0);
        assertThat(map.get(0, 2)).isEqualTo(48.0);
        assertThat(map.get(1, 0)).isEqualTo(64.0);
        assertThat(map.get(1, 2)).isEqualTo(96.0);
        assertThat(assembler.progress().complete()).isTrue();
        assertThat(forwarder.relayedCount()).isGreaterThanOrEqualTo(6);
    }

    @Test
    void frames_tagged_with_a_previous_scan_never_reach_the_map() {
        startScan(Scans.grid("s2", 2, 2));

        long zombiesBefore = assembler.view().getZombieFrames();

        publishFrame(uniform(9).withIdentity(0, "warm"));
        publishFrame(uniform(1));
        await(() -> assembler.progress().accepted() == 1);
        await(() -> assembler.view().getZombieFrames() > zombiesBefore);

        assertThat(assembler.snapshot().orElseThrow().get(0, 0)).isEqualTo(16.0);
    }

    @Test
    void malformed_messages_are_dropped_and_the_stream_continues() {
        ZMsg junk = new ZMsg();
        junk.addString("{\"x_num\": \"lots\"}");
        junk.send(mdPub);
        await(() -> reducer.malformedCount() >= 1);

        startScan(Scans.grid("s3", 1, 1));
        publishFrame(uniform(2));
        await(() -> assembler.progress().complete());
        assertThat(receiver.isRunning()).isTrue();
    }

    @Test
    void links_report_up_once_connected() {
        await(() -> reducer.linkStates().get("source-metadata") == LinkState.UP);
        await(() -> forwarder.linkStates().get("source-data") == LinkState.UP);
        assertThat(alerts.anyActiveWithPrefix("LINK_DOWN:")).isFalse();
    }

    // ---- helpers ----

    /**
     * Repeat a warm-up scan and frame until both have crossed every hop, then wait
     * until every relayed frame has been reduced so nothing stale is left in flight.
     */
    private void warmUp() {
        ScanMetadata warm = Scans.grid("warm", 1000, 1);
        long deadline = System.currentTimeMillis() + TIMEOUT_MS;
        while (assembler.activeMetadata().isEmpty()) {
            if (System.currentTimeMillis() > deadline) fail("metadata path never came up");
            codec.encodeMetadata(warm).send(mdPub);
            sleep(200);
        }
        while (assembler.progress().accepted() == 0) {
            if (System.currentTimeMillis() > deadline) fail("frame path never came up");
            publishFrame(uniform(1));
            long wait = System.currentTimeMillis() + 500;
            while (assembler.progress().accepted() == 0 && System.currentTimeMillis() < wait) sleep(10);
        }
        await(() -> reducer.reducedCount() == forwarder.relayedCount());
    }

    private void startScan(ScanMetadata md) {
        codec.encodeMetadata(md).send(mdPub);
        await(() -> assembler.activeMetadata().map(m -> m.getScanId().equals(md.getScanId())).orElse(false));
    }

    private void publishFrame(RawFrame f) {
        codec.encodeRawFrame(f).send(dataPub);
    }

    private static RawFrame uniform(int value) {
        return Scans.uint16(4, 4, value, value, value, value, value, value, value, value,
                value, value, value, value, value, value, value, value);
    }

    private static void await(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + TIMEOUT_MS;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) fail("condition not met within " + TIMEOUT_MS + " ms");
            sleep(10);
        }
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static int freePort() throws IOException {
        try (ServerSocket s = new ServerSocket(0)) {
            return s.getLocalPort();
        }
    }
}
