package com.elssolution.livestxm.transport;

import com.elssolution.livestxm.alerts.AlertService;
import com.elssolution.livestxm.pipeline.FrameForwarder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.zeromq.SocketType;
import org.zeromq.ZContext;
import org.zeromq.ZMQ;
import org.zeromq.ZMsg;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

/** Start, stop and transport-fault recovery of a stage loop, using the forwarder. */
class ZmqStageLifecycleTest {

    private static final long TIMEOUT_MS = 10_000;
    private static final String FAULT_KEY = "FORWARDER_TRANSPORT";

    private ZContext zmq;
    private AlertService alerts;
    private FrameForwarder forwarder;
    private ZMQ.Socket sourcePub;
    private int outputPort;

    @BeforeEach
    void setUp() throws IOException {
        zmq = new ZContext();
        alerts = new AlertService();

        String sourceEndpoint = "tcp://127.0.0.1:" + freePort();
        outputPort = freePort();

        sourcePub = zmq.createSocket(SocketType.PUB);
        sourcePub.setLinger(0);
        sourcePub.bind(sourceEndpoint);

        forwarder = new FrameForwarder(zmq, alerts);
        forwarder.setSourceEndpoint(sourceEndpoint);
        forwarder.setOutputEndpoint("tcp://127.0.0.1:" + outputPort);
        forwarder.setPollTimeoutMs(20);
        forwarder.setReconnectBackoffMs(50);
        forwarder.setMaxReconnectBackoffMs(200);
    }

    @AfterEach
    void tearDown() {
        forwarder.stop();
        zmq.close();
    }

    @Test
    void occupied_output_port_raises_the_fault_alert_and_the_loop_recovers_once_it_is_free() throws IOException {
        try (ServerSocket blocker = new ServerSocket(outputPort, 1, InetAddress.getByName("127.0.0.1"))) {
            forwarder.start();

            await(() -> forwarder.transportFaultCount() >= 2);
            assertThat(alerts.isActive(FAULT_KEY)).isTrue();
            assertThat(forwarder.isRunning()).isTrue();
        }

        await(() -> !alerts.isActive(FAULT_KEY));
        assertThat(forwarder.isRunning()).isTrue();

        // relaying works on the reopened sockets
        ZMQ.Socket sink = zmq.createSocket(SocketType.PULL);
        sink.setLinger(0);
        sink.setReceiveTimeOut(50);
        sink.connect("tcp://127.0.0.1:" + outputPort);
        long deadline = System.currentTimeMillis() + TIMEOUT_MS;
        ZMsg got = null;
        while (got == null) {
            if (System.currentTimeMillis() > deadline) fail("nothing relayed after recovery");
            ZMsg out = new ZMsg();
            out.addString("frame");
            out.send(sourcePub);
            got = ZMsg.recvMsg(sink);
        }
        assertThat(got.popString()).isEqualTo("frame");
        assertThat(forwarder.relayedCount()).isPositive();
    }

    @Test
    void stop_returns_within_a_few_poll_intervals() {
        forwarder.setPollTimeoutMs(100);
        forwarder.start();
        await(forwarder::isRunning);

        long t0 = System.nanoTime();
        forwarder.stop();
        long tookMs = (System.nanoTime() - t0) / 1_000_000;

        assertThat(tookMs).isLessThan(1_000);
        assertThat(forwarder.isRunning()).isFalse();
    }

    @Test
    void stop_interrupts_a_long_reconnect_backoff() throws IOException {
        forwarder.setReconnectBackoffMs(10_000);
        forwarder.setMaxReconnectBackoffMs(10_000);
        try (ServerSocket blocker = new ServerSocket(outputPort, 1, InetAddress.getByName("127.0.0.1"))) {
            forwarder.start();
            await(() -> forwarder.transportFaultCount() >= 1);

            long t0 = System.nanoTime();
            forwarder.stop();
            long tookMs = (System.nanoTime() - t0) / 1_000_000;

            assertThat(tookMs).isLessThan(1_000);
            assertThat(forwarder.isRunning()).isFalse();
        }
    }

    private static void await(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + TIMEOUT_MS;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) fail("condition not met within " + TIMEOUT_MS + " ms");
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
    }

    private static int freePort() throws IOException {
        try (ServerSocket s = new ServerSocket(0)) {
            return s.getLocalPort();
        }
    }
}
