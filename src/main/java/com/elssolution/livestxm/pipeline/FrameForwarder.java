package com.elssolution.livestxm.pipeline;

import com.elssolution.livestxm.alerts.AlertService;
import com.elssolution.livestxm.transport.ZmqStage;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.zeromq.SocketType;
import org.zeromq.ZContext;
import org.zeromq.ZMQ;
import org.zeromq.ZMsg;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Relays the source's raw data stream (SUB) onto the reducer queue (PUSH), untouched
 * and in order. Its only job is to keep the inbound subscription drained while the
 * reducer is busy; buffering beyond that is the transport's high-water marks.
 */
@Slf4j
@Component
public class FrameForwarder extends ZmqStage {

    @Value("${stxm.forwarder.enabled:true}")
    @Getter @Setter private boolean enabled = true;
    @Value("${stxm.source.dataEndpoint:tcp://127.0.0.1:50002}")
    @Getter @Setter private String sourceEndpoint;
    @Value("${stxm.forwarder.outputEndpoint:tcp://127.0.0.1:5555}")
    @Getter @Setter private String outputEndpoint;
    @Value("${stxm.forwarder.highWaterMark:10000}")
    @Getter @Setter private int highWaterMark = 10_000;

    private final AtomicLong relayed = new AtomicLong();
    private ZMQ.Socket out;

    public FrameForwarder(ZContext zmq, AlertService alerts) {
        super("forwarder", zmq, alerts);
    }

    @Override
    protected void openSockets() {
        ZMQ.Socket in = openSocket(SocketType.SUB, "source-data");
        in.setRcvHWM(highWaterMark);
        in.connect(sourceEndpoint);
        in.subscribe(ZMQ.SUBSCRIPTION_ALL);

        out = openSocket(SocketType.PUSH, "reducer-queue");
        configureOutput(out, highWaterMark);
        out.bind(outputEndpoint);

        pollInput(in);
        log.info("forwarder relaying {} → {}", sourceEndpoint, outputEndpoint);
    }

    @Override
    protected void onMessage(int inputIndex, ZMsg msg) {
        if (sendReliably(out, msg)) {
            long n = relayed.incrementAndGet();
            if (log.isTraceEnabled()) log.trace("relayed #{} ({} parts)", n, msg.size());
        }
        msg.destroy();
    }

    public long relayedCount() {
        return relayed.get();
    }
}
