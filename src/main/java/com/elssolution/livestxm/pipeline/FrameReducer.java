package com.elssolution.livestxm.pipeline;

import com.elssolution.livestxm.alerts.AlertService;
import com.elssolution.livestxm.codec.MalformedMessageException;
import com.elssolution.livestxm.codec.MessageCodec;
import com.elssolution.livestxm.domain.RawFrame;
import com.elssolution.livestxm.domain.ReducedFrame;
import com.elssolution.livestxm.domain.ScanMetadata;
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
 * Reducer stage.
 *
 * Inputs (metadata is registered first so that, when both are ready in one poll
 * round, a new scan is announced before its frames):
 *   0: SUB  source metadata
 *   1: PULL raw frames from the forwarder
 * Output:
 *   PUSH to the assembler, carrying "metadata" and "reduced" in arrival order.
 *
 * The reducer tracks the current scan: metadata without a scan id gets one, and
 * frames without seq/scan_id get the reducer's per-scan counter and id. Frames whose
 * shape contradicts the announced detector shape are dropped as malformed.
 */
@Slf4j
@Component
public class FrameReducer extends ZmqStage {

    private static final int INPUT_METADATA = 0;
    private static final int INPUT_FRAMES = 1;

    @Value("${stxm.reducer.enabled:true}")
    @Getter @Setter private boolean enabled = true;
    @Value("${stxm.source.metadataEndpoint:tcp://127.0.0.1:50001}")
    @Getter @Setter private String metadataEndpoint;
    @Value("${stxm.reducer.inputEndpoint:tcp://127.0.0.1:5555}")
    @Getter @Setter private String inputEndpoint;
    @Value("${stxm.reducer.outputEndpoint:tcp://127.0.0.1:5556}")
    @Getter @Setter private String outputEndpoint;
    @Value("${stxm.reducer.highWaterMark:10000}")
    @Getter @Setter private int highWaterMark = 10_000;

    private final MessageCodec codec;
    private final FrameReduction reduction;

    private ZMQ.Socket out;

    // ==== Scan tracking (loop thread only) ====
    private ScanMetadata current;
    private long nextSeq = 0;
    private long generatedIds = 0;

    // ==== Counters ====
    private final AtomicLong reduced = new AtomicLong();
    private final AtomicLong scans = new AtomicLong();
    private final AtomicLong shapeRejects = new AtomicLong();

    public FrameReducer(ZContext zmq, AlertService alerts, MessageCodec codec, FrameReduction reduction) {
        super("reducer", zmq, alerts);
        this.codec = codec;
        this.reduction = reduction;
    }

    @Override
    protected void openSockets() {
        ZMQ.Socket md = openSocket(SocketType.SUB, "source-metadata");
        md.connect(metadataEndpoint);
        md.subscribe(ZMQ.SUBSCRIPTION_ALL);

        ZMQ.Socket frames = openSocket(SocketType.PULL, "reducer-queue");
        frames.setRcvHWM(highWaterMark);
        frames.connect(inputEndpoint);

        out = openSocket(SocketType.PUSH, "assembler-queue");
        configureOutput(out, highWaterMark);
        out.bind(outputEndpoint);

        pollInput(md);      // INPUT_METADATA
        pollInput(frames);  // INPUT_FRAMES
        log.info("reducer pulling {} (metadata {}) → pushing {}", inputEndpoint, metadataEndpoint, outputEndpoint);
    }

    @Override
    protected void onMessage(int inputIndex, ZMsg msg) {
        try {
            if (inputIndex == INPUT_METADATA) onMetadata(codec.decodeMetadata(msg));
            else if (inputIndex == INPUT_FRAMES) onFrame(codec.decodeRawFrame(msg));
        } finally {
            msg.destroy();
        }
    }

    private void onMetadata(ScanMetadata md) {
        ScanMetadata stamped = beginScan(md);
        log.info("reducer_new_scan scan={} grid={}x{} → frame index reset to 0",
                stamped.getScanId(), stamped.rows(), stamped.cols());
        sendReliably(out, codec.encodeMetadata(stamped));
    }

    private void onFrame(RawFrame frame) {
        RawFrame identified = identify(frame);
        ReducedFrame r = reduction.reduce(identified);
        if (sendReliably(out, codec.encodeReduced(r))) {
            reduced.incrementAndGet();
        }
        if (log.isTraceEnabled()) {
            log.trace("reduced scan={} seq={} intensity={}", identified.scanId(), identified.seq(), r.getIntensity());
        }
    }

    /** Make {@code md} the current scan, assigning an id when it has none. */
    ScanMetadata beginScan(ScanMetadata md) {
        ScanMetadata stamped = md.getScanId() != null ? md : md.toBuilder().scanId(newScanId()).build();
        current = stamped;
        nextSeq = 0;
        scans.incrementAndGet();
        return stamped;
    }

    /**
     * Fill in seq and scan id for a frame. Untagged frames take the current scan's id
     * and counter; only frames of the current scan move that counter.
     */
    RawFrame identify(RawFrame frame) {
        boolean ofCurrent = frame.scanId() == null
                || (current != null && frame.scanId().equals(current.getScanId()));
        if (ofCurrent && current != null && current.getDetectorHeight() > 0 && current.getDetectorWidth() > 0
                && (frame.height() != current.getDetectorHeight() || frame.width() != current.getDetectorWidth())) {
            shapeRejects.incrementAndGet();
            throw new MalformedMessageException("frame " + frame.height() + "x" + frame.width()
                    + " does not match detector " + current.getDetectorHeight() + "x" + current.getDetectorWidth());
        }

        long seq = frame.seq() != RawFrame.NO_SEQ ? frame.seq() : nextSeq;
        String scanId = frame.scanId() != null ? frame.scanId() : (current != null ? current.getScanId() : null);
        if (scanId == null) {
            throw new MalformedMessageException("frame seq=" + seq + " arrived before any scan metadata");
        }
        if (ofCurrent) nextSeq = seq + 1;
        return frame.withIdentity(seq, scanId);
    }

    private String newScanId() {
        return "scan-" + System.currentTimeMillis() + "-" + (++generatedIds);
    }

    public long reducedCount()      { return reduced.get(); }
    public long scanCount()         { return scans.get(); }
    public long shapeRejectCount()  { return shapeRejects.get(); }
}
