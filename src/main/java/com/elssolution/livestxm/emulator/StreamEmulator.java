package com.elssolution.livestxm.emulator;

import com.elssolution.livestxm.codec.MessageCodec;
import com.elssolution.livestxm.domain.PixelType;
import com.elssolution.livestxm.domain.RawFrame;
import com.elssolution.livestxm.domain.ScanMetadata;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.zeromq.SocketType;
import org.zeromq.ZContext;
import org.zeromq.ZMQ;
import org.zeromq.ZMQException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stand-in for the beamline: publishes random scans on the two source endpoints.
 * Each scan has 10..19 steps per axis in a random direction, one float32 detector
 * frame per point paced by the exposure time, and a pause before the next scan.
 * Frames carry no seq or scan id, like the real source.
 */
@Slf4j
@Component
public class StreamEmulator {

    @Value("${stxm.emulator.enabled:false}")
    @Getter @Setter private boolean enabled = false;
    @Value("${stxm.emulator.metadataEndpoint:tcp://127.0.0.1:50001}")
    @Getter @Setter private String metadataEndpoint;
    @Value("${stxm.emulator.dataEndpoint:tcp://127.0.0.1:50002}")
    @Getter @Setter private String dataEndpoint;
    @Value("${stxm.emulator.detectorHeight:200}")
    @Getter @Setter private int detectorHeight = 200;
    @Value("${stxm.emulator.detectorWidth:200}")
    @Getter @Setter private int detectorWidth = 200;
    @Value("${stxm.emulator.minSteps:10}")
    @Getter @Setter private int minSteps = 10;
    @Value("${stxm.emulator.maxSteps:20}")
    @Getter @Setter private int maxSteps = 20;
    @Value("${stxm.emulator.maxExposureS:0.005}")
    @Getter @Setter private double maxExposureS = 0.005;
    @Value("${stxm.emulator.pauseBetweenScansMs:5000}")
    @Getter @Setter private long pauseBetweenScansMs = 5000;
    @Value("${stxm.emulator.subscriberWarmupMs:1000}")
    @Getter @Setter private long subscriberWarmupMs = 1000;

    private static final double MIN_EXPOSURE_S = 1e-3;

    private final ZContext zmq;
    private final MessageCodec codec;
    private final Random random = new Random();

    private volatile boolean stopping;
    private ExecutorService exec;
    private final AtomicLong scans = new AtomicLong();
    private final AtomicLong frames = new AtomicLong();

    public StreamEmulator(ZContext zmq, MessageCodec codec) {
        this.zmq = zmq;
        this.codec = codec;
    }

    @PostConstruct
    void startIfEnabled() {
        if (enabled) start();
        else log.info("emulator disabled");
    }

    public synchronized void start() {
        if (exec != null) return;
        stopping = false;
        exec = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "stxm-emulator");
            t.setDaemon(true);
            return t;
        });
        exec.execute(this::run);
    }

    @PreDestroy
    public synchronized void stop() {
        stopping = true;
        if (exec == null) return;
        exec.shutdownNow();
        try {
            if (!exec.awaitTermination(2, TimeUnit.SECONDS)) log.warn("emulator thread did not stop in time");
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        exec = null;
    }

    private void run() {
        ZMQ.Socket md = zmq.createSocket(SocketType.PUB);
        ZMQ.Socket data = zmq.createSocket(SocketType.PUB);
        try {
            md.setLinger(0);
            data.setLinger(0);
            md.bind(metadataEndpoint);
            data.bind(dataEndpoint);
            log.info("emulator publishing metadata on {} and frames on {}", metadataEndpoint, dataEndpoint);
            pause(subscriberWarmupMs);

            while (!stopping) {
                publishScan(md, data, nextScan());
                pause(pauseBetweenScansMs);
            }
        } catch (ZMQException e) {
            if (!stopping) log.warn("emulator stopped on transport error: {}", e.toString());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } finally {
            zmq.destroySocket(md);
            zmq.destroySocket(data);
            log.info("emulator stopped after {} scans / {} frames", scans.get(), frames.get());
        }
    }

    private void publishScan(ZMQ.Socket md, ZMQ.Socket data, ScanMetadata scan) throws InterruptedException {
        codec.encodeMetadata(scan).send(md);
        scans.incrementAndGet();
        log.info("emulator_scan grid={}x{} x=[{} → {}] y=[{} → {}] exposure={}s",
                scan.getYNum(), scan.getXNum(), fmt(scan.getXStart()), fmt(scan.getXStop()),
                fmt(scan.getYStart()), fmt(scan.getYStop()), fmt(scan.getExposureTimeS()));

        long exposureNs = (long) (scan.getExposureTimeS() * 1e9);
        for (int i = 0; i < scan.totalPoints() && !stopping; i++) {
            long t0 = System.nanoTime();
            codec.encodeRawFrame(randomFrame()).send(data);
            frames.incrementAndGet();
            long left = exposureNs - (System.nanoTime() - t0);
            if (left > 0) TimeUnit.NANOSECONDS.sleep(left);
        }
    }

    ScanMetadata nextScan() {
        double[] x = axis();
        double[] y = axis();
        return ScanMetadata.builder()
                .xStart(x[0]).xStop(x[1]).xNum((int) x[2])
                .xStep(ScanMetadata.derivedStep(x[0], x[1], (int) x[2]))
                .yStart(y[0]).yStop(y[1]).yNum((int) y[2])
                .yStep(ScanMetadata.derivedStep(y[0], y[1], (int) y[2]))
                .exposureTimeS(Math.max(MIN_EXPOSURE_S, random.nextDouble() * maxExposureS))
                .detectorHeight(detectorHeight)
                .detectorWidth(detectorWidth)
                .build();
    }

    /** {start, stop, num}; the axis may run in either direction. */
    private double[] axis() {
        double start = random.nextDouble();
        double step = random.nextDouble();
        int num = minSteps + random.nextInt(Math.max(1, maxSteps - minSteps));
        int direction = random.nextBoolean() ? 1 : -1;
        return new double[] {start, start + step * direction * num, num};
    }

    private RawFrame randomFrame() {
        int n = detectorHeight * detectorWidth;
        ByteBuffer buf = ByteBuffer.allocate(n * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < n; i++) buf.putFloat(random.nextFloat());
        buf.flip();
        return new RawFrame(PixelType.FLOAT32, detectorHeight, detectorWidth, buf, RawFrame.NO_SEQ, null);
    }

    private static void pause(long ms) throws InterruptedException {
        if (ms > 0) Thread.sleep(ms);
    }

    private static String fmt(double v) {
        return String.format("%.3f", v);
    }
}
