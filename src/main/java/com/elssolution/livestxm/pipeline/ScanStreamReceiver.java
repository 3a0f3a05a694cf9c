package com.elssolution.livestxm.pipeline;

import com.elssolution.livestxm.alerts.AlertService;
import com.elssolution.livestxm.codec.MalformedMessageException;
import com.elssolution.livestxm.codec.MessageCodec;
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

/**
 * Assembler input: one PULL socket carrying both metadata and reduced frames from the
 * reducer, so a new scan is always seen before its first frame. Decoding happens here,
 * placement in {@link ScanAssembler}.
 */
@Slf4j
@Component
public class ScanStreamReceiver extends ZmqStage {

    @Value("${stxm.assembler.enabled:true}")
    @Getter @Setter private boolean enabled = true;
    @Value("${stxm.assembler.inputEndpoint:tcp://127.0.0.1:5556}")
    @Getter @Setter private String inputEndpoint;
    @Value("${stxm.assembler.highWaterMark:10000}")
    @Getter @Setter private int highWaterMark = 10_000;

    private final MessageCodec codec;
    private final ScanAssembler assembler;

    public ScanStreamReceiver(ZContext zmq, AlertService alerts, MessageCodec codec, ScanAssembler assembler) {
        super("assembler", zmq, alerts);
        this.codec = codec;
        this.assembler = assembler;
    }

    @Override
    protected void openSockets() {
        ZMQ.Socket in = openSocket(SocketType.PULL, "assembler-queue");
        in.setRcvHWM(highWaterMark);
        in.connect(inputEndpoint);
        pollInput(in);
        log.info("assembler pulling {}", inputEndpoint);
    }

    @Override
    protected void onMessage(int inputIndex, ZMsg msg) {
        try {
            String topic = codec.topicOf(msg);
            if (MessageCodec.TOPIC_METADATA.equals(topic)) {
                assembler.onMetadata(codec.decodeMetadata(msg));
            } else if (MessageCodec.TOPIC_REDUCED.equals(topic)) {
                assembler.onReducedFrame(codec.decodeReduced(msg));
            } else {
                throw new MalformedMessageException("unexpected topic on assembler queue: " + topic);
            }
        } finally {
            msg.destroy();
        }
    }
}
