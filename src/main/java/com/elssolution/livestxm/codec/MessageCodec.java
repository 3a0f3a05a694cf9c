package com.elssolution.livestxm.codec;

import com.elssolution.livestxm.domain.DownsampledImage;
import com.elssolution.livestxm.domain.PixelType;
import com.elssolution.livestxm.domain.RawFrame;
import com.elssolution.livestxm.domain.ReducedFrame;
import com.elssolution.livestxm.domain.ScanMetadata;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import org.zeromq.ZFrame;
import org.zeromq.ZMsg;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Multipart wire format shared by every hop:
 *
 *   metadata : [ "metadata", json ]
 *   frame    : [ "frame",    json{dtype, shape, seq, scan_id}, pixels ]
 *   reduced  : [ "reduced",  json{seq, scan_id, intensity, dtype, shape}, pixels ]
 *
 * Untagged forms from the Python source ([json] for metadata, [json, pixels] for
 * frames) are accepted on decode. Pixel payloads are little-endian.
 */
@Component
public class MessageCodec {

    public static final String TOPIC_METADATA = "metadata";
    public static final String TOPIC_FRAME = "frame";
    public static final String TOPIC_REDUCED = "reduced";

    /** Refuse grids that would make the assembler allocate absurd maps. */
    static final long MAX_GRID_POINTS = 16_000_000L;

    private final ObjectMapper objectMapper = new ObjectMapper();

    // ---------------------- topic ----------------------

    /**
     * Topic of a message. Untagged JSON-first messages report {@code null}; the
     * caller knows from the socket which kind they are.
     */
    public String topicOf(ZMsg msg) {
        if (msg == null || msg.isEmpty()) {
            throw new MalformedMessageException("empty message");
        }
        String first = msg.peekFirst().getString(StandardCharsets.UTF_8);
        return switch (first) {
            case TOPIC_METADATA, TOPIC_FRAME, TOPIC_REDUCED -> first;
            default -> null;
        };
    }

    // ---------------------- metadata ----------------------

    public ZMsg encodeMetadata(ScanMetadata md) {
        ZMsg msg = new ZMsg();
        msg.addString(TOPIC_METADATA);
        msg.add(toBytes(metadataJson(md)));
        return msg;
    }

    public ScanMetadata decodeMetadata(ZMsg msg) {
        List<ZFrame> parts = body(msg, TOPIC_METADATA, 1);
        JsonNode n = readJson(parts.get(0));

        int xNum = requiredInt(n, "x_num");
        int yNum = requiredInt(n, "y_num");
        if (xNum <= 0 || yNum <= 0) {
            throw new MalformedMessageException("grid must be non-empty: x_num=" + xNum + " y_num=" + yNum);
        }
        if ((long) xNum * yNum > MAX_GRID_POINTS) {
            throw new MalformedMessageException("grid too large: " + xNum + "x" + yNum);
        }
        double xStart = requiredDouble(n, "x_start");
        double xStop = requiredDouble(n, "x_stop");
        double yStart = requiredDouble(n, "y_start");
        double yStop = requiredDouble(n, "y_stop");

        int detH = 0;
        int detW = 0;
        JsonNode shape = n.path("detector_shape");
        if (shape.isArray() && shape.size() == 2) {
            detH = shape.get(0).asInt();
            detW = shape.get(1).asInt();
        }

        String scanId = n.hasNonNull("scan_id") ? n.get("scan_id").asText() : null;

        return ScanMetadata.builder()
                .scanId(scanId == null || scanId.isBlank() ? null : scanId)
                .xStart(xStart).xStop(xStop).xNum(xNum)
                .xStep(n.hasNonNull("x_step") ? n.get("x_step").asDouble() : ScanMetadata.derivedStep(xStart, xStop, xNum))
                .yStart(yStart).yStop(yStop).yNum(yNum)
                .yStep(n.hasNonNull("y_step") ? n.get("y_step").asDouble() : ScanMetadata.derivedStep(yStart, yStop, yNum))
                .exposureTimeS(n.path("exposure_time_s").asDouble(0.0))
                .detectorHeight(detH)
                .detectorWidth(detW)
                .build();
    }

    /** Snake_case document, also used for the archived metadata file. */
    public ObjectNode metadataJson(ScanMetadata md) {
        ObjectNode n = objectMapper.createObjectNode();
        if (md.getScanId() != null) n.put("scan_id", md.getScanId());
        n.put("x_start", md.getXStart());
        n.put("x_stop", md.getXStop());
        n.put("x_num", md.getXNum());
        n.put("x_step", md.getXStep());
        n.put("y_start", md.getYStart());
        n.put("y_stop", md.getYStop());
        n.put("y_num", md.getYNum());
        n.put("y_step", md.getYStep());
        n.put("exposure_time_s", md.getExposureTimeS());
        n.putArray("detector_shape").add(md.getDetectorHeight()).add(md.getDetectorWidth());
        n.put("total_points", md.totalPoints());
        n.put("invert_x", md.invertX());
        n.put("invert_y", md.invertY());
        return n;
    }

    public byte[] metadataPrettyJson(ScanMetadata md) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(metadataJson(md));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("metadata serialization failed", e);
        }
    }

    // ---------------------- raw frames ----------------------

    public ZMsg encodeRawFrame(RawFrame f) {
        ObjectNode h = objectMapper.createObjectNode();
        h.put("dtype", f.type().dtype());
        h.putArray("shape").add(f.height()).add(f.width());
        if (f.seq() != RawFrame.NO_SEQ) h.put("seq", f.seq());
        if (f.scanId() != null) h.put("scan_id", f.scanId());

        ByteBuffer px = f.pixels();
        byte[] payload = new byte[px.remaining()];
        px.get(payload);

        ZMsg msg = new ZMsg();
        msg.addString(TOPIC_FRAME);
        msg.add(toBytes(h));
        msg.add(payload);
        return msg;
    }

    public RawFrame decodeRawFrame(ZMsg msg) {
        List<ZFrame> parts = body(msg, TOPIC_FRAME, 2);
        JsonNode h = readJson(parts.get(0));
        PixelType type;
        try {
            type = PixelType.fromDtype(h.path("dtype").asText(null));
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException(e.getMessage(), e);
        }
        int[] shape = shape2d(h);
        long seq = h.hasNonNull("seq") ? h.get("seq").asLong() : RawFrame.NO_SEQ;
        String scanId = h.hasNonNull("scan_id") ? h.get("scan_id").asText() : null;
        try {
            return new RawFrame(type, shape[0], shape[1], ByteBuffer.wrap(parts.get(1).getData()), seq, scanId);
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException(e.getMessage(), e);
        }
    }

    // ---------------------- reduced frames ----------------------

    public ZMsg encodeReduced(ReducedFrame r) {
        DownsampledImage img = r.getImage();
        ObjectNode h = objectMapper.createObjectNode();
        h.put("seq", r.getSeq());
        h.put("scan_id", r.getScanId());
        h.put("intensity", r.getIntensity());
        h.put("dtype", PixelType.FLOAT32.dtype());
        h.putArray("shape").add(img.getHeight()).add(img.getWidth());

        ByteBuffer buf = ByteBuffer.allocate(img.getPixels().length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buf.asFloatBuffer().put(img.getPixels());

        ZMsg msg = new ZMsg();
        msg.addString(TOPIC_REDUCED);
        msg.add(toBytes(h));
        msg.add(buf.array());
        return msg;
    }

    public ReducedFrame decodeReduced(ZMsg msg) {
        List<ZFrame> parts = body(msg, TOPIC_REDUCED, 2);
        JsonNode h = readJson(parts.get(0));
        if (!h.hasNonNull("scan_id") || !h.hasNonNull("seq") || !h.hasNonNull("intensity")) {
            throw new MalformedMessageException("reduced header needs scan_id, seq and intensity: " + h);
        }
        int[] shape = shape2d(h);
        byte[] payload = parts.get(1).getData();
        long expected = (long) shape[0] * shape[1] * Float.BYTES;
        if (payload.length != expected) {
            throw new MalformedMessageException("reduced payload is " + payload.length + " bytes, expected " + expected);
        }
        float[] px = new float[shape[0] * shape[1]];
        ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer().get(px);
        return new ReducedFrame(h.get("scan_id").asText(), h.get("seq").asLong(),
                h.get("intensity").asDouble(), new DownsampledImage(shape[0], shape[1], px));
    }

    // ---------------------- helpers ----------------------

    /** Parts after the topic tag (if any); at least {@code minParts} of them. */
    private List<ZFrame> body(ZMsg msg, String expectedTopic, int minParts) {
        String topic = topicOf(msg);
        if (topic != null && !topic.equals(expectedTopic)) {
            throw new MalformedMessageException("expected " + expectedTopic + " but got " + topic);
        }
        List<ZFrame> parts = new ArrayList<>(msg);
        if (topic != null) parts.remove(0);
        if (parts.size() < minParts) {
            throw new MalformedMessageException(expectedTopic + " needs " + minParts + " parts, got " + parts.size());
        }
        return parts;
    }

    private JsonNode readJson(ZFrame part) {
        try {
            JsonNode n = objectMapper.readTree(part.getData());
            if (n == null || !n.isObject()) {
                throw new MalformedMessageException("header is not a JSON object");
            }
            return n;
        } catch (IOException e) {
            throw new MalformedMessageException("header is not valid JSON: " + e.getMessage(), e);
        }
    }

    private byte[] toBytes(JsonNode n) {
        try {
            return objectMapper.writeValueAsBytes(n);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("header serialization failed", e);
        }
    }

    private static int[] shape2d(JsonNode h) {
        JsonNode s = h.path("shape");
        if (!s.isArray() || s.size() != 2 || !s.get(0).canConvertToInt() || !s.get(1).canConvertToInt()) {
            throw new MalformedMessageException("shape must be [height, width]: " + s);
        }
        int height = s.get(0).asInt();
        int width = s.get(1).asInt();
        if (height <= 0 || width <= 0) {
            throw new MalformedMessageException("shape must be positive: " + s);
        }
        return new int[] {height, width};
    }

    private static int requiredInt(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || !v.isNumber() || !v.canConvertToInt()) {
            throw new MalformedMessageException("metadata field '" + field + "' missing or not an integer");
        }
        return v.asInt();
    }

    private static double requiredDouble(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || !v.isNumber() || !Double.isFinite(v.asDouble())) {
            throw new MalformedMessageException("metadata field '" + field + "' missing or not a number");
        }
        return v.asDouble();
    }
}
