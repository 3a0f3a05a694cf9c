package com.elssolution.livestxm.web;

import com.elssolution.livestxm.archive.ScanArchiveService;
import com.elssolution.livestxm.codec.MessageCodec;
import com.elssolution.livestxm.display.LiveViewState;
import com.elssolution.livestxm.display.MapImageRenderer;
import com.elssolution.livestxm.domain.PixelProbe;
import com.elssolution.livestxm.domain.ReducedFrame;
import com.elssolution.livestxm.domain.ScanMapSnapshot;
import com.elssolution.livestxm.domain.ScanMetadata;
import com.elssolution.livestxm.pipeline.ScanAssembler;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import javax.imageio.ImageIO;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Read-only view of the live scan, plus the manual save action. */
@Slf4j
@RestController
@RequestMapping("/scan")
public class ScanController {

    private final ScanAssembler assembler;
    private final LiveViewState view;
    private final MapImageRenderer renderer;
    private final ScanArchiveService archive;
    private final MessageCodec codec;

    public ScanController(ScanAssembler assembler, LiveViewState view, MapImageRenderer renderer,
                          ScanArchiveService archive, MessageCodec codec) {
        this.assembler = assembler;
        this.view = view;
        this.renderer = renderer;
        this.archive = archive;
        this.codec = codec;
    }

    @GetMapping("/metadata")
    public ResponseEntity<ObjectNode> metadata() {
        return assembler.activeMetadata()
                .map(md -> ResponseEntity.ok(codec.metadataJson(md)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/map")
    public ResponseEntity<ScanMapSnapshot> map() {
        return ResponseEntity.of(assembler.snapshot());
    }

    @GetMapping(value = "/map.png", produces = MediaType.IMAGE_PNG_VALUE)
    public ResponseEntity<byte[]> mapPng() throws IOException {
        Optional<ScanMapSnapshot> map = assembler.snapshot();
        if (map.isEmpty()) return ResponseEntity.noContent().build();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(renderer.render(map.get()), "png", out);
        return ResponseEntity.ok().contentType(MediaType.IMAGE_PNG).body(out.toByteArray());
    }

    /** Last frame the display tick picked up. */
    @GetMapping("/frame")
    public ResponseEntity<ReducedFrame> frame() {
        return ResponseEntity.of(view.frame());
    }

    @GetMapping("/probe")
    public PixelProbe probe(@RequestParam int row, @RequestParam int col) {
        ScanMetadata md = assembler.activeMetadata()
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "no scan yet"));
        ScanMapSnapshot map = assembler.snapshot()
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "no scan yet"));
        if (!Objects.equals(md.getScanId(), map.getScanId())) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "scan changed, retry");
        }
        try {
            return PixelProbe.of(md, map, row, col);
        } catch (IndexOutOfBoundsException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    @PostMapping("/save")
    public ResponseEntity<Map<String, String>> save() {
        try {
            Optional<Path> saved = archive.saveCurrent();
            return saved
                    .map(p -> ResponseEntity.ok(Map.of("path", p.toAbsolutePath().toString())))
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "no scan to save")));
        } catch (IOException e) {
            log.warn("manual_save_failed: {}", e.toString());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
        }
    }
}
