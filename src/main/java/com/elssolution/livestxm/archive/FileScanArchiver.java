package com.elssolution.livestxm.archive;

import com.elssolution.livestxm.codec.MessageCodec;
import com.elssolution.livestxm.domain.ScanMapSnapshot;
import com.elssolution.livestxm.domain.ScanMetadata;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Writes three files per scan into {@code stxm.archive.dir}:
 *   stxm_scan_<ts>_data.npy   the map as float64, row 0 = y-min
 *   stxm_scan_<ts>_meta.json  the scan metadata
 *   stxm_scan_<ts>_image.png  the rendered map
 * A second save within the same millisecond gets {@code _1}, {@code _2}, ... appended to
 * {@code <ts>} instead of replacing the first.
 */
@Slf4j
@Component
public class FileScanArchiver implements ScanArchiver {

    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    @Value("${stxm.archive.dir:saved_data}")
    @Getter @Setter private String dir = "saved_data";

    private final MessageCodec codec;
    private final Clock clock;

    public FileScanArchiver(MessageCodec codec, Clock clock) {
        this.codec = codec;
        this.clock = clock;
    }

    @Override
    public synchronized Path save(ScanMetadata metadata, ScanMapSnapshot map, BufferedImage image) throws IOException {
        Path root = Paths.get(dir);
        Files.createDirectories(root);
        String base = uniqueBase(root, "stxm_scan_" + TS.format(clock.instant().atZone(ZoneId.systemDefault())));
        Path basePath = root.resolve(base);

        Path npy = root.resolve(base + "_data.npy");
        try (OutputStream out = Files.newOutputStream(npy, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            NpyArrays.writeFloat64(out, map.getRows(), map.getCols(), map.flatValues());
        }
        Files.write(root.resolve(base + "_meta.json"), codec.metadataPrettyJson(metadata));

        Path png = root.resolve(base + "_image.png");
        if (!ImageIO.write(image, "png", png.toFile())) {
            throw new IOException("no PNG writer available for " + png);
        }

        log.info("scan_saved scan={} written={}/{} → {}_*", map.getScanId(), map.getWrittenCount(),
                map.getRows() * map.getCols(), basePath.toAbsolutePath());
        return basePath;
    }

    private static String uniqueBase(Path root, String stamp) {
        String base = stamp;
        for (int n = 1; Files.exists(root.resolve(base + "_data.npy")); n++) {
            base = stamp + "_" + n;
        }
        return base;
    }
}
