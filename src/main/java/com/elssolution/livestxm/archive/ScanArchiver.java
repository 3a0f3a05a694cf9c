package com.elssolution.livestxm.archive;

import com.elssolution.livestxm.domain.ScanMapSnapshot;
import com.elssolution.livestxm.domain.ScanMetadata;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/** Persists a finished (or partial) scan. Returns the common base path of the written files. */
public interface ScanArchiver {
    Path save(ScanMetadata metadata, ScanMapSnapshot map, BufferedImage image) throws IOException;
}
