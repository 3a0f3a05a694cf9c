package com.elssolution.livestxm.pipeline.events;

import com.elssolution.livestxm.domain.ScanMapSnapshot;
import com.elssolution.livestxm.domain.ScanMetadata;

/** Every declared grid point of the scan has been placed. */
public record ScanCompletedEvent(ScanMetadata metadata, ScanMapSnapshot map) {}
