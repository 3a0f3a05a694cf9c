package com.elssolution.livestxm.pipeline.events;

import com.elssolution.livestxm.domain.ScanMetadata;

/** New metadata accepted; {@code epoch} counts every metadata arrival since start. */
public record ScanStartedEvent(ScanMetadata metadata, long epoch) {}
