package com.elssolution.livestxm.pipeline.events;

public record StandbyChangedEvent(boolean standby, long idleMs) {}
