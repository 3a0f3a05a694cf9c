package com.elssolution.livestxm.alerts;

/** A socket stage's loop thread died from an uncaught throwable. */
public record StageCrashedEvent(String stageName, Throwable cause) {}
