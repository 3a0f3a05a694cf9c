package com.elssolution.livestxm.display;

/** Receives render ticks. Called on the scheduler thread; must not block. */
public interface DisplaySink {
    void render(DisplayUpdate update);
}
