package com.elssolution.livestxm.pipeline;

public enum AssemblerState {
    /** No metadata seen yet; frames have nowhere to go. */
    AWAITING_METADATA,
    /** Placing frames for the current scan. */
    ACTIVE,
    /** Nothing accepted for longer than the inactivity threshold. */
    STANDBY
}
