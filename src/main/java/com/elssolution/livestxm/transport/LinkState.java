package com.elssolution.livestxm.transport;

/** Connection status of one socket, as reported by its ZeroMQ monitor. */
public enum LinkState {
    CONNECTING,
    UP,
    DOWN
}
