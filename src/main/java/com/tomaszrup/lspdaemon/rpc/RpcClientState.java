package com.tomaszrup.lspdaemon.rpc;

/**
 * Lifecycle of an {@link RpcClient}. Transitions only move forward.
 */
public enum RpcClientState {
    DISCONNECTED,
    CONNECTED,
    /** Handshake done; document notifications are allowed. */
    INITIALIZED,
    CLOSED
}
