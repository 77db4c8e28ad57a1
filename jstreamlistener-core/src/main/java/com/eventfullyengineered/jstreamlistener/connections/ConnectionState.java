package com.eventfullyengineered.jstreamlistener.connections;

/**
 * Reachability of an upstream connection.
 */
public enum ConnectionState {

    /**
     * The connection is established and usable for subscriptions.
     */
    UP,

    /**
     * The connection has been lost. Any subscription made through it is gone with it.
     */
    DOWN
}
