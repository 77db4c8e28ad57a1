package com.eventfullyengineered.jstreamlistener.connections;

import io.reactivex.Observable;

/**
 * Reports liveness transitions of a named upstream connection.
 */
public interface ConnectionMonitor {

    /**
     * Observe the liveness of {@code target}.
     * If the connection is already up when subscribing an {@link ConnectionState#UP} event is emitted first.
     * @param target name of the connection to monitor
     * @return the UP/DOWN transitions of the connection
     */
    Observable<ConnectionEvent> monitor(String target);
}
