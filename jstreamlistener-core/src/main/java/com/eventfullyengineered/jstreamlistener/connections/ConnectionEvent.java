package com.eventfullyengineered.jstreamlistener.connections;

import com.eventfullyengineered.jstreamlistener.infrastructure.Ensure;
import com.google.common.base.MoreObjects;

import java.util.Objects;

/**
 * A liveness transition reported by a {@link ConnectionMonitor} for a named connection.
 */
public final class ConnectionEvent {

    private final String target;
    private final ConnectionState state;

    public ConnectionEvent(String target, ConnectionState state) {
        this.target = Ensure.notNullOrEmpty(target, "target");
        this.state = Ensure.notNull(state, "state");
    }

    public static ConnectionEvent up(String target) {
        return new ConnectionEvent(target, ConnectionState.UP);
    }

    public static ConnectionEvent down(String target) {
        return new ConnectionEvent(target, ConnectionState.DOWN);
    }

    public String getTarget() {
        return target;
    }

    public ConnectionState getState() {
        return state;
    }

    public boolean isUp() {
        return state == ConnectionState.UP;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ConnectionEvent that = (ConnectionEvent) o;
        return target.equals(that.target) && state == that.state;
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, state);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("target", target)
            .add("state", state)
            .toString();
    }
}
