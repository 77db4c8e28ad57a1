package com.eventfullyengineered.jstreamlistener.listener;

public enum ListenerState {

    /**
     * No active listen. Incoming notifications are discarded.
     */
    DISCONNECTED,

    /**
     * Listening on the events channel. Notifications are decoded and queued.
     */
    SUBSCRIBED
}
