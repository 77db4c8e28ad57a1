package com.eventfullyengineered.jstreamlistener.notifications;

import com.eventfullyengineered.jstreamlistener.infrastructure.Ensure;
import com.google.common.base.MoreObjects;

/**
 * An undecoded notification as delivered on a channel.
 */
public final class RawNotification {

    private final String channel;
    private final String payload;

    public RawNotification(String channel, String payload) {
        this.channel = Ensure.notNull(channel, "channel");
        this.payload = payload;
    }

    public String getChannel() {
        return channel;
    }

    public String getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("channel", channel)
            .add("payload", payload)
            .toString();
    }
}
