package com.eventfullyengineered.jstreamlistener.notifications;

import io.reactivex.Observable;

/**
 * Handle for an active listen on a notification channel.
 * The handle becomes invalid when the connection it was made through goes down and needs no
 * release in that case. {@link #close()} stops the listen while the connection is still up.
 */
public interface NotificationSubscription extends AutoCloseable {

    String getTarget();

    String getChannel();

    /**
     * @return the notifications received on the channel, in arrival order
     */
    Observable<RawNotification> notifications();

    /**
     * Stop listening. Does nothing if the connection has gone down since, or if already closed.
     */
    @Override
    void close();
}
