package com.eventfullyengineered.jstreamlistener.notifications;

/**
 * Issues listens on notification channels of a connection.
 */
@FunctionalInterface
public interface NotificationSource {

    /**
     * Start listening on {@code channel} through the connection named {@code target}.
     * @param target the connection to listen through
     * @param channel the channel name
     * @return the handle of the new listen
     * @throws SubscriptionFailedException if the listen could not be issued
     */
    NotificationSubscription listen(String target, String channel);
}
