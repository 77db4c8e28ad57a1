package com.eventfullyengineered.jstreamlistener.notifications;

/**
 * Thrown when listening on a notification channel fails even though its connection was reported up.
 */
public class SubscriptionFailedException extends RuntimeException {

    private static final long serialVersionUID = 8815402710533317350L;

    public SubscriptionFailedException(String target, String channel, Throwable cause) {
        super("Could not listen on channel " + channel + " through " + target, cause);
    }
}
