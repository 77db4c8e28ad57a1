package com.eventfullyengineered.jstreamlistener.notifications;

/**
 * Thrown when a notification payload does not follow the
 * {@code <stream_id>,<stream_sequence>,<first_version>,<last_version>} format.
 */
public class MalformedNotificationException extends RuntimeException {

    private static final long serialVersionUID = -3571028374461295127L;

    private final String payload;

    public MalformedNotificationException(String payload, String reason) {
        super("Malformed notification payload '" + payload + "': " + reason);
        this.payload = payload;
    }

    public MalformedNotificationException(String payload, String reason, Throwable cause) {
        super("Malformed notification payload '" + payload + "': " + reason, cause);
        this.payload = payload;
    }

    public String getPayload() {
        return payload;
    }
}
