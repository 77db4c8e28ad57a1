package com.eventfullyengineered.jstreamlistener.notifications;

import com.eventfullyengineered.jstreamlistener.infrastructure.Ensure;
import org.apache.commons.lang3.StringUtils;

/**
 * Converts between {@link EventRange} and the text payload carried by a store notification.
 *
 * <p>The payload has the form {@code <stream_id>,<stream_sequence>,<first_version>,<last_version>}.
 * The stream id is not comma safe so the three numeric fields are taken from the right.</p>
 */
public final class NotificationPayloads {

    private static final String SEPARATOR = ",";
    private static final int NUMERIC_FIELDS = 3;

    private NotificationPayloads() {
        // statics only
    }

    /**
     * Decode a notification payload.
     * @param payload the raw payload e.g. {@code stream-12345,1,1,5}
     * @return the range announced by the payload
     * @throws MalformedNotificationException if there are fewer than four fields or a numeric field is not an integer
     */
    public static EventRange decode(String payload) {
        if (payload == null) {
            throw new MalformedNotificationException(null, "payload is null");
        }

        int streamIdEnd = StringUtils.lastOrdinalIndexOf(payload, SEPARATOR, NUMERIC_FIELDS);
        if (streamIdEnd < 0) {
            throw new MalformedNotificationException(payload, "expected at least 4 comma separated fields");
        }

        String streamId = payload.substring(0, streamIdEnd);
        String[] fields = StringUtils.splitPreserveAllTokens(payload.substring(streamIdEnd + 1), SEPARATOR);

        long streamSequence = parseField(payload, fields[0], "stream_sequence");
        long firstVersion = parseField(payload, fields[1], "first_version");
        long lastVersion = parseField(payload, fields[2], "last_version");

        return new EventRange(streamId, streamSequence, firstVersion, lastVersion);
    }

    /**
     * Encode a range the way the store's append trigger does.
     * @param range the range to encode
     * @return the payload text
     */
    public static String encode(EventRange range) {
        Ensure.notNull(range, "range");
        return range.getStreamId() + SEPARATOR
            + range.getStreamSequence() + SEPARATOR
            + range.getFirstVersion() + SEPARATOR
            + range.getLastVersion();
    }

    private static long parseField(String payload, String field, String fieldName) {
        try {
            return Long.parseLong(field);
        } catch (NumberFormatException ex) {
            throw new MalformedNotificationException(payload, fieldName + " is not an integer", ex);
        }
    }
}
