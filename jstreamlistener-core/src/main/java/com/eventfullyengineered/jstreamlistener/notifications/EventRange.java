package com.eventfullyengineered.jstreamlistener.notifications;

import com.eventfullyengineered.jstreamlistener.infrastructure.Ensure;
import com.google.common.base.MoreObjects;

import java.util.Objects;

/**
 * Represents one contiguous append to a stream as announced by a single store notification.
 *
 * <p>Only the range is carried. Reading the messages themselves back from the store is left to the consumer.</p>
 */
public final class EventRange {

    /**
     * The identifier of the stream that was appended to. May contain commas.
     */
    private final String streamId;

    /**
     * The store's internal sequence number of the stream.
     */
    private final long streamSequence;

    /**
     * The version of the first message appended.
     */
    private final long firstVersion;

    /**
     * The version of the last message appended.
     */
    private final long lastVersion;

    /**
     * Constructs new {@link EventRange}
     * @param streamId The identifier of the stream that was appended to.
     * @param streamSequence The store's internal sequence number of the stream.
     * @param firstVersion The version of the first message appended.
     * @param lastVersion The version of the last message appended.
     */
    public EventRange(String streamId, long streamSequence, long firstVersion, long lastVersion) {
        this.streamId = Ensure.notNull(streamId, "streamId");
        this.streamSequence = streamSequence;
        this.firstVersion = firstVersion;
        this.lastVersion = lastVersion;
    }

    public String getStreamId() {
        return streamId;
    }

    public long getStreamSequence() {
        return streamSequence;
    }

    public long getFirstVersion() {
        return firstVersion;
    }

    public long getLastVersion() {
        return lastVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        EventRange that = (EventRange) o;
        return streamSequence == that.streamSequence
            && firstVersion == that.firstVersion
            && lastVersion == that.lastVersion
            && streamId.equals(that.streamId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamId, streamSequence, firstVersion, lastVersion);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("streamId", getStreamId())
            .add("streamSequence", getStreamSequence())
            .add("firstVersion", getFirstVersion())
            .add("lastVersion", getLastVersion())
            .toString();
    }
}
