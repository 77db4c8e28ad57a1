package com.eventfullyengineered.jstreamlistener.listener;

import com.eventfullyengineered.jstreamlistener.infrastructure.Ensure;
import com.eventfullyengineered.jstreamlistener.notifications.EventRange;
import com.eventfullyengineered.jstreamlistener.notifications.NotificationPayloads;
import com.eventfullyengineered.jstreamlistener.notifications.NotificationSource;
import com.eventfullyengineered.jstreamlistener.notifications.NotificationSubscription;
import com.eventfullyengineered.jstreamlistener.notifications.RawNotification;
import com.google.common.base.MoreObjects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * Connection aware state machine that turns store notifications into {@link EventRange}s and releases them
 * in arrival order, never more than the consumer has asked for.
 *
 * <p>Each handler runs to completion and returns the batch to emit. Callers must invoke the handlers
 * from one thread at a time; {@link NotificationListener} does so from a single scheduler worker.</p>
 */
public class EventRangeDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(EventRangeDispatcher.class);

    private static final String CHANNEL_SUFFIX = ".events";

    private final String listenTo;
    private final String channel;
    private final NotificationSource notificationSource;
    private final PendingQueue pending = new PendingQueue();

    private NotificationSubscription subscription;

    public EventRangeDispatcher(String listenTo, String schema, NotificationSource notificationSource) {
        this.listenTo = Ensure.notNullOrEmpty(listenTo, "listenTo");
        this.channel = channelName(schema);
        this.notificationSource = Ensure.notNull(notificationSource, "notificationSource");
    }

    /**
     * @param schema the store schema
     * @return the channel the store notifies appends on for {@code schema}
     */
    public static String channelName(String schema) {
        return Ensure.notNullOrEmpty(schema, "schema") + CHANNEL_SUFFIX;
    }

    /**
     * Listen on the events channel. Any previous subscription is closed and replaced so that at most one is held.
     * Queued ranges and demand are left untouched.
     * @return the new subscription
     * @throws com.eventfullyengineered.jstreamlistener.notifications.SubscriptionFailedException if the listen fails
     */
    public NotificationSubscription connectionUp() {
        if (subscription != null) {
            LOG.info("Connection {} reported up while already listening on {}. Listening again.", listenTo, channel);
            release();
        }
        subscription = Ensure.notNull(notificationSource.listen(listenTo, channel), "subscription");
        LOG.info("Listening for notifications on channel {} through {}", channel, listenTo);
        return subscription;
    }

    /**
     * Forget the subscription. The connection going down has already invalidated it.
     */
    public void connectionDown() {
        if (subscription != null) {
            LOG.info("Connection {} down. Stopped listening on channel {}", listenTo, channel);
        }
        subscription = null;
    }

    /**
     * Close and forget the subscription, if any. Used when the listener stops while the connection may still be up.
     */
    public void release() {
        NotificationSubscription released = subscription;
        subscription = null;
        if (released != null) {
            released.close();
        }
    }

    /**
     * Decode and queue a notification, then release what current demand allows.
     * Notifications arriving while disconnected are discarded.
     * @param notification the raw notification
     * @return ranges to emit, possibly empty
     * @throws com.eventfullyengineered.jstreamlistener.notifications.MalformedNotificationException if the payload cannot be decoded
     */
    public List<EventRange> notificationReceived(RawNotification notification) {
        if (subscription == null) {
            LOG.trace("Ignoring notification {} while disconnected", notification);
            return Collections.emptyList();
        }

        LOG.debug("Listener received notification on channel {} with payload: {}",
            notification.getChannel(), notification.getPayload());

        pending.enqueue(NotificationPayloads.decode(notification.getPayload()));
        return pending.drain();
    }

    /**
     * Record consumer demand, then release what it allows.
     * @param n number of further ranges requested, positive
     * @return ranges to emit, possibly empty
     */
    public List<EventRange> demandReceived(long n) {
        pending.addDemand(n);
        return pending.drain();
    }

    public ListenerState getState() {
        return subscription == null ? ListenerState.DISCONNECTED : ListenerState.SUBSCRIBED;
    }

    public String getListenTo() {
        return listenTo;
    }

    public String getChannel() {
        return channel;
    }

    public NotificationSubscription getSubscription() {
        return subscription;
    }

    public long getDemand() {
        return pending.getDemand();
    }

    public int getPendingCount() {
        return pending.size();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("listenTo", listenTo)
            .add("channel", channel)
            .add("state", getState())
            .add("pending", pending)
            .toString();
    }
}
