package com.eventfullyengineered.jstreamlistener.postgres;

import com.eventfullyengineered.jstreamlistener.notifications.NotificationSubscription;
import com.eventfullyengineered.jstreamlistener.notifications.RawNotification;
import com.google.common.base.MoreObjects;
import io.reactivex.Observable;

import java.util.concurrent.atomic.AtomicBoolean;

class PostgresNotificationSubscription implements NotificationSubscription {

    private final String target;
    private final String channel;
    private final Observable<RawNotification> notifications;
    private final Runnable unlisten;
    private final AtomicBoolean closed = new AtomicBoolean();

    PostgresNotificationSubscription(String target,
                                     String channel,
                                     Observable<RawNotification> notifications,
                                     Runnable unlisten) {
        this.target = target;
        this.channel = channel;
        this.notifications = notifications.filter(notification -> channel.equals(notification.getChannel()));
        this.unlisten = unlisten;
    }

    @Override
    public String getTarget() {
        return target;
    }

    @Override
    public String getChannel() {
        return channel;
    }

    @Override
    public Observable<RawNotification> notifications() {
        return notifications;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            unlisten.run();
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("target", target)
            .add("channel", channel)
            .toString();
    }
}
