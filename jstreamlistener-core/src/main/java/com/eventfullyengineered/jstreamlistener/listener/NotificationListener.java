package com.eventfullyengineered.jstreamlistener.listener;

import com.eventfullyengineered.jstreamlistener.connections.ConnectionEvent;
import com.eventfullyengineered.jstreamlistener.connections.ConnectionMonitor;
import com.eventfullyengineered.jstreamlistener.infrastructure.Ensure;
import com.eventfullyengineered.jstreamlistener.notifications.EventRange;
import com.eventfullyengineered.jstreamlistener.notifications.NotificationSource;
import com.eventfullyengineered.jstreamlistener.notifications.NotificationSubscription;
import com.eventfullyengineered.jstreamlistener.notifications.RawNotification;
import io.reactivex.Flowable;
import io.reactivex.Scheduler;
import io.reactivex.disposables.CompositeDisposable;
import io.reactivex.disposables.Disposables;
import io.reactivex.disposables.SerialDisposable;
import io.reactivex.exceptions.Exceptions;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Publishes the {@link EventRange}s announced by store notifications, paced by subscriber demand.
 *
 * <p>The listener monitors the connection named in its settings and listens on the {@code <schema>.events}
 * channel each time the connection comes up. Connection transitions, notifications and requests are all
 * handled one at a time on a single worker of the configured {@link Scheduler}, so ranges are emitted in
 * exactly the order their notifications arrived.</p>
 *
 * <p>Ranges queued while the connection is down are kept and delivered once demand allows.
 * A malformed payload or a failed listen terminates the listener with {@code onError}; anything still
 * queued at that point is lost.</p>
 *
 * <p>A listener accepts a single subscriber.</p>
 */
public class NotificationListener extends Flowable<EventRange> {

    private static final Logger LOG = LoggerFactory.getLogger(NotificationListener.class);

    private final NotificationListenerSettings settings;
    private final ConnectionMonitor connectionMonitor;
    private final NotificationSource notificationSource;
    private final AtomicBoolean subscribed = new AtomicBoolean();

    public NotificationListener(NotificationListenerSettings settings,
                                ConnectionMonitor connectionMonitor,
                                NotificationSource notificationSource) {
        this.settings = Ensure.notNull(settings, "settings");
        this.connectionMonitor = Ensure.notNull(connectionMonitor, "connectionMonitor");
        this.notificationSource = Ensure.notNull(notificationSource, "notificationSource");
    }

    public String getName() {
        return settings.getName();
    }

    @Override
    protected void subscribeActual(Subscriber<? super EventRange> subscriber) {
        if (!subscribed.compareAndSet(false, true)) {
            Flowable.<EventRange>error(new IllegalStateException("Listener " + getName() + " allows only one subscriber"))
                .subscribe(subscriber);
            return;
        }

        EventRangeDispatcher dispatcher = new EventRangeDispatcher(
            settings.getListenTo(), settings.getSchema(), notificationSource);
        ListenerSubscription subscription = new ListenerSubscription(
            subscriber, dispatcher, settings.getScheduler().createWorker());

        LOG.info("Listener {} started for {} on channel {}", getName(), settings.getListenTo(), settings.getChannel());
        subscriber.onSubscribe(subscription);
        subscription.start();
    }

    final class ListenerSubscription implements Subscription {

        private final Subscriber<? super EventRange> downstream;
        private final EventRangeDispatcher dispatcher;
        private final Scheduler.Worker worker;
        private final SerialDisposable notifications = new SerialDisposable();
        private final CompositeDisposable streams = new CompositeDisposable();

        private volatile boolean done;

        ListenerSubscription(Subscriber<? super EventRange> downstream,
                             EventRangeDispatcher dispatcher,
                             Scheduler.Worker worker) {
            this.downstream = downstream;
            this.dispatcher = dispatcher;
            this.worker = worker;
            streams.add(notifications);
        }

        void start() {
            if (done) {
                return;
            }
            streams.add(connectionMonitor.monitor(dispatcher.getListenTo()).subscribe(
                event -> schedule(() -> onConnectionEvent(event)),
                error -> schedule(() -> fail(error))));
        }

        @Override
        public void request(long n) {
            if (n <= 0) {
                schedule(() -> fail(new IllegalArgumentException("§3.9 violated: positive request amount required but it was " + n)));
                return;
            }
            schedule(() -> emit(dispatcher.demandReceived(n)));
        }

        @Override
        public void cancel() {
            if (!done) {
                done = true;
                LOG.info("Listener {} cancelled", getName());
                streams.dispose();
                // the dispatcher is only touched from the worker
                worker.schedule(() -> {
                    dispatcher.release();
                    worker.dispose();
                });
            }
        }

        private void onConnectionEvent(ConnectionEvent event) {
            if (!dispatcher.getListenTo().equals(event.getTarget())) {
                return;
            }

            if (event.isUp()) {
                notifications.set(Disposables.disposed());
                NotificationSubscription subscription = dispatcher.connectionUp();
                notifications.set(subscription.notifications().subscribe(
                    notification -> schedule(() -> onNotification(notification)),
                    error -> schedule(() -> fail(error))));
            } else {
                dispatcher.connectionDown();
                notifications.set(Disposables.disposed());
            }
        }

        private void onNotification(RawNotification notification) {
            emit(dispatcher.notificationReceived(notification));
        }

        private void emit(List<EventRange> batch) {
            for (EventRange range : batch) {
                if (done) {
                    return;
                }
                downstream.onNext(range);
            }
        }

        private void fail(Throwable error) {
            if (done) {
                return;
            }
            done = true;
            LOG.error("Listener {} terminated. {} ranges pending were dropped.", getName(), dispatcher.getPendingCount(), error);
            streams.dispose();
            try {
                dispatcher.release();
            } finally {
                worker.dispose();
                downstream.onError(error);
            }
        }

        private void schedule(Runnable task) {
            worker.schedule(() -> {
                if (done) {
                    return;
                }
                try {
                    task.run();
                } catch (Throwable ex) {
                    Exceptions.throwIfFatal(ex);
                    fail(ex);
                }
            });
        }
    }
}
