package com.eventfullyengineered.jstreamlistener.postgres;

import com.eventfullyengineered.jstreamlistener.connections.ConnectionEvent;
import com.eventfullyengineered.jstreamlistener.connections.ConnectionFactory;
import com.eventfullyengineered.jstreamlistener.listener.NotificationListener;
import com.eventfullyengineered.jstreamlistener.listener.NotificationListenerSettings;
import com.eventfullyengineered.jstreamlistener.notifications.EventRange;
import com.eventfullyengineered.jstreamlistener.notifications.NotificationSubscription;
import com.eventfullyengineered.jstreamlistener.notifications.RawNotification;
import com.eventfullyengineered.jstreamlistener.notifications.SubscriptionFailedException;
import io.reactivex.observers.TestObserver;
import io.reactivex.schedulers.Schedulers;
import io.reactivex.schedulers.TestScheduler;
import io.reactivex.subscribers.TestSubscriber;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PostgresNotificationConnectionTest {

    private static final String TARGET = "event-store-db";
    private static final String LISTEN = "LISTEN \"public.events\";";
    private static final String UNLISTEN = "UNLISTEN \"public.events\";";

    private TestScheduler scheduler;
    private AtomicInteger connectAttempts;
    private List<FakePgConnection> opened;
    private PostgresNotificationConnection connection;

    @BeforeEach
    void setUp() {
        scheduler = new TestScheduler();
        connectAttempts = new AtomicInteger();
        opened = new ArrayList<>();
    }

    @AfterEach
    void tearDown() {
        if (connection != null) {
            connection.close();
        }
    }

    @Test
    void keepsTryingToConnectEveryPollInterval() {
        connection = connect(unreachable());

        scheduler.triggerActions();
        assertEquals(1, connectAttempts.get());

        scheduler.advanceTimeBy(300, TimeUnit.MILLISECONDS);

        assertEquals(4, connectAttempts.get());
        assertFalse(connection.isConnected());
    }

    @Test
    void unreachableDatabaseIsNeverReportedUp() {
        connection = connect(unreachable());
        TestObserver<ConnectionEvent> events = connection.monitor(TARGET).test();

        scheduler.advanceTimeBy(1, TimeUnit.SECONDS);

        events.assertNoValues();
        events.assertNotTerminated();
    }

    @Test
    void runtimeFailureOpeningConnectionDoesNotStopPolling() {
        connection = connect(() -> {
            if (connectAttempts.incrementAndGet() == 1) {
                throw new IllegalStateException("pool not ready");
            }
            throw new SQLException("Connection refused");
        });

        scheduler.advanceTimeBy(1, TimeUnit.SECONDS);

        assertEquals(11, connectAttempts.get());
    }

    @Test
    void reportsUpOnceConnectionOpensAfterRuntimeFailure() {
        connection = connect(() -> {
            if (connectAttempts.incrementAndGet() == 1) {
                throw new IllegalStateException("pool not ready");
            }
            return open();
        });
        TestObserver<ConnectionEvent> events = connection.monitor(TARGET).test();

        scheduler.advanceTimeBy(100, TimeUnit.MILLISECONDS);

        events.assertValues(ConnectionEvent.up(TARGET));
        assertTrue(connection.isConnected());
    }

    @Test
    void failedRoundTripReportsDownThenReconnects() {
        connection = connect(reachable());
        TestObserver<ConnectionEvent> events = connection.monitor(TARGET).test();
        scheduler.triggerActions();
        events.assertValues(ConnectionEvent.up(TARGET));

        opened.get(0).breakConnection();
        scheduler.advanceTimeBy(100, TimeUnit.MILLISECONDS);

        events.assertValues(ConnectionEvent.up(TARGET), ConnectionEvent.down(TARGET));
        assertTrue(opened.get(0).isClosed());
        assertFalse(connection.isConnected());

        scheduler.advanceTimeBy(100, TimeUnit.MILLISECONDS);

        events.assertValues(ConnectionEvent.up(TARGET), ConnectionEvent.down(TARGET), ConnectionEvent.up(TARGET));
        assertEquals(2, opened.size());
        assertTrue(connection.isConnected());
    }

    @Test
    void runtimeFailureDuringRoundTripReportsDownThenReconnects() {
        connection = connect(reachable());
        TestObserver<ConnectionEvent> events = connection.monitor(TARGET).test();
        scheduler.triggerActions();

        opened.get(0).failWith(new IllegalStateException("driver bug"));
        scheduler.advanceTimeBy(200, TimeUnit.MILLISECONDS);

        events.assertValues(ConnectionEvent.up(TARGET), ConnectionEvent.down(TARGET), ConnectionEvent.up(TARGET));
    }

    @Test
    void deliversNotificationsForListenedChannel() {
        connection = connect(reachable());
        scheduler.triggerActions();
        NotificationSubscription subscription = connection.listen(TARGET, "public.events");
        TestObserver<RawNotification> notifications = subscription.notifications().test();

        opened.get(0).deliver("public.events", "stream-1,1,1,1");
        opened.get(0).deliver("other.events", "stream-2,1,1,1");
        scheduler.advanceTimeBy(100, TimeUnit.MILLISECONDS);

        notifications.assertValueCount(1);
        assertEquals("stream-1,1,1,1", notifications.values().get(0).getPayload());
        assertTrue(opened.get(0).executed().contains(LISTEN));
    }

    @Test
    void listenerListensAgainAfterReconnectAndKeepsQueuedRanges() {
        connection = connect(reachable());
        NotificationListener listener = listener();
        TestSubscriber<EventRange> subscriber = listener.test(0);

        scheduler.triggerActions();
        FakePgConnection first = opened.get(0);
        assertEquals(Collections.singletonList(LISTEN), first.executed());
        first.deliver("public.events", "stream-1,1,1,1");
        first.deliver("public.events", "stream-1,1,2,3");
        scheduler.advanceTimeBy(100, TimeUnit.MILLISECONDS);
        subscriber.assertNoValues();

        first.breakConnection();
        scheduler.advanceTimeBy(200, TimeUnit.MILLISECONDS);

        FakePgConnection second = opened.get(1);
        assertEquals(Collections.singletonList(LISTEN), second.executed());
        second.deliver("public.events", "stream-2,2,1,1");
        scheduler.advanceTimeBy(100, TimeUnit.MILLISECONDS);

        subscriber.request(5);

        subscriber.assertValues(
            new EventRange("stream-1", 1, 1, 1),
            new EventRange("stream-1", 1, 2, 3),
            new EventRange("stream-2", 2, 1, 1));
        subscriber.assertNotTerminated();
    }

    @Test
    void cancellingListenerUnlistens() {
        connection = connect(reachable());
        TestSubscriber<EventRange> subscriber = listener().test(0);
        scheduler.triggerActions();

        subscriber.cancel();

        assertEquals(Arrays.asList(LISTEN, UNLISTEN), opened.get(0).executed());
    }

    @Test
    void unlistensOnlyWhenLastSubscriptionOnChannelCloses() {
        connection = connect(reachable());
        scheduler.triggerActions();
        NotificationSubscription first = connection.listen(TARGET, "public.events");
        NotificationSubscription second = connection.listen(TARGET, "public.events");

        first.close();
        first.close();
        assertEquals(Arrays.asList(LISTEN, LISTEN), opened.get(0).executed());

        second.close();
        assertEquals(Arrays.asList(LISTEN, LISTEN, UNLISTEN), opened.get(0).executed());
    }

    @Test
    void closingSubscriptionFromLostConnectionDoesNothing() {
        connection = connect(reachable());
        scheduler.triggerActions();
        NotificationSubscription subscription = connection.listen(TARGET, "public.events");

        opened.get(0).breakConnection();
        scheduler.advanceTimeBy(200, TimeUnit.MILLISECONDS);
        subscription.close();

        assertTrue(opened.get(1).executed().stream().noneMatch(sql -> sql.startsWith("UNLISTEN")));
    }

    @Test
    void listenWhileDisconnectedFails() {
        connection = connect(unreachable());

        SubscriptionFailedException ex = assertThrows(SubscriptionFailedException.class,
            () -> connection.listen(TARGET, "public.events"));

        assertEquals(SQLException.class, ex.getCause().getClass());
    }

    @Test
    void unknownTargetIsRejected() {
        connection = connect(unreachable());

        assertThrows(IllegalArgumentException.class, () -> connection.monitor("another-db"));
        assertThrows(IllegalArgumentException.class, () -> connection.listen("another-db", "public.events"));
    }

    @Test
    void closeReportsDownCompletesMonitorAndStopsPolling() {
        connection = connect(reachable());
        TestObserver<ConnectionEvent> events = connection.monitor(TARGET).test();
        scheduler.triggerActions();

        connection.close();
        scheduler.advanceTimeBy(1, TimeUnit.SECONDS);

        events.assertValues(ConnectionEvent.up(TARGET), ConnectionEvent.down(TARGET));
        events.assertComplete();
        assertEquals(1, connectAttempts.get());
        assertTrue(opened.get(0).isClosed());
    }

    private PostgresNotificationConnection connect(ConnectionFactory connectionFactory) {
        PostgresNotificationSettings settings = new PostgresNotificationSettings.Builder(connectionFactory)
            .withName(TARGET)
            .withPollInterval(Duration.ofMillis(100))
            .withScheduler(scheduler)
            .build();
        return new PostgresNotificationConnection(settings);
    }

    private NotificationListener listener() {
        NotificationListenerSettings settings = new NotificationListenerSettings.Builder(TARGET)
            .withScheduler(Schedulers.trampoline())
            .build();
        return new NotificationListener(settings, connection, connection);
    }

    private ConnectionFactory unreachable() {
        return () -> {
            connectAttempts.incrementAndGet();
            throw new SQLException("Connection refused");
        };
    }

    private ConnectionFactory reachable() {
        return () -> {
            connectAttempts.incrementAndGet();
            return open();
        };
    }

    private java.sql.Connection open() {
        FakePgConnection fake = new FakePgConnection();
        opened.add(fake);
        return fake.connection();
    }

}
