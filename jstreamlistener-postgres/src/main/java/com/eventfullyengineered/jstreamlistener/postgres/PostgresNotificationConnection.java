package com.eventfullyengineered.jstreamlistener.postgres;

import com.eventfullyengineered.jstreamlistener.connections.ConnectionEvent;
import com.eventfullyengineered.jstreamlistener.connections.ConnectionFactory;
import com.eventfullyengineered.jstreamlistener.connections.ConnectionMonitor;
import com.eventfullyengineered.jstreamlistener.infrastructure.Ensure;
import com.eventfullyengineered.jstreamlistener.notifications.NotificationSource;
import com.eventfullyengineered.jstreamlistener.notifications.NotificationSubscription;
import com.eventfullyengineered.jstreamlistener.notifications.RawNotification;
import com.eventfullyengineered.jstreamlistener.notifications.SubscriptionFailedException;
import io.reactivex.Observable;
import io.reactivex.disposables.Disposable;
import io.reactivex.subjects.BehaviorSubject;
import io.reactivex.subjects.PublishSubject;
import io.reactivex.subjects.Subject;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * A dedicated PostgreSQL connection used for {@code LISTEN}.
 *
 * <p>PgJDBC only reads asynchronous notifications off the socket when a statement is executed, so a poll
 * loop issues a cheap round trip every interval, collects pending notifications and uses the outcome
 * as the liveness check. A failed round trip reports the connection DOWN and the next tick reconnects
 * and reports it UP again. Listens do not survive a reconnect; listeners issue them again on UP.</p>
 *
 * <p>Several subscriptions may share a channel. {@code UNLISTEN} is sent when the last one made on the
 * current connection is closed.</p>
 */
public class PostgresNotificationConnection implements ConnectionMonitor, NotificationSource, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(PostgresNotificationConnection.class);

    private final String name;
    private final ConnectionFactory connectionFactory;
    private final Scripts scripts = new Scripts();
    private final Subject<ConnectionEvent> connectionEvents = BehaviorSubject.<ConnectionEvent>create().toSerialized();
    private final Subject<RawNotification> notifications = PublishSubject.<RawNotification>create().toSerialized();
    private final Object lock = new Object();
    private final Disposable polling;

    // guarded by lock
    private Connection connection;
    private long generation;
    private final Map<String, Integer> listenCounts = new HashMap<>();

    public PostgresNotificationConnection(PostgresNotificationSettings settings) {
        Ensure.notNull(settings, "settings");
        this.name = settings.getName();
        this.connectionFactory = settings.getConnectionFactory();
        this.polling = Observable
            .interval(0, settings.getPollInterval().toMillis(), TimeUnit.MILLISECONDS, settings.getScheduler())
            .subscribe(tick -> poll());
    }

    public boolean isConnected() {
        synchronized (lock) {
            return connection != null;
        }
    }

    @Override
    public Observable<ConnectionEvent> monitor(String target) {
        requireOwnTarget(target);
        return connectionEvents.hide();
    }

    @Override
    public NotificationSubscription listen(String target, String channel) {
        requireOwnTarget(target);
        long listenGeneration;
        synchronized (lock) {
            if (connection == null) {
                throw new SubscriptionFailedException(target, channel, new SQLException("Connection " + name + " is not open"));
            }
            try (Statement stmt = connection.createStatement()) {
                stmt.execute(scripts.listen(channel));
            } catch (SQLException ex) {
                throw new SubscriptionFailedException(target, channel, ex);
            }
            listenCounts.merge(channel, 1, Integer::sum);
            listenGeneration = generation;
        }
        LOG.debug("Connection {} listening on channel {}", name, channel);
        return new PostgresNotificationSubscription(target, channel, notifications, () -> unlisten(channel, listenGeneration));
    }

    void unlisten(String channel, long listenGeneration) {
        synchronized (lock) {
            // a listen made on a connection since lost is already gone
            if (connection == null || listenGeneration != generation || !listenCounts.containsKey(channel)) {
                return;
            }
            int remaining = listenCounts.merge(channel, -1, Integer::sum);
            if (remaining > 0) {
                return;
            }
            listenCounts.remove(channel);
            try (Statement stmt = connection.createStatement()) {
                stmt.execute(scripts.unlisten(channel));
                LOG.debug("Connection {} stopped listening on channel {}", name, channel);
            } catch (SQLException ex) {
                LOG.warn("Could not stop listening on channel {} through {}", channel, name, ex);
            }
        }
    }

    void poll() {
        synchronized (lock) {
            if (connection == null) {
                connect();
                return;
            }

            try {
                try (Statement stmt = connection.createStatement()) {
                    stmt.execute(scripts.ping());
                }
                PGNotification[] received = connection.unwrap(PGConnection.class).getNotifications();
                if (received != null) {
                    for (PGNotification notification : received) {
                        notifications.onNext(new RawNotification(notification.getName(), notification.getParameter()));
                    }
                }
            } catch (Exception ex) {
                LOG.warn("Lost connection {}", name, ex);
                closeConnection();
                connectionEvents.onNext(ConnectionEvent.down(name));
            }
        }
    }

    private void connect() {
        try {
            connection = connectionFactory.openConnection();
            connection.setAutoCommit(true);
        } catch (Exception ex) {
            LOG.debug("Could not open connection {}", name, ex);
            closeConnection();
            return;
        }
        generation++;
        listenCounts.clear();
        LOG.info("Connection {} up", name);
        connectionEvents.onNext(ConnectionEvent.up(name));
    }

    private void closeConnection() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (Exception ex) {
            LOG.debug("Error closing connection {}", name, ex);
        }
        connection = null;
    }

    private void requireOwnTarget(String target) {
        if (!name.equals(target)) {
            throw new IllegalArgumentException("Unknown connection " + target + ". This connection is " + name);
        }
    }

    @Override
    public void close() {
        polling.dispose();
        synchronized (lock) {
            if (connection != null) {
                closeConnection();
                connectionEvents.onNext(ConnectionEvent.down(name));
            }
        }
        connectionEvents.onComplete();
        notifications.onComplete();
        LOG.info("Connection {} closed", name);
    }
}
