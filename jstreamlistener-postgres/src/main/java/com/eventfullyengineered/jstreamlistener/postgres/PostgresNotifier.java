package com.eventfullyengineered.jstreamlistener.postgres;

import com.eventfullyengineered.jstreamlistener.connections.ConnectionFactory;
import com.eventfullyengineered.jstreamlistener.infrastructure.Ensure;
import com.eventfullyengineered.jstreamlistener.listener.EventRangeDispatcher;
import com.eventfullyengineered.jstreamlistener.notifications.EventRange;
import com.eventfullyengineered.jstreamlistener.notifications.NotificationPayloads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Announces appended ranges on a schema's events channel with {@code pg_notify}.
 */
public class PostgresNotifier {

    private static final Logger LOG = LoggerFactory.getLogger(PostgresNotifier.class);

    private final ConnectionFactory connectionFactory;
    private final Scripts scripts = new Scripts();

    public PostgresNotifier(ConnectionFactory connectionFactory) {
        this.connectionFactory = Ensure.notNull(connectionFactory, "connectionFactory");
    }

    public void publish(String schema, EventRange range) throws SQLException {
        String channel = EventRangeDispatcher.channelName(schema);
        String payload = NotificationPayloads.encode(range);

        try (Connection connection = connectionFactory.openConnection();
             PreparedStatement stmt = connection.prepareStatement(scripts.notifyChannel())) {
            stmt.setString(1, channel);
            stmt.setString(2, payload);
            stmt.execute();
        }
        LOG.trace("Notified {} with payload {}", channel, payload);
    }
}
