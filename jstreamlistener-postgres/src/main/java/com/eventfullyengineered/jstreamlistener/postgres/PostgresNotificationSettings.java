package com.eventfullyengineered.jstreamlistener.postgres;

import com.eventfullyengineered.jstreamlistener.connections.ConnectionFactory;
import com.eventfullyengineered.jstreamlistener.infrastructure.Ensure;
import io.reactivex.Scheduler;
import io.reactivex.schedulers.Schedulers;

import javax.sql.DataSource;
import java.sql.DriverManager;
import java.time.Duration;
import java.util.Properties;

public class PostgresNotificationSettings {

    private static final String DEFAULT_NAME = "postgres";
    private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(250);

    private String name = DEFAULT_NAME;
    private ConnectionFactory connectionFactory;
    private Duration pollInterval = DEFAULT_POLL_INTERVAL;
    private Scheduler scheduler = Schedulers.io();

    public void setName(String name) {
        this.name = Ensure.notNullOrEmpty(name, "name");
    }

    /**
     * @return the name listeners use to refer to this connection
     */
    public String getName() {
        return name;
    }

    public void setConnectionFactory(ConnectionFactory connectionFactory) {
        this.connectionFactory = Ensure.notNull(connectionFactory);
    }

    public ConnectionFactory getConnectionFactory() {
        return connectionFactory;
    }

    public void setPollInterval(Duration pollInterval) {
        Ensure.notNull(pollInterval, "pollInterval");
        Ensure.positive(pollInterval.toMillis(), "pollInterval");
        this.pollInterval = pollInterval;
    }

    /**
     * @return how often the connection is checked and pending notifications collected
     */
    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = Ensure.notNull(scheduler, "scheduler");
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public static class Builder {

        private final ConnectionFactory connectionFactory;
        private String name = DEFAULT_NAME;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private Scheduler scheduler = Schedulers.io();

        public Builder(DataSource dataSource) {
            this(dataSource::getConnection);
        }

        public Builder(final String url) {
            this(() -> DriverManager.getConnection(url));
        }

        public Builder(final String url, final Properties properties) {
            this(() -> DriverManager.getConnection(url, properties));
        }

        public Builder(final String url, final String username, final String password) {
            this(() -> DriverManager.getConnection(url, username, password));
        }

        public Builder(ConnectionFactory connectionFactory) {
            this.connectionFactory = Ensure.notNull(connectionFactory);
        }

        public Builder withName(String name) {
            this.name = Ensure.notNullOrEmpty(name, "name");
            return this;
        }

        public Builder withPollInterval(Duration pollInterval) {
            this.pollInterval = Ensure.notNull(pollInterval);
            return this;
        }

        public Builder withScheduler(Scheduler scheduler) {
            this.scheduler = Ensure.notNull(scheduler);
            return this;
        }

        public PostgresNotificationSettings build() {
            PostgresNotificationSettings settings = new PostgresNotificationSettings();
            settings.setName(name);
            settings.setConnectionFactory(connectionFactory);
            settings.setPollInterval(pollInterval);
            settings.setScheduler(scheduler);
            return settings;
        }
    }
}
