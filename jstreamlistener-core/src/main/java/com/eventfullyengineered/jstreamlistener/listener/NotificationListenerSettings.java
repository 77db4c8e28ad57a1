package com.eventfullyengineered.jstreamlistener.listener;

import com.eventfullyengineered.jstreamlistener.infrastructure.Ensure;
import com.google.common.base.MoreObjects;
import io.reactivex.Scheduler;
import io.reactivex.schedulers.Schedulers;

import java.util.UUID;

public class NotificationListenerSettings {

    private static final String DEFAULT_SCHEMA = "public";

    private String name;
    private String listenTo;
    private String schema = DEFAULT_SCHEMA;
    private Scheduler scheduler = Schedulers.single();

    public void setName(String name) {
        this.name = Ensure.notNullOrEmpty(name, "name");
    }

    public String getName() {
        return name;
    }

    public void setListenTo(String listenTo) {
        this.listenTo = Ensure.notNullOrEmpty(listenTo, "listenTo");
    }

    /**
     * @return the name of the connection to monitor and listen through
     */
    public String getListenTo() {
        return listenTo;
    }

    public void setSchema(String schema) {
        this.schema = Ensure.notNullOrEmpty(schema, "schema");
    }

    /**
     * @return the store schema, from which the channel name is derived
     */
    public String getSchema() {
        return schema;
    }

    public String getChannel() {
        return EventRangeDispatcher.channelName(schema);
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = Ensure.notNull(scheduler, "scheduler");
    }

    /**
     * @return the scheduler whose worker serializes all listener events
     */
    public Scheduler getScheduler() {
        return scheduler;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("name", name)
            .add("listenTo", listenTo)
            .add("schema", schema)
            .toString();
    }

    public static class Builder {

        private final String listenTo;
        private String name;
        private String schema = DEFAULT_SCHEMA;
        private Scheduler scheduler = Schedulers.single();

        public Builder(String listenTo) {
            this.listenTo = Ensure.notNullOrEmpty(listenTo, "listenTo");
        }

        public Builder withName(String name) {
            this.name = Ensure.notNullOrEmpty(name, "name");
            return this;
        }

        public Builder withSchema(String schema) {
            this.schema = Ensure.notNullOrEmpty(schema, "schema");
            return this;
        }

        public Builder withScheduler(Scheduler scheduler) {
            this.scheduler = Ensure.notNull(scheduler, "scheduler");
            return this;
        }

        public NotificationListenerSettings build() {
            NotificationListenerSettings settings = new NotificationListenerSettings();
            settings.setListenTo(listenTo);
            settings.setName(Ensure.isNullOrEmpty(name) ? UUID.randomUUID().toString() : name);
            settings.setSchema(schema);
            settings.setScheduler(scheduler);
            return settings;
        }
    }
}
