package com.eventfullyengineered.jstreamlistener.postgres;

import com.eventfullyengineered.jstreamlistener.common.InputStreams;
import com.eventfullyengineered.jstreamlistener.infrastructure.Ensure;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * SQL used to listen for and publish store notifications.
 */
public class Scripts {

    private final ConcurrentMap<String, String> sqlScripts = new ConcurrentHashMap<>();

    public String notifyChannel() {
        return getScript("Notify");
    }

    public String ping() {
        return getScript("Ping");
    }

    /**
     * LISTEN does not accept bind parameters so the channel is sent as a quoted identifier.
     * @param channel the channel name e.g. {@code public.events}
     * @return the LISTEN statement
     */
    public String listen(String channel) {
        return "LISTEN " + quoteIdentifier(channel) + ";";
    }

    public String unlisten(String channel) {
        return "UNLISTEN " + quoteIdentifier(channel) + ";";
    }

    static String quoteIdentifier(String identifier) {
        Ensure.notNullOrEmpty(identifier, "identifier");
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    private String getScript(String name) {
        return sqlScripts.computeIfAbsent(name, key -> {
            InputStream resourceStream = getClass().getClassLoader().getResourceAsStream("db/scripts/" + key + ".sql");
            if (resourceStream == null) {
                throw new IllegalStateException("Resource script " + key + " not found");
            }
            try {
                return InputStreams.asString(resourceStream).trim();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }
}
