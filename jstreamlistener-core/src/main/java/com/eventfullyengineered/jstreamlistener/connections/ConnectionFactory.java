package com.eventfullyengineered.jstreamlistener.connections;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens connections to the store database: the dedicated connection notifications are listened on
 * and the short lived ones notifications are published through.
 */
@FunctionalInterface
public interface ConnectionFactory {

    /**
     * @return a new open connection, owned by the caller
     * @throws SQLException if the database cannot be reached
     */
    Connection openConnection() throws SQLException;
}
