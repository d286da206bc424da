package com.vexen.database;

/**
 * Unchecked wrapper for {@link java.sql.SQLException} and Flyway failures.
 */
public class DataAccessException extends RuntimeException {

    public DataAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
