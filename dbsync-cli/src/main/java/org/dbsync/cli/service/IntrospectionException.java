package org.dbsync.cli.service;

/**
 * Reading a database's metadata failed (connection refused, bad credentials,
 * missing privileges). Fatal for the run.
 */
public class IntrospectionException extends RuntimeException {
    public IntrospectionException(String message, Throwable cause) {
        super(message, cause);
    }

    public IntrospectionException(String message) {
        super(message);
    }
}
