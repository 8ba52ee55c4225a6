package com.migranet.core.source;

/**
 * Source or target database cannot be reached. Fatal to a migration run.
 */
public class ConnectivityException extends RuntimeException {

    public ConnectivityException(String message) {
        super(message);
    }

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
