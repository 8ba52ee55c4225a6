package com.migranet.core.memory;

/**
 * Memory store or report I/O failed. Never fatal to a migration run.
 */
public class PersistenceException extends Exception {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
