package com.migranet.core.executor;

/**
 * The orchestrating thread was interrupted while waiting on an external call.
 * The in-flight attempt is discarded and the batch ends as cancelled.
 */
public class MigrationCancelledException extends RuntimeException {

    public MigrationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
