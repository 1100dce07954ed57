package com.healthecon.common.exception;

/**
 * The persistence layer could not complete a read or write. Not retried; the caller may resubmit.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
