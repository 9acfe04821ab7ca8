package com.tariffmonitor.monitor.persistence;

/**
 * The tracked document store could not complete a write or read. Fatal for the current run.
 */
public class DocumentStoreException extends RuntimeException {
    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
