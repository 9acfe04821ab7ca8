package com.tariffmonitor.monitor.service;

public class SourceListException extends RuntimeException {
    public SourceListException(String message) {
        super(message);
    }

    public SourceListException(String message, Throwable cause) {
        super(message, cause);
    }
}
