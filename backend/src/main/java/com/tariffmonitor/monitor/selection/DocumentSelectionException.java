package com.tariffmonitor.monitor.selection;

public class DocumentSelectionException extends Exception {
    public DocumentSelectionException(String message) {
        super(message);
    }

    public DocumentSelectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
