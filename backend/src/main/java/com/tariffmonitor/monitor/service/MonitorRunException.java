package com.tariffmonitor.monitor.service;

public class MonitorRunException extends RuntimeException {
    public MonitorRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
