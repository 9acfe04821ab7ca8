package com.tariffmonitor.monitor.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveMonitorRunException extends RuntimeException {
    public ActiveMonitorRunException(String message) {
        super(message);
    }
}
