package com.tariffmonitor.monitor.discovery;

public class CandidateResolutionException extends Exception {
    public CandidateResolutionException(String message) {
        super(message);
    }

    public CandidateResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
