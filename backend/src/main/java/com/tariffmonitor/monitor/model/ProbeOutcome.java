package com.tariffmonitor.monitor.model;

/**
 * Result of the quick-mode metadata probe. Only {@link #UNCHANGED} allows skipping the full fetch.
 */
public enum ProbeOutcome {
    /** Full fetch requested, no probe sent. */
    NOT_ATTEMPTED,
    /** Remote answered 304 or reported exactly the recorded modification time. */
    UNCHANGED,
    /** Remote reported a modification time other than the recorded one, earlier or later. */
    MODIFIED,
    /** Nothing to compare against: no prior state, or the remote exposes no modification time. */
    UNSUPPORTED,
    /** Probe request failed or returned an unexpected status. */
    FAILED;

    public boolean skipsFullFetch() {
        return this == UNCHANGED;
    }
}
