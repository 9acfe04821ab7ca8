package com.tariffmonitor.monitor.http;

/**
 * A document could not be fetched. {@link #reasonCode()} is one of the
 * {@link com.tariffmonitor.monitor.util.ReasonCodeClassifier} codes.
 */
public class FetchFailureException extends Exception {
    private final String url;
    private final String reasonCode;
    private final String detail;

    public FetchFailureException(String url, String reasonCode, String detail) {
        super(reasonCode + " fetching " + url + (detail == null || detail.isBlank() ? "" : ": " + detail));
        this.url = url;
        this.reasonCode = reasonCode;
        this.detail = detail;
    }

    public String url() {
        return url;
    }

    public String reasonCode() {
        return reasonCode;
    }

    public String detail() {
        return detail;
    }
}
