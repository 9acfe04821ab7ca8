package com.tariffmonitor.monitor.service;

import com.tariffmonitor.monitor.http.DocumentHttpClient;
import com.tariffmonitor.monitor.http.FetchFailureException;
import com.tariffmonitor.monitor.model.DetectionResult;
import com.tariffmonitor.monitor.model.DocumentFingerprint;
import com.tariffmonitor.monitor.model.HttpFetchResult;
import com.tariffmonitor.monitor.model.ProbeOutcome;
import com.tariffmonitor.monitor.model.TrackedDocument;
import com.tariffmonitor.monitor.util.DocumentUrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Decides whether a tracked url changed since its recorded fingerprint.
 *
 * <p>In quick mode a conditional {@code HEAD} is tried first; only a definite "not modified"
 * answer skips the download. Anything else falls through to a full fetch.
 */
@Service
public class ChangeDetector {
    private static final Logger log = LoggerFactory.getLogger(ChangeDetector.class);

    private final Fingerprinter fingerprinter;
    private final DocumentHttpClient httpClient;

    public ChangeDetector(Fingerprinter fingerprinter, DocumentHttpClient httpClient) {
        this.fingerprinter = fingerprinter;
        this.httpClient = httpClient;
    }

    public DetectionResult detect(String url, TrackedDocument prior, boolean quickMode) throws FetchFailureException {
        return prior == null
            ? detect(url, null, null, quickMode)
            : detect(url, prior.fingerprint(), prior.contentUpdatedAt(), quickMode);
    }

    public DetectionResult detect(
        String url,
        String priorFingerprint,
        Instant priorRemoteModifiedAt,
        boolean quickMode
    ) throws FetchFailureException {
        ProbeOutcome probe = ProbeOutcome.NOT_ATTEMPTED;
        if (quickMode) {
            probe = probe(url, priorFingerprint, priorRemoteModifiedAt);
            log.debug("Quick probe for {}: {}", url, probe);
            if (probe.skipsFullFetch()) {
                return new DetectionResult(
                    url,
                    priorFingerprint,
                    priorRemoteModifiedAt,
                    false,
                    null,
                    DocumentUrlUtils.documentName(url),
                    probe
                );
            }
        }

        DocumentFingerprint fetched = fingerprinter.fingerprint(url);
        boolean changed = priorFingerprint == null || !priorFingerprint.equals(fetched.fingerprint());
        return new DetectionResult(
            url,
            fetched.fingerprint(),
            fetched.remoteModifiedAt(),
            changed,
            fetched.byteSize(),
            fetched.documentName(),
            probe
        );
    }

    ProbeOutcome probe(String url, String priorFingerprint, Instant priorRemoteModifiedAt) {
        if (priorFingerprint == null || priorRemoteModifiedAt == null) {
            return ProbeOutcome.UNSUPPORTED;
        }
        HttpFetchResult result = httpClient.head(url, priorRemoteModifiedAt);
        if (result.isNotModified()) {
            return ProbeOutcome.UNCHANGED;
        }
        if (result.statusCode() == 405 || result.statusCode() == 501) {
            return ProbeOutcome.UNSUPPORTED;
        }
        if (!result.isSuccessful()) {
            return ProbeOutcome.FAILED;
        }
        if (result.lastModified() == null) {
            return ProbeOutcome.UNSUPPORTED;
        }
        // a Last-Modified moving backwards still means different content
        return result.lastModified().equals(priorRemoteModifiedAt) ? ProbeOutcome.UNCHANGED : ProbeOutcome.MODIFIED;
    }
}
