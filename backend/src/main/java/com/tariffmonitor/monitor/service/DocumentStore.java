package com.tariffmonitor.monitor.service;

import com.tariffmonitor.monitor.model.DocumentObservation;
import com.tariffmonitor.monitor.model.DocumentStatus;
import com.tariffmonitor.monitor.model.TrackedDocument;
import com.tariffmonitor.monitor.model.UpsertResult;
import com.tariffmonitor.monitor.persistence.DocumentStoreException;
import com.tariffmonitor.monitor.persistence.TrackedDocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable record of every tracked url. One row per url; status changes keep history instead of
 * deleting rows. Writes for the same url are serialized in-process and each runs in its own
 * transaction, the unique index on {@code url} covers other processes.
 */
@Service
public class DocumentStore {
    private static final Logger log = LoggerFactory.getLogger(DocumentStore.class);

    private final TrackedDocumentRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final Map<String, Object> urlLocks = new ConcurrentHashMap<>();

    public DocumentStore(TrackedDocumentRepository repository, TransactionTemplate transactionTemplate) {
        this.repository = repository;
        this.transactionTemplate = transactionTemplate;
    }

    public TrackedDocument findByUrl(String url) {
        try {
            return repository.findByUrl(url);
        } catch (DataAccessException e) {
            throw new DocumentStoreException("Failed to look up " + url, e);
        }
    }

    public List<TrackedDocument> findBySource(String sourceName) {
        try {
            return repository.findBySource(sourceName);
        } catch (DataAccessException e) {
            throw new DocumentStoreException("Failed to look up documents of " + sourceName, e);
        }
    }

    public UpsertResult upsert(DocumentObservation observation) {
        Object lock = urlLocks.computeIfAbsent(observation.url(), ignored -> new Object());
        synchronized (lock) {
            try {
                return transactionTemplate.execute(status -> applyUpsert(observation));
            } catch (DataAccessException e) {
                throw new DocumentStoreException("Failed to record " + observation.url(), e);
            }
        }
    }

    public boolean markObsolete(String url) {
        Object lock = urlLocks.computeIfAbsent(url, ignored -> new Object());
        synchronized (lock) {
            try {
                int updated = repository.updateStatus(url, DocumentStatus.OBSOLETE);
                if (updated > 0) {
                    log.info("Marked {} obsolete", url);
                }
                return updated > 0;
            } catch (DataAccessException e) {
                throw new DocumentStoreException("Failed to mark " + url + " obsolete", e);
            }
        }
    }

    /**
     * Makes {@code currentUrls} the active documents of the source: they are (re)activated and
     * every other active row of the source becomes {@code OBSOLETE}.
     *
     * @return number of rows superseded
     */
    public int supersede(String sourceName, Collection<String> currentUrls) {
        if (currentUrls == null || currentUrls.isEmpty()) {
            return 0;
        }
        Set<String> keep = new LinkedHashSet<>(currentUrls);
        try {
            Integer superseded = transactionTemplate.execute(status -> {
                repository.activate(keep);
                return repository.markObsoleteForSourceExcept(sourceName, keep);
            });
            int count = superseded == null ? 0 : superseded;
            if (count > 0) {
                log.info("Superseded {} document(s) of {} by {}", count, sourceName, keep);
            }
            return count;
        } catch (DataAccessException e) {
            throw new DocumentStoreException("Failed to supersede documents of " + sourceName, e);
        }
    }

    private UpsertResult applyUpsert(DocumentObservation observation) {
        TrackedDocument existing = repository.findByUrl(observation.url());
        if (existing == null && repository.insertIfAbsent(observation)) {
            TrackedDocument inserted = repository.findByUrl(observation.url());
            log.info("Inserted new record for {} ({})", observation.url(), observation.sourceName());
            return new UpsertResult(inserted, true, true);
        }
        if (existing == null) {
            existing = repository.findByUrl(observation.url());
            if (existing == null) {
                throw new IllegalStateException("Row for " + observation.url() + " vanished during upsert");
            }
        }

        boolean fingerprintChanged = !Objects.equals(existing.fingerprint(), observation.fingerprint());
        Instant contentUpdatedAt = observation.remoteModifiedAt();
        if (contentUpdatedAt == null && !fingerprintChanged) {
            contentUpdatedAt = existing.contentUpdatedAt();
        }
        repository.updateObservation(existing.id(), observation, contentUpdatedAt);
        if (fingerprintChanged) {
            log.info("Updated fingerprint for {}", observation.url());
        } else {
            log.debug("No changes detected for {}", observation.url());
        }
        return new UpsertResult(repository.findByUrl(observation.url()), false, fingerprintChanged);
    }
}
