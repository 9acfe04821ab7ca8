package com.tariffmonitor.monitor.model;

import java.time.Instant;

public record DocumentFingerprint(
    String url,
    String fingerprint,
    Instant remoteModifiedAt,
    long byteSize,
    String documentName
) {}
