package com.tariffmonitor.monitor.model;

public enum DocumentStatus {
    ACTIVE,
    OBSOLETE
}
