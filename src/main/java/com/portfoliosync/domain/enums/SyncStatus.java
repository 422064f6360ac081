package com.portfoliosync.domain.enums;

public enum SyncStatus {
    SUCCESS,
    SKIPPED,
    FAILED
}
