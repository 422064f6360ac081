package com.portfoliosync.domain.model;

import com.portfoliosync.domain.enums.SyncStatus;
import lombok.Builder;
import lombok.Getter;

/** Outcome of one account within a sync-all run. */
@Getter
@Builder
public class AccountSyncResult {

    private final Long accountId;
    private final String accountName;
    private final SyncStatus status;
    private final String message;
}
