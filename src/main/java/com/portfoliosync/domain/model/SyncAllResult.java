package com.portfoliosync.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class SyncAllResult {

    private final int syncedAccounts;

    /** Failed plus skipped accounts. */
    private final int failedAccounts;

    private final List<AccountSyncResult> results;
}
