package com.portfoliosync.sync;

import com.portfoliosync.config.SyncConfig;
import com.portfoliosync.domain.model.SegmentMargin;
import com.portfoliosync.entity.AccountEntity;
import com.portfoliosync.mapper.AccountMapper;
import com.portfoliosync.mapper.MarginSnapshotMapper;
import com.portfoliosync.session.RetryOrchestrator;
import java.time.Clock;
import java.time.LocalDateTime;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Pulls the configured segment's margins and upserts the account's margin row. */
@Service
public class MarginSyncService {

    private static final Logger log = LoggerFactory.getLogger(MarginSyncService.class);

    private final RetryOrchestrator retryOrchestrator;
    private final MarginSnapshotMapper marginSnapshotMapper;
    private final AccountSnapshotStore accountSnapshotStore;
    private final Clock clock;
    private final String segment;

    private final AccountMapper accountMapper = Mappers.getMapper(AccountMapper.class);

    public MarginSyncService(
            RetryOrchestrator retryOrchestrator,
            MarginSnapshotMapper marginSnapshotMapper,
            AccountSnapshotStore accountSnapshotStore,
            Clock clock,
            SyncConfig syncConfig) {
        this.retryOrchestrator = retryOrchestrator;
        this.marginSnapshotMapper = marginSnapshotMapper;
        this.accountSnapshotStore = accountSnapshotStore;
        this.clock = clock;
        this.segment = syncConfig.getMargins().getSegment();
    }

    /** @return the segment margin exactly as the broker reported it */
    public SegmentMargin syncMargins(AccountEntity account) {
        return retryOrchestrator.runWithRetry(
                client -> {
                    SegmentMargin margin = client.getMargins(segment);
                    LocalDateTime now = LocalDateTime.now(clock);
                    accountSnapshotStore.upsertMargin(
                            account.getId(), row -> marginSnapshotMapper.applyTo(margin, row, now));
                    log.info("Synced {} margins for account {}", segment, account.getName());
                    return margin;
                },
                accountMapper.toCredentials(account));
    }
}
