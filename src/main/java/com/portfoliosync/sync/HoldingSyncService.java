package com.portfoliosync.sync;

import com.portfoliosync.domain.model.Holding;
import com.portfoliosync.entity.AccountEntity;
import com.portfoliosync.entity.HoldingEntity;
import com.portfoliosync.mapper.AccountMapper;
import com.portfoliosync.mapper.HoldingSnapshotMapper;
import com.portfoliosync.session.RetryOrchestrator;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pulls an account's holdings from the broker and replaces the stored holdings with them.
 * The whole fetch-and-store runs inside {@link RetryOrchestrator}.
 */
@Service
public class HoldingSyncService {

    private static final Logger log = LoggerFactory.getLogger(HoldingSyncService.class);

    private final RetryOrchestrator retryOrchestrator;
    private final HoldingSnapshotMapper holdingSnapshotMapper;
    private final AccountSnapshotStore accountSnapshotStore;
    private final Clock clock;

    private final AccountMapper accountMapper = Mappers.getMapper(AccountMapper.class);

    public HoldingSyncService(
            RetryOrchestrator retryOrchestrator,
            HoldingSnapshotMapper holdingSnapshotMapper,
            AccountSnapshotStore accountSnapshotStore,
            Clock clock) {
        this.retryOrchestrator = retryOrchestrator;
        this.holdingSnapshotMapper = holdingSnapshotMapper;
        this.accountSnapshotStore = accountSnapshotStore;
        this.clock = clock;
    }

    /** @return the holdings exactly as the broker reported them */
    public List<Holding> syncHoldings(AccountEntity account) {
        return retryOrchestrator.runWithRetry(
                client -> {
                    List<Holding> holdings = client.getHoldings();
                    List<HoldingEntity> rows =
                            holdingSnapshotMapper.toEntityList(holdings, account.getId(), LocalDateTime.now(clock));
                    accountSnapshotStore.replaceHoldings(account.getId(), rows);
                    log.info("Synced {} holdings for account {}", rows.size(), account.getName());
                    return holdings;
                },
                accountMapper.toCredentials(account));
    }
}
