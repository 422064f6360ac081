package com.portfoliosync.sync;

import com.portfoliosync.domain.model.Position;
import com.portfoliosync.domain.model.PositionBook;
import com.portfoliosync.entity.AccountEntity;
import com.portfoliosync.entity.PositionEntity;
import com.portfoliosync.mapper.AccountMapper;
import com.portfoliosync.mapper.PositionSnapshotMapper;
import com.portfoliosync.session.RetryOrchestrator;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pulls an account's net positions, prices the margin each one blocks, and replaces the
 * stored positions.
 *
 * <p>Only the broker's {@code net} list is stored. Rows whose symbol ends in {@code _day}
 * are intraday duplicates of a net row and are dropped.
 */
@Service
public class PositionSyncService {

    private static final Logger log = LoggerFactory.getLogger(PositionSyncService.class);

    static final String INTRADAY_DUPLICATE_SUFFIX = "_day";

    private final RetryOrchestrator retryOrchestrator;
    private final PositionSnapshotMapper positionSnapshotMapper;
    private final PositionMarginEnricher positionMarginEnricher;
    private final AccountSnapshotStore accountSnapshotStore;
    private final Clock clock;

    private final AccountMapper accountMapper = Mappers.getMapper(AccountMapper.class);

    public PositionSyncService(
            RetryOrchestrator retryOrchestrator,
            PositionSnapshotMapper positionSnapshotMapper,
            PositionMarginEnricher positionMarginEnricher,
            AccountSnapshotStore accountSnapshotStore,
            Clock clock) {
        this.retryOrchestrator = retryOrchestrator;
        this.positionSnapshotMapper = positionSnapshotMapper;
        this.positionMarginEnricher = positionMarginEnricher;
        this.accountSnapshotStore = accountSnapshotStore;
        this.clock = clock;
    }

    /** @return the position book exactly as the broker reported it */
    public PositionBook syncPositions(AccountEntity account) {
        return retryOrchestrator.runWithRetry(
                client -> {
                    PositionBook book = client.getPositions();

                    List<Position> netPositions = book.getNet().stream()
                            .filter(p -> !isIntradayDuplicate(p))
                            .toList();
                    List<PositionEntity> rows = positionSnapshotMapper.toEntityList(
                            netPositions, account.getId(), LocalDateTime.now(clock));

                    positionMarginEnricher.enrich(client, rows);
                    accountSnapshotStore.replacePositions(account.getId(), rows);

                    log.info("Synced {} positions for account {} ({} intraday duplicates dropped)",
                            rows.size(), account.getName(), book.getNet().size() - netPositions.size());
                    return book;
                },
                accountMapper.toCredentials(account));
    }

    static boolean isIntradayDuplicate(Position position) {
        String symbol = position.getTradingSymbol();
        return symbol != null && symbol.toLowerCase(Locale.ROOT).endsWith(INTRADAY_DUPLICATE_SUFFIX);
    }
}
