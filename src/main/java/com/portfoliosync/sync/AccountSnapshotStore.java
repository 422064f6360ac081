package com.portfoliosync.sync;

import com.portfoliosync.entity.HoldingEntity;
import com.portfoliosync.entity.MarginEntity;
import com.portfoliosync.entity.PositionEntity;
import com.portfoliosync.repository.jpa.HoldingJpaRepository;
import com.portfoliosync.repository.jpa.MarginJpaRepository;
import com.portfoliosync.repository.jpa.PositionJpaRepository;
import java.util.List;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reconciles the stored snapshot of one account with freshly fetched broker data.
 *
 * <p>Holdings and positions use replace-by-account: delete every row of the account, then
 * insert the new rows. Both steps run in one transaction, so a failed insert leaves the
 * previous snapshot in place. Margins are a single row per account and are upserted.
 */
@Component
public class AccountSnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(AccountSnapshotStore.class);

    private final HoldingJpaRepository holdingJpaRepository;
    private final PositionJpaRepository positionJpaRepository;
    private final MarginJpaRepository marginJpaRepository;

    public AccountSnapshotStore(
            HoldingJpaRepository holdingJpaRepository,
            PositionJpaRepository positionJpaRepository,
            MarginJpaRepository marginJpaRepository) {
        this.holdingJpaRepository = holdingJpaRepository;
        this.positionJpaRepository = positionJpaRepository;
        this.marginJpaRepository = marginJpaRepository;
    }

    @Transactional
    public List<HoldingEntity> replaceHoldings(Long accountId, List<HoldingEntity> holdings) {
        int deleted = holdingJpaRepository.deleteAllForAccount(accountId);
        List<HoldingEntity> saved = holdingJpaRepository.saveAll(holdings);
        log.info("Replaced holdings for account {}: {} removed, {} stored", accountId, deleted, saved.size());
        return saved;
    }

    @Transactional
    public List<PositionEntity> replacePositions(Long accountId, List<PositionEntity> positions) {
        int deleted = positionJpaRepository.deleteAllForAccount(accountId);
        List<PositionEntity> saved = positionJpaRepository.saveAll(positions);
        log.info("Replaced positions for account {}: {} removed, {} stored", accountId, deleted, saved.size());
        return saved;
    }

    /**
     * Loads the account's margin row (or starts a new one), lets {@code update} fill it in
     * and saves it.
     */
    @Transactional
    public MarginEntity upsertMargin(Long accountId, UnaryOperator<MarginEntity> update) {
        MarginEntity row = marginJpaRepository
                .findByAccountId(accountId)
                .orElseGet(() -> MarginEntity.builder().accountId(accountId).build());
        MarginEntity saved = marginJpaRepository.save(update.apply(row));
        log.info("Upserted margins for account {}", accountId);
        return saved;
    }

    /** Drops every stored row of the account. */
    @Transactional
    public void deleteSnapshots(Long accountId) {
        int holdings = holdingJpaRepository.deleteAllForAccount(accountId);
        int positions = positionJpaRepository.deleteAllForAccount(accountId);
        int margins = marginJpaRepository.deleteAllForAccount(accountId);
        log.info("Deleted snapshots for account {}: {} holdings, {} positions, {} margin rows",
                accountId, holdings, positions, margins);
    }

    @Transactional(readOnly = true)
    public List<HoldingEntity> findHoldings(Long accountId) {
        return holdingJpaRepository.findByAccountIdOrderByTradingSymbolAsc(accountId);
    }

    @Transactional(readOnly = true)
    public List<PositionEntity> findPositions(Long accountId) {
        return positionJpaRepository.findByAccountIdOrderByTradingSymbolAsc(accountId);
    }

    @Transactional(readOnly = true)
    public MarginEntity findMargin(Long accountId) {
        return marginJpaRepository.findByAccountId(accountId).orElse(null);
    }
}
