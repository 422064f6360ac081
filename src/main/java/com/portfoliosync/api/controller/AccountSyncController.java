package com.portfoliosync.api.controller;

import com.portfoliosync.api.dto.response.HoldingResponse;
import com.portfoliosync.api.dto.response.MarginResponse;
import com.portfoliosync.api.dto.response.PositionResponse;
import com.portfoliosync.domain.model.AccountSyncResult;
import com.portfoliosync.domain.model.Holding;
import com.portfoliosync.domain.model.PositionBook;
import com.portfoliosync.domain.model.SegmentMargin;
import com.portfoliosync.domain.model.SyncAllResult;
import com.portfoliosync.entity.AccountEntity;
import com.portfoliosync.entity.MarginEntity;
import com.portfoliosync.exception.ResourceNotFoundException;
import com.portfoliosync.mapper.SnapshotResponseMapper;
import com.portfoliosync.service.AccountService;
import com.portfoliosync.sync.AccountSnapshotStore;
import com.portfoliosync.sync.AccountSyncService;
import com.portfoliosync.sync.HoldingSyncService;
import com.portfoliosync.sync.MarginSyncService;
import com.portfoliosync.sync.PositionSyncService;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for syncing accounts with Kite and reading the stored snapshots.
 *
 * <p>The per-domain sync endpoints return the broker's response as fetched; the GET
 * endpoints return what is stored after normalization.
 */
@RestController
@RequestMapping("/api/accounts")
public class AccountSyncController {

    private final AccountService accountService;
    private final AccountSyncService accountSyncService;
    private final HoldingSyncService holdingSyncService;
    private final PositionSyncService positionSyncService;
    private final MarginSyncService marginSyncService;
    private final AccountSnapshotStore accountSnapshotStore;

    private final SnapshotResponseMapper snapshotResponseMapper = Mappers.getMapper(SnapshotResponseMapper.class);

    public AccountSyncController(
            AccountService accountService,
            AccountSyncService accountSyncService,
            HoldingSyncService holdingSyncService,
            PositionSyncService positionSyncService,
            MarginSyncService marginSyncService,
            AccountSnapshotStore accountSnapshotStore) {
        this.accountService = accountService;
        this.accountSyncService = accountSyncService;
        this.holdingSyncService = holdingSyncService;
        this.positionSyncService = positionSyncService;
        this.marginSyncService = marginSyncService;
        this.accountSnapshotStore = accountSnapshotStore;
    }

    @PostMapping("/{id}/sync")
    public AccountSyncResult syncAccount(@PathVariable Long id) {
        return accountSyncService.syncAccount(id);
    }

    @PostMapping("/sync-all")
    public SyncAllResult syncAllAccounts() {
        return accountSyncService.syncAllAccounts();
    }

    @PostMapping("/{id}/holdings/sync")
    public List<Holding> syncHoldings(@PathVariable Long id) {
        return holdingSyncService.syncHoldings(accountService.getAccount(id));
    }

    @PostMapping("/{id}/positions/sync")
    public PositionBook syncPositions(@PathVariable Long id) {
        return positionSyncService.syncPositions(accountService.getAccount(id));
    }

    @PostMapping("/{id}/margins/sync")
    public SegmentMargin syncMargins(@PathVariable Long id) {
        return marginSyncService.syncMargins(accountService.getAccount(id));
    }

    @GetMapping("/{id}/holdings")
    public List<HoldingResponse> getHoldings(@PathVariable Long id) {
        AccountEntity account = accountService.getAccount(id);
        return snapshotResponseMapper.toHoldingResponses(accountSnapshotStore.findHoldings(account.getId()));
    }

    @GetMapping("/{id}/positions")
    public List<PositionResponse> getPositions(@PathVariable Long id) {
        AccountEntity account = accountService.getAccount(id);
        return snapshotResponseMapper.toPositionResponses(accountSnapshotStore.findPositions(account.getId()));
    }

    @GetMapping("/{id}/margins")
    public MarginResponse getMargins(@PathVariable Long id) {
        AccountEntity account = accountService.getAccount(id);
        MarginEntity margin = accountSnapshotStore.findMargin(account.getId());
        if (margin == null) {
            throw new ResourceNotFoundException("Margins for account", id);
        }
        return snapshotResponseMapper.toMarginResponse(margin);
    }
}
