package com.portfoliosync.sync;

import com.portfoliosync.broker.LoginAutomation;
import com.portfoliosync.config.SyncConfig;
import com.portfoliosync.domain.enums.SyncStatus;
import com.portfoliosync.domain.model.AccountSyncResult;
import com.portfoliosync.domain.model.SyncAllResult;
import com.portfoliosync.entity.AccountEntity;
import com.portfoliosync.exception.BusinessException;
import com.portfoliosync.mapper.AccountMapper;
import com.portfoliosync.repository.jpa.AccountJpaRepository;
import com.portfoliosync.service.AccountService;
import com.portfoliosync.session.SessionManager;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Syncs whole accounts: holdings, then positions, then margins.
 *
 * <p>Sync-all walks the active accounts one at a time so the broker never sees concurrent
 * sessions from us. Each account gets a fresh request token from {@link LoginAutomation}
 * first. A failing account is recorded and the run moves on.
 */
@Service
public class AccountSyncService {

    private static final Logger log = LoggerFactory.getLogger(AccountSyncService.class);

    private final AccountService accountService;
    private final AccountJpaRepository accountJpaRepository;
    private final HoldingSyncService holdingSyncService;
    private final PositionSyncService positionSyncService;
    private final MarginSyncService marginSyncService;
    private final LoginAutomation loginAutomation;
    private final SessionManager sessionManager;
    private final Duration pauseBetweenAccounts;

    private final AccountMapper accountMapper = Mappers.getMapper(AccountMapper.class);

    public AccountSyncService(
            AccountService accountService,
            AccountJpaRepository accountJpaRepository,
            HoldingSyncService holdingSyncService,
            PositionSyncService positionSyncService,
            MarginSyncService marginSyncService,
            LoginAutomation loginAutomation,
            SessionManager sessionManager,
            SyncConfig syncConfig) {
        this.accountService = accountService;
        this.accountJpaRepository = accountJpaRepository;
        this.holdingSyncService = holdingSyncService;
        this.positionSyncService = positionSyncService;
        this.marginSyncService = marginSyncService;
        this.loginAutomation = loginAutomation;
        this.sessionManager = sessionManager;
        this.pauseBetweenAccounts = syncConfig.getAccounts().getPauseBetween();
    }

    /**
     * Syncs one account with its stored request token.
     *
     * @throws BusinessException if the account lacks API credentials or a request token
     */
    public AccountSyncResult syncAccount(Long accountId) {
        AccountEntity account = accountService.getAccount(accountId);
        if (isBlank(account.getApiKey()) || isBlank(account.getApiSecret())) {
            throw new BusinessException("Account credentials not configured. "
                    + "Please configure API key and API secret for this account.");
        }
        if (isBlank(account.getRequestToken())) {
            throw new BusinessException("Authentication required. "
                    + "Please complete the login flow to get a request token.");
        }

        syncAccountData(account);
        return AccountSyncResult.builder()
                .accountId(account.getId())
                .accountName(account.getName())
                .status(SyncStatus.SUCCESS)
                .message("Account synced successfully")
                .build();
    }

    public SyncAllResult syncAllAccounts() {
        List<AccountEntity> accounts = accountJpaRepository.findByActiveTrueOrderByIdAsc();
        log.info("Starting sync of {} active accounts", accounts.size());

        List<AccountSyncResult> results = new ArrayList<>();
        int synced = 0;
        for (int i = 0; i < accounts.size(); i++) {
            AccountSyncResult result = loginAndSync(accounts.get(i));
            results.add(result);
            if (result.getStatus() == SyncStatus.SUCCESS) {
                synced++;
                if (i < accounts.size() - 1) {
                    pause();
                }
            }
        }

        int failed = accounts.size() - synced;
        log.info("Sync all completed: {} successful, {} failed", synced, failed);
        return SyncAllResult.builder()
                .syncedAccounts(synced)
                .failedAccounts(failed)
                .results(results)
                .build();
    }

    private AccountSyncResult loginAndSync(AccountEntity account) {
        String skipReason = skipReason(account);
        if (skipReason != null) {
            log.warn("Skipping account {}: {}", account.getName(), skipReason);
            return result(account, SyncStatus.SKIPPED, skipReason);
        }

        try {
            log.info("Logging in to account {}", account.getName());
            String requestToken = loginAutomation.obtainRequestToken(accountMapper.toLoginCredentials(account));
            accountService.updateRequestToken(account, requestToken);
            // the new login invalidates whatever session we held
            sessionManager.resetSession();

            syncAccountData(account);
            return result(account, SyncStatus.SUCCESS, "Login and data sync completed successfully");
        } catch (RuntimeException e) {
            log.error("Failed to sync account {}: {}", account.getName(), e.getMessage(), e);
            return result(account, SyncStatus.FAILED, e.getMessage() != null ? e.getMessage() : "Unknown error occurred");
        }
    }

    private void syncAccountData(AccountEntity account) {
        log.info("Starting data sync for account {}", account.getName());
        holdingSyncService.syncHoldings(account);
        positionSyncService.syncPositions(account);
        marginSyncService.syncMargins(account);
        accountService.markSynced(account);
        log.info("Data sync completed for account {}", account.getName());
    }

    static String skipReason(AccountEntity account) {
        if (isBlank(account.getApiKey()) || isBlank(account.getApiSecret())) {
            return "Missing API credentials";
        }
        if (isBlank(account.getRequestToken())) {
            return "Missing request token - please complete login flow";
        }
        if (isBlank(account.getTotpSecret())) {
            return "Missing TOTP secret - please configure TOTP secret for this account";
        }
        return null;
    }

    private void pause() {
        if (pauseBetweenAccounts.isZero() || pauseBetweenAccounts.isNegative()) {
            return;
        }
        try {
            Thread.sleep(pauseBetweenAccounts.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while pausing between accounts");
        }
    }

    private static AccountSyncResult result(AccountEntity account, SyncStatus status, String message) {
        return AccountSyncResult.builder()
                .accountId(account.getId())
                .accountName(account.getName())
                .status(status)
                .message(message)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
