package com.portfoliosync.service;

import com.portfoliosync.api.dto.request.CreateAccountRequest;
import com.portfoliosync.api.dto.request.UpdateAccountRequest;
import com.portfoliosync.config.KiteConfig;
import com.portfoliosync.entity.AccountEntity;
import com.portfoliosync.exception.BusinessException;
import com.portfoliosync.exception.ResourceNotFoundException;
import com.portfoliosync.mapper.AccountMapper;
import com.portfoliosync.repository.jpa.AccountJpaRepository;
import com.portfoliosync.session.SessionManager;
import com.portfoliosync.sync.AccountSnapshotStore;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Account management and the manual Kite OAuth path: building the login URL and
 * capturing the request token from the redirect.
 *
 * <p>Any change to an account's API key, secret or request token drops the broker session,
 * so the next sync exchanges the new credentials.
 */
@Service
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final AccountJpaRepository accountJpaRepository;
    private final SessionManager sessionManager;
    private final AccountSnapshotStore accountSnapshotStore;
    private final KiteConfig kiteConfig;
    private final Clock clock;

    private final AccountMapper accountMapper = Mappers.getMapper(AccountMapper.class);

    public AccountService(
            AccountJpaRepository accountJpaRepository,
            SessionManager sessionManager,
            AccountSnapshotStore accountSnapshotStore,
            KiteConfig kiteConfig,
            Clock clock) {
        this.accountJpaRepository = accountJpaRepository;
        this.sessionManager = sessionManager;
        this.accountSnapshotStore = accountSnapshotStore;
        this.kiteConfig = kiteConfig;
        this.clock = clock;
    }

    public List<AccountEntity> getAccounts() {
        return accountJpaRepository.findAll();
    }

    public AccountEntity getAccount(Long id) {
        return accountJpaRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Account", id));
    }

    @Transactional
    public AccountEntity createAccount(CreateAccountRequest request) {
        accountJpaRepository.findByName(request.getName()).ifPresent(existing -> {
            throw new BusinessException("Account with name '" + request.getName() + "' already exists");
        });

        AccountEntity account = accountMapper.toEntity(request);
        LocalDateTime now = LocalDateTime.now(clock);
        account.setCreatedAt(now);
        account.setUpdatedAt(now);
        AccountEntity saved = accountJpaRepository.save(account);
        log.info("Created account {} (id={})", saved.getName(), saved.getId());
        return saved;
    }

    @Transactional
    public AccountEntity updateAccount(Long id, UpdateAccountRequest request) {
        AccountEntity account = getAccount(id);
        if (request.getName() != null && !request.getName().equals(account.getName())) {
            accountJpaRepository.findByName(request.getName()).ifPresent(existing -> {
                throw new BusinessException("Account with name '" + request.getName() + "' already exists");
            });
        }

        String apiKey = account.getApiKey();
        String apiSecret = account.getApiSecret();
        String requestToken = account.getRequestToken();

        accountMapper.updateFromRequest(request, account);
        account.setUpdatedAt(LocalDateTime.now(clock));
        AccountEntity saved = accountJpaRepository.save(account);

        boolean credentialsChanged = !Objects.equals(apiKey, saved.getApiKey())
                || !Objects.equals(apiSecret, saved.getApiSecret())
                || !Objects.equals(requestToken, saved.getRequestToken());
        if (credentialsChanged) {
            sessionManager.resetSession();
        }
        log.info("Updated account {} (id={}, credentialsChanged={})", saved.getName(), id, credentialsChanged);
        return saved;
    }

    /** Removes the account together with its stored holdings, positions and margins. */
    @Transactional
    public void deleteAccount(Long id) {
        AccountEntity account = getAccount(id);
        accountSnapshotStore.deleteSnapshots(id);
        accountJpaRepository.delete(account);
        log.info("Deleted account {} (id={})", account.getName(), id);
    }

    /** Kite OAuth login URL for the account's API key. */
    public String getLoginUrl(Long id) {
        AccountEntity account = getAccount(id);
        if (account.getApiKey() == null || account.getApiKey().isBlank()) {
            throw new BusinessException("Account '" + account.getName() + "' has no API key configured");
        }
        return kiteConfig.loginUrlFor(account.getApiKey());
    }

    /**
     * Stores the request token from the Kite OAuth redirect. The current broker session is
     * dropped, since logging in again invalidates the previous access token.
     */
    @Transactional
    public AccountEntity captureRequestToken(String accountName, String requestToken, String status) {
        if (!"success".equals(status) || requestToken == null || requestToken.isBlank()) {
            throw new BusinessException("Kite login did not complete for account '" + accountName + "' (status="
                    + status + ")");
        }

        AccountEntity account = accountJpaRepository
                .findByName(accountName)
                .orElseThrow(() -> new ResourceNotFoundException("Account", accountName));
        account.setRequestToken(requestToken);
        account.setUpdatedAt(LocalDateTime.now(clock));
        AccountEntity saved = accountJpaRepository.save(account);

        sessionManager.resetSession();
        log.info("Captured request token for account {}", accountName);
        return saved;
    }

    @Transactional
    public void updateRequestToken(AccountEntity account, String requestToken) {
        account.setRequestToken(requestToken);
        account.setUpdatedAt(LocalDateTime.now(clock));
        accountJpaRepository.save(account);
    }

    @Transactional
    public void markSynced(AccountEntity account) {
        LocalDateTime now = LocalDateTime.now(clock);
        account.setLastSync(now);
        account.setUpdatedAt(now);
        accountJpaRepository.save(account);
    }
}
