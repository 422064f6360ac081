package com.portfoliosync.unit.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.portfoliosync.broker.LoginAutomation;
import com.portfoliosync.config.SyncConfig;
import com.portfoliosync.domain.enums.SyncStatus;
import com.portfoliosync.domain.model.AccountSyncResult;
import com.portfoliosync.domain.model.LoginCredentials;
import com.portfoliosync.domain.model.SyncAllResult;
import com.portfoliosync.entity.AccountEntity;
import com.portfoliosync.exception.BrokerErrorKind;
import com.portfoliosync.exception.BrokerException;
import com.portfoliosync.exception.BusinessException;
import com.portfoliosync.repository.jpa.AccountJpaRepository;
import com.portfoliosync.service.AccountService;
import com.portfoliosync.session.SessionManager;
import com.portfoliosync.sync.AccountSyncService;
import com.portfoliosync.sync.HoldingSyncService;
import com.portfoliosync.sync.MarginSyncService;
import com.portfoliosync.sync.PositionSyncService;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for {@link AccountSyncService}: single-account preconditions and ordering,
 * and the sequential sync-all run with skipped and failing accounts.
 */
@ExtendWith(MockitoExtension.class)
class AccountSyncServiceTest {

    @Mock
    private AccountService accountService;

    @Mock
    private AccountJpaRepository accountJpaRepository;

    @Mock
    private HoldingSyncService holdingSyncService;

    @Mock
    private PositionSyncService positionSyncService;

    @Mock
    private MarginSyncService marginSyncService;

    @Mock
    private LoginAutomation loginAutomation;

    @Mock
    private SessionManager sessionManager;

    private AccountSyncService accountSyncService;

    @BeforeEach
    void setUp() {
        SyncConfig syncConfig = new SyncConfig();
        syncConfig.getAccounts().setPauseBetween(Duration.ZERO);
        accountSyncService = new AccountSyncService(
                accountService,
                accountJpaRepository,
                holdingSyncService,
                positionSyncService,
                marginSyncService,
                loginAutomation,
                sessionManager,
                syncConfig);
    }

    private static AccountEntity.AccountEntityBuilder complete(long id, String name) {
        return AccountEntity.builder()
                .id(id)
                .name(name)
                .apiKey("key-" + id)
                .apiSecret("secret-" + id)
                .requestToken("token-" + id)
                .userId("AB" + id)
                .password("password")
                .totpSecret("JBSWY3DPEHPK3PXP");
    }

    @Nested
    @DisplayName("Single account")
    class SyncAccountTests {

        @Test
        @DisplayName("syncs holdings, positions and margins in order, then stamps last sync")
        void syncsInOrder() {
            AccountEntity account = complete(1L, "main").build();
            when(accountService.getAccount(1L)).thenReturn(account);

            AccountSyncResult result = accountSyncService.syncAccount(1L);

            assertThat(result.getStatus()).isEqualTo(SyncStatus.SUCCESS);
            assertThat(result.getAccountName()).isEqualTo("main");
            InOrder order = inOrder(holdingSyncService, positionSyncService, marginSyncService, accountService);
            order.verify(holdingSyncService).syncHoldings(account);
            order.verify(positionSyncService).syncPositions(account);
            order.verify(marginSyncService).syncMargins(account);
            order.verify(accountService).markSynced(account);
        }

        @Test
        @DisplayName("missing API secret is rejected before any broker call")
        void missingCredentials() {
            when(accountService.getAccount(1L)).thenReturn(complete(1L, "main").apiSecret(null).build());

            assertThatThrownBy(() -> accountSyncService.syncAccount(1L))
                    .isInstanceOf(BusinessException.class)
                    .hasMessageContaining("credentials not configured");
            verifyNoInteractions(holdingSyncService, positionSyncService, marginSyncService);
        }

        @Test
        @DisplayName("missing request token is rejected")
        void missingRequestToken() {
            when(accountService.getAccount(1L)).thenReturn(complete(1L, "main").requestToken(" ").build());

            assertThatThrownBy(() -> accountSyncService.syncAccount(1L))
                    .isInstanceOf(BusinessException.class)
                    .hasMessageContaining("Authentication required");
        }

        @Test
        @DisplayName("a failing step stops the sync and last sync is not stamped")
        void failingStep() {
            AccountEntity account = complete(1L, "main").build();
            when(accountService.getAccount(1L)).thenReturn(account);
            when(positionSyncService.syncPositions(account))
                    .thenThrow(new BrokerException(BrokerErrorKind.TOKEN_EXPIRED, "Token is invalid or has expired."));

            assertThatThrownBy(() -> accountSyncService.syncAccount(1L)).isInstanceOf(BrokerException.class);

            verify(marginSyncService, never()).syncMargins(any());
            verify(accountService, never()).markSynced(any());
        }
    }

    @Nested
    @DisplayName("Sync all")
    class SyncAllTests {

        @Test
        @DisplayName("skips incomplete accounts, records failures and carries on")
        void mixedOutcome() {
            AccountEntity noTotp = complete(1L, "no-totp").totpSecret(null).build();
            AccountEntity failing = complete(2L, "failing").build();
            AccountEntity healthy = complete(3L, "healthy").build();
            when(accountJpaRepository.findByActiveTrueOrderByIdAsc()).thenReturn(List.of(noTotp, failing, healthy));
            when(loginAutomation.obtainRequestToken(any(LoginCredentials.class))).thenReturn("fresh-token");
            when(holdingSyncService.syncHoldings(failing))
                    .thenThrow(new BrokerException(BrokerErrorKind.OTHER, "Failed to fetch holdings: Gateway timeout"));
            when(holdingSyncService.syncHoldings(healthy)).thenReturn(List.of());

            SyncAllResult result = accountSyncService.syncAllAccounts();

            assertThat(result.getSyncedAccounts()).isEqualTo(1);
            assertThat(result.getFailedAccounts()).isEqualTo(2);
            assertThat(result.getResults())
                    .extracting(AccountSyncResult::getStatus)
                    .containsExactly(SyncStatus.SKIPPED, SyncStatus.FAILED, SyncStatus.SUCCESS);
            assertThat(result.getResults().get(0).getMessage()).contains("TOTP");
            assertThat(result.getResults().get(1).getMessage()).contains("Gateway timeout");

            verify(loginAutomation, times(2)).obtainRequestToken(any(LoginCredentials.class));
            verify(accountService, never()).markSynced(failing);
            verify(accountService).markSynced(healthy);
        }

        @Test
        @DisplayName("each login stores the new token and drops the previous session before syncing")
        void loginThenReset() {
            AccountEntity account = complete(1L, "main").build();
            when(accountJpaRepository.findByActiveTrueOrderByIdAsc()).thenReturn(List.of(account));
            when(loginAutomation.obtainRequestToken(any(LoginCredentials.class))).thenReturn("fresh-token");

            accountSyncService.syncAllAccounts();

            ArgumentCaptor<LoginCredentials> credentials = ArgumentCaptor.forClass(LoginCredentials.class);
            InOrder order = inOrder(loginAutomation, accountService, sessionManager, holdingSyncService);
            order.verify(loginAutomation).obtainRequestToken(credentials.capture());
            order.verify(accountService).updateRequestToken(account, "fresh-token");
            order.verify(sessionManager).resetSession();
            order.verify(holdingSyncService).syncHoldings(account);

            assertThat(credentials.getValue().getApiKey()).isEqualTo("key-1");
            assertThat(credentials.getValue().getUserId()).isEqualTo("AB1");
            assertThat(credentials.getValue().getTotpSecret()).isEqualTo("JBSWY3DPEHPK3PXP");
        }

        @Test
        @DisplayName("a login failure marks only that account as failed")
        void loginFailure() {
            AccountEntity account = complete(1L, "main").build();
            when(accountJpaRepository.findByActiveTrueOrderByIdAsc()).thenReturn(List.of(account));
            when(loginAutomation.obtainRequestToken(any(LoginCredentials.class)))
                    .thenThrow(new BrokerException("request_token not found in redirect URL"));

            SyncAllResult result = accountSyncService.syncAllAccounts();

            assertThat(result.getSyncedAccounts()).isZero();
            assertThat(result.getFailedAccounts()).isEqualTo(1);
            assertThat(result.getResults().get(0).getStatus()).isEqualTo(SyncStatus.FAILED);
            verifyNoInteractions(holdingSyncService);
        }

        @Test
        @DisplayName("no active accounts is an empty run")
        void noAccounts() {
            when(accountJpaRepository.findByActiveTrueOrderByIdAsc()).thenReturn(List.of());

            SyncAllResult result = accountSyncService.syncAllAccounts();

            assertThat(result.getSyncedAccounts()).isZero();
            assertThat(result.getFailedAccounts()).isZero();
            assertThat(result.getResults()).isEmpty();
        }
    }
}
