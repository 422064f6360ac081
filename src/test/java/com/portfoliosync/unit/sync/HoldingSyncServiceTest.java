package com.portfoliosync.unit.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.portfoliosync.broker.BrokerClient;
import com.portfoliosync.config.SyncConfig;
import com.portfoliosync.domain.model.AccountCredentials;
import com.portfoliosync.domain.model.Holding;
import com.portfoliosync.entity.AccountEntity;
import com.portfoliosync.entity.HoldingEntity;
import com.portfoliosync.exception.BrokerErrorKind;
import com.portfoliosync.exception.BrokerException;
import com.portfoliosync.mapper.HoldingSnapshotMapper;
import com.portfoliosync.session.RetryOrchestrator;
import com.portfoliosync.session.SessionManager;
import com.portfoliosync.sync.AccountSnapshotStore;
import com.portfoliosync.sync.HoldingSyncService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HoldingSyncServiceTest {

    @Mock
    private SessionManager sessionManager;

    @Mock
    private BrokerClient brokerClient;

    @Mock
    private AccountSnapshotStore accountSnapshotStore;

    @Captor
    private ArgumentCaptor<List<HoldingEntity>> rowsCaptor;

    @Captor
    private ArgumentCaptor<AccountCredentials> credentialsCaptor;

    private HoldingSyncService holdingSyncService;

    private final AccountEntity account = AccountEntity.builder()
            .id(5L)
            .name("family")
            .apiKey("api-key")
            .apiSecret("api-secret")
            .requestToken("request-token")
            .build();

    @BeforeEach
    void setUp() {
        SyncConfig syncConfig = new SyncConfig();
        syncConfig.getRetry().setBackoff(Duration.ofMillis(1));
        holdingSyncService = new HoldingSyncService(
                new RetryOrchestrator(sessionManager, syncConfig),
                new HoldingSnapshotMapper(),
                accountSnapshotStore,
                Clock.fixed(Instant.parse("2025-02-03T04:45:00Z"), ZoneOffset.UTC));

        when(sessionManager.ensureSession(any())).thenReturn(brokerClient);
    }

    @Test
    @DisplayName("replaces stored holdings and returns the broker's list")
    void replacesHoldings() {
        List<Holding> holdings = List.of(
                Holding.builder().tradingSymbol("INFY").quantity(10).lastPrice(new BigDecimal("1500")).build(),
                Holding.builder().tradingSymbol("TCS").quantity(2).lastPrice(new BigDecimal("4000")).build());
        when(brokerClient.getHoldings()).thenReturn(holdings);

        List<Holding> result = holdingSyncService.syncHoldings(account);

        assertThat(result).isSameAs(holdings);
        verify(accountSnapshotStore).replaceHoldings(eq(5L), rowsCaptor.capture());
        assertThat(rowsCaptor.getValue())
                .extracting(HoldingEntity::getMarketValue)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("15000"), new BigDecimal("8000"));
    }

    @Test
    @DisplayName("the session is requested with the account's own credentials")
    void usesAccountCredentials() {
        when(brokerClient.getHoldings()).thenReturn(List.of());

        holdingSyncService.syncHoldings(account);

        verify(sessionManager).ensureSession(credentialsCaptor.capture());
        assertThat(credentialsCaptor.getValue().getApiKey()).isEqualTo("api-key");
        assertThat(credentialsCaptor.getValue().getApiSecret()).isEqualTo("api-secret");
        assertThat(credentialsCaptor.getValue().getRequestToken()).isEqualTo("request-token");
    }

    @Test
    @DisplayName("token expiry is not retried and nothing is stored")
    void tokenExpiredIsTerminal() {
        when(brokerClient.getHoldings())
                .thenThrow(new BrokerException(BrokerErrorKind.TOKEN_EXPIRED, "Token is invalid or has expired."));

        assertThatThrownBy(() -> holdingSyncService.syncHoldings(account))
                .isInstanceOf(BrokerException.class)
                .satisfies(e -> assertThat(((BrokerException) e).isTokenExpired()).isTrue());

        verify(accountSnapshotStore, never()).replaceHoldings(anyLong(), anyList());
        verify(sessionManager, never()).resetSession();
    }
}
