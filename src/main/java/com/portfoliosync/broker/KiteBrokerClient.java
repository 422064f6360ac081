package com.portfoliosync.broker;

import com.portfoliosync.broker.mapper.KiteHoldingMapper;
import com.portfoliosync.broker.mapper.KiteMarginMapper;
import com.portfoliosync.broker.mapper.KitePositionMapper;
import com.portfoliosync.domain.model.Holding;
import com.portfoliosync.domain.model.MarginOrder;
import com.portfoliosync.domain.model.OrderMargin;
import com.portfoliosync.domain.model.PositionBook;
import com.portfoliosync.domain.model.SegmentMargin;
import com.portfoliosync.domain.model.SessionGrant;
import com.portfoliosync.domain.model.UserProfile;
import com.portfoliosync.exception.BrokerException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.Profile;
import com.zerodhatech.models.User;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link BrokerClient} backed by one {@link KiteConnect} instance (one API key).
 *
 * <p>Data calls go through the Kite SDK. Order margin calculation is not exposed by the
 * SDK, so it is a direct {@code POST /margins/orders} through the shared {@link RestClient}
 * using Kite's {@code token api_key:access_token} authorization scheme.
 *
 * <p>All SDK and HTTP failures are translated by {@link KiteErrorTranslator}.
 */
public class KiteBrokerClient implements BrokerClient {

    private static final Logger log = LoggerFactory.getLogger(KiteBrokerClient.class);

    private final String apiKey;
    private final KiteConnect kiteConnect;
    private final RestClient kiteRestClient;
    private final KiteErrorTranslator errorTranslator;
    private final KiteHoldingMapper holdingMapper;
    private final KitePositionMapper positionMapper;
    private final KiteMarginMapper marginMapper;

    private volatile String accessToken;

    public KiteBrokerClient(
            String apiKey,
            KiteConnect kiteConnect,
            RestClient kiteRestClient,
            KiteErrorTranslator errorTranslator,
            KiteHoldingMapper holdingMapper,
            KitePositionMapper positionMapper,
            KiteMarginMapper marginMapper) {
        this.apiKey = apiKey;
        this.kiteConnect = kiteConnect;
        this.kiteRestClient = kiteRestClient;
        this.errorTranslator = errorTranslator;
        this.holdingMapper = holdingMapper;
        this.positionMapper = positionMapper;
        this.marginMapper = marginMapper;
    }

    @Override
    public String getApiKey() {
        return apiKey;
    }

    /**
     * Per the Kite SDK sample: after generateSession(), set accessToken, publicToken
     * and userId on the KiteConnect instance.
     */
    @Override
    public SessionGrant exchangeSession(String requestToken, String apiSecret) {
        try {
            User user = kiteConnect.generateSession(requestToken, apiSecret);

            kiteConnect.setAccessToken(user.accessToken);
            kiteConnect.setPublicToken(user.publicToken);
            kiteConnect.setUserId(user.userId);
            this.accessToken = user.accessToken;

            log.info("Kite session created for user {}", user.userId);
            return SessionGrant.builder()
                    .accessToken(user.accessToken)
                    .userId(user.userId)
                    .userName(user.userName)
                    .build();
        } catch (KiteException e) {
            throw errorTranslator.translate("exchange request token", apiKey, e);
        } catch (JSONException | IOException e) {
            throw errorTranslator.translate("exchange request token", e);
        }
    }

    @Override
    public UserProfile getProfile() {
        try {
            Profile profile = kiteConnect.getProfile();
            return UserProfile.builder()
                    .userId(kiteConnect.getUserId())
                    .userName(profile.userName)
                    .email(profile.email)
                    .build();
        } catch (KiteException e) {
            throw errorTranslator.translate("fetch profile", apiKey, e);
        } catch (JSONException | IOException e) {
            throw errorTranslator.translate("fetch profile", e);
        }
    }

    @Override
    public List<Holding> getHoldings() {
        try {
            return holdingMapper.toDomainList(kiteConnect.getHoldings());
        } catch (KiteException e) {
            throw errorTranslator.translate("fetch holdings", apiKey, e);
        } catch (JSONException | IOException e) {
            throw errorTranslator.translate("fetch holdings", e);
        }
    }

    @Override
    public PositionBook getPositions() {
        try {
            return positionMapper.toPositionBook(kiteConnect.getPositions());
        } catch (KiteException e) {
            throw errorTranslator.translate("fetch positions", apiKey, e);
        } catch (JSONException | IOException e) {
            throw errorTranslator.translate("fetch positions", e);
        }
    }

    @Override
    public SegmentMargin getMargins(String segment) {
        try {
            return marginMapper.toDomain(segment, kiteConnect.getMargins(segment));
        } catch (KiteException e) {
            throw errorTranslator.translate("fetch " + segment + " margins", apiKey, e);
        } catch (JSONException | IOException e) {
            throw errorTranslator.translate("fetch " + segment + " margins", e);
        }
    }

    @Override
    public List<OrderMargin> calculateOrderMargins(List<MarginOrder> orders) {
        if (orders == null || orders.isEmpty()) {
            return List.of();
        }

        KiteOrderMarginResponse response;
        try {
            response = kiteRestClient
                    .post()
                    .uri("/margins/orders")
                    .header(HttpHeaders.AUTHORIZATION, "token " + apiKey + ":" + accessToken)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(orders.stream().map(KiteOrderMarginRequest::from).toList())
                    .retrieve()
                    .body(KiteOrderMarginResponse.class);
        } catch (RestClientResponseException e) {
            throw errorTranslator.translate("calculate order margins", apiKey, e);
        } catch (RestClientException e) {
            throw errorTranslator.translate("calculate order margins", e);
        }

        if (response == null || !"success".equals(response.getStatus()) || response.getData() == null) {
            throw new BrokerException("Unexpected order margin response: status="
                    + (response != null ? response.getStatus() : null));
        }

        return response.getData().stream()
                .filter(Objects::nonNull)
                .filter(entry -> entry.getTradingSymbol() != null && entry.getTotal() != null)
                .map(entry -> OrderMargin.builder()
                        .tradingSymbol(entry.getTradingSymbol())
                        .exchange(entry.getExchange())
                        .total(entry.getTotal())
                        .build())
                .toList();
    }
}
