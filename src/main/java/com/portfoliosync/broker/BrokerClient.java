package com.portfoliosync.broker;

import com.portfoliosync.domain.model.Holding;
import com.portfoliosync.domain.model.MarginOrder;
import com.portfoliosync.domain.model.OrderMargin;
import com.portfoliosync.domain.model.PositionBook;
import com.portfoliosync.domain.model.SegmentMargin;
import com.portfoliosync.domain.model.SessionGrant;
import com.portfoliosync.domain.model.UserProfile;
import com.portfoliosync.exception.BrokerException;
import java.util.List;

/**
 * Broker-agnostic view of one brokerage API client bound to a single API key.
 *
 * <p>Every call that reaches the broker throws {@link BrokerException} on failure, classified
 * as token-expired, authentication or other. Callers never see SDK exception types.
 *
 * <p>An instance is not usable for data calls until {@link #exchangeSession} succeeded.
 */
public interface BrokerClient {

    String getApiKey();

    /**
     * Exchanges a short-lived request token for an access token and binds it to this client.
     *
     * @param requestToken token from the OAuth redirect
     * @param apiSecret    the account's API secret, used for the checksum
     * @return the granted session
     */
    SessionGrant exchangeSession(String requestToken, String apiSecret);

    UserProfile getProfile();

    List<Holding> getHoldings();

    PositionBook getPositions();

    SegmentMargin getMargins(String segment);

    /**
     * Asks the broker how much margin each order would block. Returns one entry per order
     * the broker priced, in response order.
     */
    List<OrderMargin> calculateOrderMargins(List<MarginOrder> orders);
}
