package com.portfoliosync.sync;

import com.portfoliosync.broker.BrokerClient;
import com.portfoliosync.domain.model.MarginOrder;
import com.portfoliosync.domain.model.OrderMargin;
import com.portfoliosync.entity.PositionEntity;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fills {@link PositionEntity#getMarginBlocked()} from one batched order-margin call.
 *
 * <p>Each open position is priced as the order that would open it: same side, absolute
 * quantity, LIMIT at the last price when known, otherwise MARKET. Any failure is absorbed:
 * every row keeps a null margin and the sync carries on. This call is never retried.
 */
@Component
public class PositionMarginEnricher {

    private static final Logger log = LoggerFactory.getLogger(PositionMarginEnricher.class);

    static final String DEFAULT_PRODUCT = "NRML";
    static final String VARIETY_REGULAR = "regular";

    public void enrich(BrokerClient client, List<PositionEntity> positions) {
        List<MarginOrder> orders = positions.stream()
                .filter(p -> p.getQuantity() != 0)
                .map(PositionMarginEnricher::toMarginOrder)
                .toList();
        if (orders.isEmpty()) {
            return;
        }

        List<OrderMargin> margins;
        try {
            margins = client.calculateOrderMargins(orders);
        } catch (RuntimeException e) {
            log.warn("Order margin calculation failed, storing positions without margin: {}", e.getMessage());
            return;
        }

        Map<String, BigDecimal> marginBySymbol = new HashMap<>();
        for (OrderMargin margin : margins) {
            marginBySymbol.put(margin.getTradingSymbol(), margin.getTotal());
        }
        for (PositionEntity position : positions) {
            if (position.getQuantity() != 0) {
                position.setMarginBlocked(marginBySymbol.get(position.getTradingSymbol()));
            }
        }
        log.debug("Margin blocked resolved for {}/{} positions", marginBySymbol.size(), orders.size());
    }

    static MarginOrder toMarginOrder(PositionEntity position) {
        BigDecimal lastPrice = position.getLastPrice();
        boolean priced = lastPrice != null && lastPrice.signum() > 0;
        boolean knownProduct = position.getProduct() != null && !"UNKNOWN".equals(position.getProduct());

        return MarginOrder.builder()
                .exchange(position.getExchange())
                .tradingSymbol(position.getTradingSymbol())
                .transactionType(position.getSide().name())
                .variety(VARIETY_REGULAR)
                .product(knownProduct ? position.getProduct() : DEFAULT_PRODUCT)
                .orderType(priced ? "LIMIT" : "MARKET")
                .quantity(Math.abs(position.getQuantity()))
                .price(priced ? lastPrice : BigDecimal.ZERO)
                .triggerPrice(BigDecimal.ZERO)
                .build();
    }
}
