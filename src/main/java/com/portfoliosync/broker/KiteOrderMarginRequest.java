package com.portfoliosync.broker;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.portfoliosync.domain.model.MarginOrder;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;

/** One element of the {@code POST /margins/orders} body, in Kite's snake_case. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
class KiteOrderMarginRequest {

    @JsonProperty("exchange")
    private final String exchange;

    @JsonProperty("tradingsymbol")
    private final String tradingSymbol;

    @JsonProperty("transaction_type")
    private final String transactionType;

    @JsonProperty("variety")
    private final String variety;

    @JsonProperty("product")
    private final String product;

    @JsonProperty("order_type")
    private final String orderType;

    @JsonProperty("quantity")
    private final int quantity;

    @JsonProperty("price")
    private final BigDecimal price;

    @JsonProperty("trigger_price")
    private final BigDecimal triggerPrice;

    static KiteOrderMarginRequest from(MarginOrder order) {
        return KiteOrderMarginRequest.builder()
                .exchange(order.getExchange())
                .tradingSymbol(order.getTradingSymbol())
                .transactionType(order.getTransactionType())
                .variety(order.getVariety())
                .product(order.getProduct())
                .orderType(order.getOrderType())
                .quantity(order.getQuantity())
                .price(order.getPrice())
                .triggerPrice(order.getTriggerPrice())
                .build();
    }
}
