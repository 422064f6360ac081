package com.portfoliosync.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;

/**
 * A hypothetical order submitted to the broker's order-margin calculator.
 * Open positions are expressed as orders to learn how much margin they block.
 */
@Getter
@Builder
public class MarginOrder {

    private final String exchange;
    private final String tradingSymbol;
    private final String transactionType;
    private final String variety;
    private final String product;
    private final String orderType;
    private final int quantity;
    private final BigDecimal price;
    private final BigDecimal triggerPrice;
}
