package com.portfoliosync.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;

/** Broker-computed margin requirement for one {@link MarginOrder}. */
@Getter
@Builder
public class OrderMargin {

    private final String tradingSymbol;
    private final String exchange;
    private final BigDecimal total;
}
