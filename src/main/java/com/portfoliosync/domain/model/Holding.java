package com.portfoliosync.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A long-term holding as reported by the broker.
 *
 * <p>Numeric fields are null when the broker omitted them; defaults are applied when
 * the holding is turned into a stored row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Holding {

    private String tradingSymbol;
    private String exchange;
    private String isin;
    private String product;
    private String instrumentToken;

    private Integer quantity;
    private Integer t1Quantity;
    private Integer realisedQuantity;

    /** Quantity pledged as collateral; counts towards market value. */
    private Integer collateralQuantity;

    private BigDecimal averagePrice;
    private BigDecimal lastPrice;
    private BigDecimal pnl;
    private BigDecimal dayChange;
    private BigDecimal dayChangePercentage;
}
