package com.portfoliosync.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A day or net position as reported by the broker.
 *
 * <p>Quantity is signed: positive = long, negative = short. Numeric fields are null
 * when the broker omitted them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String tradingSymbol;
    private String exchange;
    private String product;
    private String instrumentToken;

    private Integer quantity;
    private Integer overnightQuantity;

    private BigDecimal averagePrice;
    private BigDecimal lastPrice;

    /** Signed position value; negative for shorts. */
    private BigDecimal value;

    private BigDecimal pnl;
    private BigDecimal m2m;
    private BigDecimal unrealised;
    private BigDecimal realised;
}
