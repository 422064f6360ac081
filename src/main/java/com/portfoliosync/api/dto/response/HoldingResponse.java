package com.portfoliosync.api.dto.response;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HoldingResponse {

    private Long id;
    private Long accountId;
    private String tradingSymbol;
    private String exchange;
    private String isin;
    private String product;
    private int quantity;
    private int t1Quantity;
    private int realisedQuantity;
    private int collateralQuantity;
    private BigDecimal averagePrice;
    private BigDecimal lastPrice;
    private BigDecimal marketValue;
    private BigDecimal pnl;
    private BigDecimal pnlPercentage;
    private LocalDateTime syncedAt;
}
