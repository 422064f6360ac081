package com.portfoliosync.api.dto.response;

import com.portfoliosync.domain.enums.PositionSide;
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
public class PositionResponse {

    private Long id;
    private Long accountId;
    private String tradingSymbol;
    private String exchange;
    private String product;
    private int quantity;
    private PositionSide side;
    private BigDecimal averagePrice;
    private BigDecimal lastPrice;
    private BigDecimal marketValue;
    private BigDecimal pnl;
    private BigDecimal pnlPercentage;

    /** Null when the broker's margin calculation was unavailable at sync time. */
    private BigDecimal marginBlocked;

    private LocalDateTime syncedAt;
}
