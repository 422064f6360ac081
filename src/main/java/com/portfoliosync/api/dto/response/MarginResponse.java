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
public class MarginResponse {

    private Long accountId;
    private String segment;
    private boolean enabled;
    private BigDecimal net;
    private BigDecimal availableCash;
    private BigDecimal collateral;
    private BigDecimal intradayPayin;
    private BigDecimal adhocMargin;
    private BigDecimal liveBalance;
    private BigDecimal debits;
    private BigDecimal span;
    private BigDecimal exposure;
    private BigDecimal optionPremium;
    private BigDecimal m2mRealised;
    private BigDecimal m2mUnrealised;
    private LocalDateTime updatedAt;
}
