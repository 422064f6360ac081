package com.portfoliosync.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Funds and utilisation for one trading segment ("equity" or "commodity"). */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentMargin {

    private String segment;
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
}
