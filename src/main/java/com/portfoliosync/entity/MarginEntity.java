package com.portfoliosync.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the margins table. One row per account, upserted on every margin sync.
 */
@Entity
@Table(name = "margins")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MarginEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false, unique = true)
    private Long accountId;

    @Column(length = 20)
    private String segment;

    private boolean enabled;

    @Column(precision = 15, scale = 2)
    private BigDecimal net;

    @Column(name = "available_cash", precision = 15, scale = 2)
    private BigDecimal availableCash;

    @Column(precision = 15, scale = 2)
    private BigDecimal collateral;

    @Column(name = "intraday_payin", precision = 15, scale = 2)
    private BigDecimal intradayPayin;

    @Column(name = "adhoc_margin", precision = 15, scale = 2)
    private BigDecimal adhocMargin;

    @Column(name = "live_balance", precision = 15, scale = 2)
    private BigDecimal liveBalance;

    @Column(precision = 15, scale = 2)
    private BigDecimal debits;

    @Column(precision = 15, scale = 2)
    private BigDecimal span;

    @Column(precision = 15, scale = 2)
    private BigDecimal exposure;

    @Column(name = "option_premium", precision = 15, scale = 2)
    private BigDecimal optionPremium;

    @Column(name = "m2m_realised", precision = 15, scale = 2)
    private BigDecimal m2mRealised;

    @Column(name = "m2m_unrealised", precision = 15, scale = 2)
    private BigDecimal m2mUnrealised;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
