package com.portfoliosync.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the holdings table.
 * Each sync replaces every row of the account with the broker's current holdings.
 */
@Entity
@Table(name = "holdings", indexes = @Index(name = "idx_holdings_account_id", columnList = "account_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HoldingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false)
    private Long accountId;

    @Column(name = "trading_symbol", length = 50)
    private String tradingSymbol;

    @Column(length = 20)
    private String exchange;

    @Column(length = 20)
    private String isin;

    @Column(length = 10)
    private String product;

    @Column(name = "instrument_token", length = 20)
    private String instrumentToken;

    private int quantity;

    @Column(name = "t1_quantity")
    private int t1Quantity;

    @Column(name = "realised_quantity")
    private int realisedQuantity;

    @Column(name = "collateral_quantity")
    private int collateralQuantity;

    @Column(name = "average_price", precision = 15, scale = 2)
    private BigDecimal averagePrice;

    @Column(name = "last_price", precision = 15, scale = 2)
    private BigDecimal lastPrice;

    @Column(name = "market_value", precision = 15, scale = 2)
    private BigDecimal marketValue;

    @Column(precision = 15, scale = 2)
    private BigDecimal pnl;

    @Column(name = "pnl_percentage", precision = 9, scale = 2)
    private BigDecimal pnlPercentage;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
