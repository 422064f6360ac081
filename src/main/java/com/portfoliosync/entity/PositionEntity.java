package com.portfoliosync.entity;

import com.portfoliosync.domain.enums.PositionSide;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
 * JPA entity for the positions table.
 * Holds the account's net positions from the last sync, with the margin the broker
 * blocks for each. {@code marginBlocked} is null when the margin lookup was unavailable.
 */
@Entity
@Table(name = "positions", indexes = @Index(name = "idx_positions_account_id", columnList = "account_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false)
    private Long accountId;

    @Column(name = "trading_symbol", length = 50)
    private String tradingSymbol;

    @Column(length = 20)
    private String exchange;

    /** CNC, MIS, NRML. */
    @Column(length = 10)
    private String product;

    /** Signed: positive = long, negative = short. */
    private int quantity;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private PositionSide side;

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

    @Column(name = "margin_blocked", precision = 15, scale = 2)
    private BigDecimal marginBlocked;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
