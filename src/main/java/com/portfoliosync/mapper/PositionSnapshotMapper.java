package com.portfoliosync.mapper;

import static com.portfoliosync.mapper.HoldingSnapshotMapper.orZero;

import com.portfoliosync.domain.enums.PositionSide;
import com.portfoliosync.domain.model.Position;
import com.portfoliosync.entity.PositionEntity;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Normalizes broker net positions into stored rows.
 *
 * <p>Side follows the sign of quantity. P&L percentage is {@code pnl / |marketValue| × 100}
 * rounded half-up to 2 places, or zero when either operand is zero. Margin blocked is
 * left null here and filled by the enrichment step.
 */
@Component
public class PositionSnapshotMapper {

    static final String DEFAULT_PRODUCT = "UNKNOWN";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public PositionEntity toEntity(Position position, Long accountId, LocalDateTime syncedAt) {
        int quantity = orZero(position.getQuantity());
        BigDecimal marketValue = orZero(position.getValue());
        BigDecimal pnl = orZero(position.getPnl());

        return PositionEntity.builder()
                .accountId(accountId)
                .tradingSymbol(position.getTradingSymbol())
                .exchange(position.getExchange())
                .product(position.getProduct() != null ? position.getProduct() : DEFAULT_PRODUCT)
                .quantity(quantity)
                .side(PositionSide.fromQuantity(quantity))
                .averagePrice(orZero(position.getAveragePrice()))
                .lastPrice(orZero(position.getLastPrice()))
                .marketValue(marketValue)
                .pnl(pnl)
                .pnlPercentage(pnlPercentage(pnl, marketValue))
                .createdAt(syncedAt)
                .build();
    }

    public List<PositionEntity> toEntityList(List<Position> positions, Long accountId, LocalDateTime syncedAt) {
        return positions.stream().map(p -> toEntity(p, accountId, syncedAt)).toList();
    }

    static BigDecimal pnlPercentage(BigDecimal pnl, BigDecimal marketValue) {
        if (pnl.signum() == 0 || marketValue.signum() == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return pnl.multiply(HUNDRED).divide(marketValue.abs(), 2, RoundingMode.HALF_UP);
    }
}
