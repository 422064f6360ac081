package com.portfoliosync.mapper;

import com.portfoliosync.domain.model.Holding;
import com.portfoliosync.entity.HoldingEntity;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Normalizes broker holdings into stored rows.
 *
 * <p>Missing numbers become zero. Market value counts pledged (collateral) quantity
 * alongside free quantity; the stored P&L percentage is the broker's day change
 * percentage.
 */
@Component
public class HoldingSnapshotMapper {

    public HoldingEntity toEntity(Holding holding, Long accountId, LocalDateTime syncedAt) {
        int quantity = orZero(holding.getQuantity());
        int collateralQuantity = orZero(holding.getCollateralQuantity());
        BigDecimal lastPrice = orZero(holding.getLastPrice());

        return HoldingEntity.builder()
                .accountId(accountId)
                .tradingSymbol(holding.getTradingSymbol())
                .exchange(holding.getExchange())
                .isin(holding.getIsin())
                .product(holding.getProduct())
                .instrumentToken(holding.getInstrumentToken())
                .quantity(quantity)
                .t1Quantity(orZero(holding.getT1Quantity()))
                .realisedQuantity(orZero(holding.getRealisedQuantity()))
                .collateralQuantity(collateralQuantity)
                .averagePrice(orZero(holding.getAveragePrice()))
                .lastPrice(lastPrice)
                .marketValue(lastPrice.multiply(BigDecimal.valueOf((long) quantity + collateralQuantity)))
                .pnl(orZero(holding.getPnl()))
                .pnlPercentage(orZero(holding.getDayChangePercentage()).setScale(2, RoundingMode.HALF_UP))
                .createdAt(syncedAt)
                .build();
    }

    public List<HoldingEntity> toEntityList(List<Holding> holdings, Long accountId, LocalDateTime syncedAt) {
        return holdings.stream().map(h -> toEntity(h, accountId, syncedAt)).toList();
    }

    static int orZero(Integer value) {
        return value != null ? value : 0;
    }

    static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
