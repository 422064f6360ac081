package com.portfoliosync.broker.mapper;

import static com.portfoliosync.broker.mapper.KiteValues.decimal;
import static com.portfoliosync.broker.mapper.KiteValues.integer;
import static com.portfoliosync.broker.mapper.KiteValues.text;

import com.portfoliosync.domain.model.Holding;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Maps Kite SDK {@code com.zerodhatech.models.Holding} to the domain {@link Holding}.
 *
 * <p>The SDK model uses public fields and mixes Strings with numbers (collateral and
 * realised quantities are Strings), so the mapping is written by hand.
 */
@Component
public class KiteHoldingMapper {

    public Holding toDomain(com.zerodhatech.models.Holding kiteHolding) {
        if (kiteHolding == null) {
            return null;
        }

        return Holding.builder()
                .tradingSymbol(kiteHolding.tradingSymbol)
                .exchange(kiteHolding.exchange)
                .isin(kiteHolding.isin)
                .product(kiteHolding.product)
                .instrumentToken(text(kiteHolding.instrumentToken))
                .quantity(integer(kiteHolding.quantity))
                .t1Quantity(integer(kiteHolding.t1Quantity))
                .realisedQuantity(integer(kiteHolding.realisedQuantity))
                .collateralQuantity(integer(kiteHolding.collateralQuantity))
                .averagePrice(decimal(kiteHolding.averagePrice))
                .lastPrice(decimal(kiteHolding.lastPrice))
                .pnl(decimal(kiteHolding.pnl))
                .dayChange(decimal(kiteHolding.dayChange))
                .dayChangePercentage(decimal(kiteHolding.dayChangePercentage))
                .build();
    }

    public List<Holding> toDomainList(List<com.zerodhatech.models.Holding> kiteHoldings) {
        if (kiteHoldings == null) {
            return List.of();
        }
        return kiteHoldings.stream().map(this::toDomain).filter(Objects::nonNull).toList();
    }
}
