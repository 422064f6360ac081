package com.portfoliosync.broker.mapper;

import static com.portfoliosync.broker.mapper.KiteValues.decimal;
import static com.portfoliosync.broker.mapper.KiteValues.integer;
import static com.portfoliosync.broker.mapper.KiteValues.text;

import com.portfoliosync.domain.model.Position;
import com.portfoliosync.domain.model.PositionBook;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Maps Kite SDK positions to the domain {@link Position} model.
 *
 * <p>Kite's getPositions() returns a {@code Map<String, List<Position>>} keyed "net" and
 * "day". Quantity is Kite's signed {@code netQuantity}; market value is {@code netValue}.
 */
@Component
public class KitePositionMapper {

    public Position toDomain(com.zerodhatech.models.Position kitePosition) {
        if (kitePosition == null) {
            return null;
        }

        return Position.builder()
                .tradingSymbol(kitePosition.tradingSymbol)
                .exchange(kitePosition.exchange)
                .product(kitePosition.product)
                .instrumentToken(text(kitePosition.instrumentToken))
                .quantity(integer(kitePosition.netQuantity))
                .overnightQuantity(integer(kitePosition.overnightQuantity))
                .averagePrice(decimal(kitePosition.averagePrice))
                .lastPrice(decimal(kitePosition.lastPrice))
                .value(decimal(kitePosition.netValue))
                .pnl(decimal(kitePosition.pnl))
                .m2m(decimal(kitePosition.m2m))
                .unrealised(decimal(kitePosition.unrealised))
                .realised(decimal(kitePosition.realised))
                .build();
    }

    public List<Position> toDomainList(List<com.zerodhatech.models.Position> kitePositions) {
        if (kitePositions == null) {
            return List.of();
        }
        return kitePositions.stream().map(this::toDomain).filter(Objects::nonNull).toList();
    }

    public PositionBook toPositionBook(Map<String, List<com.zerodhatech.models.Position>> kitePositions) {
        if (kitePositions == null) {
            return PositionBook.builder().build();
        }
        return PositionBook.builder()
                .net(toDomainList(kitePositions.get("net")))
                .day(toDomainList(kitePositions.get("day")))
                .build();
    }
}
