package com.portfoliosync.broker.mapper;

import static com.portfoliosync.broker.mapper.KiteValues.decimal;

import com.portfoliosync.domain.model.SegmentMargin;
import com.zerodhatech.models.Margin;
import org.springframework.stereotype.Component;

/**
 * Maps a Kite {@link Margin} (one segment) to {@link SegmentMargin}.
 *
 * <p>Kite stores every margin value as a String inside the nested {@code available} and
 * {@code utilised} objects; either may be absent.
 */
@Component
public class KiteMarginMapper {

    public SegmentMargin toDomain(String segment, Margin margin) {
        SegmentMargin.SegmentMarginBuilder builder = SegmentMargin.builder().segment(segment);
        if (margin == null) {
            return builder.build();
        }

        builder.net(decimal(margin.net));

        if (margin.available != null) {
            builder.availableCash(decimal(margin.available.cash))
                    .collateral(decimal(margin.available.collateral))
                    .intradayPayin(decimal(margin.available.intradayPayin))
                    .adhocMargin(decimal(margin.available.adhocMargin))
                    .liveBalance(decimal(margin.available.liveBalance));
        }

        if (margin.utilised != null) {
            builder.debits(decimal(margin.utilised.debits))
                    .span(decimal(margin.utilised.span))
                    .exposure(decimal(margin.utilised.exposure))
                    .optionPremium(decimal(margin.utilised.optionPremium))
                    .m2mRealised(decimal(margin.utilised.m2mRealised))
                    .m2mUnrealised(decimal(margin.utilised.m2mUnrealised));
        }

        return builder.build();
    }
}
