package com.portfoliosync.mapper;

import static com.portfoliosync.mapper.HoldingSnapshotMapper.orZero;

import com.portfoliosync.domain.model.SegmentMargin;
import com.portfoliosync.entity.MarginEntity;
import java.time.LocalDateTime;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Copies a broker segment margin onto the account's single margin row.
 * Missing values become zero; the segment name is stored upper-case.
 */
@Component
public class MarginSnapshotMapper {

    static final String DEFAULT_SEGMENT = "EQUITY";

    /** Overwrites every margin field of {@code target}; the id and account id are kept. */
    public MarginEntity applyTo(SegmentMargin margin, MarginEntity target, LocalDateTime syncedAt) {
        target.setSegment(margin.getSegment() != null ? margin.getSegment().toUpperCase(Locale.ROOT) : DEFAULT_SEGMENT);
        target.setEnabled(true);
        target.setNet(orZero(margin.getNet()));
        target.setAvailableCash(orZero(margin.getAvailableCash()));
        target.setCollateral(orZero(margin.getCollateral()));
        target.setIntradayPayin(orZero(margin.getIntradayPayin()));
        target.setAdhocMargin(orZero(margin.getAdhocMargin()));
        target.setLiveBalance(orZero(margin.getLiveBalance()));
        target.setDebits(orZero(margin.getDebits()));
        target.setSpan(orZero(margin.getSpan()));
        target.setExposure(orZero(margin.getExposure()));
        target.setOptionPremium(orZero(margin.getOptionPremium()));
        target.setM2mRealised(orZero(margin.getM2mRealised()));
        target.setM2mUnrealised(orZero(margin.getM2mUnrealised()));
        target.setUpdatedAt(syncedAt);
        return target;
    }
}
