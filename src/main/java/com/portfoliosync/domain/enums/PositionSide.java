package com.portfoliosync.domain.enums;

/** Direction of a position, derived from the sign of its net quantity. */
public enum PositionSide {
    BUY,
    SELL,
    NONE;

    public static PositionSide fromQuantity(int quantity) {
        if (quantity > 0) {
            return BUY;
        }
        return quantity < 0 ? SELL : NONE;
    }
}
