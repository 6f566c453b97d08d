package com.dlxtrade.backend.model;

public enum TradeAction {
    BUY,
    SELL,
    HOLD;

    public boolean isActionable() {
        return this != HOLD;
    }

    public OrderSide toSide() {
        return switch (this) {
            case BUY -> OrderSide.BUY;
            case SELL -> OrderSide.SELL;
            case HOLD -> throw new IllegalStateException("HOLD has no order side");
        };
    }
}
