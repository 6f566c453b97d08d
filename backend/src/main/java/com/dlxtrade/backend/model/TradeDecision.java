package com.dlxtrade.backend.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class TradeDecision {
    TradeAction action;
    OrderType orderType;
    BigDecimal quantity;
    BigDecimal price;
    BigDecimal stopLoss;
    BigDecimal takeProfit;
    Long timeToLiveMs;
    String reason;

    public static TradeDecision hold(String reason) {
        return TradeDecision.builder().action(TradeAction.HOLD).reason(reason).build();
    }

    public boolean isActionable() {
        return action != null && action.isActionable();
    }
}
