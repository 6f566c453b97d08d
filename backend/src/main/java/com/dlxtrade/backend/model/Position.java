package com.dlxtrade.backend.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class Position {
    String id;
    String symbol;
    OrderSide side;
    BigDecimal quantity;
    BigDecimal entryPrice;
    BigDecimal stopLoss;
    BigDecimal takeProfit;
    Instant openedAt;
    Long timeToLiveMs;
}
