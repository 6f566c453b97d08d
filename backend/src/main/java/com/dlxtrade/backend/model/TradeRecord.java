package com.dlxtrade.backend.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class TradeRecord {
    String symbol;
    OrderSide side;
    BigDecimal quantity;
    BigDecimal entryPrice;
    BigDecimal exitPrice;
    BigDecimal pnl;
    Instant timestamp;
    String engineType;
    String orderId;
    String strategy;
}
