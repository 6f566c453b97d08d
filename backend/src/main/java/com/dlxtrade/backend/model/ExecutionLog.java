package com.dlxtrade.backend.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class ExecutionLog {
    String symbol;
    Instant timestamp;
    ExecutionAction action;
    String reason;
    Double accuracy;
    Double accuracyUsed;
    String orderId;
    Long executionLatencyMs;
    BigDecimal slippage;
    String strategy;
    Signal signal;
    BigDecimal pnl;
    OrderStatus status;
}
