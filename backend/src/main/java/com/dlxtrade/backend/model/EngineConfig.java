package com.dlxtrade.backend.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class EngineConfig {
    @NonNull
    String symbol;
    @NonNull
    BigDecimal quoteSize;
    @NonNull
    BigDecimal adverseMovePct;
    long cancelIntervalMs;
    @NonNull
    BigDecimal maxPositionSize;
}
