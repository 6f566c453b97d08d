package com.dlxtrade.backend.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class StrategyConfig {
    BigDecimal quoteSize;
    BigDecimal adversePct;
    long cancelMs;
    BigDecimal maxPos;
}
