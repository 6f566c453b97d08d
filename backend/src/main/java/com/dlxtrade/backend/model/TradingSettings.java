package com.dlxtrade.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Per-user trading settings as held by the record store. Percentages are whole numbers (1 = 1%).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TradingSettings {

    @Builder.Default
    private EngineStatus status = EngineStatus.ACTIVE;

    private String symbol;
    private String strategy;

    private BigDecimal quoteSize;
    private BigDecimal adversePct;
    private Long cancelMs;
    private BigDecimal maxPos;

    private BigDecimal perTradeRiskPct;
    private BigDecimal maxLossPct;
    private BigDecimal maxDrawdownPct;

    private Double minAccuracyThreshold;
    private boolean autoTradeEnabled;
}
