package com.dlxtrade.backend.model;

import com.dlxtrade.backend.util.MoneyUtils;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Mutable per-user risk state. Only RiskManager touches instances, always under the user's lock.
 */
@Data
public class RiskState {

    private BigDecimal dailyLoss = MoneyUtils.ZERO;
    private BigDecimal dailyStartBalance = MoneyUtils.ZERO;
    private LocalDate dailyStartDate;
    private BigDecimal peakBalance = MoneyUtils.ZERO;
    private int consecutiveFailures;
    private Instant lastFailureTimestamp = Instant.EPOCH;
    private boolean paused;
    private String pauseReason;

    public void pause(String reason) {
        this.paused = true;
        this.pauseReason = reason;
    }

    public void clearPause() {
        this.paused = false;
        this.pauseReason = null;
    }
}
