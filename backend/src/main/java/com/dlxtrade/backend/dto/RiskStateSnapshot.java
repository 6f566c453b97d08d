package com.dlxtrade.backend.dto;

import com.dlxtrade.backend.model.RiskState;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

public record RiskStateSnapshot(
        String userId,
        BigDecimal dailyLoss,
        BigDecimal dailyStartBalance,
        LocalDate dailyStartDate,
        BigDecimal peakBalance,
        int consecutiveFailures,
        Instant lastFailureTimestamp,
        boolean paused,
        String pauseReason
) {
    public static RiskStateSnapshot of(String userId, RiskState state) {
        return new RiskStateSnapshot(
                userId,
                state.getDailyLoss(),
                state.getDailyStartBalance(),
                state.getDailyStartDate(),
                state.getPeakBalance(),
                state.getConsecutiveFailures(),
                state.getLastFailureTimestamp(),
                state.isPaused(),
                state.getPauseReason()
        );
    }
}
