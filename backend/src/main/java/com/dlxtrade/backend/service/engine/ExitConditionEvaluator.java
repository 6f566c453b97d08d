package com.dlxtrade.backend.service.engine;

import com.dlxtrade.backend.model.ExitReason;
import com.dlxtrade.backend.model.OrderSide;
import com.dlxtrade.backend.model.Position;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Exit checks for an open position, first hit wins: stop-loss, then take-profit, then holding time.
 */
public class ExitConditionEvaluator {

    public ExitDecision evaluate(Position position, BigDecimal midPrice, Instant now) {
        boolean isLong = position.getSide() == OrderSide.BUY;

        BigDecimal stop = position.getStopLoss();
        if (stop != null) {
            boolean stopHit = isLong ? midPrice.compareTo(stop) <= 0 : midPrice.compareTo(stop) >= 0;
            if (stopHit) {
                return ExitDecision.exit(ExitReason.STOP_LOSS, midPrice);
            }
        }

        BigDecimal target = position.getTakeProfit();
        if (target != null) {
            boolean targetHit = isLong ? midPrice.compareTo(target) >= 0 : midPrice.compareTo(target) <= 0;
            if (targetHit) {
                return ExitDecision.exit(ExitReason.TAKE_PROFIT, midPrice);
            }
        }

        Long ttl = position.getTimeToLiveMs();
        if (ttl != null && position.getOpenedAt() != null
                && Duration.between(position.getOpenedAt(), now).toMillis() >= ttl) {
            return ExitDecision.exit(ExitReason.TIME_EXPIRY, midPrice);
        }

        return ExitDecision.hold();
    }

    public record ExitDecision(boolean shouldExit, ExitReason reason, BigDecimal exitPrice) {
        public static ExitDecision exit(ExitReason reason, BigDecimal exitPrice) {
            return new ExitDecision(true, reason, exitPrice);
        }

        public static ExitDecision hold() {
            return new ExitDecision(false, null, null);
        }
    }
}
