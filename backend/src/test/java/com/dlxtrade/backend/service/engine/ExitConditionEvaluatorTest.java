package com.dlxtrade.backend.service.engine;

import com.dlxtrade.backend.model.ExitReason;
import com.dlxtrade.backend.model.OrderSide;
import com.dlxtrade.backend.model.Position;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ExitConditionEvaluatorTest {

    private static final Instant OPENED = Instant.parse("2024-03-01T10:00:00Z");

    private final ExitConditionEvaluator evaluator = new ExitConditionEvaluator();

    private static Position position(OrderSide side, String stop, String target, Long ttlMs) {
        return Position.builder()
                .id("POS-1")
                .symbol("BTCUSDT")
                .side(side)
                .quantity(new BigDecimal("0.001"))
                .entryPrice(BigDecimal.valueOf(100))
                .stopLoss(stop == null ? null : new BigDecimal(stop))
                .takeProfit(target == null ? null : new BigDecimal(target))
                .openedAt(OPENED)
                .timeToLiveMs(ttlMs)
                .build();
    }

    @Test
    void triggersLongStopLoss() {
        ExitConditionEvaluator.ExitDecision decision =
                evaluator.evaluate(position(OrderSide.BUY, "99", "102", null), BigDecimal.valueOf(98), OPENED);

        assertThat(decision.shouldExit()).isTrue();
        assertThat(decision.reason()).isEqualTo(ExitReason.STOP_LOSS);
        assertThat(decision.exitPrice()).isEqualByComparingTo("98");
    }

    @Test
    void triggersLongTakeProfit() {
        ExitConditionEvaluator.ExitDecision decision =
                evaluator.evaluate(position(OrderSide.BUY, "99", "102", null), BigDecimal.valueOf(102), OPENED);

        assertThat(decision.reason()).isEqualTo(ExitReason.TAKE_PROFIT);
    }

    @Test
    void mirrorsLevelsForShorts() {
        Position shortPosition = position(OrderSide.SELL, "101", "98", null);

        assertThat(evaluator.evaluate(shortPosition, BigDecimal.valueOf(101), OPENED).reason())
                .isEqualTo(ExitReason.STOP_LOSS);
        assertThat(evaluator.evaluate(shortPosition, BigDecimal.valueOf(97), OPENED).reason())
                .isEqualTo(ExitReason.TAKE_PROFIT);
        assertThat(evaluator.evaluate(shortPosition, BigDecimal.valueOf(100), OPENED).shouldExit()).isFalse();
    }

    @Test
    void expiresAfterHoldingTime() {
        Position timed = position(OrderSide.BUY, "90", "110", 60_000L);

        assertThat(evaluator.evaluate(timed, BigDecimal.valueOf(100), OPENED.plusSeconds(59)).shouldExit()).isFalse();
        ExitConditionEvaluator.ExitDecision decision =
                evaluator.evaluate(timed, BigDecimal.valueOf(100), OPENED.plusSeconds(60));
        assertThat(decision.reason()).isEqualTo(ExitReason.TIME_EXPIRY);
        assertThat(decision.reason().getLabel()).isEqualTo("Time-based exit");
    }

    @Test
    void stopLossWinsOverExpiry() {
        ExitConditionEvaluator.ExitDecision decision = evaluator.evaluate(
                position(OrderSide.BUY, "99", null, 1L), BigDecimal.valueOf(95), OPENED.plusSeconds(5));

        assertThat(decision.reason()).isEqualTo(ExitReason.STOP_LOSS);
    }

    @Test
    void holdsWithoutLevels() {
        ExitConditionEvaluator.ExitDecision decision =
                evaluator.evaluate(position(OrderSide.BUY, null, null, null), BigDecimal.valueOf(1), OPENED);

        assertThat(decision.shouldExit()).isFalse();
        assertThat(decision.reason()).isNull();
    }
}
