package com.dlxtrade.backend.service;

import com.dlxtrade.backend.config.EngineProperties;
import com.dlxtrade.backend.dto.RiskCheckResult;
import com.dlxtrade.backend.dto.RiskStateSnapshot;
import com.dlxtrade.backend.event.EnginePauseRequestedEvent;
import com.dlxtrade.backend.model.EngineStatus;
import com.dlxtrade.backend.model.RiskState;
import com.dlxtrade.backend.model.SettingsPatch;
import com.dlxtrade.backend.model.TradingSettings;
import com.dlxtrade.backend.port.BalanceProvider;
import com.dlxtrade.backend.port.PositionLedger;
import com.dlxtrade.backend.port.TradingRecordStore;
import com.dlxtrade.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-user trade gate. Each user's {@link RiskState} lives in its own slot guarded by its own lock,
 * so checks for one user never wait on another user's I/O.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RiskManager {

    private final TradingRecordStore recordStore;
    private final PositionLedger positionLedger;
    private final BalanceProvider balanceProvider;
    private final IoGuard ioGuard;
    private final ApplicationEventPublisher eventPublisher;
    private final EngineProperties engineProperties;
    private final Clock clock;

    private final ConcurrentMap<String, UserSlot> slots = new ConcurrentHashMap<>();

    public RiskCheckResult canTrade(String userId, String symbol, BigDecimal tradeSize) {
        return canTrade(userId, symbol, tradeSize, null, null);
    }

    public RiskCheckResult canTrade(String userId, String symbol, BigDecimal tradeSize,
                                   BigDecimal midPrice, BigDecimal assumedAdverseMove) {
        UserSlot slot = slot(userId);
        Decision decision;
        slot.lock.lock();
        try {
            decision = evaluate(userId, symbol, tradeSize, midPrice, assumedAdverseMove, slot.state);
        } finally {
            slot.lock.unlock();
        }
        if (decision.pauseRequired()) {
            pauseEngine(userId, EngineStatus.PAUSED_BY_RISK, decision.result().reason());
        }
        if (!decision.result().allowed()) {
            log.warn("Trade denied userId={} symbol={} size={} reason={}",
                    userId, symbol, MoneyUtils.plain(tradeSize), decision.result().reason());
        }
        return decision.result();
    }

    private Decision evaluate(String userId, String symbol, BigDecimal tradeSize, BigDecimal midPrice,
                              BigDecimal assumedAdverseMove, RiskState state) {
        Optional<TradingSettings> loaded = ioGuard.call("getSettings", () -> recordStore.getSettings(userId));
        if (loaded.isEmpty()) {
            return Decision.deny("Settings not found");
        }
        TradingSettings settings = loaded.get();

        if (settings.getStatus() != null && settings.getStatus().isPaused()) {
            return Decision.deny("Engine paused: " + settings.getStatus().getValue());
        }

        Instant now = clock.instant();
        Duration cooldown = Duration.ofMinutes(engineProperties.getRisk().getPauseMinutes());
        boolean withinCooldown = Duration.between(state.getLastFailureTimestamp(), now).compareTo(cooldown) < 0;

        if (state.isPaused()) {
            if (withinCooldown) {
                return Decision.deny(state.getPauseReason() != null ? state.getPauseReason() : "Paused due to risk limits");
            }
            log.info("Risk pause expired userId={} reason={}", userId, state.getPauseReason());
            state.clearPause();
        }

        if (state.getConsecutiveFailures() >= engineProperties.getRisk().getMaxConsecutiveFailures()) {
            if (withinCooldown) {
                state.pause("Too many consecutive failures: " + state.getConsecutiveFailures());
                return Decision.denyAndPause(state.getPauseReason());
            }
            state.setConsecutiveFailures(0);
        }

        if (settings.getMaxPos() != null && settings.getMaxPos().signum() > 0) {
            BigDecimal current = ioGuard.call("netPosition", () -> positionLedger.netPosition(userId, symbol));
            BigDecimal projected = current.add(tradeSize);
            if (projected.abs().compareTo(settings.getMaxPos()) > 0) {
                return Decision.deny("Max position exceeded: " + MoneyUtils.plain(projected)
                        + " > " + MoneyUtils.plain(settings.getMaxPos()));
            }
        }

        if (MoneyUtils.isPositive(settings.getPerTradeRiskPct())) {
            BigDecimal maxTradeRisk = MoneyUtils.percentOf(balance(userId), settings.getPerTradeRiskPct());
            BigDecimal estimatedRisk = estimateRisk(tradeSize, midPrice, assumedAdverseMove);
            if (estimatedRisk.compareTo(maxTradeRisk) > 0) {
                return Decision.deny("Per-trade risk exceeded");
            }
        }

        if (MoneyUtils.isPositive(settings.getMaxLossPct())) {
            BigDecimal maxDailyLoss = MoneyUtils.percentOf(balance(userId), settings.getMaxLossPct());
            if (state.getDailyLoss().compareTo(maxDailyLoss.negate()) < 0) {
                state.pause("Daily loss limit exceeded: " + MoneyUtils.plain(state.getDailyLoss())
                        + " < -" + MoneyUtils.plain(maxDailyLoss));
                return Decision.denyAndPause(state.getPauseReason());
            }
        }

        if (MoneyUtils.isPositive(settings.getMaxDrawdownPct())) {
            BigDecimal balance = balance(userId);
            BigDecimal drawdown = MoneyUtils.subtract(state.getPeakBalance(), balance);
            BigDecimal maxDrawdown = MoneyUtils.percentOf(state.getPeakBalance(), settings.getMaxDrawdownPct());
            if (drawdown.compareTo(maxDrawdown) > 0) {
                state.pause("Max drawdown exceeded: " + MoneyUtils.plain(drawdown)
                        + " > " + MoneyUtils.plain(maxDrawdown));
                return Decision.denyAndPause(state.getPauseReason());
            }
        }

        return Decision.allow();
    }

    BigDecimal estimateRisk(BigDecimal tradeSize, BigDecimal midPrice, BigDecimal assumedAdverseMove) {
        EngineProperties.Risk risk = engineProperties.getRisk();
        if (!MoneyUtils.isPositive(midPrice)) {
            return MoneyUtils.multiply(tradeSize, risk.getFlatNotionalPerUnit());
        }
        BigDecimal adverseMove = MoneyUtils.isPositive(assumedAdverseMove)
                ? assumedAdverseMove
                : risk.getDefaultAdverseMove();
        return MoneyUtils.scale(tradeSize.multiply(midPrice).multiply(adverseMove));
    }

    public void recordTradeResult(String userId, BigDecimal pnl, boolean success) {
        BigDecimal amount = pnl == null ? MoneyUtils.ZERO : pnl;
        UserSlot slot = slot(userId);
        slot.lock.lock();
        try {
            RiskState state = slot.state;
            BigDecimal balance = balance(userId);
            LocalDate today = LocalDate.now(clock);

            if (state.getDailyStartDate() == null) {
                state.setDailyStartDate(today);
                state.setDailyStartBalance(balance);
            } else if (!today.equals(state.getDailyStartDate())) {
                log.info("Daily risk rollover userId={} previousDay={} dailyLoss={}",
                        userId, state.getDailyStartDate(), MoneyUtils.plain(state.getDailyLoss()));
                state.setDailyLoss(MoneyUtils.ZERO);
                state.setDailyStartDate(today);
                state.setDailyStartBalance(balance);
            }

            state.setDailyLoss(MoneyUtils.add(state.getDailyLoss(), amount));

            if (balance.compareTo(state.getPeakBalance()) > 0) {
                state.setPeakBalance(balance);
            }

            if (success) {
                state.setConsecutiveFailures(0);
            } else {
                state.setConsecutiveFailures(state.getConsecutiveFailures() + 1);
                state.setLastFailureTimestamp(clock.instant());
            }

            log.info("Trade result recorded userId={} pnl={} success={} consecutiveFailures={}",
                    userId, MoneyUtils.plain(amount), success, state.getConsecutiveFailures());
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Persists a manual pause and stops the user's engines. The free-text {@code reason} travels on the
     * stop request and into the log; the persisted status is {@link EngineStatus#PAUSED_MANUAL}.
     */
    public void pauseEngine(String userId, String reason) {
        pauseEngine(userId, EngineStatus.PAUSED_MANUAL, reason);
    }

    /**
     * Same as {@link #pauseEngine(String, String)} with an explicit paused status, whose value doubles as
     * the reason.
     */
    public void pauseEngine(String userId, EngineStatus status) {
        pauseEngine(userId, status, status.getValue());
    }

    private void pauseEngine(String userId, EngineStatus status, String reason) {
        ioGuard.run("saveSettings", () -> recordStore.saveSettings(userId, SettingsPatch.status(status)));
        eventPublisher.publishEvent(new EnginePauseRequestedEvent(userId, status, reason, clock.instant()));
        log.warn("⛔ Engine paused userId={} status={} reason={}", userId, status.getValue(), reason);
    }

    public void resumeEngine(String userId) {
        UserSlot slot = slot(userId);
        slot.lock.lock();
        try {
            slot.state.clearPause();
            slot.state.setConsecutiveFailures(0);
        } finally {
            slot.lock.unlock();
        }
        ioGuard.run("saveSettings", () -> recordStore.saveSettings(userId, SettingsPatch.status(EngineStatus.ACTIVE)));
        log.info("Engine resumed userId={}", userId);
    }

    public Optional<RiskStateSnapshot> getState(String userId) {
        UserSlot slot = slots.get(userId);
        if (slot == null) {
            return Optional.empty();
        }
        slot.lock.lock();
        try {
            return Optional.of(RiskStateSnapshot.of(userId, slot.state));
        } finally {
            slot.lock.unlock();
        }
    }

    private BigDecimal balance(String userId) {
        return ioGuard.call("balance", () -> balanceProvider.balance(userId));
    }

    private UserSlot slot(String userId) {
        return slots.computeIfAbsent(userId, key -> new UserSlot());
    }

    private static final class UserSlot {
        private final ReentrantLock lock = new ReentrantLock();
        private final RiskState state = new RiskState();
    }

    private record Decision(RiskCheckResult result, boolean pauseRequired) {
        static Decision allow() {
            return new Decision(RiskCheckResult.allow(), false);
        }

        static Decision deny(String reason) {
            return new Decision(RiskCheckResult.deny(reason), false);
        }

        static Decision denyAndPause(String reason) {
            return new Decision(RiskCheckResult.deny(reason), true);
        }
    }
}
