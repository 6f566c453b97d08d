package com.dlxtrade.backend.service.engine;

import com.dlxtrade.backend.config.EngineProperties;
import com.dlxtrade.backend.dto.EngineEvent;
import com.dlxtrade.backend.dto.EngineStatusView;
import com.dlxtrade.backend.dto.ExecutionConfig;
import com.dlxtrade.backend.dto.RiskCheckResult;
import com.dlxtrade.backend.exception.EngineConfigurationException;
import com.dlxtrade.backend.exception.StrategyAlreadyInitializedException;
import com.dlxtrade.backend.exception.TradingException;
import com.dlxtrade.backend.model.ExecutionAction;
import com.dlxtrade.backend.model.ExecutionLog;
import com.dlxtrade.backend.model.GlobalStats;
import com.dlxtrade.backend.model.Order;
import com.dlxtrade.backend.model.OrderBook;
import com.dlxtrade.backend.model.OrderRequest;
import com.dlxtrade.backend.model.OrderStatus;
import com.dlxtrade.backend.model.Position;
import com.dlxtrade.backend.model.ResearchResult;
import com.dlxtrade.backend.model.Signal;
import com.dlxtrade.backend.model.StrategyConfig;
import com.dlxtrade.backend.model.TradeDecision;
import com.dlxtrade.backend.model.TradeRecord;
import com.dlxtrade.backend.model.TradingSettings;
import com.dlxtrade.backend.model.UserStats;
import com.dlxtrade.backend.port.MarketDataSource;
import com.dlxtrade.backend.port.OrderGateway;
import com.dlxtrade.backend.port.PositionManagement;
import com.dlxtrade.backend.port.TradingRecordStore;
import com.dlxtrade.backend.service.IoGuard;
import com.dlxtrade.backend.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodic research-and-execute loop for one user ("accuracy engine").
 * <p>
 * Each cycle runs research, gates on the user's settings, checks risk, asks the strategy for a decision
 * and places the resulting order. Open positions are watched by a throttled exit monitor when the order
 * gateway supports {@link PositionManagement}.
 */
@Slf4j
public class ExecutionOrchestrator {

    public static final String ENGINE_TYPE = "auto";
    static final String ACTIVITY_TRADE_EXECUTED = "TRADE_EXECUTED";

    private final String userId;
    private final MarketDataSource marketData;
    private final OrderGateway orderGateway;
    private final PositionManagement positionManagement;
    private final EngineCollaborators collaborators;
    private final EngineProperties.Execution properties;
    private final IoGuard ioGuard;
    private final ExitConditionEvaluator exitEvaluator = new ExitConditionEvaluator();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong generation = new AtomicLong();
    private final AtomicReference<Instant> lastExitCheck = new AtomicReference<>(Instant.EPOCH);

    private volatile ExecutionConfig config;
    private volatile ScheduledFuture<?> cycleFuture;
    private volatile ScheduledFuture<?> exitFuture;

    public ExecutionOrchestrator(String userId, MarketDataSource marketData, OrderGateway orderGateway,
                                 EngineCollaborators collaborators) {
        this.userId = userId;
        this.marketData = marketData;
        this.orderGateway = orderGateway;
        this.positionManagement = orderGateway instanceof PositionManagement management ? management : null;
        this.collaborators = collaborators;
        this.properties = collaborators.getEngineProperties().getExecution();
        this.ioGuard = collaborators.getIoGuard();
    }

    public void start(String symbol, long intervalMs) {
        if (userId == null || userId.isBlank()) {
            throw new EngineConfigurationException("Execution engine requires user context");
        }
        if (!running.compareAndSet(false, true)) {
            throw new EngineConfigurationException("Execution engine already running for user " + userId);
        }
        long runGeneration = generation.incrementAndGet();
        config = new ExecutionConfig(symbol, intervalMs);
        lastExitCheck.set(Instant.EPOCH);

        cycleFuture = collaborators.getScheduler().scheduleAtFixedRate(
                () -> tick(runGeneration), 0, intervalMs, TimeUnit.MILLISECONDS);
        if (positionManagement != null) {
            long exitInterval = properties.getExitCheckIntervalMs();
            exitFuture = collaborators.getScheduler().scheduleWithFixedDelay(
                    () -> monitorExits(runGeneration), exitInterval, exitInterval, TimeUnit.MILLISECONDS);
        } else {
            log.info("Order gateway has no position management userId={}, exit monitor disabled", userId);
        }
        log.info("Execution engine started userId={} symbol={} intervalMs={}", userId, symbol, intervalMs);
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        generation.incrementAndGet();
        ScheduledFuture<?> cycle = cycleFuture;
        if (cycle != null) {
            cycle.cancel(false);
        }
        ScheduledFuture<?> exits = exitFuture;
        if (exits != null) {
            exits.cancel(false);
        }
        log.info("Execution engine stopped userId={}", userId);
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean supportsExitMonitoring() {
        return positionManagement != null;
    }

    public EngineStatusView<ExecutionConfig> getStatus() {
        return new EngineStatusView<>(running.get(), config);
    }

    private void tick(long runGeneration) {
        try {
            runCycle(runGeneration);
        } catch (Exception e) {
            log.error("Research cycle failed userId={} symbol={}", userId, config.symbol(), e);
        }
    }

    void runCycle() {
        runCycle(generation.get());
    }

    void runCycle(long runGeneration) {
        if (!isCurrent(runGeneration)) {
            return;
        }
        Instant cycleStart = collaborators.getClock().instant();
        String symbol = config.symbol();

        ResearchResult research = ioGuard.call("runResearch",
                () -> collaborators.getResearchService().runResearch(userId, symbol, marketData));
        broadcast(EngineEvent.RESEARCH, payload(
                "symbol", research.getSymbol(),
                "signal", research.getSignal(),
                "accuracy", research.getAccuracy(),
                "orderbookImbalance", research.getOrderbookImbalance(),
                "recommendedAction", research.getRecommendedAction()));
        if (!isCurrent(runGeneration)) {
            return;
        }

        Optional<TradingSettings> settings = loadSettings();
        double minAccuracy = settings.map(TradingSettings::getMinAccuracyThreshold)
                .filter(value -> value > 0)
                .orElse(properties.getDefaultMinAccuracy());
        boolean autoTradeEnabled = settings.map(TradingSettings::isAutoTradeEnabled).orElse(false);

        GateDecision gate = gate(research, minAccuracy, autoTradeEnabled);
        if (gate.execute()) {
            executeTrade(runGeneration, symbol, research, cycleStart);
        } else {
            log.info("Trade skipped userId={} symbol={} reason={}", userId, symbol, gate.reason());
            saveLog(ExecutionLog.builder()
                    .symbol(symbol)
                    .timestamp(collaborators.getClock().instant())
                    .action(ExecutionAction.SKIPPED)
                    .reason(gate.reason())
                    .accuracy(research.getAccuracy())
                    .signal(research.getSignal())
                    .build());
            broadcast(EngineEvent.EXECUTION, payload(
                    "symbol", symbol,
                    "action", ExecutionAction.SKIPPED,
                    "reason", gate.reason(),
                    "accuracy", research.getAccuracy()));
        }

        monitorExits(runGeneration);
    }

    static GateDecision gate(ResearchResult research, double minAccuracy, boolean autoTradeEnabled) {
        if (!autoTradeEnabled) {
            return GateDecision.skip("Auto-trade disabled");
        }
        if (research.getAccuracy() < minAccuracy) {
            return GateDecision.skip(String.format(Locale.ROOT, "Accuracy %.1f%% below threshold %.1f%%",
                    research.getAccuracy() * 100, minAccuracy * 100));
        }
        if (research.getSignal() == null || research.getSignal() == Signal.HOLD) {
            return GateDecision.skip("HOLD signal");
        }
        return GateDecision.proceed();
    }

    private void executeTrade(long runGeneration, String symbol, ResearchResult research, Instant cycleStart) {
        String strategyName = properties.getDefaultStrategy();
        try {
            TradingSettings settings = loadSettings()
                    .orElseThrow(() -> new EngineConfigurationException("Settings not found for user " + userId));
            if (settings.getStrategy() != null && !settings.getStrategy().isBlank()) {
                strategyName = settings.getStrategy();
            }
            BigDecimal tradeSize = MoneyUtils.isPositive(settings.getQuoteSize())
                    ? settings.getQuoteSize()
                    : properties.getDefaultTradeSize();

            OrderBook book = ioGuard.call("getOrderbook",
                    () -> marketData.getOrderbook(symbol, properties.getOrderbookDepth()));
            BigDecimal midPrice = book.midPrice().orElse(null);

            RiskCheckResult risk = collaborators.getRiskManager()
                    .canTrade(userId, symbol, tradeSize, midPrice, properties.getAssumedAdverseMove());
            if (!risk.allowed()) {
                String reason = risk.reason() != null ? risk.reason() : "Risk check failed";
                saveLog(ExecutionLog.builder()
                        .symbol(symbol)
                        .timestamp(collaborators.getClock().instant())
                        .action(ExecutionAction.SKIPPED)
                        .reason(reason)
                        .accuracy(research.getAccuracy())
                        .build());
                broadcast(EngineEvent.RISK_ALERT, payload("symbol", symbol, "reason", reason));
                return;
            }
            if (!isCurrent(runGeneration)) {
                return;
            }

            if (properties.getMarketMakingStrategy().equals(strategyName)) {
                String reason = "Strategy " + strategyName + " runs only in the quote engine";
                log.warn("Rejected strategy userId={} symbol={} strategy={}", userId, symbol, strategyName);
                saveLog(ExecutionLog.builder()
                        .symbol(symbol)
                        .timestamp(collaborators.getClock().instant())
                        .action(ExecutionAction.SKIPPED)
                        .reason(reason)
                        .accuracy(research.getAccuracy())
                        .strategy(strategyName)
                        .build());
                broadcast(EngineEvent.EXECUTION, payload(
                        "symbol", symbol,
                        "action", ExecutionAction.SKIPPED,
                        "reason", reason,
                        "strategy", strategyName));
                return;
            }

            initializeStrategy(strategyName, strategyConfig(settings, tradeSize));
            String resolvedStrategy = strategyName;
            TradeDecision decision = ioGuard.call("executeStrategy", () -> collaborators.getStrategyGateway()
                    .executeStrategy(userId, resolvedStrategy, research, book));

            if (decision == null || !decision.isActionable()) {
                String reason = decision != null && decision.getReason() != null
                        ? decision.getReason()
                        : "Strategy returned HOLD";
                saveLog(ExecutionLog.builder()
                        .symbol(symbol)
                        .timestamp(collaborators.getClock().instant())
                        .action(ExecutionAction.SKIPPED)
                        .reason(reason)
                        .accuracy(research.getAccuracy())
                        .strategy(strategyName)
                        .build());
                broadcast(EngineEvent.EXECUTION, payload(
                        "symbol", symbol,
                        "action", ExecutionAction.SKIPPED,
                        "reason", reason,
                        "strategy", strategyName));
                return;
            }
            if (!isCurrent(runGeneration)) {
                return;
            }

            OrderRequest request = OrderRequest.from(symbol, decision);
            Order order = ioGuard.call("placeOrder", () -> orderGateway.placeOrder(userId, request));
            if (order == null) {
                throw new TradingException("Order not acknowledged for " + symbol);
            }
            onExecuted(symbol, research, decision, order, strategyName, cycleStart);
        } catch (Exception e) {
            log.error("Trade execution failed userId={} symbol={} strategy={}", userId, symbol, strategyName, e);
            recordFailure(symbol, research, strategyName, e);
        }
    }

    private void onExecuted(String symbol, ResearchResult research, TradeDecision decision, Order order,
                            String strategyName, Instant cycleStart) {
        Instant now = collaborators.getClock().instant();
        long latencyMs = Duration.between(cycleStart, now).toMillis();
        BigDecimal decisionPrice = decision.getPrice();
        BigDecimal fillPrice = order.effectivePrice() != null ? order.effectivePrice() : decisionPrice;
        BigDecimal slippage = MoneyUtils.isPositive(decisionPrice) && fillPrice != null
                ? MoneyUtils.ratio(fillPrice.subtract(decisionPrice).abs(), decisionPrice)
                : BigDecimal.ZERO;

        collaborators.getRiskManager().recordTradeResult(userId, MoneyUtils.ZERO, true);

        String tradeId = ioGuard.call("saveTrade", () -> collaborators.getRecordStore().saveTrade(userId,
                TradeRecord.builder()
                        .symbol(symbol)
                        .side(order.getSide())
                        .quantity(order.getQuantity())
                        .entryPrice(fillPrice)
                        .timestamp(now)
                        .engineType(ENGINE_TYPE)
                        .orderId(order.getId())
                        .strategy(strategyName)
                        .build()));
        incrementTradeCounters();

        saveLog(ExecutionLog.builder()
                .symbol(symbol)
                .timestamp(now)
                .action(ExecutionAction.EXECUTED)
                .accuracy(research.getAccuracy())
                .accuracyUsed(research.getAccuracy())
                .orderId(order.getId())
                .executionLatencyMs(latencyMs)
                .slippage(slippage)
                .strategy(strategyName)
                .signal(research.getSignal())
                .pnl(MoneyUtils.ZERO)
                .status(order.getStatus())
                .build());

        ioGuard.run("logActivity", () -> collaborators.getRecordStore().logActivity(userId, ACTIVITY_TRADE_EXECUTED,
                payload(
                        "message", "Auto-trade executed: " + order.getSide() + " " + MoneyUtils.plain(order.getQuantity())
                                + " " + symbol + " at " + MoneyUtils.plain(fillPrice),
                        "symbol", symbol,
                        "side", order.getSide(),
                        "price", fillPrice,
                        "quantity", order.getQuantity(),
                        "orderId", order.getId(),
                        "tradeId", tradeId)));

        Map<String, Object> execution = payload(
                "symbol", symbol,
                "action", ExecutionAction.EXECUTED,
                "orderId", order.getId(),
                "side", order.getSide(),
                "quantity", order.getQuantity(),
                "price", order.getPrice(),
                "accuracy", research.getAccuracy(),
                "executionLatency", latencyMs,
                "slippage", slippage,
                "strategy", strategyName);
        broadcast(EngineEvent.EXECUTION, execution);
        collaborators.getMetricsService().recordTrade(userId, strategyName, true, latencyMs);
        collaborators.getAdminNotificationService().notifyExecutionTrade(userId, execution);

        log.info("Trade executed userId={} symbol={} orderId={} side={} accuracy={} strategy={} latencyMs={}",
                userId, symbol, order.getId(), order.getSide(), research.getAccuracy(), strategyName, latencyMs);
    }

    private void recordFailure(String symbol, ResearchResult research, String strategyName, Exception cause) {
        collaborators.getMetricsService().recordTrade(userId, strategyName, false, null);
        collaborators.getRiskManager().recordTradeResult(userId, MoneyUtils.ZERO, false);
        try {
            saveLog(ExecutionLog.builder()
                    .symbol(symbol)
                    .timestamp(collaborators.getClock().instant())
                    .action(ExecutionAction.SKIPPED)
                    .reason("Execution error: " + cause.getMessage())
                    .accuracy(research.getAccuracy())
                    .strategy(strategyName)
                    .build());
        } catch (RuntimeException e) {
            log.error("Failed to log execution error userId={} symbol={}: {}", userId, symbol, e.getMessage());
        }
    }

    private void initializeStrategy(String strategyName, StrategyConfig strategyConfig) {
        try {
            ioGuard.run("initializeStrategy", () -> collaborators.getStrategyGateway()
                    .initializeStrategy(userId, strategyName, strategyConfig, marketData, orderGateway));
        } catch (StrategyAlreadyInitializedException e) {
            log.debug("Strategy already initialized userId={} strategy={}", userId, strategyName);
        }
    }

    private StrategyConfig strategyConfig(TradingSettings settings, BigDecimal tradeSize) {
        return StrategyConfig.builder()
                .quoteSize(tradeSize)
                .adversePct(settings.getAdversePct() != null ? settings.getAdversePct() : new BigDecimal("0.0002"))
                .cancelMs(settings.getCancelMs() != null ? settings.getCancelMs() : 40L)
                .maxPos(settings.getMaxPos() != null ? settings.getMaxPos() : new BigDecimal("0.01"))
                .build();
    }

    private void incrementTradeCounters() {
        TradingRecordStore recordStore = collaborators.getRecordStore();
        ioGuard.run("updateUserStats", () -> {
            UserStats stats = recordStore.getUser(userId)
                    .orElseGet(() -> UserStats.builder().userId(userId).build());
            recordStore.createOrUpdateUser(userId, stats.toBuilder().totalTrades(stats.getTotalTrades() + 1).build());
        });
        ioGuard.run("updateGlobalStats", () -> {
            GlobalStats stats = recordStore.getGlobalStats();
            if (stats != null) {
                recordStore.updateGlobalStats(stats.toBuilder().totalTrades(stats.getTotalTrades() + 1).build());
            }
        });
    }

    void monitorExits() {
        monitorExits(generation.get());
    }

    /**
     * Closes positions whose exit condition is hit. Throttled to one pass per exit-check interval;
     * failures are logged and never reach the research cycle.
     */
    void monitorExits(long runGeneration) {
        if (positionManagement == null || !isCurrent(runGeneration)) {
            return;
        }
        Instant now = collaborators.getClock().instant();
        Instant last = lastExitCheck.get();
        if (Duration.between(last, now).toMillis() < properties.getExitCheckIntervalMs()
                || !lastExitCheck.compareAndSet(last, now)) {
            return;
        }
        String symbol = config.symbol();
        try {
            OrderBook book = ioGuard.call("getOrderbook",
                    () -> marketData.getOrderbook(symbol, properties.getExitOrderbookDepth()));
            Optional<BigDecimal> mid = book.midPrice();
            if (mid.isEmpty()) {
                return;
            }
            List<Position> positions = ioGuard.call("getOpenPositions",
                    () -> positionManagement.getOpenPositions(userId, symbol));
            for (Position position : positions) {
                if (!isCurrent(runGeneration)) {
                    return;
                }
                if (!MoneyUtils.isPositive(position.getQuantity())) {
                    continue;
                }
                ExitConditionEvaluator.ExitDecision decision = exitEvaluator.evaluate(position, mid.get(), now);
                if (decision.shouldExit()) {
                    closePosition(symbol, position, decision);
                }
            }
        } catch (Exception e) {
            log.debug("Exit monitor skipped userId={} symbol={}", userId, symbol, e);
        }
    }

    private void closePosition(String symbol, Position position, ExitConditionEvaluator.ExitDecision decision) {
        String reason = decision.reason().getLabel();
        try {
            ioGuard.run("closePosition", () -> positionManagement.closePosition(userId, symbol, position.getId()));
            saveLog(ExecutionLog.builder()
                    .symbol(symbol)
                    .timestamp(collaborators.getClock().instant())
                    .action(ExecutionAction.CLOSED)
                    .reason(reason)
                    .status(OrderStatus.FILLED)
                    .build());
            broadcast(EngineEvent.EXECUTION, payload(
                    "symbol", symbol,
                    "action", ExecutionAction.CLOSED,
                    "reason", reason,
                    "positionId", position.getId(),
                    "exitPrice", decision.exitPrice()));
            log.info("Position closed userId={} symbol={} positionId={} reason={}",
                    userId, symbol, position.getId(), reason);
        } catch (RuntimeException e) {
            log.error("Failed to close position userId={} symbol={} positionId={}",
                    userId, symbol, position.getId(), e);
        }
    }

    private Optional<TradingSettings> loadSettings() {
        return ioGuard.call("getSettings", () -> collaborators.getRecordStore().getSettings(userId));
    }

    private void saveLog(ExecutionLog entry) {
        ioGuard.run("saveExecutionLog", () -> collaborators.getRecordStore().saveExecutionLog(userId, entry));
    }

    private void broadcast(String type, Map<String, Object> data) {
        collaborators.getBroadcastService().broadcast(userId, type, data);
    }

    private boolean isCurrent(long runGeneration) {
        return running.get() && generation.get() == runGeneration;
    }

    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            data.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return data;
    }

    record GateDecision(boolean execute, String reason) {
        static GateDecision proceed() {
            return new GateDecision(true, null);
        }

        static GateDecision skip(String reason) {
            return new GateDecision(false, reason);
        }
    }
}
