package com.dlxtrade.backend.service.engine;

import com.dlxtrade.backend.config.EngineProperties;
import com.dlxtrade.backend.dto.EngineStatusView;
import com.dlxtrade.backend.dto.RiskCheckResult;
import com.dlxtrade.backend.exception.EngineConfigurationException;
import com.dlxtrade.backend.model.EngineConfig;
import com.dlxtrade.backend.model.Order;
import com.dlxtrade.backend.model.OrderBook;
import com.dlxtrade.backend.model.OrderRequest;
import com.dlxtrade.backend.model.QuoteSide;
import com.dlxtrade.backend.model.QuoteState;
import com.dlxtrade.backend.port.MarketDataSource;
import com.dlxtrade.backend.port.OrderGateway;
import com.dlxtrade.backend.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Continuous two-sided quoting for one user and symbol.
 * <p>
 * Lifecycle is {@code Stopped -> Running -> Stopped}. Every start bumps a run generation; loop ticks,
 * cancellation timers and in-flight cycles carry the generation they were created under and give up
 * as soon as it is no longer current. Quote state is only touched under {@code stateLock}, and no
 * collaborator call is made while holding it.
 * <p>
 * An order whose cancel is in flight stays in {@code pendingCancels} until the exchange answers. No
 * cycle quotes while that map is non-empty, and a failed cancel puts the id back on its side.
 */
@Slf4j
public class QuoteEngine {

    public static final String ENGINE_TYPE = "quote";

    private final String userId;
    private final OrderGateway orderGateway;
    private final EngineCollaborators collaborators;
    private final EngineProperties.Quote properties;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicReference<OrderBook> latestSnapshot = new AtomicReference<>();

    private volatile EngineConfig config;
    private volatile MarketDataSource marketData;
    private volatile ScheduledFuture<?> loopFuture;
    private volatile MarketDataSource.Subscription subscription;

    private final Object stateLock = new Object();
    private QuoteState quoteState;
    private final Map<QuoteSide, ScheduledFuture<?>> cancelTimers = new EnumMap<>(QuoteSide.class);
    private final Map<QuoteSide, String> pendingCancels = new EnumMap<>(QuoteSide.class);

    public QuoteEngine(String userId, OrderGateway orderGateway, EngineCollaborators collaborators) {
        this.userId = userId;
        this.orderGateway = orderGateway;
        this.collaborators = collaborators;
        this.properties = collaborators.getEngineProperties().getQuote();
    }

    public void start(EngineConfig engineConfig, MarketDataSource source) {
        requireUserContext();
        if (!running.compareAndSet(false, true)) {
            throw new EngineConfigurationException("Quote engine already running for user " + userId);
        }
        long runGeneration = generation.incrementAndGet();
        this.config = engineConfig;
        this.marketData = source;
        latestSnapshot.set(null);
        try {
            subscription = source.subscribeOrderbook(engineConfig.getSymbol(), latestSnapshot::set);
        } catch (RuntimeException e) {
            log.warn("Order book subscription unavailable userId={} symbol={}, polling only: {}",
                    userId, engineConfig.getSymbol(), e.getMessage());
        }
        log.info("Quote engine started userId={} symbol={} quoteSize={} adversePct={} cancelMs={} maxPos={}",
                userId, engineConfig.getSymbol(), MoneyUtils.plain(engineConfig.getQuoteSize()),
                MoneyUtils.plain(engineConfig.getAdverseMovePct()), engineConfig.getCancelIntervalMs(),
                MoneyUtils.plain(engineConfig.getMaxPositionSize()));
        scheduleNext(runGeneration, 0);
    }

    /**
     * Stops the loop, drops pending cancellation timers and cancels resting quotes best-effort.
     * Safe to call repeatedly and while a cycle is in flight.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        generation.incrementAndGet();
        ScheduledFuture<?> loop = loopFuture;
        if (loop != null) {
            loop.cancel(false);
        }
        MarketDataSource.Subscription current = subscription;
        subscription = null;
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close order book subscription userId={}: {}", userId, e.getMessage());
            }
        }

        QuoteState resting;
        synchronized (stateLock) {
            resting = quoteState;
            quoteState = null;
            clearTimersLocked();
        }
        latestSnapshot.set(null);
        if (resting != null) {
            for (QuoteSide side : QuoteSide.values()) {
                cancelSide(resting.orderId(side), side);
            }
        }
        log.info("Quote engine stopped userId={}", userId);
    }

    public boolean isRunning() {
        return running.get();
    }

    public EngineStatusView<EngineConfig> getStatus() {
        return new EngineStatusView<>(running.get(), config);
    }

    Optional<QuoteState> currentQuote() {
        synchronized (stateLock) {
            return Optional.ofNullable(quoteState);
        }
    }

    private void scheduleNext(long runGeneration, long delayMs) {
        if (!isCurrent(runGeneration)) {
            return;
        }
        loopFuture = collaborators.getScheduler().schedule(() -> tick(runGeneration), delayMs, TimeUnit.MILLISECONDS);
    }

    private void tick(long runGeneration) {
        if (!isCurrent(runGeneration)) {
            return;
        }
        long delay = properties.getLoopIntervalMs();
        try {
            runCycle(runGeneration);
        } catch (Exception e) {
            log.error("Quote cycle failed userId={} symbol={}", userId, config.getSymbol(), e);
            delay = properties.getErrorBackoffMs();
        }
        scheduleNext(runGeneration, delay);
    }

    void runCycle() {
        runCycle(generation.get());
    }

    void runCycle(long runGeneration) {
        if (!isCurrent(runGeneration)) {
            return;
        }
        EngineConfig cfg = config;
        RiskCheckResult risk = collaborators.getRiskManager().canTrade(userId, cfg.getSymbol(), cfg.getQuoteSize());
        if (!risk.allowed()) {
            log.debug("Quote cycle blocked userId={} symbol={} reason={}", userId, cfg.getSymbol(), risk.reason());
            return;
        }
        if (!isCurrent(runGeneration)) {
            return;
        }

        OrderBook book = currentBook(cfg);
        Optional<BigDecimal> mid = book.midPrice();
        if (mid.isEmpty() || !isCurrent(runGeneration)) {
            return;
        }
        BigDecimal midPrice = mid.get();
        Instant now = collaborators.getClock().instant();

        QuoteState active;
        boolean cancelInFlight;
        synchronized (stateLock) {
            active = quoteState;
            cancelInFlight = !pendingCancels.isEmpty();
        }
        if (cancelInFlight) {
            log.debug("Cancel in flight userId={} symbol={}, skipping cycle", userId, cfg.getSymbol());
            return;
        }

        long ageMs = active == null ? Long.MAX_VALUE : Duration.between(active.getPlacedAt(), now).toMillis();
        if (active != null && ageMs < cfg.getCancelIntervalMs()) {
            BigDecimal baseline = active.getBaselineMidPrice();
            BigDecimal move = MoneyUtils.ratio(midPrice.subtract(baseline).abs(), baseline);
            if (move.compareTo(cfg.getAdverseMovePct()) > 0) {
                log.info("Adverse selection userId={} symbol={} move={} ageMs={}, cancelling quotes",
                        userId, cfg.getSymbol(), move.toPlainString(), ageMs);
                cancelQuote(active);
                return;
            }
        }

        if (active == null || ageMs > cfg.getCancelIntervalMs() * 2) {
            if (active != null && !cancelQuote(active)) {
                return;
            }
            placeQuotes(runGeneration, cfg, book, midPrice, now);
        }
    }

    private OrderBook currentBook(EngineConfig cfg) {
        OrderBook pushed = latestSnapshot.get();
        if (pushed != null && pushed.timestamp() != null) {
            long ageMs = Duration.between(pushed.timestamp(), collaborators.getClock().instant()).toMillis();
            if (ageMs <= properties.getSnapshotMaxAgeMs()) {
                return pushed;
            }
        }
        MarketDataSource source = marketData;
        return collaborators.getIoGuard().call("getOrderbook",
                () -> source.getOrderbook(cfg.getSymbol(), properties.getOrderbookDepth()));
    }

    void placeQuotes(long runGeneration, EngineConfig cfg, OrderBook book, BigDecimal midPrice, Instant now) {
        requireUserContext();
        BigDecimal spread = book.spread().orElse(BigDecimal.ZERO);
        if (spread.signum() <= 0) {
            log.debug("Locked or crossed book userId={} symbol={}, not quoting", userId, cfg.getSymbol());
            return;
        }
        BigDecimal offset = spread.divide(MoneyUtils.TWO).multiply(properties.getSpreadFraction());
        BigDecimal bidPrice = MoneyUtils.scale(midPrice.subtract(offset));
        BigDecimal askPrice = MoneyUtils.scale(midPrice.add(offset));

        BigDecimal position = collaborators.getIoGuard().call("netPosition",
                () -> collaborators.getPositionLedger().netPosition(userId, cfg.getSymbol()));
        BigDecimal size = cfg.getQuoteSize();
        BigDecimal maxPosition = cfg.getMaxPositionSize();
        long quoteSequence = sequence.incrementAndGet();

        String bidOrderId = null;
        String askOrderId = null;
        try {
            if (position.add(size).compareTo(maxPosition) <= 0 && isCurrent(runGeneration)) {
                bidOrderId = placeSide(cfg, QuoteSide.BID, bidPrice);
            }
            if (position.subtract(size).compareTo(maxPosition.negate()) >= 0 && isCurrent(runGeneration)) {
                askOrderId = placeSide(cfg, QuoteSide.ASK, askPrice);
            }
        } finally {
            commitQuote(runGeneration, QuoteState.builder()
                    .bidOrderId(bidOrderId)
                    .askOrderId(askOrderId)
                    .placedAt(now)
                    .baselineMidPrice(midPrice)
                    .sequence(quoteSequence)
                    .build());
        }
    }

    private String placeSide(EngineConfig cfg, QuoteSide side, BigDecimal price) {
        OrderRequest request = OrderRequest.limit(cfg.getSymbol(), side.orderSide(), cfg.getQuoteSize(), price);
        Order order = collaborators.getIoGuard().call("placeOrder",
                () -> orderGateway.placeOrder(userId, request));
        if (order == null || order.getId() == null) {
            log.warn("Quote not acknowledged userId={} symbol={} side={}", userId, cfg.getSymbol(), side);
            return null;
        }
        log.debug("Quote placed userId={} symbol={} side={} price={} orderId={}",
                userId, cfg.getSymbol(), side, MoneyUtils.plain(price), order.getId());
        return order.getId();
    }

    private void commitQuote(long runGeneration, QuoteState placed) {
        if (placed.isEmpty()) {
            return;
        }
        boolean orphaned;
        synchronized (stateLock) {
            orphaned = !isCurrent(runGeneration);
            if (!orphaned) {
                quoteState = placed;
                clearTimersLocked();
                for (QuoteSide side : QuoteSide.values()) {
                    if (placed.orderId(side) != null) {
                        armTimerLocked(runGeneration, placed.getSequence(), side);
                    }
                }
            }
        }
        if (orphaned) {
            log.info("Engine stopped during placement userId={}, cancelling fresh quotes", userId);
            for (QuoteSide side : QuoteSide.values()) {
                cancelSide(placed.orderId(side), side);
            }
        }
    }

    private void armTimerLocked(long runGeneration, long quoteSequence, QuoteSide side) {
        ScheduledFuture<?> timer = collaborators.getScheduler().schedule(
                () -> onCancelTimer(runGeneration, quoteSequence, side),
                config.getCancelIntervalMs(), TimeUnit.MILLISECONDS);
        cancelTimers.put(side, timer);
    }

    void onCancelTimer(long runGeneration, long quoteSequence, QuoteSide side) {
        String orderId;
        synchronized (stateLock) {
            if (!isCurrent(runGeneration) || quoteState == null || quoteState.getSequence() != quoteSequence) {
                return;
            }
            orderId = quoteState.orderId(side);
            if (orderId == null) {
                return;
            }
            cancelTimers.remove(side);
            QuoteState remaining = quoteState.withoutSide(side);
            quoteState = remaining.isEmpty() ? null : remaining;
            pendingCancels.put(side, orderId);
        }
        settleCancel(quoteSequence, side, orderId, cancelSide(orderId, side));
    }

    /**
     * Cancels every side of {@code expected} if it is still the active quote. Sides whose cancel failed
     * stay tracked so the next cycle retries them instead of quoting on top.
     *
     * @return true when nothing is left resting and no other cancel is in flight
     */
    private boolean cancelQuote(QuoteState expected) {
        synchronized (stateLock) {
            if (quoteState != expected) {
                return quoteState == null && pendingCancels.isEmpty();
            }
            quoteState = null;
            clearTimersLocked();
            for (QuoteSide side : QuoteSide.values()) {
                if (expected.orderId(side) != null) {
                    pendingCancels.put(side, expected.orderId(side));
                }
            }
        }
        boolean allCancelled = true;
        for (QuoteSide side : QuoteSide.values()) {
            String orderId = expected.orderId(side);
            if (orderId != null) {
                boolean cancelled = cancelSide(orderId, side);
                settleCancel(expected.getSequence(), side, orderId, cancelled);
                allCancelled &= cancelled;
            }
        }
        return allCancelled;
    }

    /**
     * Clears the in-flight marker for {@code orderId}. A failed cancel puts the id back on its side,
     * whatever quote sequence is active now, so the next cycle retries it and {@link #stop()} sees it.
     */
    private void settleCancel(long quoteSequence, QuoteSide side, String orderId, boolean cancelled) {
        boolean untracked = false;
        synchronized (stateLock) {
            pendingCancels.remove(side, orderId);
            if (cancelled) {
                return;
            }
            if (!running.get()) {
                untracked = true;
            } else if (quoteState == null) {
                quoteState = QuoteState.builder()
                        .placedAt(Instant.EPOCH)
                        .baselineMidPrice(BigDecimal.ONE)
                        .sequence(quoteSequence)
                        .build()
                        .withSide(side, orderId);
            } else if (quoteState.orderId(side) == null) {
                quoteState = quoteState.withSide(side, orderId);
            } else {
                untracked = true;
            }
        }
        if (untracked) {
            log.error("Quote left resting after failed cancel userId={} side={} orderId={}", userId, side, orderId);
        }
    }

    private boolean cancelSide(String orderId, QuoteSide side) {
        if (orderId == null) {
            return true;
        }
        try {
            collaborators.getIoGuard().run("cancelOrder", () -> orderGateway.cancelOrder(orderId));
            collaborators.getMetricsService().recordCancel(userId, properties.getStrategyName());
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to cancel quote userId={} side={} orderId={}: {}", userId, side, orderId, e.getMessage());
            return false;
        }
    }

    private void clearTimersLocked() {
        cancelTimers.values().forEach(timer -> timer.cancel(false));
        cancelTimers.clear();
    }

    private boolean isCurrent(long runGeneration) {
        return running.get() && generation.get() == runGeneration;
    }

    private void requireUserContext() {
        if (userId == null || userId.isBlank()) {
            throw new EngineConfigurationException("Quote engine requires user context");
        }
    }
}
