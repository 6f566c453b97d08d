package com.dlxtrade.backend.service;

import com.dlxtrade.backend.dto.TradeMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private static final String UNKNOWN_STRATEGY = "unknown";

    private final MeterRegistry meterRegistry;

    private final Map<Key, Aggregate> aggregates = new ConcurrentHashMap<>();

    public void recordTrade(String userId, String strategy, boolean success, Long latencyMs) {
        String strategyTag = strategy == null ? UNKNOWN_STRATEGY : strategy;
        Aggregate aggregate = aggregate(userId, strategyTag);
        if (success) {
            aggregate.tradesExecuted.incrementAndGet();
            Counter.builder("engine_trades_executed_total")
                    .tag("strategy", strategyTag)
                    .register(meterRegistry)
                    .increment();
        } else {
            aggregate.failedOrders.incrementAndGet();
            Counter.builder("engine_failed_orders_total")
                    .tag("strategy", strategyTag)
                    .register(meterRegistry)
                    .increment();
        }
        if (latencyMs != null && latencyMs >= 0) {
            aggregate.totalLatency.addAndGet(latencyMs);
            aggregate.latencyCount.incrementAndGet();
            Timer.builder("engine_execution_latency")
                    .tag("strategy", strategyTag)
                    .register(meterRegistry)
                    .record(Duration.ofMillis(latencyMs));
        }
        log.debug("Trade metric userId={} strategy={} success={} latencyMs={}", userId, strategyTag, success, latencyMs);
    }

    public void recordCancel(String userId, String strategy) {
        String strategyTag = strategy == null ? UNKNOWN_STRATEGY : strategy;
        aggregate(userId, strategyTag).cancels.incrementAndGet();
        Counter.builder("engine_cancels_total")
                .tag("strategy", strategyTag)
                .register(meterRegistry)
                .increment();
    }

    public List<TradeMetrics> getMetrics(String userId) {
        return aggregates.entrySet().stream()
                .filter(entry -> entry.getKey().userId().equals(userId))
                .map(entry -> entry.getValue().snapshot(entry.getKey()))
                .sorted(Comparator.comparing(TradeMetrics::strategy))
                .toList();
    }

    public TradeMetrics getMetrics(String userId, String strategy) {
        Key key = new Key(userId, strategy);
        Aggregate aggregate = aggregates.get(key);
        return aggregate == null ? new Aggregate().snapshot(key) : aggregate.snapshot(key);
    }

    public void reset(String userId) {
        aggregates.keySet().removeIf(key -> key.userId().equals(userId));
    }

    private Aggregate aggregate(String userId, String strategy) {
        return aggregates.computeIfAbsent(new Key(userId, strategy), key -> new Aggregate());
    }

    private record Key(String userId, String strategy) {
    }

    private static final class Aggregate {
        private final AtomicLong tradesExecuted = new AtomicLong();
        private final AtomicLong failedOrders = new AtomicLong();
        private final AtomicLong cancels = new AtomicLong();
        private final AtomicLong totalLatency = new AtomicLong();
        private final AtomicLong latencyCount = new AtomicLong();

        private TradeMetrics snapshot(Key key) {
            return new TradeMetrics(key.userId(), key.strategy(), tradesExecuted.get(), failedOrders.get(),
                    cancels.get(), totalLatency.get(), latencyCount.get());
        }
    }
}
