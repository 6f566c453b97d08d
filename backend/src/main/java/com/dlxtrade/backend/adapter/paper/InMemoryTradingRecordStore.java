package com.dlxtrade.backend.adapter.paper;

import com.dlxtrade.backend.config.EngineProperties;
import com.dlxtrade.backend.model.ExecutionLog;
import com.dlxtrade.backend.model.GlobalStats;
import com.dlxtrade.backend.model.SettingsPatch;
import com.dlxtrade.backend.model.TradeRecord;
import com.dlxtrade.backend.model.TradingSettings;
import com.dlxtrade.backend.model.UserStats;
import com.dlxtrade.backend.port.TradingRecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Paper-mode record store. Trades, execution logs and activities keep only the newest
 * {@code engine.paper.max-records} entries per user.
 */
@Component
@Slf4j
public class InMemoryTradingRecordStore implements TradingRecordStore {

    private final Clock clock;
    private final int maxRecords;

    private final Map<String, TradingSettings> settings = new ConcurrentHashMap<>();
    private final Map<String, RecentRecords<StoredTrade>> trades = new ConcurrentHashMap<>();
    private final Map<String, RecentRecords<ExecutionLog>> executionLogs = new ConcurrentHashMap<>();
    private final Map<String, RecentRecords<Activity>> activities = new ConcurrentHashMap<>();
    private final Map<String, UserStats> users = new ConcurrentHashMap<>();
    private final AtomicReference<GlobalStats> globalStats = new AtomicReference<>(GlobalStats.builder().build());

    public InMemoryTradingRecordStore(Clock clock, EngineProperties engineProperties) {
        this.clock = clock;
        this.maxRecords = engineProperties.getPaper().getMaxRecords();
    }

    public void putSettings(String userId, TradingSettings value) {
        settings.put(userId, value.toBuilder().build());
    }

    @Override
    public Optional<TradingSettings> getSettings(String userId) {
        TradingSettings stored = settings.get(userId);
        return stored == null ? Optional.empty() : Optional.of(stored.toBuilder().build());
    }

    @Override
    public void saveSettings(String userId, SettingsPatch patch) {
        settings.compute(userId, (key, current) -> {
            TradingSettings updated = current == null ? new TradingSettings() : current.toBuilder().build();
            patch.applyTo(updated);
            return updated;
        });
        log.debug("Settings saved userId={} status={}", userId, patch.getStatus());
    }

    @Override
    public String saveTrade(String userId, TradeRecord trade) {
        String tradeId = UUID.randomUUID().toString();
        recordsOf(trades, userId).add(new StoredTrade(tradeId, trade));
        return tradeId;
    }

    @Override
    public void saveExecutionLog(String userId, ExecutionLog entry) {
        recordsOf(executionLogs, userId).add(entry);
    }

    @Override
    public void logActivity(String userId, String type, Map<String, Object> payload) {
        recordsOf(activities, userId)
                .add(new Activity(type, Collections.unmodifiableMap(new LinkedHashMap<>(payload)), clock.instant()));
    }

    @Override
    public Optional<UserStats> getUser(String userId) {
        return Optional.ofNullable(users.get(userId));
    }

    @Override
    public void createOrUpdateUser(String userId, UserStats stats) {
        users.put(userId, stats.toBuilder().userId(userId).build());
    }

    @Override
    public GlobalStats getGlobalStats() {
        return globalStats.get();
    }

    @Override
    public void updateGlobalStats(GlobalStats stats) {
        globalStats.set(stats);
    }

    public List<StoredTrade> getTrades(String userId) {
        return snapshot(trades, userId);
    }

    public List<ExecutionLog> getExecutionLogs(String userId) {
        return snapshot(executionLogs, userId);
    }

    public List<Activity> getActivities(String userId) {
        return snapshot(activities, userId);
    }

    private <T> RecentRecords<T> recordsOf(Map<String, RecentRecords<T>> byUser, String userId) {
        return byUser.computeIfAbsent(userId, key -> new RecentRecords<>(maxRecords));
    }

    private static <T> List<T> snapshot(Map<String, RecentRecords<T>> byUser, String userId) {
        RecentRecords<T> records = byUser.get(userId);
        return records == null ? List.of() : records.snapshot();
    }

    /**
     * Oldest-first window that drops its head once full.
     */
    private static final class RecentRecords<T> {
        private final int capacity;
        private final Deque<T> entries = new ArrayDeque<>();

        private RecentRecords(int capacity) {
            this.capacity = capacity;
        }

        synchronized void add(T entry) {
            if (entries.size() == capacity) {
                entries.removeFirst();
            }
            entries.addLast(entry);
        }

        synchronized List<T> snapshot() {
            return List.copyOf(entries);
        }
    }

    public record StoredTrade(String id, TradeRecord trade) {
    }

    public record Activity(String type, Map<String, Object> payload, Instant createdAt) {
    }
}
