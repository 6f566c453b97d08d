package com.dlxtrade.backend.adapter.paper;

import com.dlxtrade.backend.config.EngineProperties;
import com.dlxtrade.backend.model.EngineStatus;
import com.dlxtrade.backend.model.ExecutionLog;
import com.dlxtrade.backend.model.SettingsPatch;
import com.dlxtrade.backend.model.TradingSettings;
import com.dlxtrade.backend.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryTradingRecordStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
    private final InMemoryTradingRecordStore store = new InMemoryTradingRecordStore(clock, new EngineProperties());

    private static InMemoryTradingRecordStore cappedStore(MutableClock clock, int maxRecords) {
        EngineProperties properties = new EngineProperties();
        properties.getPaper().setMaxRecords(maxRecords);
        return new InMemoryTradingRecordStore(clock, properties);
    }

    @Test
    void patchesOnlyStatus() {
        store.putSettings("u1", TradingSettings.builder().symbol("ETHUSDT").autoTradeEnabled(true).build());

        store.saveSettings("u1", SettingsPatch.status(EngineStatus.PAUSED_BY_RISK));

        TradingSettings settings = store.getSettings("u1").orElseThrow();
        assertThat(settings.getStatus()).isEqualTo(EngineStatus.PAUSED_BY_RISK);
        assertThat(settings.getSymbol()).isEqualTo("ETHUSDT");
        assertThat(settings.isAutoTradeEnabled()).isTrue();
    }

    @Test
    void returnsDetachedSettingsCopies() {
        store.putSettings("u1", TradingSettings.builder().autoTradeEnabled(true).build());

        store.getSettings("u1").orElseThrow().setAutoTradeEnabled(false);

        assertThat(store.getSettings("u1").orElseThrow().isAutoTradeEnabled()).isTrue();
        assertThat(store.getSettings("u2")).isEmpty();
    }

    @Test
    void keepsActivityPayloadWithNullValues() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("orderId", "PAPER-1");
        payload.put("tradeId", null);

        store.logActivity("u1", "TRADE_EXECUTED", payload);

        assertThat(store.getActivities("u1")).singleElement().satisfies(activity -> {
            assertThat(activity.type()).isEqualTo("TRADE_EXECUTED");
            assertThat(activity.payload()).containsEntry("tradeId", null);
            assertThat(activity.createdAt()).isEqualTo(clock.instant());
        });
    }

    @Test
    void keepsOnlyNewestRecordsPerUser() {
        InMemoryTradingRecordStore capped = cappedStore(clock, 3);

        for (int i = 1; i <= 5; i++) {
            capped.logActivity("u1", "CYCLE_" + i, Map.of());
            capped.saveExecutionLog("u1", ExecutionLog.builder().reason("skip " + i).build());
        }
        capped.logActivity("u2", "CYCLE_1", Map.of());

        assertThat(capped.getActivities("u1")).extracting(InMemoryTradingRecordStore.Activity::type)
                .containsExactly("CYCLE_3", "CYCLE_4", "CYCLE_5");
        assertThat(capped.getExecutionLogs("u1")).extracting(ExecutionLog::getReason)
                .containsExactly("skip 3", "skip 4", "skip 5");
        assertThat(capped.getActivities("u2")).hasSize(1);
        assertThat(capped.getTrades("u1")).isEmpty();
    }
}
