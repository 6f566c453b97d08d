package com.dlxtrade.backend.port;

import com.dlxtrade.backend.model.ExecutionLog;
import com.dlxtrade.backend.model.GlobalStats;
import com.dlxtrade.backend.model.SettingsPatch;
import com.dlxtrade.backend.model.TradeRecord;
import com.dlxtrade.backend.model.TradingSettings;
import com.dlxtrade.backend.model.UserStats;

import java.util.Map;
import java.util.Optional;

public interface TradingRecordStore {

    Optional<TradingSettings> getSettings(String userId);

    void saveSettings(String userId, SettingsPatch patch);

    String saveTrade(String userId, TradeRecord trade);

    void saveExecutionLog(String userId, ExecutionLog log);

    void logActivity(String userId, String type, Map<String, Object> payload);

    Optional<UserStats> getUser(String userId);

    void createOrUpdateUser(String userId, UserStats stats);

    GlobalStats getGlobalStats();

    void updateGlobalStats(GlobalStats stats);
}
