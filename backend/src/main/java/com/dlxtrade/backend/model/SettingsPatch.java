package com.dlxtrade.backend.model;

import lombok.Builder;
import lombok.Value;

/**
 * Partial settings update; null fields are left untouched.
 */
@Value
@Builder
public class SettingsPatch {
    EngineStatus status;
    Boolean autoTradeEnabled;

    public static SettingsPatch status(EngineStatus status) {
        return SettingsPatch.builder().status(status).build();
    }

    public void applyTo(TradingSettings settings) {
        if (status != null) {
            settings.setStatus(status);
        }
        if (autoTradeEnabled != null) {
            settings.setAutoTradeEnabled(autoTradeEnabled);
        }
    }
}
