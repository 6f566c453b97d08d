package com.dlxtrade.backend.dto;

import java.time.Instant;
import java.util.Map;

public record EngineEvent(String type, String userId, Map<String, Object> data, Instant timestamp) {

    public static final String RESEARCH = "research";
    public static final String EXECUTION = "execution";
    public static final String RISK_ALERT = "risk:alert";
    public static final String ENGINE_START = "engine_start";
    public static final String ENGINE_STOP = "engine_stop";

    public EngineEvent {
        data = data == null ? Map.of() : data;
    }
}
