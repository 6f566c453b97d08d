package com.dlxtrade.backend.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum EngineStatus {
    ACTIVE("active"),
    PAUSED_MANUAL("paused_manual"),
    PAUSED_BY_RISK("paused_by_risk");

    private final String value;

    public boolean isPaused() {
        return this != ACTIVE;
    }
}
