package com.dlxtrade.backend.dto;

import com.dlxtrade.backend.model.EngineConfig;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class UserEngineStatus {
    String userId;
    boolean registered;
    EngineStatusView<EngineConfig> quoteEngine;
    EngineStatusView<ExecutionConfig> autoTrade;
    RiskStateSnapshot risk;
}
