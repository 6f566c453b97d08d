package com.dlxtrade.backend.service.engine;

import com.dlxtrade.backend.config.EngineProperties;
import com.dlxtrade.backend.port.PositionLedger;
import com.dlxtrade.backend.port.ResearchService;
import com.dlxtrade.backend.port.StrategyGateway;
import com.dlxtrade.backend.port.TradingRecordStore;
import com.dlxtrade.backend.service.AdminNotificationService;
import com.dlxtrade.backend.service.BroadcastService;
import com.dlxtrade.backend.service.IoGuard;
import com.dlxtrade.backend.service.MetricsService;
import com.dlxtrade.backend.service.RiskManager;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Shared services handed to every per-user engine. Per-user market data and order gateways are passed separately.
 */
@Value
@Builder
public class EngineCollaborators {
    @NonNull RiskManager riskManager;
    @NonNull StrategyGateway strategyGateway;
    @NonNull ResearchService researchService;
    @NonNull TradingRecordStore recordStore;
    @NonNull PositionLedger positionLedger;
    @NonNull MetricsService metricsService;
    @NonNull BroadcastService broadcastService;
    @NonNull AdminNotificationService adminNotificationService;
    @NonNull IoGuard ioGuard;
    @NonNull EngineProperties engineProperties;
    @NonNull ScheduledExecutorService scheduler;
    @NonNull Clock clock;
}
