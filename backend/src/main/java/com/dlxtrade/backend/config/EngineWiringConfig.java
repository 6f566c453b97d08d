package com.dlxtrade.backend.config;

import com.dlxtrade.backend.port.PositionLedger;
import com.dlxtrade.backend.port.ResearchService;
import com.dlxtrade.backend.port.StrategyGateway;
import com.dlxtrade.backend.port.TradingRecordStore;
import com.dlxtrade.backend.service.AdminNotificationService;
import com.dlxtrade.backend.service.BroadcastService;
import com.dlxtrade.backend.service.IoGuard;
import com.dlxtrade.backend.service.MetricsService;
import com.dlxtrade.backend.service.RiskManager;
import com.dlxtrade.backend.service.engine.EngineCollaborators;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class EngineWiringConfig {

    @Bean
    public EngineCollaborators engineCollaborators(RiskManager riskManager,
                                                   StrategyGateway strategyGateway,
                                                   ResearchService researchService,
                                                   TradingRecordStore recordStore,
                                                   PositionLedger positionLedger,
                                                   MetricsService metricsService,
                                                   BroadcastService broadcastService,
                                                   AdminNotificationService adminNotificationService,
                                                   IoGuard ioGuard,
                                                   EngineProperties engineProperties,
                                                   @Qualifier("engineScheduler") ScheduledExecutorService engineScheduler,
                                                   Clock clock) {
        return EngineCollaborators.builder()
                .riskManager(riskManager)
                .strategyGateway(strategyGateway)
                .researchService(researchService)
                .recordStore(recordStore)
                .positionLedger(positionLedger)
                .metricsService(metricsService)
                .broadcastService(broadcastService)
                .adminNotificationService(adminNotificationService)
                .ioGuard(ioGuard)
                .engineProperties(engineProperties)
                .scheduler(engineScheduler)
                .clock(clock)
                .build();
    }
}
