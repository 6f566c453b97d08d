package com.dlxtrade.backend.service;

import com.dlxtrade.backend.config.EngineProperties;
import com.dlxtrade.backend.dto.EngineEvent;
import com.dlxtrade.backend.dto.EngineStatusView;
import com.dlxtrade.backend.dto.UserEngineStatus;
import com.dlxtrade.backend.event.EnginePauseRequestedEvent;
import com.dlxtrade.backend.exception.EngineConfigurationException;
import com.dlxtrade.backend.model.EngineConfig;
import com.dlxtrade.backend.model.TradingSettings;
import com.dlxtrade.backend.port.ExchangeConnectorFactory;
import com.dlxtrade.backend.port.TradingRecordStore;
import com.dlxtrade.backend.service.engine.EngineCollaborators;
import com.dlxtrade.backend.service.engine.ExecutionOrchestrator;
import com.dlxtrade.backend.service.engine.QuoteEngine;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of per-user engine pairs. Each user gets one {@link QuoteEngine} and one
 * {@link ExecutionOrchestrator}, built on that user's exchange connection.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UserEngineManager {

    private static final BigDecimal DEFAULT_ADVERSE_PCT = new BigDecimal("0.0002");
    private static final long DEFAULT_CANCEL_MS = 40L;
    private static final BigDecimal DEFAULT_MAX_POS = new BigDecimal("0.01");

    private final EngineCollaborators collaborators;
    private final ExchangeConnectorFactory connectorFactory;
    private final TradingRecordStore recordStore;
    private final IoGuard ioGuard;
    private final BroadcastService broadcastService;
    private final AdminNotificationService adminNotificationService;
    private final EngineProperties engineProperties;

    private final Map<String, UserEngine> engines = new ConcurrentHashMap<>();

    public void createUserEngine(String userId) {
        stopUserEngine(userId);
        engines.put(userId, buildEngine(userId));
        log.info("User engine created userId={}", userId);
    }

    public void startAutoTrade(String userId) {
        TradingSettings settings = requireSettings(userId);
        if (!settings.isAutoTradeEnabled()) {
            throw new EngineConfigurationException("Auto-trade not enabled in settings");
        }
        String symbol = symbolOf(settings);
        UserEngine engine = engines.computeIfAbsent(userId, this::buildEngine);
        engine.orchestrator().start(symbol, engineProperties.getExecution().getDefaultIntervalMs());
        announceStart(userId, ExecutionOrchestrator.ENGINE_TYPE, symbol);
        log.info("Auto-trade started userId={} symbol={}", userId, symbol);
    }

    public void stopAutoTrade(String userId) {
        UserEngine engine = engines.get(userId);
        if (engine != null && engine.orchestrator().isRunning()) {
            engine.orchestrator().stop();
            announceStop(userId, ExecutionOrchestrator.ENGINE_TYPE);
        }
        log.info("Auto-trade stopped userId={}", userId);
    }

    public void startQuoting(String userId) {
        TradingSettings settings = requireSettings(userId);
        EngineConfig config = EngineConfig.builder()
                .symbol(symbolOf(settings))
                .quoteSize(settings.getQuoteSize() != null
                        ? settings.getQuoteSize()
                        : engineProperties.getExecution().getDefaultTradeSize())
                .adverseMovePct(settings.getAdversePct() != null ? settings.getAdversePct() : DEFAULT_ADVERSE_PCT)
                .cancelIntervalMs(settings.getCancelMs() != null ? settings.getCancelMs() : DEFAULT_CANCEL_MS)
                .maxPositionSize(settings.getMaxPos() != null ? settings.getMaxPos() : DEFAULT_MAX_POS)
                .build();
        UserEngine engine = engines.computeIfAbsent(userId, this::buildEngine);
        engine.quoteEngine().start(config, engine.connection().marketData());
        announceStart(userId, QuoteEngine.ENGINE_TYPE, config.getSymbol());
    }

    public void stopQuoting(String userId) {
        UserEngine engine = engines.get(userId);
        if (engine != null && engine.quoteEngine().isRunning()) {
            engine.quoteEngine().stop();
            announceStop(userId, QuoteEngine.ENGINE_TYPE);
        }
    }

    /**
     * Stops both engines and forgets the user's connection.
     */
    public void stopUserEngine(String userId) {
        UserEngine engine = engines.remove(userId);
        if (engine == null) {
            return;
        }
        stopEngines(userId, engine);
        log.info("User engine stopped and removed userId={}", userId);
    }

    /**
     * Stops running engines but keeps them registered for a later restart.
     */
    public void stopUserEngineRunning(String userId) {
        UserEngine engine = engines.get(userId);
        if (engine != null) {
            stopEngines(userId, engine);
        }
    }

    public UserEngineStatus getUserEngineStatus(String userId) {
        UserEngine engine = engines.get(userId);
        UserEngineStatus.UserEngineStatusBuilder status = UserEngineStatus.builder()
                .userId(userId)
                .registered(engine != null)
                .risk(collaborators.getRiskManager().getState(userId).orElse(null));
        if (engine == null) {
            return status
                    .quoteEngine(EngineStatusView.stopped())
                    .autoTrade(EngineStatusView.stopped())
                    .build();
        }
        return status
                .quoteEngine(engine.quoteEngine().getStatus())
                .autoTrade(engine.orchestrator().getStatus())
                .build();
    }

    @EventListener
    public void onPauseRequested(EnginePauseRequestedEvent event) {
        log.warn("Stopping engines on pause userId={} status={} reason={}",
                event.userId(), event.status().getValue(), event.reason());
        stopUserEngineRunning(event.userId());
        broadcastService.broadcast(event.userId(), EngineEvent.RISK_ALERT, Map.of(
                "status", event.status().getValue(),
                "reason", event.reason()));
    }

    @PreDestroy
    public void shutdown() {
        List<String> userIds = List.copyOf(engines.keySet());
        userIds.forEach(this::stopUserEngine);
        log.info("Engine registry shut down, stopped {} user engines", userIds.size());
    }

    private void stopEngines(String userId, UserEngine engine) {
        if (engine.quoteEngine().isRunning()) {
            engine.quoteEngine().stop();
            announceStop(userId, QuoteEngine.ENGINE_TYPE);
        }
        if (engine.orchestrator().isRunning()) {
            engine.orchestrator().stop();
            announceStop(userId, ExecutionOrchestrator.ENGINE_TYPE);
        }
    }

    private UserEngine buildEngine(String userId) {
        ExchangeConnectorFactory.ExchangeConnection connection = connectorFactory.connect(userId);
        return new UserEngine(
                connection,
                new QuoteEngine(userId, connection.orderGateway(), collaborators),
                new ExecutionOrchestrator(userId, connection.marketData(), connection.orderGateway(), collaborators));
    }

    private TradingSettings requireSettings(String userId) {
        return ioGuard.call("getSettings", () -> recordStore.getSettings(userId))
                .orElseThrow(() -> new EngineConfigurationException("Settings not found for user " + userId));
    }

    private String symbolOf(TradingSettings settings) {
        return settings.getSymbol() != null && !settings.getSymbol().isBlank()
                ? settings.getSymbol()
                : engineProperties.getExecution().getDefaultSymbol();
    }

    private void announceStart(String userId, String engineType, String symbol) {
        broadcastService.broadcast(userId, EngineEvent.ENGINE_START, Map.of("engineType", engineType, "symbol", symbol));
        adminNotificationService.notifyEngineStart(userId, engineType);
    }

    private void announceStop(String userId, String engineType) {
        broadcastService.broadcast(userId, EngineEvent.ENGINE_STOP, Map.of("engineType", engineType));
        adminNotificationService.notifyEngineStop(userId, engineType);
    }

    private record UserEngine(ExchangeConnectorFactory.ExchangeConnection connection,
                              QuoteEngine quoteEngine,
                              ExecutionOrchestrator orchestrator) {
    }
}
