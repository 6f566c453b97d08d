package com.dlxtrade.backend.service.engine;

import com.dlxtrade.backend.config.EngineProperties;
import com.dlxtrade.backend.dto.EngineEvent;
import com.dlxtrade.backend.dto.RiskCheckResult;
import com.dlxtrade.backend.exception.EngineConfigurationException;
import com.dlxtrade.backend.exception.StrategyAlreadyInitializedException;
import com.dlxtrade.backend.model.ExecutionAction;
import com.dlxtrade.backend.model.ExecutionLog;
import com.dlxtrade.backend.model.GlobalStats;
import com.dlxtrade.backend.model.Order;
import com.dlxtrade.backend.model.OrderRequest;
import com.dlxtrade.backend.model.OrderSide;
import com.dlxtrade.backend.model.OrderStatus;
import com.dlxtrade.backend.model.OrderType;
import com.dlxtrade.backend.model.Position;
import com.dlxtrade.backend.model.ResearchResult;
import com.dlxtrade.backend.model.Signal;
import com.dlxtrade.backend.model.TradeAction;
import com.dlxtrade.backend.model.TradeDecision;
import com.dlxtrade.backend.model.TradeRecord;
import com.dlxtrade.backend.model.TradingSettings;
import com.dlxtrade.backend.model.UserStats;
import com.dlxtrade.backend.port.MarketDataSource;
import com.dlxtrade.backend.port.OrderGateway;
import com.dlxtrade.backend.port.PositionLedger;
import com.dlxtrade.backend.port.PositionManagement;
import com.dlxtrade.backend.port.ResearchService;
import com.dlxtrade.backend.port.StrategyGateway;
import com.dlxtrade.backend.port.TradingRecordStore;
import com.dlxtrade.backend.service.AdminNotificationService;
import com.dlxtrade.backend.service.BroadcastService;
import com.dlxtrade.backend.service.MetricsService;
import com.dlxtrade.backend.service.RiskManager;
import com.dlxtrade.backend.support.MutableClock;
import com.dlxtrade.backend.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static com.dlxtrade.backend.support.TestFixtures.SYMBOL;
import static com.dlxtrade.backend.support.TestFixtures.USER;
import static com.dlxtrade.backend.support.TestFixtures.book;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

class ExecutionOrchestratorTest {

    private static final String STRATEGY = "orderbook_imbalance";
    private static final long INTERVAL_MS = 5000;

    private RiskManager riskManager;
    private StrategyGateway strategyGateway;
    private ResearchService researchService;
    private TradingRecordStore recordStore;
    private MetricsService metricsService;
    private BroadcastService broadcastService;
    private AdminNotificationService adminNotificationService;
    private MarketDataSource marketData;
    private OrderGateway orderGateway;
    private PositionManagement positionManagement;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> future;
    private MutableClock clock;
    private TradingSettings settings;
    private ExecutionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        riskManager = mock(RiskManager.class);
        strategyGateway = mock(StrategyGateway.class);
        researchService = mock(ResearchService.class);
        recordStore = mock(TradingRecordStore.class);
        metricsService = mock(MetricsService.class);
        broadcastService = mock(BroadcastService.class);
        adminNotificationService = mock(AdminNotificationService.class);
        marketData = mock(MarketDataSource.class);
        orderGateway = mock(OrderGateway.class, withSettings().extraInterfaces(PositionManagement.class));
        positionManagement = (PositionManagement) orderGateway;
        scheduler = mock(ScheduledExecutorService.class);
        future = mock(ScheduledFuture.class);
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));

        doReturn(future).when(scheduler).scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
        doReturn(future).when(scheduler).scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));

        settings = TradingSettings.builder()
                .autoTradeEnabled(true)
                .minAccuracyThreshold(0.7)
                .strategy(STRATEGY)
                .quoteSize(new BigDecimal("0.001"))
                .build();
        when(recordStore.getSettings(USER)).thenAnswer(invocation -> Optional.of(settings));
        when(recordStore.saveTrade(eq(USER), any(TradeRecord.class))).thenReturn("trade-1");
        when(recordStore.getUser(USER)).thenReturn(Optional.of(UserStats.builder().userId(USER).totalTrades(4).build()));
        when(recordStore.getGlobalStats()).thenReturn(GlobalStats.builder().totalTrades(10).build());
        givenResearch(Signal.BUY, 0.9);
        when(marketData.getOrderbook(eq(SYMBOL), anyInt())).thenReturn(book("49999", "50001", clock.instant()));
        when(riskManager.canTrade(anyString(), anyString(), any(BigDecimal.class), any(), any()))
                .thenReturn(RiskCheckResult.allow());
        when(strategyGateway.executeStrategy(eq(USER), eq(STRATEGY), any(ResearchResult.class), any()))
                .thenReturn(buyDecision());
        when(orderGateway.placeOrder(eq(USER), any(OrderRequest.class))).thenReturn(Order.builder()
                .id("PAPER-1")
                .symbol(SYMBOL)
                .side(OrderSide.BUY)
                .type(OrderType.LIMIT)
                .quantity(new BigDecimal("0.001"))
                .price(new BigDecimal("50000"))
                .avgPrice(new BigDecimal("50010"))
                .status(OrderStatus.FILLED)
                .build());

        orchestrator = new ExecutionOrchestrator(USER, marketData, orderGateway, collaborators());
    }

    private EngineCollaborators collaborators() {
        return EngineCollaborators.builder()
                .riskManager(riskManager)
                .strategyGateway(strategyGateway)
                .researchService(researchService)
                .recordStore(recordStore)
                .positionLedger(mock(PositionLedger.class))
                .metricsService(metricsService)
                .broadcastService(broadcastService)
                .adminNotificationService(adminNotificationService)
                .ioGuard(TestFixtures.directIoGuard())
                .engineProperties(new EngineProperties())
                .scheduler(scheduler)
                .clock(clock)
                .build();
    }

    private void givenResearch(Signal signal, double accuracy) {
        when(researchService.runResearch(eq(USER), eq(SYMBOL), any())).thenAnswer(invocation -> {
            clock.advanceMillis(12);
            return ResearchResult.builder()
                    .symbol(SYMBOL)
                    .signal(signal)
                    .accuracy(accuracy)
                    .recommendedAction(signal.name())
                    .orderbookImbalance(0.4)
                    .build();
        });
    }

    private static TradeDecision buyDecision() {
        return TradeDecision.builder()
                .action(TradeAction.BUY)
                .orderType(OrderType.LIMIT)
                .quantity(new BigDecimal("0.001"))
                .price(new BigDecimal("50000"))
                .reason("Orderbook imbalance")
                .build();
    }

    private List<ExecutionLog> savedLogs() {
        ArgumentCaptor<ExecutionLog> captor = ArgumentCaptor.forClass(ExecutionLog.class);
        verify(recordStore, atLeast(0)).saveExecutionLog(eq(USER), captor.capture());
        return captor.getAllValues();
    }

    private ExecutionLog singleLog() {
        ArgumentCaptor<ExecutionLog> captor = ArgumentCaptor.forClass(ExecutionLog.class);
        verify(recordStore).saveExecutionLog(eq(USER), captor.capture());
        return captor.getValue();
    }

    @Test
    void schedulesCycleAndExitMonitorOnStart() {
        orchestrator.start(SYMBOL, INTERVAL_MS);

        verify(scheduler).scheduleAtFixedRate(any(Runnable.class), eq(0L), eq(INTERVAL_MS), eq(TimeUnit.MILLISECONDS));
        verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(2000L), eq(2000L), eq(TimeUnit.MILLISECONDS));
        assertThat(orchestrator.isRunning()).isTrue();
        assertThat(orchestrator.supportsExitMonitoring()).isTrue();
        assertThat(orchestrator.getStatus().config().symbol()).isEqualTo(SYMBOL);
        assertThat(orchestrator.getStatus().config().intervalMs()).isEqualTo(INTERVAL_MS);
    }

    @Test
    void executesTradeWhenAllGatesPass() {
        orchestrator.start(SYMBOL, INTERVAL_MS);

        orchestrator.runCycle();

        InOrder order = inOrder(riskManager, orderGateway);
        order.verify(riskManager).canTrade(eq(USER), eq(SYMBOL), eq(new BigDecimal("0.001")), any(), any());
        order.verify(orderGateway).placeOrder(eq(USER), any(OrderRequest.class));
        order.verify(riskManager).recordTradeResult(eq(USER), any(BigDecimal.class), eq(true));

        ExecutionLog log = singleLog();
        assertThat(log.getAction()).isEqualTo(ExecutionAction.EXECUTED);
        assertThat(log.getOrderId()).isEqualTo("PAPER-1");
        assertThat(log.getExecutionLatencyMs()).isEqualTo(12L);
        assertThat(log.getSlippage()).isEqualByComparingTo("0.0002");
        assertThat(log.getStrategy()).isEqualTo(STRATEGY);
        assertThat(log.getStatus()).isEqualTo(OrderStatus.FILLED);

        ArgumentCaptor<TradeRecord> trade = ArgumentCaptor.forClass(TradeRecord.class);
        verify(recordStore).saveTrade(eq(USER), trade.capture());
        assertThat(trade.getValue().getEngineType()).isEqualTo("auto");
        assertThat(trade.getValue().getEntryPrice()).isEqualByComparingTo("50010");

        verify(recordStore).createOrUpdateUser(USER, UserStats.builder().userId(USER).totalTrades(5).build());
        verify(recordStore).updateGlobalStats(GlobalStats.builder().totalTrades(11).build());
        verify(recordStore).logActivity(eq(USER), eq("TRADE_EXECUTED"), argThat(payload ->
                "trade-1".equals(payload.get("tradeId"))
                        && String.valueOf(payload.get("message")).startsWith("Auto-trade executed: BUY 0.001 BTCUSDT")));
        verify(metricsService).recordTrade(USER, STRATEGY, true, 12L);
        verify(adminNotificationService).notifyExecutionTrade(eq(USER), argThat(payload ->
                "PAPER-1".equals(payload.get("orderId")) && Long.valueOf(12L).equals(payload.get("executionLatency"))));
        verify(broadcastService).broadcast(eq(USER), eq(EngineEvent.RESEARCH), anyMap());
        verify(broadcastService).broadcast(eq(USER), eq(EngineEvent.EXECUTION), argThat(payload ->
                ExecutionAction.EXECUTED.equals(payload.get("action"))));
    }

    @Test
    void skipsWhenAutoTradeDisabled() {
        settings.setAutoTradeEnabled(false);
        orchestrator.start(SYMBOL, INTERVAL_MS);

        orchestrator.runCycle();

        ExecutionLog log = singleLog();
        assertThat(log.getAction()).isEqualTo(ExecutionAction.SKIPPED);
        assertThat(log.getReason()).isEqualTo("Auto-trade disabled");
        verify(riskManager, never()).canTrade(anyString(), anyString(), any(BigDecimal.class), any(), any());
        verify(orderGateway, never()).placeOrder(anyString(), any());
        verify(broadcastService).broadcast(eq(USER), eq(EngineEvent.RESEARCH), anyMap());
    }

    @ParameterizedTest
    @CsvSource({
            "0.5, 0.7, Accuracy 50.0% below threshold 70.0%",
            "0.84, 0.85, Accuracy 84.0% below threshold 85.0%"
    })
    void gateRejectsLowAccuracy(double accuracy, double threshold, String reason) {
        ResearchResult research = ResearchResult.builder().symbol(SYMBOL).signal(Signal.BUY).accuracy(accuracy).build();

        ExecutionOrchestrator.GateDecision gate = ExecutionOrchestrator.gate(research, threshold, true);

        assertThat(gate.execute()).isFalse();
        assertThat(gate.reason()).isEqualTo(reason);
    }

    @Test
    void gateChecksAutoTradeBeforeAccuracyAndSignal() {
        ResearchResult research = ResearchResult.builder().symbol(SYMBOL).signal(Signal.HOLD).accuracy(0.1).build();

        assertThat(ExecutionOrchestrator.gate(research, 0.85, false).reason()).isEqualTo("Auto-trade disabled");
        assertThat(ExecutionOrchestrator.gate(research, 0.05, true).reason()).isEqualTo("HOLD signal");
        assertThat(ExecutionOrchestrator.gate(
                ResearchResult.builder().signal(Signal.SELL).accuracy(0.9).build(), 0.85, true).execute()).isTrue();
    }

    @Test
    void fallsBackToDefaultThresholdWhenUnset() {
        settings.setMinAccuracyThreshold(null);
        givenResearch(Signal.BUY, 0.8);
        orchestrator.start(SYMBOL, INTERVAL_MS);

        orchestrator.runCycle();

        assertThat(singleLog().getReason()).isEqualTo("Accuracy 80.0% below threshold 85.0%");
        verify(orderGateway, never()).placeOrder(anyString(), any());
    }

    @Test
    void skipsHoldSignal() {
        givenResearch(Signal.HOLD, 0.95);
        orchestrator.start(SYMBOL, INTERVAL_MS);

        orchestrator.runCycle();

        assertThat(singleLog().getReason()).isEqualTo("HOLD signal");
        verify(strategyGateway, never()).executeStrategy(anyString(), anyString(), any(), any());
    }

    @Test
    void raisesRiskAlertWhenRiskDenies() {
        when(riskManager.canTrade(anyString(), anyString(), any(BigDecimal.class), any(), any()))
                .thenReturn(RiskCheckResult.deny("Per-trade risk exceeded"));
        orchestrator.start(SYMBOL, INTERVAL_MS);

        orchestrator.runCycle();

        assertThat(singleLog().getReason()).isEqualTo("Per-trade risk exceeded");
        verify(broadcastService).broadcast(eq(USER), eq(EngineEvent.RISK_ALERT), argThat(payload ->
                "Per-trade risk exceeded".equals(payload.get("reason"))));
        verify(orderGateway, never()).placeOrder(anyString(), any());
        verify(riskManager, never()).recordTradeResult(anyString(), any(), anyBoolean());
    }

    @Test
    void rejectsMarketMakingStrategy() {
        settings.setStrategy("market_making_hft");
        orchestrator.start(SYMBOL, INTERVAL_MS);

        orchestrator.runCycle();

        ExecutionLog log = singleLog();
        assertThat(log.getReason()).isEqualTo("Strategy market_making_hft runs only in the quote engine");
        assertThat(log.getStrategy()).isEqualTo("market_making_hft");
        verify(strategyGateway, never()).initializeStrategy(anyString(), anyString(), any(), any(), any());
        verify(orderGateway, never()).placeOrder(anyString(), any());
    }

    @Test
    void toleratesStrategyAlreadyInitialized() {
        doThrow(new StrategyAlreadyInitializedException(USER, STRATEGY))
                .when(strategyGateway).initializeStrategy(eq(USER), eq(STRATEGY), any(), any(), any());
        orchestrator.start(SYMBOL, INTERVAL_MS);

        orchestrator.runCycle();

        verify(orderGateway).placeOrder(eq(USER), any(OrderRequest.class));
        assertThat(singleLog().getAction()).isEqualTo(ExecutionAction.EXECUTED);
    }

    @Test
    void logsStrategyHoldReason() {
        when(strategyGateway.executeStrategy(eq(USER), eq(STRATEGY), any(ResearchResult.class), any()))
                .thenReturn(TradeDecision.hold("No directional signal"));
        orchestrator.start(SYMBOL, INTERVAL_MS);

        orchestrator.runCycle();

        assertThat(singleLog().getReason()).isEqualTo("No directional signal");
        verify(orderGateway, never()).placeOrder(anyString(), any());
    }

    @Test
    void treatsMissingDecisionAsHold() {
        when(strategyGateway.executeStrategy(eq(USER), eq(STRATEGY), any(ResearchResult.class), any()))
                .thenReturn(null);
        orchestrator.start(SYMBOL, INTERVAL_MS);

        orchestrator.runCycle();

        assertThat(singleLog().getReason()).isEqualTo("Strategy returned HOLD");
    }

    @Test
    void recordsFailureWhenPlacementThrows() {
        when(orderGateway.placeOrder(eq(USER), any(OrderRequest.class))).thenThrow(new IllegalStateException("exchange down"));
        orchestrator.start(SYMBOL, INTERVAL_MS);

        assertThatCode(orchestrator::runCycle).doesNotThrowAnyException();

        assertThat(singleLog().getReason()).isEqualTo("Execution error: exchange down");
        verify(metricsService).recordTrade(USER, STRATEGY, false, null);
        verify(riskManager).recordTradeResult(eq(USER), any(BigDecimal.class), eq(false));
        verify(recordStore, never()).saveTrade(anyString(), any());
    }

    @Test
    void recordsFailureWhenOrderNotAcknowledged() {
        when(orderGateway.placeOrder(eq(USER), any(OrderRequest.class))).thenReturn(null);
        orchestrator.start(SYMBOL, INTERVAL_MS);

        orchestrator.runCycle();

        assertThat(singleLog().getReason()).isEqualTo("Execution error: Order not acknowledged for BTCUSDT");
        verify(riskManager).recordTradeResult(eq(USER), any(BigDecimal.class), eq(false));
    }

    @Test
    void recordsFailureWhenSettingsDisappearMidCycle() {
        when(recordStore.getSettings(USER)).thenReturn(Optional.of(settings), Optional.empty());
        orchestrator.start(SYMBOL, INTERVAL_MS);

        orchestrator.runCycle();

        assertThat(singleLog().getReason()).isEqualTo("Execution error: Settings not found for user user-1");
        verify(metricsService).recordTrade(USER, STRATEGY, false, null);
        verify(orderGateway, never()).placeOrder(anyString(), any());
    }

    @Test
    void closesPositionWhenStopLossHit() {
        when(positionManagement.getOpenPositions(USER, SYMBOL)).thenReturn(List.of(Position.builder()
                .id("POS-1")
                .symbol(SYMBOL)
                .side(OrderSide.BUY)
                .quantity(new BigDecimal("0.001"))
                .entryPrice(new BigDecimal("50600"))
                .stopLoss(new BigDecimal("50100"))
                .openedAt(clock.instant())
                .build()));
        orchestrator.start(SYMBOL, INTERVAL_MS);

        orchestrator.monitorExits();

        verify(positionManagement).closePosition(USER, SYMBOL, "POS-1");
        ExecutionLog log = singleLog();
        assertThat(log.getAction()).isEqualTo(ExecutionAction.CLOSED);
        assertThat(log.getReason()).isEqualTo("Stop loss hit");
        verify(broadcastService).broadcast(eq(USER), eq(EngineEvent.EXECUTION), argThat(payload ->
                "POS-1".equals(payload.get("positionId"))));
    }

    @Test
    void throttlesExitChecks() {
        orchestrator.start(SYMBOL, INTERVAL_MS);

        orchestrator.monitorExits();
        orchestrator.monitorExits();
        clock.advanceMillis(2000);
        orchestrator.monitorExits();

        verify(positionManagement, times(2)).getOpenPositions(USER, SYMBOL);
    }

    @Test
    void exitFailuresNeverEscape() {
        when(positionManagement.getOpenPositions(USER, SYMBOL)).thenReturn(List.of(Position.builder()
                .id("POS-1")
                .side(OrderSide.SELL)
                .quantity(new BigDecimal("0.001"))
                .takeProfit(new BigDecimal("50100"))
                .build()));
        doThrow(new IllegalStateException("close rejected")).when(positionManagement).closePosition(USER, SYMBOL, "POS-1");
        orchestrator.start(SYMBOL, INTERVAL_MS);

        assertThatCode(orchestrator::monitorExits).doesNotThrowAnyException();

        verify(recordStore, never()).saveExecutionLog(anyString(), any());
    }

    @Test
    void disablesExitMonitorWithoutPositionManagement() {
        ExecutionOrchestrator plain = new ExecutionOrchestrator(USER, marketData, mock(OrderGateway.class), collaborators());

        plain.start(SYMBOL, INTERVAL_MS);
        plain.monitorExits();

        assertThat(plain.supportsExitMonitoring()).isFalse();
        verify(scheduler, never()).scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
        verify(marketData, never()).getOrderbook(anyString(), anyInt());
    }

    @Test
    void tickSurvivesResearchFailure() {
        when(researchService.runResearch(eq(USER), eq(SYMBOL), any())).thenThrow(new IllegalStateException("no data"));
        orchestrator.start(SYMBOL, INTERVAL_MS);
        ArgumentCaptor<Runnable> tick = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleAtFixedRate(tick.capture(), eq(0L), eq(INTERVAL_MS), eq(TimeUnit.MILLISECONDS));

        assertThatCode(() -> tick.getValue().run()).doesNotThrowAnyException();

        assertThat(savedLogs()).isEmpty();
    }

    @Test
    void stopIsIdempotentAndHaltsCycles() {
        orchestrator.start(SYMBOL, INTERVAL_MS);

        orchestrator.stop();
        orchestrator.stop();
        orchestrator.runCycle();

        verify(future, times(2)).cancel(false);
        verify(researchService, never()).runResearch(anyString(), anyString(), any());
        assertThat(orchestrator.isRunning()).isFalse();
    }

    @Test
    void rejectsSecondStart() {
        orchestrator.start(SYMBOL, INTERVAL_MS);

        assertThatThrownBy(() -> orchestrator.start(SYMBOL, INTERVAL_MS))
                .isInstanceOf(EngineConfigurationException.class)
                .hasMessage("Execution engine already running for user user-1");
    }

    @Test
    void eventPayloadCarriesResearch() {
        orchestrator.start(SYMBOL, INTERVAL_MS);

        orchestrator.runCycle();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(broadcastService).broadcast(eq(USER), eq(EngineEvent.RESEARCH), payload.capture());
        assertThat(payload.getValue())
                .containsEntry("signal", Signal.BUY)
                .containsEntry("accuracy", 0.9)
                .containsEntry("recommendedAction", "BUY");
    }
}
