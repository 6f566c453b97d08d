package com.dlxtrade.backend.service.strategy;

import com.dlxtrade.backend.exception.EngineConfigurationException;
import com.dlxtrade.backend.exception.StrategyAlreadyInitializedException;
import com.dlxtrade.backend.model.OrderBook;
import com.dlxtrade.backend.model.ResearchResult;
import com.dlxtrade.backend.model.StrategyConfig;
import com.dlxtrade.backend.model.TradeDecision;
import com.dlxtrade.backend.port.MarketDataSource;
import com.dlxtrade.backend.port.OrderGateway;
import com.dlxtrade.backend.port.StrategyGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Slf4j
public class StrategyRegistry implements StrategyGateway {

    private final Map<String, TradingStrategy> strategies;
    private final Map<String, StrategyConfig> initialized = new ConcurrentHashMap<>();

    public StrategyRegistry(List<TradingStrategy> strategies) {
        this.strategies = strategies.stream()
                .collect(Collectors.toUnmodifiableMap(TradingStrategy::getName, Function.identity()));
    }

    @Override
    public void initializeStrategy(String userId, String strategyName, StrategyConfig config,
                                   MarketDataSource marketData, OrderGateway orderGateway) {
        strategy(strategyName);
        StrategyConfig previous = initialized.putIfAbsent(key(userId, strategyName), config);
        if (previous != null) {
            throw new StrategyAlreadyInitializedException(userId, strategyName);
        }
        log.info("Strategy initialized userId={} strategy={}", userId, strategyName);
    }

    @Override
    public TradeDecision executeStrategy(String userId, String strategyName, ResearchResult research, OrderBook orderBook) {
        TradingStrategy strategy = strategy(strategyName);
        StrategyConfig config = initialized.get(key(userId, strategyName));
        if (config == null) {
            throw new EngineConfigurationException("Strategy " + strategyName + " not initialized for user " + userId);
        }
        try {
            return strategy.decide(research, orderBook, config);
        } catch (RuntimeException e) {
            log.error("Strategy failed userId={} strategy={}", userId, strategyName, e);
            return null;
        }
    }

    public boolean isInitialized(String userId, String strategyName) {
        return initialized.containsKey(key(userId, strategyName));
    }

    private TradingStrategy strategy(String strategyName) {
        TradingStrategy strategy = strategies.get(strategyName);
        if (strategy == null) {
            throw new EngineConfigurationException("Unknown strategy: " + strategyName);
        }
        return strategy;
    }

    private static String key(String userId, String strategyName) {
        return userId + ":" + strategyName;
    }
}
