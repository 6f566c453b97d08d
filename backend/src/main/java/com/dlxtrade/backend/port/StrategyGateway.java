package com.dlxtrade.backend.port;

import com.dlxtrade.backend.model.OrderBook;
import com.dlxtrade.backend.model.ResearchResult;
import com.dlxtrade.backend.model.StrategyConfig;
import com.dlxtrade.backend.model.TradeDecision;

public interface StrategyGateway {

    /**
     * @throws com.dlxtrade.backend.exception.StrategyAlreadyInitializedException if the user already runs it
     */
    void initializeStrategy(String userId, String strategyName, StrategyConfig config,
                            MarketDataSource marketData, OrderGateway orderGateway);

    TradeDecision executeStrategy(String userId, String strategyName, ResearchResult research, OrderBook orderBook);
}
