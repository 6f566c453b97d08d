package com.dlxtrade.backend.service.strategy;

import com.dlxtrade.backend.model.OrderBook;
import com.dlxtrade.backend.model.ResearchResult;
import com.dlxtrade.backend.model.StrategyConfig;
import com.dlxtrade.backend.model.TradeDecision;

public interface TradingStrategy {

    String getName();

    TradeDecision decide(ResearchResult research, OrderBook orderBook, StrategyConfig config);
}
