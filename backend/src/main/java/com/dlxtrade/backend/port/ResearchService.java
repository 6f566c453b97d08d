package com.dlxtrade.backend.port;

import com.dlxtrade.backend.model.ResearchResult;

public interface ResearchService {

    ResearchResult runResearch(String userId, String symbol, MarketDataSource marketData);
}
