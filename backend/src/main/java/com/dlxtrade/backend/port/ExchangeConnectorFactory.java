package com.dlxtrade.backend.port;

public interface ExchangeConnectorFactory {

    ExchangeConnection connect(String userId);

    record ExchangeConnection(MarketDataSource marketData, OrderGateway orderGateway) {
    }
}
