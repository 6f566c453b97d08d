package com.dlxtrade.backend.port;

import com.dlxtrade.backend.model.OrderBook;

import java.util.function.Consumer;

public interface MarketDataSource {

    OrderBook getOrderbook(String symbol, int depth);

    /**
     * Registers a push listener for book updates. The returned handle detaches it.
     */
    Subscription subscribeOrderbook(String symbol, Consumer<OrderBook> listener);

    @FunctionalInterface
    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
