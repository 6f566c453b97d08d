package com.dlxtrade.backend.adapter.paper;

import com.dlxtrade.backend.model.OrderBook;
import com.dlxtrade.backend.port.MarketDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Push-fed market data: publishers replace the latest book per symbol, readers poll it or subscribe.
 */
@Component
@Slf4j
public class OrderBookChannel implements MarketDataSource {

    private final Clock clock;
    private final Map<String, OrderBook> latest = new ConcurrentHashMap<>();
    private final Map<String, List<Consumer<OrderBook>>> listeners = new ConcurrentHashMap<>();

    public OrderBookChannel(Clock clock) {
        this.clock = clock;
    }

    public void publish(OrderBook book) {
        latest.put(book.symbol(), book);
        for (Consumer<OrderBook> listener : listeners.getOrDefault(book.symbol(), List.of())) {
            try {
                listener.accept(book);
            } catch (RuntimeException e) {
                log.warn("Order book listener failed symbol={}: {}", book.symbol(), e.getMessage());
            }
        }
    }

    public Optional<OrderBook> latest(String symbol) {
        return Optional.ofNullable(latest.get(symbol));
    }

    @Override
    public OrderBook getOrderbook(String symbol, int depth) {
        return latest(symbol)
                .map(book -> book.truncate(depth))
                .orElseGet(() -> OrderBook.empty(symbol, clock.instant()));
    }

    @Override
    public Subscription subscribeOrderbook(String symbol, Consumer<OrderBook> listener) {
        List<Consumer<OrderBook>> symbolListeners = listeners.computeIfAbsent(symbol, key -> new CopyOnWriteArrayList<>());
        symbolListeners.add(listener);
        return () -> symbolListeners.remove(listener);
    }
}
