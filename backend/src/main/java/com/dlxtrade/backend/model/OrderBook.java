package com.dlxtrade.backend.model;

import com.dlxtrade.backend.util.MoneyUtils;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Top-of-book snapshot. Bids are sorted best (highest) first, asks best (lowest) first.
 */
public record OrderBook(String symbol, List<PriceLevel> bids, List<PriceLevel> asks, Instant timestamp) {

    public OrderBook {
        bids = bids == null ? List.of() : List.copyOf(bids);
        asks = asks == null ? List.of() : List.copyOf(asks);
    }

    public static OrderBook empty(String symbol, Instant timestamp) {
        return new OrderBook(symbol, List.of(), List.of(), timestamp);
    }

    public boolean isTwoSided() {
        return !bids.isEmpty() && !asks.isEmpty();
    }

    public Optional<BigDecimal> bestBid() {
        return bids.isEmpty() ? Optional.empty() : Optional.ofNullable(bids.get(0).price());
    }

    public Optional<BigDecimal> bestAsk() {
        return asks.isEmpty() ? Optional.empty() : Optional.ofNullable(asks.get(0).price());
    }

    /**
     * Average of best bid and best ask; empty when either side is missing.
     */
    public Optional<BigDecimal> midPrice() {
        if (!isTwoSided()) {
            return Optional.empty();
        }
        BigDecimal bid = bids.get(0).price();
        BigDecimal ask = asks.get(0).price();
        if (!MoneyUtils.isPositive(bid) || !MoneyUtils.isPositive(ask)) {
            return Optional.empty();
        }
        return Optional.of(bid.add(ask).divide(MoneyUtils.TWO, MathContext.DECIMAL64));
    }

    public Optional<BigDecimal> spread() {
        if (!isTwoSided()) {
            return Optional.empty();
        }
        return Optional.of(asks.get(0).price().subtract(bids.get(0).price()));
    }

    public OrderBook truncate(int depth) {
        return new OrderBook(symbol,
                bids.subList(0, Math.min(depth, bids.size())),
                asks.subList(0, Math.min(depth, asks.size())),
                timestamp);
    }
}
