package com.dlxtrade.backend.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class OrderRequest {
    String symbol;
    OrderSide side;
    OrderType type;
    BigDecimal quantity;
    BigDecimal price;
    BigDecimal stopLoss;
    BigDecimal takeProfit;
    Long timeToLiveMs;

    public static OrderRequest limit(String symbol, OrderSide side, BigDecimal quantity, BigDecimal price) {
        return OrderRequest.builder()
                .symbol(symbol)
                .side(side)
                .type(OrderType.LIMIT)
                .quantity(quantity)
                .price(price)
                .build();
    }

    public static OrderRequest from(String symbol, TradeDecision decision) {
        return OrderRequest.builder()
                .symbol(symbol)
                .side(decision.getAction().toSide())
                .type(decision.getOrderType() != null ? decision.getOrderType() : OrderType.MARKET)
                .quantity(decision.getQuantity())
                .price(decision.getPrice())
                .stopLoss(decision.getStopLoss())
                .takeProfit(decision.getTakeProfit())
                .timeToLiveMs(decision.getTimeToLiveMs())
                .build();
    }
}
