package com.dlxtrade.backend.adapter.paper;

import com.dlxtrade.backend.exception.TradingException;
import com.dlxtrade.backend.model.Order;
import com.dlxtrade.backend.model.OrderBook;
import com.dlxtrade.backend.model.OrderRequest;
import com.dlxtrade.backend.model.OrderSide;
import com.dlxtrade.backend.model.OrderStatus;
import com.dlxtrade.backend.model.OrderType;
import com.dlxtrade.backend.model.Position;
import com.dlxtrade.backend.port.OrderGateway;
import com.dlxtrade.backend.port.PositionManagement;
import com.dlxtrade.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simulated order routing. Market orders and limits that cross the current book fill immediately and
 * open a position; other limits rest until cancelled.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PaperOrderGateway implements OrderGateway, PositionManagement {

    private final OrderBookChannel orderBookChannel;
    private final InMemoryPositionLedger positionLedger;
    private final Clock clock;

    private final Map<String, Order> restingOrders = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Position>> positions = new ConcurrentHashMap<>();

    @Override
    public Order placeOrder(String userId, OrderRequest request) {
        if (!MoneyUtils.isPositive(request.getQuantity())) {
            throw new TradingException("Quantity must be greater than zero");
        }
        Order order = Order.builder()
                .id("PAPER-" + UUID.randomUUID())
                .symbol(request.getSymbol())
                .side(request.getSide())
                .type(request.getType())
                .quantity(request.getQuantity())
                .price(request.getPrice())
                .status(OrderStatus.NEW)
                .build();

        Optional<BigDecimal> fillPrice = fillPrice(request);
        if (fillPrice.isEmpty()) {
            restingOrders.put(order.getId(), order);
            log.debug("Paper order resting userId={} orderId={} side={} price={}",
                    userId, order.getId(), order.getSide(), MoneyUtils.plain(order.getPrice()));
            return order;
        }

        Order filled = order.toBuilder()
                .avgPrice(fillPrice.get())
                .status(OrderStatus.FILLED)
                .build();
        positionLedger.recordFill(userId, request.getSymbol(), request.getSide(), request.getQuantity());
        Position position = Position.builder()
                .id("POS-" + UUID.randomUUID())
                .symbol(request.getSymbol())
                .side(request.getSide())
                .quantity(request.getQuantity())
                .entryPrice(fillPrice.get())
                .stopLoss(request.getStopLoss())
                .takeProfit(request.getTakeProfit())
                .timeToLiveMs(request.getTimeToLiveMs())
                .openedAt(clock.instant())
                .build();
        positions.computeIfAbsent(userId, key -> new ConcurrentHashMap<>()).put(position.getId(), position);
        log.info("Paper order filled userId={} orderId={} side={} qty={} price={}",
                userId, filled.getId(), filled.getSide(), MoneyUtils.plain(filled.getQuantity()),
                MoneyUtils.plain(fillPrice.get()));
        return filled;
    }

    private Optional<BigDecimal> fillPrice(OrderRequest request) {
        OrderBook book = orderBookChannel.getOrderbook(request.getSymbol(), 1);
        Optional<BigDecimal> touch = request.getSide() == OrderSide.BUY ? book.bestAsk() : book.bestBid();
        if (request.getType() == OrderType.MARKET) {
            if (touch.isPresent()) {
                return touch;
            }
            if (MoneyUtils.isPositive(request.getPrice())) {
                return Optional.of(request.getPrice());
            }
            throw new TradingException("No market price for " + request.getSymbol());
        }
        if (touch.isEmpty() || request.getPrice() == null) {
            return Optional.empty();
        }
        boolean crosses = request.getSide() == OrderSide.BUY
                ? request.getPrice().compareTo(touch.get()) >= 0
                : request.getPrice().compareTo(touch.get()) <= 0;
        return crosses ? Optional.of(request.getPrice()) : Optional.empty();
    }

    /**
     * Cancelling an order that is no longer resting is a no-op.
     */
    @Override
    public void cancelOrder(String orderId) {
        Order removed = restingOrders.remove(orderId);
        if (removed == null) {
            log.debug("Paper cancel ignored, order not resting orderId={}", orderId);
            return;
        }
        log.debug("Paper order cancelled orderId={}", orderId);
    }

    @Override
    public List<Position> getOpenPositions(String userId, String symbol) {
        return positions.getOrDefault(userId, Map.of()).values().stream()
                .filter(position -> position.getSymbol().equals(symbol))
                .toList();
    }

    @Override
    public void closePosition(String userId, String symbol, String positionId) {
        Map<String, Position> userPositions = positions.getOrDefault(userId, Map.of());
        Position position = userPositions.get(positionId);
        if (position == null || !position.getSymbol().equals(symbol)) {
            throw new TradingException("No open position " + positionId + " for " + symbol);
        }
        userPositions.remove(positionId);
        positionLedger.recordFill(userId, symbol, position.getSide().opposite(), position.getQuantity());
        log.info("Paper position closed userId={} symbol={} positionId={}", userId, symbol, positionId);
    }

    public List<Order> getRestingOrders() {
        return List.copyOf(restingOrders.values());
    }
}
