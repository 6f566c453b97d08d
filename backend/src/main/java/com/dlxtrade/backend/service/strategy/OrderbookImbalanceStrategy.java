package com.dlxtrade.backend.service.strategy;

import com.dlxtrade.backend.model.OrderBook;
import com.dlxtrade.backend.model.OrderType;
import com.dlxtrade.backend.model.ResearchResult;
import com.dlxtrade.backend.model.Signal;
import com.dlxtrade.backend.model.StrategyConfig;
import com.dlxtrade.backend.model.TradeAction;
import com.dlxtrade.backend.model.TradeDecision;
import com.dlxtrade.backend.util.MoneyUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;

/**
 * Follows the research signal with a marketable limit at the opposite touch, bracketed by a
 * fixed stop-loss, take-profit and holding time.
 */
@Component
public class OrderbookImbalanceStrategy implements TradingStrategy {

    public static final String NAME = "orderbook_imbalance";

    static final BigDecimal STOP_LOSS_FRACTION = new BigDecimal("0.01");
    static final BigDecimal TAKE_PROFIT_FRACTION = new BigDecimal("0.02");
    static final long HOLD_TIME_MS = 5 * 60 * 1000L;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public TradeDecision decide(ResearchResult research, OrderBook orderBook, StrategyConfig config) {
        if (research == null || research.getSignal() == null || research.getSignal() == Signal.HOLD) {
            return TradeDecision.hold("No directional signal");
        }
        boolean buy = research.getSignal() == Signal.BUY;
        Optional<BigDecimal> touch = buy ? orderBook.bestAsk() : orderBook.bestBid();
        if (touch.isEmpty()) {
            return TradeDecision.hold("Order book has no " + (buy ? "asks" : "bids"));
        }
        BigDecimal price = touch.get();
        BigDecimal stopOffset = MoneyUtils.multiply(price, STOP_LOSS_FRACTION);
        BigDecimal profitOffset = MoneyUtils.multiply(price, TAKE_PROFIT_FRACTION);

        return TradeDecision.builder()
                .action(buy ? TradeAction.BUY : TradeAction.SELL)
                .orderType(OrderType.LIMIT)
                .quantity(config.getQuoteSize())
                .price(price)
                .stopLoss(buy ? MoneyUtils.subtract(price, stopOffset) : MoneyUtils.add(price, stopOffset))
                .takeProfit(buy ? MoneyUtils.add(price, profitOffset) : MoneyUtils.subtract(price, profitOffset))
                .timeToLiveMs(HOLD_TIME_MS)
                .reason("Imbalance " + String.format(Locale.ROOT, "%.3f", research.getOrderbookImbalance())
                        + " signals " + research.getSignal())
                .build();
    }
}
