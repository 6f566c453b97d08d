package com.dlxtrade.backend.adapter.paper;

import com.dlxtrade.backend.config.EngineProperties;
import com.dlxtrade.backend.model.OrderBook;
import com.dlxtrade.backend.model.PriceLevel;
import com.dlxtrade.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Random-walk order books for the configured paper symbols.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "engine.paper", name = "feed-enabled", havingValue = "true", matchIfMissing = true)
public class PaperMarketFeed {

    private static final BigDecimal LEVEL_STEP = new BigDecimal("0.0001");

    private final OrderBookChannel orderBookChannel;
    private final EngineProperties engineProperties;
    private final Clock clock;

    private final Map<String, BigDecimal> mids = new ConcurrentHashMap<>();

    @Scheduled(fixedDelayString = "${engine.paper.tick-interval-ms:250}")
    public void publishBooks() {
        EngineProperties.Paper paper = engineProperties.getPaper();
        for (String symbol : paper.getSymbols()) {
            BigDecimal mid = mids.merge(symbol, paper.getStartPrice(), (current, ignored) -> step(current, paper.getVolatility()));
            orderBookChannel.publish(book(symbol, mid, paper.getDepth()));
        }
    }

    private BigDecimal step(BigDecimal mid, BigDecimal volatility) {
        double shock = ThreadLocalRandom.current().nextGaussian();
        BigDecimal move = mid.multiply(volatility).multiply(BigDecimal.valueOf(shock));
        BigDecimal next = MoneyUtils.add(mid, move);
        return next.signum() > 0 ? next : mid;
    }

    OrderBook book(String symbol, BigDecimal mid, int depth) {
        BigDecimal step = MoneyUtils.multiply(mid, LEVEL_STEP);
        List<PriceLevel> bids = new ArrayList<>(depth);
        List<PriceLevel> asks = new ArrayList<>(depth);
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int level = 1; level <= depth; level++) {
            BigDecimal offset = step.multiply(BigDecimal.valueOf(level));
            bids.add(new PriceLevel(MoneyUtils.subtract(mid, offset), MoneyUtils.bd(random.nextDouble(0.01, 2.0))));
            asks.add(new PriceLevel(MoneyUtils.add(mid, offset), MoneyUtils.bd(random.nextDouble(0.01, 2.0))));
        }
        return new OrderBook(symbol, bids, asks, clock.instant());
    }
}
