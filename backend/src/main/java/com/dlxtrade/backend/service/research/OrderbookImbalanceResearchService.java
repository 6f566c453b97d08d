package com.dlxtrade.backend.service.research;

import com.dlxtrade.backend.config.EngineProperties;
import com.dlxtrade.backend.model.OrderBook;
import com.dlxtrade.backend.model.PriceLevel;
import com.dlxtrade.backend.model.ResearchResult;
import com.dlxtrade.backend.model.Signal;
import com.dlxtrade.backend.port.MarketDataSource;
import com.dlxtrade.backend.port.ResearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class OrderbookImbalanceResearchService implements ResearchService {

    private final EngineProperties engineProperties;

    @Override
    public ResearchResult runResearch(String userId, String symbol, MarketDataSource marketData) {
        EngineProperties.Research research = engineProperties.getResearch();
        OrderBook book = marketData.getOrderbook(symbol, research.getDepth());
        double imbalance = imbalance(book, research.getDepth());

        Signal signal;
        if (imbalance > research.getImbalanceThreshold()) {
            signal = Signal.BUY;
        } else if (imbalance < -research.getImbalanceThreshold()) {
            signal = Signal.SELL;
        } else {
            signal = Signal.HOLD;
        }
        double accuracy = Math.min(1.0, 0.5 + Math.abs(imbalance) / 2);

        log.debug("Research userId={} symbol={} imbalance={} signal={}", userId, symbol, imbalance, signal);
        return ResearchResult.builder()
                .symbol(symbol)
                .signal(signal)
                .accuracy(accuracy)
                .orderbookImbalance(imbalance)
                .recommendedAction(signal == Signal.HOLD ? "WAIT" : signal.name())
                .build();
    }

    /**
     * (bidVolume - askVolume) / (bidVolume + askVolume) over the top {@code depth} levels; 0 for an empty book.
     */
    static double imbalance(OrderBook book, int depth) {
        BigDecimal bidVolume = volume(book.bids(), depth);
        BigDecimal askVolume = volume(book.asks(), depth);
        BigDecimal total = bidVolume.add(askVolume);
        if (total.signum() == 0) {
            return 0.0;
        }
        return bidVolume.subtract(askVolume).doubleValue() / total.doubleValue();
    }

    private static BigDecimal volume(List<PriceLevel> levels, int depth) {
        return levels.stream()
                .limit(depth)
                .map(PriceLevel::quantity)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
