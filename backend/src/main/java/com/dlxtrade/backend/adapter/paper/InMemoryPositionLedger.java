package com.dlxtrade.backend.adapter.paper;

import com.dlxtrade.backend.model.OrderSide;
import com.dlxtrade.backend.port.PositionLedger;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Net position per user and symbol, summed from fills: buys add, sells subtract.
 */
@Component
public class InMemoryPositionLedger implements PositionLedger {

    private final Map<String, BigDecimal> positions = new ConcurrentHashMap<>();

    public void recordFill(String userId, String symbol, OrderSide side, BigDecimal quantity) {
        BigDecimal signed = side == OrderSide.BUY ? quantity : quantity.negate();
        positions.merge(key(userId, symbol), signed, BigDecimal::add);
    }

    @Override
    public BigDecimal netPosition(String userId, String symbol) {
        return positions.getOrDefault(key(userId, symbol), BigDecimal.ZERO);
    }

    private static String key(String userId, String symbol) {
        return userId + ":" + symbol;
    }
}
