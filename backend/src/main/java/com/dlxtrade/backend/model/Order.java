package com.dlxtrade.backend.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder(toBuilder = true)
public class Order {
    String id;
    String symbol;
    OrderSide side;
    OrderType type;
    BigDecimal quantity;
    BigDecimal price;
    BigDecimal avgPrice;
    OrderStatus status;

    /**
     * Average fill price when known, otherwise the order price.
     */
    public BigDecimal effectivePrice() {
        return avgPrice != null && avgPrice.signum() > 0 ? avgPrice : price;
    }
}
