package com.dlxtrade.backend.model;

import java.math.BigDecimal;

public record PriceLevel(BigDecimal price, BigDecimal quantity) {
}
