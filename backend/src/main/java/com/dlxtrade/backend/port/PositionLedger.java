package com.dlxtrade.backend.port;

import java.math.BigDecimal;

public interface PositionLedger {

    /**
     * Signed net position: positive long, negative short.
     */
    BigDecimal netPosition(String userId, String symbol);
}
