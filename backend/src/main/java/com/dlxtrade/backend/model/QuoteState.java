package com.dlxtrade.backend.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Resting two-sided quote for one symbol. Replaced wholesale on every re-quote.
 */
@Value
@Builder
@With
public class QuoteState {
    String bidOrderId;
    String askOrderId;
    Instant placedAt;
    BigDecimal baselineMidPrice;
    long sequence;

    public String orderId(QuoteSide side) {
        return side == QuoteSide.BID ? bidOrderId : askOrderId;
    }

    public QuoteState withSide(QuoteSide side, String orderId) {
        return side == QuoteSide.BID ? withBidOrderId(orderId) : withAskOrderId(orderId);
    }

    public QuoteState withoutSide(QuoteSide side) {
        return withSide(side, null);
    }

    public boolean isEmpty() {
        return bidOrderId == null && askOrderId == null;
    }
}
