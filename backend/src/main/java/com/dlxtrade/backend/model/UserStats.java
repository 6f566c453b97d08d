package com.dlxtrade.backend.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class UserStats {
    String userId;
    long totalTrades;
}
