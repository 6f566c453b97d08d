package com.dlxtrade.backend.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ResearchResult {
    String symbol;
    Signal signal;
    double accuracy;
    String recommendedAction;
    double orderbookImbalance;
}
