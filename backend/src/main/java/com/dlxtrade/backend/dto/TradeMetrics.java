package com.dlxtrade.backend.dto;

public record TradeMetrics(
        String userId,
        String strategy,
        long tradesExecuted,
        long failedOrders,
        long cancels,
        long totalLatencyMs,
        long latencyCount
) {
    public double averageLatencyMs() {
        return latencyCount == 0 ? 0.0 : (double) totalLatencyMs / latencyCount;
    }
}
