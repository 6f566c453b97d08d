package com.dlxtrade.backend.dto;

public record ExecutionConfig(String symbol, long intervalMs) {
}
