package com.dlxtrade.backend.model;

public enum OrderType {
    MARKET,
    LIMIT
}
