package com.dlxtrade.backend.model;

public enum Signal {
    BUY,
    SELL,
    HOLD
}
