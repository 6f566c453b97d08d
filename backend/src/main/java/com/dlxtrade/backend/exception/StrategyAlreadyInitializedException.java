package com.dlxtrade.backend.exception;

public class StrategyAlreadyInitializedException extends TradingException {
    public StrategyAlreadyInitializedException(String userId, String strategyName) {
        super("Strategy " + strategyName + " already initialized for user " + userId);
    }
}
