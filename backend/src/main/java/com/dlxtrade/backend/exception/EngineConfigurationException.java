package com.dlxtrade.backend.exception;

/**
 * Caller-side contract violation: missing user context, missing settings,
 * or an engine driven through an invalid lifecycle transition.
 */
public class EngineConfigurationException extends TradingException {
    public EngineConfigurationException(String message) {
        super(message);
    }
}
