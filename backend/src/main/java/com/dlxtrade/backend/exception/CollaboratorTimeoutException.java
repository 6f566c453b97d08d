package com.dlxtrade.backend.exception;

public class CollaboratorTimeoutException extends TradingException {
    public CollaboratorTimeoutException(String operation, long timeoutMs, Throwable cause) {
        super(operation + " timed out after " + timeoutMs + "ms", cause);
    }
}
