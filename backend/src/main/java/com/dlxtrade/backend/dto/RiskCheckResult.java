package com.dlxtrade.backend.dto;

public record RiskCheckResult(boolean allowed, String reason) {

    private static final RiskCheckResult ALLOWED = new RiskCheckResult(true, null);

    public static RiskCheckResult allow() {
        return ALLOWED;
    }

    public static RiskCheckResult deny(String reason) {
        return new RiskCheckResult(false, reason);
    }
}
