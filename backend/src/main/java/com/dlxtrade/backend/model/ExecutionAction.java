package com.dlxtrade.backend.model;

public enum ExecutionAction {
    EXECUTED,
    SKIPPED,
    CLOSED
}
