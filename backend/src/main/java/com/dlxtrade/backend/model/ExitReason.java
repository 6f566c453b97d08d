package com.dlxtrade.backend.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ExitReason {
    STOP_LOSS("Stop loss hit"),
    TAKE_PROFIT("Take profit hit"),
    TIME_EXPIRY("Time-based exit");

    private final String label;
}
