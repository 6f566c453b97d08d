package com.dlxtrade.backend.event;

import com.dlxtrade.backend.model.EngineStatus;

import java.time.Instant;

public record EnginePauseRequestedEvent(
        String userId,
        EngineStatus status,
        String reason,
        Instant createdAt
) {
}
