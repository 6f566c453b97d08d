package com.dlxtrade.backend.service;

import com.dlxtrade.backend.dto.EngineEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class BroadcastService {

    private final SimpMessagingTemplate messagingTemplate;
    private final Clock clock;

    /**
     * Pushes an engine event to the user's topic. Delivery failures never reach the engine.
     */
    public void broadcast(String userId, EngineEvent event) {
        try {
            messagingTemplate.convertAndSend("/topic/engine/" + userId, event);
        } catch (RuntimeException e) {
            log.warn("Broadcast failed userId={} type={}: {}", userId, event.type(), e.getMessage());
        }
    }

    public void broadcast(String userId, String type, Map<String, Object> data) {
        broadcast(userId, new EngineEvent(type, userId, data, clock.instant()));
    }
}
