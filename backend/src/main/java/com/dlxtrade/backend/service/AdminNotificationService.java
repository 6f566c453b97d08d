package com.dlxtrade.backend.service;

import com.dlxtrade.backend.dto.EngineEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class AdminNotificationService {

    static final String ADMIN_TOPIC = "/topic/admin";

    private final SimpMessagingTemplate messagingTemplate;
    private final Clock clock;

    public void notifyExecutionTrade(String userId, Map<String, Object> trade) {
        send(EngineEvent.EXECUTION, userId, trade);
    }

    public void notifyEngineStart(String userId, String engineType) {
        send(EngineEvent.ENGINE_START, userId, Map.of("engineType", engineType));
    }

    public void notifyEngineStop(String userId, String engineType) {
        send(EngineEvent.ENGINE_STOP, userId, Map.of("engineType", engineType));
    }

    private void send(String type, String userId, Map<String, Object> data) {
        try {
            messagingTemplate.convertAndSend(ADMIN_TOPIC,
                    new EngineEvent(type, userId, new LinkedHashMap<>(data), clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Admin notification failed userId={} type={}: {}", userId, type, e.getMessage());
        }
    }
}
