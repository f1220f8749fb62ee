package com.cardhub.gameservice.games.bigtwo.interfaces.ws;

import com.cardhub.gameservice.games.bigtwo.application.SnapshotPublisher;
import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoSnapshot;
import com.cardhub.gameservice.games.bigtwo.domain.model.RuleViolation;
import com.cardhub.gameservice.platform.transport.Envelope;
import lombok.RequiredArgsConstructor;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 通过 STOMP 简单代理把快照/事件/错误广播到 /topic/room.{roomId}。
 * 事件载荷统一带上 type 字段，便于前端分发。
 */
@Component
@RequiredArgsConstructor
public class StompSnapshotPublisher implements SnapshotPublisher {

    static final String GAME = "bigtwo";

    private final SimpMessagingTemplate messaging;
    private final Clock clock;

    @Override
    public void publishState(BigTwoSnapshot snapshot) {
        messaging.convertAndSend(topic(snapshot.roomId()),
                Envelope.state(GAME, snapshot.roomId(), snapshot, snapshot.version(), clock.millis()));
    }

    @Override
    public void publishEvent(String roomId, String type, Map<String, Object> payload, long seq) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", type);
        body.putAll(payload);
        messaging.convertAndSend(topic(roomId), Envelope.event(GAME, roomId, body, seq, clock.millis()));
    }

    @Override
    public void publishError(String roomId, RuleViolation violation) {
        messaging.convertAndSend(topic(roomId), Envelope.error(GAME, roomId, violation, clock.millis()));
    }

    // WS 主题
    static String topic(String roomId) {
        return "/topic/room." + roomId;
    }
}
