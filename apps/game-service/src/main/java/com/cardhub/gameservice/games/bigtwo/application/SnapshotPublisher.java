package com.cardhub.gameservice.games.bigtwo.application;

import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoSnapshot;
import com.cardhub.gameservice.games.bigtwo.domain.model.RuleViolation;

import java.util.Map;

/**
 * 房间广播通道（分发给房间内所有观察者）。
 * 实现：STOMP /topic/room.{roomId}。
 */
public interface SnapshotPublisher {

    /** 完整状态（seq = 状态版本） */
    void publishState(BigTwoSnapshot snapshot);

    /**
     * 增量事件。
     * @param type    事件类型（TICK / AUTO_PASSED / MATCH_STARTED ...）
     * @param payload 事件载荷
     * @param seq     计时事件用计时器序号，其余用状态版本
     */
    void publishEvent(String roomId, String type, Map<String, Object> payload, long seq);

    /** 校验失败通知 */
    void publishError(String roomId, RuleViolation violation);
}
