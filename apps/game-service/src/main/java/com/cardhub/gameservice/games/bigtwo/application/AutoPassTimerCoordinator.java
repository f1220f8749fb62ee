package com.cardhub.gameservice.games.bigtwo.application;

import com.cardhub.gameservice.clock.scheduler.CountdownScheduler;
import com.cardhub.gameservice.games.bigtwo.domain.enums.ErrorKind;
import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoSnapshot;
import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoState;
import com.cardhub.gameservice.games.bigtwo.domain.model.TimerState;
import com.cardhub.gameservice.games.bigtwo.infrastructure.redis.RedisKeys;
import com.cardhub.gameservice.games.bigtwo.service.BigTwoService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Lazy;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * AutoPassTimerCoordinator
 * -------------------------------------------------
 * 自动过牌计时的业务协调器（应用编排层）：把通用倒计时引擎与锄大地的计时器状态对接。
 *
 * 职责与边界：
 * 1) 应用启动时注册 tick 监听（转成房间内 TICK 事件广播），并恢复所有未到期的倒计时；
 * 2) 每次状态提交后由服务层调用 syncFromState：
 *    - 状态里有 Active 计时器 → 按其序号启动倒计时（同一序号不重复启动）；
 *    - 没有 → 停止该房间的倒计时；
 * 3) 引擎回调到期时，先校验序号仍是房间当前计时器，再交给服务层 onTimerExpired 执行连锁过牌。
 *
 * 本类不修改对局状态，也不处理玩家输入。
 */
@Slf4j
@Component
@Lazy
public class AutoPassTimerCoordinator {

    // 通用倒计时调度器（不懂业务）
    private final CountdownScheduler scheduler;
    private final BigTwoService bigTwoService;
    private final SnapshotPublisher publisher;
    private final Clock clock;

    // roomId -> 已调度的计时器序号
    private final ConcurrentMap<String, Long> scheduledSequence = new ConcurrentHashMap<>();

    public AutoPassTimerCoordinator(CountdownScheduler scheduler,
                                    @Lazy BigTwoService bigTwoService,
                                    SnapshotPublisher publisher,
                                    Clock clock) {
        this.scheduler = scheduler;
        this.bigTwoService = bigTwoService;
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * 应用启动后注册 TICK 监听，并恢复所有未过期倒计时任务。
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("协调器启动：注册倒计时 TICK 监听并恢复活跃任务");
        scheduler.setTickListener(this::onTick);
        int restored = scheduler.restoreAllActive(this::handleTimeout);
        log.info("协调器启动完成：已恢复活跃倒计时任务 {} 个", restored);
    }

    /**
     * 根据最新提交的状态驱动倒计时。
     */
    public void syncFromState(BigTwoState state) {
        String roomId = state.getRoomId();
        if (state.getTimer() instanceof TimerState.Active t) {
            Long current = scheduledSequence.get(roomId);
            if (current != null && current == t.sequenceId()) return;
            scheduledSequence.put(roomId, t.sequenceId());
            scheduler.startOrResume(RedisKeys.autoPassCountdown(roomId),
                    String.valueOf(t.exemptSeat()),
                    t.endTimestamp(),
                    String.valueOf(t.sequenceId()),
                    this::handleTimeout);
            return;
        }
        if (scheduledSequence.remove(roomId) != null) {
            scheduler.stop(RedisKeys.autoPassCountdown(roomId));
        }
    }

    /**
     * 倒计时到期：过期序号丢弃，否则执行连锁过牌。
     * @param key     调度键（含游戏前缀）
     * @param owner   豁免座位
     * @param version 计时器序号
     */
    void handleTimeout(String key, String owner, String version) {
        String roomId = RedisKeys.roomIdFromCountdown(key);
        if (roomId == null) return;
        long sequence = Long.parseLong(version);
        scheduledSequence.remove(roomId, sequence);

        BigTwoSnapshot snapshot = bigTwoService.getState(roomId);
        TimerState.Active t = snapshot.autoPassTimer();
        if (t == null || t.sequenceId() != sequence) {
            log.info("丢弃过期计时器回调: room={}, seq={}, kind={}", roomId, sequence, ErrorKind.STALE_TIMER_SEQUENCE);
            return;
        }
        log.info("自动过牌计时器到期: room={}, seq={}, exempt={}", roomId, sequence, owner);
        bigTwoService.onTimerExpired(roomId);
    }

    private void onTick(String key, String owner, long deadlineMs, long left) {
        String roomId = RedisKeys.roomIdFromCountdown(key);
        if (roomId == null) return;
        Long seq = scheduledSequence.get(roomId);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("left", left);
        payload.put("exemptSeat", Integer.parseInt(owner));
        payload.put("endTimestamp", deadlineMs);
        payload.put("serverNow", clock.millis());
        publisher.publishEvent(roomId, "TICK", payload, seq == null ? 0 : seq);
    }
}
