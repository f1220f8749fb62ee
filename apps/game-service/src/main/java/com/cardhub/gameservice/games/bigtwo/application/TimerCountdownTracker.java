package com.cardhub.gameservice.games.bigtwo.application;

import com.cardhub.gameservice.games.bigtwo.domain.constants.GameMessages;
import com.cardhub.gameservice.games.bigtwo.domain.enums.ErrorKind;
import com.cardhub.gameservice.games.bigtwo.domain.model.RuleViolation;
import com.cardhub.gameservice.games.bigtwo.domain.model.TimerState;

import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * 观察者侧的倒计时换算（客户端、机器人、其它节点）。
 * - 每个计时器序号只在第一次收到时计算一次时钟偏移：offset = 服务端创建时刻 − 本地收到时刻；
 * - 剩余时间 = 截止时间 − (本地当前时刻 + offset)，每帧不重新推导偏移；
 * - 序号小于已见最大序号的通知视为过期，返回 STALE_TIMER_SEQUENCE 并丢弃。
 * 服务端自身以权威时钟判定到期，不经过这里；本类是观察者一侧换算的参考实现，
 * 供 Java 客户端、压测机器人或其它节点订阅 TICK 时直接复用，算法与前端保持一致。
 */
public class TimerCountdownTracker {

    private final LongSupplier localClock;

    private long newestSequence = -1;
    private long offsetMs;
    private TimerState.Active current;

    public TimerCountdownTracker(LongSupplier localClock) {
        this.localClock = localClock;
    }

    /**
     * 收到一条计时器通知。
     * @return 过期通知返回 StaleTimerSequence；否则 empty
     */
    public synchronized Optional<RuleViolation> onTimer(TimerState.Active timer) {
        long seq = timer.sequenceId();
        if (seq < newestSequence) {
            return Optional.of(RuleViolation.of(ErrorKind.STALE_TIMER_SEQUENCE,
                    GameMessages.formatStaleTimer(seq, newestSequence)));
        }
        if (seq == newestSequence) {
            // 同一计时器的重复通知：沿用首次的偏移
            return Optional.empty();
        }
        newestSequence = seq;
        offsetMs = timer.serverTimeAtCreation() - localClock.getAsLong();
        current = timer;
        return Optional.empty();
    }

    /** 计时器被清除（出牌替换 / 三家连过 / 本局结束） */
    public synchronized void onCleared() {
        current = null;
    }

    public synchronized long remainingMs() {
        if (current == null) return 0;
        return Math.max(0, current.endTimestamp() - (localClock.getAsLong() + offsetMs));
    }

    public synchronized boolean isExpired() {
        return current != null && remainingMs() == 0;
    }

    public synchronized long offsetMs() {
        return offsetMs;
    }

    public synchronized long newestSequence() {
        return newestSequence;
    }

    public synchronized Optional<TimerState.Active> current() {
        return Optional.ofNullable(current);
    }
}
