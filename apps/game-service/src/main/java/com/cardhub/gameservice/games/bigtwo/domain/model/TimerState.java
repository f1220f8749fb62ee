package com.cardhub.gameservice.games.bigtwo.domain.model;

/**
 * 自动过牌计时器（不可变的标签变体）。
 * - {@link None}：没有计时；
 * - {@link Active}：有人打出了“无人能压”的牌，其余座位需在截止前行动，否则被自动过牌。
 * 替换计时器 = 整体换一个新值，不做字段级修改。
 */
public interface TimerState {

    TimerState NONE = new None();

    boolean isActive();

    record None() implements TimerState {
        @Override
        public boolean isActive() {
            return false;
        }
    }

    /**
     * @param exemptSeat           打出该手牌的座位（不会被自动过牌）
     * @param endTimestamp         截止时间（权威时钟，毫秒）
     * @param serverTimeAtCreation 创建时刻（权威时钟，毫秒），观察者据此计算时钟偏移
     * @param durationMs           计时长度
     * @param sequenceId           房间内严格递增的计时器序号
     * @param triggeringCombo      触发计时的牌型
     */
    record Active(int exemptSeat,
                  long endTimestamp,
                  long serverTimeAtCreation,
                  long durationMs,
                  long sequenceId,
                  Combo triggeringCombo) implements TimerState {
        @Override
        public boolean isActive() {
            return true;
        }

        public boolean isExpiredAt(long nowMs) {
            return nowMs >= endTimestamp;
        }
    }
}
