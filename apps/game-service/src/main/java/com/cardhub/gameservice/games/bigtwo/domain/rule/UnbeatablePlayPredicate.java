package com.cardhub.gameservice.games.bigtwo.domain.rule;

import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoState;
import com.cardhub.gameservice.games.bigtwo.domain.model.Combo;

/**
 * 判断“刚打出的牌是否已无人能压”，为 true 时启动自动过牌计时器。
 * 可插拔：不同实现可使用不同的信息范围。
 */
@FunctionalInterface
public interface UnbeatablePlayPredicate {

    /**
     * @param play           刚打出的牌型
     * @param stateAfterPlay 已应用该手牌后的状态（牌堆含本手，出牌者手牌已扣除）
     * @param actorSeat      出牌座位
     */
    boolean isUnbeatable(Combo play, BigTwoState stateAfterPlay, int actorSeat);
}
