package com.cardhub.gameservice.games.bigtwo.domain.bot;

import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoSnapshot;
import com.cardhub.gameservice.games.bigtwo.domain.model.Card;

import java.util.List;

/**
 * 机器人出牌策略（可插拔）。
 * 只能看到自己的手牌和公开快照；返回的动作仍要经过服务端完整校验。
 */
public interface BotStrategy {

    /**
     * @param seat     机器人所在座位
     * @param hand     机器人手牌
     * @param snapshot 当前公开快照
     */
    BotAction chooseMove(int seat, List<Card> hand, BigTwoSnapshot snapshot);
}
