package com.cardhub.gameservice.games.bigtwo.service;

import com.cardhub.gameservice.games.bigtwo.domain.enums.PassOrigin;
import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoSnapshot;
import com.cardhub.gameservice.games.bigtwo.domain.model.Card;
import com.cardhub.gameservice.games.bigtwo.domain.model.MoveResult;

import java.util.List;
import java.util.Set;

/**
 * 锄大地房间服务：每个房间唯一的权威修改者。
 * 规则校验失败以 MoveResult.rejected 返回；房间不存在抛 RoomNotFoundException。
 */
public interface BigTwoService {

    /**
     * 开局：发牌，第 1 局首手阶段，由 3♦ 持有者先出。
     * @param botSeats 由机器人代打的座位（可为空）
     */
    MoveResult startGame(String roomId, Set<Integer> botSeats);

    MoveResult play(String roomId, int seat, List<Card> cards);

    /** 玩家主动过牌 */
    MoveResult pass(String roomId, int seat);

    /** 指定来源的过牌（自动过牌走 AUTO_PASS，不受报单规则约束） */
    MoveResult pass(String roomId, int seat, PassOrigin origin);

    /** 只读快照（不含牌面） */
    BigTwoSnapshot getState(String roomId);

    /** 某座位的手牌（仅该座位自己可见） */
    List<Card> getHand(String roomId, int seat);

    /**
     * 自动过牌计时器到期。幂等：没有计时器、尚未到截止时间、或该房间已有连锁在执行时什么都不做。
     */
    void onTimerExpired(String roomId);

    /** 本局结束后发下一局 */
    MoveResult startNextMatch(String roomId);

    /** 权威时钟（毫秒） */
    long nowMs();
}
