package com.cardhub.gameservice.games.bigtwo.domain.bot;

import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoSnapshot;
import com.cardhub.gameservice.games.bigtwo.domain.model.Card;
import com.cardhub.gameservice.games.bigtwo.domain.model.Combo;
import com.cardhub.gameservice.games.bigtwo.domain.model.PlayRecord;
import com.cardhub.gameservice.games.bigtwo.domain.rule.ComboFinder;
import com.cardhub.gameservice.games.bigtwo.domain.rule.PlayValidator;

import java.util.ArrayList;
import java.util.List;

/**
 * 基础策略：总是出“刚好压得过”的最小牌。
 * 候选按从小到大排列，取第一个通过 {@link PlayValidator#validatePlay} 的组合：
 * - 首手：只有含方块 3 的单张能通过；
 * - 领出：最小的单张；
 * - 跟牌：同张数中能压过的最小组合，没有则过；
 * - 报单规则生效时只有规则要求的最大单张能通过。
 */
public class LowestBeatingPlayStrategy implements BotStrategy {

    @Override
    public BotAction chooseMove(int seat, List<Card> hand, BigTwoSnapshot snapshot) {
        if (hand.isEmpty()) return BotAction.pass();
        List<Card> sorted = new ArrayList<>(hand);
        sorted.sort(Card.ORDER);

        PlayRecord last = snapshot.lastPlay();
        int size = last == null ? 1 : last.combo().size();
        for (Combo c : ComboFinder.combosOfSize(sorted, size)) {
            if (PlayValidator.validatePlay(seat, c.cards(), snapshot, sorted).isEmpty()) {
                return BotAction.play(c.cards());
            }
        }
        return BotAction.pass();
    }
}
