package com.cardhub.gameservice.games.bigtwo.domain.rule;

import com.cardhub.gameservice.games.bigtwo.domain.constants.GameMessages;
import com.cardhub.gameservice.games.bigtwo.domain.enums.ComboType;
import com.cardhub.gameservice.games.bigtwo.domain.enums.ErrorKind;
import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoState;
import com.cardhub.gameservice.games.bigtwo.domain.model.Card;
import com.cardhub.gameservice.games.bigtwo.domain.model.Combo;
import com.cardhub.gameservice.games.bigtwo.domain.model.PlayRecord;
import com.cardhub.gameservice.games.bigtwo.domain.model.RuleViolation;

import java.util.List;
import java.util.Optional;

/**
 * “报单”规则。
 * 生效条件（同时满足）：
 * - 下家（按出牌顺序）只剩 1 张；
 * - 上一手是单张；
 * - 当前座位手里至少有一张能压过它的单张。
 * 生效时当前座位必须出能压过的最大单张：不能过，也不能出其它单张。
 * 对子/三条/五张牌型对单张本就压不过（由 canBeat 拒绝），本规则对它们不起作用。
 */
public final class OneCardLeftRule {

    private OneCardLeftRule() {
    }

    /** 出牌顺序中的下家 */
    public static int nextSeat(int seat) {
        return (seat + 1) % BigTwoState.SEATS;
    }

    /**
     * 规则生效时必须打出的单张；不生效返回 empty。
     * @param hand             当前座位手牌
     * @param nextSeatHandSize 下家剩余张数
     * @param lastPlay         上一手（可为 null）
     */
    public static Optional<Card> requiredSingle(List<Card> hand, int nextSeatHandSize, PlayRecord lastPlay) {
        if (nextSeatHandSize != 1 || lastPlay == null) return Optional.empty();
        Combo last = lastPlay.combo();
        if (last.type() != ComboType.SINGLE) return Optional.empty();
        Card target = last.cards().get(0);
        Card best = null;
        for (Card c : hand) {
            if (c.value() > target.value() && (best == null || c.value() > best.value())) best = c;
        }
        return Optional.ofNullable(best);
    }

    public static Optional<Card> requiredSingle(int seat, BigTwoState state) {
        int next = nextSeat(seat);
        return requiredSingle(state.hand(seat), state.hand(next).size(), state.getLastPlay());
    }

    /** 出牌检查：只约束单张 */
    public static Optional<RuleViolation> checkPlay(int seat, Combo play, BigTwoState state) {
        return checkPlay(play, state.hand(seat), state.hand(nextSeat(seat)).size(), state.getLastPlay());
    }

    public static Optional<RuleViolation> checkPlay(Combo play, List<Card> hand, int nextSeatHandSize, PlayRecord lastPlay) {
        if (play.type() != ComboType.SINGLE) return Optional.empty();
        return requiredSingle(hand, nextSeatHandSize, lastPlay)
                .filter(required -> !required.equals(play.cards().get(0)))
                .map(OneCardLeftRule::violation);
    }

    /** 过牌检查：有能压的单张就不能过 */
    public static Optional<RuleViolation> checkPass(int seat, BigTwoState state) {
        return requiredSingle(seat, state).map(OneCardLeftRule::violation);
    }

    private static RuleViolation violation(Card required) {
        return new RuleViolation(ErrorKind.ONE_CARD_LEFT_VIOLATION,
                GameMessages.formatOneCardLeft(required.code()), required);
    }
}
