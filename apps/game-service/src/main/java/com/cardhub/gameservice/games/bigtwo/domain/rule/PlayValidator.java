package com.cardhub.gameservice.games.bigtwo.domain.rule;

import com.cardhub.gameservice.games.bigtwo.domain.constants.GameMessages;
import com.cardhub.gameservice.games.bigtwo.domain.enums.ErrorKind;
import com.cardhub.gameservice.games.bigtwo.domain.enums.GamePhase;
import com.cardhub.gameservice.games.bigtwo.domain.enums.PassOrigin;
import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoSnapshot;
import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoState;
import com.cardhub.gameservice.games.bigtwo.domain.model.Card;
import com.cardhub.gameservice.games.bigtwo.domain.model.Combo;
import com.cardhub.gameservice.games.bigtwo.domain.model.PlayRecord;
import com.cardhub.gameservice.games.bigtwo.domain.model.RuleViolation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 出牌/过牌合法性校验。
 * 按固定顺序检查，返回第一个失败项；失败以值返回（RuleViolation），不抛异常。
 */
public final class PlayValidator {

    private PlayValidator() {
    }

    /**
     * play 能否压过 last。
     * - last 为 null：任意合法牌型都可领出；
     * - 张数不同永远压不过；
     * - 单张/对子/三条只能被同牌型更大的压；
     * - 五张牌型先比档位，同档再比值。
     */
    public static boolean canBeat(Combo play, Combo last) {
        if (last == null) return true;
        if (play.size() != last.size()) return false;
        if (play.type() != last.type()) {
            if (!play.type().isFiveCard() || !last.type().isFiveCard()) return false;
            return play.type().strength() > last.type().strength();
        }
        return play.compareSameType(last) > 0;
    }

    public static boolean canBeat(Combo play, PlayRecord last) {
        return canBeat(play, last == null ? null : last.combo());
    }

    /**
     * 出牌校验，顺序：
     * 对局进行中 → 轮到该座位 → 持有全部牌 → 牌型合法 → 压得过 → 首手含 3♦ → 报单规则。
     */
    public static Optional<RuleViolation> validatePlay(int seat, List<Card> cards, BigTwoState state) {
        return validatePlay(seat, cards, BigTwoSnapshot.of(state), state.hand(seat));
    }

    /**
     * 同上，但只依赖公开快照与该座位自己的手牌（机器人只能看到这些）。
     * 报单规则所需的下家张数取自快照。
     */
    public static Optional<RuleViolation> validatePlay(int seat, List<Card> cards, BigTwoSnapshot view, List<Card> hand) {
        Optional<RuleViolation> turn = checkTurn(seat, view.phase(), view.currentTurn());
        if (turn.isPresent()) return turn;

        List<Card> missing = new ArrayList<>();
        for (Card c : cards) {
            if (!hand.contains(c)) missing.add(c);
        }
        if (!missing.isEmpty()) {
            return Optional.of(RuleViolation.of(ErrorKind.CARDS_NOT_OWNED,
                    GameMessages.formatCardsNotOwned(String.join(",", Card.codes(missing)))));
        }

        Optional<Combo> combo = ComboClassifier.classify(cards);
        if (combo.isEmpty()) {
            return Optional.of(RuleViolation.of(ErrorKind.INVALID_COMBO, GameMessages.INVALID_COMBO));
        }
        Combo play = combo.get();

        if (!canBeat(play, view.lastPlay())) {
            return Optional.of(RuleViolation.of(ErrorKind.CANNOT_BEAT_LAST_PLAY, GameMessages.CANNOT_BEAT_LAST_PLAY));
        }

        if (view.phase() == GamePhase.FIRST_PLAY && !play.contains(Card.THREE_OF_DIAMONDS)) {
            return Optional.of(new RuleViolation(ErrorKind.MISSING_REQUIRED_CARD,
                    GameMessages.formatMissingRequiredCard(Card.THREE_OF_DIAMONDS.code()), Card.THREE_OF_DIAMONDS));
        }

        return OneCardLeftRule.checkPlay(play, hand, view.handSize(OneCardLeftRule.nextSeat(seat)), view.lastPlay());
    }

    /** 玩家主动过牌校验 */
    public static Optional<RuleViolation> validatePass(int seat, BigTwoState state) {
        return validatePass(seat, state, PassOrigin.PLAYER);
    }

    /**
     * 过牌校验，顺序：对局进行中 → 轮到该座位 → 不是领出 → 报单规则（自动过牌豁免）。
     */
    public static Optional<RuleViolation> validatePass(int seat, BigTwoState state, PassOrigin origin) {
        Optional<RuleViolation> turn = checkTurn(seat, state);
        if (turn.isPresent()) return turn;
        if (state.getLastPlay() == null) {
            return Optional.of(RuleViolation.of(ErrorKind.CANNOT_PASS_WHILE_LEADING, GameMessages.CANNOT_PASS_WHILE_LEADING));
        }
        if (origin == PassOrigin.AUTO_PASS) return Optional.empty();
        return OneCardLeftRule.checkPass(seat, state);
    }

    private static Optional<RuleViolation> checkTurn(int seat, BigTwoState state) {
        return checkTurn(seat, state.getPhase(), state.getCurrentTurn());
    }

    private static Optional<RuleViolation> checkTurn(int seat, GamePhase phase, int currentTurn) {
        if (phase != GamePhase.FIRST_PLAY && phase != GamePhase.PLAYING) {
            return Optional.of(RuleViolation.of(ErrorKind.GAME_NOT_IN_PROGRESS,
                    GameMessages.formatGameNotInProgress(phase.name())));
        }
        if (currentTurn != seat) {
            return Optional.of(RuleViolation.of(ErrorKind.NOT_YOUR_TURN,
                    GameMessages.formatNotYourTurn(currentTurn)));
        }
        return Optional.empty();
    }
}
