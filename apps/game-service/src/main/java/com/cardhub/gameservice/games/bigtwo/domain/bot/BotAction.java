package com.cardhub.gameservice.games.bigtwo.domain.bot;

import com.cardhub.gameservice.games.bigtwo.domain.model.Card;

import java.util.List;

/** 机器人的决定：出哪些牌，或过牌 */
public record BotAction(Kind kind, List<Card> cards) {

    public enum Kind { PLAY, PASS }

    public BotAction {
        cards = cards == null ? List.of() : List.copyOf(cards);
    }

    public static BotAction play(List<Card> cards) {
        return new BotAction(Kind.PLAY, cards);
    }

    public static BotAction pass() {
        return new BotAction(Kind.PASS, List.of());
    }

    public boolean isPass() {
        return kind == Kind.PASS;
    }
}
