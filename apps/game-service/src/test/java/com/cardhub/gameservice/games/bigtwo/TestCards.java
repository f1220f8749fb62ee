package com.cardhub.gameservice.games.bigtwo;

import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoState;
import com.cardhub.gameservice.games.bigtwo.domain.model.Card;
import com.cardhub.gameservice.games.bigtwo.domain.model.Combo;
import com.cardhub.gameservice.games.bigtwo.domain.model.PlayRecord;
import com.cardhub.gameservice.games.bigtwo.domain.enums.GamePhase;
import com.cardhub.gameservice.games.bigtwo.domain.rule.ComboClassifier;

import java.util.ArrayList;
import java.util.List;

/** 测试用牌面/状态构造 */
public final class TestCards {

    private TestCards() {
    }

    public static List<Card> cards(String... codes) {
        return Card.parseAll(List.of(codes));
    }

    public static Combo combo(String... codes) {
        return ComboClassifier.classify(cards(codes)).orElseThrow();
    }

    public static PlayRecord played(int seat, String... codes) {
        return new PlayRecord(seat, combo(codes));
    }

    /** 按花色发牌：座位 0 全方块，1 全梅花，2 全红桃，3 全黑桃 */
    public static List<List<Card>> dealBySuit() {
        List<List<Card>> hands = new ArrayList<>();
        for (int i = 0; i < BigTwoState.SEATS; i++) hands.add(new ArrayList<>());
        List<Card> deck = Card.fullDeck();
        for (int i = 0; i < deck.size(); i++) hands.get(i % BigTwoState.SEATS).add(deck.get(i));
        return hands;
    }

    /** 进行中的状态，四家手牌按给定牌面 */
    public static BigTwoState playing(int turn, List<Card> h0, List<Card> h1, List<Card> h2, List<Card> h3) {
        BigTwoState s = new BigTwoState();
        s.setRoomId("r1");
        s.setHands(new ArrayList<>(List.of(new ArrayList<>(h0), new ArrayList<>(h1), new ArrayList<>(h2), new ArrayList<>(h3))));
        s.setPhase(GamePhase.PLAYING);
        s.setCurrentTurn(turn);
        s.setVersion(1);
        return s;
    }
}
