package com.cardhub.gameservice.games.bigtwo.domain.engine;

import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoState;
import com.cardhub.gameservice.games.bigtwo.domain.model.Card;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/** 随机洗牌发牌 */
public class ShuffledDealer implements Dealer {

    private final Random random;

    public ShuffledDealer() {
        this(new Random());
    }

    public ShuffledDealer(Random random) {
        this.random = random;
    }

    @Override
    public List<List<Card>> deal() {
        List<Card> deck = Card.fullDeck();
        Collections.shuffle(deck, random);
        List<List<Card>> hands = new ArrayList<>(BigTwoState.SEATS);
        for (int s = 0; s < BigTwoState.SEATS; s++) {
            List<Card> hand = new ArrayList<>(deck.subList(s * BigTwoState.HAND_SIZE, (s + 1) * BigTwoState.HAND_SIZE));
            hand.sort(Card.ORDER);
            hands.add(hand);
        }
        return hands;
    }
}
