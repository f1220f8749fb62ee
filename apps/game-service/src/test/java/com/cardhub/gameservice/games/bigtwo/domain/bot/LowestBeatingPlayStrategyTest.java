package com.cardhub.gameservice.games.bigtwo.domain.bot;

import com.cardhub.gameservice.games.bigtwo.domain.enums.GamePhase;
import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoSnapshot;
import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoState;
import com.cardhub.gameservice.games.bigtwo.domain.model.Card;
import com.cardhub.gameservice.games.bigtwo.domain.model.Combo;
import com.cardhub.gameservice.games.bigtwo.domain.model.PlayRecord;
import com.cardhub.gameservice.games.bigtwo.domain.rule.ComboFinder;
import com.cardhub.gameservice.games.bigtwo.domain.rule.PlayValidator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.cardhub.gameservice.games.bigtwo.TestCards.cards;
import static com.cardhub.gameservice.games.bigtwo.TestCards.played;
import static com.cardhub.gameservice.games.bigtwo.TestCards.playing;
import static org.assertj.core.api.Assertions.assertThat;

class LowestBeatingPlayStrategyTest {

    private final LowestBeatingPlayStrategy strategy = new LowestBeatingPlayStrategy();

    @Test
    void opensWithThreeOfDiamonds() {
        BigTwoState s = playing(0, cards("3D", "4C", "9H"), cards("5D"), cards("6D"), cards("7D"));
        s.setPhase(GamePhase.FIRST_PLAY);

        BotAction a = strategy.chooseMove(0, s.hand(0), BigTwoSnapshot.of(s));

        assertThat(a.isPass()).isFalse();
        assertThat(a.cards()).containsExactlyElementsOf(cards("3D"));
    }

    @Test
    void leadsLowestSingle() {
        BigTwoState s = playing(0, cards("9H", "4C", "KD"), cards("5D"), cards("6D"), cards("7D"));

        assertThat(strategy.chooseMove(0, s.hand(0), BigTwoSnapshot.of(s)).cards()).containsExactlyElementsOf(cards("4C"));
    }

    @Test
    void followsWithWeakestBeatingCombo() {
        BigTwoState s = playing(0, cards("4C", "4D", "9H", "9S", "KD", "KS"), cards("5D", "5C"), cards("6D", "6C"), cards("7D", "7C"));
        s.setLastPlay(played(3, "8D", "8S"));

        assertThat(strategy.chooseMove(0, s.hand(0), BigTwoSnapshot.of(s)).cards()).containsExactlyElementsOf(cards("9H", "9S"));
    }

    @Test
    void passesWhenNothingBeats() {
        BigTwoState s = playing(0, cards("4C", "9H"), cards("5D", "5C"), cards("6D"), cards("7D"));
        s.setLastPlay(played(3, "2S"));

        assertThat(strategy.chooseMove(0, s.hand(0), BigTwoSnapshot.of(s)).isPass()).isTrue();
    }

    @Test
    void obeysOneCardLeft() {
        BigTwoState s = playing(0, cards("5D", "9S", "KH"), cards("AS"), cards("6D", "7H"), cards("8D", "8C"));
        s.setLastPlay(played(3, "4D"));

        assertThat(strategy.chooseMove(0, s.hand(0), BigTwoSnapshot.of(s)).cards()).containsExactlyElementsOf(cards("KH"));
    }

    @Test
    void chosenMovesAlwaysPassValidation() {
        Random rnd = new Random(11L);
        for (int i = 0; i < 200; i++) {
            List<Card> deck = new ArrayList<>(Card.fullDeck());
            Collections.shuffle(deck, rnd);
            // 下家有时只剩一张，触发报单规则
            int nextSize = rnd.nextBoolean() ? 1 : 13;
            BigTwoState s = playing(0, deck.subList(0, 13), deck.subList(13, 13 + nextSize),
                    deck.subList(26, 39), deck.subList(39, 52));
            List<Combo> lastOptions = ComboFinder.allCombos(s.hand(3));
            s.setLastPlay(new PlayRecord(3, lastOptions.get(rnd.nextInt(lastOptions.size()))));

            BotAction a = strategy.chooseMove(0, s.hand(0), BigTwoSnapshot.of(s));

            if (a.isPass()) {
                assertThat(PlayValidator.validatePass(0, s)).isEmpty();
            } else {
                assertThat(PlayValidator.validatePlay(0, a.cards(), s)).isEmpty();
            }
        }
    }
}
