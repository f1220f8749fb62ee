package com.cardhub.gameservice.games.bigtwo.domain.rule;

import com.cardhub.gameservice.games.bigtwo.domain.enums.ComboType;
import com.cardhub.gameservice.games.bigtwo.domain.enums.Rank;
import com.cardhub.gameservice.games.bigtwo.domain.enums.Suit;
import com.cardhub.gameservice.games.bigtwo.domain.model.Combo;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.cardhub.gameservice.games.bigtwo.TestCards.cards;
import static org.assertj.core.api.Assertions.assertThat;

class ComboClassifierTest {

    @Test
    void singlesPairsAndTriples() {
        assertThat(ComboClassifier.classify(cards("7H")).orElseThrow().type()).isEqualTo(ComboType.SINGLE);

        Combo pair = ComboClassifier.classify(cards("9D", "9S")).orElseThrow();
        assertThat(pair.type()).isEqualTo(ComboType.PAIR);
        assertThat(pair.primary()).isEqualTo(Rank.NINE.value());
        assertThat(pair.secondary()).isEqualTo(Suit.SPADES.value());

        assertThat(ComboClassifier.classify(cards("KD", "KC", "KH")).orElseThrow().type()).isEqualTo(ComboType.TRIPLE);
    }

    @Test
    void mismatchedRanksAreInvalid() {
        assertThat(ComboClassifier.classify(cards("9D", "10S"))).isEmpty();
        assertThat(ComboClassifier.classify(cards("KD", "KC", "AH"))).isEmpty();
    }

    @Test
    void unsupportedSizesAndDuplicatesAreInvalid() {
        assertThat(ComboClassifier.classify(List.of())).isEmpty();
        assertThat(ComboClassifier.classify(cards("3D", "3C", "3H", "3S"))).isEmpty();
        assertThat(ComboClassifier.classify(cards("3D", "3D"))).isEmpty();
        assertThat(ComboClassifier.classify(cards("3D", "4D", "5D", "6D", "7D", "8D"))).isEmpty();
    }

    @Test
    void lowestAndHighestStraights() {
        Combo low = ComboClassifier.classify(cards("AH", "2S", "3D", "4C", "5H")).orElseThrow();
        assertThat(low.type()).isEqualTo(ComboType.STRAIGHT);
        assertThat(low.primary()).isZero();
        // 顶张是 5H
        assertThat(low.secondary()).isEqualTo(Suit.HEARTS.value());

        Combo twoToSix = ComboClassifier.classify(cards("2D", "3C", "4H", "5S", "6D")).orElseThrow();
        assertThat(twoToSix.primary()).isEqualTo(1);

        Combo high = ComboClassifier.classify(cards("10D", "JC", "QH", "KS", "AD")).orElseThrow();
        assertThat(high.type()).isEqualTo(ComboType.STRAIGHT);
        assertThat(high.primary()).isEqualTo(9);
    }

    @Test
    void wrapAroundPastTwoIsNotAStraight() {
        assertThat(ComboClassifier.classify(cards("JD", "QC", "KH", "AS", "2D"))).isEmpty();
        assertThat(ComboClassifier.classify(cards("QD", "KC", "AH", "2S", "3D"))).isEmpty();
    }

    @Test
    void fiveCardTiers() {
        assertThat(ComboClassifier.classify(cards("3H", "5H", "7H", "9H", "JH")).orElseThrow().type())
                .isEqualTo(ComboType.FLUSH);
        Combo fullHouse = ComboClassifier.classify(cards("3D", "3C", "3H", "4D", "4S")).orElseThrow();
        assertThat(fullHouse.type()).isEqualTo(ComboType.FULL_HOUSE);
        assertThat(fullHouse.primary()).isEqualTo(Rank.THREE.value());
        Combo quads = ComboClassifier.classify(cards("8D", "8C", "8H", "8S", "3D")).orElseThrow();
        assertThat(quads.type()).isEqualTo(ComboType.FOUR_OF_A_KIND);
        assertThat(quads.primary()).isEqualTo(Rank.EIGHT.value());
        assertThat(ComboClassifier.classify(cards("5S", "6S", "7S", "8S", "9S")).orElseThrow().type())
                .isEqualTo(ComboType.STRAIGHT_FLUSH);
    }

    @Test
    void cardsAreKeptSorted() {
        Combo c = ComboClassifier.classify(cards("9S", "9D")).orElseThrow();
        assertThat(c.cards()).containsExactlyElementsOf(cards("9D", "9S"));
    }

    @Test
    void straightIndexRejectsNonStraights() {
        assertThat(ComboClassifier.straightIndex(cards("3D", "4C", "5H", "6S", "8D"))).isEqualTo(-1);
        assertThat(ComboClassifier.straightIndex(cards("3D", "4C", "5H", "6S"))).isEqualTo(-1);
        assertThat(ComboClassifier.straightIndex(cards("3D", "4C", "5H", "6S", "7D"))).isEqualTo(2);
    }
}
