package com.cardhub.gameservice.games.bigtwo.domain.model;

import com.cardhub.gameservice.games.bigtwo.domain.enums.Rank;
import com.cardhub.gameservice.games.bigtwo.domain.enums.Suit;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 一张牌（不可变）。
 * 线上编码：点数 + 花色字母，如 "3D"、"10H"、"AS"、"2S"（输入大小写不敏感）。
 * 自然顺序：先比点数，再比花色。
 */
public record Card(Rank rank, Suit suit) implements Comparable<Card> {

    public static final Card THREE_OF_DIAMONDS = new Card(Rank.THREE, Suit.DIAMONDS);

    /** 按 (rank, suit) 升序 */
    public static final Comparator<Card> ORDER =
            Comparator.comparingInt((Card c) -> c.rank.value()).thenComparingInt(c -> c.suit.value());

    public Card {
        Objects.requireNonNull(rank, "rank");
        Objects.requireNonNull(suit, "suit");
    }

    /**
     * 解析线上编码。
     * @throws IllegalArgumentException 编码非法
     */
    @JsonCreator
    public static Card parse(String code) {
        if (code == null || code.trim().length() < 2) {
            throw new IllegalArgumentException("非法牌面编码: " + code);
        }
        String c = code.trim();
        Suit suit = Suit.fromCode(c.charAt(c.length() - 1));
        Rank rank = Rank.fromCode(c.substring(0, c.length() - 1));
        return new Card(rank, suit);
    }

    public static List<Card> parseAll(Collection<String> codes) {
        if (codes == null) throw new IllegalArgumentException("缺少牌面编码");
        List<Card> out = new ArrayList<>(codes.size());
        for (String code : codes) out.add(parse(code));
        return out;
    }

    public static List<String> codes(Collection<Card> cards) {
        List<String> out = new ArrayList<>(cards.size());
        for (Card c : cards) out.add(c.code());
        return out;
    }

    /** 完整 52 张牌，按自然顺序 */
    public static List<Card> fullDeck() {
        List<Card> deck = new ArrayList<>(52);
        for (Rank r : Rank.values()) {
            for (Suit s : Suit.values()) deck.add(new Card(r, s));
        }
        return deck;
    }

    @JsonValue
    public String code() {
        return rank.code() + suit.code();
    }

    /** 单张比较值：点数为主、花色为次 */
    public int value() {
        return rank.value() * 4 + suit.value();
    }

    @Override
    public int compareTo(Card o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return code();
    }
}
