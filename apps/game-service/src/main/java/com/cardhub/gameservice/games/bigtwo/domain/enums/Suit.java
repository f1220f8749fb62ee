package com.cardhub.gameservice.games.bigtwo.domain.enums;

/**
 * 花色：仅在同点数比较时作为次级比较依据。
 * 大小顺序：方块 D < 梅花 C < 红桃 H < 黑桃 S
 */
public enum Suit {
    DIAMONDS('D'),
    CLUBS('C'),
    HEARTS('H'),
    SPADES('S');

    private final char code;

    Suit(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    /** 比较用权值（0 最小） */
    public int value() {
        return ordinal();
    }

    public static Suit fromCode(char c) {
        char upper = Character.toUpperCase(c);
        for (Suit s : values()) {
            if (s.code == upper) return s;
        }
        throw new IllegalArgumentException("非法花色: " + c);
    }
}
