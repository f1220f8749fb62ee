package com.cardhub.gameservice.games.bigtwo.domain.enums;

/**
 * 点数：锄大地规则下 3 最小、2 最大。
 * 枚举声明顺序即比较顺序（ordinal 越大越大）。
 */
public enum Rank {
    THREE("3"),
    FOUR("4"),
    FIVE("5"),
    SIX("6"),
    SEVEN("7"),
    EIGHT("8"),
    NINE("9"),
    TEN("10"),
    JACK("J"),
    QUEEN("Q"),
    KING("K"),
    ACE("A"),
    TWO("2");

    private final String code;

    Rank(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /** 比较用权值（0 = 3，12 = 2） */
    public int value() {
        return ordinal();
    }

    public static Rank fromCode(String code) {
        String upper = code.trim().toUpperCase();
        for (Rank r : values()) {
            if (r.code.equals(upper)) return r;
        }
        throw new IllegalArgumentException("非法点数: " + code);
    }
}
