package com.cardhub.gameservice.games.bigtwo.domain.enums;

/**
 * 牌型及其强度。
 * - 单张/对子/三条只能被同牌型压制；
 * - 五张牌型之间按强度（strength）分档：顺子 < 同花 < 葫芦 < 铁支 < 同花顺。
 */
public enum ComboType {
    SINGLE(1, 1),
    PAIR(2, 2),
    TRIPLE(3, 3),
    STRAIGHT(4, 5),
    FLUSH(5, 5),
    FULL_HOUSE(6, 5),
    FOUR_OF_A_KIND(7, 5),
    STRAIGHT_FLUSH(8, 5);

    private final int strength;
    private final int size;

    ComboType(int strength, int size) {
        this.strength = strength;
        this.size = size;
    }

    public int strength() {
        return strength;
    }

    /** 该牌型需要的张数 */
    public int size() {
        return size;
    }

    public boolean isFiveCard() {
        return size == 5;
    }
}
