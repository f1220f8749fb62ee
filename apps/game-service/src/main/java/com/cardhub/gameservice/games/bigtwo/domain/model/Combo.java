package com.cardhub.gameservice.games.bigtwo.domain.model;

import com.cardhub.gameservice.games.bigtwo.domain.enums.ComboType;

import java.util.List;

/**
 * 已识别的牌型（不可变）。
 * - cards 按 (rank, suit) 升序保存；
 * - primary / secondary 为同牌型内的比较值（字典序），由 ComboClassifier 计算：
 *   单张 (点数, 花色)；对子 (点数, 最大花色)；三条 点数；
 *   顺子/同花顺 (序列下标, 顶张花色)；同花 (最大张点数, 其花色)；
 *   葫芦 三条点数；铁支 四条点数。
 */
public record Combo(ComboType type, List<Card> cards, int primary, int secondary) {

    public Combo {
        cards = List.copyOf(cards);
    }

    public int size() {
        return cards.size();
    }

    /** 同牌型比较：正数表示 this 更大 */
    public int compareSameType(Combo other) {
        if (primary != other.primary) return Integer.compare(primary, other.primary);
        return Integer.compare(secondary, other.secondary);
    }

    public boolean contains(Card card) {
        return cards.contains(card);
    }
}
