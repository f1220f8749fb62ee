package com.cardhub.gameservice.games.bigtwo.domain.rule;

import com.cardhub.gameservice.games.bigtwo.domain.model.Card;
import com.cardhub.gameservice.games.bigtwo.domain.model.Combo;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 从一手牌里枚举指定张数的全部合法牌型（供机器人选牌使用）。
 * 手牌最多 13 张，五张组合至多 C(13,5)=1287 种，直接枚举。
 */
public final class ComboFinder {

    /** 牌型从小到大：先比档位，再比同档比较值 */
    public static final Comparator<Combo> WEAKEST_FIRST = Comparator
            .comparingInt((Combo c) -> c.type().strength())
            .thenComparingInt(Combo::primary)
            .thenComparingInt(Combo::secondary);

    private ComboFinder() {
    }

    public static List<Combo> combosOfSize(List<Card> hand, int size) {
        List<Combo> out = new ArrayList<>();
        if (size <= 0 || size > hand.size()) return out;
        collect(hand, size, 0, new ArrayList<>(size), out);
        out.sort(WEAKEST_FIRST);
        return out;
    }

    public static List<Combo> allCombos(List<Card> hand) {
        List<Combo> out = new ArrayList<>();
        for (int size : new int[]{1, 2, 3, 5}) out.addAll(combosOfSize(hand, size));
        return out;
    }

    private static void collect(List<Card> hand, int size, int from, List<Card> picked, List<Combo> out) {
        if (picked.size() == size) {
            Optional<Combo> combo = ComboClassifier.classify(picked);
            combo.ifPresent(out::add);
            return;
        }
        for (int i = from; i <= hand.size() - (size - picked.size()); i++) {
            picked.add(hand.get(i));
            collect(hand, size, i + 1, picked, out);
            picked.remove(picked.size() - 1);
        }
    }
}
