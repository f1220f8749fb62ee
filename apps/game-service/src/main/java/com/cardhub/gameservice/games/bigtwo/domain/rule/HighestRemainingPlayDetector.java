package com.cardhub.gameservice.games.bigtwo.domain.rule;

import com.cardhub.gameservice.games.bigtwo.domain.enums.ComboType;
import com.cardhub.gameservice.games.bigtwo.domain.enums.Rank;
import com.cardhub.gameservice.games.bigtwo.domain.enums.Suit;
import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoState;
import com.cardhub.gameservice.games.bigtwo.domain.model.Card;
import com.cardhub.gameservice.games.bigtwo.domain.model.Combo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * “最大牌”检测：在候选牌池里扫描是否还存在能压过该手牌的组合。
 * 候选牌池 = 整副牌 − 本局已出牌 − 出牌者自己的手牌（公开信息 + 出牌者视角）。
 * 五张牌型按档位逐一检查，任何更高档的组合都算能压。
 */
public class HighestRemainingPlayDetector implements UnbeatablePlayPredicate {

    @Override
    public boolean isUnbeatable(Combo play, BigTwoState stateAfterPlay, int actorSeat) {
        Set<Card> pool = new HashSet<>(Card.fullDeck());
        pool.removeAll(stateAfterPlay.getPlayedPile());
        pool.removeAll(stateAfterPlay.hand(actorSeat));
        return !anyCanBeat(play, pool);
    }

    /** 牌池中是否存在能压过 play 的组合 */
    public static boolean anyCanBeat(Combo play, Collection<Card> pool) {
        if (pool.size() < play.size()) return false;
        Map<Rank, List<Card>> byRank = new EnumMap<>(Rank.class);
        Map<Suit, List<Card>> bySuit = new EnumMap<>(Suit.class);
        for (Card c : pool) {
            byRank.computeIfAbsent(c.rank(), k -> new ArrayList<>()).add(c);
            bySuit.computeIfAbsent(c.suit(), k -> new ArrayList<>()).add(c);
        }

        switch (play.type()) {
            case SINGLE:
                Card target = play.cards().get(0);
                return pool.stream().anyMatch(c -> c.value() > target.value());
            case PAIR:
                for (Map.Entry<Rank, List<Card>> e : byRank.entrySet()) {
                    if (e.getValue().size() < 2) continue;
                    int suit = maxSuit(e.getValue());
                    if (beats(e.getKey().value(), suit, play)) return true;
                }
                return false;
            case TRIPLE:
                for (Map.Entry<Rank, List<Card>> e : byRank.entrySet()) {
                    if (e.getValue().size() >= 3 && e.getKey().value() > play.primary()) return true;
                }
                return false;
            default:
                return anyFiveCardBeats(play, pool.size(), byRank, bySuit);
        }
    }

    private static boolean anyFiveCardBeats(Combo play,
                                            int poolSize,
                                            Map<Rank, List<Card>> byRank,
                                            Map<Suit, List<Card>> bySuit) {
        // 同花顺
        for (Map.Entry<Suit, List<Card>> e : bySuit.entrySet()) {
            Set<Rank> ranks = new HashSet<>();
            for (Card c : e.getValue()) ranks.add(c.rank());
            for (int i = 0; i < ComboClassifier.STRAIGHT_SEQUENCES.size(); i++) {
                if (ranks.containsAll(ComboClassifier.STRAIGHT_SEQUENCES.get(i))
                        && beatsAtTier(ComboType.STRAIGHT_FLUSH, i, e.getKey().value(), play)) {
                    return true;
                }
            }
        }
        // 铁支：四条 + 任意一张
        if (poolSize >= 5) {
            for (Map.Entry<Rank, List<Card>> e : byRank.entrySet()) {
                if (e.getValue().size() == 4 && beatsAtTier(ComboType.FOUR_OF_A_KIND, e.getKey().value(), 0, play)) {
                    return true;
                }
            }
        }
        // 葫芦：三条 + 另一点数的对子
        for (Map.Entry<Rank, List<Card>> t : byRank.entrySet()) {
            if (t.getValue().size() < 3) continue;
            boolean hasPair = byRank.entrySet().stream()
                    .anyMatch(p -> p.getKey() != t.getKey() && p.getValue().size() >= 2);
            if (hasPair && beatsAtTier(ComboType.FULL_HOUSE, t.getKey().value(), 0, play)) return true;
        }
        // 同花：取该花色最大一张作顶
        for (Map.Entry<Suit, List<Card>> e : bySuit.entrySet()) {
            if (e.getValue().size() < 5) continue;
            Card top = e.getValue().stream().max(Card.ORDER).orElseThrow();
            if (beatsAtTier(ComboType.FLUSH, top.rank().value(), top.suit().value(), play)) return true;
        }
        // 顺子：顶张取最大花色
        for (int i = 0; i < ComboClassifier.STRAIGHT_SEQUENCES.size(); i++) {
            List<Rank> seq = ComboClassifier.STRAIGHT_SEQUENCES.get(i);
            if (!byRank.keySet().containsAll(seq)) continue;
            int topSuit = maxSuit(byRank.get(seq.get(seq.size() - 1)));
            if (beatsAtTier(ComboType.STRAIGHT, i, topSuit, play)) return true;
        }
        return false;
    }

    /** 同牌型比较 (primary, secondary) */
    private static boolean beats(int primary, int secondary, Combo play) {
        if (primary != play.primary()) return primary > play.primary();
        return secondary > play.secondary();
    }

    private static boolean beatsAtTier(ComboType type, int primary, int secondary, Combo play) {
        if (type.strength() != play.type().strength()) return type.strength() > play.type().strength();
        return beats(primary, secondary, play);
    }

    private static int maxSuit(List<Card> cards) {
        int max = -1;
        for (Card c : cards) max = Math.max(max, c.suit().value());
        return max;
    }
}
