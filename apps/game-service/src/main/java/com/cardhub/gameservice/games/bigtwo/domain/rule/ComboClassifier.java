package com.cardhub.gameservice.games.bigtwo.domain.rule;

import com.cardhub.gameservice.games.bigtwo.domain.enums.ComboType;
import com.cardhub.gameservice.games.bigtwo.domain.enums.Rank;
import com.cardhub.gameservice.games.bigtwo.domain.model.Card;
import com.cardhub.gameservice.games.bigtwo.domain.model.Combo;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 牌型识别。
 * 只包含纯判断逻辑：对任意牌组返回牌型或“非法”（Optional.empty）。
 * - 1 张：单张；2 张同点：对子；3 张同点：三条；
 * - 5 张依次判定：同花顺、铁支、葫芦、同花、顺子；
 * - 其它张数、重复牌、不成型一律非法。
 */
public final class ComboClassifier {

    /**
     * 合法顺子表（按序列下标从小到大）：A-2-3-4-5 最小，10-J-Q-K-A 最大。
     * 2 不能出现在顺子的顶端之后（J-Q-K-A-2 非法）。
     */
    public static final List<List<Rank>> STRAIGHT_SEQUENCES = buildSequences();

    private ComboClassifier() {
    }

    public static Optional<Combo> classify(List<Card> cards) {
        if (cards == null || cards.isEmpty()) return Optional.empty();
        if (new HashSet<>(cards).size() != cards.size()) return Optional.empty();

        List<Card> sorted = new ArrayList<>(cards);
        sorted.sort(Card.ORDER);
        Card top = sorted.get(sorted.size() - 1);

        switch (sorted.size()) {
            case 1:
                return Optional.of(new Combo(ComboType.SINGLE, sorted, top.rank().value(), top.suit().value()));
            case 2:
                if (!sameRank(sorted)) return Optional.empty();
                return Optional.of(new Combo(ComboType.PAIR, sorted, top.rank().value(), top.suit().value()));
            case 3:
                if (!sameRank(sorted)) return Optional.empty();
                return Optional.of(new Combo(ComboType.TRIPLE, sorted, top.rank().value(), 0));
            case 5:
                return classifyFive(sorted);
            default:
                return Optional.empty();
        }
    }

    public static boolean isValid(List<Card> cards) {
        return classify(cards).isPresent();
    }

    /** 5 张判定，入参已排序 */
    private static Optional<Combo> classifyFive(List<Card> sorted) {
        boolean flush = sorted.stream().allMatch(c -> c.suit() == sorted.get(0).suit());
        int seq = straightIndex(sorted);
        Map<Rank, Integer> counts = countByRank(sorted);

        if (seq >= 0 && flush) {
            return Optional.of(new Combo(ComboType.STRAIGHT_FLUSH, sorted, seq, topOfSequence(sorted, seq).suit().value()));
        }
        Rank quad = rankWithCount(counts, 4);
        if (quad != null) {
            return Optional.of(new Combo(ComboType.FOUR_OF_A_KIND, sorted, quad.value(), 0));
        }
        Rank triple = rankWithCount(counts, 3);
        if (triple != null && rankWithCount(counts, 2) != null) {
            return Optional.of(new Combo(ComboType.FULL_HOUSE, sorted, triple.value(), 0));
        }
        if (flush) {
            Card top = sorted.get(4);
            return Optional.of(new Combo(ComboType.FLUSH, sorted, top.rank().value(), top.suit().value()));
        }
        if (seq >= 0) {
            return Optional.of(new Combo(ComboType.STRAIGHT, sorted, seq, topOfSequence(sorted, seq).suit().value()));
        }
        return Optional.empty();
    }

    /**
     * 顺子序列下标；不是合法顺子返回 -1。
     * @param cards 5 张牌（任意顺序）
     */
    public static int straightIndex(List<Card> cards) {
        if (cards.size() != 5) return -1;
        List<Rank> ranks = new ArrayList<>(5);
        for (Card c : cards) ranks.add(c.rank());
        for (int i = 0; i < STRAIGHT_SEQUENCES.size(); i++) {
            List<Rank> seq = STRAIGHT_SEQUENCES.get(i);
            if (ranks.containsAll(seq) && seq.containsAll(ranks) && new HashSet<>(ranks).size() == 5) {
                return i;
            }
        }
        return -1;
    }

    /** 顺子“顶张”：序列中最后一个点数对应的牌 */
    private static Card topOfSequence(List<Card> cards, int seq) {
        List<Rank> ranks = STRAIGHT_SEQUENCES.get(seq);
        Rank topRank = ranks.get(ranks.size() - 1);
        for (Card c : cards) {
            if (c.rank() == topRank) return c;
        }
        throw new IllegalStateException("顺子缺少顶张: " + cards);
    }

    private static boolean sameRank(List<Card> cards) {
        Rank r = cards.get(0).rank();
        for (Card c : cards) {
            if (c.rank() != r) return false;
        }
        return true;
    }

    static Map<Rank, Integer> countByRank(List<Card> cards) {
        Map<Rank, Integer> counts = new EnumMap<>(Rank.class);
        for (Card c : cards) counts.merge(c.rank(), 1, Integer::sum);
        return counts;
    }

    private static Rank rankWithCount(Map<Rank, Integer> counts, int n) {
        for (Map.Entry<Rank, Integer> e : counts.entrySet()) {
            if (e.getValue() == n) return e.getKey();
        }
        return null;
    }

    private static List<List<Rank>> buildSequences() {
        Rank[] r = Rank.values();
        List<List<Rank>> seqs = new ArrayList<>(10);
        seqs.add(List.of(Rank.ACE, Rank.TWO, Rank.THREE, Rank.FOUR, Rank.FIVE));
        seqs.add(List.of(Rank.TWO, Rank.THREE, Rank.FOUR, Rank.FIVE, Rank.SIX));
        // 3-4-5-6-7 ... 10-J-Q-K-A
        for (int start = Rank.THREE.ordinal(); start <= Rank.TEN.ordinal(); start++) {
            seqs.add(List.of(r[start], r[start + 1], r[start + 2], r[start + 3], r[start + 4]));
        }
        return List.copyOf(seqs);
    }
}
