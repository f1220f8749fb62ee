package com.cardhub.gameservice.games.bigtwo.domain.rule;

import java.util.ArrayList;
import java.util.List;

/**
 * 计分规则。
 * - 本局得分 = 剩余张数 × 倍数（1–4 张 ×1，5–9 张 ×2，10–13 张 ×3），出完为 0；
 * - 分数越低越好，任一座位累计分 ≥ 阈值即整场结束；
 * - 整场赢家为累计分最低者，并列取座位号最小者。
 */
public final class ScoreCalculator {

    public static final int DEFAULT_GAME_OVER_THRESHOLD = 101;

    private ScoreCalculator() {
    }

    public static int multiplier(int cardsRemaining) {
        if (cardsRemaining >= 10) return 3;
        if (cardsRemaining >= 5) return 2;
        return 1;
    }

    public static int scoreFor(int cardsRemaining) {
        if (cardsRemaining <= 0) return 0;
        return cardsRemaining * multiplier(cardsRemaining);
    }

    /** [0,3,7,12] → [0,3,14,36] */
    public static List<Integer> computeMatchScore(List<Integer> handSizes) {
        List<Integer> out = new ArrayList<>(handSizes.size());
        for (int n : handSizes) out.add(scoreFor(n));
        return out;
    }

    public static List<Integer> addToTotals(List<Integer> totals, List<Integer> deltas) {
        if (totals.size() != deltas.size()) {
            throw new IllegalArgumentException("座位数不一致: " + totals.size() + " vs " + deltas.size());
        }
        List<Integer> out = new ArrayList<>(totals.size());
        for (int i = 0; i < totals.size(); i++) out.add(totals.get(i) + deltas.get(i));
        return out;
    }

    public static boolean isGameOver(List<Integer> totals) {
        return isGameOver(totals, DEFAULT_GAME_OVER_THRESHOLD);
    }

    public static boolean isGameOver(List<Integer> totals, int threshold) {
        for (int t : totals) {
            if (t >= threshold) return true;
        }
        return false;
    }

    /** 累计分最低的座位；并列取座位号最小者 */
    public static int findFinalWinner(List<Integer> totals) {
        int best = 0;
        for (int i = 1; i < totals.size(); i++) {
            if (totals.get(i) < totals.get(best)) best = i;
        }
        return best;
    }
}
