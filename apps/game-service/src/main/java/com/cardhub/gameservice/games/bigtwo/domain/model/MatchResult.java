package com.cardhub.gameservice.games.bigtwo.domain.model;

import java.util.List;

/**
 * 一局的结算结果。
 * @param matchNumber    第几局
 * @param winnerSeat     出完牌的座位
 * @param cardsRemaining 各座位剩余张数
 * @param deltas         各座位本局得分（剩余张数 × 倍数）
 */
public record MatchResult(int matchNumber, int winnerSeat, List<Integer> cardsRemaining, List<Integer> deltas) {

    public MatchResult {
        cardsRemaining = List.copyOf(cardsRemaining);
        deltas = List.copyOf(deltas);
    }
}
