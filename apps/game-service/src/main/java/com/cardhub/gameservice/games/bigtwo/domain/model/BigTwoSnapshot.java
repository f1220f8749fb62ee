package com.cardhub.gameservice.games.bigtwo.domain.model;

import com.cardhub.gameservice.games.bigtwo.domain.enums.GamePhase;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Set;

/**
 * 对外只读快照：不含任何牌面，只有各家张数。
 * autoPassTimer 为 null 表示当前没有计时器。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BigTwoSnapshot(String roomId,
                             GamePhase phase,
                             int matchNumber,
                             int currentTurn,
                             PlayRecord lastPlay,
                             int consecutivePasses,
                             List<Integer> handSizes,
                             int playedCount,
                             List<Integer> totals,
                             TimerState.Active autoPassTimer,
                             MatchResult lastMatch,
                             Integer finalWinner,
                             Set<Integer> botSeats,
                             long version) {

    public static BigTwoSnapshot of(BigTwoState s) {
        TimerState.Active timer = s.getTimer() instanceof TimerState.Active a ? a : null;
        return new BigTwoSnapshot(
                s.getRoomId(),
                s.getPhase(),
                s.getMatchNumber(),
                s.getCurrentTurn(),
                s.getLastPlay(),
                s.getConsecutivePasses(),
                List.copyOf(s.handSizes()),
                s.getPlayedPile().size(),
                List.copyOf(s.getTotals()),
                timer,
                s.getLastMatch(),
                s.getFinalWinner(),
                Set.copyOf(s.getBotSeats()),
                s.getVersion());
    }

    public int handSize(int seat) {
        return handSizes.get(seat);
    }

    public boolean inProgress() {
        return phase == GamePhase.FIRST_PLAY || phase == GamePhase.PLAYING;
    }
}
