package com.cardhub.gameservice.games.bigtwo.domain.dto;

import com.cardhub.gameservice.games.bigtwo.domain.enums.GamePhase;
import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoState;
import com.cardhub.gameservice.games.bigtwo.domain.model.Card;
import com.cardhub.gameservice.games.bigtwo.domain.model.Combo;
import com.cardhub.gameservice.games.bigtwo.domain.model.MatchResult;
import com.cardhub.gameservice.games.bigtwo.domain.model.PlayRecord;
import com.cardhub.gameservice.games.bigtwo.domain.model.TimerState;
import com.cardhub.gameservice.games.bigtwo.domain.rule.ComboClassifier;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * BigTwoState ⇄ GameStateRecord 转换工具。
 * 牌型不落库，读取时由牌面重新识别。
 */
public final class GameStateRecordConverter {

    private GameStateRecordConverter() {
    }

    public static GameStateRecord toRecord(BigTwoState s) {
        GameStateRecord r = new GameStateRecord();
        r.setRoomId(s.getRoomId());
        List<List<String>> hands = new ArrayList<>();
        for (List<Card> h : s.getHands()) hands.add(Card.codes(h));
        r.setHands(hands);
        r.setPlayedPile(Card.codes(s.getPlayedPile()));
        r.setCurrentTurn(s.getCurrentTurn());
        if (s.getLastPlay() != null) {
            r.setLastPlaySeat(s.getLastPlay().seat());
            r.setLastPlayCards(Card.codes(s.getLastPlay().combo().cards()));
        }
        r.setConsecutivePasses(s.getConsecutivePasses());
        r.setMatchNumber(s.getMatchNumber());
        r.setPhase(s.getPhase().name());
        if (s.getTimer() instanceof TimerState.Active t) {
            r.setTimerExemptSeat(t.exemptSeat());
            r.setTimerEndTimestamp(t.endTimestamp());
            r.setTimerCreatedAt(t.serverTimeAtCreation());
            r.setTimerDurationMs(t.durationMs());
            r.setTimerSequence(t.sequenceId());
            r.setTimerComboCards(Card.codes(t.triggeringCombo().cards()));
        }
        r.setLastTimerSequence(s.getLastTimerSequence());
        r.setTotals(new ArrayList<>(s.getTotals()));
        if (s.getLastMatch() != null) {
            MatchResult m = s.getLastMatch();
            r.setLastMatchNumber(m.matchNumber());
            r.setLastMatchWinner(m.winnerSeat());
            r.setLastMatchRemaining(new ArrayList<>(m.cardsRemaining()));
            r.setLastMatchDeltas(new ArrayList<>(m.deltas()));
        }
        r.setFinalWinner(s.getFinalWinner());
        r.setBotSeats(new ArrayList<>(s.getBotSeats()));
        r.setVersion(s.getVersion());
        return r;
    }

    public static BigTwoState fromRecord(GameStateRecord r) {
        BigTwoState s = new BigTwoState();
        s.setRoomId(r.getRoomId());
        List<List<Card>> hands = new ArrayList<>();
        for (List<String> h : r.getHands()) hands.add(new ArrayList<>(Card.parseAll(h)));
        s.setHands(hands);
        s.setPlayedPile(new ArrayList<>(Card.parseAll(r.getPlayedPile())));
        s.setCurrentTurn(r.getCurrentTurn());
        if (r.getLastPlaySeat() != null) {
            s.setLastPlay(new PlayRecord(r.getLastPlaySeat(), combo(r.getLastPlayCards())));
        }
        s.setConsecutivePasses(r.getConsecutivePasses());
        s.setMatchNumber(r.getMatchNumber());
        s.setPhase(GamePhase.valueOf(r.getPhase()));
        if (r.getTimerSequence() != null) {
            s.setTimer(new TimerState.Active(
                    r.getTimerExemptSeat(),
                    r.getTimerEndTimestamp(),
                    r.getTimerCreatedAt(),
                    r.getTimerDurationMs(),
                    r.getTimerSequence(),
                    combo(r.getTimerComboCards())));
        }
        s.setLastTimerSequence(r.getLastTimerSequence());
        s.setTotals(new ArrayList<>(r.getTotals()));
        if (r.getLastMatchWinner() != null) {
            s.setLastMatch(new MatchResult(r.getLastMatchNumber(), r.getLastMatchWinner(),
                    r.getLastMatchRemaining(), r.getLastMatchDeltas()));
        }
        s.setFinalWinner(r.getFinalWinner());
        s.setBotSeats(new LinkedHashSet<>(r.getBotSeats()));
        s.setVersion(r.getVersion());
        return s;
    }

    private static Combo combo(List<String> codes) {
        return ComboClassifier.classify(Card.parseAll(codes))
                .orElseThrow(() -> new IllegalStateException("持久化的牌型非法: " + codes));
    }
}
