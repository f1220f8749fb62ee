package com.cardhub.gameservice.games.bigtwo.domain.engine;

import com.cardhub.gameservice.games.bigtwo.domain.constants.GameMessages;
import com.cardhub.gameservice.games.bigtwo.domain.enums.ErrorKind;
import com.cardhub.gameservice.games.bigtwo.domain.enums.GamePhase;
import com.cardhub.gameservice.games.bigtwo.domain.enums.PassOrigin;
import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoState;
import com.cardhub.gameservice.games.bigtwo.domain.model.Card;
import com.cardhub.gameservice.games.bigtwo.domain.model.Combo;
import com.cardhub.gameservice.games.bigtwo.domain.model.MatchResult;
import com.cardhub.gameservice.games.bigtwo.domain.model.PlayRecord;
import com.cardhub.gameservice.games.bigtwo.domain.model.RuleViolation;
import com.cardhub.gameservice.games.bigtwo.domain.model.TimerState;
import com.cardhub.gameservice.games.bigtwo.domain.rule.ComboClassifier;
import com.cardhub.gameservice.games.bigtwo.domain.rule.OneCardLeftRule;
import com.cardhub.gameservice.games.bigtwo.domain.rule.PlayValidator;
import com.cardhub.gameservice.games.bigtwo.domain.rule.ScoreCalculator;
import com.cardhub.gameservice.games.bigtwo.domain.rule.UnbeatablePlayPredicate;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 回合状态机。
 * 作用：在一份（已复制的）BigTwoState 上执行出牌/过牌/开局/下一局迁移。
 * - 先校验，失败返回 RuleViolation，状态不变；
 * - 成功则就地修改状态并 version + 1；
 * - 出牌会整体替换计时器（无人能压 → 新计时器；否则 None）；
 * - 过牌不取消计时器；三家连过时清桌，若有计时器则回到豁免座位并清除计时器。
 * 不负责并发与持久化，由服务层保证“一个房间同一时刻只有一个修改者”。
 */
@Slf4j
public class TurnStateMachine {

    private final UnbeatablePlayPredicate unbeatable;
    private final Clock clock;
    private final long autoPassDurationMs;
    private final int gameOverThreshold;

    public TurnStateMachine(UnbeatablePlayPredicate unbeatable, Clock clock, long autoPassDurationMs, int gameOverThreshold) {
        this.unbeatable = unbeatable;
        this.clock = clock;
        this.autoPassDurationMs = autoPassDurationMs;
        this.gameOverThreshold = gameOverThreshold;
    }

    /** 开局：第 1 局，首手阶段，由 3♦ 持有者先出 */
    public BigTwoState newGame(String roomId, List<List<Card>> hands, Set<Integer> botSeats) {
        BigTwoState s = new BigTwoState();
        s.setRoomId(roomId);
        s.setHands(copyHands(hands));
        s.setMatchNumber(1);
        s.setPhase(GamePhase.FIRST_PLAY);
        s.setCurrentTurn(requireHolderOfThree(s));
        s.setBotSeats(new LinkedHashSet<>(botSeats));
        s.setVersion(1);
        return s;
    }

    public Optional<RuleViolation> play(BigTwoState s, int seat, List<Card> cards) {
        Optional<RuleViolation> violation = PlayValidator.validatePlay(seat, cards, s);
        if (violation.isPresent()) return violation;
        Combo combo = ComboClassifier.classify(cards).orElseThrow();

        s.hand(seat).removeAll(combo.cards());
        s.getPlayedPile().addAll(combo.cards());
        s.setLastPlay(new PlayRecord(seat, combo));
        s.setConsecutivePasses(0);
        if (s.getPhase() == GamePhase.FIRST_PLAY) s.setPhase(GamePhase.PLAYING);
        s.setCurrentTurn(OneCardLeftRule.nextSeat(seat));

        if (s.hand(seat).isEmpty()) {
            finishMatch(s, seat);
        } else if (unbeatable.isUnbeatable(combo, s, seat)) {
            long now = clock.millis();
            long seq = s.getLastTimerSequence() + 1;
            s.setLastTimerSequence(seq);
            s.setTimer(new TimerState.Active(seat, now + autoPassDurationMs, now, autoPassDurationMs, seq, combo));
            log.info("自动过牌计时器启动: room={}, seat={}, seq={}, combo={}", s.getRoomId(), seat, seq, combo.type());
        } else {
            s.setTimer(TimerState.NONE);
        }
        s.setVersion(s.getVersion() + 1);
        return Optional.empty();
    }

    public Optional<RuleViolation> pass(BigTwoState s, int seat, PassOrigin origin) {
        Optional<RuleViolation> violation = PlayValidator.validatePass(seat, s, origin);
        if (violation.isPresent()) return violation;

        s.setConsecutivePasses(s.getConsecutivePasses() + 1);
        s.setCurrentTurn(OneCardLeftRule.nextSeat(seat));
        if (s.getConsecutivePasses() >= BigTwoState.SEATS - 1) {
            // 清桌：上一手出牌者重新领出
            s.setLastPlay(null);
            s.setConsecutivePasses(0);
            if (s.getTimer() instanceof TimerState.Active active) {
                s.setCurrentTurn(active.exemptSeat());
                s.setTimer(TimerState.NONE);
            }
        }
        s.setVersion(s.getVersion() + 1);
        return Optional.empty();
    }

    /** 下一局：仅在本局结束（FINISHED）后可用；上一局赢家领出，无 3♦ 约束 */
    public Optional<RuleViolation> startNextMatch(BigTwoState s, List<List<Card>> hands) {
        if (s.getPhase() != GamePhase.FINISHED) {
            String msg = s.getPhase() == GamePhase.GAME_OVER
                    ? GameMessages.formatGameNotInProgress(s.getPhase().name())
                    : GameMessages.NEXT_MATCH_NOT_READY;
            return Optional.of(RuleViolation.of(ErrorKind.GAME_NOT_IN_PROGRESS, msg));
        }
        s.setHands(copyHands(hands));
        s.setPlayedPile(new ArrayList<>());
        s.setMatchNumber(s.getMatchNumber() + 1);
        s.setPhase(GamePhase.PLAYING);
        s.setCurrentTurn(s.getLastMatch().winnerSeat());
        s.setLastPlay(null);
        s.setConsecutivePasses(0);
        s.setTimer(TimerState.NONE);
        s.setVersion(s.getVersion() + 1);
        log.info("新一局开始: room={}, match={}, leader={}", s.getRoomId(), s.getMatchNumber(), s.getCurrentTurn());
        return Optional.empty();
    }

    private void finishMatch(BigTwoState s, int winnerSeat) {
        List<Integer> sizes = s.handSizes();
        List<Integer> deltas = ScoreCalculator.computeMatchScore(sizes);
        List<Integer> totals = ScoreCalculator.addToTotals(s.getTotals(), deltas);
        s.setTotals(new ArrayList<>(totals));
        s.setLastMatch(new MatchResult(s.getMatchNumber(), winnerSeat, sizes, deltas));
        s.setTimer(TimerState.NONE);
        if (ScoreCalculator.isGameOver(totals, gameOverThreshold)) {
            s.setPhase(GamePhase.GAME_OVER);
            s.setFinalWinner(ScoreCalculator.findFinalWinner(totals));
            log.info("整场结束: room={}, totals={}, winner={}", s.getRoomId(), totals, s.getFinalWinner());
        } else {
            s.setPhase(GamePhase.FINISHED);
            log.info("本局结束: room={}, match={}, winner={}, deltas={}", s.getRoomId(), s.getMatchNumber(), winnerSeat, deltas);
        }
    }

    /** 四家手牌 + 已出牌堆 恰好是一副 52 张，无重复 */
    public static boolean isDeckConserved(BigTwoState s) {
        Set<Card> seen = new HashSet<>();
        int count = 0;
        for (List<Card> h : s.getHands()) {
            seen.addAll(h);
            count += h.size();
        }
        seen.addAll(s.getPlayedPile());
        count += s.getPlayedPile().size();
        return count == 52 && seen.size() == 52;
    }

    private static int requireHolderOfThree(BigTwoState s) {
        int holder = s.holderOf(Card.THREE_OF_DIAMONDS);
        if (holder < 0) throw new IllegalArgumentException("发牌结果中没有 3D");
        return holder;
    }

    private static List<List<Card>> copyHands(List<List<Card>> hands) {
        if (hands.size() != BigTwoState.SEATS) {
            throw new IllegalArgumentException("需要 4 手牌，实际 " + hands.size());
        }
        List<List<Card>> out = new ArrayList<>(BigTwoState.SEATS);
        for (List<Card> h : hands) {
            List<Card> copy = new ArrayList<>(h);
            copy.sort(Card.ORDER);
            out.add(copy);
        }
        return out;
    }
}
