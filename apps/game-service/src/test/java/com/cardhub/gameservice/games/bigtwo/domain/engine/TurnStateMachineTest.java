package com.cardhub.gameservice.games.bigtwo.domain.engine;

import com.cardhub.gameservice.games.bigtwo.domain.enums.ErrorKind;
import com.cardhub.gameservice.games.bigtwo.domain.enums.GamePhase;
import com.cardhub.gameservice.games.bigtwo.domain.enums.PassOrigin;
import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoState;
import com.cardhub.gameservice.games.bigtwo.domain.model.Card;
import com.cardhub.gameservice.games.bigtwo.domain.model.RuleViolation;
import com.cardhub.gameservice.games.bigtwo.domain.model.TimerState;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.cardhub.gameservice.games.bigtwo.TestCards.cards;
import static com.cardhub.gameservice.games.bigtwo.TestCards.dealBySuit;
import static com.cardhub.gameservice.games.bigtwo.TestCards.playing;
import static org.assertj.core.api.Assertions.assertThat;

class TurnStateMachineTest {

    private static final long NOW = 1_000_000L;
    private final Clock clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);

    private TurnStateMachine machine(boolean unbeatable) {
        return new TurnStateMachine((play, state, seat) -> unbeatable, clock, 10_000L, 101);
    }

    @Test
    void newGameLetsThreeOfDiamondsHolderLead() {
        BigTwoState s = machine(false).newGame("r1", dealBySuit(), Set.of(2));

        assertThat(s.getCurrentTurn()).isZero();
        assertThat(s.getPhase()).isEqualTo(GamePhase.FIRST_PLAY);
        assertThat(s.getMatchNumber()).isEqualTo(1);
        assertThat(s.getBotSeats()).containsExactly(2);
        assertThat(TurnStateMachine.isDeckConserved(s)).isTrue();
    }

    @Test
    void playMovesCardsAndAdvancesTurn() {
        TurnStateMachine m = machine(false);
        BigTwoState s = m.newGame("r1", dealBySuit(), Set.of());

        assertThat(m.play(s, 0, cards("3D"))).isEmpty();

        assertThat(s.getPhase()).isEqualTo(GamePhase.PLAYING);
        assertThat(s.getCurrentTurn()).isEqualTo(1);
        assertThat(s.hand(0)).hasSize(12).doesNotContain(Card.THREE_OF_DIAMONDS);
        assertThat(s.getPlayedPile()).containsExactly(Card.THREE_OF_DIAMONDS);
        assertThat(s.getVersion()).isEqualTo(2);
        assertThat(s.getTimer()).isEqualTo(TimerState.NONE);
        assertThat(TurnStateMachine.isDeckConserved(s)).isTrue();
    }

    @Test
    void rejectedPlayLeavesStateUntouched() {
        TurnStateMachine m = machine(false);
        BigTwoState s = m.newGame("r1", dealBySuit(), Set.of());

        Optional<RuleViolation> v = m.play(s, 0, cards("4D"));

        assertThat(v.map(RuleViolation::kind)).contains(ErrorKind.MISSING_REQUIRED_CARD);
        assertThat(s.hand(0)).hasSize(13);
        assertThat(s.getVersion()).isEqualTo(1);
    }

    @Test
    void threePassesClearTheTrick() {
        TurnStateMachine m = machine(false);
        BigTwoState s = m.newGame("r1", dealBySuit(), Set.of());
        m.play(s, 0, cards("3D"));

        assertThat(m.pass(s, 1, PassOrigin.PLAYER)).isEmpty();
        assertThat(m.pass(s, 2, PassOrigin.PLAYER)).isEmpty();
        assertThat(s.getConsecutivePasses()).isEqualTo(2);
        assertThat(m.pass(s, 3, PassOrigin.PLAYER)).isEmpty();

        assertThat(s.getLastPlay()).isNull();
        assertThat(s.getConsecutivePasses()).isZero();
        assertThat(s.getCurrentTurn()).isZero();
        assertThat(m.pass(s, 0, PassOrigin.PLAYER).map(RuleViolation::kind)).contains(ErrorKind.CANNOT_PASS_WHILE_LEADING);
    }

    @Test
    void unbeatablePlayStartsTimerAndPassesKeepIt() {
        TurnStateMachine m = machine(true);
        BigTwoState s = m.newGame("r1", dealBySuit(), Set.of());
        m.play(s, 0, cards("3D"));

        TimerState.Active t = (TimerState.Active) s.getTimer();
        assertThat(t.exemptSeat()).isZero();
        assertThat(t.sequenceId()).isEqualTo(1);
        assertThat(t.serverTimeAtCreation()).isEqualTo(NOW);
        assertThat(t.endTimestamp()).isEqualTo(NOW + 10_000L);

        m.pass(s, 1, PassOrigin.AUTO_PASS);
        assertThat(s.getTimer()).isSameAs(t);
        m.pass(s, 2, PassOrigin.PLAYER);
        m.pass(s, 3, PassOrigin.AUTO_PASS);

        assertThat(s.getTimer()).isEqualTo(TimerState.NONE);
        assertThat(s.getCurrentTurn()).isEqualTo(t.exemptSeat());
        assertThat(s.getLastTimerSequence()).isEqualTo(1);
    }

    @Test
    void everyPlayReplacesTheTimer() {
        // 只有座位 0 的出牌算“无人能压”
        TurnStateMachine m = new TurnStateMachine((play, state, seat) -> seat == 0, clock, 10_000L, 101);
        BigTwoState s = m.newGame("r1", dealBySuit(), Set.of());
        m.play(s, 0, cards("3D"));
        assertThat(s.getTimer().isActive()).isTrue();

        m.play(s, 1, cards("4C"));

        assertThat(s.getTimer()).isEqualTo(TimerState.NONE);
        assertThat(s.getLastTimerSequence()).isEqualTo(1);

        m.pass(s, 2, PassOrigin.PLAYER);
        m.pass(s, 3, PassOrigin.PLAYER);
        m.play(s, 0, cards("5D"));
        assertThat(((TimerState.Active) s.getTimer()).sequenceId()).isEqualTo(2);
    }

    @Test
    void emptyingHandFinishesMatchAndScores() {
        TurnStateMachine m = machine(true);
        List<Card> rest = new ArrayList<>(Card.fullDeck());
        rest.remove(Card.parse("2S"));
        BigTwoState s = playing(0, cards("2S"), rest.subList(0, 3), rest.subList(3, 10), rest.subList(10, 22));
        s.setTotals(new ArrayList<>(List.of(10, 10, 10, 10)));

        assertThat(m.play(s, 0, cards("2S"))).isEmpty();

        assertThat(s.getPhase()).isEqualTo(GamePhase.FINISHED);
        assertThat(s.getLastMatch().winnerSeat()).isZero();
        assertThat(s.getLastMatch().deltas()).containsExactly(0, 3, 14, 36);
        assertThat(s.getTotals()).containsExactly(10, 13, 24, 46);
        assertThat(s.getTimer()).isEqualTo(TimerState.NONE);
        assertThat(m.play(s, 1, cards(rest.get(0).code())).map(RuleViolation::kind))
                .contains(ErrorKind.GAME_NOT_IN_PROGRESS);
    }

    @Test
    void crossingThresholdEndsTheGame() {
        TurnStateMachine m = machine(false);
        List<Card> rest = new ArrayList<>(Card.fullDeck());
        rest.remove(Card.parse("2S"));
        BigTwoState s = playing(0, cards("2S"), rest.subList(0, 3), rest.subList(3, 10), rest.subList(10, 22));
        s.setTotals(new ArrayList<>(List.of(90, 60, 40, 70)));

        m.play(s, 0, cards("2S"));

        assertThat(s.getPhase()).isEqualTo(GamePhase.GAME_OVER);
        assertThat(s.getTotals()).containsExactly(90, 63, 54, 106);
        assertThat(s.getFinalWinner()).isEqualTo(2);
        assertThat(m.startNextMatch(s, dealBySuit()).map(RuleViolation::kind)).contains(ErrorKind.GAME_NOT_IN_PROGRESS);
    }

    @Test
    void nextMatchIsLedByPreviousWinnerWithoutThreeOfDiamonds() {
        TurnStateMachine m = machine(false);
        List<Card> rest = new ArrayList<>(Card.fullDeck());
        rest.remove(Card.parse("2C"));
        BigTwoState s = playing(1, rest.subList(0, 5), cards("2C"), rest.subList(5, 10), rest.subList(10, 15));
        m.play(s, 1, cards("2C"));
        assertThat(s.getPhase()).isEqualTo(GamePhase.FINISHED);

        assertThat(m.startNextMatch(s, dealBySuit())).isEmpty();

        assertThat(s.getMatchNumber()).isEqualTo(2);
        assertThat(s.getPhase()).isEqualTo(GamePhase.PLAYING);
        assertThat(s.getCurrentTurn()).isEqualTo(1);
        assertThat(s.getPlayedPile()).isEmpty();
        assertThat(TurnStateMachine.isDeckConserved(s)).isTrue();
        assertThat(m.play(s, 1, cards("4C"))).isEmpty();
    }

    @Test
    void nextMatchRejectedWhileMatchInProgress() {
        TurnStateMachine m = machine(false);
        BigTwoState s = m.newGame("r1", dealBySuit(), Set.of());

        assertThat(m.startNextMatch(s, dealBySuit()).map(RuleViolation::kind)).contains(ErrorKind.GAME_NOT_IN_PROGRESS);
    }
}
