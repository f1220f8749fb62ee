package com.cardhub.gameservice.games.bigtwo.application;

import com.cardhub.gameservice.games.bigtwo.domain.bot.LowestBeatingPlayStrategy;
import com.cardhub.gameservice.games.bigtwo.domain.enums.ErrorKind;
import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoSnapshot;
import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoState;
import com.cardhub.gameservice.games.bigtwo.domain.model.MoveResult;
import com.cardhub.gameservice.games.bigtwo.domain.model.RuleViolation;
import com.cardhub.gameservice.games.bigtwo.service.BigTwoService;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static com.cardhub.gameservice.games.bigtwo.TestCards.cards;
import static com.cardhub.gameservice.games.bigtwo.TestCards.played;
import static com.cardhub.gameservice.games.bigtwo.TestCards.playing;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BotTurnRunnerTest {

    private final BigTwoService service = mock(BigTwoService.class);
    private final ScheduledExecutorService executor = mock(ScheduledExecutorService.class);
    private final BotTurnRunner runner = new BotTurnRunner(service, new LowestBeatingPlayStrategy(), executor);

    private static BigTwoState botToAct() {
        BigTwoState s = playing(2, cards("4D"), cards("5D", "5C"), cards("6D", "9H", "KS"), cards("7D", "7C"));
        s.setBotSeats(new LinkedHashSet<>(List.of(2)));
        return s;
    }

    @Test
    void schedulesOnlyForBotSeats() {
        BigTwoState human = botToAct();
        human.setCurrentTurn(1);
        runner.maybeSchedule(BigTwoSnapshot.of(human));
        verify(executor, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));

        runner.maybeSchedule(BigTwoSnapshot.of(botToAct()));
        verify(executor).schedule(any(Runnable.class), anyLong(), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void leadsWithLowestSingle() {
        BigTwoState s = botToAct();
        when(service.getState("r1")).thenReturn(BigTwoSnapshot.of(s));
        when(service.getHand("r1", 2)).thenReturn(s.hand(2));
        when(service.play(anyString(), anyInt(), anyList())).thenReturn(MoveResult.ok(BigTwoSnapshot.of(s)));

        runner.act("r1", 1);

        verify(service).play("r1", 2, cards("6D"));
    }

    @Test
    void staleVersionIsSkipped() {
        when(service.getState("r1")).thenReturn(BigTwoSnapshot.of(botToAct()));

        runner.act("r1", 7);

        verify(service, never()).getHand(anyString(), anyInt());
    }

    @Test
    void rejectedFollowFallsBackToPass() {
        BigTwoState s = botToAct();
        s.setLastPlay(played(1, "8S"));
        when(service.getState("r1")).thenReturn(BigTwoSnapshot.of(s));
        when(service.getHand("r1", 2)).thenReturn(s.hand(2));
        when(service.play(anyString(), anyInt(), anyList()))
                .thenReturn(MoveResult.rejected(RuleViolation.of(ErrorKind.ROOM_LOCK_CONFLICT, "busy")));
        when(service.pass("r1", 2)).thenReturn(MoveResult.ok(BigTwoSnapshot.of(s)));

        runner.act("r1", 1);

        verify(service).play("r1", 2, cards("9H"));
        verify(service).pass("r1", 2);
    }
}
