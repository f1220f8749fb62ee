package com.cardhub.gameservice.games.bigtwo.application;

import com.cardhub.gameservice.games.bigtwo.domain.enums.ErrorKind;
import com.cardhub.gameservice.games.bigtwo.domain.model.RuleViolation;
import com.cardhub.gameservice.games.bigtwo.domain.model.TimerState;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static com.cardhub.gameservice.games.bigtwo.TestCards.combo;
import static org.assertj.core.api.Assertions.assertThat;

class TimerCountdownTrackerTest {

    private final AtomicLong local = new AtomicLong();
    private final TimerCountdownTracker tracker = new TimerCountdownTracker(local::get);

    private static TimerState.Active timer(long seq, long createdAt) {
        return new TimerState.Active(0, createdAt + 10_000L, createdAt, 10_000L, seq, combo("2S"));
    }

    @Test
    void offsetComputedOnceAndCountdownRunsOnLocalClock() {
        local.set(500);
        tracker.onTimer(timer(1, 1_000));

        assertThat(tracker.offsetMs()).isEqualTo(500);
        assertThat(tracker.remainingMs()).isEqualTo(10_000);

        local.set(5_500);
        assertThat(tracker.remainingMs()).isEqualTo(5_000);
        assertThat(tracker.isExpired()).isFalse();

        // 同一序号的重复通知不会重新计算偏移
        tracker.onTimer(timer(1, 1_000));
        assertThat(tracker.offsetMs()).isEqualTo(500);

        local.set(10_500);
        assertThat(tracker.isExpired()).isTrue();
        assertThat(tracker.remainingMs()).isZero();
    }

    @Test
    void olderSequenceIsRejected() {
        tracker.onTimer(timer(3, 0));

        assertThat(tracker.onTimer(timer(2, 0)).map(RuleViolation::kind)).contains(ErrorKind.STALE_TIMER_SEQUENCE);
        assertThat(tracker.newestSequence()).isEqualTo(3);
        assertThat(tracker.current().orElseThrow().sequenceId()).isEqualTo(3);
    }

    @Test
    void newerSequenceResetsOffset() {
        local.set(0);
        tracker.onTimer(timer(1, 100));
        local.set(2_000);
        tracker.onTimer(timer(2, 1_900));

        assertThat(tracker.offsetMs()).isEqualTo(-100);
    }

    @Test
    void clearedTimerHasNothingLeft() {
        tracker.onTimer(timer(1, 0));
        tracker.onCleared();

        assertThat(tracker.current()).isEmpty();
        assertThat(tracker.remainingMs()).isZero();
        assertThat(tracker.isExpired()).isFalse();
    }
}
