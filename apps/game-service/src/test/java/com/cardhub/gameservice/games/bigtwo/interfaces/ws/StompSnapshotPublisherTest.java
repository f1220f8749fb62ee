package com.cardhub.gameservice.games.bigtwo.interfaces.ws;

import com.cardhub.gameservice.games.bigtwo.domain.enums.ErrorKind;
import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoSnapshot;
import com.cardhub.gameservice.games.bigtwo.domain.model.RuleViolation;
import com.cardhub.gameservice.platform.transport.Envelope;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static com.cardhub.gameservice.games.bigtwo.TestCards.cards;
import static com.cardhub.gameservice.games.bigtwo.TestCards.playing;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class StompSnapshotPublisherTest {

    private final SimpMessagingTemplate messaging = mock(SimpMessagingTemplate.class);
    private final StompSnapshotPublisher publisher =
            new StompSnapshotPublisher(messaging, Clock.fixed(Instant.ofEpochMilli(42), ZoneOffset.UTC));

    private Envelope<?> sent() {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(messaging).convertAndSend(eq("/topic/room.r1"), captor.capture());
        return (Envelope<?>) captor.getValue();
    }

    @Test
    void stateCarriesVersionAsSeq() {
        BigTwoSnapshot snap = BigTwoSnapshot.of(playing(0, cards("3D"), cards("4D"), cards("5D"), cards("6D")));

        publisher.publishState(snap);

        Envelope<?> e = sent();
        assertThat(e.getKind()).isEqualTo(Envelope.Kind.STATE);
        assertThat(e.getGame()).isEqualTo("bigtwo");
        assertThat(e.getSeq()).isEqualTo(1);
        assertThat(e.getTs()).isEqualTo(42);
        assertThat(e.getPayload()).isSameAs(snap);
    }

    @Test
    void eventPayloadIsTagged() {
        publisher.publishEvent("r1", "AUTO_PASSED", Map.of("seat", 2), 9);

        Envelope<?> e = sent();
        assertThat(e.getKind()).isEqualTo(Envelope.Kind.EVENT);
        assertThat(e.getPayload()).asInstanceOf(InstanceOfAssertFactories.MAP)
                .containsEntry("type", "AUTO_PASSED")
                .containsEntry("seat", 2);
    }

    @Test
    void errorCarriesViolation() {
        RuleViolation v = RuleViolation.of(ErrorKind.NOT_YOUR_TURN, "no");

        publisher.publishError("r1", v);

        assertThat(sent().getPayload()).isEqualTo(v);
    }
}
