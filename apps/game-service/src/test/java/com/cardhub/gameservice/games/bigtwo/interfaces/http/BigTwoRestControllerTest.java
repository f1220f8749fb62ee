package com.cardhub.gameservice.games.bigtwo.interfaces.http;

import com.cardhub.gameservice.games.bigtwo.domain.enums.ErrorKind;
import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoSnapshot;
import com.cardhub.gameservice.games.bigtwo.domain.model.Card;
import com.cardhub.gameservice.games.bigtwo.domain.model.MoveResult;
import com.cardhub.gameservice.games.bigtwo.domain.model.RuleViolation;
import com.cardhub.gameservice.games.bigtwo.interfaces.http.dto.PlayRequest;
import com.cardhub.gameservice.games.bigtwo.interfaces.http.dto.SeatRequest;
import com.cardhub.gameservice.games.bigtwo.interfaces.http.dto.StartRequest;
import com.cardhub.gameservice.games.bigtwo.service.BigTwoService;
import com.cardhub.web.common.ApiResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Set;

import static com.cardhub.gameservice.games.bigtwo.TestCards.cards;
import static com.cardhub.gameservice.games.bigtwo.TestCards.playing;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class BigTwoRestControllerTest {

    private final BigTwoService service = mock(BigTwoService.class);
    private final BigTwoRestController controller = new BigTwoRestController(service);

    @Test
    void acceptedPlayReturnsSnapshot() {
        BigTwoSnapshot snap = BigTwoSnapshot.of(playing(1, cards("4D"), cards("5D"), cards("6D"), cards("7D")));
        when(service.play("r1", 0, cards("3D"))).thenReturn(MoveResult.ok(snap));
        PlayRequest req = new PlayRequest();
        req.setSeat(0);
        req.setCards(List.of("3D"));

        ResponseEntity<ApiResponse<Object>> res = controller.play("r1", req);

        assertThat(res.getStatusCode().value()).isEqualTo(200);
        assertThat(res.getBody().data()).isSameAs(snap);
    }

    @Test
    void oneCardLeftViolationIsBadRequestWithRequiredCard() {
        Card required = Card.parse("KH");
        when(service.play("r1", 0, cards("5D")))
                .thenReturn(MoveResult.rejected(new RuleViolation(ErrorKind.ONE_CARD_LEFT_VIOLATION, "must KH", required)));
        PlayRequest req = new PlayRequest();
        req.setCards(List.of("5D"));

        ResponseEntity<ApiResponse<Object>> res = controller.play("r1", req);

        assertThat(res.getStatusCode().value()).isEqualTo(400);
        assertThat(res.getBody().errorCode()).isEqualTo("ONE_CARD_LEFT_VIOLATION");
        assertThat(res.getBody().data()).isEqualTo(required);
    }

    @Test
    void lockConflictIsConflict() {
        when(service.pass("r1", 2))
                .thenReturn(MoveResult.rejected(RuleViolation.of(ErrorKind.ROOM_LOCK_CONFLICT, "busy")));
        SeatRequest req = new SeatRequest();
        req.setSeat(2);

        assertThat(controller.pass("r1", req).getStatusCode().value()).isEqualTo(409);
    }

    @Test
    void serverTimeComesFromService() {
        when(service.nowMs()).thenReturn(123L);

        assertThat(controller.serverTime().getBody().data()).containsEntry("now", 123L);
    }

    @Test
    void nullBotSeatsStartWithoutBots() {
        BigTwoSnapshot snap = BigTwoSnapshot.of(playing(0, cards("3D"), cards("5D"), cards("6D"), cards("7D")));
        when(service.startGame("r1", Set.of())).thenReturn(MoveResult.ok(snap));
        StartRequest req = new StartRequest();
        req.setBotSeats(null);

        assertThat(controller.start("r1", req).getStatusCode().value()).isEqualTo(200);
    }

    @Test
    void nullCardsAreRejectedBeforeReachingService() {
        PlayRequest req = new PlayRequest();
        req.setCards(null);

        // WebExceptionAdvice 将 IllegalArgumentException 映射为 400
        assertThatThrownBy(() -> controller.play("r1", req)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(service);
    }
}
