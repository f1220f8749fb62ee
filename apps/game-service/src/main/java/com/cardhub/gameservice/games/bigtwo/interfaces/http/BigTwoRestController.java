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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * 锄大地 http 接口。
 * 规则校验失败返回 400（报单规则会在 data 中给出必须打出的牌），房间锁冲突返回 409。
 */
@Slf4j
@RestController
@RequestMapping("/api/bigtwo")
@RequiredArgsConstructor
public class BigTwoRestController {

    private final BigTwoService svc;

    @PostMapping("/rooms/{roomId}/start")
    public ResponseEntity<ApiResponse<Object>> start(@PathVariable("roomId") String roomId,
                                                     @RequestBody(required = false) StartRequest req) {
        List<Integer> bots = req == null ? List.of() : ObjectUtils.defaultIfNull(req.getBotSeats(), List.of());
        return toResponse(svc.startGame(roomId, new HashSet<>(bots)));
    }

    @PostMapping("/rooms/{roomId}/play")
    public ResponseEntity<ApiResponse<Object>> play(@PathVariable("roomId") String roomId,
                                                    @RequestBody PlayRequest req) {
        return toResponse(svc.play(roomId, req.getSeat(), Card.parseAll(req.getCards())));
    }

    @PostMapping("/rooms/{roomId}/pass")
    public ResponseEntity<ApiResponse<Object>> pass(@PathVariable("roomId") String roomId,
                                                    @RequestBody SeatRequest req) {
        return toResponse(svc.pass(roomId, req.getSeat()));
    }

    @PostMapping("/rooms/{roomId}/next")
    public ResponseEntity<ApiResponse<Object>> next(@PathVariable("roomId") String roomId) {
        return toResponse(svc.startNextMatch(roomId));
    }

    /** 观察者上报倒计时归零（幂等） */
    @PostMapping("/rooms/{roomId}/timer/expire")
    public ResponseEntity<ApiResponse<BigTwoSnapshot>> expire(@PathVariable("roomId") String roomId) {
        svc.onTimerExpired(roomId);
        return ResponseEntity.ok(ApiResponse.success(svc.getState(roomId)));
    }

    @GetMapping("/rooms/{roomId}")
    public ResponseEntity<ApiResponse<BigTwoSnapshot>> state(@PathVariable("roomId") String roomId) {
        return ResponseEntity.ok(ApiResponse.success(svc.getState(roomId)));
    }

    @GetMapping("/rooms/{roomId}/hand")
    public ResponseEntity<ApiResponse<List<Card>>> hand(@PathVariable("roomId") String roomId,
                                                        @RequestParam("seat") int seat) {
        return ResponseEntity.ok(ApiResponse.success(svc.getHand(roomId, seat)));
    }

    /** 权威时钟，客户端据此校准 */
    @GetMapping("/server-time")
    public ResponseEntity<ApiResponse<Map<String, Long>>> serverTime() {
        return ResponseEntity.ok(ApiResponse.success(Map.of("now", svc.nowMs())));
    }

    private static ResponseEntity<ApiResponse<Object>> toResponse(MoveResult r) {
        if (r.ok()) return ResponseEntity.ok(ApiResponse.success(r.snapshot()));
        RuleViolation v = r.violation();
        HttpStatus status = v.kind() == ErrorKind.ROOM_LOCK_CONFLICT ? HttpStatus.CONFLICT : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status)
                .body(ApiResponse.error(status.value(), v.kind().name(), v.message(), v.requiredCard()));
    }
}
