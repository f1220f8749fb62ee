package com.cardhub.gameservice.games.bigtwo.interfaces.ws;

import com.cardhub.gameservice.common.RoomNotFoundException;
import com.cardhub.gameservice.games.bigtwo.application.SnapshotPublisher;
import com.cardhub.gameservice.games.bigtwo.domain.enums.ErrorKind;
import com.cardhub.gameservice.games.bigtwo.domain.model.Card;
import com.cardhub.gameservice.games.bigtwo.domain.model.MoveResult;
import com.cardhub.gameservice.games.bigtwo.domain.model.RuleViolation;
import com.cardhub.gameservice.games.bigtwo.interfaces.ws.dto.BigTwoMessages.PlayCmd;
import com.cardhub.gameservice.games.bigtwo.interfaces.ws.dto.BigTwoMessages.SimpleCmd;
import com.cardhub.gameservice.games.bigtwo.interfaces.ws.dto.BigTwoMessages.StartCmd;
import com.cardhub.gameservice.games.bigtwo.service.BigTwoService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.stereotype.Controller;

import java.util.HashSet;
import java.util.List;
import java.util.function.Supplier;

/**
 * 锄大地 WebSocket 控制器
 * ----------------------------------------
 * 接收前端通过 STOMP 发送的指令（/app/bigtwo.*）。
 * 成功后的状态广播由服务层统一完成；这里只负责把失败以 ERROR 消息推回房间。
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class BigTwoWsController {

    private final BigTwoService bigTwoService;
    private final SnapshotPublisher publisher;

    @MessageMapping("/bigtwo.start")
    public void start(StartCmd cmd) {
        List<Integer> bots = ObjectUtils.defaultIfNull(cmd.getBotSeats(), List.of());
        handle(cmd.getRoomId(), () -> bigTwoService.startGame(cmd.getRoomId(), new HashSet<>(bots)));
    }

    @MessageMapping("/bigtwo.play")
    public void play(PlayCmd cmd) {
        handle(cmd.getRoomId(), () -> bigTwoService.play(cmd.getRoomId(), cmd.getSeat(), Card.parseAll(cmd.getCards())));
    }

    @MessageMapping("/bigtwo.pass")
    public void pass(SimpleCmd cmd) {
        handle(cmd.getRoomId(), () -> bigTwoService.pass(cmd.getRoomId(), cmd.getSeat()));
    }

    @MessageMapping("/bigtwo.next")
    public void next(SimpleCmd cmd) {
        handle(cmd.getRoomId(), () -> bigTwoService.startNextMatch(cmd.getRoomId()));
    }

    /** 任意观察者在本地看到倒计时归零时上报；服务端以权威时钟判断，重复上报无副作用 */
    @MessageMapping("/bigtwo.expire")
    public void expire(SimpleCmd cmd) {
        if (StringUtils.isBlank(cmd.getRoomId())) return;
        try {
            bigTwoService.onTimerExpired(cmd.getRoomId());
        } catch (RoomNotFoundException e) {
            log.debug("到期上报的房间不存在: {}", cmd.getRoomId());
        }
    }

    private void handle(String roomId, Supplier<MoveResult> action) {
        if (StringUtils.isBlank(roomId)) {
            log.debug("忽略缺少 roomId 的指令");
            return;
        }
        try {
            MoveResult r = action.get();
            if (!r.ok()) publisher.publishError(roomId, r.violation());
        } catch (IllegalArgumentException e) {
            publisher.publishError(roomId, RuleViolation.of(ErrorKind.INVALID_COMBO, e.getMessage()));
        } catch (RoomNotFoundException | IllegalStateException e) {
            publisher.publishError(roomId, RuleViolation.of(ErrorKind.GAME_NOT_IN_PROGRESS, e.getMessage()));
        }
    }
}
