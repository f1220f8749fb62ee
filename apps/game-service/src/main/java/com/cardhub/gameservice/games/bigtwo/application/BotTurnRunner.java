package com.cardhub.gameservice.games.bigtwo.application;

import com.cardhub.gameservice.games.bigtwo.domain.bot.BotAction;
import com.cardhub.gameservice.games.bigtwo.domain.bot.BotStrategy;
import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoSnapshot;
import com.cardhub.gameservice.games.bigtwo.domain.model.Card;
import com.cardhub.gameservice.games.bigtwo.domain.model.MoveResult;
import com.cardhub.gameservice.games.bigtwo.service.BigTwoService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 机器人代打：轮到机器人座位时，延迟“思考时间”后替它出牌或过牌。
 * 执行前再次确认状态版本未变（期间有新的提交会重新调度），动作仍走服务层完整校验。
 */
@Slf4j
@Component
@Lazy
public class BotTurnRunner {

    private final BigTwoService bigTwoService;
    private final BotStrategy strategy;
    private final ScheduledExecutorService botScheduler;

    @Value("${bigtwo.bot.think-delay-ms:800}")
    private long thinkDelayMs;

    public BotTurnRunner(@Lazy BigTwoService bigTwoService,
                         BotStrategy strategy,
                         @Qualifier("botScheduler") ScheduledExecutorService botScheduler) {
        this.bigTwoService = bigTwoService;
        this.strategy = strategy;
        this.botScheduler = botScheduler;
    }

    /** 提交后调用：轮到机器人则调度一次行动 */
    public void maybeSchedule(BigTwoSnapshot snapshot) {
        if (!isBotTurn(snapshot)) return;
        botScheduler.schedule(() -> act(snapshot.roomId(), snapshot.version()), thinkDelayMs, TimeUnit.MILLISECONDS);
    }

    /**
     * 替机器人行动一次。
     * @param expectedVersion 调度时的状态版本；不一致说明已有新提交，放弃本次
     */
    void act(String roomId, long expectedVersion) {
        try {
            BigTwoSnapshot s = bigTwoService.getState(roomId);
            if (s.version() != expectedVersion || !isBotTurn(s)) return;
            int seat = s.currentTurn();
            List<Card> hand = bigTwoService.getHand(roomId, seat);
            BotAction action = strategy.chooseMove(seat, hand, s);

            MoveResult r = action.isPass()
                    ? bigTwoService.pass(roomId, seat)
                    : bigTwoService.play(roomId, seat, action.cards());
            if (!r.ok() && !action.isPass() && s.lastPlay() != null) {
                log.info("机器人出牌被拒，改为过牌: room={}, seat={}, kind={}", roomId, seat, r.violation().kind());
                r = bigTwoService.pass(roomId, seat);
            }
            if (!r.ok()) {
                log.warn("机器人行动失败: room={}, seat={}, kind={}", roomId, seat, r.violation().kind());
            }
        } catch (RuntimeException e) {
            log.error("机器人行动异常: room={}", roomId, e);
        }
    }

    private static boolean isBotTurn(BigTwoSnapshot s) {
        return s.inProgress() && s.botSeats().contains(s.currentTurn());
    }
}
