package com.cardhub.gameservice.games.bigtwo.service.impl;

import com.cardhub.gameservice.common.RoomNotFoundException;
import com.cardhub.gameservice.games.bigtwo.application.AutoPassCascade;
import com.cardhub.gameservice.games.bigtwo.application.AutoPassTimerCoordinator;
import com.cardhub.gameservice.games.bigtwo.application.BotTurnRunner;
import com.cardhub.gameservice.games.bigtwo.application.SnapshotPublisher;
import com.cardhub.gameservice.games.bigtwo.domain.constants.GameMessages;
import com.cardhub.gameservice.games.bigtwo.domain.dto.GameStateRecordConverter;
import com.cardhub.gameservice.games.bigtwo.domain.engine.Dealer;
import com.cardhub.gameservice.games.bigtwo.domain.engine.TurnStateMachine;
import com.cardhub.gameservice.games.bigtwo.domain.enums.ErrorKind;
import com.cardhub.gameservice.games.bigtwo.domain.enums.GamePhase;
import com.cardhub.gameservice.games.bigtwo.domain.enums.PassOrigin;
import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoSnapshot;
import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoState;
import com.cardhub.gameservice.games.bigtwo.domain.model.Card;
import com.cardhub.gameservice.games.bigtwo.domain.model.MoveResult;
import com.cardhub.gameservice.games.bigtwo.domain.model.RuleViolation;
import com.cardhub.gameservice.games.bigtwo.domain.model.TimerState;
import com.cardhub.gameservice.games.bigtwo.domain.repository.GameStateRepository;
import com.cardhub.gameservice.games.bigtwo.domain.repository.RoomLockManager;
import com.cardhub.gameservice.games.bigtwo.service.BigTwoService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * 锄大地房间服务实现。
 * - 内存房间表 + 存储（Redis / 本地）写穿；内存未命中时从存储加载；
 * - 每次迁移：非阻塞抢房间锁 → 复制状态 → 状态机迁移 → 按版本号 CAS 持久化 → 整体替换；
 * - CAS 失败说明其它节点先提交：丢弃本地缓存，返回 ROOM_LOCK_CONFLICT，下次调用重新加载；
 * - 提交后（仍持锁）广播快照、同步自动过牌倒计时；锁外调度机器人与下一局发牌。
 */
@Slf4j
@Service
public class BigTwoServiceImpl implements BigTwoService {

    private static final Duration ROOM_TTL = Duration.ofHours(48);

    // ====== 内存房间表 ======
    private final Map<String, BigTwoState> rooms = new ConcurrentHashMap<>();
    // 正在执行连锁过牌的房间
    private final Set<String> cascading = ConcurrentHashMap.newKeySet();

    private final GameStateRepository gameRepo;
    private final RoomLockManager lockManager;
    private final TurnStateMachine stateMachine;
    private final Dealer dealer;
    private final AutoPassCascade cascade;
    private final SnapshotPublisher publisher;
    private final Clock clock;
    private final ScheduledExecutorService botScheduler;

    private ObjectProvider<AutoPassTimerCoordinator> coordinatorProvider;
    private ObjectProvider<BotTurnRunner> botRunnerProvider;

    /** 本局结束到自动发下一局的延迟；小于 0 表示不自动发 */
    @Value("${bigtwo.match.next-delay-ms:3000}")
    private long nextMatchDelayMs;

    public BigTwoServiceImpl(GameStateRepository gameRepo,
                             RoomLockManager lockManager,
                             TurnStateMachine stateMachine,
                             Dealer dealer,
                             AutoPassCascade cascade,
                             SnapshotPublisher publisher,
                             Clock clock,
                             @Qualifier("botScheduler") ScheduledExecutorService botScheduler) {
        this.gameRepo = gameRepo;
        this.lockManager = lockManager;
        this.stateMachine = stateMachine;
        this.dealer = dealer;
        this.cascade = cascade;
        this.publisher = publisher;
        this.clock = clock;
        this.botScheduler = botScheduler;
    }

    @Autowired
    public void setCoordinatorProvider(ObjectProvider<AutoPassTimerCoordinator> coordinatorProvider) {
        this.coordinatorProvider = coordinatorProvider;
    }

    @Autowired
    public void setBotRunnerProvider(ObjectProvider<BotTurnRunner> botRunnerProvider) {
        this.botRunnerProvider = botRunnerProvider;
    }

    @Override
    public MoveResult startGame(String roomId, Set<Integer> botSeats) {
        for (Integer seat : botSeats) checkSeat(seat);
        Optional<RoomLockManager.Handle> lock = lockManager.tryLock(roomId);
        if (lock.isEmpty()) return lockConflict(roomId, "startGame");

        BigTwoState before;
        BigTwoState next;
        try (RoomLockManager.Handle ignored = lock.get()) {
            before = rooms.get(roomId);
            if (before == null) before = gameRepo.get(roomId).map(GameStateRecordConverter::fromRecord).orElse(null);
            if (before != null && before.getPhase() != GamePhase.GAME_OVER) {
                throw new IllegalStateException("房间已有进行中的对局: " + roomId);
            }
            next = stateMachine.newGame(roomId, dealer.deal(), botSeats);
            if (before != null) {
                next.setVersion(before.getVersion() + 1);
                next.setLastTimerSequence(before.getLastTimerSequence());
            }
            gameRepo.save(roomId, GameStateRecordConverter.toRecord(next), ROOM_TTL);
            rooms.put(roomId, next);
            log.info("开局: room={}, leader={}, bots={}", roomId, next.getCurrentTurn(), botSeats);
            publisher.publishEvent(roomId, "GAME_STARTED", Map.of("message", GameMessages.GAME_STARTED), next.getVersion());
            onCommitted(before, next);
        }
        afterUnlock(before, next);
        return MoveResult.ok(BigTwoSnapshot.of(next));
    }

    @Override
    public MoveResult play(String roomId, int seat, List<Card> cards) {
        checkSeat(seat);
        return mutate(roomId, "play", s -> stateMachine.play(s, seat, cards));
    }

    @Override
    public MoveResult pass(String roomId, int seat) {
        return pass(roomId, seat, PassOrigin.PLAYER);
    }

    @Override
    public MoveResult pass(String roomId, int seat, PassOrigin origin) {
        checkSeat(seat);
        MoveResult r = mutate(roomId, "pass", s -> stateMachine.pass(s, seat, origin));
        if (r.ok() && origin == PassOrigin.AUTO_PASS) {
            publisher.publishEvent(roomId, "AUTO_PASSED",
                    Map.of("seat", seat, "message", GameMessages.formatAutoPassed(seat)), r.snapshot().version());
        }
        return r;
    }

    @Override
    public MoveResult startNextMatch(String roomId) {
        return mutate(roomId, "startNextMatch", s -> stateMachine.startNextMatch(s, dealer.deal()));
    }

    @Override
    public BigTwoSnapshot getState(String roomId) {
        return BigTwoSnapshot.of(room(roomId));
    }

    @Override
    public List<Card> getHand(String roomId, int seat) {
        checkSeat(seat);
        return List.copyOf(room(roomId).hand(seat));
    }

    @Override
    public void onTimerExpired(String roomId) {
        BigTwoState s = room(roomId);
        if (!(s.getTimer() instanceof TimerState.Active t)) {
            log.debug("计时器已不存在，忽略到期: room={}", roomId);
            return;
        }
        long now = clock.millis();
        if (now < t.endTimestamp()) {
            log.debug("计时器尚未到期，忽略: room={}, seq={}, remainMs={}", roomId, t.sequenceId(), t.endTimestamp() - now);
            return;
        }
        if (!cascading.add(roomId)) {
            log.info("连锁过牌已在执行，忽略重复到期: room={}, seq={}", roomId, t.sequenceId());
            return;
        }
        try {
            cascade.run(roomId, () -> getState(roomId), seat -> pass(roomId, seat, PassOrigin.AUTO_PASS));
        } finally {
            cascading.remove(roomId);
        }
    }

    @Override
    public long nowMs() {
        return clock.millis();
    }

    // ====== 内部 ======

    /**
     * 一次状态迁移的通用流程。
     * @param op 在复制出的状态上执行迁移，失败返回 RuleViolation
     */
    private MoveResult mutate(String roomId, String action, Function<BigTwoState, Optional<RuleViolation>> op) {
        Optional<RoomLockManager.Handle> lock = lockManager.tryLock(roomId);
        if (lock.isEmpty()) return lockConflict(roomId, action);

        BigTwoState before;
        BigTwoState next;
        try (RoomLockManager.Handle ignored = lock.get()) {
            before = room(roomId);
            next = before.copy();
            Optional<RuleViolation> violation = op.apply(next);
            if (violation.isPresent()) {
                log.debug("{} 被拒: room={}, kind={}, msg={}", action, roomId, violation.get().kind(), violation.get().message());
                return MoveResult.rejected(violation.get());
            }
            if (!gameRepo.compareAndSet(roomId, before.getVersion(), GameStateRecordConverter.toRecord(next), ROOM_TTL)) {
                rooms.remove(roomId);
                log.warn("{} 持久化版本冲突，丢弃本地缓存: room={}, expectedVersion={}", action, roomId, before.getVersion());
                return MoveResult.rejected(RuleViolation.of(ErrorKind.ROOM_LOCK_CONFLICT, GameMessages.ROOM_LOCK_CONFLICT));
            }
            rooms.put(roomId, next);
            onCommitted(before, next);
        }
        afterUnlock(before, next);
        return MoveResult.ok(BigTwoSnapshot.of(next));
    }

    /** 持锁期间：广播快照、同步倒计时 */
    private void onCommitted(BigTwoState before, BigTwoState next) {
        publisher.publishState(BigTwoSnapshot.of(next));
        if (next.getPhase() != (before == null ? null : before.getPhase())) {
            if (next.getPhase() == GamePhase.FINISHED || next.getPhase() == GamePhase.GAME_OVER) {
                int winner = next.getLastMatch().winnerSeat();
                publisher.publishEvent(next.getRoomId(), "MATCH_FINISHED",
                        Map.of("matchNumber", next.getLastMatch().matchNumber(), "winnerSeat", winner,
                                "deltas", next.getLastMatch().deltas(), "totals", next.getTotals(),
                                "message", GameMessages.formatMatchFinished(next.getLastMatch().matchNumber(), winner)),
                        next.getVersion());
            }
            if (next.getPhase() == GamePhase.GAME_OVER) {
                publisher.publishEvent(next.getRoomId(), "GAME_OVER",
                        Map.of("winnerSeat", next.getFinalWinner(), "totals", next.getTotals(),
                                "message", GameMessages.formatGameOver(next.getFinalWinner())),
                        next.getVersion());
            }
            if (before != null && before.getPhase() == GamePhase.FINISHED && next.getPhase() == GamePhase.PLAYING) {
                publisher.publishEvent(next.getRoomId(), "MATCH_STARTED",
                        Map.of("matchNumber", next.getMatchNumber(), "leader", next.getCurrentTurn(),
                                "message", GameMessages.formatMatchStarted(next.getMatchNumber())),
                        next.getVersion());
            }
        }
        AutoPassTimerCoordinator coordinator = coordinatorProvider == null ? null : coordinatorProvider.getIfAvailable();
        if (coordinator != null) coordinator.syncFromState(next);
    }

    /** 锁外：调度机器人行动与下一局发牌 */
    private void afterUnlock(BigTwoState before, BigTwoState next) {
        BotTurnRunner runner = botRunnerProvider == null ? null : botRunnerProvider.getIfAvailable();
        if (runner != null) runner.maybeSchedule(BigTwoSnapshot.of(next));

        boolean justFinished = next.getPhase() == GamePhase.FINISHED
                && (before == null || before.getPhase() != GamePhase.FINISHED);
        if (justFinished && nextMatchDelayMs >= 0) {
            String roomId = next.getRoomId();
            botScheduler.schedule(() -> autoStartNextMatch(roomId), nextMatchDelayMs, TimeUnit.MILLISECONDS);
        }
    }

    private void autoStartNextMatch(String roomId) {
        try {
            MoveResult r = startNextMatch(roomId);
            if (!r.ok() && r.violation().kind().isRetryable()) {
                botScheduler.schedule(() -> autoStartNextMatch(roomId), 100, TimeUnit.MILLISECONDS);
            } else if (!r.ok()) {
                log.info("自动发下一局跳过: room={}, kind={}", roomId, r.violation().kind());
            }
        } catch (RuntimeException e) {
            log.error("自动发下一局失败: room={}", roomId, e);
        }
    }

    /** 获取房间（内存优先，未命中则从存储加载） */
    private BigTwoState room(String roomId) {
        BigTwoState cached = rooms.get(roomId);
        if (cached != null) return cached;
        BigTwoState loaded = gameRepo.get(roomId)
                .map(GameStateRecordConverter::fromRecord)
                .orElseThrow(() -> new RoomNotFoundException(roomId));
        BigTwoState prev = rooms.putIfAbsent(roomId, loaded);
        return prev != null ? prev : loaded;
    }

    private MoveResult lockConflict(String roomId, String action) {
        log.debug("{} 抢房间锁失败: room={}", action, roomId);
        return MoveResult.rejected(RuleViolation.of(ErrorKind.ROOM_LOCK_CONFLICT, GameMessages.ROOM_LOCK_CONFLICT));
    }

    private static void checkSeat(Integer seat) {
        if (seat == null || seat < 0 || seat >= BigTwoState.SEATS) {
            throw new IllegalArgumentException("座位号非法: " + seat);
        }
    }
}
