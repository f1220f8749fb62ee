package com.cardhub.gameservice.games.bigtwo.application;

import com.cardhub.gameservice.games.bigtwo.domain.enums.ErrorKind;
import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoSnapshot;
import com.cardhub.gameservice.games.bigtwo.domain.model.BigTwoState;
import com.cardhub.gameservice.games.bigtwo.domain.model.MoveResult;
import com.cardhub.gameservice.games.bigtwo.domain.model.TimerState;
import lombok.extern.slf4j.Slf4j;

import java.util.function.IntFunction;
import java.util.function.Supplier;

/**
 * AutoPassCascade
 * -------------------------------------------------
 * 自动过牌计时器到期后的“连锁过牌”。
 *
 * 流程：每一步都通过注入的实时读取器重新读取房间状态，再决定是否替当前座位过牌。
 * 停止条件（任一满足）：
 *  - 期望序号的计时器已不存在（被新出牌替换，或三家连过后清除）；
 *  - 上一手已清空（本轮结束）；
 *  - 回合已回到豁免座位；
 *  - 对局不在进行中。
 * 单步失败不终止整体：
 *  - NOT_YOUR_TURN 等拒绝（与玩家手动过牌竞争）记录后忽略，下一步重新读取；
 *  - ROOM_LOCK_CONFLICT 有限次重试（带退避）；
 *  - 同一版本上重复被拒则停止，避免空转。
 */
@Slf4j
public class AutoPassCascade {

    private final int lockRetries;
    private final long retryBackoffMs;

    public AutoPassCascade(int lockRetries, long retryBackoffMs) {
        this.lockRetries = lockRetries;
        this.retryBackoffMs = retryBackoffMs;
    }

    /**
     * @param roomId 房间ID（仅用于日志）
     * @param live   实时状态读取器（每一步调用一次）
     * @param pass   替指定座位执行一次自动过牌
     * @return 成功执行的自动过牌次数
     */
    public int run(String roomId, Supplier<BigTwoSnapshot> live, IntFunction<MoveResult> pass) {
        BigTwoSnapshot first = live.get();
        TimerState.Active timer = first.autoPassTimer();
        if (timer == null) return 0;
        long sequence = timer.sequenceId();
        int exempt = timer.exemptSeat();
        log.info("自动过牌开始: room={}, seq={}, exempt={}", roomId, sequence, exempt);

        int passes = 0;
        int conflicts = 0;
        long rejectedAtVersion = -1;
        // 最多三家需要过牌，额外步数留给重试与竞争
        int maxSteps = (BigTwoState.SEATS - 1) * 2 + lockRetries;

        for (int step = 0; step < maxSteps; step++) {
            BigTwoSnapshot s = live.get();
            String stop = stopReason(s, sequence, exempt);
            if (stop != null) {
                log.info("自动过牌结束: room={}, seq={}, passes={}, reason={}", roomId, sequence, passes, stop);
                return passes;
            }
            if (s.version() == rejectedAtVersion) {
                log.warn("自动过牌在同一版本上重复被拒，停止: room={}, seq={}, version={}", roomId, sequence, s.version());
                return passes;
            }

            int seat = s.currentTurn();
            MoveResult r = pass.apply(seat);
            if (r.ok()) {
                passes++;
                conflicts = 0;
                continue;
            }

            ErrorKind kind = r.violation().kind();
            if (kind == ErrorKind.ROOM_LOCK_CONFLICT) {
                if (++conflicts > lockRetries) {
                    log.warn("自动过牌锁冲突重试耗尽: room={}, seq={}, seat={}", roomId, sequence, seat);
                    return passes;
                }
                backoff();
                continue;
            }
            // 与玩家操作竞争导致的拒绝：忽略，下一步重新读取
            log.info("自动过牌被拒，忽略: room={}, seat={}, kind={}", roomId, seat, kind);
            rejectedAtVersion = s.version();
        }
        log.warn("自动过牌达到步数上限: room={}, seq={}, passes={}", roomId, sequence, passes);
        return passes;
    }

    private static String stopReason(BigTwoSnapshot s, long sequence, int exempt) {
        if (!s.inProgress()) return "not-in-progress";
        TimerState.Active t = s.autoPassTimer();
        if (t == null || t.sequenceId() != sequence) return "timer-cleared";
        if (s.lastPlay() == null) return "trick-cleared";
        if (s.currentTurn() == exempt) return "back-to-exempt";
        return null;
    }

    private void backoff() {
        if (retryBackoffMs <= 0) return;
        try {
            Thread.sleep(retryBackoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
