package com.cardhub.gameservice.clock.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * CountdownSchedulerImpl
 * ---------------------------------------
 * 通用倒计时调度引擎的默认实现。
 *
 * 职责：
 *  - 使用 ScheduledThreadPoolExecutor 每秒发 TICK，并在截止时刻精确触发一次到期检查。
 *  - 将倒计时状态（key/owner/version/deadline）交给 CountdownStore 持久化，支持重启恢复。
 *  - 通过 holder 锁确保分布式下只有一个节点做超时处理。
 *  - 时间一律取自注入的权威 Clock。
 *
 * 不做的事：
 *  - 不做任何业务逻辑（如广播、过牌）。
 */
public class CountdownSchedulerImpl implements CountdownScheduler {

    private static final Logger log = LoggerFactory.getLogger(CountdownSchedulerImpl.class);

    private final CountdownStore store;
    private final ScheduledThreadPoolExecutor scheduler;
    private final Clock clock;
    // 本节点标识，用于 holder 锁
    private final String nodeId;

    // 每秒 TICK 的上层监听器（可为空）
    private volatile TickListener tickListener;

    // key -> 任务句柄（tick + 截止）
    private final ConcurrentMap<String, Tasks> activeTasks = new ConcurrentHashMap<>();

    public CountdownSchedulerImpl(CountdownStore store, ScheduledThreadPoolExecutor scheduler, Clock clock, String nodeId) {
        this.store = store;
        this.scheduler = scheduler;
        this.clock = clock;
        this.nodeId = nodeId;
    }

    @Override
    public void setTickListener(TickListener listener) {
        this.tickListener = listener;
    }

    /**
     * 启动或续上倒计时；若已到期则直接尝试触发超时，不再调度。
     */
    @Override
    public void startOrResume(String key, String owner, long deadlineEpochMs, String version, TimeoutHandler onTimeout) {
        // 防止重复任务：先取消老任务
        stop(key);
        CountdownState state = new CountdownState(key, owner, version, deadlineEpochMs);
        store.save(state);
        schedule(state, onTimeout);
    }

    @Override
    public void stop(String key) {
        Tasks t = activeTasks.remove(key);
        if (t != null) t.cancel();
        try {
            store.delete(key);
        } catch (RuntimeException e) {
            log.warn("清理倒计时状态失败: key={}", key, e);
        }
    }

    @Override
    public int restoreAllActive(TimeoutHandler onTimeout) {
        List<CountdownState> states = store.loadAll();
        int restored = 0;
        int expiredHandled = 0;
        for (CountdownState st : states) {
            if (st.deadlineEpochMs - clock.millis() <= 0) {
                if (tryFire(st, onTimeout)) expiredHandled++;
                continue;
            }
            schedule(st, onTimeout);
            restored++;
        }
        log.info("Countdown restoreAllActive done: restored={}, expiredHandled={}", restored, expiredHandled);
        return restored;
    }

    @Override
    public boolean isScheduled(String key) {
        return activeTasks.containsKey(key);
    }

    private void schedule(CountdownState state, TimeoutHandler onTimeout) {
        long remainMs = state.deadlineEpochMs - clock.millis();
        // 已到期：直接尝试做超时
        if (remainMs <= 0) {
            tryFire(state, onTimeout);
            return;
        }
        // 立即首帧 TICK
        fireTick(state);
        ScheduledFuture<?> ticks = scheduler.scheduleAtFixedRate(
                () -> tickTask(state, onTimeout), 1, 1, TimeUnit.SECONDS);
        ScheduledFuture<?> deadline = scheduler.schedule(
                () -> deadlineTask(state, onTimeout), remainMs, TimeUnit.MILLISECONDS);
        Tasks old = activeTasks.put(state.key, new Tasks(ticks, deadline, state.version));
        if (old != null) old.cancel();
    }

    /**
     * 周期任务：读取最新状态，到期则交给截止处理，否则发出一帧 TICK。
     */
    private void tickTask(CountdownState state, TimeoutHandler onTimeout) {
        CountdownState latest = store.load(state.key);
        // 状态不存在或已被新计时替换 → 本任务作废
        if (latest == null || !sameVersion(latest, state)) {
            cancelIfCurrent(state);
            return;
        }
        if (latest.deadlineEpochMs - clock.millis() <= 0) {
            deadlineTask(state, onTimeout);
            return;
        }
        fireTick(latest);
    }

    private void deadlineTask(CountdownState state, TimeoutHandler onTimeout) {
        CountdownState latest = store.load(state.key);
        if (latest == null || !sameVersion(latest, state)) {
            cancelIfCurrent(state);
            return;
        }
        // 调度线程可能早到几毫秒，以 Clock 为准
        long remainMs = latest.deadlineEpochMs - clock.millis();
        if (remainMs > 0) {
            scheduler.schedule(() -> deadlineTask(state, onTimeout), remainMs, TimeUnit.MILLISECONDS);
            return;
        }
        cancelIfCurrent(state);
        tryFire(latest, onTimeout);
    }

    /** holder 才执行超时；执行后清理状态 */
    private boolean tryFire(CountdownState state, TimeoutHandler onTimeout) {
        if (!store.tryAcquireHolder(state.key, nodeId)) return false;
        CountdownState latest = store.load(state.key);
        if (latest != null && sameVersion(latest, state)) {
            store.delete(state.key);
        }
        safeTimeout(onTimeout, state);
        return true;
    }

    private void cancelIfCurrent(CountdownState state) {
        Tasks t = activeTasks.get(state.key);
        if (t != null && Objects.equals(t.version, state.version) && activeTasks.remove(state.key, t)) {
            t.cancel();
        }
    }

    private void fireTick(CountdownState state) {
        TickListener l = tickListener;
        if (l == null) return;
        long left = Math.max(0, (state.deadlineEpochMs - clock.millis()) / 1000);
        try {
            l.onTick(state.key, state.owner, state.deadlineEpochMs, left);
        } catch (RuntimeException e) {
            log.warn("TICK 回调异常: key={}", state.key, e);
        }
    }

    private void safeTimeout(TimeoutHandler onTimeout, CountdownState state) {
        if (onTimeout == null) return;
        try {
            onTimeout.onTimeout(state.key, state.owner, state.version);
        } catch (RuntimeException e) {
            log.error("超时回调异常: key={}, version={}", state.key, state.version, e);
        }
    }

    private static boolean sameVersion(CountdownState a, CountdownState b) {
        return a.version != null && a.version.equals(b.version);
    }

    /** 一个 key 的两个调度句柄 */
    private static final class Tasks {
        final ScheduledFuture<?> ticks;
        final ScheduledFuture<?> deadline;
        final String version;

        Tasks(ScheduledFuture<?> ticks, ScheduledFuture<?> deadline, String version) {
            this.ticks = ticks;
            this.deadline = deadline;
            this.version = version;
        }

        void cancel() {
            ticks.cancel(false);
            deadline.cancel(false);
        }
    }
}
