package com.cardhub.gameservice.clock;

import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ClockSchedulerConfigTest {

    @Test
    void executorUsesDaemonThreadsAndDropsCancelledTasks() throws Exception {
        ClockSchedulerConfig config = new ClockSchedulerConfig();
        ReflectionTestUtils.setField(config, "clockThreads", 2);

        ScheduledThreadPoolExecutor executor = config.autoPassClockExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(2);
            assertThat(executor.getRemoveOnCancelPolicy()).isTrue();

            CompletableFuture<Thread> worker = new CompletableFuture<>();
            executor.execute(() -> worker.complete(Thread.currentThread()));
            Thread t = worker.get(5, TimeUnit.SECONDS);
            assertThat(t.getName()).startsWith("auto-pass-clock-");
            assertThat(t.isDaemon()).isTrue();

            executor.schedule(() -> { }, 1, TimeUnit.HOURS).cancel(false);
            assertThat(executor.getQueue()).isEmpty();
        } finally {
            executor.shutdownNow();
        }
    }
}
