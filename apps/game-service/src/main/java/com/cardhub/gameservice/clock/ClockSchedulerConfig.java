package com.cardhub.gameservice.clock;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 自动过牌倒计时的执行线程池。
 * 每个房间同一时刻最多一个到期任务，外加每秒一次的 TICK，线程数 bigtwo.auto-pass.clock-threads 默认 2 即可。
 * 线程名 auto-pass-clock-N；守护线程，不阻塞进程退出。
 */
@Configuration
public class ClockSchedulerConfig {

    @Value("${bigtwo.auto-pass.clock-threads:2}")
    private int clockThreads;

    @Bean(name = "autoPassClockExecutor", destroyMethod = "shutdownNow")
    public ScheduledThreadPoolExecutor autoPassClockExecutor() {
        AtomicInteger seq = new AtomicInteger(1);
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "auto-pass-clock-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        // 队列无界，拒绝只会发生在关闭之后，此时到期任务已无意义
        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(clockThreads, tf, new ThreadPoolExecutor.DiscardPolicy());
        // 计时器被替换时旧任务 cancel，立即出队
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
