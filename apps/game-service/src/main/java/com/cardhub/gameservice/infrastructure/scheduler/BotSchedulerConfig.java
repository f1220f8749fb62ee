package com.cardhub.gameservice.infrastructure.scheduler;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 这个调度器专门用于机器人“思考延迟”和下一局自动发牌，与自动过牌倒计时的调度器分开，以防止线程池任务相互影响计时精度。
 */
@Configuration
public class BotSchedulerConfig {

	@Bean(name = "botScheduler", destroyMethod = "shutdownNow")
	public ScheduledExecutorService botScheduler() {
		int poolSize = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
		ScheduledThreadPoolExecutor exec = new ScheduledThreadPoolExecutor(poolSize, new ThreadFactory() {
			private final AtomicInteger idx = new AtomicInteger(1);
			@Override
			public Thread newThread(Runnable r) {
				Thread t = new Thread(r, "bot-delay-" + idx.getAndIncrement());
                // 设置为守护线程
				t.setDaemon(true);
				return t;
			}
		});
		exec.setRemoveOnCancelPolicy(true);
		return exec;
	}
}
