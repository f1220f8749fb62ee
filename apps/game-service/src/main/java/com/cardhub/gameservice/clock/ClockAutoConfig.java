package com.cardhub.gameservice.clock;

import com.cardhub.gameservice.clock.scheduler.CountdownScheduler;
import com.cardhub.gameservice.clock.scheduler.CountdownSchedulerImpl;
import com.cardhub.gameservice.clock.scheduler.CountdownStore;
import com.cardhub.gameservice.clock.scheduler.LocalCountdownStore;
import com.cardhub.gameservice.clock.scheduler.RedisCountdownStore;
import com.cardhub.gameservice.infrastructure.redis.RedisOps;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * ClockAutoConfig
 * ---------------------------------------
 * 时间与倒计时相关 Bean 的装配：
 *  - 权威时钟 Clock（所有截止时间、计时器创建时刻都取自它）；
 *  - 倒计时存储（redis / local，按 cardhub.storage.mode 选择）；
 *  - 通用倒计时调度器。
 *
 * 说明：
 *  - 线程池由 {@link ClockSchedulerConfig} 提供。
 *  - 这里不关心任何业务细节，只负责把基础设施拼起来。
 */
@Configuration
public class ClockAutoConfig {

    @Value("${instance.id:${spring.application.name:game-service}-${random.value}}")
    private String nodeId;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "cardhub.storage.mode", havingValue = "redis", matchIfMissing = true)
    public CountdownStore redisCountdownStore(RedisOps redisOps) {
        return new RedisCountdownStore(redisOps);
    }

    @Bean
    @ConditionalOnProperty(name = "cardhub.storage.mode", havingValue = "local")
    public CountdownStore localCountdownStore() {
        return new LocalCountdownStore();
    }

    /**
     * 注册通用倒计时调度器。
     * @param store              倒计时状态/holder 锁存储
     * @param clockExecutor      调度线程池（守护线程）
     * @param clock              权威时钟
     */
    @Bean
    public CountdownScheduler countdownScheduler(CountdownStore store,
                                                 @Qualifier("autoPassClockExecutor") ScheduledThreadPoolExecutor clockExecutor,
                                                 Clock clock) {
        return new CountdownSchedulerImpl(store, clockExecutor, clock, nodeId); // 纯引擎，无业务逻辑
    }
}
