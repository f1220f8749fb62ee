package com.cardhub.gameservice.games.bigtwo.config;

import com.cardhub.gameservice.games.bigtwo.application.AutoPassCascade;
import com.cardhub.gameservice.games.bigtwo.domain.bot.BotStrategy;
import com.cardhub.gameservice.games.bigtwo.domain.bot.LowestBeatingPlayStrategy;
import com.cardhub.gameservice.games.bigtwo.domain.engine.Dealer;
import com.cardhub.gameservice.games.bigtwo.domain.engine.ShuffledDealer;
import com.cardhub.gameservice.games.bigtwo.domain.engine.TurnStateMachine;
import com.cardhub.gameservice.games.bigtwo.domain.rule.HighestRemainingPlayDetector;
import com.cardhub.gameservice.games.bigtwo.domain.rule.UnbeatablePlayPredicate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 锄大地规则引擎装配：状态机、发牌、最大牌判定、机器人策略、连锁过牌。
 * 判定与策略都可被替换（声明同类型 Bean 即可）。
 */
@Configuration
public class BigTwoEngineConfig {

    @Value("${bigtwo.auto-pass.duration-ms:10000}")
    private long autoPassDurationMs;

    @Value("${bigtwo.auto-pass.lock-retries:5}")
    private int lockRetries;

    @Value("${bigtwo.auto-pass.lock-retry-backoff-ms:20}")
    private long lockRetryBackoffMs;

    @Value("${bigtwo.scoring.game-over-threshold:101}")
    private int gameOverThreshold;

    @Bean
    @ConditionalOnMissingBean
    public UnbeatablePlayPredicate unbeatablePlayPredicate() {
        return new HighestRemainingPlayDetector();
    }

    @Bean
    @ConditionalOnMissingBean
    public Dealer dealer() {
        return new ShuffledDealer();
    }

    @Bean
    @ConditionalOnMissingBean
    public BotStrategy botStrategy() {
        return new LowestBeatingPlayStrategy();
    }

    @Bean
    public TurnStateMachine turnStateMachine(UnbeatablePlayPredicate unbeatablePlayPredicate, Clock clock) {
        return new TurnStateMachine(unbeatablePlayPredicate, clock, autoPassDurationMs, gameOverThreshold);
    }

    @Bean
    public AutoPassCascade autoPassCascade() {
        return new AutoPassCascade(lockRetries, lockRetryBackoffMs);
    }
}
