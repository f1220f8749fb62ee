package com.cardhub.gameservice.clock.scheduler;

import com.cardhub.gameservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Redis 版倒计时存储：状态 24h 过期，holder 锁 10s 过期。
 */
@RequiredArgsConstructor
public class RedisCountdownStore implements CountdownStore {

    private static final Duration STATE_TTL = Duration.ofHours(24);
    private static final Duration HOLDER_TTL = Duration.ofSeconds(10);

    private final RedisOps ops;

    @Override
    public void save(CountdownState state) {
        ops.setEx(stateKey(state.key), state, STATE_TTL);
    }

    @Override
    public CountdownState load(String key) {
        return ops.get(stateKey(key), CountdownState.class);
    }

    @Override
    public List<CountdownState> loadAll() {
        Set<String> keys = ops.keys(stateKey("*"));
        List<CountdownState> out = new ArrayList<>();
        if (keys == null) return out;
        for (String redisKey : keys) {
            // holder 锁与状态共用前缀，跳过
            if (redisKey.startsWith(holderKey(""))) continue;
            CountdownState st = ops.get(redisKey, CountdownState.class);
            if (st != null) out.add(st);
        }
        return out;
    }

    @Override
    public void delete(String key) {
        ops.del(stateKey(key), holderKey(key));
    }

    @Override
    public boolean tryAcquireHolder(String key, String nodeId) {
        return ops.setStringNx(holderKey(key), nodeId, HOLDER_TTL);
    }

    private String stateKey(String key) { return "countdown:" + key; }

    private String holderKey(String key) { return "countdown:holder:" + key; }
}
