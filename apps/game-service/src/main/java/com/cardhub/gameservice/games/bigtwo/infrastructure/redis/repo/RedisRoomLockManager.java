package com.cardhub.gameservice.games.bigtwo.infrastructure.redis.repo;

import com.cardhub.gameservice.games.bigtwo.domain.repository.RoomLockManager;
import com.cardhub.gameservice.games.bigtwo.infrastructure.redis.RedisKeys;
import com.cardhub.gameservice.infrastructure.redis.RedisOps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 基于 Redis 的房间锁（多节点）。
 * - 加锁：SET key token NX PX ttl；
 * - 解锁：Lua 脚本比较令牌后删除，只删自己的锁。
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "cardhub.storage.mode", havingValue = "redis", matchIfMissing = true)
public class RedisRoomLockManager implements RoomLockManager {

    static final String RELEASE_SCRIPT =
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end";

    private final RedisOps ops;

    @Value("${bigtwo.lock.ttl-ms:5000}")
    private long ttlMs;

    public RedisRoomLockManager(RedisOps ops) {
        this.ops = ops;
    }

    @Override
    public Optional<Handle> tryLock(String roomId) {
        String key = RedisKeys.roomLock(roomId);
        String token = UUID.randomUUID().toString();
        if (!ops.setStringNx(key, token, Duration.ofMillis(ttlMs))) {
            return Optional.empty();
        }
        Handle handle = () -> release(key, token);
        return Optional.of(handle);
    }

    private void release(String key, String token) {
        Long n = ops.eval(RELEASE_SCRIPT, List.of(key), List.<Object>of(token), Long.class);
        if (n == null || n == 0L) {
            // 锁已过期或被别人持有
            log.warn("房间锁释放时令牌不匹配: key={}", key);
        }
    }
}
