package com.cardhub.gameservice.games.bigtwo.infrastructure.redis.repo;

import com.cardhub.gameservice.games.bigtwo.domain.dto.GameStateRecord;
import com.cardhub.gameservice.games.bigtwo.domain.repository.GameStateRepository;
import com.cardhub.gameservice.games.bigtwo.infrastructure.redis.RedisKeys;
import com.cardhub.gameservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Optional;

/**
 * RedisGameStateRepository
 * -------------------------------------------------------
 * 房间对局状态的 Redis 仓储实现。
 * - 存取对象：GameStateRecord（JSON）；
 * - compareAndSet 基于 WATCH/MULTI：版本号一致才写入。
 */
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "cardhub.storage.mode", havingValue = "redis", matchIfMissing = true)
public class RedisGameStateRepository implements GameStateRepository {

    private final RedisOps ops;

    private final RedisTemplate<String, Object> redisTemplate; // 用于原生事务

    @Override
    public void save(String roomId, GameStateRecord state, Duration ttl) {
        ops.setEx(RedisKeys.gameState(roomId), state, ttl);
    }

    @Override
    public Optional<GameStateRecord> get(String roomId) {
        return Optional.ofNullable(ops.get(RedisKeys.gameState(roomId), GameStateRecord.class));
    }

    @Override
    public void delete(String roomId) {
        ops.del(RedisKeys.gameState(roomId));
    }

    /**
     * 原子更新房间状态（CAS 语义）。
     * <p>
     * 实现：对状态键执行 WATCH，校验期望版本一致后在 MULTI/EXEC 中写入新状态。
     * 若在提交前键被其他请求修改，EXEC 返回 null，视为更新失败。
     */
    @Override
    public boolean compareAndSet(String roomId, long expectedVersion, GameStateRecord newState, Duration ttl) {
        final String stateKey = RedisKeys.gameState(roomId);

        Boolean ok = redisTemplate.execute(new SessionCallback<Boolean>() {
            @SuppressWarnings("unchecked")
            @Override
            public <K, V> Boolean execute(RedisOperations<K, V> operations) throws DataAccessException {
                // 1) 监视 stateKey
                operations.watch((K) stateKey);

                // 2) 读取并校验当前版本
                GameStateRecord cur = (GameStateRecord) operations.opsForValue().get((K) stateKey);
                if (cur == null || cur.getVersion() != expectedVersion) {
                    operations.unwatch();
                    return false;
                }

                // 3) 开启事务、写入新状态
                operations.multi();
                operations.opsForValue().set((K) stateKey, (V) newState, ttl);

                // 4) 提交事务：exec 返回 null 代表被改动冲突
                var res = operations.exec();
                return res != null;
            }
        });

        return Boolean.TRUE.equals(ok);
    }
}
