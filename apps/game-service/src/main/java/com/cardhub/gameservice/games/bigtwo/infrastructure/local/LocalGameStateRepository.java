package com.cardhub.gameservice.games.bigtwo.infrastructure.local;

import com.cardhub.gameservice.games.bigtwo.domain.dto.GameStateRecord;
import com.cardhub.gameservice.games.bigtwo.domain.repository.GameStateRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内存版对局状态仓储（cardhub.storage.mode=local，单节点/测试用）。
 * 不做 TTL。
 */
@Repository
@ConditionalOnProperty(name = "cardhub.storage.mode", havingValue = "local")
public class LocalGameStateRepository implements GameStateRepository {

    private final Map<String, GameStateRecord> store = new ConcurrentHashMap<>();

    @Override
    public void save(String roomId, GameStateRecord state, Duration ttl) {
        store.put(roomId, state);
    }

    @Override
    public Optional<GameStateRecord> get(String roomId) {
        return Optional.ofNullable(store.get(roomId));
    }

    @Override
    public void delete(String roomId) {
        store.remove(roomId);
    }

    @Override
    public boolean compareAndSet(String roomId, long expectedVersion, GameStateRecord newState, Duration ttl) {
        boolean[] ok = {false};
        store.computeIfPresent(roomId, (k, cur) -> {
            if (cur.getVersion() != expectedVersion) return cur;
            ok[0] = true;
            return newState;
        });
        return ok[0];
    }
}
