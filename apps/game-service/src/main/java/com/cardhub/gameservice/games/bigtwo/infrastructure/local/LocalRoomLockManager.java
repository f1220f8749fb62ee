package com.cardhub.gameservice.games.bigtwo.infrastructure.local;

import com.cardhub.gameservice.games.bigtwo.domain.repository.RoomLockManager;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 进程内房间锁：每个房间一把 ReentrantLock，tryLock 不等待。
 */
@Component
@ConditionalOnProperty(name = "cardhub.storage.mode", havingValue = "local")
public class LocalRoomLockManager implements RoomLockManager {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public Optional<Handle> tryLock(String roomId) {
        ReentrantLock lock = locks.computeIfAbsent(roomId, k -> new ReentrantLock());
        if (!lock.tryLock()) return Optional.empty();
        Handle handle = lock::unlock;
        return Optional.of(handle);
    }
}
