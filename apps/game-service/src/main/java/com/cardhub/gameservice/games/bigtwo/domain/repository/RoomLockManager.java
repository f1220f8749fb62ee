package com.cardhub.gameservice.games.bigtwo.domain.repository;

import java.util.Optional;

/**
 * 房间互斥锁。
 * 非阻塞：拿不到立即返回 empty，调用方据此返回 RoomLockConflict，不排队。
 */
public interface RoomLockManager {

    /**
     * 尝试获取房间锁。
     * @return 锁句柄；拿不到返回 empty
     */
    Optional<Handle> tryLock(String roomId);

    /** 锁句柄，close 即释放 */
    interface Handle extends AutoCloseable {
        @Override
        void close();
    }
}
