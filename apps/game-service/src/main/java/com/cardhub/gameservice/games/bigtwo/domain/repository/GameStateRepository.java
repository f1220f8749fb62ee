package com.cardhub.gameservice.games.bigtwo.domain.repository;

import com.cardhub.gameservice.games.bigtwo.domain.dto.GameStateRecord;

import java.time.Duration;
import java.util.Optional;

/**
 * GameStateRepository
 * ----------------------------------------
 * 房间对局状态仓储接口
 * - 管理房间的权威对局状态；
 * - 支持保存、查询、删除与基于版本号的原子更新；
 * - 实现：Redis（WATCH/MULTI）与进程内存（本地模式）。
 * ----------------------------------------
 */
public interface GameStateRepository {

    /**
     * 无条件保存（开局时使用）
     * @param roomId 房间ID
     * @param state  对局状态
     * @param ttl    过期时间
     */
    void save(String roomId, GameStateRecord state, Duration ttl);

    Optional<GameStateRecord> get(String roomId);

    void delete(String roomId);

    /**
     * 仅当存储中的 version 等于 expectedVersion 时写入 newState。
     * @return true 写入成功；false 版本已变化（其它节点先提交）
     */
    boolean compareAndSet(String roomId, long expectedVersion, GameStateRecord newState, Duration ttl);
}
