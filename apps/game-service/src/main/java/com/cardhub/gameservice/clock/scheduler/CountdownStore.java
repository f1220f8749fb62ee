package com.cardhub.gameservice.clock.scheduler;

import java.util.List;

/**
 * 倒计时状态与 holder 锁的存储。
 * - Redis 实现：多节点共享，holder 锁保证只有一个节点执行超时；
 * - 本地实现：单进程内存。
 */
public interface CountdownStore {

    void save(CountdownState state);

    CountdownState load(String key);

    List<CountdownState> loadAll();

    void delete(String key);

    /**
     * 抢占超时执行权（SETNX 语义，带过期）。
     * @return true 表示本节点获得执行权
     */
    boolean tryAcquireHolder(String key, String nodeId);
}
