package com.cardhub.gameservice.clock.scheduler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 单进程内存版倒计时存储（cardhub.storage.mode=local）。
 * holder 锁在状态删除时一并释放。
 */
public class LocalCountdownStore implements CountdownStore {

    private final Map<String, CountdownState> states = new ConcurrentHashMap<>();
    private final Map<String, String> holders = new ConcurrentHashMap<>();

    @Override
    public void save(CountdownState state) {
        states.put(state.key, state);
    }

    @Override
    public CountdownState load(String key) {
        return states.get(key);
    }

    @Override
    public List<CountdownState> loadAll() {
        return new ArrayList<>(states.values());
    }

    @Override
    public void delete(String key) {
        states.remove(key);
        holders.remove(key);
    }

    @Override
    public boolean tryAcquireHolder(String key, String nodeId) {
        return holders.putIfAbsent(key, nodeId) == null;
    }
}
