package com.cardhub.gameservice.clock.scheduler;

import java.io.Serializable;

/**
 * 倒计时持久化状态
 */
public class CountdownState implements Serializable {
    // 业务键
    public String key;
    // 被计时的一方（字符串）
    public String owner;
    // 计时版本（上层用于幂等/保护）
    public String version;
    // 绝对截止时间（毫秒）
    public long deadlineEpochMs;

    public CountdownState() {
    }

    public CountdownState(String key, String owner, String version, long deadlineEpochMs) {
        this.key = key;
        this.owner = owner;
        this.version = version;
        this.deadlineEpochMs = deadlineEpochMs;
    }
}
