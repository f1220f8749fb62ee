package com.cardhub.gameservice.clock.scheduler;

/**
 * CountdownScheduler
 * ---------------------------------------
 * 通用的“倒计时调度器”接口，独立于具体牌局规则。
 *
 * 设计目标：
 *  - 提供统一的倒计时能力（启动/恢复/停止/全量恢复）。
 *  - 暴露“每秒 tick 回调”和“到期 timeout 回调”。
 *  - 不关心消息广播、过牌等业务细节，由上层协调器负责。
 */
public interface CountdownScheduler {

    /**
     * 每秒触发一次，用于向上层报告：当前 key 的 owner、绝对截止时间、剩余秒数。
     */
    interface TickListener {
        /**
         * @param key              业务键（如 "bigtwo:{roomId}"）
         * @param owner            被计时的一方（字符串表现，如豁免座位号）
         * @param deadlineEpochMs  绝对截止时间（毫秒）
         * @param remainingSeconds 剩余秒数（服务端计算）
         */
        void onTick(String key, String owner, long deadlineEpochMs, long remainingSeconds);
    }

    /**
     * 到期时回调一次，由上层做权威业务处理。
     */
    interface TimeoutHandler {
        /**
         * @param key     业务键
         * @param owner   被计时的一方
         * @param version 计时版本（上层用于幂等/保护，如计时器序号）
         */
        void onTimeout(String key, String owner, String version);
    }

    void setTickListener(TickListener listener);

    /**
     * 启动或恢复指定 key 的倒计时；同一 key 只保留最新一个。
     * @param key             业务键
     * @param owner           被计时的一方
     * @param deadlineEpochMs 绝对截止时间（毫秒）
     * @param version         计时版本
     * @param onTimeout       到期回调
     */
    void startOrResume(String key, String owner, long deadlineEpochMs, String version, TimeoutHandler onTimeout);

    /**
     * 停止指定 key 的倒计时并清理持久化状态。
     */
    void stop(String key);

    /**
     * 从持久化介质恢复所有“仍未到期”的倒计时；已到期的直接尝试触发超时。
     * @return 恢复的任务数
     */
    int restoreAllActive(TimeoutHandler onTimeout);

    /** 当前是否有该 key 的调度任务 */
    boolean isScheduled(String key);
}
