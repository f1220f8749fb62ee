package com.cardhub.gameservice.games.bigtwo.infrastructure.redis;

/**
 * 统一集中管理 Redis Key 的前缀与拼接，避免字符串散落。
 */
public final class RedisKeys {

    private static final String PFX = "bigtwo:";

    private RedisKeys() {}

    // ---- 房间对局状态 ----
    public static String gameState(String roomId) {
        return PFX + "room:" + roomId + ":state";
    }

    // ---- 房间互斥锁（令牌值） ----
    public static String roomLock(String roomId) {
        return PFX + "room:" + roomId + ":lock";
    }

    // ---- 自动过牌倒计时业务键（交给 CountdownScheduler） ----
    public static String autoPassCountdown(String roomId) {
        return PFX + roomId;
    }

    /** 从倒计时业务键还原房间ID；不是本游戏的键返回 null */
    public static String roomIdFromCountdown(String key) {
        return key != null && key.startsWith(PFX) ? key.substring(PFX.length()) : null;
    }
}
