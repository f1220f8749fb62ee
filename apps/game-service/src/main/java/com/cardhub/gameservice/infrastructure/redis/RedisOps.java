package com.cardhub.gameservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * 公用 Redis 工具类：
 * - 封装常用 String/Key/脚本 操作
 * - 仅提供“原语级”方法；业务键名放在 Repo 层组织（见 RedisKeys）
 */
@Component
@RequiredArgsConstructor
public class RedisOps {
    /** 通用对象模板：用于 JSON 存储与反序列化 */
    private final RedisTemplate<String, Object> redis;
    /** 字符串模板：用于轻量 String 操作 */
    private final StringRedisTemplate strRedis;

    // -------------- Object --------------
    /**
     * 写入键值（带 TTL）
     */
    public boolean setEx(String key, Object val, Duration ttl) {
        redis.opsForValue().set(key, val, ttl);
        return true;
    }

    /**
     * 获取键值并自动反序列化为指定类型
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String key, Class<T> type) {
        Object v = redis.opsForValue().get(key);
        return (v == null) ? null : (T) v;
    }

    // -------------- Key --------------
    /**
     * 删除一个或多个 Key
     */
    public Long del(String... keys) {
        return redis.delete(Arrays.asList(keys));
    }

    /**
     * 按模式列出 Key（仅用于启动恢复这类低频场景）
     */
    public Set<String> keys(String pattern) {
        return redis.keys(pattern);
    }

    // -------------- Script --------------
    /**
     * 执行 Lua 脚本（原子操作）
     * 常用于：锁的“比较后删除”、乐观锁更新。
     *
     * @param script     Lua 文本内容
     * @param keys       KEYS[...] 参数列表
     * @param args       ARGV[...] 参数列表
     * @param resultType 返回类型
     */
    public <T> T eval(String script, List<String> keys, List<Object> args, Class<T> resultType) {
        DefaultRedisScript<T> rs = new DefaultRedisScript<>();
        rs.setResultType(resultType);
        rs.setScriptText(script);
        return strRedis.execute(rs, keys, args.toArray());
    }

    // -------------- String --------------
    /**
     * 仅当不存在时写入字符串键值（SETNX），带 TTL。
     * @return true 表示写入成功，false 表示已存在
     */
    public boolean setStringNx(String key, String val, Duration ttl) {
        Boolean ok = strRedis.opsForValue().setIfAbsent(key, val, ttl);
        return Boolean.TRUE.equals(ok);
    }
}
