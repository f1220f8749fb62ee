package com.cardhub.gameservice.infrastructure.redis;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * 锄大地用到的两个 Redis 模板。
 * - objectRedis：对局记录 GameStateRecord 与倒计时 CountdownState，值为带类型信息的 JSON，
 *   RedisGameStateRepository 在它上面做 WATCH/MULTI 版本比较；
 * - stringRedis：房间锁令牌与倒计时 holder 锁，值是裸字符串，便于 Lua 脚本直接比较。
 */
@Configuration
public class RedisConfig {

    @Bean(name = "redisTemplate")
    public RedisTemplate<String, Object> objectRedis(RedisConnectionFactory factory) {
        StringRedisSerializer keys = new StringRedisSerializer();
        GenericJackson2JsonRedisSerializer json = new GenericJackson2JsonRedisSerializer();

        RedisTemplate<String, Object> tpl = new RedisTemplate<>();
        tpl.setConnectionFactory(factory);
        tpl.setKeySerializer(keys);
        tpl.setHashKeySerializer(keys);
        tpl.setValueSerializer(json);
        tpl.setHashValueSerializer(json);
        tpl.afterPropertiesSet();
        return tpl;
    }

    @Bean(name = "stringRedisTemplate")
    public StringRedisTemplate stringRedis(RedisConnectionFactory factory) {
        return new StringRedisTemplate(factory);
    }
}
