package com.cardhub.gameservice.infrastructure.redis;

import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class RedisConfigTest {

    private final RedisConnectionFactory factory = mock(RedisConnectionFactory.class);

    @Test
    void objectTemplateWritesStringKeysAndJsonValues() {
        RedisTemplate<String, Object> tpl = new RedisConfig().objectRedis(factory);

        assertThat(tpl.getKeySerializer()).isInstanceOf(StringRedisSerializer.class);
        assertThat(tpl.getHashKeySerializer()).isInstanceOf(StringRedisSerializer.class);
        assertThat(tpl.getValueSerializer()).isInstanceOf(GenericJackson2JsonRedisSerializer.class);
        assertThat(tpl.getHashValueSerializer()).isInstanceOf(GenericJackson2JsonRedisSerializer.class);
        assertThat(tpl.getConnectionFactory()).isSameAs(factory);
    }

    @Test
    void stringTemplateSharesTheFactory() {
        assertThat(new RedisConfig().stringRedis(factory).getConnectionFactory()).isSameAs(factory);
    }
}
