package com.bullrunhub.gameservice.infrastructure.redis;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * RedisConfig
 * -------------------------------------------------------
 * 全局 Redis 序列化配置（通用基础设施层）
 * -------------------------------------------------------
 *  - Key 使用 StringRedisSerializer，保证键名可读；
 *  - Value 使用 GenericJackson2JsonRedisSerializer，携带类型信息，读回时还原为原对象类型；
 *  - Hash 的 key/value 与普通 key/value 保持一致。
 */
@Configuration
public class RedisConfig {

    /**
     * @param factory Spring Data Redis 提供的连接工厂（Lettuce）
     */
    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory factory) {
        RedisTemplate<String, Object> tpl = new RedisTemplate<>();
        tpl.setConnectionFactory(factory);

        StringRedisSerializer keySer = new StringRedisSerializer();
        GenericJackson2JsonRedisSerializer valSer = new GenericJackson2JsonRedisSerializer();

        tpl.setKeySerializer(keySer);
        tpl.setValueSerializer(valSer);
        tpl.setHashKeySerializer(keySer);
        tpl.setHashValueSerializer(valSer);

        tpl.afterPropertiesSet();
        return tpl;
    }
}
