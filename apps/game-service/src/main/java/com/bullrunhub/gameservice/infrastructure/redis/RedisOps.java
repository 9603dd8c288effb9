package com.bullrunhub.gameservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * 公用 Redis 工具类：
 * - 只提供原语级方法（String / Hash / Key）；
 * - 业务键名与字段名放在 Repo 层组织（见各游戏的 RedisKeys）。
 */
@Component
@RequiredArgsConstructor
public class RedisOps {
    /** 通用对象模板：JSON 存储与反序列化 */
    private final RedisTemplate<String, Object> redis;

    // -------------- String --------------
    /**
     * 写入键值（带 TTL）
     */
    public boolean setEx(String key, Object val, Duration ttl) {
        redis.opsForValue().set(key, val, ttl);
        return true;
    }

    // -------------- Hash --------------
    /**
     * 批量写入 Hash
     */
    public boolean hSetAll(String key, Map<String, ?> map) {
        redis.opsForHash().putAll(key, map);
        return true;
    }

    /**
     * 获取整个 Hash（转为 Map<String,Object>）
     */
    public Map<String, Object> hGetAll(String key) {
        Map<Object, Object> raw = redis.opsForHash().entries(key);
        Map<String, Object> out = new HashMap<>();
        raw.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    // -------------- Key & TTL --------------
    /**
     * 设置过期时间（TTL）
     */
    public Boolean expire(String key, Duration ttl) {
        return redis.expire(key, ttl);
    }
}
