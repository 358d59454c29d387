package com.example.nodelearn.kv;

import java.time.Duration;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Redis-backed cache. Every key is stored under {@code app.kv.key-prefix} so the engine can share a
 * Redis instance with other services.
 */
@Component
public class RedisKvClient implements KvClient {

    private final StringRedisTemplate redis;
    private final String keyPrefix;

    @Autowired
    public RedisKvClient(StringRedisTemplate redis, @Value("${app.kv.key-prefix:nodelearn:}") String keyPrefix) {
        this.redis = redis;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(namespaced(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        // a missing or non-positive ttl keeps the value until it is deleted
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            redis.opsForValue().set(namespaced(key), value);
        } else {
            redis.opsForValue().set(namespaced(key), value, ttl);
        }
    }

    @Override
    public void del(String key) {
        redis.delete(namespaced(key));
    }

    String namespaced(String key) {
        return keyPrefix + key;
    }
}
