package com.intermission.scheduler.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Stores counters as plain decimal strings so they stay readable from redis-cli.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisCounterStore implements CounterStore {

    private final StringRedisTemplate redisTemplate;

    @Override
    public int load(String key, int defaultValue) {
        try {
            String raw = redisTemplate.opsForValue().get(key);
            if (raw == null) {
                return defaultValue;
            }
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Counter {} holds a non-numeric value, using {}: {}", key, defaultValue, e.getMessage());
            return defaultValue;
        } catch (DataAccessException e) {
            log.warn("Failed to load counter {} from Redis, using {}: {}", key, defaultValue, e.getMessage());
            return defaultValue;
        }
    }

    @Override
    public void save(String key, int value) {
        try {
            redisTemplate.opsForValue().set(key, String.valueOf(value));
        } catch (DataAccessException e) {
            log.warn("Failed to persist counter {}={} to Redis: {}", key, value, e.getMessage());
        }
    }
}
