package com.intermission.scheduler.config;

import com.intermission.scheduler.store.CounterStore;
import com.intermission.scheduler.store.InMemoryCounterStore;
import com.intermission.scheduler.store.RedisCounterStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Slf4j
@Configuration
public class RedisConfig {

    @Bean
    public CounterStore counterStore(ObjectProvider<StringRedisTemplate> redisTemplate,
                                     @Value("${intermission.store:redis}") String storeType) {
        StringRedisTemplate template = redisTemplate.getIfAvailable();
        if ("redis".equalsIgnoreCase(storeType) && template != null) {
            return new RedisCounterStore(template);
        }
        log.warn("Counter store '{}' without Redis - manual trigger counter will not survive restarts", storeType);
        return new InMemoryCounterStore();
    }
}
