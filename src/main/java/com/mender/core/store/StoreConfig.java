package com.mender.core.store;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class StoreConfig {

    @Bean
    @ConditionalOnProperty(name = "mender.store.type", havingValue = "memory", matchIfMissing = true)
    public KeyValueStore inMemoryKeyValueStore() {
        return new InMemoryKeyValueStore();
    }

    @Bean
    @ConditionalOnProperty(name = "mender.store.type", havingValue = "redis")
    public KeyValueStore redisKeyValueStore(StringRedisTemplate redisTemplate) {
        return new RedisKeyValueStore(redisTemplate);
    }
}
