package com.mender.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@link KeyValueStore} backed by Redis string values with per-key expiry.
 */
public class RedisKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(RedisKeyValueStore.class);

    /** Keys requested per SCAN round trip. */
    static final long SCAN_COUNT = 500;

    private final StringRedisTemplate redis;

    public RedisKeyValueStore(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redis.opsForValue().get(key));
        } catch (DataAccessException e) {
            throw new StoreException("Redis GET failed for " + key, e);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        try {
            redis.opsForValue().set(key, value, ttl);
        } catch (DataAccessException e) {
            throw new StoreException("Redis SET failed for " + key, e);
        }
    }

    /**
     * Iterates with SCAN so a large keyspace never blocks the server. SCAN may
     * return a key more than once; duplicates are dropped.
     */
    @Override
    public List<String> listKeys(String prefix) {
        ScanOptions options = ScanOptions.scanOptions().match(prefix + "*").count(SCAN_COUNT).build();
        Set<String> keys = new LinkedHashSet<>();
        try (Cursor<String> cursor = redis.scan(options)) {
            cursor.forEachRemaining(keys::add);
        } catch (DataAccessException e) {
            throw new StoreException("Redis SCAN failed for prefix " + prefix, e);
        }
        log.debug("SCAN {}* found {} key(s)", prefix, keys.size());
        return new ArrayList<>(keys);
    }
}
