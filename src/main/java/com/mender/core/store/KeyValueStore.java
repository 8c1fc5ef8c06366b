package com.mender.core.store;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Shared key-value store used to hand missions and fix audit records between
 * the anomaly detector, this pipeline and dashboards.
 * Implementations: InMemoryKeyValueStore (dev, tests), RedisKeyValueStore (prod).
 * <p>
 * Semantics are at-least-once, last write wins. Implementations wrap backend
 * failures in {@link StoreException}.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    /**
     * Writes {@code value} under {@code key}, expiring it {@code ttl} after this write.
     */
    void set(String key, String value, Duration ttl);

    /**
     * Lists live keys starting with {@code prefix}, in no particular order.
     */
    List<String> listKeys(String prefix);
}
