package com.mender.core.scheduler;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;

/**
 * Missions currently owned by this process, keyed by mission key.
 * <p>
 * Only the poller claims; only the orchestration that owns a claim releases it.
 * A key is claimed at most once at a time.
 */
@Component
public class ClaimTable {

    private final ConcurrentHashMap<String, Claim> claims = new ConcurrentHashMap<>();

    /**
     * Claims {@code missionKey} if nobody holds it.
     *
     * @return the new claim, or empty if the key is already claimed
     */
    public Optional<Claim> tryClaim(String missionKey, Instant now) {
        var claim = new Claim(missionKey, now);
        return claims.putIfAbsent(missionKey, claim) == null ? Optional.of(claim) : Optional.empty();
    }

    /** Records the task running the claimed mission. Ignored if the claim was already released. */
    public void attach(String missionKey, Future<?> task) {
        Claim claim = claims.get(missionKey);
        if (claim != null) {
            claim.task = task;
        }
    }

    public void release(String missionKey) {
        claims.remove(missionKey);
    }

    public boolean contains(String missionKey) {
        return claims.containsKey(missionKey);
    }

    public int size() {
        return claims.size();
    }

    public Collection<Claim> claims() {
        return List.copyOf(claims.values());
    }

    public static final class Claim {
        private final String missionKey;
        private final Instant claimedAt;
        private volatile Future<?> task;

        Claim(String missionKey, Instant claimedAt) {
            this.missionKey = missionKey;
            this.claimedAt = claimedAt;
        }

        public String getMissionKey() { return missionKey; }
        public Instant getClaimedAt() { return claimedAt; }
        public Optional<Future<?>> getTask() { return Optional.ofNullable(task); }
    }
}
