package com.mender.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mender.core.model.Fix;
import com.mender.core.model.Mission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes mission and fix audit records as JSON in the shared {@link KeyValueStore}.
 */
@Service
public class MissionStore {

    private static final Logger log = LoggerFactory.getLogger(MissionStore.class);

    public static final String MISSION_PREFIX = "healing_mission:";
    public static final String FIX_PREFIX = "autonomous_fix:";

    /** Mission records expire one hour after their last write. */
    public static final Duration MISSION_TTL = Duration.ofHours(1);
    public static final Duration FIX_TTL = Duration.ofDays(7);

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MissionStore(KeyValueStore store, ObjectMapper objectMapper) {
        this(store, objectMapper, Clock.systemUTC());
    }

    @Autowired
    public MissionStore(KeyValueStore store, ObjectMapper objectMapper, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public static String missionKey(String anomalyId) {
        return MISSION_PREFIX + anomalyId;
    }

    public static String fixKey(String fixId) {
        return FIX_PREFIX + fixId;
    }

    public List<String> listMissionKeys() {
        return store.listKeys(MISSION_PREFIX);
    }

    /**
     * Loads the mission stored under {@code key}; the returned record always carries that key.
     * Detector records without {@code createdAt} are stamped with the current time.
     *
     * @throws StoreException if the record cannot be parsed
     */
    public Optional<Mission> loadMission(String key) {
        return store.get(key).map(json -> {
            Mission mission = read(json, Mission.class, key).withKey(key);
            return mission.createdAt() != null ? mission : mission.withCreatedAt(clock.instant());
        });
    }

    public void saveMission(Mission mission) {
        if (mission.key() == null || !mission.key().startsWith(MISSION_PREFIX)) {
            throw new IllegalArgumentException("Mission key must start with " + MISSION_PREFIX + ": " + mission.key());
        }
        store.set(mission.key(), write(mission), MISSION_TTL);
        log.debug("Persisted mission {} with status {}", mission.key(), mission.status().value());
    }

    /** All readable missions; malformed records are logged and skipped. */
    public List<Mission> loadAllMissions() {
        var missions = new ArrayList<Mission>();
        for (String key : listMissionKeys()) {
            try {
                loadMission(key).ifPresent(missions::add);
            } catch (StoreException e) {
                log.warn("Skipping unreadable mission record {}: {}", key, e.getMessage());
            }
        }
        return missions;
    }

    public void saveFix(Fix fix) {
        store.set(fixKey(fix.id()), write(fix), FIX_TTL);
        log.debug("Persisted fix {} with status {}", fix.id(), fix.status().value());
    }

    public Optional<Fix> loadFix(String fixId) {
        String key = fixKey(fixId);
        return store.get(key).map(json -> read(json, Fix.class, key));
    }

    /** All readable fix audit records; malformed records are logged and skipped. */
    public List<Fix> loadAllFixes() {
        var fixes = new ArrayList<Fix>();
        for (String key : store.listKeys(FIX_PREFIX)) {
            try {
                store.get(key).map(json -> read(json, Fix.class, key)).ifPresent(fixes::add);
            } catch (StoreException e) {
                log.warn("Skipping unreadable fix record {}: {}", key, e.getMessage());
            }
        }
        return fixes;
    }

    private String write(Object record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new StoreException("Could not serialize " + record.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, Class<T> type, String key) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new StoreException("Malformed " + type.getSimpleName() + " record at " + key, e);
        }
    }
}
