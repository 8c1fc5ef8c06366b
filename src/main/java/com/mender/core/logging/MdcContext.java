package com.mender.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Mender-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String MISSION_KEY = "missionKey";
    public static final String FIX_ID = "fixId";

    private MdcContext() {}

    public static void setMission(String missionKey) {
        MDC.put(MISSION_KEY, missionKey);
    }

    public static void setFix(String missionKey, String fixId) {
        MDC.put(MISSION_KEY, missionKey);
        MDC.put(FIX_ID, fixId);
    }

    public static void clear() {
        MDC.remove(MISSION_KEY);
        MDC.remove(FIX_ID);
    }
}
