package com.mender.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "mender")
public class MenderProperties {

    private Poller poller = new Poller();
    private Orchestrator orchestrator = new Orchestrator();

    // -- Poller accessors (delegate to nested) --
    public boolean isPollerEnabled() { return poller.enabled; }
    public long getPollIntervalMs() { return poller.intervalMs; }
    public int getMaxConcurrentMissions() { return poller.maxConcurrentMissions; }
    public int getShutdownTimeoutSeconds() { return poller.shutdownTimeoutSeconds; }

    // -- Orchestrator accessors (delegate to nested) --
    public int getCollaboratorTimeoutSeconds() { return orchestrator.collaboratorTimeoutSeconds; }

    public Poller getPoller() { return poller; }
    public void setPoller(Poller poller) { this.poller = poller; }
    public Orchestrator getOrchestrator() { return orchestrator; }
    public void setOrchestrator(Orchestrator orchestrator) { this.orchestrator = orchestrator; }

    public static class Poller {
        private boolean enabled = true;
        private long intervalMs = 10_000;
        private int maxConcurrentMissions = 3;
        private int shutdownTimeoutSeconds = 30;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
        public int getMaxConcurrentMissions() { return maxConcurrentMissions; }
        public void setMaxConcurrentMissions(int maxConcurrentMissions) { this.maxConcurrentMissions = maxConcurrentMissions; }
        public int getShutdownTimeoutSeconds() { return shutdownTimeoutSeconds; }
        public void setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) { this.shutdownTimeoutSeconds = shutdownTimeoutSeconds; }
    }

    public static class Orchestrator {
        /** Upper bound for a single analyzer, synthesizer, executor or review call. */
        private int collaboratorTimeoutSeconds = 120;

        public int getCollaboratorTimeoutSeconds() { return collaboratorTimeoutSeconds; }
        public void setCollaboratorTimeoutSeconds(int collaboratorTimeoutSeconds) { this.collaboratorTimeoutSeconds = collaboratorTimeoutSeconds; }
    }
}
