package com.mender.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator view of {@link HealthCheckService}: DOWN when any component is down,
 * DEGRADED when one is degraded, otherwise UP. Each component is a detail entry.
 */
@Component
public class MissionPipelineHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public MissionPipelineHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        var checks = healthCheckService.checkAll();
        var builder = Health.up();
        boolean degraded = false;
        for (var check : checks) {
            builder.withDetail(check.component(), check.status().name() + ": " + check.detail());
            if (check.status() == HealthStatus.Status.DEGRADED) {
                degraded = true;
            }
        }
        if (!healthCheckService.isHealthy(checks)) {
            return builder.down().build();
        }
        return degraded ? builder.status("DEGRADED").build() : builder.build();
    }
}
