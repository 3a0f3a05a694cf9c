package com.elssolution.livestxm.health;

import com.elssolution.livestxm.service.StatusService;
import org.springframework.boot.actuate.health.*;
import org.springframework.stereotype.Component;

/** DOWN when an enabled stage loop is dead or a link is down. Standby is a normal state. */
@Component
public class PipelineHealth implements HealthIndicator {
    private final StatusService status;

    public PipelineHealth(StatusService status) { this.status = status; }

    @Override public Health health() {
        var v = status.buildStatusView();
        return (v.isConnected() ? Health.up() : Health.down())
                .withDetail("state", v.getState())
                .withDetail("scanId", String.valueOf(v.getScanId()))
                .withDetail("progress", v.getProgressLabel())
                .withDetail("idleMs", v.getIdleMs())
                .withDetail("links", v.getLinks())
                .withDetail("linkAlerts", v.isLinkAlerts())
                .withDetail("shapeRejects", v.getShapeRejects())
                .build();
    }
}
