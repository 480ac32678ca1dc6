package com.flowo.live.core.model;

import java.util.Map;

/**
 * Result of an on-demand upstream liveness probe.
 */
public record UpstreamHealth(String name, Status status, String message, Map<String, Object> details) {

    public enum Status {
        HEALTHY, UNHEALTHY
    }

    public boolean isHealthy() {
        return status == Status.HEALTHY;
    }
}
