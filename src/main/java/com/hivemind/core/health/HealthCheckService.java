package com.hivemind.core.health;

import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.graph.IntakeGraph;
import com.hivemind.core.memory.PatternStore;
import com.hivemind.core.model.PatternStoreStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final IntakeGraph intakeGraph;
    private final PatternStore patternStore;
    private final HivemindProperties properties;

    public HealthCheckService(
            @Autowired(required = false) IntakeGraph intakeGraph,
            @Autowired(required = false) PatternStore patternStore,
            HivemindProperties properties) {
        this.intakeGraph = intakeGraph;
        this.patternStore = patternStore;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGraph());
        results.add(checkPatternStore());
        results.add(checkPlatform());
        return results;
    }

    private HealthStatus checkGraph() {
        if (intakeGraph != null && intakeGraph.getCompiledGraph() != null) {
            return new HealthStatus("intake-graph", HealthStatus.Status.UP,
                    "Intake graph compiled and available", Map.of());
        }
        return new HealthStatus("intake-graph", HealthStatus.Status.DOWN,
                "Intake graph not available", Map.of());
    }

    private HealthStatus checkPatternStore() {
        if (patternStore == null) {
            return new HealthStatus("pattern-store", HealthStatus.Status.DOWN,
                    "No PatternStore configured", Map.of());
        }
        try {
            PatternStoreStats stats = patternStore.stats();
            return new HealthStatus("pattern-store", HealthStatus.Status.UP,
                    "Pattern store available (" + patternStore.getClass().getSimpleName() + ")",
                    Map.of("patterns", String.valueOf(stats.patternCount()),
                            "history", String.valueOf(stats.historyCount())));
        } catch (Exception e) {
            log.warn("Pattern store health check failed: {}", e.getMessage());
            return new HealthStatus("pattern-store", HealthStatus.Status.DOWN,
                    "Pattern store error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkPlatform() {
        if (properties.isPlatformConfigured()) {
            return new HealthStatus("platform", HealthStatus.Status.UP,
                    "Platform endpoint configured", Map.of("baseUrl", properties.getPlatform().getBaseUrl()));
        }
        return new HealthStatus("platform", HealthStatus.Status.DEGRADED,
                "No platform endpoint configured, artifact deployment disabled", Map.of());
    }
}
