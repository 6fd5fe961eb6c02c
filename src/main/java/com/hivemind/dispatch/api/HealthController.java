package com.hivemind.dispatch.api;

import com.hivemind.core.engine.QueenCoordinator;
import com.hivemind.core.health.HealthCheckService;
import com.hivemind.core.health.HealthStatus;
import com.hivemind.core.model.CoordinatorStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for system health and coordinator status.
 */
@RestController
@RequestMapping("/api/v1")
public class HealthController {

    private final HealthCheckService healthCheckService;
    private final QueenCoordinator coordinator;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService,
                            QueenCoordinator coordinator) {
        this.healthCheckService = healthCheckService;
        this.coordinator = coordinator;
    }

    /**
     * GET /api/v1/health: 503 when a component is DOWN, otherwise 200 with UP or DEGRADED.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> result = new LinkedHashMap<>();

        if (healthCheckService == null) {
            result.put("status", "DOWN");
            result.put("components", Map.of());
            return ResponseEntity.status(503).body(result);
        }

        HealthStatus.Status overall = HealthStatus.Status.UP;
        Map<String, Object> components = new LinkedHashMap<>();
        for (var check : healthCheckService.checkAll()) {
            Map<String, Object> componentInfo = new LinkedHashMap<>();
            componentInfo.put("status", check.status().name());
            componentInfo.put("detail", check.detail());
            if (!check.metadata().isEmpty()) {
                componentInfo.put("metadata", check.metadata());
            }
            components.put(check.component(), componentInfo);
            overall = worse(overall, check.status());
        }

        result.put("status", overall.name());
        result.put("components", components);

        return overall == HealthStatus.Status.DOWN ? ResponseEntity.status(503).body(result)
                                                   : ResponseEntity.ok(result);
    }

    private static HealthStatus.Status worse(HealthStatus.Status a, HealthStatus.Status b) {
        if (a == HealthStatus.Status.DOWN || b == HealthStatus.Status.DOWN) {
            return HealthStatus.Status.DOWN;
        }
        if (a == HealthStatus.Status.DEGRADED || b == HealthStatus.Status.DEGRADED) {
            return HealthStatus.Status.DEGRADED;
        }
        return HealthStatus.Status.UP;
    }

    @GetMapping("/status")
    public CoordinatorStatus status() {
        return coordinator.getStatus();
    }
}
