package com.hivemind.dispatch.api;

import com.hivemind.core.engine.QueenCoordinator;
import com.hivemind.core.error.HivemindException;
import com.hivemind.core.model.DecisionRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for ad-hoc decisions.
 */
@RestController
@RequestMapping("/api/v1/decisions")
public class DecisionController {

    private final QueenCoordinator coordinator;

    public DecisionController(QueenCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping
    public ResponseEntity<?> decide(@RequestBody DecisionRequestBody body) {
        if (body.options() == null || body.options().isEmpty()) {
            return ApiErrors.badRequest("At least one option is required");
        }
        try {
            return ResponseEntity.ok(coordinator.makeDecision(new DecisionRequest(
                    body.objectiveId(), body.objective(), body.currentState(), body.options())));
        } catch (HivemindException e) {
            return ApiErrors.toResponse(e);
        }
    }
}
