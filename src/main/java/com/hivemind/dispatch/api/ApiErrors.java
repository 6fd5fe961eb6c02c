package com.hivemind.dispatch.api;

import com.hivemind.core.error.HivemindException;
import com.hivemind.core.error.InvalidTransitionException;
import com.hivemind.core.error.ObjectiveNotFoundException;
import com.hivemind.core.error.ValidationException;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/**
 * Maps coordinator exceptions to HTTP responses: validation 400, unknown objective 404,
 * illegal state change 409, anything else 500.
 */
final class ApiErrors {

    private ApiErrors() {}

    static ResponseEntity<Map<String, Object>> toResponse(HivemindException e) {
        int status;
        if (e instanceof ValidationException) {
            status = 400;
        } else if (e instanceof ObjectiveNotFoundException) {
            status = 404;
        } else if (e instanceof InvalidTransitionException) {
            status = 409;
        } else {
            status = 500;
        }
        return ResponseEntity.status(status).body(Map.of(
                "error", e.getClass().getSimpleName(),
                "message", String.valueOf(e.getMessage())));
    }

    static ResponseEntity<Map<String, Object>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", "ValidationException", "message", message));
    }
}
