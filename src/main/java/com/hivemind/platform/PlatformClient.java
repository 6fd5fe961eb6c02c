package com.hivemind.platform;

import com.fasterxml.jackson.databind.JsonNode;
import com.hivemind.core.error.PermissionDeniedException;
import com.hivemind.core.error.PlatformException;

import java.util.Map;
import java.util.Optional;

/**
 * Record-level access to the target platform's table API.
 * <p>
 * Every method throws {@link PermissionDeniedException} when the platform refuses the call
 * and {@link PlatformException} for any other failure.
 */
public interface PlatformClient {

    /**
     * @return the id the platform assigned to the new record
     */
    String createRecord(String table, Map<String, ?> fields);

    Optional<JsonNode> getRecord(String table, String recordId);

    JsonNode updateRecord(String table, String recordId, Map<String, ?> fields);

    /** Whether an endpoint and credentials are configured. */
    boolean isConfigured();
}
