package com.hivemind.core.remediation;

import com.hivemind.core.error.PermissionDeniedException;
import com.hivemind.core.model.ExecutionErrorContext;
import com.hivemind.core.model.Priority;
import com.hivemind.core.model.Task;
import com.hivemind.core.planning.TaskGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PermissionRemediatorTest {

    private PermissionRemediator remediator;
    private TaskGraph graph;
    private PermissionDeniedException denied;

    @BeforeEach
    void setUp() {
        remediator = new PermissionRemediator();
        graph = new TaskGraph("OBJ-1", List.of(
                Task.pending("OBJ-1-T01", "Deploy widget to the platform instance", Priority.HIGH)), Map.of());
        denied = new PermissionDeniedException("create", "sp_widget", "403 Forbidden");
    }

    private static ExecutionErrorContext context(String taskId, String artifactType) {
        return new ExecutionErrorContext("OBJ-1", "OBJ-1-widget-creator-02", taskId, "execute", artifactType);
    }

    @Test
    @DisplayName("first failure schedules a single automatic retry")
    void firstFailureIsAutomatic() {
        RemediationPlan plan = remediator.plan(denied, context("OBJ-1-T01", "interactive-component"), graph, false);

        assertTrue(plan.automatic());
        assertEquals("OBJ-1-R01", plan.retryTaskId());
        assertEquals(1, plan.tasks().size());
        assertEquals("Retry after permission fix: Deploy widget to the platform instance",
                plan.tasks().get(0).content());
        assertEquals(Priority.HIGH, plan.tasks().get(0).priority());
        assertTrue(plan.manualActions().isEmpty());
        assertTrue(plan.manualTaskIds().isEmpty());
    }

    @Test
    @DisplayName("repeated failure adds manual actions the retry waits for")
    void repeatedFailureNeedsManualActions() {
        RemediationPlan plan = remediator.plan(denied, context("OBJ-1-T01", "interactive-component"), graph, true);

        assertFalse(plan.automatic());
        assertEquals(3, plan.manualActions().size());
        assertTrue(plan.manualActions().contains("Retry widget creation in the global application scope"));
        assertEquals("OBJ-1-R04", plan.retryTaskId());
        assertEquals(List.of("OBJ-1-R01", "OBJ-1-R02", "OBJ-1-R03"), plan.manualTaskIds());
        assertEquals(Set.of("OBJ-1-R01", "OBJ-1-R02", "OBJ-1-R03"), plan.dependencies().get("OBJ-1-R04"));
        assertTrue(plan.tasks().stream()
                .filter(t -> !t.id().equals(plan.retryTaskId()))
                .allMatch(t -> t.priority() == Priority.CRITICAL));
    }

    @Test
    @DisplayName("auth resources add a re-authentication step")
    void authResourceAddsReauthentication() {
        var oauth = new PermissionDeniedException("read", "oauth_entity", "401 Unauthorized");

        List<String> actions = remediator.manualActions(oauth, context(null, null));

        assertEquals(3, actions.size());
        assertEquals("Re-authenticate the platform OAuth credentials", actions.get(2));
    }

    @Test
    @DisplayName("retry without a task names the operation and resource")
    void retryWithoutTask() {
        RemediationPlan plan = remediator.plan(denied, context(null, null), graph, false);

        assertEquals("Retry create on sp_widget after permission fix", plan.tasks().get(0).content());
    }

    @Test
    @DisplayName("remediation ids continue after existing remediation tasks")
    void idsContinue() {
        RemediationPlan first = remediator.plan(denied, context("OBJ-1-T01", null), graph, false);
        graph.prepend(first.tasks(), first.dependencies());

        RemediationPlan second = remediator.plan(denied, context("OBJ-1-T01", null), graph, false);

        assertEquals("OBJ-1-R02", second.retryTaskId());
    }
}
