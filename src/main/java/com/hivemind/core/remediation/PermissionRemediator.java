package com.hivemind.core.remediation;

import com.hivemind.core.error.PermissionDeniedException;
import com.hivemind.core.model.ExecutionErrorContext;
import com.hivemind.core.model.Priority;
import com.hivemind.core.model.Task;
import com.hivemind.core.planning.TaskGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns a permission failure into remediation tasks.
 * <p>
 * The first failure for an operation/resource pair is remediated automatically: a retry task
 * goes to the front of the queue. A repeated failure for the same pair needs a human, so the
 * plan carries manual-action tasks and the retry waits for them.
 */
@Service
public class PermissionRemediator {

    private static final Logger log = LoggerFactory.getLogger(PermissionRemediator.class);

    public RemediationPlan plan(PermissionDeniedException error, ExecutionErrorContext context,
                                TaskGraph graph, boolean alreadyRemediated) {
        String objectiveId = graph.objectiveId();
        int ordinal = nextOrdinal(graph);

        String failedContent = context.taskId() != null
                ? graph.find(context.taskId()).map(Task::content).orElse(null)
                : null;
        String retryContent = failedContent != null
                ? "Retry after permission fix: " + failedContent
                : "Retry %s on %s after permission fix".formatted(error.getOperation(), error.getResource());

        if (!alreadyRemediated) {
            String retryId = remediationId(objectiveId, ordinal);
            Task retry = Task.pending(retryId, retryContent, Priority.HIGH);
            log.info("Automatic remediation for {} on {}: retry task {}", error.getOperation(), error.getResource(), retryId);
            return new RemediationPlan(true, List.of(retry), Map.of(retryId, Set.of()), retryId);
        }

        var tasks = new ArrayList<Task>();
        for (String action : manualActions(error, context)) {
            tasks.add(Task.pending(remediationId(objectiveId, ordinal++), action, Priority.CRITICAL));
        }
        String retryId = remediationId(objectiveId, ordinal);
        var manualIds = new LinkedHashSet<String>();
        tasks.forEach(t -> manualIds.add(t.id()));
        tasks.add(Task.pending(retryId, retryContent, Priority.HIGH));

        log.warn("Permission failure for {} on {} repeated; {} manual actions required",
                error.getOperation(), error.getResource(), manualIds.size());
        return new RemediationPlan(false, tasks, Map.of(retryId, manualIds), retryId);
    }

    List<String> manualActions(PermissionDeniedException error, ExecutionErrorContext context) {
        String operation = error.getOperation();
        String resource = error.getResource();
        var actions = new ArrayList<String>();
        actions.add("Verify the integration user holds a role granting %s on %s".formatted(operation, resource));
        actions.add("Review ACL rules restricting %s on %s".formatted(operation, resource));

        String artifactType = context.artifactType() != null ? context.artifactType().toLowerCase(Locale.ROOT) : "";
        if (artifactType.contains("widget") || artifactType.contains("interactive") || artifactType.contains("portal")) {
            actions.add("Retry widget creation in the global application scope");
        }
        String lowerResource = resource != null ? resource.toLowerCase(Locale.ROOT) : "";
        if (lowerResource.contains("oauth") || lowerResource.contains("auth")) {
            actions.add("Re-authenticate the platform OAuth credentials");
        }
        return actions;
    }

    private static int nextOrdinal(TaskGraph graph) {
        String prefix = graph.objectiveId() + "-R";
        return (int) graph.tasks().stream().filter(t -> t.id().startsWith(prefix)).count() + 1;
    }

    private static String remediationId(String objectiveId, int ordinal) {
        return "%s-R%02d".formatted(objectiveId, ordinal);
    }
}
