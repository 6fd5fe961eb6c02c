package com.hivemind.core.planning;

import com.hivemind.core.model.Objective;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Expands a classified objective into its task template and wires dependencies.
 * <p>
 * Default rule: every task depends on its predecessor. When the template has a structure
 * task followed by both a styling task and a client task, the styling and client tasks
 * depend only on the structure task, so they can run side by side; the first task after
 * that parallel section then joins on every branch that nothing else depends on.
 */
@Service
public class TaskGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(TaskGraphBuilder.class);

    private static final List<String> STRUCTURE_KEYWORDS = List.of("template", "structure");
    private static final List<String> STYLING_KEYWORDS = List.of("style", "css");
    private static final List<String> CLIENT_KEYWORDS = List.of("client", "controller");

    public TaskGraph build(Objective objective, TaskAnalysis analysis) {
        List<TaskTemplates.Entry> template = TaskTemplates.forType(analysis.type());

        var tasks = new ArrayList<Task>(template.size());
        for (int i = 0; i < template.size(); i++) {
            TaskTemplates.Entry entry = template.get(i);
            String content = entry.content().replace("%s", objective.description().trim());
            tasks.add(Task.pending(taskId(objective.id(), i + 1), content, entry.priority()));
        }

        Map<String, Set<String>> dependencies = wireDependencies(tasks);
        TaskGraph graph = new TaskGraph(objective.id(), tasks, dependencies);
        log.info("Built task graph for {} with {} tasks", objective.id(), graph.size());
        return graph;
    }

    static String taskId(String objectiveId, int ordinal) {
        return "%s-T%02d".formatted(objectiveId, ordinal);
    }

    Map<String, Set<String>> wireDependencies(List<Task> tasks) {
        Map<String, Set<String>> deps = new HashMap<>();
        for (int i = 0; i < tasks.size(); i++) {
            var predecessors = new LinkedHashSet<String>();
            if (i > 0) {
                predecessors.add(tasks.get(i - 1).id());
            }
            deps.put(tasks.get(i).id(), predecessors);
        }

        // The analysis task embeds free text from the objective, so keyword search starts after it
        int structure = indexOf(tasks, STRUCTURE_KEYWORDS, 1);
        if (structure < 0) {
            return deps;
        }
        int styling = indexOf(tasks, STYLING_KEYWORDS, structure + 1);
        int client = indexOf(tasks, CLIENT_KEYWORDS, structure + 1);
        if (styling < 0 || client < 0 || styling == client) {
            return deps;
        }

        String structureId = tasks.get(structure).id();
        deps.put(tasks.get(styling).id(), new LinkedHashSet<>(Set.of(structureId)));
        deps.put(tasks.get(client).id(), new LinkedHashSet<>(Set.of(structureId)));

        int join = Math.max(styling, client) + 1;
        if (join < tasks.size()) {
            var branches = new LinkedHashSet<String>();
            for (int j = structure; j < join; j++) {
                String candidate = tasks.get(j).id();
                boolean hasDependent = false;
                for (int k = 0; k < join; k++) {
                    if (deps.get(tasks.get(k).id()).contains(candidate)) {
                        hasDependent = true;
                        break;
                    }
                }
                if (!hasDependent) {
                    branches.add(candidate);
                }
            }
            deps.put(tasks.get(join).id(), branches);
        }
        return deps;
    }

    private static int indexOf(List<Task> tasks, List<String> keywords, int from) {
        for (int i = from; i < tasks.size(); i++) {
            String content = tasks.get(i).content().toLowerCase(Locale.ROOT);
            for (String keyword : keywords) {
                if (content.contains(keyword)) {
                    return i;
                }
            }
        }
        return -1;
    }
}
