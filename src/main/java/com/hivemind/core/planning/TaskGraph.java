package com.hivemind.core.planning;

import com.hivemind.core.error.InvalidTransitionException;
import com.hivemind.core.error.ValidationException;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Dependency-aware task DAG owned by exactly one objective.
 * <p>
 * Task order is queue order: remediation tasks are {@link #prepend prepended} so they are
 * picked up first. Every mutation validates the graph invariants: unique ids, dependencies
 * resolvable inside this graph, no cycles, and no task completes before its dependencies.
 * Not thread-safe; the coordinator serialises access.
 */
public class TaskGraph implements Serializable {

    private final String objectiveId;
    private LinkedHashMap<String, Task> tasks = new LinkedHashMap<>();
    private final HashMap<String, LinkedHashSet<String>> dependencies = new HashMap<>();
    private final LinkedHashMap<String, String> assignments = new LinkedHashMap<>();
    private final HashMap<String, String> supersededBy = new HashMap<>();
    private final LinkedHashSet<String> manualTasks = new LinkedHashSet<>();

    public TaskGraph(String objectiveId, List<Task> orderedTasks, Map<String, ? extends Collection<String>> dependencyMap) {
        this.objectiveId = objectiveId;
        for (Task task : orderedTasks) {
            if (tasks.putIfAbsent(task.id(), task) != null) {
                throw new ValidationException("Duplicate task id " + task.id() + " in objective " + objectiveId);
            }
            dependencies.put(task.id(), new LinkedHashSet<>());
        }
        addDependencies(dependencyMap);
        ensureAcyclic();
    }

    public String objectiveId() {
        return objectiveId;
    }

    public List<Task> tasks() {
        return List.copyOf(tasks.values());
    }

    /** Tasks that still count towards the objective: everything not replaced by a retry. */
    public List<Task> effectiveTasks() {
        return tasks.values().stream().filter(t -> !supersededBy.containsKey(t.id())).toList();
    }

    public int size() {
        return tasks.size();
    }

    public Optional<Task> find(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public Task task(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new ValidationException("Unknown task " + taskId + " in objective " + objectiveId);
        }
        return task;
    }

    public Set<String> dependenciesOf(String taskId) {
        task(taskId);
        return Collections.unmodifiableSet(dependencies.get(taskId));
    }

    public List<String> dependentsOf(String taskId) {
        return dependencies.entrySet().stream()
                .filter(e -> e.getValue().contains(taskId))
                .map(Map.Entry::getKey)
                .sorted(this::compareQueueOrder)
                .toList();
    }

    /** Dependencies of {@code taskId} that have not completed yet. */
    public List<Task> incompleteDependencies(String taskId) {
        return dependenciesOf(taskId).stream()
                .map(tasks::get)
                .filter(dep -> dep.status() != TaskStatus.COMPLETED)
                .toList();
    }

    public boolean dependenciesComplete(String taskId) {
        return incompleteDependencies(taskId).isEmpty();
    }

    /**
     * Non-terminal tasks whose dependencies are all completed, in queue order.
     */
    public List<Task> readyFrontier() {
        return tasks.values().stream()
                .filter(t -> !t.status().isTerminal())
                .filter(t -> dependenciesComplete(t.id()))
                .toList();
    }

    // -- Assignment --

    public Optional<String> assigneeOf(String taskId) {
        return Optional.ofNullable(assignments.get(taskId));
    }

    public Map<String, String> assignments() {
        return Collections.unmodifiableMap(assignments);
    }

    public List<Task> tasksAssignedTo(String agentId) {
        return assignments.entrySet().stream()
                .filter(e -> e.getValue().equals(agentId))
                .map(e -> tasks.get(e.getKey()))
                .sorted((a, b) -> compareQueueOrder(a.id(), b.id()))
                .toList();
    }

    public void assign(String taskId, String agentId) {
        task(taskId);
        assignments.put(taskId, agentId);
    }

    public void unassign(String taskId) {
        assignments.remove(taskId);
    }

    // -- Manual actions --

    /** Marks tasks an operator must perform; they are never assigned or dispatched to agents. */
    public void markManual(Collection<String> taskIds) {
        taskIds.forEach(this::task);
        manualTasks.addAll(taskIds);
    }

    public boolean isManual(String taskId) {
        return manualTasks.contains(taskId);
    }

    public Set<String> manualTasks() {
        return Collections.unmodifiableSet(manualTasks);
    }

    // -- Status transitions --

    public Task start(String taskId, Instant now) {
        Task current = task(taskId);
        List<Task> blocking = incompleteDependencies(taskId);
        if (!blocking.isEmpty()) {
            throw new InvalidTransitionException("Task " + taskId + " cannot start: "
                    + blocking.size() + " dependencies not completed " + blocking.stream().map(Task::id).toList());
        }
        Task started = current.start(now);
        tasks.put(taskId, started);
        return started;
    }

    public Task complete(String taskId, Instant now) {
        Task current = task(taskId);
        List<Task> blocking = incompleteDependencies(taskId);
        if (!blocking.isEmpty()) {
            throw new InvalidTransitionException("Task " + taskId + " cannot complete: "
                    + blocking.size() + " dependencies not completed " + blocking.stream().map(Task::id).toList());
        }
        Task completed = current.complete(now);
        tasks.put(taskId, completed);
        return completed;
    }

    public Task fail(String taskId, Instant now, String reason) {
        Task failed = task(taskId).fail(now, reason);
        tasks.put(taskId, failed);
        return failed;
    }

    /** Cancels every non-terminal task and returns the cancelled records. */
    public List<Task> cancelAll(Instant now) {
        var cancelled = new ArrayList<Task>();
        for (Task task : List.copyOf(tasks.values())) {
            if (!task.status().isTerminal()) {
                Task updated = task.cancel(now);
                tasks.put(task.id(), updated);
                cancelled.add(updated);
            }
        }
        return cancelled;
    }

    public boolean allCompleted() {
        List<Task> effective = effectiveTasks();
        return !effective.isEmpty() && effective.stream().allMatch(t -> t.status() == TaskStatus.COMPLETED);
    }

    public long countByStatus(TaskStatus status) {
        return effectiveTasks().stream().filter(t -> t.status() == status).count();
    }

    // -- Structural changes --

    /**
     * Inserts {@code newTasks} at the front of the queue, keeping their relative order.
     * Their dependencies may point at each other or at existing tasks.
     */
    public void prepend(List<Task> newTasks, Map<String, ? extends Collection<String>> newDependencies) {
        var reordered = new LinkedHashMap<String, Task>();
        for (Task task : newTasks) {
            if (tasks.containsKey(task.id()) || reordered.putIfAbsent(task.id(), task) != null) {
                throw new ValidationException("Duplicate task id " + task.id() + " in objective " + objectiveId);
            }
        }
        if (newDependencies != null) {
            newDependencies.forEach((taskId, deps) -> {
                if (!reordered.containsKey(taskId)) {
                    throw new ValidationException("Prepended dependencies must belong to new tasks, got " + taskId);
                }
                for (String dep : deps) {
                    if (!reordered.containsKey(dep) && !tasks.containsKey(dep)) {
                        throw new ValidationException("Task " + taskId + " depends on unknown task " + dep);
                    }
                }
            });
        }
        reordered.putAll(tasks);
        tasks = reordered;
        for (Task task : newTasks) {
            dependencies.put(task.id(), new LinkedHashSet<>());
        }
        addDependencies(newDependencies);
        ensureAcyclic();
    }

    /**
     * Replaces a failed task by {@code replacementId}: tasks that depended on the failed
     * task now depend on the replacement, and the failed task stops counting towards
     * progress.
     */
    public void supersede(String failedTaskId, String replacementId) {
        Task failed = task(failedTaskId);
        task(replacementId);
        if (failed.status() != TaskStatus.FAILED) {
            throw new InvalidTransitionException("Only failed tasks can be superseded, " + failedTaskId + " is " + failed.status());
        }
        for (LinkedHashSet<String> deps : dependencies.values()) {
            if (deps.remove(failedTaskId)) {
                deps.add(replacementId);
            }
        }
        dependencies.get(replacementId).remove(replacementId);
        supersededBy.put(failedTaskId, replacementId);
        ensureAcyclic();
    }

    public boolean isSuperseded(String taskId) {
        return supersededBy.containsKey(taskId);
    }

    private void addDependencies(Map<String, ? extends Collection<String>> dependencyMap) {
        if (dependencyMap == null) {
            return;
        }
        dependencyMap.forEach((taskId, deps) -> {
            LinkedHashSet<String> target = dependencies.get(taskId);
            if (target == null) {
                throw new ValidationException("Dependencies declared for unknown task " + taskId);
            }
            for (String dep : deps) {
                if (!tasks.containsKey(dep)) {
                    throw new ValidationException("Task " + taskId + " depends on unknown task " + dep);
                }
                target.add(dep);
            }
        });
    }

    private void ensureAcyclic() {
        Map<String, Integer> inDegree = new HashMap<>();
        tasks.keySet().forEach(id -> inDegree.put(id, dependencies.get(id).size()));
        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) ready.add(id);
        });
        int visited = 0;
        while (!ready.isEmpty()) {
            String id = ready.poll();
            visited++;
            for (String dependent : dependentsOf(id)) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (visited != tasks.size()) {
            List<String> cyclic = inDegree.entrySet().stream()
                    .filter(e -> e.getValue() > 0)
                    .map(Map.Entry::getKey)
                    .sorted(this::compareQueueOrder)
                    .toList();
            throw new ValidationException("Task graph of objective " + objectiveId + " contains a cycle through " + cyclic);
        }
    }

    private int compareQueueOrder(String a, String b) {
        return Integer.compare(indexOf(a), indexOf(b));
    }

    private int indexOf(String taskId) {
        int i = 0;
        for (String id : tasks.keySet()) {
            if (id.equals(taskId)) {
                return i;
            }
            i++;
        }
        return Integer.MAX_VALUE;
    }
}
