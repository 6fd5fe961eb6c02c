package com.hivemind.core.planning;

import com.hivemind.core.error.InvalidTransitionException;
import com.hivemind.core.error.ValidationException;
import com.hivemind.core.model.Priority;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskGraphTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private TaskGraph graph;

    /** a -> b, a -> c, (b, c) -> d */
    @BeforeEach
    void setUp() {
        graph = new TaskGraph("OBJ-1",
                List.of(task("a"), task("b"), task("c"), task("d")),
                Map.of("b", Set.of("a"), "c", Set.of("a"), "d", Set.of("b", "c")));
    }

    private static Task task(String id) {
        return Task.pending(id, "Task " + id, Priority.MEDIUM);
    }

    private void finish(String id) {
        graph.start(id, NOW);
        graph.complete(id, NOW);
    }

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("rejects a dependency cycle")
        void rejectsCycle() {
            var ex = assertThrows(ValidationException.class, () -> new TaskGraph("OBJ-1",
                    List.of(task("a"), task("b"), task("c")),
                    Map.of("a", Set.of("c"), "b", Set.of("a"), "c", Set.of("b"))));
            assertTrue(ex.getMessage().contains("cycle"));
        }

        @Test
        @DisplayName("rejects a self dependency")
        void rejectsSelfDependency() {
            assertThrows(ValidationException.class, () -> new TaskGraph("OBJ-1",
                    List.of(task("a")), Map.of("a", Set.of("a"))));
        }

        @Test
        @DisplayName("rejects unknown dependencies")
        void rejectsUnknownDependency() {
            assertThrows(ValidationException.class, () -> new TaskGraph("OBJ-1",
                    List.of(task("a")), Map.of("a", Set.of("zz"))));
        }

        @Test
        @DisplayName("rejects duplicate ids")
        void rejectsDuplicateIds() {
            assertThrows(ValidationException.class, () -> new TaskGraph("OBJ-1",
                    List.of(task("a"), task("a")), Map.of()));
        }
    }

    @Nested
    @DisplayName("transitions")
    class Transitions {

        @Test
        @DisplayName("a task cannot start before its dependencies")
        void startRequiresDependencies() {
            var ex = assertThrows(InvalidTransitionException.class, () -> graph.start("b", NOW));

            assertTrue(ex.getMessage().contains("[a]"));
            assertEquals(TaskStatus.PENDING, graph.task("b").status());
            finish("a");
            assertEquals(TaskStatus.IN_PROGRESS, graph.start("b", NOW).status());
        }

        @Test
        @DisplayName("pending tasks cannot complete directly")
        void pendingCannotComplete() {
            assertThrows(InvalidTransitionException.class, () -> graph.complete("a", NOW));
        }

        @Test
        @DisplayName("ready frontier follows completions")
        void readyFrontier() {
            assertEquals(List.of("a"), ids(graph.readyFrontier()));
            finish("a");
            assertEquals(List.of("b", "c"), ids(graph.readyFrontier()));
            finish("b");
            finish("c");
            assertEquals(List.of("d"), ids(graph.readyFrontier()));
        }

        @Test
        @DisplayName("cancelAll cancels only non-terminal tasks")
        void cancelAll() {
            finish("a");
            List<Task> cancelled = graph.cancelAll(NOW);
            assertEquals(List.of("b", "c", "d"), ids(cancelled));
            assertEquals(TaskStatus.COMPLETED, graph.task("a").status());
            assertTrue(graph.cancelAll(NOW).isEmpty());
        }

        @Test
        @DisplayName("allCompleted requires every task")
        void allCompleted() {
            finish("a");
            finish("b");
            finish("c");
            assertFalse(graph.allCompleted());
            finish("d");
            assertTrue(graph.allCompleted());
        }
    }

    @Nested
    @DisplayName("structural changes")
    class StructuralChanges {

        @Test
        @DisplayName("prepended tasks go to the front of the queue")
        void prependGoesFirst() {
            graph.prepend(List.of(task("r1"), task("r2")), Map.of("r2", Set.of("r1")));

            assertEquals(List.of("r1", "r2", "a", "b", "c", "d"), ids(graph.tasks()));
            assertEquals(Set.of("r1"), graph.dependenciesOf("r2"));
            assertEquals(List.of("r1", "a"), ids(graph.readyFrontier()));
        }

        @Test
        @DisplayName("prepend rejects ids already in the graph")
        void prependRejectsDuplicates() {
            assertThrows(ValidationException.class, () -> graph.prepend(List.of(task("a")), Map.of()));
        }

        @Test
        @DisplayName("supersede moves dependents onto the replacement")
        void supersedeRewiresDependents() {
            finish("a");
            graph.start("b", NOW);
            graph.fail("b", NOW, "boom");
            graph.prepend(List.of(task("b2")), Map.of("b2", Set.of("a")));

            graph.supersede("b", "b2");

            assertTrue(graph.isSuperseded("b"));
            assertEquals(Set.of("b2", "c"), graph.dependenciesOf("d"));
            assertFalse(graph.effectiveTasks().stream().anyMatch(t -> t.id().equals("b")));
            assertEquals(4, graph.effectiveTasks().size());
        }

        @Test
        @DisplayName("only failed tasks can be superseded")
        void supersedeRequiresFailure() {
            graph.prepend(List.of(task("b2")), Map.of());
            assertThrows(InvalidTransitionException.class, () -> graph.supersede("b", "b2"));
        }

        @Test
        @DisplayName("superseded tasks do not block completion")
        void supersededIgnoredForCompletion() {
            finish("a");
            graph.start("b", NOW);
            graph.fail("b", NOW, "boom");
            graph.prepend(List.of(task("b2")), Map.of("b2", Set.of("a")));
            graph.supersede("b", "b2");

            finish("b2");
            finish("c");
            finish("d");

            assertTrue(graph.allCompleted());
        }
    }

    @Nested
    @DisplayName("manual actions")
    class ManualActions {

        @Test
        @DisplayName("marked tasks are reported as manual")
        void markManual() {
            graph.prepend(List.of(task("m1"), task("r1")), Map.of("r1", Set.of("m1")));

            graph.markManual(List.of("m1"));

            assertTrue(graph.isManual("m1"));
            assertFalse(graph.isManual("r1"));
            assertEquals(Set.of("m1"), graph.manualTasks());
        }

        @Test
        @DisplayName("unknown ids cannot be marked")
        void markUnknown() {
            assertThrows(ValidationException.class, () -> graph.markManual(List.of("zz")));
            assertTrue(graph.manualTasks().isEmpty());
        }
    }

    @Test
    @DisplayName("random graphs and operations never run a task ahead of its dependencies")
    void randomOperationsKeepInvariants() {
        var random = new Random(42);
        for (int round = 0; round < 200; round++) {
            graph = randomGraph(random);
            int retries = 0;
            for (int step = 0; step < 40; step++) {
                List<Task> all = graph.tasks();
                Task pick = all.get(random.nextInt(all.size()));
                try {
                    switch (random.nextInt(4)) {
                        case 0 -> graph.start(pick.id(), NOW);
                        case 1 -> graph.complete(pick.id(), NOW);
                        case 2 -> graph.fail(pick.id(), NOW, "random");
                        default -> {
                            if (pick.status() == TaskStatus.FAILED && !graph.isSuperseded(pick.id())) {
                                String retry = "retry" + retries++;
                                graph.prepend(List.of(task(retry)), Map.of(retry, Set.copyOf(graph.dependenciesOf(pick.id()))));
                                graph.supersede(pick.id(), retry);
                            }
                        }
                    }
                } catch (InvalidTransitionException expected) {
                    // illegal moves are rejected without changing state
                }
                for (Task t : graph.tasks()) {
                    if (t.status() == TaskStatus.COMPLETED || t.status() == TaskStatus.IN_PROGRESS) {
                        assertTrue(graph.dependenciesComplete(t.id()),
                                "round " + round + ": " + t.id() + " is " + t.status() + " before its dependencies");
                    }
                }
            }
        }
    }

    /** Up to ten tasks in shuffled queue order; edges only point from lower to higher index, so no cycles. */
    private static TaskGraph randomGraph(Random random) {
        int size = 2 + random.nextInt(9);
        var ordered = new ArrayList<Task>();
        var deps = new HashMap<String, Set<String>>();
        for (int i = 0; i < size; i++) {
            ordered.add(task("t" + i));
            var own = new HashSet<String>();
            for (int j = 0; j < i; j++) {
                if (random.nextInt(10) < 3) {
                    own.add("t" + j);
                }
            }
            deps.put("t" + i, own);
        }
        Collections.shuffle(ordered, random);
        return new TaskGraph("OBJ-1", ordered, deps);
    }

    private static List<String> ids(List<Task> tasks) {
        return tasks.stream().map(Task::id).toList();
    }
}
