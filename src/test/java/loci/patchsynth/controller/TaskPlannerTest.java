package loci.patchsynth.controller;

import loci.patchsynth.model.PairTask;
import loci.patchsynth.utilities.InvalidConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TaskPlanner.
 */
class TaskPlannerTest {

    private static List<List<Object>> matrix(Object[]... rows) {
        return Arrays.stream(rows).map(Arrays::asList).toList();
    }

    // ==================== Upper Triangle Scan ====================

    @Test
    @DisplayName("Only positive strict upper-triangle entries become tasks, in scan order")
    void testUpperTriangleOnly() {
        List<List<Object>> m = matrix(
                new Object[] {7, 10, 0},
                new Object[] {4, 9, 5},
                new Object[] {3, 8, 6});

        List<PairTask> tasks = TaskPlanner.planPairTasks(m, null);

        assertEquals(List.of(new PairTask(0, 1, 10), new PairTask(1, 2, 5)), tasks);
    }

    @Test
    @DisplayName("Class labels replace positional indices")
    void testClassLabels() {
        List<List<Object>> m = matrix(
                new Object[] {0, 2, 3},
                new Object[] {0, 0, 4},
                new Object[] {0, 0, 0});

        List<PairTask> tasks = TaskPlanner.planPairTasks(m, List.of(5, 8, 11));

        assertEquals(List.of(new PairTask(5, 8, 2), new PairTask(5, 11, 3), new PairTask(8, 11, 4)), tasks);
    }

    @Test
    @DisplayName("Fractional counts are truncated, entries truncating to zero are dropped")
    void testTruncation() {
        List<List<Object>> m = matrix(
                new Object[] {0, 2.9, 0.5},
                new Object[] {0, 0, -3},
                new Object[] {0, 0, 0});

        List<PairTask> tasks = TaskPlanner.planPairTasks(m, null);

        assertEquals(List.of(new PairTask(0, 1, 2)), tasks);
    }

    @Test
    @DisplayName("Non-numeric entries are ignored")
    void testNonNumericIgnored() {
        List<List<Object>> m = matrix(
                new Object[] {0, "x", null},
                new Object[] {0, 0, 1},
                new Object[] {0, 0, 0});

        assertEquals(List.of(new PairTask(1, 2, 1)), TaskPlanner.planPairTasks(m, null));
    }

    @Test
    @DisplayName("No pair appears twice or reversed")
    void testNoDuplicatePairs() {
        List<List<Object>> m = matrix(
                new Object[] {1, 1, 1, 1},
                new Object[] {1, 1, 1, 1},
                new Object[] {1, 1, 1, 1},
                new Object[] {1, 1, 1, 1});

        List<PairTask> tasks = TaskPlanner.planPairTasks(m, null);

        assertEquals(6, tasks.size());
        assertEquals(6, tasks.stream().map(PairTask::pair).distinct().count());
        assertTrue(tasks.stream().allMatch(t -> t.classA() < t.classB()));
    }

    // ==================== Invalid Input ====================

    @Test
    @DisplayName("A non-square matrix is a configuration error")
    void testNonSquareRejected() {
        List<List<Object>> m = matrix(
                new Object[] {0, 1},
                new Object[] {0, 0, 0});

        assertThrows(InvalidConfigurationException.class, () -> TaskPlanner.planPairTasks(m, null));
    }

    @Test
    @DisplayName("Class labels must match the matrix size")
    void testClassCountMismatch() {
        List<List<Object>> m = matrix(
                new Object[] {0, 1},
                new Object[] {0, 0});

        assertThrows(InvalidConfigurationException.class, () -> TaskPlanner.planPairTasks(m, List.of(1, 2, 3)));
    }

    @Test
    @DisplayName("An empty matrix is a configuration error")
    void testEmptyMatrix() {
        assertThrows(InvalidConfigurationException.class, () -> TaskPlanner.planPairTasks(List.of(), null));
    }
}
