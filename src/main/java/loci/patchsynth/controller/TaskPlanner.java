package loci.patchsynth.controller;

import loci.patchsynth.model.PairTask;
import loci.patchsynth.model.SynthesisMode;
import loci.patchsynth.utilities.InvalidConfigurationException;
import loci.patchsynth.utilities.SynthesisConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the requested workload into pair tasks (matrix mode) or an aggregate patch count.
 *
 * <p>The matrix is read row by row over its strict upper triangle only. An entry {@code M[i][j]}
 * with {@code j > i} becomes the task {@code (classes[i], classes[j], (int) M[i][j])} when it is a
 * number whose truncated value is positive. The diagonal and the lower triangle are never read, so
 * each unordered pair appears at most once and always in row-before-column order.
 */
public class TaskPlanner {
    private static final Logger logger = LoggerFactory.getLogger(TaskPlanner.class);

    private TaskPlanner() {}

    /**
     * @param matrix  square matrix of requested counts
     * @param classes label of each row/column, or null for positional indices
     * @return tasks in scan order
     * @throws InvalidConfigurationException if the matrix is not square or the labels do not fit it
     */
    public static List<PairTask> planPairTasks(List<? extends List<?>> matrix, List<Integer> classes) {
        if (matrix == null || matrix.isEmpty()) {
            throw new InvalidConfigurationException("Pair matrix is empty");
        }
        int n = matrix.size();
        for (int i = 0; i < n; i++) {
            List<?> row = matrix.get(i);
            if (row == null || row.size() != n) {
                throw new InvalidConfigurationException(String.format(
                        "Pair matrix must be square: row %d has %d entries, expected %d",
                        i, row == null ? 0 : row.size(), n));
            }
        }
        if (classes != null && classes.size() != n) {
            throw new InvalidConfigurationException(String.format(
                    "%d class labels given for a %dx%d matrix", classes.size(), n, n));
        }

        List<PairTask> tasks = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            List<?> row = matrix.get(i);
            for (int j = i + 1; j < n; j++) {
                Object entry = row.get(j);
                if (!(entry instanceof Number number) || !(number.doubleValue() > 0)) {
                    continue;
                }
                int count = number.intValue();
                if (count <= 0) {
                    logger.warn("Dropping matrix entry [{}][{}] = {}: truncates to zero", i, j, entry);
                    continue;
                }
                int a = classes == null ? i : classes.get(i);
                int b = classes == null ? j : classes.get(j);
                tasks.add(new PairTask(a, b, count));
            }
        }

        logger.info("Planned {} pair tasks totalling {} patches", tasks.size(),
                tasks.stream().mapToLong(PairTask::count).sum());
        return tasks;
    }

    /**
     * @return tasks for a matrix-mode configuration
     */
    public static List<PairTask> planPairTasks(SynthesisConfig config) {
        if (config.getMode() != SynthesisMode.TARGETED_MATRIX) {
            throw new IllegalArgumentException("Pair tasks are only planned in targeted_matrix mode, not " + config.getMode());
        }
        return planPairTasks(config.getMatrix(), config.getClasses());
    }

    /**
     * @return the aggregate patch count for the non-matrix modes
     */
    public static int planPatchCount(SynthesisConfig config) {
        if (config.getMode() == SynthesisMode.TARGETED_MATRIX) {
            throw new IllegalArgumentException("targeted_matrix mode is planned as pair tasks");
        }
        return config.getNPatches();
    }
}
