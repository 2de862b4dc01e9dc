package loci.patchsynth.controller;

import loci.patchsynth.model.BalancingPolicy;
import loci.patchsynth.model.PairTask;
import loci.patchsynth.model.WorkChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Partitions the planned work over a fixed number of worker slots.
 *
 * <h3>Quota splitting</h3>
 * <ol>
 *   <li>Each slot gets a target of {@code total / slots}, the first {@code total % slots} slots one more.</li>
 *   <li>Slots are filled in order by taking the largest pending task (ties keep planning order).</li>
 *   <li>A task that fits the slot's remaining target is assigned whole; otherwise exactly the remaining
 *       target is assigned and the rest goes back to the pending tasks for later slots.</li>
 * </ol>
 * Every slot ends exactly on its target. A task may be spread over several slots.
 *
 * <h3>Greedy</h3>
 * Tasks, largest first, go whole to the currently least loaded slot. Balance is only as good as the
 * task granularity; use it when tasks are small relative to {@code total / slots}.
 */
public class LoadBalancer {
    private static final Logger logger = LoggerFactory.getLogger(LoadBalancer.class);

    private LoadBalancer() {}

    /**
     * @param total total units to distribute
     * @param slots number of worker slots
     * @return per-slot targets summing to {@code total}, differing by at most one
     */
    public static int[] slotTargets(int total, int slots) {
        if (slots <= 0) {
            throw new IllegalArgumentException("Need at least one worker slot, got " + slots);
        }
        if (total < 0) {
            throw new IllegalArgumentException("Total must not be negative, got " + total);
        }
        int[] targets = new int[slots];
        int base = total / slots;
        int remainder = total % slots;
        for (int s = 0; s < slots; s++) {
            targets[s] = base + (s < remainder ? 1 : 0);
        }
        return targets;
    }

    /**
     * Splits a plain patch count over the slots (generalized and targeted-filter modes).
     *
     * @return one chunk per slot; slots with nothing to do get an empty chunk
     */
    public static List<WorkChunk> splitCount(int total, int slots) {
        int[] targets = slotTargets(total, slots);
        List<WorkChunk> chunks = new ArrayList<>(slots);
        for (int s = 0; s < slots; s++) {
            chunks.add(WorkChunk.ofCount(s, targets[s]));
        }
        logger.info("Split {} patches over {} slots: {}", total, slots, Arrays.toString(targets));
        return chunks;
    }

    /**
     * Distributes pair tasks over the slots.
     *
     * @param tasks  planned tasks
     * @param slots  number of worker slots
     * @param policy balancing policy
     * @return one chunk per slot, in slot order
     */
    public static List<WorkChunk> balance(List<PairTask> tasks, int slots, BalancingPolicy policy) {
        return switch (policy) {
            case QUOTA_SPLIT -> balanceQuotaSplit(tasks, slots);
            case GREEDY -> balanceGreedy(tasks, slots);
        };
    }

    static List<WorkChunk> balanceQuotaSplit(List<PairTask> tasks, int slots) {
        int total = totalOf(tasks);
        int[] targets = slotTargets(total, slots);

        // Pending tasks keep their planning position so ties and remainders stay deterministic
        PriorityQueue<Pending> pending = new PriorityQueue<>(
                Comparator.comparingInt((Pending p) -> p.task.count()).reversed()
                        .thenComparingInt(p -> p.order));
        for (int i = 0; i < tasks.size(); i++) {
            pending.add(new Pending(tasks.get(i), i));
        }

        List<WorkChunk> chunks = new ArrayList<>(slots);
        for (int s = 0; s < slots; s++) {
            List<PairTask> assigned = new ArrayList<>();
            int remaining = targets[s];
            while (remaining > 0 && !pending.isEmpty()) {
                Pending next = pending.poll();
                int count = next.task.count();
                if (count <= remaining) {
                    assigned.add(next.task);
                    remaining -= count;
                } else {
                    assigned.add(next.task.withCount(remaining));
                    pending.add(new Pending(next.task.withCount(count - remaining), next.order));
                    logger.debug("Split task {} at slot {}: {} here, {} deferred",
                            next.task, s, remaining, count - remaining);
                    remaining = 0;
                }
            }
            chunks.add(WorkChunk.ofTasks(s, assigned));
        }

        if (!pending.isEmpty()) {
            // Targets sum to the total, so this means a task count changed underneath us
            throw new IllegalStateException("Unassigned tasks after balancing: " + pending.size());
        }
        logChunks("quota-split", chunks);
        return chunks;
    }

    static List<WorkChunk> balanceGreedy(List<PairTask> tasks, int slots) {
        if (slots <= 0) {
            throw new IllegalArgumentException("Need at least one worker slot, got " + slots);
        }
        List<PairTask> sorted = new ArrayList<>(tasks);
        // List.sort is stable, so equal counts keep planning order
        sorted.sort(Comparator.comparingInt(PairTask::count).reversed());

        int[] loads = new int[slots];
        List<List<PairTask>> assigned = new ArrayList<>(slots);
        for (int s = 0; s < slots; s++) {
            assigned.add(new ArrayList<>());
        }
        for (PairTask task : sorted) {
            int target = 0;
            for (int s = 1; s < slots; s++) {
                if (loads[s] < loads[target]) target = s;
            }
            assigned.get(target).add(task);
            loads[target] += task.count();
        }

        List<WorkChunk> chunks = new ArrayList<>(slots);
        for (int s = 0; s < slots; s++) {
            chunks.add(WorkChunk.ofTasks(s, assigned.get(s)));
        }
        logChunks("greedy", chunks);
        return chunks;
    }

    private static int totalOf(List<PairTask> tasks) {
        long total = 0;
        for (PairTask task : tasks) {
            total += task.count();
        }
        if (total > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Requested total of " + total + " patches is too large");
        }
        return (int) total;
    }

    private static void logChunks(String policy, List<WorkChunk> chunks) {
        if (logger.isInfoEnabled()) {
            int[] loads = chunks.stream().mapToInt(WorkChunk::totalCount).toArray();
            logger.info("Balanced ({}) over {} slots, loads {}", policy, chunks.size(), Arrays.toString(loads));
        }
        for (WorkChunk chunk : chunks) {
            logger.debug("  {}", chunk);
        }
    }

    private record Pending(PairTask task, int order) { }
}
