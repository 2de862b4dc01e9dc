package loci.patchsynth.model;

import java.util.Collections;
import java.util.List;

/**
 * The work assigned to one worker slot: either a list of pair tasks (matrix mode) or a plain
 * patch count (generalized and targeted-filter modes).
 *
 * <p>An empty chunk is never launched.
 */
public final class WorkChunk {

    private final int slotIndex;
    private final List<PairTask> tasks;
    private final int patchCount;

    private WorkChunk(int slotIndex, List<PairTask> tasks, int patchCount) {
        this.slotIndex = slotIndex;
        this.tasks = tasks;
        this.patchCount = patchCount;
    }

    /**
     * @param slotIndex index of the worker slot, also used to derive the worker seed
     * @param tasks     tasks of this slot, possibly empty
     * @return a matrix-mode chunk
     */
    public static WorkChunk ofTasks(int slotIndex, List<PairTask> tasks) {
        return new WorkChunk(slotIndex, List.copyOf(tasks), 0);
    }

    /**
     * @param slotIndex  index of the worker slot
     * @param patchCount number of composites, zero for an empty chunk
     * @return a count chunk for the non-matrix modes
     */
    public static WorkChunk ofCount(int slotIndex, int patchCount) {
        if (patchCount < 0) {
            throw new IllegalArgumentException("Patch count must not be negative: " + patchCount);
        }
        return new WorkChunk(slotIndex, null, patchCount);
    }

    public int getSlotIndex() {
        return slotIndex;
    }

    /**
     * @return true if this chunk carries pair tasks rather than a count
     */
    public boolean hasTasks() {
        return tasks != null;
    }

    public List<PairTask> getTasks() {
        return tasks == null ? Collections.emptyList() : tasks;
    }

    public int getPatchCount() {
        return patchCount;
    }

    /**
     * @return number of composites this chunk asks for
     */
    public int totalCount() {
        if (tasks == null) {
            return patchCount;
        }
        int sum = 0;
        for (PairTask task : tasks) {
            sum += task.count();
        }
        return sum;
    }

    public boolean isEmpty() {
        return totalCount() == 0;
    }

    @Override
    public String toString() {
        return hasTasks()
                ? String.format("chunk[%d] %s (%d patches)", slotIndex, tasks, totalCount())
                : String.format("chunk[%d] %d patches", slotIndex, patchCount);
    }
}
