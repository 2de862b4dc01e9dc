package loci.patchsynth.service;

/**
 * Outcome of one worker process.
 *
 * @param slotIndex slot of the chunk the worker ran
 * @param cpu       CPU the worker was pinned to, {@link #NO_CPU} if none was taken
 * @param exitCode  process exit code, -1 if the process could not be started
 * @param timedOut  true if the worker was killed after the configured timeout
 * @param stdout    captured standard output
 * @param stderr    captured standard error
 */
public record WorkerResult(int slotIndex, int cpu, int exitCode, boolean timedOut, String stdout, String stderr) {

    public static final int LAUNCH_FAILED = -1;
    /** CPU of a launch that failed before a ticket was taken. */
    public static final int NO_CPU = -1;

    public boolean succeeded() {
        return exitCode == 0 && !timedOut;
    }

    /**
     * @return a result for a worker that never started
     */
    public static WorkerResult launchFailure(int slotIndex, int cpu, Throwable cause) {
        return new WorkerResult(slotIndex, cpu, LAUNCH_FAILED, false, "", String.valueOf(cause));
    }

    /**
     * @return a one-line description for log and exception messages
     */
    public String summary() {
        if (exitCode == LAUNCH_FAILED) {
            return cpu == NO_CPU
                    ? String.format("chunk %d could not be launched", slotIndex)
                    : String.format("chunk %d on CPU %d could not be launched", slotIndex, cpu);
        }
        return String.format("chunk %d on CPU %d %s (exit %d)", slotIndex, cpu,
                timedOut ? "timed out" : "failed", exitCode);
    }
}
