package loci.patchsynth.service;

import loci.patchsynth.utilities.MinorFunctions;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception thrown when one or more worker processes of a run did not complete successfully.
 * Any failed worker makes the whole run fail, since its share of the patches is missing.
 */
public class WorkerFailureException extends IOException {

    /** Lines of each worker's stderr quoted in the message; the full output is logged. */
    static final int STDERR_EXCERPT_LINES = 3;

    private final List<WorkerResult> failures;

    /**
     * @param failures results of every failed worker, at least one
     */
    public WorkerFailureException(List<WorkerResult> failures) {
        super(failures.size() + " worker(s) failed: "
                + failures.stream().map(WorkerFailureException::describe).collect(Collectors.joining("; ")));
        this.failures = List.copyOf(failures);
    }

    private static String describe(WorkerResult result) {
        String stderr = result.stderr() == null ? "" : result.stderr().strip();
        return stderr.isEmpty()
                ? result.summary()
                : result.summary() + ": " + MinorFunctions.firstLines(stderr, STDERR_EXCERPT_LINES);
    }

    public List<WorkerResult> getFailures() {
        return failures;
    }
}
