package loci.patchsynth.service;

import loci.patchsynth.model.WorkChunk;

import java.io.IOException;
import java.util.List;

/**
 * Runs one chunk on one CPU and blocks until it has finished.
 */
@FunctionalInterface
public interface WorkerLauncher {

    /**
     * @param chunk      the chunk to run
     * @param cpu        CPU the worker holds for its whole lifetime
     * @param workerArgs worker command line arguments
     * @return the worker outcome, successful or not
     * @throws IOException          if the worker cannot be started
     * @throws InterruptedException if interrupted while waiting for the worker
     */
    WorkerResult launch(WorkChunk chunk, int cpu, List<String> workerArgs) throws IOException, InterruptedException;
}
