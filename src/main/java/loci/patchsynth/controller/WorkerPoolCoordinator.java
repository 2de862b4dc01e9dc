package loci.patchsynth.controller;

import loci.patchsynth.model.WorkChunk;
import loci.patchsynth.service.WorkerFailureException;
import loci.patchsynth.service.WorkerLauncher;
import loci.patchsynth.service.WorkerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Runs work chunks on a bounded pool of CPU tickets.
 *
 * <p>Every non-empty chunk gets its own launch thread. The thread takes a CPU ticket from the
 * queue (blocking only itself while all CPUs are busy), runs one worker on that CPU and puts the
 * ticket back when the worker ends, whatever the outcome. {@link #runAll} returns once every
 * launch has finished and throws if any worker failed.
 */
public class WorkerPoolCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(WorkerPoolCoordinator.class);

    private final BlockingQueue<Integer> tickets;
    private final int ticketCount;
    private final WorkerLauncher launcher;

    /**
     * @param cpus     CPU identifiers, one ticket each; must be non-empty and distinct
     * @param launcher starts one worker and waits for it
     */
    public WorkerPoolCoordinator(List<Integer> cpus, WorkerLauncher launcher) {
        if (cpus == null || cpus.isEmpty()) {
            throw new IllegalArgumentException("At least one CPU is required");
        }
        if (new LinkedHashSet<>(cpus).size() != cpus.size()) {
            throw new IllegalArgumentException("CPU list contains duplicates: " + cpus);
        }
        this.ticketCount = cpus.size();
        this.tickets = new ArrayBlockingQueue<>(ticketCount, true, cpus);
        this.launcher = launcher;
    }

    /**
     * Launches every non-empty chunk and waits for all of them.
     *
     * @param chunks     chunks to run; empty ones are skipped
     * @param argsForChunk worker arguments for a chunk
     * @return results of all launched workers, in chunk order
     * @throws WorkerFailureException if any worker exited nonzero, timed out or could not start
     * @throws InterruptedException   if interrupted while waiting for the workers
     */
    public List<WorkerResult> runAll(List<WorkChunk> chunks, Function<WorkChunk, List<String>> argsForChunk)
            throws WorkerFailureException, InterruptedException {

        List<WorkChunk> runnable = new ArrayList<>();
        for (WorkChunk chunk : chunks) {
            if (chunk.isEmpty()) {
                logger.info("Skipping empty {}", chunk);
            } else {
                runnable.add(chunk);
            }
        }
        if (runnable.isEmpty()) {
            logger.warn("No work to run");
            return List.of();
        }

        logger.info("Launching {} worker(s) on {} CPU(s)", runnable.size(), ticketCount);
        ExecutorService pool = Executors.newFixedThreadPool(runnable.size(), r -> {
            Thread t = new Thread(r, "worker-launch");
            t.setDaemon(true);
            return t;
        });

        List<Future<WorkerResult>> futures = new ArrayList<>();
        try {
            for (WorkChunk chunk : runnable) {
                futures.add(pool.submit(() -> runOnTicket(chunk, argsForChunk)));
            }

            // Barrier: every launch is joined before failures are judged
            List<WorkerResult> results = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    WorkChunk chunk = runnable.get(i);
                    logger.error("Launch thread for {} failed unexpectedly", chunk, e.getCause());
                    results.add(WorkerResult.launchFailure(chunk.getSlotIndex(), WorkerResult.NO_CPU, e.getCause()));
                }
            }
            escalateFailures(results);
            logger.info("All {} worker(s) finished successfully", results.size());
            return results;
        } catch (InterruptedException e) {
            pool.shutdownNow();
            throw e;
        } finally {
            pool.shutdown();
        }
    }

    private WorkerResult runOnTicket(WorkChunk chunk, Function<WorkChunk, List<String>> argsForChunk)
            throws InterruptedException {
        List<String> args;
        try {
            args = argsForChunk.apply(chunk);
        } catch (RuntimeException e) {
            logger.error("Could not build worker arguments for {}", chunk, e);
            return WorkerResult.launchFailure(chunk.getSlotIndex(), WorkerResult.NO_CPU, e);
        }
        int cpu = tickets.take();
        logger.info("Starting {} on CPU {}", chunk, cpu);
        try {
            return launcher.launch(chunk, cpu, args);
        } catch (IOException | RuntimeException e) {
            logger.error("Could not launch {} on CPU {}", chunk, cpu, e);
            return WorkerResult.launchFailure(chunk.getSlotIndex(), cpu, e);
        } finally {
            tickets.offer(cpu);
            logger.debug("CPU {} returned to the pool", cpu);
        }
    }

    private static void escalateFailures(List<WorkerResult> results) throws WorkerFailureException {
        List<WorkerResult> failures = new ArrayList<>();
        for (WorkerResult result : results) {
            if (!result.succeeded()) {
                failures.add(result);
                logger.error("Worker {}", result.summary());
                logger.error("Worker stdout (chunk {}):\n{}", result.slotIndex(), result.stdout());
                logger.error("Worker stderr (chunk {}):\n{}", result.slotIndex(), result.stderr());
            }
        }
        if (!failures.isEmpty()) {
            throw new WorkerFailureException(failures);
        }
    }

    /**
     * @return number of CPU tickets currently idle
     */
    public int availableTickets() {
        return tickets.size();
    }

    public int getTicketCount() {
        return ticketCount;
    }
}
