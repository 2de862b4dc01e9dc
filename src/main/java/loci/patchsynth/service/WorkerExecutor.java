package loci.patchsynth.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * WorkerExecutor
 *
 * <p>Runs worker processes:
 *   - Starts the process from a prepared command line.
 *   - Captures stdout/stderr on two reader threads so neither pipe can fill up and stall the worker.
 *   - Applies an optional timeout, first asking the worker to stop, then killing it.
 *   - Returns a structured ExecResult for callers to inspect exit codes and output.
 */
public class WorkerExecutor {
    private static final Logger logger = LoggerFactory.getLogger(WorkerExecutor.class);

    /** Time a worker gets to shut down after being asked to stop. */
    static final long GRACE_PERIOD_SECONDS = 10;

    /** Result of a worker process run. */
    public record ExecResult(
            int            exitCode,
            boolean        timedOut,
            String         stdout,
            String         stderr
    ) { }

    private WorkerExecutor() {}

    /**
     * Runs a command to completion.
     *
     * @param cmd        full command line
     * @param timeoutSec maximum run time, 0 for none
     * @param label      short label prefixed to debug output, e.g. "cpu 3"
     * @return exit code, timeout flag and captured output
     * @throws IOException          if the process cannot be started
     * @throws InterruptedException if interrupted while waiting; the process is killed first
     */
    public static ExecResult execute(List<String> cmd, int timeoutSec, String label)
            throws IOException, InterruptedException {

        logger.info("[{}] Running worker: {}", label, cmd);

        ProcessBuilder pb = new ProcessBuilder(cmd);
        Process process = pb.start();

        // ---- Output capture ----
        StringBuilder out = new StringBuilder();
        StringBuilder err = new StringBuilder();
        Thread tOut = new Thread(() -> pump(process.getInputStream(), out, label, "stdout"), "worker-stdout-" + label);
        Thread tErr = new Thread(() -> pump(process.getErrorStream(), err, label, "stderr"), "worker-stderr-" + label);
        tOut.setDaemon(true);
        tErr.setDaemon(true);
        tOut.start();
        tErr.start();

        // ---- Wait for exit or timeout ----
        boolean timedOut = false;
        try {
            if (timeoutSec > 0) {
                if (!process.waitFor(timeoutSec, TimeUnit.SECONDS)) {
                    timedOut = true;
                    logger.warn("[{}] Worker still running after {} seconds, stopping it", label, timeoutSec);
                    stop(process);
                    synchronized (err) {
                        err.append("Worker stopped after timeout of ").append(timeoutSec).append(" seconds\n");
                    }
                }
            } else {
                process.waitFor();
            }
        } catch (InterruptedException e) {
            logger.warn("[{}] Interrupted while waiting for worker, killing it", label);
            process.destroyForcibly();
            throw e;
        }

        tOut.join();
        tErr.join();

        String stdout;
        String stderr;
        synchronized (out) {
            stdout = out.toString();
        }
        synchronized (err) {
            stderr = err.toString();
        }
        return new ExecResult(process.exitValue(), timedOut, stdout, stderr);
    }

    /**
     * Asks the process to terminate so its shutdown hook can cancel sampling, then kills it if needed.
     */
    private static void stop(Process process) throws InterruptedException {
        process.destroy();
        if (!process.waitFor(GRACE_PERIOD_SECONDS, TimeUnit.SECONDS)) {
            process.destroyForcibly();
            process.waitFor();
        }
    }

    private static void pump(InputStream stream, StringBuilder sink, String label, String name) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                synchronized (sink) {
                    sink.append(line).append('\n');
                }
                logger.debug("[{}] worker {}: {}", label, name, line);
            }
        } catch (IOException e) {
            logger.warn("[{}] Lost worker {} stream: {}", label, name, e.getMessage());
        }
    }
}
