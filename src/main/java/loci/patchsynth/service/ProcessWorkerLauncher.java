package loci.patchsynth.service;

import loci.patchsynth.model.WorkChunk;
import loci.patchsynth.utilities.MinorFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Launches each chunk as a separate JVM running the worker entry point, pinned to its CPU with
 * {@code taskset -c <cpu>} where the platform supports it.
 */
public class ProcessWorkerLauncher implements WorkerLauncher {
    private static final Logger logger = LoggerFactory.getLogger(ProcessWorkerLauncher.class);

    public static final String WORKER_MAIN_CLASS = "loci.patchsynth.worker.StitchWorker";

    private final String javaExecutable;
    private final String classPath;
    private final Path taskset;
    private final int timeoutSec;

    /**
     * @param pinCpus    pin workers to their CPU when {@code taskset} is available
     * @param timeoutSec per-worker timeout in seconds, 0 for none
     */
    public ProcessWorkerLauncher(boolean pinCpus, int timeoutSec) {
        this(currentJavaExecutable(), System.getProperty("java.class.path"),
                pinCpus ? locateTaskset() : null, timeoutSec);
    }

    ProcessWorkerLauncher(String javaExecutable, String classPath, Path taskset, int timeoutSec) {
        this.javaExecutable = javaExecutable;
        this.classPath = classPath;
        this.taskset = taskset;
        this.timeoutSec = timeoutSec;
        if (taskset == null) {
            logger.info("Workers will not be pinned to CPUs");
        }
    }

    @Override
    public WorkerResult launch(WorkChunk chunk, int cpu, List<String> workerArgs)
            throws IOException, InterruptedException {
        List<String> cmd = buildCommand(cpu, workerArgs);
        WorkerExecutor.ExecResult result = WorkerExecutor.execute(cmd, timeoutSec, "cpu " + cpu);
        return new WorkerResult(chunk.getSlotIndex(), cpu, result.exitCode(), result.timedOut(),
                result.stdout(), result.stderr());
    }

    /**
     * @return {@code [taskset -c cpu] java -cp <classpath> <worker main> args...}
     */
    List<String> buildCommand(int cpu, List<String> workerArgs) {
        List<String> cmd = new ArrayList<>();
        if (taskset != null) {
            cmd.add(taskset.toString());
            cmd.add("-c");
            cmd.add(String.valueOf(cpu));
        }
        cmd.add(javaExecutable);
        cmd.add("-cp");
        cmd.add(classPath);
        cmd.add(WORKER_MAIN_CLASS);
        cmd.addAll(workerArgs);
        return cmd;
    }

    private static String currentJavaExecutable() {
        String exe = MinorFunctions.isWindows() ? "java.exe" : "java";
        return Paths.get(System.getProperty("java.home"), "bin", exe).toString();
    }

    private static Path locateTaskset() {
        if (!MinorFunctions.isLinux()) {
            logger.warn("CPU pinning requested but taskset is only available on Linux");
            return null;
        }
        Path taskset = MinorFunctions.findOnPath("taskset");
        if (taskset == null) {
            logger.warn("CPU pinning requested but taskset was not found on the PATH");
        }
        return taskset;
    }
}
