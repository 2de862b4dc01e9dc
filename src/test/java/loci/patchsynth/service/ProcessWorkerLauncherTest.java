package loci.patchsynth.service;

import loci.patchsynth.model.WorkChunk;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ProcessWorkerLauncher and the underlying WorkerExecutor.
 */
class ProcessWorkerLauncherTest {

    private static final String JAVA = Paths.get(System.getProperty("java.home"), "bin", "java").toString();

    @Test
    @DisplayName("Pinned workers are prefixed with taskset -c <cpu>")
    void testPinnedCommand() {
        ProcessWorkerLauncher launcher = new ProcessWorkerLauncher("java", "cp", Path.of("/usr/bin/taskset"), 0);

        List<String> cmd = launcher.buildCommand(5, List.of("--seed", "1"));

        assertEquals(List.of("/usr/bin/taskset", "-c", "5", "java", "-cp", "cp",
                ProcessWorkerLauncher.WORKER_MAIN_CLASS, "--seed", "1"), cmd);
    }

    @Test
    @DisplayName("Without taskset the worker JVM is started directly")
    void testUnpinnedCommand() {
        ProcessWorkerLauncher launcher = new ProcessWorkerLauncher("java", "cp", null, 0);

        List<String> cmd = launcher.buildCommand(5, List.of());

        assertEquals(List.of("java", "-cp", "cp", ProcessWorkerLauncher.WORKER_MAIN_CLASS), cmd);
    }

    @Test
    @DisplayName("Exit code and output of a finished process are captured")
    void testExecuteCapturesOutput() throws Exception {
        WorkerExecutor.ExecResult result = WorkerExecutor.execute(List.of(JAVA, "-version"), 60, "test");

        assertEquals(0, result.exitCode());
        assertFalse(result.timedOut());
        assertFalse(result.stderr().isBlank(), "java -version prints to stderr");
    }

    @Test
    @DisplayName("A worker that fails to start its main class reports a nonzero exit")
    void testLaunchReportsFailure() throws Exception {
        ProcessWorkerLauncher launcher = new ProcessWorkerLauncher(JAVA, "does-not-exist", null, 60);

        WorkerResult result = launcher.launch(WorkChunk.ofCount(2, 1), 0, List.of());

        assertFalse(result.succeeded());
        assertEquals(2, result.slotIndex());
        assertNotEquals(0, result.exitCode());
        assertTrue(result.stderr().contains("StitchWorker"));
    }
}
