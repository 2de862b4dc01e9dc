package loci.patchsynth.utilities;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RunLoggerTest {
    private static final Logger logger = LoggerFactory.getLogger(RunLoggerTest.class);

    @TempDir
    Path tmp;

    @AfterEach
    void tearDown() {
        RunLogger.disable();
    }

    @Test
    @DisplayName("Messages logged during a session land in the run log")
    void testSessionWritesLog() throws IOException {
        try (RunLogger.Session session = RunLogger.start(tmp)) {
            assertTrue(session.isActive());
            assertTrue(RunLogger.isEnabled());
            logger.info("composite batch 7 done");
        }

        assertFalse(RunLogger.isEnabled());
        String log = Files.readString(tmp.resolve(RunLogger.LOG_FILE_NAME));
        assertTrue(log.contains("composite batch 7 done"));
    }

    @Test
    @DisplayName("A missing directory leaves run logging off")
    void testInvalidDirectory() {
        try (RunLogger.Session session = RunLogger.start(tmp.resolve("missing"))) {
            assertFalse(session.isActive());
            assertFalse(RunLogger.isEnabled());
        }
    }
}
