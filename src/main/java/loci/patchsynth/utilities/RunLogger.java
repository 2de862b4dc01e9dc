package loci.patchsynth.utilities;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for writing a run-specific log next to the generated patches.
 *
 * <p>While enabled, everything logged by the coordinator is written both to the console and to
 * {@code <output-dir>/synthesis.log}. Worker output reaches the file through the coordinator,
 * which logs the captured output of failing workers.</p>
 *
 * <pre>{@code
 * try (RunLogger.Session session = RunLogger.start(config.getOutputDir())) {
 *     logger.info("Starting synthesis...");
 *     // ... workflow code ...
 * } // Automatically cleaned up
 * }</pre>
 */
public class RunLogger {
    private static final Logger logger = LoggerFactory.getLogger(RunLogger.class);

    public static final String LOG_FILE_NAME = "synthesis.log";
    private static final String APPENDER_NAME = "RUN_LOG";
    private static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

    private static FileAppender<ILoggingEvent> currentAppender;

    /**
     * Enables run logging into the given directory.
     *
     * @param outputDir existing directory that receives {@code synthesis.log}
     * @return true if successfully enabled, false otherwise
     */
    public static synchronized boolean enable(Path outputDir) {
        if (outputDir == null || !Files.isDirectory(outputDir)) {
            logger.warn("Cannot enable run logging: invalid directory: {}", outputDir);
            return false;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            logger.warn("Cannot enable run logging: logback is not the active SLF4J binding");
            return false;
        }
        if (currentAppender != null) {
            disable();
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(PATTERN);
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setFile(outputDir.resolve(LOG_FILE_NAME).toString());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();

        context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(appender);
        currentAppender = appender;

        logger.info("Run logging enabled: {}", outputDir.resolve(LOG_FILE_NAME));
        return true;
    }

    /**
     * Disables run logging. Safe to call when not enabled.
     */
    public static synchronized void disable() {
        if (currentAppender == null) {
            return;
        }
        logger.info("Run logging disabled: {}", currentAppender.getFile());
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).detachAppender(currentAppender);
        }
        currentAppender.stop();
        currentAppender = null;
    }

    public static synchronized boolean isEnabled() {
        return currentAppender != null;
    }

    /**
     * Starts a run logging session with automatic cleanup.
     *
     * @param outputDir The directory to save logs in
     * @return A Session object that will disable logging when closed
     */
    public static Session start(Path outputDir) {
        return new Session(outputDir);
    }

    /**
     * Auto-closeable session for run logging.
     */
    public static class Session implements AutoCloseable {
        private final boolean wasEnabled;

        private Session(Path outputDir) {
            this.wasEnabled = enable(outputDir);
        }

        public boolean isActive() {
            return wasEnabled;
        }

        @Override
        public void close() {
            if (wasEnabled) {
                disable();
            }
        }
    }
}
